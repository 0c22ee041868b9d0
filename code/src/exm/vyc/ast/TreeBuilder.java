/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.vyc.ast;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;

import exm.vyc.common.Settings;
import exm.vyc.common.exceptions.InvalidOptionException;
import exm.vyc.common.exceptions.UnsupportedSyntaxException;
import exm.vyc.common.exceptions.VYCRuntimeError;
import exm.vyc.frontend.LogHelper;

/**
 * Builds typed nodes from the generic parse tree.  Each builder hands out
 * node ids in pre-order, so use one builder per compilation unit.
 */
public class TreeBuilder {

  private final Logger logger;

  /** If true, every parsed node must carry a source span */
  private final boolean requireSpans;

  private int nextNodeId = 0;

  public TreeBuilder(Logger logger, boolean requireSpans) {
    this.logger = logger;
    this.requireSpans = requireSpans;
  }

  public static TreeBuilder fromSettings(Logger logger)
      throws InvalidOptionException {
    return new TreeBuilder(logger, Settings.getBoolean(Settings.REQUIRE_SPANS));
  }

  /**
   * Build the tree for a whole compilation unit
   */
  public ModuleNode buildModule(ParseTree tree)
      throws UnsupportedSyntaxException {
    if (!NodeKind.MODULE.getTag().equals(tree.getTag())) {
      throw new UnsupportedSyntaxException(tree.getSpan(), "Expected a "
          + NodeKind.MODULE.getTag() + " at the root of the tree, but got "
          + tree.getTag());
    }
    return (ModuleNode)build(tree, null);
  }

  /**
   * Build a node and its subtree.
   * @param parent if not null, the new node is appended to its body
   * @throws UnsupportedSyntaxException if the tree has an unknown tag or a
   *      field that doesn't fit its kind
   */
  public Node build(ParseTree tree, TopLevelNode parent)
      throws UnsupportedSyntaxException {
    if (parent != null) {
      NodeKind kind = lookupKind(tree);
      FieldSpec body = NodeSchema.field(parent.getKind(), "body");
      if (!body.allows(kind)) {
        throw new UnsupportedSyntaxException(tree.getSpan(), "A " +
            kind.getDescription() + " is not allowed in the body of a " +
            parent.getDescription());
      }
    }

    Node node = buildNode(tree, 0);
    if (parent != null) {
      TreeEditor.addToBody(parent, node);
    }
    return node;
  }

  private NodeKind lookupKind(ParseTree tree)
      throws UnsupportedSyntaxException {
    NodeKind kind = NodeKind.fromTag(tree.getTag());
    if (kind == null || kind.isAbstract()) {
      throw new UnsupportedSyntaxException(tree.getSpan(),
          "Unsupported syntax: no node type " + tree.getTag());
    }
    return kind;
  }

  private Node buildNode(ParseTree tree, int indent)
      throws UnsupportedSyntaxException {
    NodeKind kind = lookupKind(tree);
    SourceSpan span = tree.getSpan();
    if (span == null && requireSpans) {
      throw new UnsupportedSyntaxException("Parsed " + tree.getTag() +
                                           " has no source location");
    }
    int nodeId = nextNodeId++;
    LogHelper.log(logger, indent, Level.TRACE, span, "build " +
                  kind.getTag() + " #" + nodeId);

    for (String key: tree.getFieldNames()) {
      if (NodeSchema.field(kind, key) == null) {
        LogHelper.log(logger, indent + 2, Level.TRACE, span,
                      "ignoring field " + key);
      }
    }

    Map<String, Object> values = new HashMap<String, Object>();
    for (FieldSpec f: NodeSchema.fields(kind)) {
      if (!tree.hasField(f.name)) {
        continue;
      }
      values.put(f.name, buildValue(kind, f, tree.getField(f.name), span,
                                    indent + 2));
    }
    return Node.construct(kind, values, span, nodeId);
  }

  private Object buildValue(NodeKind kind, FieldSpec f, Object raw,
      SourceSpan span, int indent) throws UnsupportedSyntaxException {
    if (raw == null) {
      return null;
    }
    switch (f.shape) {
      case NODE:
        return buildChild(kind, f, raw, span, indent);
      case NODE_LIST: {
        if (!(raw instanceof List)) {
          throw new UnsupportedSyntaxException(span, "Field '" + f.name +
              "' of " + kind.getTag() + " must be a list");
        }
        List<Node> result = new ArrayList<Node>();
        for (Object elem: (List<?>)raw) {
          result.add(buildChild(kind, f, elem, span, indent));
        }
        return result;
      }
      case SCALAR:
        // Coerced when the node is constructed
        return raw;
      default:
        throw new VYCRuntimeError("Unknown shape " + f.shape);
    }
  }

  private Node buildChild(NodeKind kind, FieldSpec f, Object raw,
      SourceSpan span, int indent) throws UnsupportedSyntaxException {
    if (!(raw instanceof ParseTree)) {
      throw new UnsupportedSyntaxException(span, "Field '" + f.name +
          "' of " + kind.getTag() + " must hold a node, but got " + raw);
    }
    return buildNode((ParseTree)raw, indent);
  }
}
