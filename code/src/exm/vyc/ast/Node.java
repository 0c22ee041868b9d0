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

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Sets;

import exm.vyc.ast.FieldSpec.Shape;
import exm.vyc.common.exceptions.NodeNotFoundError;
import exm.vyc.common.exceptions.UnsupportedSyntaxException;
import exm.vyc.common.exceptions.VYCRuntimeError;

/**
 * A node of the typed syntax tree.
 *
 * Every node has a kind and the semantic fields its kind declares in
 * {@link NodeSchema}.  In addition it carries metadata that never takes
 * part in equality or serialization of fields: a link to its parent, the
 * source span, a node id and a table of annotations that later passes
 * attach.
 *
 * The tree owns its children exclusively: a node is stored in exactly one
 * field of exactly one parent.  Structure only changes through
 * {@link TreeEditor}, which keeps parent links consistent.
 *
 * Equality and hashing are structural (see {@link NodeEquality}), so the
 * hash of a node changes when its subtree is edited.
 */
public class Node {

  /** Node id of nodes that were not produced by the tree builder */
  public static final int NO_ID = -1;

  private final NodeKind kind;

  /**
   * Field values in declaration order.  Values are Nodes, ArrayLists of
   * Nodes, scalars of the field's storage class or null.
   */
  private final LinkedHashMap<String, Object> fields;

  private final SourceSpan span;
  private final int nodeId;

  private Node parent = null;

  /** Created on first use */
  private Map<String, Object> annotations = null;

  /** Memoized result of constant folding, null if not computed */
  private FoldResult cachedEvaluation = null;

  Node(NodeKind kind, LinkedHashMap<String, Object> fields,
       SourceSpan span, int nodeId) {
    this.kind = kind;
    this.fields = fields;
    this.span = span;
    this.nodeId = nodeId;
    adoptChildren();
  }

  /**
   * Pick the right class for the kind.  Field values must already
   * be validated.
   */
  static Node instantiate(NodeKind kind, LinkedHashMap<String, Object> fields,
                          SourceSpan span, int nodeId) {
    if (kind == NodeKind.MODULE) {
      return new ModuleNode(fields, span, nodeId);
    } else if (kind.isA(NodeKind.TOP_LEVEL)) {
      return new TopLevelNode(kind, fields, span, nodeId);
    } else {
      return new Node(kind, fields, span, nodeId);
    }
  }

  private void adoptChildren() {
    for (Node child: children()) {
      if (child.parent != null) {
        throw new VYCRuntimeError("Cannot attach " + child.describe() +
              " to " + describe() + ": already attached to " +
              child.parent.describe());
      }
      child.parent = this;
    }
  }

  /**
   * Create a synthesized node without source position.
   * @param values field values by name.  Absent list fields become empty.
   *      Node values must not be attached to another node.
   * @throws UnsupportedSyntaxException if values don't fit the kind
   */
  public static Node create(NodeKind kind, Map<String, ?> values)
      throws UnsupportedSyntaxException {
    return create(kind, values, null);
  }

  public static Node create(NodeKind kind, Map<String, ?> values,
        SourceSpan span) throws UnsupportedSyntaxException {
    return construct(kind, values, span, NO_ID);
  }

  /**
   * Retype a node: make a new detached node of a different kind, copying
   * span, node id and every field the target kind also declares with the
   * same shape.  Copied children are deep copies.  Fields the target
   * doesn't declare are dropped.
   * @param overrides values that replace or add to the copied fields
   * @throws UnsupportedSyntaxException if a required field of the target
   *       is left without a value
   */
  public static Node fromNode(NodeKind kind, Node source,
      Map<String, ?> overrides) throws UnsupportedSyntaxException {
    Map<String, Object> values = new HashMap<String, Object>();
    if (!kind.isAbstract()) {
      for (FieldSpec target: NodeSchema.fields(kind)) {
        if (overrides.containsKey(target.name)) {
          continue;
        }
        FieldSpec src = NodeSchema.field(source.kind, target.name);
        if (src != null && src.shape == target.shape) {
          values.put(target.name, copyValue(source.fields.get(src.name)));
        }
      }
    }
    values.putAll(overrides);
    return construct(kind, values, source.span, source.nodeId);
  }

  /**
   * Check field values against the kind's declaration, coercing scalars,
   * and build the node.
   */
  static Node construct(NodeKind kind, Map<String, ?> values,
      SourceSpan span, int nodeId) throws UnsupportedSyntaxException {
    if (kind.isAbstract()) {
      throw new UnsupportedSyntaxException(span, "Cannot create node of "
            + "abstract kind " + kind.getTag());
    }
    for (String key: values.keySet()) {
      if (NodeSchema.field(kind, key) == null) {
        throw new UnsupportedSyntaxException(span, kind.getTag() +
              " has no field '" + key + "'");
      }
    }

    LinkedHashMap<String, Object> checked =
                              new LinkedHashMap<String, Object>();
    Set<Node> seen = Sets.newIdentityHashSet();
    for (FieldSpec f: NodeSchema.fields(kind)) {
      Object value = values.get(f.name);
      checked.put(f.name, checkValue(kind, f, value, span, seen));
    }
    return instantiate(kind, checked, span, nodeId);
  }

  private static Object checkValue(NodeKind kind, FieldSpec f, Object value,
      SourceSpan span, Set<Node> seen) throws UnsupportedSyntaxException {
    switch (f.shape) {
      case NODE:
        if (value == null) {
          if (!f.optional) {
            throw missingField(kind, f, span);
          }
          return null;
        }
        return checkChild(kind, f, value, span, seen);
      case NODE_LIST: {
        ArrayList<Node> result = new ArrayList<Node>();
        if (value == null) {
          return result;
        }
        if (!(value instanceof List)) {
          throw new UnsupportedSyntaxException(span, "Field '" + f.name +
                "' of " + kind.getTag() + " must be a list");
        }
        for (Object elem: (List<?>)value) {
          result.add(checkChild(kind, f, elem, span, seen));
        }
        return result;
      }
      case SCALAR: {
        if (value == null) {
          if (!f.optional) {
            throw missingField(kind, f, span);
          }
          return null;
        }
        Object coerced = f.scalarType.coerce(value);
        if (coerced == null) {
          throw new UnsupportedSyntaxException(span, "Invalid value for "
              + "field '" + f.name + "' of " + kind.getTag() + ": expected "
              + f.describeAllowed() + " but got " + describeValue(value));
        }
        return coerced;
      }
      default:
        throw new VYCRuntimeError("Unknown shape " + f.shape);
    }
  }

  private static Node checkChild(NodeKind kind, FieldSpec f, Object value,
      SourceSpan span, Set<Node> seen) throws UnsupportedSyntaxException {
    if (!(value instanceof Node)) {
      throw new UnsupportedSyntaxException(span, "Field '" + f.name +
            "' of " + kind.getTag() + " must hold " + f.describeAllowed() +
            " nodes, but got " + describeValue(value));
    }
    Node child = (Node)value;
    if (!f.allows(child.kind)) {
      throw new UnsupportedSyntaxException(child.span, "A " +
            child.kind.getDescription() + " is not allowed in field '" +
            f.name + "' of " + kind.getTag() + ", expected " +
            f.describeAllowed());
    }
    if (child.parent != null || !seen.add(child)) {
      throw new VYCRuntimeError(child.describe() + " is already part of a "
          + "tree: copy it before reusing it");
    }
    return child;
  }

  private static UnsupportedSyntaxException missingField(NodeKind kind,
      FieldSpec f, SourceSpan span) {
    return new UnsupportedSyntaxException(span, kind.getTag() +
        " is missing required field '" + f.name + "'");
  }

  private static String describeValue(Object value) {
    if (value instanceof Node) {
      return ((Node)value).kind.getDescription();
    } else if (value instanceof byte[]) {
      return "bytes";
    }
    return value.getClass().getSimpleName() + " " + value;
  }

  /**
   * @return deep copy of the subtree rooted here, detached from any parent.
   *    Spans and ids are kept, annotations and cached results are not.
   */
  public Node copy() {
    LinkedHashMap<String, Object> copied =
                          new LinkedHashMap<String, Object>();
    for (Map.Entry<String, Object> e: fields.entrySet()) {
      copied.put(e.getKey(), copyValue(e.getValue()));
    }
    return instantiate(kind, copied, span, nodeId);
  }

  private static Object copyValue(Object value) {
    if (value instanceof Node) {
      return ((Node)value).copy();
    } else if (value instanceof List) {
      ArrayList<Node> copy = new ArrayList<Node>();
      for (Object elem: (List<?>)value) {
        copy.add(((Node)elem).copy());
      }
      return copy;
    } else if (value instanceof byte[]) {
      return ((byte[])value).clone();
    }
    // Other scalars are immutable
    return value;
  }

  public NodeKind getKind() {
    return kind;
  }

  /**
   * @return true if this node's kind is, or is a subkind of, any of kinds
   */
  public boolean isA(NodeKind... kinds) {
    for (NodeKind k: kinds) {
      if (kind.isA(k)) {
        return true;
      }
    }
    return false;
  }

  public String getDescription() {
    return kind.getDescription();
  }

  /**
   * @return source position, null for synthesized nodes
   */
  public SourceSpan getSpan() {
    return span;
  }

  public int getNodeId() {
    return nodeId;
  }

  /**
   * @return parent, null for the root or a detached node
   */
  public Node getParent() {
    return parent;
  }

  void setParent(Node parent) {
    this.parent = parent;
  }

  public List<String> getFieldNames() {
    return NodeSchema.fieldNames(kind);
  }

  private FieldSpec checkedField(String name) {
    FieldSpec f = NodeSchema.field(kind, name);
    if (f == null) {
      throw new VYCRuntimeError(kind.getTag() + " has no field '" + name
                                + "'");
    }
    return f;
  }

  /**
   * @return value of field: a Node, an unmodifiable list of Nodes,
   *         a scalar, or null
   */
  public Object getField(String name) {
    FieldSpec f = checkedField(name);
    return exposeValue(fields.get(f.name));
  }

  @SuppressWarnings("unchecked")
  private static Object exposeValue(Object value) {
    if (value instanceof List) {
      return Collections.unmodifiableList((List<Node>)value);
    } else if (value instanceof byte[]) {
      return ((byte[])value).clone();
    }
    return value;
  }

  public Node getNode(String name) {
    FieldSpec f = checkedField(name);
    if (f.shape != Shape.NODE) {
      throw new VYCRuntimeError("Field '" + name + "' of " + kind.getTag()
                                + " does not hold a single node");
    }
    return (Node)fields.get(name);
  }

  @SuppressWarnings("unchecked")
  public List<Node> getNodes(String name) {
    FieldSpec f = checkedField(name);
    if (f.shape != Shape.NODE_LIST) {
      throw new VYCRuntimeError("Field '" + name + "' of " + kind.getTag()
                                + " does not hold a list of nodes");
    }
    return Collections.unmodifiableList((List<Node>)fields.get(name));
  }

  public Object getScalar(String name) {
    FieldSpec f = checkedField(name);
    if (f.shape != Shape.SCALAR) {
      throw new VYCRuntimeError("Field '" + name + "' of " + kind.getTag()
                                + " is not a scalar");
    }
    return exposeValue(fields.get(name));
  }

  public String getString(String name) {
    return (String)getScalar(name);
  }

  /**
   * @return the value of a literal node
   */
  public Object getValue() {
    if (!kind.isLiteral()) {
      throw new VYCRuntimeError(kind.getDescription() + " is not a literal");
    }
    return getScalar("value");
  }

  /**
   * Raw access for the equality engine and editor: no copying
   */
  Object rawField(String name) {
    return fields.get(name);
  }

  /**
   * @return immediate children in declared field order, lists flattened
   */
  public List<Node> children() {
    ArrayList<Node> result = new ArrayList<Node>();
    for (Object value: fields.values()) {
      if (value instanceof Node) {
        result.add((Node)value);
      } else if (value instanceof List) {
        for (Object elem: (List<?>)value) {
          result.add((Node)elem);
        }
      }
    }
    return result;
  }

  /**
   * Replace a child by identity in whichever field holds it.
   * @return the field that held it, or null if old is not a child
   */
  @SuppressWarnings("unchecked")
  FieldSpec replaceChild(Node oldChild, Node newChild) {
    for (FieldSpec f: NodeSchema.fields(kind)) {
      Object value = fields.get(f.name);
      if (value == oldChild) {
        fields.put(f.name, newChild);
        return f;
      } else if (value instanceof List) {
        List<Node> list = (List<Node>)value;
        for (int i = 0; i < list.size(); i++) {
          if (list.get(i) == oldChild) {
            list.set(i, newChild);
            return f;
          }
        }
      }
    }
    return null;
  }

  /**
   * @return the field holding child, by identity, or null
   */
  FieldSpec fieldOf(Node child) {
    for (FieldSpec f: NodeSchema.fields(kind)) {
      Object value = fields.get(f.name);
      if (value == child) {
        return f;
      } else if (value instanceof List) {
        for (Object elem: (List<?>)value) {
          if (elem == child) {
            return f;
          }
        }
      }
    }
    return null;
  }

  @SuppressWarnings("unchecked")
  List<Node> mutableList(String name) {
    return (List<Node>)fields.get(name);
  }

  /* Navigation */

  public List<Node> getChildren(NodeKind... kinds) {
    return TreeNavigator.getChildren(this, kindSet(kinds),
                        ImmutableMap.<String, Object>of(), false);
  }

  public List<Node> getChildren(Set<NodeKind> kinds, Map<String, ?> filters,
                                boolean reverse) {
    return TreeNavigator.getChildren(this, kinds, filters, reverse);
  }

  public List<Node> getDescendants(NodeKind... kinds) {
    return TreeNavigator.getDescendants(this, kindSet(kinds),
                        ImmutableMap.<String, Object>of(), false, false);
  }

  public List<Node> getDescendants(Set<NodeKind> kinds,
        Map<String, ?> filters, boolean includeSelf, boolean reverse) {
    return TreeNavigator.getDescendants(this, kinds, filters, includeSelf,
                                        reverse);
  }

  /**
   * @return nearest ancestor of one of the kinds (the parent if no kinds
   *         given), or null if there is none
   */
  public Node getAncestor(NodeKind... kinds) {
    return TreeNavigator.getAncestor(this, kindSet(kinds));
  }

  public Node checkedGetAncestor(NodeKind... kinds) {
    Node result = getAncestor(kinds);
    if (result == null) {
      throw new NodeNotFoundError("No ancestor of " + describe() +
          (kinds.length == 0 ? "" : " matching " + Arrays.toString(kinds)));
    }
    return result;
  }

  /**
   * Follow a dotted path of field names, e.g. "target.id"
   * @return value at end of path, or null if any step is missing
   */
  public Object get(String path) {
    return TreeNavigator.getPath(this, path);
  }

  public Node getRoot() {
    Node curr = this;
    while (curr.parent != null) {
      curr = curr.parent;
    }
    return curr;
  }

  /**
   * @return number of ancestors: 0 for a root
   */
  public int getDepth() {
    int depth = 0;
    for (Node curr = parent; curr != null; curr = curr.parent) {
      depth++;
    }
    return depth;
  }

  private static Set<NodeKind> kindSet(NodeKind[] kinds) {
    if (kinds.length == 0) {
      return Collections.emptySet();
    }
    return Sets.immutableEnumSet(Arrays.asList(kinds));
  }

  /* Folding */

  /**
   * Try to reduce this node to a literal.  Never changes the tree.
   */
  public FoldResult evaluate() {
    return ConstantFolder.fromSettings().evaluate(this);
  }

  FoldResult getCachedEvaluation() {
    return cachedEvaluation;
  }

  void setCachedEvaluation(FoldResult result) {
    this.cachedEvaluation = result;
  }

  /**
   * Drop memoized fold results of this node and everything above it,
   * since their values may depend on this subtree.
   */
  void invalidateEvaluation() {
    for (Node curr = this; curr != null; curr = curr.parent) {
      curr.cachedEvaluation = null;
    }
  }

  /* Annotations */

  public Object getAnnotation(String key) {
    return annotations == null ? null : annotations.get(key);
  }

  public boolean hasAnnotation(String key) {
    return annotations != null && annotations.containsKey(key);
  }

  public void setAnnotation(String key, Object value) {
    if (annotations == null) {
      annotations = new HashMap<String, Object>();
    }
    annotations.put(key, value);
  }

  public Map<String, Object> getAnnotations() {
    if (annotations == null) {
      return Collections.emptyMap();
    }
    return Collections.unmodifiableMap(annotations);
  }

  void clearAnnotations() {
    annotations = null;
  }

  /* Output */

  public Map<String, Object> toDict() {
    return AstSerializer.toDict(this);
  }

  public String printTree() {
    StringWriter sw = new StringWriter();
    PrintWriter writer = new PrintWriter(sw);
    printTree(writer, 0);
    writer.flush();
    return sw.toString();
  }

  private void printTree(PrintWriter writer, int indent) {
    indent(writer, indent);
    writer.println(toString());
    for (Map.Entry<String, Object> e: fields.entrySet()) {
      Object value = e.getValue();
      if (value instanceof Node) {
        indent(writer, indent + 2);
        writer.println(e.getKey() + ":");
        ((Node)value).printTree(writer, indent + 4);
      } else if (value instanceof List && !((List<?>)value).isEmpty()) {
        indent(writer, indent + 2);
        writer.println(e.getKey() + ":");
        for (Object elem: (List<?>)value) {
          ((Node)elem).printTree(writer, indent + 4);
        }
      }
    }
  }

  public static void indent(PrintWriter writer, int indent)
  {
    for (int i = 0; i < indent; i++)
      writer.print(' ');
  }

  /**
   * Short description with location for error messages
   */
  public String describe() {
    return kind.getDescription() + (span == null ? "" : " at " + span);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Node)) {
      return false;
    }
    return NodeEquality.equal(this, (Node)obj);
  }

  @Override
  public int hashCode() {
    return NodeEquality.hash(this);
  }

  /**
   * Kind tag followed by scalar fields, e.g. Name(id=x)
   */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(kind.getTag());
    boolean first = true;
    for (Map.Entry<String, Object> e: fields.entrySet()) {
      Object value = e.getValue();
      if (value == null || value instanceof Node || value instanceof List) {
        continue;
      }
      sb.append(first ? "(" : ", ");
      first = false;
      sb.append(e.getKey()).append('=');
      if (value instanceof byte[]) {
        sb.append(ScalarType.hexString((byte[])value));
      } else {
        sb.append(value);
      }
    }
    if (!first) {
      sb.append(')');
    }
    return sb.toString();
  }
}
