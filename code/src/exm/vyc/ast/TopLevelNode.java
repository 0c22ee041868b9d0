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

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * A module or a definition: a container over its body statements.
 */
public class TopLevelNode extends Node implements Iterable<Node> {

  TopLevelNode(NodeKind kind, LinkedHashMap<String, Object> fields,
               SourceSpan span, int nodeId) {
    super(kind, fields, span, nodeId);
    assert(kind.isA(NodeKind.TOP_LEVEL));
  }

  public List<Node> getBody() {
    return getNodes("body");
  }

  public Node get(int i) {
    return getBody().get(i);
  }

  public int size() {
    return getBody().size();
  }

  /**
   * @return true if the body holds a node structurally equal to node
   */
  public boolean contains(Node node) {
    return getBody().contains(node);
  }

  @Override
  public Iterator<Node> iterator() {
    return getBody().iterator();
  }

  /**
   * @return name of definition, null for an unnamed module
   */
  public String getName() {
    return getString("name");
  }

  /**
   * @return documentation string supplied by the doc extractor, or null
   */
  public String getDocString() {
    Node doc = getNode("doc_string");
    return doc == null ? null : doc.getString("value");
  }
}
