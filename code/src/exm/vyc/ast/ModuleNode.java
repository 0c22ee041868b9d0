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

import java.util.LinkedHashMap;

/**
 * Root of a tree.  Structural edits of the tree go through here.
 */
public class ModuleNode extends TopLevelNode {

  ModuleNode(LinkedHashMap<String, Object> fields, SourceSpan span,
             int nodeId) {
    super(NodeKind.MODULE, fields, span, nodeId);
  }

  /**
   * Put newNode in the exact slot oldNode occupies in this tree.
   * @see TreeEditor#replaceInTree(ModuleNode, Node, Node)
   */
  public void replaceInTree(Node oldNode, Node newNode) {
    TreeEditor.replaceInTree(this, oldNode, newNode);
  }

  public void addToBody(Node node) {
    TreeEditor.addToBody(this, node);
  }

  public void removeFromBody(Node node) {
    TreeEditor.removeFromBody(this, node);
  }
}
