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

import java.util.List;

import org.apache.log4j.Logger;

import exm.vyc.common.Logging;
import exm.vyc.common.exceptions.NodeNotFoundError;
import exm.vyc.common.exceptions.NotInTreeError;
import exm.vyc.common.exceptions.VYCRuntimeError;

/**
 * In-place structural edits.  All lookups are by identity: a structurally
 * equal node elsewhere in the tree is never touched.
 */
class TreeEditor {

  private static final Logger logger = Logging.getVYCLogger();

  /**
   * Replace oldNode with newNode in the slot oldNode occupies.
   * Locating the slot walks up from oldNode, so the cost is proportional
   * to its depth, not to the size of the tree.
   *
   * Afterwards oldNode is detached and its annotations are gone.
   * @throws NotInTreeError if oldNode is not inside root
   */
  static void replaceInTree(ModuleNode root, Node oldNode, Node newNode) {
    if (oldNode == root) {
      throw new VYCRuntimeError("Cannot replace the root of a tree");
    }
    checkDetached(newNode, root);
    if (oldNode.getRoot() != root) {
      throw new NotInTreeError(oldNode.describe() + " is not part of this "
                               + "tree");
    }

    Node parent = oldNode.getParent();
    FieldSpec slot = parent.fieldOf(oldNode);
    if (slot == null) {
      throw new VYCRuntimeError("Parent link of " + oldNode.describe() +
                                " is inconsistent");
    }
    if (!slot.allows(newNode.getKind())) {
      throw new VYCRuntimeError("A " + newNode.getDescription() +
            " is not allowed in field '" + slot.name + "' of " +
            parent.getKind().getTag());
    }

    parent.replaceChild(oldNode, newNode);
    newNode.setParent(parent);
    oldNode.setParent(null);
    oldNode.clearAnnotations();
    parent.invalidateEvaluation();

    if (logger.isTraceEnabled()) {
      logger.trace("replaced " + oldNode.describe() + " with " + newNode +
                   " in " + parent.getKind().getTag() + "." + slot.name);
    }
  }

  static void addToBody(TopLevelNode container, Node node) {
    checkDetached(node, container.getRoot());
    FieldSpec body = NodeSchema.field(container.getKind(), "body");
    if (!body.allows(node.getKind())) {
      throw new VYCRuntimeError("A " + node.getDescription() +
          " is not allowed in the body of a " + container.getDescription());
    }
    container.mutableList("body").add(node);
    node.setParent(container);
    container.invalidateEvaluation();
    logger.trace("added " + node + " to body of " + container);
  }

  static void removeFromBody(TopLevelNode container, Node node) {
    List<Node> body = container.mutableList("body");
    for (int i = 0; i < body.size(); i++) {
      if (body.get(i) == node) {
        body.remove(i);
        node.setParent(null);
        container.invalidateEvaluation();
        logger.trace("removed " + node + " from body of " + container);
        return;
      }
    }
    throw new NodeNotFoundError(node.describe() + " is not in the body of "
                                + container.describe());
  }

  private static void checkDetached(Node node, Node root) {
    if (node.getParent() != null || node == root) {
      throw new VYCRuntimeError(node.describe() + " is already part of a "
          + "tree: remove or copy it first");
    }
  }
}
