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
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

import org.apache.commons.lang3.StringUtils;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

/**
 * Read-only queries over a tree.  Results are materialized, so the tree
 * can be edited while iterating over them.
 */
class TreeNavigator {

  /**
   * @param kinds empty to accept any kind
   * @param filters dotted field path to expected value or {@link Predicate}
   */
  static List<Node> getChildren(Node node, Set<NodeKind> kinds,
                      Map<String, ?> filters, boolean reverse) {
    List<Node> children = node.children();
    if (reverse) {
      children = Lists.reverse(children);
    }
    ImmutableList.Builder<Node> result = ImmutableList.builder();
    for (Node child: children) {
      if (matches(child, kinds, filters)) {
        result.add(child);
      }
    }
    return result.build();
  }

  /**
   * Depth-first pre-order walk.  With reverse set the result is in exactly
   * the opposite order.
   */
  static List<Node> getDescendants(Node node, Set<NodeKind> kinds,
        Map<String, ?> filters, boolean includeSelf, boolean reverse) {
    List<Node> result = new ArrayList<Node>();
    ArrayList<Node> stack = new ArrayList<Node>();
    stack.add(node);

    while (!stack.isEmpty()) {
      Node curr = stack.remove(stack.size() - 1);
      if ((curr != node || includeSelf) && matches(curr, kinds, filters)) {
        result.add(curr);
      }
      // Push in reverse so first child is visited first
      stack.addAll(Lists.reverse(curr.children()));
    }
    if (reverse) {
      result = Lists.reverse(result);
    }
    return ImmutableList.copyOf(result);
  }

  /**
   * @return nearest strict ancestor of one of kinds, or the parent if kinds
   *         is empty, or null
   */
  static Node getAncestor(Node node, Set<NodeKind> kinds) {
    for (Node curr = node.getParent(); curr != null;
         curr = curr.getParent()) {
      if (matchesKind(curr, kinds)) {
        return curr;
      }
    }
    return null;
  }

  /**
   * Follow a dotted path of field names
   * @return value at end of path, or null if any step is missing
   */
  static Object getPath(Node node, String path) {
    Object curr = node;
    for (String step: StringUtils.split(path, '.')) {
      if (!(curr instanceof Node)) {
        return null;
      }
      Node n = (Node)curr;
      if (NodeSchema.field(n.getKind(), step) == null) {
        return null;
      }
      curr = n.getField(step);
    }
    return curr;
  }

  private static boolean matches(Node node, Set<NodeKind> kinds,
                                 Map<String, ?> filters) {
    if (!matchesKind(node, kinds)) {
      return false;
    }
    for (Map.Entry<String, ?> filter: filters.entrySet()) {
      Object actual = getPath(node, filter.getKey());
      Object expected = filter.getValue();
      if (expected instanceof Predicate) {
        @SuppressWarnings("unchecked")
        Predicate<Object> pred = (Predicate<Object>)expected;
        if (!pred.test(actual)) {
          return false;
        }
      } else if (!NodeEquality.valueEqual(expected, actual)) {
        return false;
      }
    }
    return true;
  }

  private static boolean matchesKind(Node node, Set<NodeKind> kinds) {
    if (kinds.isEmpty()) {
      return true;
    }
    for (NodeKind kind: kinds) {
      if (node.getKind().isA(kind)) {
        return true;
      }
    }
    return false;
  }
}
