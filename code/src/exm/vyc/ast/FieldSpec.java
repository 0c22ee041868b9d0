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

import com.google.common.collect.ImmutableSet;

import exm.vyc.ast.NodeKind.Category;

/**
 * Declaration of one semantic field of a node kind: its name, whether it
 * holds a node, a list of nodes or a scalar, and what it may contain.
 */
public class FieldSpec {

  public static enum Shape {
    NODE, NODE_LIST, SCALAR
  }

  public final String name;
  public final Shape shape;
  public final boolean optional;
  /** Only set for scalar fields */
  public final ScalarType scalarType;

  /** Children are allowed if in one of these categories ... */
  private final ImmutableSet<Category> categories;
  /** ... or if they are one of these kinds */
  private final ImmutableSet<NodeKind> kinds;

  private FieldSpec(String name, Shape shape, boolean optional,
      ScalarType scalarType, ImmutableSet<Category> categories,
      ImmutableSet<NodeKind> kinds) {
    this.name = name;
    this.shape = shape;
    this.optional = optional;
    this.scalarType = scalarType;
    this.categories = categories;
    this.kinds = kinds;
  }

  public static FieldSpec node(String name, Category... allowed) {
    return new FieldSpec(name, Shape.NODE, false, null,
          ImmutableSet.copyOf(allowed), ImmutableSet.<NodeKind>of());
  }

  public static FieldSpec node(String name, NodeKind... allowed) {
    return new FieldSpec(name, Shape.NODE, false, null,
          ImmutableSet.<Category>of(), ImmutableSet.copyOf(allowed));
  }

  public static FieldSpec optionalNode(String name, Category... allowed) {
    return new FieldSpec(name, Shape.NODE, true, null,
          ImmutableSet.copyOf(allowed), ImmutableSet.<NodeKind>of());
  }

  public static FieldSpec optionalNode(String name, NodeKind... allowed) {
    return new FieldSpec(name, Shape.NODE, true, null,
          ImmutableSet.<Category>of(), ImmutableSet.copyOf(allowed));
  }

  /**
   * List fields are never missing: absent means empty
   */
  public static FieldSpec list(String name, Category... allowed) {
    return new FieldSpec(name, Shape.NODE_LIST, true, null,
          ImmutableSet.copyOf(allowed), ImmutableSet.<NodeKind>of());
  }

  public static FieldSpec list(String name, NodeKind... allowed) {
    return new FieldSpec(name, Shape.NODE_LIST, true, null,
          ImmutableSet.<Category>of(), ImmutableSet.copyOf(allowed));
  }

  public static FieldSpec scalar(String name, ScalarType type) {
    return new FieldSpec(name, Shape.SCALAR, false, type,
          ImmutableSet.<Category>of(), ImmutableSet.<NodeKind>of());
  }

  public static FieldSpec optionalScalar(String name, ScalarType type) {
    return new FieldSpec(name, Shape.SCALAR, true, type,
          ImmutableSet.<Category>of(), ImmutableSet.<NodeKind>of());
  }

  /**
   * @return true if a node of this kind may be stored in this field
   */
  public boolean allows(NodeKind kind) {
    if (shape == Shape.SCALAR || kind == NodeKind.MODULE) {
      // Modules are only ever roots
      return false;
    }
    if (categories.contains(kind.getCategory())) {
      return true;
    }
    for (NodeKind k: kinds) {
      if (kind.isA(k)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Description of allowed contents for error messages
   */
  public String describeAllowed() {
    if (shape == Shape.SCALAR) {
      return scalarType.toString().toLowerCase();
    }
    StringBuilder sb = new StringBuilder();
    for (Category c: categories) {
      if (sb.length() > 0) {
        sb.append(" or ");
      }
      sb.append(c.toString().toLowerCase().replace('_', '-'));
    }
    for (NodeKind k: kinds) {
      if (sb.length() > 0) {
        sb.append(" or ");
      }
      sb.append(k.getTag());
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return name + "(" + shape + (optional ? ", optional" : "") + ")";
  }
}
