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

import static exm.vyc.ast.FieldSpec.list;
import static exm.vyc.ast.FieldSpec.node;
import static exm.vyc.ast.FieldSpec.optionalNode;
import static exm.vyc.ast.FieldSpec.optionalScalar;
import static exm.vyc.ast.FieldSpec.scalar;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;

import exm.vyc.ast.NodeKind.Category;
import exm.vyc.common.exceptions.VYCRuntimeError;

/**
 * Field tables for every concrete node kind.  Field order here is the
 * order used for child traversal, equality and serialization, and is
 * part of the external serialization format.
 */
public class NodeSchema {

  private static final Category EXPR = Category.EXPRESSION;
  private static final Category STMT = Category.STATEMENT;

  private static final Map<NodeKind, ImmutableList<FieldSpec>> schema =
      new EnumMap<NodeKind, ImmutableList<FieldSpec>>(NodeKind.class);

  static {
    // Top level: documentation string comes from the external extractor
    define(NodeKind.MODULE,
        optionalNode("doc_string", NodeKind.STR),
        list("body", Category.TOP_LEVEL, STMT),
        optionalScalar("name", ScalarType.STRING));
    define(NodeKind.FUNCTION_DEF,
        optionalNode("doc_string", NodeKind.STR),
        scalar("name", ScalarType.STRING),
        node("args", NodeKind.ARGUMENTS),
        list("body", STMT),
        list("decorator_list", EXPR),
        optionalNode("returns", EXPR));
    define(NodeKind.INTERFACE_DEF,
        optionalNode("doc_string", NodeKind.STR),
        scalar("name", ScalarType.STRING),
        list("body", NodeKind.FUNCTION_DEF));
    define(NodeKind.STRUCT_DEF,
        optionalNode("doc_string", NodeKind.STR),
        scalar("name", ScalarType.STRING),
        list("body", STMT));
    define(NodeKind.ENUM_DEF,
        optionalNode("doc_string", NodeKind.STR),
        scalar("name", ScalarType.STRING),
        list("body", STMT));
    define(NodeKind.EVENT_DEF,
        optionalNode("doc_string", NodeKind.STR),
        scalar("name", ScalarType.STRING),
        list("body", STMT));

    define(NodeKind.ARGUMENTS,
        list("args", NodeKind.ARG),
        list("defaults", EXPR));
    define(NodeKind.ARG,
        scalar("arg", ScalarType.STRING),
        optionalNode("annotation", EXPR));
    define(NodeKind.KEYWORD,
        scalar("arg", ScalarType.STRING),
        node("value", EXPR));
    define(NodeKind.INDEX,
        node("value", EXPR));

    define(NodeKind.ASSIGN,
        node("target", EXPR),
        node("value", EXPR));
    define(NodeKind.AUG_ASSIGN,
        node("target", EXPR),
        node("op", NodeKind.BINARY_OPERATOR),
        node("value", EXPR));
    define(NodeKind.ANN_ASSIGN,
        node("target", EXPR),
        node("annotation", EXPR),
        optionalNode("value", EXPR));
    define(NodeKind.IF,
        node("test", EXPR),
        list("body", STMT),
        list("orelse", STMT));
    define(NodeKind.FOR,
        node("target", EXPR),
        node("iter", EXPR),
        list("body", STMT));
    define(NodeKind.RETURN,
        optionalNode("value", EXPR));
    define(NodeKind.RAISE,
        optionalNode("exc", EXPR));
    define(NodeKind.ASSERT,
        node("test", EXPR),
        optionalNode("msg", EXPR));
    define(NodeKind.PASS);
    define(NodeKind.BREAK);
    define(NodeKind.CONTINUE);
    define(NodeKind.IMPORT,
        scalar("name", ScalarType.STRING),
        optionalScalar("alias", ScalarType.STRING));
    define(NodeKind.IMPORT_FROM,
        optionalScalar("module", ScalarType.STRING),
        scalar("name", ScalarType.STRING),
        optionalScalar("alias", ScalarType.STRING),
        scalar("level", ScalarType.INTEGER));
    define(NodeKind.LOG,
        node("value", EXPR));
    define(NodeKind.EXPR,
        node("value", EXPR));

    define(NodeKind.NAME,
        scalar("id", ScalarType.STRING));
    define(NodeKind.CALL,
        node("func", EXPR),
        list("args", EXPR),
        list("keywords", NodeKind.KEYWORD));
    define(NodeKind.ATTRIBUTE,
        node("value", EXPR),
        scalar("attr", ScalarType.STRING));
    define(NodeKind.SUBSCRIPT,
        node("value", EXPR),
        node("slice", NodeKind.INDEX));
    define(NodeKind.LIST,
        list("elements", EXPR));
    define(NodeKind.TUPLE,
        list("elements", EXPR));
    define(NodeKind.DICT,
        list("keys", EXPR),
        list("values", EXPR));
    define(NodeKind.UNARY_OP,
        node("op", NodeKind.UNARY_OPERATOR),
        node("operand", EXPR));
    define(NodeKind.BIN_OP,
        node("left", EXPR),
        node("op", NodeKind.BINARY_OPERATOR),
        node("right", EXPR));
    define(NodeKind.BOOL_OP,
        node("op", NodeKind.BOOLEAN_OPERATOR),
        list("values", EXPR));
    define(NodeKind.COMPARE,
        node("left", EXPR),
        node("op", NodeKind.COMPARISON_OPERATOR),
        node("right", EXPR));

    define(NodeKind.INT, scalar("value", ScalarType.INTEGER));
    define(NodeKind.DECIMAL, scalar("value", ScalarType.DECIMAL));
    define(NodeKind.HEX, scalar("value", ScalarType.STRING));
    define(NodeKind.STR, scalar("value", ScalarType.STRING));
    define(NodeKind.BYTES, scalar("value", ScalarType.BYTES));
    define(NodeKind.NAME_CONSTANT, scalar("value", ScalarType.BOOLEAN));

    // Operators carry no fields
    for (NodeKind kind: NodeKind.values()) {
      if (kind.isOperator() && !kind.isAbstract()) {
        define(kind);
      }
    }

    checkComplete();
  }

  private static void define(NodeKind kind, FieldSpec... fields) {
    assert(!kind.isAbstract()) : kind;
    for (FieldSpec f: fields) {
      if (AstSerializer.RESERVED_KEYS.contains(f.name) ||
          AstSerializer.SKIP_LIST.contains(f.name)) {
        throw new VYCRuntimeError("Field name " + f.name + " of " +
                                   kind.getTag() + " is reserved");
      }
    }
    schema.put(kind, ImmutableList.copyOf(fields));
  }

  private static void checkComplete() {
    for (NodeKind kind: NodeKind.values()) {
      if (!kind.isAbstract() && !schema.containsKey(kind)) {
        throw new VYCRuntimeError("No field table for " + kind.getTag());
      }
    }
  }

  /**
   * @return declared fields in order
   * @throws VYCRuntimeError for abstract kinds
   */
  public static List<FieldSpec> fields(NodeKind kind) {
    ImmutableList<FieldSpec> fields = schema.get(kind);
    if (fields == null) {
      throw new VYCRuntimeError("Abstract kind " + kind.getTag() +
                                " has no fields");
    }
    return fields;
  }

  /**
   * @return the named field, or null if the kind does not declare it
   */
  public static FieldSpec field(NodeKind kind, String name) {
    for (FieldSpec f: fields(kind)) {
      if (f.name.equals(name)) {
        return f;
      }
    }
    return null;
  }

  public static List<String> fieldNames(NodeKind kind) {
    ImmutableList.Builder<String> names = ImmutableList.builder();
    for (FieldSpec f: fields(kind)) {
      names.add(f.name);
    }
    return names.build();
  }
}
