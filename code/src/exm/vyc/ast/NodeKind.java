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

import java.util.HashMap;
import java.util.Map;

/**
 * The closed set of node variants.  Abstract kinds group concrete kinds
 * so that queries can ask for e.g. any literal; they never appear on a
 * node.  The field layout of each concrete kind lives in {@link NodeSchema}.
 */
public enum NodeKind {
  /* Abstract kinds: must come first so concrete kinds can refer to them */
  TOP_LEVEL("TopLevel", Category.TOP_LEVEL, null, true, "top-level definition"),
  CONSTANT("Constant", Category.EXPRESSION, null, true, "literal value"),
  NUM("Num", Category.EXPRESSION, CONSTANT, true, "numeric literal"),
  BINARY_OPERATOR("BinaryOperator", Category.OPERATOR, null, true,
                  "binary operator"),
  UNARY_OPERATOR("UnaryOperator", Category.OPERATOR, null, true,
                 "unary operator"),
  BOOLEAN_OPERATOR("BooleanOperator", Category.OPERATOR, null, true,
                   "boolean operator"),
  COMPARISON_OPERATOR("ComparisonOperator", Category.OPERATOR, null, true,
                      "comparison operator"),

  /* Top-level constructs */
  MODULE("Module", Category.TOP_LEVEL, TOP_LEVEL, "module"),
  FUNCTION_DEF("FunctionDef", Category.TOP_LEVEL, TOP_LEVEL,
               "function definition"),
  INTERFACE_DEF("InterfaceDef", Category.TOP_LEVEL, TOP_LEVEL,
                "interface definition"),
  STRUCT_DEF("StructDef", Category.TOP_LEVEL, TOP_LEVEL, "struct definition"),
  ENUM_DEF("EnumDef", Category.TOP_LEVEL, TOP_LEVEL, "enum definition"),
  EVENT_DEF("EventDef", Category.TOP_LEVEL, TOP_LEVEL, "event definition"),

  /* Pieces of other constructs */
  ARGUMENTS("arguments", Category.AUXILIARY, null, "argument list"),
  ARG("arg", Category.AUXILIARY, null, "argument"),
  KEYWORD("keyword", Category.AUXILIARY, null, "keyword argument"),
  INDEX("Index", Category.AUXILIARY, null, "index"),

  /* Statements */
  ASSIGN("Assign", Category.STATEMENT, null, "assignment"),
  AUG_ASSIGN("AugAssign", Category.STATEMENT, null, "augmented assignment"),
  ANN_ASSIGN("AnnAssign", Category.STATEMENT, null, "annotated assignment"),
  IF("If", Category.STATEMENT, null, "if statement"),
  FOR("For", Category.STATEMENT, null, "for loop"),
  RETURN("Return", Category.STATEMENT, null, "return statement"),
  RAISE("Raise", Category.STATEMENT, null, "raise statement"),
  ASSERT("Assert", Category.STATEMENT, null, "assert statement"),
  PASS("Pass", Category.STATEMENT, null, "pass statement"),
  BREAK("Break", Category.STATEMENT, null, "break statement"),
  CONTINUE("Continue", Category.STATEMENT, null, "continue statement"),
  IMPORT("Import", Category.STATEMENT, null, "import statement"),
  IMPORT_FROM("ImportFrom", Category.STATEMENT, null, "import statement"),
  LOG("Log", Category.STATEMENT, null, "log statement"),
  EXPR("Expr", Category.STATEMENT, null, "expression statement"),

  /* Expressions */
  NAME("Name", Category.EXPRESSION, null, "name"),
  CALL("Call", Category.EXPRESSION, null, "function call"),
  ATTRIBUTE("Attribute", Category.EXPRESSION, null, "attribute access"),
  SUBSCRIPT("Subscript", Category.EXPRESSION, null, "subscript"),
  LIST("List", Category.EXPRESSION, null, "list literal"),
  TUPLE("Tuple", Category.EXPRESSION, null, "tuple literal"),
  DICT("Dict", Category.EXPRESSION, null, "dict literal"),
  UNARY_OP("UnaryOp", Category.EXPRESSION, null, "unary operation"),
  BIN_OP("BinOp", Category.EXPRESSION, null, "binary operation"),
  BOOL_OP("BoolOp", Category.EXPRESSION, null, "boolean operation"),
  COMPARE("Compare", Category.EXPRESSION, null, "comparison"),

  /* Literals */
  INT("Int", Category.EXPRESSION, NUM, "integer literal"),
  DECIMAL("Decimal", Category.EXPRESSION, NUM, "decimal literal"),
  HEX("Hex", Category.EXPRESSION, NUM, "hexadecimal literal"),
  STR("Str", Category.EXPRESSION, CONSTANT, "string literal"),
  BYTES("Bytes", Category.EXPRESSION, CONSTANT, "bytes literal"),
  NAME_CONSTANT("NameConstant", Category.EXPRESSION, CONSTANT,
                "boolean literal"),

  /* Operators */
  ADD("Add", Category.OPERATOR, BINARY_OPERATOR, "addition"),
  SUB("Sub", Category.OPERATOR, BINARY_OPERATOR, "subtraction"),
  MULT("Mult", Category.OPERATOR, BINARY_OPERATOR, "multiplication"),
  DIV("Div", Category.OPERATOR, BINARY_OPERATOR, "division"),
  MOD("Mod", Category.OPERATOR, BINARY_OPERATOR, "modulus"),
  POW("Pow", Category.OPERATOR, BINARY_OPERATOR, "exponentiation"),
  BIT_AND("BitAnd", Category.OPERATOR, BINARY_OPERATOR, "bitwise and"),
  BIT_OR("BitOr", Category.OPERATOR, BINARY_OPERATOR, "bitwise or"),
  BIT_XOR("BitXor", Category.OPERATOR, BINARY_OPERATOR, "bitwise xor"),
  LSHIFT("LShift", Category.OPERATOR, BINARY_OPERATOR, "left shift"),
  RSHIFT("RShift", Category.OPERATOR, BINARY_OPERATOR, "right shift"),
  USUB("USub", Category.OPERATOR, UNARY_OPERATOR, "negation"),
  NOT("Not", Category.OPERATOR, UNARY_OPERATOR, "logical negation"),
  INVERT("Invert", Category.OPERATOR, UNARY_OPERATOR, "bitwise inversion"),
  AND("And", Category.OPERATOR, BOOLEAN_OPERATOR, "logical and"),
  OR("Or", Category.OPERATOR, BOOLEAN_OPERATOR, "logical or"),
  EQ("Eq", Category.OPERATOR, COMPARISON_OPERATOR, "equality comparison"),
  NOT_EQ("NotEq", Category.OPERATOR, COMPARISON_OPERATOR,
         "non-equality comparison"),
  LT("Lt", Category.OPERATOR, COMPARISON_OPERATOR, "less-than comparison"),
  LT_E("LtE", Category.OPERATOR, COMPARISON_OPERATOR,
       "less-than-or-equal comparison"),
  GT("Gt", Category.OPERATOR, COMPARISON_OPERATOR, "greater-than comparison"),
  GT_E("GtE", Category.OPERATOR, COMPARISON_OPERATOR,
       "greater-than-or-equal comparison"),
  IN("In", Category.OPERATOR, COMPARISON_OPERATOR, "membership comparison"),
  NOT_IN("NotIn", Category.OPERATOR, COMPARISON_OPERATOR,
         "exclusion comparison");

  /**
   * Broad grouping of kinds, used to describe which children a field accepts
   */
  public static enum Category {
    TOP_LEVEL, STATEMENT, EXPRESSION, OPERATOR, AUXILIARY
  }

  private static final Map<String, NodeKind> byTag =
                                  new HashMap<String, NodeKind>();

  static {
    for (NodeKind kind: values()) {
      byTag.put(kind.tag, kind);
    }
  }

  private final String tag;
  private final Category category;
  private final NodeKind superKind;
  private final boolean isAbstract;
  private final String description;

  private NodeKind(String tag, Category category, NodeKind superKind,
                   String description) {
    this(tag, category, superKind, false, description);
  }

  private NodeKind(String tag, Category category, NodeKind superKind,
                   boolean isAbstract, String description) {
    this.tag = tag;
    this.category = category;
    this.superKind = superKind;
    this.isAbstract = isAbstract;
    this.description = description;
  }

  /**
   * @param tag tag as produced by the parser, e.g. "BinOp"
   * @return matching kind, or null if unknown
   */
  public static NodeKind fromTag(String tag) {
    return byTag.get(tag);
  }

  public String getTag() {
    return tag;
  }

  public Category getCategory() {
    return category;
  }

  public boolean isAbstract() {
    return isAbstract;
  }

  /**
   * Human readable name for use in diagnostics
   */
  public String getDescription() {
    return description;
  }

  /**
   * @return true if this is other, or other is one of its abstract super kinds
   */
  public boolean isA(NodeKind other) {
    NodeKind curr = this;
    while (curr != null) {
      if (curr == other) {
        return true;
      }
      curr = curr.superKind;
    }
    return false;
  }

  public boolean isLiteral() {
    return isA(CONSTANT);
  }

  public boolean isOperator() {
    return category == Category.OPERATOR;
  }
}
