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

import java.util.Arrays;

import exm.vyc.common.Logging;
import exm.vyc.common.exceptions.UnsupportedSyntaxException;

/**
 * Parse tree fixtures.  Every call gets a fresh span, so building the same
 * fixture twice gives trees that differ only in location.
 */
public class ParseTrees {

  private static int nextStart = 0;

  public static SourceSpan span() {
    int start = nextStart;
    nextStart += 3;
    int line = 1 + start / 80;
    int col = start % 80;
    return new SourceSpan(line, col, line, col + 3, start, 3);
  }

  public static ParseTree tree(String tag) {
    return ParseTree.of(tag, span());
  }

  public static ParseTree name(String id) {
    return tree("Name").with("id", id);
  }

  public static ParseTree intLit(long value) {
    return tree("Int").with("value", value);
  }

  public static ParseTree decimalLit(String value) {
    return tree("Decimal").with("value", value);
  }

  public static ParseTree boolLit(boolean value) {
    return tree("NameConstant").with("value", value);
  }

  public static ParseTree strLit(String value) {
    return tree("Str").with("value", value);
  }

  public static ParseTree binOp(ParseTree left, String op, ParseTree right) {
    return tree("BinOp").with("left", left).with("op", tree(op))
                        .with("right", right);
  }

  public static ParseTree unaryOp(String op, ParseTree operand) {
    return tree("UnaryOp").with("op", tree(op)).with("operand", operand);
  }

  public static ParseTree boolOp(String op, ParseTree... values) {
    return tree("BoolOp").with("op", tree(op))
                         .with("values", Arrays.asList(values));
  }

  public static ParseTree compare(ParseTree left, String op,
                                  ParseTree right) {
    return tree("Compare").with("left", left).with("op", tree(op))
                          .with("right", right);
  }

  public static ParseTree list(ParseTree... elements) {
    return tree("List").with("elements", Arrays.asList(elements));
  }

  public static ParseTree subscript(ParseTree value, ParseTree index) {
    return tree("Subscript").with("value", value)
                  .with("slice", tree("Index").with("value", index));
  }

  public static ParseTree call(String func, ParseTree... args) {
    return tree("Call").with("func", name(func))
                       .with("args", Arrays.asList(args));
  }

  /**
   * target: type = value
   */
  public static ParseTree annAssign(String target, String type,
                                    ParseTree value) {
    return tree("AnnAssign").with("target", name(target))
                  .with("annotation", name(type)).with("value", value);
  }

  public static ParseTree exprStmt(ParseTree value) {
    return tree("Expr").with("value", value);
  }

  public static ParseTree module(ParseTree... body) {
    return tree("Module").with("body", Arrays.asList(body));
  }

  public static ParseTree functionDef(String name, ParseTree... body) {
    return tree("FunctionDef").with("name", name)
        .with("args", tree("arguments"))
        .with("body", Arrays.asList(body));
  }

  public static TreeBuilder builder() {
    return new TreeBuilder(Logging.getVYCLogger(), true);
  }

  public static ModuleNode buildModule(ParseTree... body)
      throws UnsupportedSyntaxException {
    return builder().buildModule(module(body));
  }

  /**
   * Build a detached expression
   */
  public static Node build(ParseTree tree)
      throws UnsupportedSyntaxException {
    return builder().build(tree, null);
  }
}
