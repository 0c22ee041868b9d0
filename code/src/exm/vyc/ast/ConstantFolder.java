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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;

import exm.vyc.common.Settings;
import exm.vyc.common.exceptions.FoldException;
import exm.vyc.common.exceptions.InvalidConstantOperationException;
import exm.vyc.common.exceptions.InvalidOptionException;
import exm.vyc.common.exceptions.NotConstantException;
import exm.vyc.common.exceptions.VYCRuntimeError;
import exm.vyc.common.lang.NumericLimits;
import exm.vyc.common.lang.OpEvaluator;

/**
 * Reduces constant expressions to literals.  Folding never modifies the
 * tree: results are detached literals carrying the span of the folded
 * node, for a pass to substitute if it wants to.
 */
public class ConstantFolder {

  /** Memoize results on nodes */
  private final boolean useCache;

  public ConstantFolder(boolean useCache) {
    this.useCache = useCache;
  }

  public static ConstantFolder fromSettings() {
    try {
      return new ConstantFolder(Settings.getBoolean(Settings.FOLD_CACHE));
    } catch (InvalidOptionException e) {
      throw new VYCRuntimeError("Bad fold cache setting", e);
    }
  }

  /**
   * @return result holding a literal the caller owns, or the reason why
   *         node can't be folded
   */
  public FoldResult evaluate(Node node) {
    if (useCache) {
      FoldResult cached = node.getCachedEvaluation();
      if (cached != null) {
        return cached.copy();
      }
    }

    FoldResult result;
    try {
      result = FoldResult.folded(fold(node));
    } catch (FoldException e) {
      result = FoldResult.failed(e);
    }

    if (useCache) {
      node.setCachedEvaluation(result);
      return result.copy();
    }
    return result;
  }

  private Node fold(Node node) throws FoldException {
    if (node.getKind().isLiteral()) {
      return node.copy();
    }
    switch (node.getKind()) {
      case UNARY_OP:
        return foldUnaryOp(node);
      case BIN_OP:
        return foldBinOp(node);
      case BOOL_OP:
        return foldBoolOp(node);
      case COMPARE:
        return foldCompare(node);
      case SUBSCRIPT:
        return foldSubscript(node);
      default:
        throw notConstant(node);
    }
  }

  /**
   * Fold a subexpression, propagating failure
   */
  private Node operand(Node node) throws FoldException {
    return evaluate(node).checkedGet();
  }

  private Node foldUnaryOp(Node node) throws FoldException {
    NodeKind op = node.getNode("op").getKind();
    Node operand = operand(node.getNode("operand"));
    Object value = operand.getValue();

    Object result;
    try {
      if (operand.isA(NodeKind.INT)) {
        result = OpEvaluator.evalUnary(op, (BigInteger)value);
      } else if (operand.isA(NodeKind.DECIMAL)) {
        result = OpEvaluator.evalUnary(op, (BigDecimal)value);
      } else if (operand.isA(NodeKind.NAME_CONSTANT)) {
        result = OpEvaluator.evalUnary(op, (Boolean)value);
      } else {
        result = null;
      }
    } catch (ArithmeticException e) {
      throw invalid(node, e.getMessage());
    }
    if (result == null) {
      throw invalid(node, "Invalid operand for " + op.getDescription() +
                    ": " + operand.getDescription());
    }
    return result(node, operand.getKind(), result);
  }

  private Node foldBinOp(Node node) throws FoldException {
    NodeKind op = node.getNode("op").getKind();
    Node left = operand(node.getNode("left"));
    Node right = operand(node.getNode("right"));

    if (left.getKind() != right.getKind() ||
        !left.isA(NodeKind.INT, NodeKind.DECIMAL)) {
      throw invalid(node, "Invalid literal types for " + op.getDescription()
          + ": " + left.getDescription() + " and " + right.getDescription());
    }

    Object result;
    try {
      if (left.isA(NodeKind.INT)) {
        result = OpEvaluator.evalBinary(op, (BigInteger)left.getValue(),
                                        (BigInteger)right.getValue());
      } else {
        result = OpEvaluator.evalBinary(op, (BigDecimal)left.getValue(),
                                        (BigDecimal)right.getValue());
      }
    } catch (ArithmeticException e) {
      throw invalid(node, e.getMessage());
    }
    if (result == null) {
      throw invalid(node, "Invalid operation for " + left.getDescription()
                          + ": " + op.getDescription());
    }
    return result(node, left.getKind(), result);
  }

  /**
   * Evaluated left to right, stopping at the first operand that decides the
   * result.  Operands after it may be anything.
   */
  private Node foldBoolOp(Node node) throws FoldException {
    NodeKind op = node.getNode("op").getKind();
    Boolean decider = OpEvaluator.shortCircuitValue(op);
    if (decider == null) {
      throw invalid(node, "Unknown boolean operator " + op.getTag());
    }
    for (Node value: node.getNodes("values")) {
      Node operand = operand(value);
      if (!operand.isA(NodeKind.NAME_CONSTANT)) {
        throw invalid(node, "Invalid operand for " + op.getDescription() +
                      ": " + operand.getDescription());
      }
      if (decider.equals(operand.getValue())) {
        return result(node, NodeKind.NAME_CONSTANT, decider);
      }
    }
    return result(node, NodeKind.NAME_CONSTANT, !decider);
  }

  private Node foldCompare(Node node) throws FoldException {
    NodeKind op = node.getNode("op").getKind();
    Node left = operand(node.getNode("left"));

    if (op == NodeKind.IN || op == NodeKind.NOT_IN) {
      boolean found = isMember(node, left, node.getNode("right"));
      return result(node, NodeKind.NAME_CONSTANT,
                    op == NodeKind.IN ? found : !found);
    }

    Node right = operand(node.getNode("right"));
    if (left.getKind() != right.getKind()) {
      throw invalid(node, "Cannot compare " + left.getDescription() +
                    " with " + right.getDescription());
    }
    if (op == NodeKind.EQ || op == NodeKind.NOT_EQ) {
      boolean eq = left.equals(right);
      return result(node, NodeKind.NAME_CONSTANT,
                    op == NodeKind.EQ ? eq : !eq);
    }

    if (!left.isA(NodeKind.INT, NodeKind.DECIMAL)) {
      throw invalid(node, "Invalid literal type for " + op.getDescription()
                          + ": " + left.getDescription());
    }
    int cmp;
    if (left.isA(NodeKind.INT)) {
      cmp = ((BigInteger)left.getValue()).compareTo(
                                      (BigInteger)right.getValue());
    } else {
      cmp = ((BigDecimal)left.getValue()).compareTo(
                                      (BigDecimal)right.getValue());
    }
    Boolean result = OpEvaluator.evalOrdering(op, cmp);
    if (result == null) {
      throw invalid(node, "Unknown comparison " + op.getTag());
    }
    return result(node, NodeKind.NAME_CONSTANT, result);
  }

  private boolean isMember(Node node, Node needle, Node haystack)
      throws FoldException {
    if (!haystack.isA(NodeKind.LIST)) {
      if (haystack.isA(NodeKind.CONSTANT)) {
        throw invalid(node, "Membership test requires a list, not a "
                            + haystack.getDescription());
      }
      throw notConstant(haystack);
    }
    boolean found = false;
    for (Node elem: haystack.getNodes("elements")) {
      Node value = operand(elem);
      if (value.getKind() != needle.getKind()) {
        throw invalid(node, "Cannot compare " + needle.getDescription() +
                      " with " + value.getDescription());
      }
      found = found || needle.equals(value);
    }
    return found;
  }

  private Node foldSubscript(Node node) throws FoldException {
    Node list = node.getNode("value");
    if (!list.isA(NodeKind.LIST)) {
      throw notConstant(list);
    }
    Node index = operand(node.getNode("slice").getNode("value"));
    if (!index.isA(NodeKind.INT)) {
      throw invalid(node, "List index must be an integer, not a " +
                    index.getDescription());
    }

    List<Node> elements = list.getNodes("elements");
    NodeKind elemKind = null;
    Node[] values = new Node[elements.size()];
    for (int i = 0; i < values.length; i++) {
      values[i] = operand(elements.get(i));
      if (elemKind != null && values[i].getKind() != elemKind) {
        throw invalid(node, "List contains multiple literal types");
      }
      elemKind = values[i].getKind();
    }

    BigInteger i = (BigInteger)index.getValue();
    if (i.signum() < 0 || i.compareTo(BigInteger.valueOf(values.length)) >= 0) {
      throw invalid(node, "List index out of range: " + i);
    }
    Node chosen = values[i.intValue()];
    return result(node, chosen.getKind(), chosen.getValue());
  }

  /**
   * Make the literal that replaces node, checking numeric bounds
   */
  private Node result(Node node, NodeKind kind, Object value)
      throws InvalidConstantOperationException {
    if (kind == NodeKind.INT &&
        !NumericLimits.inIntRange((BigInteger)value)) {
      throw invalid(node, "Value is out of bounds: " + value);
    } else if (kind == NodeKind.DECIMAL) {
      value = NumericLimits.truncateDecimal((BigDecimal)value);
      if (!NumericLimits.inDecimalRange((BigDecimal)value)) {
        throw invalid(node, "Value is out of bounds: " + value);
      }
    }
    return Literals.replacing(node, kind, value);
  }

  private static NotConstantException notConstant(Node node) {
    return new NotConstantException(node.getSpan(), "A " +
        node.getDescription() + " is not a constant expression");
  }

  private static InvalidConstantOperationException invalid(Node node,
                                                           String msg) {
    return new InvalidConstantOperationException(node.getSpan(), msg);
  }
}
