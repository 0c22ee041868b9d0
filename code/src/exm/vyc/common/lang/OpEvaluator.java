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
package exm.vyc.common.lang;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

import exm.vyc.ast.NodeKind;
import exm.vyc.common.Logging;

/**
 * Compile time evaluation of operators on literal values.
 *
 * Each method returns null if the operator is not defined for the operand
 * type, and throws ArithmeticException with a user-facing message if it is
 * defined but the particular operands are invalid (e.g. division by zero).
 * Range checks of results are left to the caller.
 */
public class OpEvaluator {

  public static BigInteger evalUnary(NodeKind op, BigInteger operand) {
    switch (op) {
      case USUB:
        return operand.negate();
      case INVERT:
        if (operand.signum() < 0) {
          throw new ArithmeticException("Cannot invert a negative value");
        }
        return NumericLimits.MAX_UINT256.xor(operand);
      default:
        return null;
    }
  }

  public static BigDecimal evalUnary(NodeKind op, BigDecimal operand) {
    if (op == NodeKind.USUB) {
      return operand.negate();
    }
    return null;
  }

  public static Boolean evalUnary(NodeKind op, Boolean operand) {
    if (op == NodeKind.NOT) {
      return !operand;
    }
    return null;
  }

  public static BigInteger evalBinary(NodeKind op, BigInteger left,
                                      BigInteger right) {
    switch (op) {
      case ADD:
        return left.add(right);
      case SUB:
        return left.subtract(right);
      case MULT:
        return left.multiply(right);
      case DIV:
        checkNonZero(right, "Division");
        // Truncates toward zero
        return left.divide(right);
      case MOD:
        checkNonZero(right, "Modulo");
        // Sign follows the dividend
        return left.remainder(right);
      case POW:
        return evalPow(left, right);
      case BIT_AND:
        return left.and(right);
      case BIT_OR:
        return left.or(right);
      case BIT_XOR:
        return left.xor(right);
      case LSHIFT:
        return left.shiftLeft(checkShift(right));
      case RSHIFT:
        return left.shiftRight(checkShift(right));
      default:
        return null;
    }
  }

  private static BigInteger evalPow(BigInteger base, BigInteger exponent) {
    if (exponent.signum() < 0) {
      throw new ArithmeticException("Exponent cannot be negative");
    }
    if (base.abs().compareTo(BigInteger.ONE) <= 0) {
      // 0, 1 and -1 never overflow, whatever the exponent
      if (base.signum() == 0) {
        return exponent.signum() == 0 ? BigInteger.ONE : BigInteger.ZERO;
      } else if (base.signum() > 0 || !exponent.testBit(0)) {
        return BigInteger.ONE;
      } else {
        return BigInteger.ONE.negate();
      }
    }
    if (exponent.compareTo(BigInteger.valueOf(NumericLimits.MAX_EXPONENT))
                                                                      > 0) {
      throw new ArithmeticException("Value is out of bounds");
    }
    return base.pow(exponent.intValue());
  }

  public static BigDecimal evalBinary(NodeKind op, BigDecimal left,
                                      BigDecimal right) {
    switch (op) {
      case ADD:
        return left.add(right);
      case SUB:
        return left.subtract(right);
      case MULT:
        return truncate(left.multiply(right), op);
      case DIV:
        checkNonZero(right, "Division");
        return left.divide(right, NumericLimits.DECIMAL_PLACES,
                           RoundingMode.DOWN);
      case MOD:
        checkNonZero(right, "Modulo");
        return left.remainder(right);
      case POW:
        throw new ArithmeticException("Cannot raise a decimal to a power");
      default:
        return null;
    }
  }

  /**
   * @param cmp result of comparing left to right
   * @return result of an ordering comparison, null for other operators
   */
  public static Boolean evalOrdering(NodeKind op, int cmp) {
    switch (op) {
      case LT:
        return cmp < 0;
      case LT_E:
        return cmp <= 0;
      case GT:
        return cmp > 0;
      case GT_E:
        return cmp >= 0;
      default:
        return null;
    }
  }

  /**
   * For short-circuiting boolean operators: the operand value that decides
   * the result on its own, which is then also the result.
   * @return null if op is not a boolean operator
   */
  public static Boolean shortCircuitValue(NodeKind op) {
    switch (op) {
      case AND:
        return false;
      case OR:
        return true;
      default:
        return null;
    }
  }

  private static void checkNonZero(BigInteger value, String opName) {
    if (value.signum() == 0) {
      throw new ArithmeticException(opName + " by zero");
    }
  }

  private static void checkNonZero(BigDecimal value, String opName) {
    if (value.signum() == 0) {
      throw new ArithmeticException(opName + " by zero");
    }
  }

  private static int checkShift(BigInteger amount) {
    if (amount.signum() < 0 ||
        amount.compareTo(BigInteger.valueOf(NumericLimits.MAX_SHIFT)) > 0) {
      throw new ArithmeticException("Invalid shift amount " + amount +
          ": must be between 0 and " + NumericLimits.MAX_SHIFT);
    }
    return amount.intValue();
  }

  private static BigDecimal truncate(BigDecimal value, NodeKind op) {
    BigDecimal truncated = NumericLimits.truncateDecimal(value);
    if (truncated.compareTo(value) != 0) {
      Logging.uniqueWarn("Result of decimal " + op.getDescription() +
          " truncated to " + NumericLimits.DECIMAL_PLACES + " decimal places");
    }
    return truncated;
  }
}
