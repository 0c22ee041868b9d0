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

/**
 * Bounds of the numeric literal types
 */
public class NumericLimits {

  /** Smallest int256 */
  public static final BigInteger INT_MIN = BigInteger.ONE.shiftLeft(255).negate();

  /** Largest uint256 */
  public static final BigInteger INT_MAX =
                  BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

  public static final BigInteger MAX_UINT256 = INT_MAX;

  public static final int DECIMAL_PLACES = 10;

  public static final BigDecimal DECIMAL_MIN = new BigDecimal(
      "-170141183460469231731687303715884105728.0000000000");
  public static final BigDecimal DECIMAL_MAX = new BigDecimal(
      "170141183460469231731687303715884105727.9999999999");

  /** Largest shift amount, and largest exponent for bases other than 0, 1, -1 */
  public static final int MAX_SHIFT = 256;
  public static final int MAX_EXPONENT = 256;

  public static boolean inIntRange(BigInteger value) {
    return value.compareTo(INT_MIN) >= 0 && value.compareTo(INT_MAX) <= 0;
  }

  public static boolean inDecimalRange(BigDecimal value) {
    return value.compareTo(DECIMAL_MIN) >= 0 &&
           value.compareTo(DECIMAL_MAX) <= 0;
  }

  /**
   * Drop digits beyond the decimal precision, rounding toward zero
   */
  public static BigDecimal truncateDecimal(BigDecimal value) {
    if (value.scale() <= DECIMAL_PLACES) {
      return value;
    }
    return value.setScale(DECIMAL_PLACES, RoundingMode.DOWN);
  }
}
