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

import com.google.common.io.BaseEncoding;

/**
 * Types of non-node field values.  Values are stored as String,
 * BigInteger, BigDecimal, Boolean and byte[] respectively.
 */
public enum ScalarType {
  STRING,
  INTEGER,
  DECIMAL,
  BOOLEAN,
  BYTES;

  private static final BaseEncoding HEX = BaseEncoding.base16().lowerCase();

  /**
   * Convert a raw value from the parser or from a compiler pass to the
   * stored representation.
   * @return converted value, or null if the value can't represent this type
   */
  public Object coerce(Object raw) {
    if (raw == null) {
      return null;
    }
    switch (this) {
      case STRING:
        return raw instanceof String ? raw : null;
      case BOOLEAN:
        return raw instanceof Boolean ? raw : null;
      case INTEGER:
        return coerceInteger(raw);
      case DECIMAL:
        return coerceDecimal(raw);
      case BYTES:
        return coerceBytes(raw);
      default:
        throw new IllegalStateException("Unknown scalar type " + this);
    }
  }

  private static BigInteger coerceInteger(Object raw) {
    if (raw instanceof BigInteger) {
      return (BigInteger)raw;
    } else if (raw instanceof Integer || raw instanceof Long ||
               raw instanceof Short || raw instanceof Byte) {
      return BigInteger.valueOf(((Number)raw).longValue());
    } else if (raw instanceof BigDecimal) {
      // Integral values written with a fraction, e.g. 3.0
      try {
        return ((BigDecimal)raw).toBigIntegerExact();
      } catch (ArithmeticException e) {
        return null;
      }
    }
    return null;
  }

  private static BigDecimal coerceDecimal(Object raw) {
    if (raw instanceof BigDecimal) {
      return (BigDecimal)raw;
    } else if (raw instanceof BigInteger) {
      return new BigDecimal((BigInteger)raw);
    } else if (raw instanceof Integer || raw instanceof Long) {
      return BigDecimal.valueOf(((Number)raw).longValue());
    } else if (raw instanceof String) {
      try {
        return new BigDecimal((String)raw);
      } catch (NumberFormatException e) {
        return null;
      }
    }
    return null;
  }

  private static byte[] coerceBytes(Object raw) {
    if (raw instanceof byte[]) {
      return ((byte[])raw).clone();
    } else if (raw instanceof String) {
      String s = (String)raw;
      if (!s.startsWith("0x")) {
        return null;
      }
      try {
        return HEX.decode(s.substring(2).toLowerCase());
      } catch (IllegalArgumentException e) {
        return null;
      }
    }
    return null;
  }

  /**
   * Render bytes in the "0x..." form accepted by {@link #coerce(Object)}
   */
  public static String hexString(byte[] bytes) {
    return "0x" + HEX.encode(bytes);
  }
}
