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
import java.util.Arrays;
import java.util.List;

/**
 * Structural equality and hashing over semantic fields.  Parent links,
 * spans, ids, annotations and fold caches never take part.
 */
class NodeEquality {

  static boolean equal(Node a, Node b) {
    if (a == b) {
      return true;
    }
    if (a.getKind() != b.getKind()) {
      return false;
    }
    for (FieldSpec f: NodeSchema.fields(a.getKind())) {
      if (!valueEqual(a.rawField(f.name), b.rawField(f.name))) {
        return false;
      }
    }
    return true;
  }

  static boolean valueEqual(Object a, Object b) {
    if (a == null || b == null) {
      return a == b;
    } else if (a instanceof Node && b instanceof Node) {
      return equal((Node)a, (Node)b);
    } else if (a instanceof List && b instanceof List) {
      List<?> la = (List<?>)a;
      List<?> lb = (List<?>)b;
      if (la.size() != lb.size()) {
        return false;
      }
      for (int i = 0; i < la.size(); i++) {
        if (!valueEqual(la.get(i), lb.get(i))) {
          return false;
        }
      }
      return true;
    } else if (a instanceof BigDecimal && b instanceof BigDecimal) {
      // 1.0 and 1.00 are the same decimal
      return ((BigDecimal)a).compareTo((BigDecimal)b) == 0;
    } else if (a instanceof byte[] && b instanceof byte[]) {
      return Arrays.equals((byte[])a, (byte[])b);
    } else {
      return a.equals(b);
    }
  }

  static int hash(Node node) {
    int result = node.getKind().getTag().hashCode();
    for (FieldSpec f: NodeSchema.fields(node.getKind())) {
      result = 31 * result + valueHash(node.rawField(f.name));
    }
    return result;
  }

  private static int valueHash(Object value) {
    if (value == null) {
      return 0;
    } else if (value instanceof Node) {
      return hash((Node)value);
    } else if (value instanceof List) {
      int result = 1;
      for (Object elem: (List<?>)value) {
        result = 31 * result + valueHash(elem);
      }
      return result;
    } else if (value instanceof BigDecimal) {
      BigDecimal d = (BigDecimal)value;
      return d.signum() == 0 ? 0 : d.stripTrailingZeros().hashCode();
    } else if (value instanceof byte[]) {
      return Arrays.hashCode((byte[])value);
    } else {
      return value.hashCode();
    }
  }
}
