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

import com.google.common.collect.ImmutableMap;

import exm.vyc.common.exceptions.UnsupportedSyntaxException;
import exm.vyc.common.exceptions.VYCRuntimeError;

/**
 * Construction of synthesized literal nodes
 */
public class Literals {

  public static Node intLit(long value) {
    return intLit(BigInteger.valueOf(value));
  }

  public static Node intLit(BigInteger value) {
    return literal(NodeKind.INT, value, null, Node.NO_ID);
  }

  public static Node decimalLit(String value) {
    return decimalLit(new BigDecimal(value));
  }

  public static Node decimalLit(BigDecimal value) {
    return literal(NodeKind.DECIMAL, value, null, Node.NO_ID);
  }

  public static Node boolLit(boolean value) {
    return literal(NodeKind.NAME_CONSTANT, value, null, Node.NO_ID);
  }

  public static Node strLit(String value) {
    return literal(NodeKind.STR, value, null, Node.NO_ID);
  }

  public static Node bytesLit(byte[] value) {
    return literal(NodeKind.BYTES, value, null, Node.NO_ID);
  }

  /**
   * Make a literal standing in for an existing node: span and node id are
   * taken from it
   */
  static Node replacing(Node origin, NodeKind kind, Object value) {
    return literal(kind, value, origin.getSpan(), origin.getNodeId());
  }

  private static Node literal(NodeKind kind, Object value, SourceSpan span,
                              int nodeId) {
    assert(kind.isLiteral());
    try {
      return Node.construct(kind, ImmutableMap.of("value", value), span,
                            nodeId);
    } catch (UnsupportedSyntaxException e) {
      throw new VYCRuntimeError("Invalid value for " + kind.getTag() + ": "
                                + value, e);
    }
  }
}
