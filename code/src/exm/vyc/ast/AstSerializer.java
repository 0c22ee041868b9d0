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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * Converts subtrees to ordered maps for tooling.  The key order and the
 * skip list are part of the external format.
 */
public class AstSerializer {

  public static final String AST_TYPE = "ast_type";
  public static final String NODE_ID = "node_id";
  public static final String LINENO = "lineno";
  public static final String COL_OFFSET = "col_offset";
  public static final String END_LINENO = "end_lineno";
  public static final String END_COL_OFFSET = "end_col_offset";
  public static final String SRC = "src";

  /** Keys emitted ahead of the semantic fields, in this order */
  public static final ImmutableList<String> RESERVED_KEYS = ImmutableList.of(
      AST_TYPE, NODE_ID, LINENO, COL_OFFSET, END_LINENO, END_COL_OFFSET, SRC);

  /** Never emitted */
  public static final ImmutableSet<String> SKIP_LIST = ImmutableSet.of(
      "parent", "metadata", "full_source_code", "node_source_code");

  /**
   * @return map with the reserved keys and then every semantic field in
   *    declared order.  Child nodes become nested maps.  Never folds.
   */
  public static Map<String, Object> toDict(Node node) {
    LinkedHashMap<String, Object> result = new LinkedHashMap<String, Object>();
    result.put(AST_TYPE, node.getKind().getTag());
    result.put(NODE_ID, node.getNodeId());

    SourceSpan span = node.getSpan();
    if (span != null) {
      result.put(LINENO, span.line);
      result.put(COL_OFFSET, span.column);
      result.put(END_LINENO, span.endLine);
      result.put(END_COL_OFFSET, span.endColumn);
      result.put(SRC, span.src());
    } else {
      result.put(LINENO, null);
      result.put(COL_OFFSET, null);
      result.put(END_LINENO, null);
      result.put(END_COL_OFFSET, null);
      result.put(SRC, null);
    }

    for (FieldSpec f: NodeSchema.fields(node.getKind())) {
      result.put(f.name, valueToDict(node.rawField(f.name)));
    }
    return result;
  }

  private static Object valueToDict(Object value) {
    if (value instanceof Node) {
      return toDict((Node)value);
    } else if (value instanceof List) {
      List<Object> result = new ArrayList<Object>();
      for (Object elem: (List<?>)value) {
        result.add(valueToDict(elem));
      }
      return result;
    } else if (value instanceof byte[]) {
      return ((byte[])value).clone();
    }
    return value;
  }
}
