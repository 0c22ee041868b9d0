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
package exm.vyc.ast.json;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

import exm.vyc.ast.AstSerializer;
import exm.vyc.ast.ParseTree;
import exm.vyc.ast.SourceSpan;
import exm.vyc.common.exceptions.UnsupportedSyntaxException;

/**
 * Reads parse trees from JSON in the shape that {@link AstJson} writes:
 * one object per node, tagged with "ast_type", span in the position keys.
 * Node ids in the input are ignored; the builder assigns fresh ones.
 */
public class ParseTreeReader {

  public static ParseTree read(String json) throws UnsupportedSyntaxException {
    JsonElement root;
    try {
      root = JsonParser.parseString(json);
    } catch (JsonParseException e) {
      throw new UnsupportedSyntaxException("Malformed JSON input: " +
                                           e.getMessage());
    }
    if (!root.isJsonObject()) {
      throw new UnsupportedSyntaxException("Expected a JSON object at the "
                                           + "root of the tree");
    }
    return readTree(root.getAsJsonObject());
  }

  private static ParseTree readTree(JsonObject obj)
      throws UnsupportedSyntaxException {
    JsonElement type = obj.get(AstSerializer.AST_TYPE);
    if (type == null || !type.isJsonPrimitive() ||
        !type.getAsJsonPrimitive().isString()) {
      throw new UnsupportedSyntaxException("JSON object without string "
          + AstSerializer.AST_TYPE + ": " +
          StringUtils.abbreviate(obj.toString(), 60));
    }
    ParseTree tree = new ParseTree(type.getAsString(), readSpan(obj));

    for (Map.Entry<String, JsonElement> e: obj.entrySet()) {
      String key = e.getKey();
      if (AstSerializer.RESERVED_KEYS.contains(key) ||
          AstSerializer.SKIP_LIST.contains(key)) {
        continue;
      }
      tree.with(key, readValue(e.getValue()));
    }
    return tree;
  }

  private static Object readValue(JsonElement value)
      throws UnsupportedSyntaxException {
    if (value.isJsonNull()) {
      return null;
    } else if (value.isJsonObject()) {
      return readTree(value.getAsJsonObject());
    } else if (value.isJsonArray()) {
      JsonArray arr = value.getAsJsonArray();
      List<Object> result = new ArrayList<Object>(arr.size());
      for (JsonElement elem: arr) {
        result.add(readValue(elem));
      }
      return result;
    }

    JsonPrimitive prim = value.getAsJsonPrimitive();
    if (prim.isBoolean()) {
      return prim.getAsBoolean();
    } else if (prim.isNumber()) {
      return readNumber(prim.getAsString());
    } else {
      return prim.getAsString();
    }
  }

  /**
   * Integers stay integers: 1 and 1.0 are different literals
   */
  private static Object readNumber(String text) {
    if (text.indexOf('.') >= 0 || text.indexOf('e') >= 0 ||
        text.indexOf('E') >= 0) {
      return new BigDecimal(text);
    }
    return new BigInteger(text);
  }

  /**
   * @return span, or null if the object has no line number
   */
  private static SourceSpan readSpan(JsonObject obj)
      throws UnsupportedSyntaxException {
    Integer line = readInt(obj, AstSerializer.LINENO);
    if (line == null) {
      return null;
    }
    Integer column = readInt(obj, AstSerializer.COL_OFFSET);
    Integer endLine = readInt(obj, AstSerializer.END_LINENO);
    Integer endColumn = readInt(obj, AstSerializer.END_COL_OFFSET);
    int col = column == null ? 0 : column;

    int[] src = new int[] {0, 0, 0};
    JsonElement srcElem = obj.get(AstSerializer.SRC);
    if (srcElem != null && !srcElem.isJsonNull()) {
      if (!srcElem.isJsonPrimitive()) {
        throw new UnsupportedSyntaxException("Malformed " + AstSerializer.SRC
                      + " value: " + srcElem);
      }
      src = SourceSpan.parseSrc(srcElem.getAsString());
      if (src == null) {
        throw new UnsupportedSyntaxException("Malformed " + AstSerializer.SRC
                      + " value: " + srcElem.getAsString());
      }
    }
    return new SourceSpan(line, col,
        endLine == null ? line : endLine,
        endColumn == null ? col : endColumn,
        src[0], src[1], src[2]);
  }

  private static Integer readInt(JsonObject obj, String key)
      throws UnsupportedSyntaxException {
    JsonElement elem = obj.get(key);
    if (elem == null || elem.isJsonNull()) {
      return null;
    }
    if (!elem.isJsonPrimitive() || !elem.getAsJsonPrimitive().isNumber()) {
      throw new UnsupportedSyntaxException("Expected integer for " + key +
                                           ", but got " + elem);
    }
    try {
      return elem.getAsBigDecimal().intValueExact();
    } catch (ArithmeticException e) {
      throw new UnsupportedSyntaxException("Expected integer for " + key +
                                           ", but got " + elem);
    } catch (NumberFormatException e) {
      throw new UnsupportedSyntaxException("Expected integer for " + key +
                                           ", but got " + elem);
    }
  }
}
