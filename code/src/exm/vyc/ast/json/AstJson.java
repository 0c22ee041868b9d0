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
import java.util.List;
import java.util.Map;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

import exm.vyc.ast.Node;
import exm.vyc.ast.ScalarType;
import exm.vyc.common.Settings;
import exm.vyc.common.exceptions.InvalidOptionException;
import exm.vyc.common.exceptions.VYCRuntimeError;

/**
 * JSON rendering of serialized trees.  Bytes are written as 0x-prefixed
 * hex strings, numbers exactly.
 */
public class AstJson {

  public static String toJson(Node node) throws InvalidOptionException {
    return toJson(node, Settings.getBoolean(Settings.JSON_PRETTY));
  }

  public static String toJson(Node node, boolean pretty) {
    return gson(pretty).toJson(toJsonTree(node.toDict()));
  }

  private static Gson gson(boolean pretty) {
    GsonBuilder builder = new GsonBuilder()
                              .serializeNulls()
                              .disableHtmlEscaping();
    if (pretty) {
      builder.setPrettyPrinting();
    }
    return builder.create();
  }

  /**
   * Convert output of {@link Node#toDict()} to a JSON tree
   */
  public static JsonElement toJsonTree(Object value) {
    if (value == null) {
      return JsonNull.INSTANCE;
    } else if (value instanceof Map) {
      JsonObject obj = new JsonObject();
      for (Map.Entry<?, ?> e: ((Map<?, ?>)value).entrySet()) {
        obj.add((String)e.getKey(), toJsonTree(e.getValue()));
      }
      return obj;
    } else if (value instanceof List) {
      JsonArray arr = new JsonArray();
      for (Object elem: (List<?>)value) {
        arr.add(toJsonTree(elem));
      }
      return arr;
    } else if (value instanceof String) {
      return new JsonPrimitive((String)value);
    } else if (value instanceof Boolean) {
      return new JsonPrimitive((Boolean)value);
    } else if (value instanceof BigDecimal) {
      return new JsonPrimitive((BigDecimal)value);
    } else if (value instanceof BigInteger || value instanceof Integer) {
      return new JsonPrimitive((Number)value);
    } else if (value instanceof byte[]) {
      return new JsonPrimitive(ScalarType.hexString((byte[])value));
    } else {
      throw new VYCRuntimeError("Cannot convert to JSON: " +
                                value.getClass().getName());
    }
  }
}
