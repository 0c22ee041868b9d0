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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Set;

/**
 * Generic node description produced by the external parser: a tag, raw
 * field values and a source span.  Field values are scalars, nested
 * ParseTrees, or lists of ParseTrees.
 */
public class ParseTree {

  private final String tag;
  private final LinkedHashMap<String, Object> fields =
                        new LinkedHashMap<String, Object>();
  private final SourceSpan span;

  public ParseTree(String tag, SourceSpan span) {
    this.tag = tag;
    this.span = span;
  }

  public static ParseTree of(String tag, SourceSpan span) {
    return new ParseTree(tag, span);
  }

  /**
   * Add a field.  Returns this for chaining.
   */
  public ParseTree with(String name, Object value) {
    fields.put(name, value);
    return this;
  }

  public String getTag() {
    return tag;
  }

  public SourceSpan getSpan() {
    return span;
  }

  public boolean hasField(String name) {
    return fields.containsKey(name);
  }

  public Object getField(String name) {
    return fields.get(name);
  }

  public Set<String> getFieldNames() {
    return Collections.unmodifiableSet(fields.keySet());
  }

  @Override
  public String toString() {
    return tag + fields;
  }
}
