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

/**
 * Simple immutable class to record where a node came from in the
 * original source.  Lines start at 1, columns and offsets at 0.
 * End positions are exclusive.
 */
public class SourceSpan {
  public final int line;
  public final int column;
  public final int endLine;
  public final int endColumn;
  /** Character offset of the first character */
  public final int start;
  public final int length;
  /** Identifies the source file in multi-file compilations */
  public final int sourceId;

  public SourceSpan(int line, int column, int endLine, int endColumn,
                    int start, int length, int sourceId) {
    super();
    this.line = line;
    this.column = column;
    this.endLine = endLine;
    this.endColumn = endColumn;
    this.start = start;
    this.length = length;
    this.sourceId = sourceId;
  }

  public SourceSpan(int line, int column, int endLine, int endColumn,
                    int start, int length) {
    this(line, column, endLine, endColumn, start, length, 0);
  }

  /**
   * @return "start:length:sourceId", the form used by serialized trees
   */
  public String src() {
    return start + ":" + length + ":" + sourceId;
  }

  /**
   * Parse the form produced by {@link #src()}.
   * @return array of start, length, sourceId, or null if malformed
   */
  public static int[] parseSrc(String src) {
    String[] parts = src.split(":");
    if (parts.length < 2 || parts.length > 3) {
      return null;
    }
    try {
      int start = Integer.parseInt(parts[0]);
      int length = Integer.parseInt(parts[1]);
      int sourceId = parts.length == 3 ? Integer.parseInt(parts[2]) : 0;
      return new int[] {start, length, sourceId};
    } catch (NumberFormatException e) {
      return null;
    }
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + line;
    result = prime * result + column;
    result = prime * result + endLine;
    result = prime * result + endColumn;
    result = prime * result + start;
    result = prime * result + length;
    result = prime * result + sourceId;
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof SourceSpan))
      return false;
    SourceSpan other = (SourceSpan) obj;
    return line == other.line && column == other.column &&
           endLine == other.endLine && endColumn == other.endColumn &&
           start == other.start && length == other.length &&
           sourceId == other.sourceId;
  }

  @Override
  public String toString() {
    return line + ":" + column + "-" + endLine + ":" + endColumn;
  }
}
