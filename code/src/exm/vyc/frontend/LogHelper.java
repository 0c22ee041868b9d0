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
package exm.vyc.frontend;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;

import exm.vyc.ast.SourceSpan;
import exm.vyc.common.Logging;

/**
 * Indented log output for tree walks
 */
public class LogHelper {

  private static final Logger logger = Logging.getVYCLogger();

  /**
   * @return "line:col: " prefix, or empty string if no span
   */
  public static String location(SourceSpan span) {
    if (span == null) {
      return "";
    }
    return span.line + ":" + (span.column + 1) + ": ";
  }

  public static void debug(SourceSpan span, String msg) {
    log(logger, 0, Level.DEBUG, span, msg);
  }

  public static void log(Logger logger, int indent, Level level,
                         SourceSpan span, String msg) {
    if (!logger.isEnabledFor(level)) {
      return;
    }
    StringBuilder sb = new StringBuilder(256);
    sb.append(location(span));
    for (int i = 0; i < indent; i++)
      sb.append(' ');
    sb.append(msg);
    logger.log(level, sb.toString());
  }
}
