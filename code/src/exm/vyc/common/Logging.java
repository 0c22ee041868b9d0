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

package exm.vyc.common;

import java.io.IOException;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Appender;
import org.apache.log4j.ConsoleAppender;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Layout;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import com.google.common.collect.Maps;

import exm.vyc.common.exceptions.InvalidOptionException;

public class Logging
{
  private static final String VYC_LOGGER_NAME = "exm.vyc";

  private static final String CONSOLE_PATTERN = "%-5p %m%n";
  private static final String FILE_PATTERN = "%-5p %c{1} - %m%n";

  /**
   * Messages already emitted.
   */
  static final Set<Map.Entry<Level, String>> emitted =
       new HashSet<Map.Entry<Level, String>>();

  public static Logger getVYCLogger()
  {
    return Logger.getLogger(VYC_LOGGER_NAME);
  }

  /**
   * Attach a single appender to the VYC logger.
   * @param logfile log to this file, or to stderr if null or empty
   * @param trace log everything down to TRACE level
   * @return the configured logger
   * @throws InvalidOptionException if the log file can't be opened
   */
  public static Logger setupLogging(String logfile, boolean trace)
      throws InvalidOptionException
  {
    Logger vycLogger = getVYCLogger();
    vycLogger.removeAllAppenders();
    vycLogger.setAdditivity(false);

    Appender appender;
    Level level;
    if (logfile != null && logfile.length() > 0) {
      Layout layout = new PatternLayout(FILE_PATTERN);
      try {
        appender = new FileAppender(layout, logfile, false);
      } catch (IOException e) {
        throw new InvalidOptionException("Could not open log file " +
                                  logfile + ": " + e.getMessage());
      }
      level = Level.DEBUG;
    } else {
      ConsoleAppender console = new ConsoleAppender(
                  new PatternLayout(CONSOLE_PATTERN));
      console.setTarget(ConsoleAppender.SYSTEM_ERR);
      console.activateOptions();
      appender = console;
      level = Level.WARN;
    }
    if (trace) {
      level = Level.TRACE;
    }
    vycLogger.addAppender(appender);
    vycLogger.setLevel(level);
    return vycLogger;
  }

  /**
   * @param level
   * @param msg
   * @return true if not already emitted
   */
  public static boolean addEmitted(Level level, String msg)
  {
    return emitted.add(Maps.immutableEntry(level, msg));
  }

  public static void uniqueWarn(String msg)
  {
    if (addEmitted(Level.WARN, msg))
      getVYCLogger().warn(msg);
    else
      getVYCLogger().debug("Duplicate Warning: " + msg);
  }
}
