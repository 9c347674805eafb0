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

package exm.dec.common;

import java.io.IOException;
import java.util.HashSet;
import java.util.Set;

import org.apache.log4j.ConsoleAppender;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import exm.dec.common.exceptions.DECRuntimeError;
import exm.dec.common.exceptions.InvalidOptionException;

public class Logging
{
  private static final String DEC_LOGGER_NAME = "exm.dec";

  private static final String LOG_PATTERN = "%-5p %c{1} - %m%n";

  /**
   * Messages already emitted, keyed by level and message.
   */
  static final Set<String> emitted = new HashSet<String>();

  public static Logger getDECLogger()
  {
    return Logger.getLogger(DEC_LOGGER_NAME);
  }

  /**
   * Set up logging from the current settings
   * @throws InvalidOptionException
   */
  public static Logger setupLogging() throws InvalidOptionException
  {
    return setupLogging(Settings.get(Settings.LOG_FILE),
                        Settings.getBoolean(Settings.LOG_TRACE));
  }

  /**
   * Configure the DEC logger.  Warnings always go to the console; if a
   * log file is given, everything at the chosen level goes there.
   * @param logfile file to log to, or null/empty for no log file
   * @param trace if true, log at TRACE level, otherwise DEBUG to the file
   */
  public static Logger setupLogging(String logfile, boolean trace)
  {
    Logger decLogger = getDECLogger();
    decLogger.removeAllAppenders();
    decLogger.setAdditivity(false);

    ConsoleAppender console = new ConsoleAppender(
                          new PatternLayout(LOG_PATTERN));
    console.setThreshold(Level.WARN);
    decLogger.addAppender(console);

    if (logfile != null && logfile.length() > 0) {
      try {
        FileAppender file = new FileAppender(
                      new PatternLayout(LOG_PATTERN), logfile, false);
        decLogger.addAppender(file);
      } catch (IOException e) {
        throw new DECRuntimeError("Could not open log file: " + logfile, e);
      }
      decLogger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    } else {
      decLogger.setLevel(trace ? Level.TRACE : Level.WARN);
    }
    // Even if logging is disabled, this must be valid:
    return decLogger;
  }

  /**
   * @param level
   * @param msg
   * @return true if not already emitted
   */
  public static boolean addEmitted(Level level, String msg)
  {
    return emitted.add(level + ":" + msg);
  }

  public static void uniqueWarn(String msg)
  {
    if (addEmitted(Level.WARN, msg)) {
      getDECLogger().warn(msg);
    } else {
      getDECLogger().debug("Duplicate Warning: " + msg);
    }
  }
}
