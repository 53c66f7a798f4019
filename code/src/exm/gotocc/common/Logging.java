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
package exm.gotocc.common;

import java.io.IOException;

import org.apache.log4j.FileAppender;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import exm.gotocc.common.exceptions.GotoCCRuntimeError;
import exm.gotocc.common.exceptions.InvalidOptionException;

public class Logging {
  private static final String GOTOCC_LOGGER_NAME = "exm.gotocc";

  private static final String LOG_PATTERN = "%-5p %m%n";

  public static Logger getLogger() {
    return Logger.getLogger(GOTOCC_LOGGER_NAME);
  }

  /**
   * Configure the gotocc logger.
   * @param logfile if non-empty, append log output to this file
   * @param trace if true, log at TRACE level, otherwise DEBUG when a
   *              log file is given and WARN when not
   * @return the configured logger
   */
  public static Logger setupLogging(String logfile, boolean trace) {
    Logger logger = getLogger();
    if (logfile != null && logfile.length() > 0) {
      try {
        FileAppender appender = new FileAppender(new PatternLayout(LOG_PATTERN),
                                                 logfile, false);
        logger.addAppender(appender);
      } catch (IOException e) {
        throw new GotoCCRuntimeError("Could not open log file " + logfile, e);
      }
      logger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    } else {
      logger.setLevel(trace ? Level.TRACE : Level.WARN);
    }
    return logger;
  }

  /**
   * Configure logging from {@link Settings#LOG_FILE} and
   * {@link Settings#LOG_TRACE}
   * @throws InvalidOptionException
   */
  public static Logger setupLogging() throws InvalidOptionException {
    return setupLogging(Settings.get(Settings.LOG_FILE),
                        Settings.getBoolean(Settings.LOG_TRACE));
  }
}
