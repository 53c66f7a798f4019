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
package exm.gotocc.frontend;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;

import exm.gotocc.common.Logging;

/**
 * Helper functions to augment log messages with contextual information about
 * the current source location.
 *
 */
public class LogHelper {
  static final Logger logger = Logging.getLogger();

  public static void info(LoweringContext context, String msg) {
    log(context.getLevel(), Level.INFO, context.getLocation(), msg);
  }

  public static void debug(LoweringContext context, String msg) {
    log(context.getLevel(), Level.DEBUG, context.getLocation(), msg);
  }

  public static void trace(LoweringContext context, String msg) {
    log(context.getLevel(), Level.TRACE, context.getLocation(), msg);
  }

  public static void warn(LoweringContext context, String msg) {
    log(context.getLevel(), Level.WARN, context.getLocation(), msg);
  }

  public static void log(int indent, Level level, String location,
                         String msg) {
    if (!logger.isEnabledFor(level)) {
      return;
    }
    StringBuilder sb = new StringBuilder(256);
    sb.append(location);
    sb.append(StringUtils.repeat(' ', indent * 2));
    sb.append(msg);
    logger.log(level, sb.toString());
  }

  public static boolean isTraceEnabled() {
    return logger.isTraceEnabled();
  }
}
