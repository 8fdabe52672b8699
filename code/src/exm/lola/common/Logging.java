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
package exm.lola.common;

import java.util.HashSet;
import java.util.Set;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;

import com.google.common.collect.Maps;

public class Logging
{
  private static final String LOLA_LOGGER_NAME = "exm.lola";

  /**
   * Messages already emitted.
   */
  static final Set<java.util.Map.Entry<Level, String>> emitted =
       new HashSet<java.util.Map.Entry<Level, String>>();

  public static Logger getLolaLogger()
  {
    return Logger.getLogger(LOLA_LOGGER_NAME);
  }

  /**
   * Logger for one analysis stage, a child of the main logger so that
   * configuration of "exm.lola" applies to all stages
   * @param stage
   * @return
   */
  public static Logger getStageLogger(String stage)
  {
    return Logger.getLogger(LOLA_LOGGER_NAME + "." + stage);
  }

  /**
   * Set the level of the analysis loggers.  Appenders come from the
   * log4j configuration on the classpath.
   * @param trace log every inference step
   */
  public static Logger setupLogging(boolean trace)
  {
    Logger lolaLogger = getLolaLogger();
    lolaLogger.setLevel(trace ? Level.TRACE : Level.INFO);
    return lolaLogger;
  }

  /**
   * @param level
   * @param msg
   * @return true if not already emitted
   */
  public static synchronized boolean addEmitted(Level level, String msg)
  {
    return emitted.add(Maps.immutableEntry(level, msg));
  }

  public static void uniqueWarn(String msg)
  {
    if (addEmitted(Level.WARN, msg))
      getLolaLogger().warn(msg);
    else
      getLolaLogger().debug("Duplicate Warning: " + msg);
  }
}
