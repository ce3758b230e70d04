/*
Copyright 2013 Luke Blanshard

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

     http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/
package us.blanshard.crossword.cli;

import static java.util.logging.Level.WARNING;

import com.google.common.io.Closeables;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Static methods shared by the command-line tools.
 */
class Tools {
  private static final Logger logger = Logger.getLogger(Tools.class.getName());

  /** Where the tools look for their logging setup on the classpath. */
  static final String LOGGING_PROPERTIES = "/logging.properties";

  /**
   * Replaces the JDK's default logging setup with the one bundled with the
   * tools, if it can be found.
   */
  static void configureLogging() {
    InputStream in = Tools.class.getResourceAsStream(LOGGING_PROPERTIES);
    if (in == null) return;
    try {
      LogManager.getLogManager().readConfiguration(in);
    } catch (IOException e) {
      logger.log(WARNING, "Unable to read " + LOGGING_PROPERTIES, e);
    } finally {
      Closeables.closeQuietly(in);
    }
  }
}
