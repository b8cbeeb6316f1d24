/*
 * Copyright © 2021-present Arcade Data Ltd (info@arcadedata.com)
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
 * limitations under the License.
 *
 * SPDX-FileCopyrightText: 2021-present Arcade Data Ltd (info@arcadedata.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.mcregion.log;

import java.text.SimpleDateFormat;
import java.util.IllegalFormatException;
import java.util.logging.Level;
import java.util.logging.LogRecord;

/**
 * Log formatter that uses ANSI code if they are available and enabled.
 */
public class AnsiLogFormatter extends LogFormatter {
  private static final String  RESET  = "\u001B[0m";
  private static final String  RED    = "\u001B[31m";
  private static final String  GREEN  = "\u001B[32m";
  private static final String  YELLOW = "\u001B[33m";
  private static final String  CYAN   = "\u001B[36m";
  private static final String  WHITE  = "\u001B[37m";
  private static final boolean SUPPORTS_COLORS;

  static {
    final String os = System.getProperty("os.name", "");
    SUPPORTS_COLORS = System.console() != null && !os.toLowerCase().contains("win");
  }

  private final SimpleDateFormat dateFormat = new SimpleDateFormat("yyyy-MM-dd HH:mm:ss.SSS");

  public static boolean supportsColors() {
    return SUPPORTS_COLORS;
  }

  @Override
  protected String customFormatMessage(final LogRecord record) {
    final Level level = record.getLevel();
    final String message = record.getMessage();
    final Object[] additionalArgs = record.getParameters();
    final String requester = getSourceClassSimpleName(record.getLoggerName());

    final StringBuilder buffer = new StringBuilder(512);
    buffer.append(EOL);

    if (SUPPORTS_COLORS)
      buffer.append(CYAN);
    synchronized (dateFormat) {
      buffer.append(dateFormat.format(record.getMillis()));
    }

    if (SUPPORTS_COLORS) {
      if (level == Level.SEVERE)
        buffer.append(RED);
      else if (level == Level.WARNING)
        buffer.append(YELLOW);
      else if (level == Level.INFO)
        buffer.append(GREEN);
      else
        buffer.append(WHITE);
    }

    buffer.append(String.format(" %-5.5s ", level.getName()));
    if (SUPPORTS_COLORS)
      buffer.append(RESET);

    if (requester != null) {
      buffer.append('[');
      buffer.append(requester);
      buffer.append("] ");
    }

    try {
      if (additionalArgs != null)
        buffer.append(String.format(message, additionalArgs));
      else
        buffer.append(message);
    } catch (final IllegalFormatException ignore) {
      buffer.append(message);
    }

    return buffer.toString();
  }
}
