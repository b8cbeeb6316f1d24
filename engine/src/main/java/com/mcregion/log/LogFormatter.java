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

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.logging.Formatter;
import java.util.logging.LogRecord;

/**
 * Base log formatter: renders the message through {@link #customFormatMessage(LogRecord)} and appends the stack trace of the attached
 * exception, if any.
 */
public abstract class LogFormatter extends Formatter {
  protected static final String EOL = System.lineSeparator();

  @Override
  public String format(final LogRecord record) {
    if (record.getThrown() == null)
      return customFormatMessage(record);

    final StringBuilder buffer = new StringBuilder(512);
    buffer.append(customFormatMessage(record));
    buffer.append(EOL);

    final StringWriter writer = new StringWriter();
    record.getThrown().printStackTrace(new PrintWriter(writer));
    buffer.append(writer);

    return buffer.toString();
  }

  protected abstract String customFormatMessage(LogRecord record);

  protected String getSourceClassSimpleName(final String loggerName) {
    if (loggerName == null)
      return null;
    return loggerName.substring(loggerName.lastIndexOf('.') + 1);
  }
}
