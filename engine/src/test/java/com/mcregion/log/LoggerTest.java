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

import com.mcregion.region.RegionFile;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;

import static com.mcregion.TestHelper.region;
import static org.assertj.core.api.Assertions.assertThat;

class LoggerTest {
  private final List<String> messages = new ArrayList<>();
  private       boolean      flushed  = false;

  @Test
  void customLogger() {
    try {
      LogManager.instance().setLogger(new Logger() {
        @Override
        public void log(final Object requester, final Level level, final String message, final Throwable exception, final String context,
            final Object arg1, final Object arg2, final Object arg3, final Object arg4, final Object arg5) {
          messages.add(String.format(message, arg1, arg2, arg3, arg4, arg5));
        }

        @Override
        public void log(final Object requester, final Level level, final String message, final Throwable exception, final String context,
            final Object... args) {
          messages.add(String.format(message, args));
        }

        @Override
        public void flush() {
          flushed = true;
        }
      });

      LogManager.instance().log(this, Level.FINE, "This is a test");
      RegionFile.open(new ByteArrayInputStream(region().build()));

      assertThat(messages).containsExactly("This is a test", "Opened region <stream>");

      LogManager.instance().flush();
      assertThat(flushed).isTrue();
    } finally {
      LogManager.instance().setLogger(new DefaultLogger());
    }
  }

  @Test
  void varargsAreUsedBeyondFiveArguments() {
    final List<Object[]> calls = new ArrayList<>();
    try {
      LogManager.instance().setLogger(new Logger() {
        @Override
        public void log(final Object requester, final Level level, final String message, final Throwable exception, final String context,
            final Object arg1, final Object arg2, final Object arg3, final Object arg4, final Object arg5) {
          calls.add(new Object[] { arg1, arg2, arg3, arg4, arg5 });
        }

        @Override
        public void log(final Object requester, final Level level, final String message, final Throwable exception, final String context,
            final Object... args) {
          calls.add(args);
        }

        @Override
        public void flush() {
        }
      });

      LogManager.instance().log(this, Level.INFO, "%s %s %s %s %s %s", (Throwable) null, 1, 2, 3, 4, 5, 6);

      assertThat(calls).hasSize(1);
      assertThat(calls.get(0)).containsExactly(1, 2, 3, 4, 5, 6);
    } finally {
      LogManager.instance().setLogger(new DefaultLogger());
    }
  }
}
