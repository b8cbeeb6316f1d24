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
package com.mcregion.exception;

/**
 * The NBT byte stream violates the tag format: the root tag is not a compound, an unknown tag id appears, a length prefix cannot be
 * materialized or the nesting is deeper than the configured limit.
 */
public class CorruptNBTException extends CorruptionException {
  public CorruptNBTException(final String message) {
    super(ErrorCode.CORRUPT_NBT, message);
  }

  @Override
  public CorruptNBTException addContext(final String key, final Object value) {
    super.addContext(key, value);
    return this;
  }
}
