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
 * One chunk of a region could not be decompressed or its NBT payload could not be decoded. The cause holds the decompressor or parser
 * failure; the context holds the chunk coordinates.
 */
public class CorruptChunkException extends CorruptionException {
  public CorruptChunkException(final String message, final Throwable cause) {
    super(ErrorCode.CORRUPT_CHUNK, message, cause);
  }

  @Override
  public CorruptChunkException addContext(final String key, final Object value) {
    super.addContext(key, value);
    return this;
  }
}
