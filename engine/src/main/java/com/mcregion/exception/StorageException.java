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
 * Exception thrown when the byte source cannot supply the requested bytes: the file cannot be opened, the stream ends early or the
 * underlying read fails.
 * <p>
 * Example usage:
 * <pre>{@code
 * try {
 *     stream.readNBytes(buffer, 0, length);
 * } catch (IOException e) {
 *     throw new StorageException("Failed to read file", e)
 *         .addContext("requested", length);
 * }
 * }</pre>
 */
public class StorageException extends MCRegionException {
  public StorageException(final String message) {
    super(ErrorCode.IO_ERROR, message);
  }

  public StorageException(final String message, final Throwable cause) {
    super(ErrorCode.IO_ERROR, message, cause);
  }

  @Override
  public StorageException addContext(final String key, final Object value) {
    super.addContext(key, value);
    return this;
  }
}
