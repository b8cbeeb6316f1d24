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

import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Standardized error codes for MCRegion exceptions.
 * Error codes are organized in categories based on the first digit(s):
 * <ul>
 *   <li>1xxx - Configuration errors</li>
 *   <li>5xxx - Storage errors (I/O on the byte source)</li>
 *   <li>6xxx - Region container errors (header, chunk headers, chunk payloads)</li>
 *   <li>7xxx - NBT format errors</li>
 *   <li>99xxx - Internal errors</li>
 * </ul>
 *
 * @see MCRegionException
 */
public enum ErrorCode {
  // ========== Configuration Errors (1xxx) ==========
  /** Invalid configuration value */
  CONFIGURATION_ERROR(1001, "Configuration error"),

  // ========== Storage Errors (5xxx) ==========
  /** The byte source could not supply the requested bytes, or the file could not be opened */
  IO_ERROR(5001, "I/O error"),

  // ========== Region Errors (6xxx) ==========
  /** The region container itself is structurally invalid */
  CORRUPT_REGION(6001, "Corrupt region"),

  /** A single chunk of an otherwise readable region could not be decompressed or decoded */
  CORRUPT_CHUNK(6002, "Corrupt chunk"),

  // ========== NBT Errors (7xxx) ==========
  /** The NBT byte stream violates the tag format */
  CORRUPT_NBT(7001, "Corrupt NBT"),

  // ========== General Errors (99xxx) ==========
  /** Unexpected internal error (should not normally occur) */
  INTERNAL_ERROR(99999, "Internal error");

  private static final Map<Integer, ErrorCode> CODE_MAP = Stream.of(values())
      .collect(Collectors.toUnmodifiableMap(ErrorCode::getCode, e -> e));

  private final int    code;
  private final String defaultMessage;

  ErrorCode(final int code, final String defaultMessage) {
    this.code = code;
    this.defaultMessage = defaultMessage;
  }

  public int getCode() {
    return code;
  }

  public String getDefaultMessage() {
    return defaultMessage;
  }

  /**
   * Returns the error category based on the error code range.
   */
  public String getCategory() {
    return switch (code / 1000) {
      case 1 -> "Configuration";
      case 5 -> "Storage";
      case 6 -> "Region";
      case 7 -> "NBT";
      case 99 -> "Internal";
      default -> "Unknown";
    };
  }

  /**
   * Finds an ErrorCode by its numeric code.
   *
   * @return the matching ErrorCode, or INTERNAL_ERROR if not found
   */
  public static ErrorCode fromCode(final int code) {
    return CODE_MAP.getOrDefault(code, INTERNAL_ERROR);
  }

  @Override
  public String toString() {
    return String.format("%s(%d): %s", name(), code, defaultMessage);
  }
}
