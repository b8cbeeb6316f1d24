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
package com.mcregion.nbt;

/**
 * Tag ids of the NBT format. The id is the first byte of every named tag and of every list header.
 */
public enum TagType {
  END(0, "TAG_End"),
  BYTE(1, "TAG_Byte"),
  SHORT(2, "TAG_Short"),
  INT(3, "TAG_Int"),
  LONG(4, "TAG_Long"),
  FLOAT(5, "TAG_Float"),
  DOUBLE(6, "TAG_Double"),
  BYTE_ARRAY(7, "TAG_Byte_Array"),
  STRING(8, "TAG_String"),
  LIST(9, "TAG_List"),
  COMPOUND(10, "TAG_Compound"),
  INT_ARRAY(11, "TAG_Int_Array"),
  LONG_ARRAY(12, "TAG_Long_Array");

  private static final TagType[] BY_ID = new TagType[13];

  static {
    for (final TagType t : values())
      BY_ID[t.id] = t;
  }

  private final int    id;
  private final String tagName;

  TagType(final int id, final String tagName) {
    this.id = id;
    this.tagName = tagName;
  }

  public int getId() {
    return id;
  }

  public String getTagName() {
    return tagName;
  }

  /**
   * Returns the type with the given id, or null if the id is not part of the format.
   */
  public static TagType getById(final int id) {
    return id >= 0 && id < BY_ID.length ? BY_ID[id] : null;
  }
}
