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
package com.mcregion.nbt.tag;

import com.mcregion.nbt.TagType;

import java.util.Arrays;

public final class IntArrayTag extends Tag {
  private final int[] value;

  /**
   * Takes ownership of the array, without copying it.
   */
  public IntArrayTag(final int[] value) {
    if (value == null)
      throw new IllegalArgumentException("Array is null");
    this.value = value;
  }

  @Override
  public TagType getType() {
    return TagType.INT_ARRAY;
  }

  public int size() {
    return value.length;
  }

  public int get(final int index) {
    return value[index];
  }

  /**
   * Returns a copy of the content.
   */
  @Override
  public int[] getValue() {
    return value.clone();
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (!(o instanceof IntArrayTag))
      return false;
    return Arrays.equals(value, ((IntArrayTag) o).value);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(value);
  }

  @Override
  public String toString() {
    return TagType.INT_ARRAY.getTagName() + "[" + value.length + "]";
  }
}
