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

public final class FloatTag extends Tag {
  private final float value;

  public FloatTag(final float value) {
    this.value = value;
  }

  @Override
  public TagType getType() {
    return TagType.FLOAT;
  }

  public float getAsFloat() {
    return value;
  }

  @Override
  public Float getValue() {
    return value;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (!(o instanceof FloatTag))
      return false;
    return Float.compare(value, ((FloatTag) o).value) == 0;
  }

  @Override
  public int hashCode() {
    return Float.hashCode(value);
  }
}
