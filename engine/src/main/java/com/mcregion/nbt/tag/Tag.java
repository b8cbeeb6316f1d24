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

/**
 * A decoded NBT value. The set of implementations is closed and maps one to one to {@link TagType}: switch on {@link #getType()} to
 * dispatch on the concrete class.
 */
public abstract class Tag {
  Tag() {
  }

  public abstract TagType getType();

  /**
   * Returns the value in its natural Java form: boxed primitive, String, array copy, {@link java.util.List} of tags or {@link java.util.Map}
   * of tags.
   */
  public abstract Object getValue();

  @Override
  public String toString() {
    return getType().getTagName() + "(" + getValue() + ")";
  }
}
