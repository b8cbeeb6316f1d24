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

import com.mcregion.nbt.tag.CompoundTag;

import java.util.Objects;

/**
 * A decoded NBT document: the name of the root tag and its compound value. Documents are owned by the caller and keep no reference to
 * the reader that produced them.
 */
public class NBTDocument {
  private final String      name;
  private final CompoundTag root;

  public NBTDocument(final String name, final CompoundTag root) {
    this.name = Objects.requireNonNull(name, "name");
    this.root = Objects.requireNonNull(root, "root");
  }

  public String getName() {
    return name;
  }

  public CompoundTag getRoot() {
    return root;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (!(o instanceof NBTDocument))
      return false;
    final NBTDocument that = (NBTDocument) o;
    return name.equals(that.name) && root.equals(that.root);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, root);
  }

  @Override
  public String toString() {
    return "NBTDocument{name='" + name + "', root=" + root + "}";
  }
}
