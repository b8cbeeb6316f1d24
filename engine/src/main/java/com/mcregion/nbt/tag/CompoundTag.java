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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ordered mapping of names to tags. Iteration follows the insertion order. Putting a name that is already present replaces the previous
 * value and moves the entry to the end, as if the old entry never existed.
 */
public final class CompoundTag extends Tag {
  private final LinkedHashMap<String, Tag> entries = new LinkedHashMap<>();

  @Override
  public TagType getType() {
    return TagType.COMPOUND;
  }

  public CompoundTag put(final String name, final Tag value) {
    if (name == null || value == null)
      throw new IllegalArgumentException("Name and value of a compound entry cannot be null");

    entries.remove(name);
    entries.put(name, value);
    return this;
  }

  public Tag get(final String name) {
    return entries.get(name);
  }

  public boolean contains(final String name) {
    return entries.containsKey(name);
  }

  public int size() {
    return entries.size();
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  public Set<String> keySet() {
    return Collections.unmodifiableSet(entries.keySet());
  }

  public Set<Map.Entry<String, Tag>> entrySet() {
    return Collections.unmodifiableMap(entries).entrySet();
  }

  public CompoundTag getCompound(final String name) {
    return get(name, CompoundTag.class);
  }

  public ListTag getList(final String name) {
    return get(name, ListTag.class);
  }

  public String getString(final String name) {
    final StringTag tag = get(name, StringTag.class);
    return tag != null ? tag.getValue() : null;
  }

  /**
   * Returns the value with the given name if present and of the requested class, otherwise null.
   */
  public <T extends Tag> T get(final String name, final Class<T> type) {
    final Tag tag = entries.get(name);
    return type.isInstance(tag) ? type.cast(tag) : null;
  }

  @Override
  public Map<String, Tag> getValue() {
    return Collections.unmodifiableMap(entries);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (!(o instanceof CompoundTag))
      return false;

    // THE ORDER IS PART OF THE VALUE
    final List<Map.Entry<String, Tag>> mine = new ArrayList<>(entries.entrySet());
    final List<Map.Entry<String, Tag>> theirs = new ArrayList<>(((CompoundTag) o).entries.entrySet());
    return mine.equals(theirs);
  }

  @Override
  public int hashCode() {
    int hash = 1;
    for (final Map.Entry<String, Tag> entry : entries.entrySet())
      hash = 31 * hash + entry.hashCode();
    return hash;
  }

  @Override
  public String toString() {
    return TagType.COMPOUND.getTagName() + entries;
  }
}
