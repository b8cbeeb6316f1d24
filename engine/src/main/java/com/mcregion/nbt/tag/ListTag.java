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
import java.util.Iterator;
import java.util.List;

/**
 * Homogeneous sequence of tags. The element type is declared when the list is created and is fixed for its whole life, also when the
 * list is empty: an empty list declared as {@link TagType#END} and one declared as {@link TagType#INT} are different values.
 */
public final class ListTag extends Tag implements Iterable<Tag> {
  private final TagType   elementType;
  private final List<Tag> elements;

  public ListTag(final TagType elementType) {
    this(elementType, 0);
  }

  public ListTag(final TagType elementType, final int expectedSize) {
    if (elementType == null)
      throw new IllegalArgumentException("Element type is null");
    this.elementType = elementType;
    this.elements = new ArrayList<>(expectedSize);
  }

  @Override
  public TagType getType() {
    return TagType.LIST;
  }

  public TagType getElementType() {
    return elementType;
  }

  /**
   * Appends an element.
   *
   * @throws IllegalArgumentException if the element type differs from the declared one
   */
  public ListTag add(final Tag element) {
    if (element == null || element.getType() != elementType)
      throw new IllegalArgumentException(
          "Cannot add " + (element != null ? element.getType() : null) + " to a list of " + elementType);
    elements.add(element);
    return this;
  }

  public Tag get(final int index) {
    return elements.get(index);
  }

  public int size() {
    return elements.size();
  }

  public boolean isEmpty() {
    return elements.isEmpty();
  }

  @Override
  public Iterator<Tag> iterator() {
    return Collections.unmodifiableList(elements).iterator();
  }

  @Override
  public List<Tag> getValue() {
    return Collections.unmodifiableList(elements);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (!(o instanceof ListTag))
      return false;
    final ListTag other = (ListTag) o;
    return elementType == other.elementType && elements.equals(other.elements);
  }

  @Override
  public int hashCode() {
    return 31 * elementType.hashCode() + elements.hashCode();
  }

  @Override
  public String toString() {
    return TagType.LIST.getTagName() + "<" + elementType.getTagName() + ">" + elements;
  }
}
