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
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TagTest {

  @Test
  void compoundReplacementMovesTheEntryToTheEnd() {
    final CompoundTag compound = new CompoundTag().put("a", new IntTag(1)).put("b", new IntTag(2)).put("a", new IntTag(3));

    assertThat(compound.keySet()).containsExactly("b", "a");
    assertThat(compound.get("a")).isEqualTo(new IntTag(3));
    assertThat(compound.size()).isEqualTo(2);
  }

  @Test
  void compoundEqualityIsOrdered() {
    final CompoundTag ab = new CompoundTag().put("a", new IntTag(1)).put("b", new IntTag(2));
    final CompoundTag ba = new CompoundTag().put("b", new IntTag(2)).put("a", new IntTag(1));

    assertThat(ab).isNotEqualTo(ba);
    assertThat(ab).isEqualTo(new CompoundTag().put("a", new IntTag(1)).put("b", new IntTag(2)));
    assertThat(ab.hashCode()).isEqualTo(new CompoundTag().put("a", new IntTag(1)).put("b", new IntTag(2)).hashCode());
  }

  @Test
  void typedAccessors() {
    final CompoundTag compound = new CompoundTag()//
        .put("name", new StringTag("minecraft:chest"))//
        .put("items", new ListTag(TagType.COMPOUND))//
        .put("data", new CompoundTag());

    assertThat(compound.getString("name")).isEqualTo("minecraft:chest");
    assertThat(compound.getList("items").isEmpty()).isTrue();
    assertThat(compound.getCompound("data").isEmpty()).isTrue();
    assertThat(compound.getCompound("name")).isNull();
    assertThat(compound.getString("missing")).isNull();
    assertThat(compound.get("items", IntTag.class)).isNull();
  }

  @Test
  void compoundIsReadOnlyFromOutside() {
    final CompoundTag compound = new CompoundTag().put("a", new IntTag(1));

    assertThatThrownBy(() -> compound.getValue().put("b", new IntTag(2))).isInstanceOf(UnsupportedOperationException.class);
    assertThatThrownBy(() -> compound.keySet().remove("a")).isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void listRejectsOtherElementTypes() {
    final ListTag list = new ListTag(TagType.STRING).add(new StringTag("a"));

    assertThatThrownBy(() -> list.add(new IntTag(1))).isInstanceOf(IllegalArgumentException.class);
    assertThat(list.size()).isEqualTo(1);
  }

  @Test
  void emptyListsOfDifferentTypesDiffer() {
    assertThat(new ListTag(TagType.END)).isNotEqualTo(new ListTag(TagType.INT));
    assertThat(new ListTag(TagType.INT)).isEqualTo(new ListTag(TagType.INT, 10));
  }

  @Test
  void arraysTakeOwnershipButReturnCopies() {
    final int[] content = { 1, 2, 3 };
    final IntArrayTag tag = new IntArrayTag(content);

    tag.getValue()[0] = 99;
    assertThat(tag.get(0)).isEqualTo(1);
    assertThat(tag.size()).isEqualTo(3);
    assertThat(tag).isEqualTo(new IntArrayTag(new int[] { 1, 2, 3 }));
  }

  @Test
  void floatingPointEqualityIsBitwise() {
    assertThat(new DoubleTag(Double.NaN)).isEqualTo(new DoubleTag(Double.NaN));
    assertThat(new FloatTag(0.0f)).isNotEqualTo(new FloatTag(-0.0f));
  }

  @Test
  void tagNames() {
    assertThat(new IntTag(1).toString()).isEqualTo("TAG_Int(1)");
    assertThat(TagType.getById(12)).isEqualTo(TagType.LONG_ARRAY);
    assertThat(TagType.getById(13)).isNull();
    assertThat(TagType.getById(-1)).isNull();
    assertThat(EndTag.INSTANCE.getType()).isEqualTo(TagType.END);
  }
}
