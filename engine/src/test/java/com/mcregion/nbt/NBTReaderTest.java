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

import com.mcregion.GlobalConfiguration;
import com.mcregion.exception.CorruptNBTException;
import com.mcregion.exception.StorageException;
import com.mcregion.nbt.tag.ByteArrayTag;
import com.mcregion.nbt.tag.ByteTag;
import com.mcregion.nbt.tag.CompoundTag;
import com.mcregion.nbt.tag.DoubleTag;
import com.mcregion.nbt.tag.FloatTag;
import com.mcregion.nbt.tag.IntArrayTag;
import com.mcregion.nbt.tag.IntTag;
import com.mcregion.nbt.tag.ListTag;
import com.mcregion.nbt.tag.LongArrayTag;
import com.mcregion.nbt.tag.LongTag;
import com.mcregion.nbt.tag.ShortTag;
import com.mcregion.nbt.tag.StringTag;
import com.mcregion.serializer.BinaryInput;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.ByteArrayInputStream;

import static com.mcregion.TestHelper.emptyDocument;
import static com.mcregion.TestHelper.nbt;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NBTReaderTest {

  @AfterEach
  void resetConfiguration() {
    GlobalConfiguration.NBT_MAX_DEPTH.reset();
  }

  private static NBTDocument read(final byte[] content) {
    return new NBTReader(new ByteArrayInputStream(content)).readDocument();
  }

  @Test
  void minimalDocument() {
    final NBTDocument document = read(emptyDocument());

    assertThat(document.getName()).isEmpty();
    assertThat(document.getRoot().isEmpty()).isTrue();
    assertThat(document).isEqualTo(new NBTDocument("", new CompoundTag()));
  }

  @Test
  void decodesEveryTagType() {
    final byte[] content = nbt().named(10, "root")//
        .named(1, "byte").b(-1)//
        .named(2, "short").s(-300)//
        .named(3, "int").i(70_000)//
        .named(4, "long").l(-5_000_000_000L)//
        .named(5, "float").f(0.5f)//
        .named(6, "double").d(1e100)//
        .named(7, "bytes").i(2).b(1).b(2)//
        .named(8, "string").str("Minecraft")//
        .named(9, "list").b(3).i(2).i(10).i(20)//
        .named(10, "nested").named(8, "id").str("minecraft:stone").end()//
        .named(11, "ints").i(3).i(1).i(2).i(3)//
        .named(12, "longs").i(1).l(Long.MAX_VALUE)//
        .end().toByteArray();

    final NBTDocument document = read(content);
    final CompoundTag root = document.getRoot();

    assertThat(document.getName()).isEqualTo("root");
    assertThat(root.keySet()).containsExactly("byte", "short", "int", "long", "float", "double", "bytes", "string", "list", "nested", "ints",
        "longs");
    assertThat(root.get("byte")).isEqualTo(new ByteTag((byte) -1));
    assertThat(((ByteTag) root.get("byte")).getAsUnsignedByte()).isEqualTo(255);
    assertThat(root.get("short")).isEqualTo(new ShortTag((short) -300));
    assertThat(root.get("int")).isEqualTo(new IntTag(70_000));
    assertThat(root.get("long")).isEqualTo(new LongTag(-5_000_000_000L));
    assertThat(root.get("float")).isEqualTo(new FloatTag(0.5f));
    assertThat(root.get("double")).isEqualTo(new DoubleTag(1e100));
    assertThat(root.get("bytes")).isEqualTo(new ByteArrayTag(new byte[] { 1, 2 }));
    assertThat(root.getString("string")).isEqualTo("Minecraft");
    assertThat(root.getList("list").getElementType()).isEqualTo(TagType.INT);
    assertThat(root.getList("list").getValue()).containsExactly(new IntTag(10), new IntTag(20));
    assertThat(root.getCompound("nested").getString("id")).isEqualTo("minecraft:stone");
    assertThat(root.get("ints")).isEqualTo(new IntArrayTag(new int[] { 1, 2, 3 }));
    assertThat(root.get("longs")).isEqualTo(new LongArrayTag(new long[] { Long.MAX_VALUE }));
  }

  @Test
  void rootMustBeACompound() {
    final byte[] content = nbt().named(3, "").i(1).toByteArray();

    assertThatThrownBy(() -> read(content))
        .isInstanceOf(CorruptNBTException.class)
        .hasMessageContaining("Expected a tag compound");
  }

  @Test
  void unknownTagIdInCompoundIsRejected() {
    final byte[] content = nbt().named(10, "").named(13, "what").i(0).end().toByteArray();

    assertThatThrownBy(() -> read(content))
        .isInstanceOf(CorruptNBTException.class)
        .hasMessageContaining("13");
  }

  @ParameterizedTest
  @ValueSource(ints = { 0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12 })
  void emptyListKeepsTheDeclaredElementType(final int elementId) {
    final byte[] content = nbt().named(10, "").named(9, "empty").b(elementId).i(0).end().toByteArray();

    final ListTag list = read(content).getRoot().getList("empty");

    assertThat(list.isEmpty()).isTrue();
    assertThat(list.getElementType()).isEqualTo(TagType.getById(elementId));
  }

  @Test
  void unknownListElementTypeIsRejectedEvenWhenEmpty() {
    final byte[] content = nbt().named(10, "").named(9, "bad").b(42).i(0).end().toByteArray();

    assertThatThrownBy(() -> read(content))
        .isInstanceOf(CorruptNBTException.class)
        .hasMessageContaining("Invalid list tag id 42");
  }

  @Test
  void nonEmptyListOfEndTagsIsRejected() {
    final byte[] content = nbt().named(10, "").named(9, "ends").b(0).i(2).named(3, "after").i(5).end().toByteArray();

    assertThatThrownBy(() -> read(content))
        .isInstanceOf(CorruptNBTException.class)
        .hasMessageContaining("TAG_End");
  }

  @Test
  void hugeListOfEndTagsFailsWithoutMaterializingIt() {
    // 12 BYTES DECLARING 4 BILLION ELEMENTS WITHOUT PAYLOAD
    final byte[] content = nbt().named(10, "").named(9, "").b(0).i(0xFFFFFFFF).end().toByteArray();

    assertThatThrownBy(() -> read(content))
        .isInstanceOf(CorruptNBTException.class)
        .hasMessageContaining("4294967295");
  }

  @Test
  void nestedListsAndCompounds() {
    final byte[] content = nbt().named(10, "")//
        .named(9, "sections").b(10).i(2)//
        .named(1, "Y").b(0).end()//
        .named(1, "Y").b(1).named(9, "palette").b(9).i(1).b(8).i(1).str("air").end()//
        .end().toByteArray();

    final ListTag sections = read(content).getRoot().getList("sections");

    assertThat(sections.size()).isEqualTo(2);
    final CompoundTag second = (CompoundTag) sections.get(1);
    final ListTag inner = (ListTag) second.getList("palette").get(0);
    assertThat(inner.getElementType()).isEqualTo(TagType.STRING);
    assertThat(inner.get(0)).isEqualTo(new StringTag("air"));
  }

  @Test
  void duplicateKeyKeepsTheLastValueAtTheLastPosition() {
    final byte[] content = nbt().named(10, "")//
        .named(3, "a").i(1)//
        .named(3, "b").i(2)//
        .named(8, "a").str("again")//
        .end().toByteArray();

    final CompoundTag root = read(content).getRoot();

    assertThat(root.keySet()).containsExactly("b", "a");
    assertThat(root.get("a")).isEqualTo(new StringTag("again"));
  }

  @Test
  void decodingIsDeterministic() {
    final byte[] content = nbt().named(10, "level")//
        .named(6, "nan").d(Double.NaN)//
        .named(9, "list").b(8).i(2).str("x").str("y")//
        .named(10, "c").named(12, "l").i(2).l(1).l(2).end()//
        .end().toByteArray();

    final NBTDocument first = read(content);
    final NBTDocument second = read(content);

    assertThat(second).isEqualTo(first).isNotSameAs(first);
    assertThat(second.hashCode()).isEqualTo(first.hashCode());
  }

  @Test
  void truncatedDocumentIsAnIOError() {
    final byte[] content = nbt().named(10, "").named(3, "x").toByteArray();

    assertThatThrownBy(() -> read(content)).isInstanceOf(StorageException.class);
  }

  @Test
  void nestingBeyondTheLimitIsRejected() {
    final byte[] content = deeplyNested(10);

    assertThat(new NBTReader(new BinaryInput(new ByteArrayInputStream(content)), 11).readDocument()).isNotNull();
    assertThatThrownBy(() -> new NBTReader(new BinaryInput(new ByteArrayInputStream(content)), 10).readDocument())
        .isInstanceOf(CorruptNBTException.class)
        .hasMessageContaining("nested deeper than 10");
  }

  @Test
  void depthLimitComesFromTheConfiguration() {
    final byte[] content = deeplyNested(600);

    assertThatThrownBy(() -> read(content)).isInstanceOf(CorruptNBTException.class);

    GlobalConfiguration.NBT_MAX_DEPTH.setValue(0);
    assertThat(read(content).getRoot().contains("c")).isTrue();
  }

  /**
   * Root compound plus <code>levels</code> nested compounds, all named "c".
   */
  private static byte[] deeplyNested(final int levels) {
    final com.mcregion.TestHelper.NBTBytes bytes = nbt().named(10, "");
    for (int i = 0; i < levels; i++)
      bytes.named(10, "c");
    for (int i = 0; i < levels; i++)
      bytes.end();
    return bytes.end().toByteArray();
  }
}
