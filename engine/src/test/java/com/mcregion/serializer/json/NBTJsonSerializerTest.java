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
package com.mcregion.serializer.json;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.mcregion.nbt.NBTDocument;
import com.mcregion.nbt.NBTReader;
import com.mcregion.nbt.TagType;
import com.mcregion.nbt.tag.ByteTag;
import com.mcregion.nbt.tag.CompoundTag;
import com.mcregion.nbt.tag.DoubleTag;
import com.mcregion.nbt.tag.EndTag;
import com.mcregion.nbt.tag.IntTag;
import com.mcregion.nbt.tag.ListTag;
import com.mcregion.nbt.tag.LongArrayTag;
import com.mcregion.nbt.tag.StringTag;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.util.ArrayList;
import java.util.List;

import static com.mcregion.TestHelper.chunkDocument;
import static com.mcregion.TestHelper.nbt;
import static org.assertj.core.api.Assertions.assertThat;

class NBTJsonSerializerTest {

  @Test
  void typedDocument() {
    final NBTDocument document = new NBTReader(new ByteArrayInputStream(chunkDocument(5, -2))).readDocument();

    final JsonObject json = new NBTJsonSerializer().toJSON(document);

    assertThat(json.get("name").getAsString()).isEqualTo("Chunk");
    final JsonObject root = json.getAsJsonObject("root");
    assertThat(root.get("type").getAsString()).isEqualTo("TAG_Compound");

    final JsonObject value = root.getAsJsonObject("value");
    assertThat(value.keySet()).containsExactly("x", "z", "status");
    assertThat(value.getAsJsonObject("x").get("type").getAsString()).isEqualTo("TAG_Int");
    assertThat(value.getAsJsonObject("z").get("value").getAsInt()).isEqualTo(-2);
    assertThat(value.getAsJsonObject("status").get("value").getAsString()).isEqualTo("full");
  }

  @Test
  void typedListCarriesTheElementType() {
    final ListTag list = new ListTag(TagType.BYTE).add(new ByteTag((byte) 1)).add(new ByteTag((byte) -1));

    final JsonObject json = new NBTJsonSerializer().toJSON(list).getAsJsonObject();

    assertThat(json.get("type").getAsString()).isEqualTo("TAG_List");
    assertThat(json.get("elementType").getAsString()).isEqualTo("TAG_Byte");
    final JsonArray values = json.getAsJsonArray("value");
    assertThat(values.size()).isEqualTo(2);
    assertThat(values.get(1).getAsJsonObject().get("value").getAsByte()).isEqualTo((byte) -1);
  }

  @Test
  void plainMode() {
    final CompoundTag root = new CompoundTag()//
        .put("name", new StringTag("Steve"))//
        .put("health", new DoubleTag(20.0))//
        .put("pos", new ListTag(TagType.INT).add(new IntTag(1)).add(new IntTag(64)))//
        .put("states", new LongArrayTag(new long[] { 7L, Long.MIN_VALUE }));

    final JsonElement json = new NBTJsonSerializer(false).toJSON(root);

    final JsonObject object = json.getAsJsonObject();
    assertThat(object.get("name").getAsString()).isEqualTo("Steve");
    assertThat(object.get("health").getAsDouble()).isEqualTo(20.0);
    assertThat(object.getAsJsonArray("pos").get(1).getAsInt()).isEqualTo(64);
    assertThat(object.getAsJsonArray("states").get(1).getAsLong()).isEqualTo(Long.MIN_VALUE);
  }

  @Test
  void toStringParsesBack() {
    final NBTDocument document = new NBTDocument("level", new CompoundTag().put("nan", new DoubleTag(Double.NaN)).put("i", new IntTag(3)));
    final NBTJsonSerializer serializer = new NBTJsonSerializer(false);

    final String compact = serializer.toString(document, false);
    final String pretty = serializer.toString(document, true);

    assertThat(compact).doesNotContain("\n").contains("NaN");
    assertThat(pretty).contains("\n");
    final JsonObject parsed = JsonParser.parseString(compact).getAsJsonObject();
    assertThat(parsed.get("name").getAsString()).isEqualTo("level");
    assertThat(parsed.getAsJsonObject("root").get("i").getAsInt()).isEqualTo(3);
  }

  @Test
  void everyTagTypeIsSerialized() {
    final NBTDocument document = new NBTReader(new ByteArrayInputStream(nbt().named(10, "")//
        .named(1, "b").b(-1)//
        .named(2, "s").s(2)//
        .named(3, "i").i(3)//
        .named(4, "l").l(4)//
        .named(5, "f").f(0.5f)//
        .named(6, "d").d(0.25)//
        .named(7, "ba").i(2).b(1).b(2)//
        .named(8, "str").str("x")//
        .named(9, "list").b(0).i(0)//
        .named(10, "c").end()//
        .named(11, "ia").i(1).i(9)//
        .named(12, "la").i(1).l(10)//
        .end().toByteArray())).readDocument();

    final JsonObject typed = new NBTJsonSerializer().toJSON(document).getAsJsonObject("root").getAsJsonObject("value");
    final JsonObject plain = new NBTJsonSerializer(false).toJSON(document).getAsJsonObject("root");

    final List<String> types = new ArrayList<>();
    for (final String key : typed.keySet())
      types.add(typed.getAsJsonObject(key).get("type").getAsString());
    assertThat(types).containsExactly("TAG_Byte", "TAG_Short", "TAG_Int", "TAG_Long", "TAG_Float", "TAG_Double", "TAG_Byte_Array", "TAG_String",
        "TAG_List", "TAG_Compound", "TAG_Int_Array", "TAG_Long_Array");
    assertThat(typed.getAsJsonObject("list").get("elementType").getAsString()).isEqualTo("TAG_End");
    assertThat(plain.get("b").getAsByte()).isEqualTo((byte) -1);
    assertThat(plain.getAsJsonArray("ba").get(1).getAsInt()).isEqualTo(2);
    assertThat(plain.getAsJsonArray("ia").get(0).getAsInt()).isEqualTo(9);
    assertThat(plain.getAsJsonArray("la").get(0).getAsLong()).isEqualTo(10L);
    assertThat(plain.getAsJsonObject("c").size()).isZero();
    assertThat(new NBTJsonSerializer(false).toJSON(EndTag.INSTANCE).isJsonNull()).isTrue();
  }
}
