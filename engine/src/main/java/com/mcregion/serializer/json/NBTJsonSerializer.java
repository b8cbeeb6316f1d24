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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.mcregion.nbt.NBTDocument;
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
import com.mcregion.nbt.tag.Tag;

import java.util.Map;

/**
 * Converts NBT documents into JSON trees.
 * <p>
 * In typed mode (the default) every value becomes <code>{"type": "TAG_Int", "value": 42}</code>, lists carry also their
 * <code>elementType</code>, so the tag distinctions survive the conversion. In plain mode values are emitted as natural JSON values:
 * convenient to inspect, but a byte and a long with the same value become indistinguishable.
 */
public class NBTJsonSerializer {
  private static final Gson PRETTY  = new GsonBuilder().setPrettyPrinting().serializeNulls().serializeSpecialFloatingPointValues().create();
  private static final Gson COMPACT = new GsonBuilder().serializeNulls().serializeSpecialFloatingPointValues().create();

  private final boolean typed;

  public NBTJsonSerializer() {
    this(true);
  }

  public NBTJsonSerializer(final boolean typed) {
    this.typed = typed;
  }

  /**
   * Returns <code>{"name": root name, "root": root compound}</code>.
   */
  public JsonObject toJSON(final NBTDocument document) {
    final JsonObject json = new JsonObject();
    json.addProperty("name", document.getName());
    json.add("root", toJSON(document.getRoot()));
    return json;
  }

  public JsonElement toJSON(final Tag tag) {
    final JsonElement value = serializeValue(tag);
    if (!typed)
      return value;

    final JsonObject json = new JsonObject();
    json.addProperty("type", tag.getType().getTagName());
    if (tag instanceof ListTag)
      json.addProperty("elementType", ((ListTag) tag).getElementType().getTagName());
    json.add("value", value);
    return json;
  }

  public String toString(final NBTDocument document, final boolean pretty) {
    return (pretty ? PRETTY : COMPACT).toJson(toJSON(document));
  }

  private JsonElement serializeValue(final Tag tag) {
    return switch (tag.getType()) {
      case END -> JsonNull.INSTANCE;
      case BYTE -> new JsonPrimitive(((ByteTag) tag).getAsByte());
      case SHORT -> new JsonPrimitive(((ShortTag) tag).getAsShort());
      case INT -> new JsonPrimitive(((IntTag) tag).getAsInt());
      case LONG -> new JsonPrimitive(((LongTag) tag).getAsLong());
      case FLOAT -> new JsonPrimitive(((FloatTag) tag).getAsFloat());
      case DOUBLE -> new JsonPrimitive(((DoubleTag) tag).getAsDouble());
      case STRING -> new JsonPrimitive(((StringTag) tag).getValue());
      case BYTE_ARRAY -> {
        final ByteArrayTag array = (ByteArrayTag) tag;
        final JsonArray json = new JsonArray(array.size());
        for (int i = 0; i < array.size(); ++i)
          json.add(array.get(i));
        yield json;
      }
      case INT_ARRAY -> {
        final IntArrayTag array = (IntArrayTag) tag;
        final JsonArray json = new JsonArray(array.size());
        for (int i = 0; i < array.size(); ++i)
          json.add(array.get(i));
        yield json;
      }
      case LONG_ARRAY -> {
        final LongArrayTag array = (LongArrayTag) tag;
        final JsonArray json = new JsonArray(array.size());
        for (int i = 0; i < array.size(); ++i)
          json.add(array.get(i));
        yield json;
      }
      case LIST -> {
        final JsonArray json = new JsonArray(((ListTag) tag).size());
        for (final Tag element : (ListTag) tag)
          json.add(toJSON(element));
        yield json;
      }
      case COMPOUND -> {
        final JsonObject json = new JsonObject();
        for (final Map.Entry<String, Tag> entry : ((CompoundTag) tag).entrySet())
          json.add(entry.getKey(), toJSON(entry.getValue()));
        yield json;
      }
    };
  }
}
