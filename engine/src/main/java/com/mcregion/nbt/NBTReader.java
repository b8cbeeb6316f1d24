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
import com.mcregion.nbt.tag.ByteArrayTag;
import com.mcregion.nbt.tag.ByteTag;
import com.mcregion.nbt.tag.CompoundTag;
import com.mcregion.nbt.tag.DoubleTag;
import com.mcregion.nbt.tag.EndTag;
import com.mcregion.nbt.tag.FloatTag;
import com.mcregion.nbt.tag.IntArrayTag;
import com.mcregion.nbt.tag.IntTag;
import com.mcregion.nbt.tag.ListTag;
import com.mcregion.nbt.tag.LongArrayTag;
import com.mcregion.nbt.tag.LongTag;
import com.mcregion.nbt.tag.ShortTag;
import com.mcregion.nbt.tag.StringTag;
import com.mcregion.nbt.tag.Tag;
import com.mcregion.serializer.BinaryInput;

import java.io.InputStream;

/**
 * Recursive descent decoder of the Named Binary Tag format.
 * <p>
 * A document is a named compound: <code>[10][u16 name length][name][entries...][0]</code>, where every entry is
 * <code>[tag id][u16 name length][name][payload]</code>. A list payload is <code>[element tag id][u32 count][payloads...]</code>.
 * All the numbers are big-endian.
 * <p>
 * The reader is not thread safe. Decoding different documents in parallel requires one reader per document.
 */
public class NBTReader {
  private final BinaryInput input;
  private final int         maxDepth;
  private       int         depth;

  public NBTReader(final InputStream source) {
    this(new BinaryInput(source));
  }

  public NBTReader(final BinaryInput input) {
    this(input, GlobalConfiguration.NBT_MAX_DEPTH.getValueAsInteger());
  }

  /**
   * @param maxDepth maximum nesting of lists and compounds, 0 or negative means unlimited
   */
  public NBTReader(final BinaryInput input, final int maxDepth) {
    this.input = input;
    this.maxDepth = maxDepth;
  }

  /**
   * Reads a whole document. The outer tag must be a compound.
   */
  public NBTDocument readDocument() {
    final int tagId = input.readUnsignedByte();
    if (tagId != TagType.COMPOUND.getId())
      throw new CorruptNBTException("Expected a tag compound, found tag id " + tagId).addContext("position", input.position() - 1);

    final String name = input.readString();
    return new NBTDocument(name, readCompound());
  }

  /**
   * Reads the entries of a compound up to and including the terminating end tag.
   */
  public CompoundTag readCompound() {
    enter();
    try {
      final CompoundTag compound = new CompoundTag();
      while (true) {
        final int tagId = input.readUnsignedByte();
        if (tagId == TagType.END.getId())
          break;

        final TagType type = TagType.getById(tagId);
        if (type == null)
          throw new CorruptNBTException("Invalid tag id " + tagId + " in compound").addContext("position", input.position() - 1);

        final String name = input.readString();
        compound.put(name, readPayload(type));
      }
      return compound;
    } finally {
      depth--;
    }
  }

  /**
   * Reads a list header and its elements. The element type is validated before reading the count, also when the list is empty.
   */
  public ListTag readList() {
    enter();
    try {
      final int elementId = input.readUnsignedByte();
      final TagType elementType = TagType.getById(elementId);
      if (elementType == null)
        throw new CorruptNBTException("Invalid list tag id " + elementId).addContext("position", input.position() - 1);

      final long count = input.readUnsignedInt();
      // END ELEMENTS HAVE NO PAYLOAD: NOTHING IN THE SOURCE BOUNDS THEIR COUNT
      if (elementType == TagType.END && count > 0)
        throw new CorruptNBTException("List of " + TagType.END.getTagName() + " cannot have " + count + " elements").addContext("position",
            input.position() - BinaryInput.INT_SERIALIZED_SIZE);

      // THE COUNT IS UNTRUSTED: DO NOT PRE-ALLOCATE MORE THAN A REASONABLE AMOUNT
      final ListTag list = new ListTag(elementType, (int) Math.min(count, 1024));
      for (long i = 0; i < count; ++i)
        list.add(readPayload(elementType));
      return list;
    } finally {
      depth--;
    }
  }

  public BinaryInput getInput() {
    return input;
  }

  private Tag readPayload(final TagType type) {
    return switch (type) {
      case END -> EndTag.INSTANCE;
      case BYTE -> new ByteTag(input.readByte());
      case SHORT -> new ShortTag(input.readShort());
      case INT -> new IntTag(input.readInt());
      case LONG -> new LongTag(input.readLong());
      case FLOAT -> new FloatTag(input.readFloat());
      case DOUBLE -> new DoubleTag(input.readDouble());
      case BYTE_ARRAY -> new ByteArrayTag(input.readByteArray());
      case STRING -> new StringTag(input.readString());
      case LIST -> readList();
      case COMPOUND -> readCompound();
      case INT_ARRAY -> new IntArrayTag(input.readIntArray());
      case LONG_ARRAY -> new LongArrayTag(input.readLongArray());
    };
  }

  private void enter() {
    if (maxDepth > 0 && depth >= maxDepth)
      throw new CorruptNBTException("NBT document is nested deeper than " + maxDepth + " levels").addContext("position", input.position());
    depth++;
  }
}
