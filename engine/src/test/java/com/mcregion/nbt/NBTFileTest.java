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

import com.mcregion.exception.CorruptNBTException;
import com.mcregion.exception.ErrorCode;
import com.mcregion.exception.StorageException;
import com.mcregion.nbt.tag.IntTag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.mcregion.TestHelper.chunkDocument;
import static com.mcregion.TestHelper.gzip;
import static com.mcregion.TestHelper.nbt;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NBTFileTest {

  @TempDir
  Path folder;

  @Test
  void loadGzipFile() throws IOException {
    final Path file = folder.resolve("level.dat");
    Files.write(file, gzip(chunkDocument(3, -7)));

    final NBTDocument document = NBTFile.load(file);

    assertThat(document.getName()).isEqualTo("Chunk");
    assertThat(document.getRoot().get("x")).isEqualTo(new IntTag(3));
    assertThat(document.getRoot().get("z")).isEqualTo(new IntTag(-7));
    assertThat(document.getRoot().getString("status")).isEqualTo("full");
  }

  @Test
  void missingFileIsAnIOError() {
    final Path file = folder.resolve("missing.dat");

    assertThatThrownBy(() -> NBTFile.load(file))
        .isInstanceOf(StorageException.class)
        .hasMessageContaining("missing.dat")
        .satisfies(e -> assertThat(((StorageException) e).getErrorCode()).isEqualTo(ErrorCode.IO_ERROR));
  }

  @Test
  void loadUncompressedStream() {
    final NBTDocument document = NBTFile.load(new ByteArrayInputStream(chunkDocument(1, 2)), false);

    assertThat(document.getRoot().size()).isEqualTo(3);
  }

  @Test
  void gzipStreamOfTheCallerIsNotClosed() {
    final AtomicBoolean closed = new AtomicBoolean();
    final InputStream in = new ByteArrayInputStream(gzip(chunkDocument(4, 4))) {
      @Override
      public void close() throws IOException {
        closed.set(true);
        super.close();
      }
    };

    final NBTDocument document = NBTFile.load(in, true);

    assertThat(document.getRoot().get("x")).isEqualTo(new IntTag(4));
    assertThat(closed.get()).isFalse();
  }

  @Test
  void brokenGzipHeader() {
    // RAW NBT IS NOT GZIP-FRAMED
    final byte[] content = chunkDocument(0, 0);

    assertThatThrownBy(() -> NBTFile.load(new ByteArrayInputStream(content), true))
        .isInstanceOf(StorageException.class)
        .hasMessageContaining("gzip");
  }

  @Test
  void gzipFileWithInvalidDocument() throws IOException {
    final Path file = folder.resolve("player.dat");
    Files.write(file, gzip(nbt().named(8, "").str("not a compound").toByteArray()));

    assertThatThrownBy(() -> NBTFile.load(file)).isInstanceOf(CorruptNBTException.class);
  }
}
