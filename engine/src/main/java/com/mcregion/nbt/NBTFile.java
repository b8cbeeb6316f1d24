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
import com.mcregion.exception.StorageException;
import com.mcregion.log.LogManager;

import java.io.BufferedInputStream;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.zip.GZIPInputStream;

/**
 * Loader of stand-alone NBT files such as <code>level.dat</code> or player data, stored as a single gzip-framed document.
 */
public class NBTFile {
  private NBTFile() {
  }

  /**
   * Reads the given gzip-compressed file and returns its document.
   *
   * @throws StorageException                            if the file cannot be opened or read, or the gzip frame is broken
   * @throws com.mcregion.exception.CorruptNBTException if the content is not a valid NBT document
   */
  public static NBTDocument load(final Path path) {
    final int bufferSize = GlobalConfiguration.REGION_BUFFER_SIZE.getValueAsInteger();
    try (final InputStream in = new BufferedInputStream(Files.newInputStream(path), bufferSize)) {
      LogManager.instance().log(NBTFile.class, Level.FINE, "Loading NBT file %s", path);
      return load(in, true);
    } catch (final IOException e) {
      throw new StorageException("Cannot read NBT file '" + path + "'", e).addContext("path", path.toString());
    }
  }

  /**
   * Reads one document from the given stream. The stream is not closed.
   *
   * @param gzip true if the stream is gzip-framed, false if it contains the raw NBT bytes
   */
  public static NBTDocument load(final InputStream in, final boolean gzip) {
    if (!gzip)
      return new NBTReader(in).readDocument();

    // CLOSING THE GZIP STREAM RELEASES ITS INFLATER, THE CALLER'S STREAM STAYS OPEN
    final InputStream shielded = new FilterInputStream(in) {
      @Override
      public void close() {
      }
    };

    final GZIPInputStream gzipStream;
    try {
      gzipStream = new GZIPInputStream(shielded);
    } catch (final IOException e) {
      throw new StorageException("Invalid gzip header", e);
    }

    try (gzipStream) {
      return new NBTReader(gzipStream).readDocument();
    } catch (final IOException e) {
      throw new StorageException("Cannot release the gzip stream", e);
    }
  }
}
