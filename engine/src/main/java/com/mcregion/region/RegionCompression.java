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
package com.mcregion.region;

import com.mcregion.GlobalConfiguration;
import net.jpountz.lz4.LZ4BlockInputStream;

import java.io.IOException;
import java.io.InputStream;
import java.util.zip.GZIPInputStream;
import java.util.zip.InflaterInputStream;

/**
 * Compression types of the chunk payloads, identified by the byte that follows the chunk length.
 */
public enum RegionCompression {
  GZIP(1, false) {
    @Override
    public InputStream decompress(final InputStream compressed) throws IOException {
      return new GZIPInputStream(compressed);
    }
  },

  ZLIB(2, false) {
    @Override
    public InputStream decompress(final InputStream compressed) {
      return new InflaterInputStream(compressed);
    }
  },

  NONE(3, true) {
    @Override
    public InputStream decompress(final InputStream compressed) {
      return compressed;
    }
  },

  LZ4(4, true) {
    @Override
    public InputStream decompress(final InputStream compressed) {
      return new LZ4BlockInputStream(compressed);
    }
  };

  private final int     id;
  private final boolean extended;

  RegionCompression(final int id, final boolean extended) {
    this.id = id;
    this.extended = extended;
  }

  /**
   * Wraps the compressed bytes in a stream that returns the decompressed ones.
   *
   * @throws IOException if the stream header is invalid
   */
  public abstract InputStream decompress(InputStream compressed) throws IOException;

  public int getId() {
    return id;
  }

  /**
   * Tells if the type belongs to the extended set, accepted only when {@link GlobalConfiguration#REGION_EXTENDED_COMPRESSION} is on.
   */
  public boolean isExtended() {
    return extended;
  }

  /**
   * Returns the compression type for the given id, or null if the id is not supported.
   *
   * @param extendedAllowed true to accept also the extended types
   */
  public static RegionCompression getById(final int id, final boolean extendedAllowed) {
    for (final RegionCompression c : values())
      if (c.id == id)
        return !c.extended || extendedAllowed ? c : null;
    return null;
  }
}
