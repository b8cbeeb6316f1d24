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
import com.mcregion.exception.CorruptChunkException;
import com.mcregion.exception.CorruptRegionException;
import com.mcregion.exception.MCRegionException;
import com.mcregion.exception.StorageException;
import com.mcregion.log.LogManager;
import com.mcregion.nbt.NBTDocument;
import com.mcregion.nbt.NBTReader;
import com.mcregion.serializer.BinaryInput;

import java.io.BufferedInputStream;
import java.io.ByteArrayInputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;

/**
 * Reader of region containers: up to 1024 chunks, each one an independently compressed NBT document, behind a sector-offset index.
 * <p>
 * Layout:
 * <ul>
 *   <li>bytes 0-4095: 1024 big-endian location words, upper 24 bits = offset in 4 KiB sectors from the start of the file, lower 8 bits =
 *   number of sectors (informational)</li>
 *   <li>bytes 4096-8191: 1024 big-endian signed timestamps</li>
 *   <li>then the chunks, each one starting at its sector with a big-endian u32 length (compression byte included), the compression byte
 *   and length-1 bytes of compressed NBT</li>
 * </ul>
 * The slot of a chunk is <code>(x mod 32) + (z mod 32) * 32</code>.
 * <p>
 * Opening reads only the two header tables. The rest of the file (the body) is read in memory at the first chunk load, once. After that
 * the body is immutable and chunks can be loaded from multiple threads.
 */
public class RegionFile implements Closeable {
  public static final int SECTOR_SIZE       = 4096;
  public static final int CHUNKS_PER_SIDE   = 32;
  public static final int SLOTS             = CHUNKS_PER_SIDE * CHUNKS_PER_SIDE;
  public static final int HEADER_SIZE       = 2 * SECTOR_SIZE;
  public static final int CHUNK_HEADER_SIZE = 5;

  private final    String        name;
  private final    InputStream   source;
  private final    boolean       ownsSource;
  private final    int[]         locations;
  private final    int[]         timestamps;
  private final    boolean       extendedCompression;
  private final    ReentrantLock bodyLock = new ReentrantLock();
  private volatile byte[]        body;

  private RegionFile(final String name, final InputStream source, final boolean ownsSource, final int[] locations, final int[] timestamps) {
    this.name = name;
    this.source = source;
    this.ownsSource = ownsSource;
    this.locations = locations;
    this.timestamps = timestamps;
    this.extendedCompression = GlobalConfiguration.REGION_EXTENDED_COMPRESSION.getValueAsBoolean();
  }

  /**
   * Opens a region from a stream positioned at the start of the region. Only the header is read, the remaining bytes are consumed at
   * the first chunk load. The stream is not closed by {@link #close()}.
   *
   * @throws CorruptRegionException if the stream ends before the end of the header
   * @throws StorageException       if the stream fails
   */
  public static RegionFile open(final InputStream source) {
    return open(source, "<stream>", false);
  }

  /**
   * Opens a region file. The file stays open until {@link #close()} is called.
   *
   * @throws StorageException       if the file cannot be opened or read
   * @throws CorruptRegionException if the file is shorter than the header
   */
  public static RegionFile open(final Path path) {
    final InputStream in;
    try {
      in = new BufferedInputStream(Files.newInputStream(path), GlobalConfiguration.REGION_BUFFER_SIZE.getValueAsInteger());
    } catch (final IOException e) {
      throw new StorageException("Cannot open region file '" + path + "'", e).addContext("path", path.toString());
    }

    try {
      return open(in, path.getFileName().toString(), true);
    } catch (final MCRegionException e) {
      closeQuietly(in, e);
      throw e;
    }
  }

  private static RegionFile open(final InputStream source, final String name, final boolean ownsSource) {
    final int[] locations = readTable(source, name, "location");
    final int[] timestamps = readTable(source, name, "timestamp");

    LogManager.instance().log(RegionFile.class, Level.FINE, "Opened region %s", name);
    return new RegionFile(name, source, ownsSource, locations, timestamps);
  }

  /**
   * Tells if the slot of the chunk is occupied. Coordinates are wrapped into the region.
   */
  public boolean chunkExists(final int x, final int z) {
    return getSectorOffset(locations[getIndex(x, z)]) != 0;
  }

  /**
   * Returns the last modification time of the chunk as stored in the header. The value is returned also for empty slots, where it is
   * meaningless.
   */
  public int getChunkTimestamp(final int x, final int z) {
    return timestamps[getIndex(x, z)];
  }

  /**
   * Returns the number of sectors declared for the chunk. The value is informational and it is not used to read the chunk.
   */
  public int getChunkSectorCount(final int x, final int z) {
    return locations[getIndex(x, z)] & 0xFF;
  }

  /**
   * Lists the occupied slots, with x in the outer loop and z in the inner one. Coordinates are local to the region (0-31).
   */
  public List<ChunkCoordinates> listChunks() {
    final List<ChunkCoordinates> chunks = new ArrayList<>();
    for (int x = 0; x < CHUNKS_PER_SIDE; ++x)
      for (int z = 0; z < CHUNKS_PER_SIDE; ++z)
        if (getSectorOffset(locations[x + z * CHUNKS_PER_SIDE]) != 0)
          chunks.add(new ChunkCoordinates(x, z));
    return chunks;
  }

  /**
   * Loads and decodes a chunk. Coordinates are wrapped into the region, so absolute chunk coordinates can be used.
   *
   * @return the document, or empty if the slot is not occupied
   *
   * @throws CorruptRegionException if the chunk header points outside the file, declares an invalid length or an unsupported
   *                                compression type
   * @throws CorruptChunkException  if the payload cannot be decompressed or decoded
   * @throws StorageException       if the body of the file cannot be read
   */
  public Optional<NBTDocument> loadChunk(final int x, final int z) {
    final int location = locations[getIndex(x, z)];
    final int sectorOffset = getSectorOffset(location);
    if (sectorOffset == 0)
      return Optional.empty();

    final byte[] data = loadBody();

    // OFFSETS ARE RELATIVE TO THE START OF THE FILE, THE BODY STARTS AFTER THE HEADER
    final long bodyOffset = (long) sectorOffset * SECTOR_SIZE - HEADER_SIZE;
    if (bodyOffset < 0 || bodyOffset + CHUNK_HEADER_SIZE > data.length)
      throw new CorruptRegionException("Chunk offset is invalid").addContext("chunk", new ChunkCoordinates(x, z).toLocal())
          .addContext("sectorOffset", sectorOffset).addContext("bodySize", data.length);

    final int offset = (int) bodyOffset;
    final long length = ByteBuffer.wrap(data, offset, 4).getInt() & 0xFFFFFFFFL;
    final int compressionId = data[offset + 4] & 0xFF;

    final RegionCompression compression = RegionCompression.getById(compressionId, extendedCompression);
    if (compression == null)
      throw new CorruptRegionException(
          "Unsupported compression type: " + compressionId + (extendedCompression ? " (should be 1, 2, 3 or 4)" : " (should be 1 or 2)")).addContext(
          "chunk", new ChunkCoordinates(x, z).toLocal());

    if (length == 0 || bodyOffset + length + 4 > data.length)
      throw new CorruptRegionException("Chunk length is invalid").addContext("chunk", new ChunkCoordinates(x, z).toLocal())
          .addContext("length", length).addContext("bodySize", data.length);

    final InputStream compressed = new ByteArrayInputStream(data, offset + CHUNK_HEADER_SIZE, (int) length - 1);
    try (final InputStream decompressed = compression.decompress(compressed)) {
      return Optional.of(new NBTReader(decompressed).readDocument());
    } catch (final IOException | MCRegionException e) {
      LogManager.instance().log(this, Level.FINE, "Cannot decode chunk %d,%d of region %s", e, x, z, name);
      throw new CorruptChunkException("Could not parse chunk NBT: " + e.getMessage(), e).addContext("chunk",
          new ChunkCoordinates(x, z).toLocal()).addContext("compression", compression.name());
    }
  }

  /**
   * Loads every occupied chunk, decoding them in parallel with the given executor. The body of the file is read once before submitting
   * the tasks. A failure on one chunk is reported in its result and does not affect the others.
   *
   * @return the results in the order of {@link #listChunks()}
   *
   * @throws StorageException if the body of the file cannot be read
   */
  public Map<ChunkCoordinates, ChunkLoadResult> loadChunks(final ExecutorService executor) {
    final List<ChunkCoordinates> chunks = listChunks();
    loadBody();

    final List<Future<ChunkLoadResult>> futures = new ArrayList<>(chunks.size());
    for (final ChunkCoordinates coordinates : chunks)
      futures.add(executor.submit(() -> {
        try {
          // OCCUPIED SLOTS ALWAYS PRODUCE A DOCUMENT OR AN EXCEPTION
          return ChunkLoadResult.loaded(coordinates, loadChunk(coordinates.x(), coordinates.z()).orElseThrow());
        } catch (final MCRegionException e) {
          return ChunkLoadResult.failed(coordinates, e);
        }
      }));

    final Map<ChunkCoordinates, ChunkLoadResult> results = new LinkedHashMap<>();
    try {
      for (int i = 0; i < chunks.size(); ++i)
        results.put(chunks.get(i), futures.get(i).get());
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      futures.forEach(f -> f.cancel(true));
      throw new MCRegionException("Interrupted while loading the chunks of region " + name, e);
    } catch (final ExecutionException e) {
      futures.forEach(f -> f.cancel(true));
      throw new MCRegionException("Error while loading the chunks of region " + name, e.getCause());
    }
    return results;
  }

  /**
   * Tells if the body of the file has been read in memory.
   */
  public boolean isBodyLoaded() {
    return body != null;
  }

  public String getName() {
    return name;
  }

  @Override
  public void close() throws IOException {
    if (ownsSource)
      source.close();
  }

  @Override
  public String toString() {
    return "RegionFile{" + name + (isBodyLoaded() ? ", body=" + body.length + " bytes" : "") + "}";
  }

  private byte[] loadBody() {
    byte[] result = body;
    if (result != null)
      return result;

    bodyLock.lock();
    try {
      result = body;
      if (result == null) {
        try {
          result = new BinaryInput(source).readFully();
        } catch (final StorageException e) {
          throw e.addContext("region", name);
        }
        LogManager.instance().log(this, Level.FINE, "Loaded body of region %s (%d bytes)", name, result.length);
        body = result;
      }
      return result;
    } finally {
      bodyLock.unlock();
    }
  }

  private static int[] readTable(final InputStream source, final String name, final String table) {
    final byte[] buffer = new byte[SECTOR_SIZE];
    final int read;
    try {
      read = source.readNBytes(buffer, 0, SECTOR_SIZE);
    } catch (final IOException e) {
      throw new StorageException("Error reading " + table + " table of region '" + name + "'", e);
    }

    if (read < SECTOR_SIZE)
      throw new CorruptRegionException("Error reading " + table + " table of region '" + name + "': expected " + SECTOR_SIZE + " bytes, found " + read);

    final int[] values = new int[SLOTS];
    ByteBuffer.wrap(buffer).asIntBuffer().get(values);
    return values;
  }

  private static int getIndex(final int x, final int z) {
    return (x & (CHUNKS_PER_SIDE - 1)) + (z & (CHUNKS_PER_SIDE - 1)) * CHUNKS_PER_SIDE;
  }

  private static int getSectorOffset(final int location) {
    return location >>> 8;
  }

  private static void closeQuietly(final InputStream in, final Exception reason) {
    try {
      in.close();
    } catch (final IOException e) {
      reason.addSuppressed(e);
    }
  }
}
