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

/**
 * Coordinates of a chunk. Coordinates returned by {@link RegionFile#listChunks()} are local to the region (0-31), while the reader
 * accepts absolute coordinates too and wraps them into the region.
 *
 * @param x chunk X
 * @param z chunk Z
 */
public record ChunkCoordinates(int x, int z) {

  /**
   * Returns the coordinates wrapped into the 32x32 grid of a region. Negative coordinates wrap to [0,32) as well.
   */
  public ChunkCoordinates toLocal() {
    return new ChunkCoordinates(x & (RegionFile.CHUNKS_PER_SIDE - 1), z & (RegionFile.CHUNKS_PER_SIDE - 1));
  }

  @Override
  public String toString() {
    return "[" + x + "," + z + "]";
  }
}
