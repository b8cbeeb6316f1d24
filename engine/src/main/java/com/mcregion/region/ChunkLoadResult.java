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

import com.mcregion.exception.MCRegionException;
import com.mcregion.nbt.NBTDocument;

/**
 * Outcome of the load of one chunk in a bulk load: either the document or the error that prevented decoding it.
 */
public class ChunkLoadResult {
  private final ChunkCoordinates  coordinates;
  private final NBTDocument       document;
  private final MCRegionException error;

  private ChunkLoadResult(final ChunkCoordinates coordinates, final NBTDocument document, final MCRegionException error) {
    this.coordinates = coordinates;
    this.document = document;
    this.error = error;
  }

  public static ChunkLoadResult loaded(final ChunkCoordinates coordinates, final NBTDocument document) {
    return new ChunkLoadResult(coordinates, document, null);
  }

  public static ChunkLoadResult failed(final ChunkCoordinates coordinates, final MCRegionException error) {
    return new ChunkLoadResult(coordinates, null, error);
  }

  public ChunkCoordinates getCoordinates() {
    return coordinates;
  }

  public boolean isLoaded() {
    return error == null;
  }

  /**
   * @return the decoded document, null if the load failed
   */
  public NBTDocument getDocument() {
    return document;
  }

  /**
   * @return the failure, null if the chunk was decoded
   */
  public MCRegionException getError() {
    return error;
  }

  @Override
  public String toString() {
    return "ChunkLoadResult{" + coordinates + (error == null ? ", loaded" : ", error=" + error) + "}";
  }
}
