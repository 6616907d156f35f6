/*
 * Copyright 2025 Yelp Inc.
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
 */
package com.yelp.ingestion.appsinstalled.memcached;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/** Marks a loaded file as processed by prefixing its name with a dot, in the same directory. */
public final class DotRenamer {
  public static final String PROCESSED_PREFIX = ".";

  private DotRenamer() {}

  public static boolean isProcessed(Path path) {
    Path fileName = path.getFileName();
    return fileName != null && fileName.toString().startsWith(PROCESSED_PREFIX);
  }

  /**
   * Rename {@code dir/name} to {@code dir/.name} atomically.
   *
   * @return the new path
   * @throws IOException if the rename fails, including when the file system cannot move atomically
   */
  public static Path rename(Path path) throws IOException {
    Path target = path.resolveSibling(PROCESSED_PREFIX + path.getFileName());
    return Files.move(path, target, StandardCopyOption.ATOMIC_MOVE);
  }
}
