/*
 * Copyright © 2025 ANEO (armonik@aneo.fr)
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
package fr.aneo.datalake.client.transfer;

import fr.aneo.datalake.client.exception.DataLakeException;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

import static java.util.Objects.requireNonNull;

/**
 * Upload payload stored in a local file.
 * <p>
 * Only the requested range is loaded in memory, so the file may be of any size. Each
 * {@link #read(long, int)} opens its own channel, which makes concurrent reads safe.
 * The size is captured at construction; the file must not change during the upload.
 *
 * @see InMemoryData
 */
public final class FileData implements SeekableData {
  private final Path file;
  private final long size;

  private FileData(Path file) throws IOException {
    if (!Files.exists(file)) {
      throw new NoSuchFileException(file.toAbsolutePath().toString());
    }
    if (!Files.isReadable(file)) {
      throw new IOException("File not readable: " + file.toAbsolutePath());
    }
    this.file = file;
    this.size = Files.size(file);
  }

  /**
   * @param file the file to upload
   * @return the payload backed by that file
   * @throws NullPointerException if file is null
   * @throws DataLakeException    if the file does not exist or cannot be read
   */
  public static FileData from(Path file) {
    requireNonNull(file, "file must not be null");
    try {
      return new FileData(file);
    } catch (IOException e) {
      throw new DataLakeException("Failed to open FileData from file: " + file, e);
    }
  }

  public Path file() {
    return file;
  }

  @Override
  public long size() {
    return size;
  }

  @Override
  public byte[] read(long offset, int length) {
    var buffer = ByteBuffer.allocate(length);
    try (var channel = FileChannel.open(file, StandardOpenOption.READ)) {
      while (buffer.hasRemaining()) {
        int read = channel.read(buffer, offset + buffer.position());
        if (read < 0) {
          throw new EOFException("File " + file + " ended at " + (offset + buffer.position()) + ", expected " + (offset + length) + " bytes");
        }
      }
    } catch (IOException e) {
      throw new DataLakeException("Failed to read " + length + " bytes at offset " + offset + " from " + file, e);
    }
    return buffer.array();
  }
}
