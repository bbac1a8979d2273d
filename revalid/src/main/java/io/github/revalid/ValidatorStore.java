/*
 * Copyright (c) 2026 Moataz Abdelnasser
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package io.github.revalid;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;
import static java.util.Objects.requireNonNull;

import java.io.IOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.concurrent.TimeUnit;

/**
 * Loads and saves the {@link ValidatorRecord} of a cached artifact file. The record is kept in a
 * JSON state file next to the artifact, and is only trusted if the artifact's current size and
 * modification time equal the ones recorded when the state was saved. Otherwise, the artifact is
 * assumed to have been replaced behind the store's back and the loaded validators are dropped,
 * which makes the next fetch unconditional.
 *
 * <p>A store doesn't coordinate with other processes writing the same entry. The worst a race can
 * do is leave stale validators behind, which costs a full re-download.
 */
public final class ValidatorStore {
  private static final Logger logger = System.getLogger(ValidatorStore.class.getName());

  static final String STATE_FILE_SUFFIX = ".state.json";
  static final String TEMP_FILE_SUFFIX = ".tmp";

  private final Path artifactFile;
  private final Path stateFile;

  public ValidatorStore(Path artifactFile, Path stateFile) {
    this.artifactFile = requireNonNull(artifactFile);
    this.stateFile = requireNonNull(stateFile);
  }

  /**
   * Returns a store whose state file is a sibling of {@code artifactFile}, named after the
   * artifact's name with its {@code .json} extension replaced by {@code .state.json}.
   */
  public static ValidatorStore forArtifact(Path artifactFile) {
    var filenameComponent = artifactFile.getFileName();
    var filename = filenameComponent != null ? filenameComponent.toString() : "";
    var stem = filename.endsWith(".json") ? filename.substring(0, filename.length() - 5) : filename;
    return new ValidatorStore(artifactFile, artifactFile.resolveSibling(stem + STATE_FILE_SUFFIX));
  }

  public Path artifactFile() {
    return artifactFile;
  }

  public Path stateFile() {
    return stateFile;
  }

  /**
   * Loads the record describing the artifact file. An empty record is returned if either file is
   * missing or the state file can't be read.
   */
  public ValidatorRecord load() {
    logger.log(Level.DEBUG, () -> "Loading cache state from " + stateFile);
    try {
      var record = ValidatorRecordCodec.decode(Files.readString(stateFile, UTF_8));
      var stat = ArtifactStat.of(artifactFile);
      if (!stat.matches(record)) {
        logger.log(
            Level.DEBUG,
            () ->
                String.format(
                    "Dropping validators of %s: recorded (size=%d, mtime_ns=%d) "
                        + "but found (size=%d, mtime_ns=%d)",
                    artifactFile,
                    record.size(),
                    record.mtimeNs(),
                    stat.size,
                    stat.mtimeNs));
        record.invalidate();
      }
      return record;
    } catch (IOException e) {
      logger.log(Level.DEBUG, "Could not load state", e);
      return new ValidatorRecord();
    }
  }

  /**
   * Saves {@code record} after stamping it with the artifact file's current size and modification
   * time. Must be called after the artifact file is written.
   *
   * @throws java.nio.file.NoSuchFileException if the artifact file doesn't exist
   */
  public void save(ValidatorRecord record) throws IOException {
    requireNonNull(record);
    var stat = ArtifactStat.of(artifactFile);
    record.stamp(stat.size, stat.mtimeNs);
    writeAtomically(stateFile, ValidatorRecordCodec.encode(record));
  }

  /** Writes {@code content} to a temporary sibling of {@code target} then moves it in place. */
  static void writeAtomically(Path target, String content) throws IOException {
    var filenameComponent = target.getFileName();
    var tempFile =
        target.resolveSibling(
            (filenameComponent != null ? filenameComponent.toString() : "") + TEMP_FILE_SUFFIX);
    Files.writeString(tempFile, content, UTF_8);
    try {
      Files.move(tempFile, target, ATOMIC_MOVE, REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      Files.move(tempFile, target, REPLACE_EXISTING);
    }
  }

  private static final class ArtifactStat {
    final long size;
    final long mtimeNs;

    private ArtifactStat(long size, long mtimeNs) {
      this.size = size;
      this.mtimeNs = mtimeNs;
    }

    boolean matches(ValidatorRecord record) {
      return record.size() == size && record.mtimeNs() == mtimeNs;
    }

    static ArtifactStat of(Path file) throws IOException {
      var attributes = Files.readAttributes(file, BasicFileAttributes.class);
      return new ArtifactStat(
          attributes.size(), attributes.lastModifiedTime().to(TimeUnit.NANOSECONDS));
    }
  }
}
