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
import static java.util.Objects.requireNonNull;

import io.github.revalid.internal.ChannelUrls;
import java.io.IOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * A directory of index documents kept up to date with an {@link IndexFetcher}. Each document is
 * stored as {@code <key>.json} next to its {@code <key>.state.json} state file, where {@code key}
 * is derived from the document's URL.
 */
public final class IndexCache {
  private static final Logger logger = System.getLogger(IndexCache.class.getName());

  static final String EMPTY_DOCUMENT = "{}";

  private static final int KEY_LENGTH = 8;

  private final Path directory;
  private final IndexFetcher fetcher;

  private IndexCache(Path directory, IndexFetcher fetcher) {
    this.directory = requireNonNull(directory);
    this.fetcher = requireNonNull(fetcher);
  }

  /** Returns a cache in {@code directory}, which is created on first refresh if missing. */
  public static IndexCache create(Path directory, IndexFetcher fetcher) {
    return new IndexCache(directory, fetcher);
  }

  public Path directory() {
    return directory;
  }

  /** Returns the store of the given document, whether or not it's been cached yet. */
  public ValidatorStore storeFor(String channelUrl, String filename) {
    var key = cacheKey(ChannelUrls.join(channelUrl, filename));
    return new ValidatorStore(
        directory.resolve(key + ".json"),
        directory.resolve(key + ValidatorStore.STATE_FILE_SUFFIX));
  }

  /** Refreshes the channel's {@value IndexFetcher#DEFAULT_FILENAME}. */
  public CachedIndex refresh(String channelUrl) throws IOException, InterruptedException {
    return refresh(channelUrl, IndexFetcher.DEFAULT_FILENAME);
  }

  /**
   * Brings the cached copy of the given document up to date and returns it. The document is only
   * downloaded if the server reports it has changed since it was last cached.
   *
   * @throws io.github.revalid.error.FetchException if the document couldn't be fetched
   */
  public CachedIndex refresh(String channelUrl, String filename)
      throws IOException, InterruptedException {
    requireNonNull(channelUrl);
    requireNonNull(filename);
    Files.createDirectories(directory);
    var store = storeFor(channelUrl, filename);
    var record = store.load();
    var outcome = fetcher.fetch(channelUrl, filename, record);
    var artifactFile = store.artifactFile();
    switch (outcome.kind()) {
      case FRESH:
        var body = outcome.body().orElseThrow();
        ValidatorStore.writeAtomically(artifactFile, body);
        store.save(record);
        return new CachedIndex(FetchOutcome.Kind.FRESH, body, artifactFile);

      case NOT_MODIFIED:
        logger.log(Level.DEBUG, () -> "Reusing cached " + artifactFile + " for " + channelUrl);
        return new CachedIndex(
            FetchOutcome.Kind.NOT_MODIFIED, Files.readString(artifactFile, UTF_8), artifactFile);

      case EMPTY:
        record.clear();
        record.setSourceUrl(channelUrl);
        ValidatorStore.writeAtomically(artifactFile, EMPTY_DOCUMENT);
        store.save(record);
        return new CachedIndex(FetchOutcome.Kind.EMPTY, EMPTY_DOCUMENT, artifactFile);

      default:
        throw new AssertionError("unexpected outcome: " + outcome);
    }
  }

  /** Returns the first {@value #KEY_LENGTH} hex digits of the SHA-256 of {@code url}. */
  static String cacheKey(String url) {
    var digest = newSha256Digest().digest(url.getBytes(UTF_8));
    var key = new StringBuilder(KEY_LENGTH);
    for (int i = 0; i < KEY_LENGTH / 2; i++) {
      byte b = digest[i];
      key.append(Character.forDigit((b >> 4) & 0xf, 16)).append(Character.forDigit(b & 0xf, 16));
    }
    return key.toString();
  }

  private static MessageDigest newSha256Digest() {
    try {
      return MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException e) {
      throw new UnsupportedOperationException("SHA-256 not available!", e);
    }
  }
}
