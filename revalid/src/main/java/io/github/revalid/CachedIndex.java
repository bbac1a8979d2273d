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

import static java.util.Objects.requireNonNull;

import java.nio.file.Path;

/** An index document as held by an {@link IndexCache} after it's been refreshed. */
public final class CachedIndex {
  private final FetchOutcome.Kind kind;
  private final String text;
  private final Path artifactFile;

  CachedIndex(FetchOutcome.Kind kind, String text, Path artifactFile) {
    this.kind = requireNonNull(kind);
    this.text = requireNonNull(text);
    this.artifactFile = requireNonNull(artifactFile);
  }

  /** Returns how the refresh went: whether the document was downloaded, reused or found empty. */
  public FetchOutcome.Kind kind() {
    return kind;
  }

  /** Returns the document's content. An empty channel's content is an empty JSON object. */
  public String text() {
    return text;
  }

  public Path artifactFile() {
    return artifactFile;
  }

  @Override
  public String toString() {
    return "CachedIndex[kind=" + kind + ", artifactFile=" + artifactFile + "]";
  }
}
