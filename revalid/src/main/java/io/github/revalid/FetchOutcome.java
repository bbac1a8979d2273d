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

import static io.github.revalid.internal.Validate.requireArgument;
import static java.util.Objects.requireNonNull;

import io.github.revalid.error.ChannelUnavailableException;
import io.github.revalid.error.ErrorKind;
import java.util.Objects;
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The result of a successful {@link IndexFetcher#fetch(String, String, ValidatorRecord) fetch}.
 * An outcome is either {@link Kind#FRESH fresh}, carrying a newly downloaded body, {@link
 * Kind#NOT_MODIFIED not modified}, meaning the cached body is still current, or {@link Kind#EMPTY
 * empty}, meaning the channel has no document at the requested location and should be treated as
 * having no content.
 */
public final class FetchOutcome {
  private static final FetchOutcome NOT_MODIFIED = new FetchOutcome(Kind.NOT_MODIFIED, null, null);

  private final Kind kind;
  private final @Nullable String body;
  private final @Nullable ChannelUnavailableException emptyCause;

  private FetchOutcome(
      Kind kind, @Nullable String body, @Nullable ChannelUnavailableException emptyCause) {
    this.kind = kind;
    this.body = body;
    this.emptyCause = emptyCause;
  }

  public Kind kind() {
    return kind;
  }

  /** Returns the downloaded body if this outcome is fresh. */
  public Optional<String> body() {
    return Optional.ofNullable(body);
  }

  /** Returns the failure that made the channel be treated as empty if this outcome is empty. */
  public Optional<ChannelUnavailableException> emptyCause() {
    return Optional.ofNullable(emptyCause);
  }

  public boolean isFresh() {
    return kind == Kind.FRESH;
  }

  public boolean isNotModified() {
    return kind == Kind.NOT_MODIFIED;
  }

  public boolean isEmpty() {
    return kind == Kind.EMPTY;
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (obj == this) {
      return true;
    }
    if (!(obj instanceof FetchOutcome)) {
      return false;
    }
    var other = (FetchOutcome) obj;
    return kind == other.kind
        && Objects.equals(body, other.body)
        && Objects.equals(emptyCause, other.emptyCause);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, body, emptyCause);
  }

  @Override
  public String toString() {
    switch (kind) {
      case FRESH:
        return "FetchOutcome[FRESH, " + requireNonNull(body).length() + " characters]";
      case EMPTY:
        return "FetchOutcome[EMPTY, " + requireNonNull(emptyCause).url() + "]";
      default:
        return "FetchOutcome[" + kind + "]";
    }
  }

  public static FetchOutcome fresh(String body) {
    return new FetchOutcome(Kind.FRESH, requireNonNull(body), null);
  }

  public static FetchOutcome notModified() {
    return NOT_MODIFIED;
  }

  public static FetchOutcome empty(ChannelUnavailableException cause) {
    requireNonNull(cause);
    requireArgument(
        cause.kind() == ErrorKind.EMPTY_CHANNEL, "not an empty channel failure: %s", cause.kind());
    return new FetchOutcome(Kind.EMPTY, null, cause);
  }

  /** The kind of a {@code FetchOutcome}. */
  public enum Kind {
    /** A new body was downloaded. */
    FRESH,

    /** The server confirmed the cached body is current. */
    NOT_MODIFIED,

    /** The channel has no document at the requested location. */
    EMPTY
  }
}
