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

package io.github.revalid.error;

import static io.github.revalid.internal.Validate.requireArgument;
import static java.util.Objects.requireNonNull;

import java.time.Duration;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Signals that a channel has no document at the requested location. This is a hard failure if the
 * channel is {@link ErrorKind#INVALID_CHANNEL invalid}, and a soft one if the channel is only
 * {@link ErrorKind#EMPTY_CHANNEL empty} for the requested subdirectory.
 */
public final class ChannelUnavailableException extends FetchException {
  private static final long serialVersionUID = 1L;

  private final String channelUrl;

  public ChannelUnavailableException(
      ErrorKind kind,
      String channelUrl,
      String url,
      int statusCode,
      @Nullable String reason,
      @Nullable Duration elapsed,
      String helpMessage,
      @Nullable Throwable cause) {
    super(checkKind(kind), url, statusCode, reason, elapsed, helpMessage, cause);
    this.channelUrl = requireNonNull(channelUrl);
  }

  /** Returns the URL of the channel (or of its subdirectory) the document was requested from. */
  public String channelUrl() {
    return channelUrl;
  }

  private static ErrorKind checkKind(ErrorKind kind) {
    requireArgument(
        kind == ErrorKind.INVALID_CHANNEL || kind == ErrorKind.EMPTY_CHANNEL,
        "not a channel error kind: %s",
        kind);
    return kind;
  }
}
