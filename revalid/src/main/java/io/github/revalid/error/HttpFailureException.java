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

import java.time.Duration;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Signals that a request for an index document failed at the HTTP level, either with an error
 * response or without getting any response at all.
 */
public final class HttpFailureException extends FetchException {
  private static final long serialVersionUID = 1L;

  public HttpFailureException(
      ErrorKind kind,
      String url,
      @Nullable Integer statusCode,
      @Nullable String reason,
      @Nullable Duration elapsed,
      String helpMessage,
      @Nullable Throwable cause) {
    super(checkKind(kind), url, statusCode, reason, elapsed, helpMessage, cause);
  }

  @Override
  String exchangeSummary() {
    return statusCode().isPresent()
        ? super.exchangeSummary()
        : "HTTP 000 CONNECTION FAILED for url <" + url() + ">";
  }

  private static ErrorKind checkKind(ErrorKind kind) {
    requireArgument(
        kind == ErrorKind.UNAUTHORIZED
            || kind == ErrorKind.SERVER_ERROR
            || kind == ErrorKind.GENERIC_HTTP_ERROR,
        "not an HTTP error kind: %s",
        kind);
    return kind;
  }
}
