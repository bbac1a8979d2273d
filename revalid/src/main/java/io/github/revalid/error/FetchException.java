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

import static java.util.Objects.requireNonNull;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.OptionalInt;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Signals that an index document couldn't be fetched. Besides a human-readable, multi-line {@link
 * #helpMessage() explanation}, a {@code FetchException} carries what's known about the failed
 * request so that callers can log or render it as they see fit.
 */
public abstract class FetchException extends IOException {
  private static final long serialVersionUID = 1L;

  private final ErrorKind kind;
  private final String url;
  private final @Nullable Integer statusCode;
  private final @Nullable String reason;
  private final @Nullable Duration elapsed;
  private final String helpMessage;

  FetchException(
      ErrorKind kind,
      String url,
      @Nullable Integer statusCode,
      @Nullable String reason,
      @Nullable Duration elapsed,
      String helpMessage,
      @Nullable Throwable cause) {
    super(helpMessage, cause);
    this.kind = requireNonNull(kind);
    this.url = requireNonNull(url);
    this.statusCode = statusCode;
    this.reason = reason;
    this.elapsed = elapsed;
    this.helpMessage = requireNonNull(helpMessage);
  }

  public ErrorKind kind() {
    return kind;
  }

  /** Returns the URL of the requested document. */
  public String url() {
    return url;
  }

  /** Returns the status code of the response, if one was received. */
  public OptionalInt statusCode() {
    return statusCode != null ? OptionalInt.of(statusCode) : OptionalInt.empty();
  }

  /** Returns the reason phrase of the response, if one was received. */
  public Optional<String> reason() {
    return Optional.ofNullable(reason);
  }

  /** Returns how long the request took, if a response was received. */
  public Optional<Duration> elapsed() {
    return Optional.ofNullable(elapsed);
  }

  /** Returns the explanation of what went wrong and what can be done about it. */
  public String helpMessage() {
    return helpMessage;
  }

  @Override
  public String getMessage() {
    var summary = exchangeSummary();
    return summary.isEmpty() ? helpMessage : summary + "\n\n" + helpMessage;
  }

  /** Summarizes the failed exchange, or returns an empty string if no response was received. */
  String exchangeSummary() {
    if (statusCode == null) {
      return "";
    }
    var summary = new StringBuilder("HTTP ").append(statusCode);
    if (reason != null) {
      summary.append(' ').append(reason);
    }
    summary.append(" for url <").append(url).append('>');
    if (elapsed != null) {
      summary.append("\nElapsed: ").append(elapsed);
    }
    return summary.toString();
  }
}
