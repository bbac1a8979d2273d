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

import java.util.Optional;

/** Static functions for classifying response status codes and naming them. */
public class HttpStatus {
  /** The status a server uses to tell that the conditionally requested document is unchanged. */
  public static final int NOT_MODIFIED = 304;

  private HttpStatus() {}

  /** Returns {@code true} if {@code statusCode} is a 2xx success status code. */
  public static boolean isSuccessful(int statusCode) {
    return StatusKind.SUCCESSFUL.includes(statusCode);
  }

  /** Returns {@code true} if {@code statusCode} is a 5xx server error status code. */
  public static boolean isServerError(int statusCode) {
    return StatusKind.SERVER_ERROR.includes(statusCode);
  }

  /** Returns {@code true} if {@code statusCode} is {@code 304 Not Modified}. */
  public static boolean isNotModified(int statusCode) {
    return statusCode == NOT_MODIFIED;
  }

  /**
   * Returns the standard reason phrase for {@code statusCode}. HTTP/2 doesn't transmit reason
   * phrases, so these are what a server would have sent over HTTP/1.1.
   */
  public static Optional<String> reasonPhrase(int statusCode) {
    switch (statusCode) {
      case 200:
        return Optional.of("OK");
      case 203:
        return Optional.of("Non-Authoritative Information");
      case 204:
        return Optional.of("No Content");
      case 301:
        return Optional.of("Moved Permanently");
      case 302:
        return Optional.of("Found");
      case 304:
        return Optional.of("Not Modified");
      case 307:
        return Optional.of("Temporary Redirect");
      case 308:
        return Optional.of("Permanent Redirect");
      case 400:
        return Optional.of("Bad Request");
      case 401:
        return Optional.of("Unauthorized");
      case 403:
        return Optional.of("Forbidden");
      case 404:
        return Optional.of("Not Found");
      case 407:
        return Optional.of("Proxy Authentication Required");
      case 408:
        return Optional.of("Request Timeout");
      case 410:
        return Optional.of("Gone");
      case 429:
        return Optional.of("Too Many Requests");
      case 500:
        return Optional.of("Internal Server Error");
      case 501:
        return Optional.of("Not Implemented");
      case 502:
        return Optional.of("Bad Gateway");
      case 503:
        return Optional.of("Service Unavailable");
      case 504:
        return Optional.of("Gateway Timeout");
      default:
        return Optional.empty();
    }
  }

  enum StatusKind {
    SUCCESSFUL(200),
    SERVER_ERROR(500);

    private final int from;
    private final int to;

    StatusKind(int from) {
      this(from, from + 99);
    }

    StatusKind(int from, int to) {
      this.from = from;
      this.to = to;
    }

    boolean includes(int statusCode) {
      return statusCode >= from && statusCode <= to;
    }
  }
}
