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

/** The closed set of reasons an index document can fail to be fetched. */
public enum ErrorKind {
  /** The channel is valid but has no document for the requested subdirectory. */
  EMPTY_CHANNEL(false),

  /** The channel doesn't exist or isn't accessible. */
  INVALID_CHANNEL(true),

  PROXY_ERROR(true),

  /** The environment needs a capability that isn't installed, like SOCKS proxy support. */
  MISSING_OPTIONAL_DEPENDENCY(true),

  /** The runtime has no usable TLS implementation. */
  TLS_UNAVAILABLE(true),

  TLS_VERIFICATION_ERROR(true),

  UNAUTHORIZED(true),

  /** A 5xx response, which might not recur if the request is retried. */
  SERVER_ERROR(true),

  GENERIC_HTTP_ERROR(true);

  private final boolean hard;

  ErrorKind(boolean hard) {
    this.hard = hard;
  }

  /**
   * Returns whether failures of this kind leave the caller with nothing usable. A soft failure,
   * on the other hand, can be cached as an empty result.
   */
  public boolean isHard() {
    return hard;
  }
}
