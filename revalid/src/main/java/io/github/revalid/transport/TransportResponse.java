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

package io.github.revalid.transport;

import static java.util.Objects.requireNonNull;

import io.github.revalid.HttpStatus;
import java.net.URI;
import java.net.http.HttpHeaders;
import java.time.Duration;
import java.util.Optional;

/** A response received by a {@link Transport}, with its body fully read as text. */
public final class TransportResponse {
  private final URI uri;
  private final int statusCode;
  private final HttpHeaders headers;
  private final String body;
  private final Duration elapsed;

  public TransportResponse(
      URI uri, int statusCode, HttpHeaders headers, String body, Duration elapsed) {
    this.uri = requireNonNull(uri);
    this.statusCode = statusCode;
    this.headers = requireNonNull(headers);
    this.body = requireNonNull(body);
    this.elapsed = requireNonNull(elapsed);
  }

  /** Returns the URI of the final response, which differs from the request's after redirects. */
  public URI uri() {
    return uri;
  }

  public int statusCode() {
    return statusCode;
  }

  public HttpHeaders headers() {
    return headers;
  }

  public String body() {
    return body;
  }

  /** Returns the time the exchange took, from sending the request to reading the body. */
  public Duration elapsed() {
    return elapsed;
  }

  public Optional<String> reasonPhrase() {
    return HttpStatus.reasonPhrase(statusCode);
  }

  @Override
  public String toString() {
    return "(" + uri + ") " + statusCode;
  }
}
