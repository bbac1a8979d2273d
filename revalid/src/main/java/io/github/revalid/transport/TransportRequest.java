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

import java.net.URI;
import java.net.http.HttpHeaders;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/** An immutable {@code GET} request handed to a {@link Transport}. */
public final class TransportRequest {
  private final URI uri;
  private final HttpHeaders headers;
  private final Duration timeout;
  private final boolean quietInsecure;

  private TransportRequest(Builder builder) {
    uri = builder.uri;
    headers = HttpHeaders.of(builder.headers, (n, v) -> true);
    timeout = builder.timeout;
    quietInsecure = builder.quietInsecure;
  }

  public URI uri() {
    return uri;
  }

  public HttpHeaders headers() {
    return headers;
  }

  /** Returns the timeout bounding the whole exchange, from sending the request to reading it. */
  public Duration timeout() {
    return timeout;
  }

  /**
   * Returns whether the transport should refrain from warning about this request being sent over
   * HTTPS without certificate verification. Set by callers that disabled verification on purpose.
   */
  public boolean quietInsecure() {
    return quietInsecure;
  }

  @Override
  public String toString() {
    return "GET " + uri;
  }

  public static Builder newBuilder(URI uri) {
    return new Builder(uri);
  }

  public static final class Builder {
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

    private final URI uri;
    private final Map<String, List<String>> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    private Duration timeout = DEFAULT_TIMEOUT;
    private boolean quietInsecure;

    Builder(URI uri) {
      this.uri = requireNonNull(uri);
    }

    /** Adds the given header, keeping values previously added with the same name. */
    public Builder header(String name, String value) {
      requireNonNull(name);
      requireNonNull(value);
      headers.computeIfAbsent(name, __ -> new ArrayList<>()).add(value);
      return this;
    }

    public Builder timeout(Duration timeout) {
      this.timeout = requireNonNull(timeout);
      return this;
    }

    public Builder quietInsecure(boolean quietInsecure) {
      this.quietInsecure = quietInsecure;
      return this;
    }

    public TransportRequest build() {
      return new TransportRequest(this);
    }
  }
}
