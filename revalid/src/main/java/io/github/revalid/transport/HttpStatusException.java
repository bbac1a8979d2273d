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

import java.io.IOException;

/** Signals that a response was received with a status its requester doesn't accept. */
public class HttpStatusException extends IOException {
  private static final long serialVersionUID = 1L;

  private final transient TransportResponse response;

  public HttpStatusException(TransportResponse response) {
    super(
        response.statusCode()
            + response.reasonPhrase().map(reason -> " " + reason).orElse("")
            + " for url: "
            + response.uri());
    this.response = requireNonNull(response);
  }

  public TransportResponse response() {
    return response;
  }

  public int statusCode() {
    return response.statusCode();
  }
}
