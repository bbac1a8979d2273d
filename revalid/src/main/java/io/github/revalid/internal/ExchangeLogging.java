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

package io.github.revalid.internal;

import io.github.revalid.transport.TransportRequest;
import io.github.revalid.transport.TransportResponse;
import java.net.http.HttpHeaders;

/** Renders request/response exchanges for debug logging. */
public class ExchangeLogging {
  static final int MAX_BODY_LENGTH = 256;

  private ExchangeLogging() {}

  /**
   * Describes the exchange in a multi-line string. The response body is truncated to {@value
   * #MAX_BODY_LENGTH} characters.
   */
  public static String describe(TransportRequest request, TransportResponse response) {
    var description = new StringBuilder();
    description.append("GET ").append(request.uri()).append('\n');
    appendHeaders(description, request.headers());
    description.append('\n');
    description.append(response.statusCode());
    response.reasonPhrase().ifPresent(reason -> description.append(' ').append(reason));
    description.append(" ").append(response.uri());
    description.append(" (").append(response.elapsed().toMillis()).append(" ms)\n");
    appendHeaders(description, response.headers());
    var body = response.body();
    if (!body.isEmpty()) {
      description.append('\n');
      if (body.length() > MAX_BODY_LENGTH) {
        description
            .append(body, 0, MAX_BODY_LENGTH)
            .append(" ... [")
            .append(body.length() - MAX_BODY_LENGTH)
            .append(" more characters]");
      } else {
        description.append(body);
      }
    }
    return description.toString();
  }

  private static void appendHeaders(StringBuilder description, HttpHeaders headers) {
    headers
        .map()
        .forEach(
            (name, values) ->
                values.forEach(
                    value -> description.append(name).append(": ").append(value).append('\n')));
  }
}
