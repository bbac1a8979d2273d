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

import java.io.IOException;

/**
 * A capability that performs one blocking {@code GET} request. Implementations own connection
 * management, TLS and proxy resolution, and report failures as distinguishable exceptions:
 *
 * <ul>
 *   <li>{@link ProxyConnectException} if the request couldn't get through the configured proxy.
 *   <li>{@link UnsupportedSchemeException} if the request or proxy scheme can't be handled.
 *   <li>{@link javax.net.ssl.SSLException} (possibly as the cause of another {@code IOException})
 *       if a TLS session couldn't be established.
 *   <li>Any other {@code IOException} for connection-level failures, timeouts included.
 * </ul>
 *
 * <p>A response is returned whatever its status code is.
 */
@FunctionalInterface
public interface Transport {
  TransportResponse get(TransportRequest request) throws IOException, InterruptedException;
}
