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

import org.checkerframework.checker.nullness.qual.Nullable;

/** Signals that the configured proxy couldn't be used to fetch an index document. */
public final class ProxyException extends FetchException {
  private static final long serialVersionUID = 1L;

  static final String HELP_MESSAGE =
      "Cannot proceed due to an error in your proxy configuration.\n"
          + "Check for typos and other configuration errors in any '.netrc' file in your home "
          + "directory,\n"
          + "any environment variables ending in '_PROXY', and any other system-wide proxy\n"
          + "configuration settings.\n";

  public ProxyException(String url, @Nullable Throwable cause) {
    super(ErrorKind.PROXY_ERROR, url, null, null, null, HELP_MESSAGE, cause);
  }
}
