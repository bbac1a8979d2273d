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

import static java.nio.charset.StandardCharsets.UTF_8;

import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.net.URLDecoder;
import java.util.Optional;
import java.util.regex.Pattern;

/** Helpers for inspecting and building channel URLs. */
public class ChannelUrls {
  /** The subdirectory holding a channel's architecture-independent packages. */
  public static final String NOARCH = "noarch";

  private static final Pattern TOKEN_PATTERN = Pattern.compile("/t/([a-zA-Z0-9_-]+)(?=/|$)");

  private ChannelUrls() {}

  /** Joins {@code base} and each of {@code parts} with exactly one slash between them. */
  public static String join(String base, String... parts) {
    var joined = new StringBuilder(stripTrailingSlashes(base));
    for (var part : parts) {
      var stripped = stripTrailingSlashes(stripLeadingSlashes(part));
      if (!stripped.isEmpty()) {
        joined.append('/').append(stripped);
      }
    }
    return joined.toString();
  }

  /** Returns the token embedded in {@code url} as a {@code /t/<token>} path segment, if any. */
  public static Optional<String> token(String url) {
    var matcher = TOKEN_PATTERN.matcher(url);
    return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
  }

  /** Returns whether the last path segment of {@code channelUrl} is {@value #NOARCH}. */
  public static boolean isNoArch(String channelUrl) {
    var stripped = stripTrailingSlashes(channelUrl);
    return stripped.endsWith("/" + NOARCH);
  }

  /**
   * Returns the location of {@code uri}, which is its authority followed by its path without a
   * trailing slash. For instance, the location of {@code https://conda.anaconda.org/} is {@code
   * conda.anaconda.org}.
   */
  public static String location(URI uri) {
    var authority = uri.getRawAuthority();
    var path = uri.getRawPath();
    return stripTrailingSlashes((authority != null ? authority : "") + (path != null ? path : ""));
  }

  /**
   * Parses {@code url} into a URI, percent-encoding characters that can't appear in a URI as they
   * are, such as spaces. A URL that's already a valid URI is kept as is.
   *
   * @throws MalformedURLException if {@code url} can't be parsed even after encoding
   */
  public static URI toUri(String url) throws MalformedURLException {
    try {
      return new URI(url);
    } catch (URISyntaxException e) {
      try {
        var parsed = new URL(url);
        return new URI(
            parsed.getProtocol(),
            parsed.getUserInfo(),
            parsed.getHost(),
            parsed.getPort(),
            parsed.getPath(),
            parsed.getQuery(),
            parsed.getRef());
      } catch (MalformedURLException | URISyntaxException unencodable) {
        var malformed = new MalformedURLException("Invalid URL '" + url + "': " + e.getReason());
        malformed.initCause(unencodable);
        throw malformed;
      }
    }
  }

  /** Percent-decodes {@code url}, or returns it as is if it's not validly encoded. */
  public static String unquote(String url) {
    if (url.indexOf('%') < 0) {
      return url;
    }
    try {
      // URLDecoder decodes form data, where '+' stands for a space.
      return URLDecoder.decode(url.replace("+", "%2B"), UTF_8);
    } catch (IllegalArgumentException malformed) {
      return url;
    }
  }

  private static String stripTrailingSlashes(String s) {
    int end = s.length();
    while (end > 0 && s.charAt(end - 1) == '/') {
      end--;
    }
    return s.substring(0, end);
  }

  private static String stripLeadingSlashes(String s) {
    int start = 0;
    while (start < s.length() && s.charAt(start) == '/') {
      start++;
    }
    return s.substring(start);
  }
}
