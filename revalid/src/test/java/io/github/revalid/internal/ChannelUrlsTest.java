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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.net.MalformedURLException;
import java.net.URI;
import org.junit.jupiter.api.Test;

class ChannelUrlsTest {
  @Test
  void join() {
    assertThat(ChannelUrls.join("https://conda.anaconda.org/conda-forge/linux-64", "repodata.json"))
        .isEqualTo("https://conda.anaconda.org/conda-forge/linux-64/repodata.json");
    assertThat(ChannelUrls.join("https://example.com/c/noarch/", "/repodata.json"))
        .isEqualTo("https://example.com/c/noarch/repodata.json");
    assertThat(ChannelUrls.join("https://example.com//", "a/", "", "/b"))
        .isEqualTo("https://example.com/a/b");
    assertThat(ChannelUrls.join("https://example.com")).isEqualTo("https://example.com");
  }

  @Test
  void toUri() throws MalformedURLException {
    assertThat(ChannelUrls.toUri("https://example.com/c/linux-64/repodata.json"))
        .isEqualTo(URI.create("https://example.com/c/linux-64/repodata.json"));
    assertThat(ChannelUrls.toUri("https://example.com/my%20channel/noarch").getRawPath())
        .isEqualTo("/my%20channel/noarch");
    assertThat(ChannelUrls.toUri("https://example.com:8443/my channel/noarch?x=a b"))
        .hasScheme("https")
        .hasPort(8443)
        .hasPath("/my channel/noarch");
    assertThat(ChannelUrls.toUri("https://example.com/my channel/noarch").getRawPath())
        .isEqualTo("/my%20channel/noarch");
  }

  @Test
  void toUriRejectsUnparseableUrls() {
    assertThatThrownBy(() -> ChannelUrls.toUri("https://bad host/c"))
        .isInstanceOf(MalformedURLException.class);
    assertThatThrownBy(() -> ChannelUrls.toUri("not a url"))
        .isInstanceOf(MalformedURLException.class);
  }

  @Test
  void token() {
    assertThat(ChannelUrls.token("https://conda.anaconda.org/t/tk-123_abc/conda-forge/linux-64"))
        .hasValue("tk-123_abc");
    assertThat(ChannelUrls.token("https://conda.anaconda.org/t/tk-123")).hasValue("tk-123");
    assertThat(ChannelUrls.token("https://conda.anaconda.org/conda-forge/linux-64")).isEmpty();
    assertThat(ChannelUrls.token("https://conda.anaconda.org/t/bad.token/c")).isEmpty();
    assertThat(ChannelUrls.token("https://example.com/tt/abc/c")).isEmpty();
  }

  @Test
  void isNoArch() {
    assertThat(ChannelUrls.isNoArch("https://example.com/c/noarch")).isTrue();
    assertThat(ChannelUrls.isNoArch("https://example.com/c/noarch/")).isTrue();
    assertThat(ChannelUrls.isNoArch("https://example.com/c/linux-64")).isFalse();
    assertThat(ChannelUrls.isNoArch("https://example.com/c/notnoarch")).isFalse();
    assertThat(ChannelUrls.isNoArch("https://example.com/noarch/linux-64")).isFalse();
  }

  @Test
  void location() {
    assertThat(ChannelUrls.location(URI.create("https://conda.anaconda.org")))
        .isEqualTo("conda.anaconda.org");
    assertThat(ChannelUrls.location(URI.create("https://conda.anaconda.org/")))
        .isEqualTo("conda.anaconda.org");
    assertThat(ChannelUrls.location(URI.create("https://user@example.com:8443/conda/")))
        .isEqualTo("user@example.com:8443/conda");
  }

  @Test
  void unquote() {
    assertThat(ChannelUrls.unquote("https://example.com/my%20channel/linux-64"))
        .isEqualTo("https://example.com/my channel/linux-64");
    assertThat(ChannelUrls.unquote("https://example.com/a+b/%2B"))
        .isEqualTo("https://example.com/a+b/+");
    assertThat(ChannelUrls.unquote("https://example.com/plain"))
        .isEqualTo("https://example.com/plain");
    assertThat(ChannelUrls.unquote("https://example.com/bad%zz"))
        .isEqualTo("https://example.com/bad%zz");
  }
}
