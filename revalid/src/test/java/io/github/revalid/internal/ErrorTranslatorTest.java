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

import io.github.revalid.FetchSettings;
import io.github.revalid.error.ChannelUnavailableException;
import io.github.revalid.error.ErrorKind;
import io.github.revalid.error.FetchException;
import io.github.revalid.error.HttpFailureException;
import io.github.revalid.error.MissingDependencyException;
import io.github.revalid.error.ProxyException;
import io.github.revalid.error.TlsException;
import io.github.revalid.transport.HttpStatusException;
import io.github.revalid.transport.ProxyConnectException;
import io.github.revalid.transport.TransportResponse;
import io.github.revalid.transport.UnsupportedSchemeException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpHeaders;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Map;
import javax.net.ssl.SSLHandshakeException;
import org.junit.jupiter.api.Test;

class ErrorTranslatorTest {
  private static final String LINUX_64 = "https://example.com/channel/linux-64";
  private static final String NOARCH = "https://example.com/channel/noarch";
  private static final String FILENAME = "repodata.json";

  private final ErrorTranslator translator =
      new ErrorTranslator(FetchSettings.newBuilder().build());
  private final ErrorTranslator permissiveTranslator =
      new ErrorTranslator(FetchSettings.newBuilder().allowNonChannelUrls(true).build());

  @Test
  void proxyFailure() {
    var cause = new ProxyConnectException("Unable to connect to proxy");
    var translated = translator.translate(LINUX_64, FILENAME, cause);
    assertThat(translated).isInstanceOf(ProxyException.class).hasCause(cause);
    var exception = (ProxyException) translated;
    assertThat(exception.kind()).isEqualTo(ErrorKind.PROXY_ERROR);
    assertThat(exception.url()).isEqualTo(LINUX_64 + "/" + FILENAME);
    assertThat(exception.helpMessage()).contains("proxy configuration");
  }

  @Test
  void socksWithoutSupport() {
    var cause = new UnsupportedSchemeException("Missing dependencies for SOCKS support");
    var translated = translator.translate(LINUX_64, FILENAME, cause);
    assertThat(translated).isInstanceOf(MissingDependencyException.class).hasCause(cause);
    var exception = (MissingDependencyException) translated;
    assertThat(exception.kind()).isEqualTo(ErrorKind.MISSING_OPTIONAL_DEPENDENCY);
    assertThat(exception.capability()).contains("SOCKS");
    assertThat(exception.helpMessage()).contains("SOCKS");
  }

  @Test
  void otherSchemaFailuresAreNotTranslated() {
    var cause = new UnsupportedSchemeException("No connection adapters were found for 'ftp'");
    assertThat(translator.translate(LINUX_64, FILENAME, cause)).isSameAs(cause);
  }

  @Test
  void tlsVerificationFailure() {
    var sslFailure = new SSLHandshakeException("PKIX path building failed");
    var cause = new IOException("handshake failed", sslFailure);
    var translated = translator.translate(LINUX_64, FILENAME, cause);
    assertThat(translated).isInstanceOf(TlsException.class).hasCause(cause);
    assertThat(((FetchException) translated).kind()).isEqualTo(ErrorKind.TLS_VERIFICATION_ERROR);
    assertThat(((FetchException) translated).helpMessage())
        .contains("certificate verification")
        .contains("PKIX path building failed");
  }

  @Test
  void tlsUnavailable() {
    var unavailableTranslator = new ErrorTranslator(FetchSettings.defaults(), () -> false);
    var cause = new SSLHandshakeException("no cipher suites in common");
    var translated = unavailableTranslator.translate(LINUX_64, FILENAME, cause);
    assertThat(translated).isInstanceOf(TlsException.class).hasCause(cause);
    assertThat(((FetchException) translated).kind()).isEqualTo(ErrorKind.TLS_UNAVAILABLE);
    assertThat(((FetchException) translated).helpMessage())
        .contains("TLS appears to be unavailable");
  }

  @Test
  void notFoundOnArchitectureSubdirectory() {
    for (int code : new int[] {403, 404}) {
      var translated = translator.translate(LINUX_64, FILENAME, statusFailure(LINUX_64, code));
      assertThat(translated).isInstanceOf(ChannelUnavailableException.class);
      var exception = (ChannelUnavailableException) translated;
      assertThat(exception.kind()).isEqualTo(ErrorKind.INVALID_CHANNEL);
      assertThat(exception.kind().isHard()).isTrue();
      assertThat(exception.channelUrl()).isEqualTo(LINUX_64);
      assertThat(exception.statusCode()).hasValue(code);
      assertThat(exception.helpMessage()).contains("https://conda.io/docs/config.html");
    }
  }

  @Test
  void notFoundOnArchitectureSubdirectoryIsInvalidEvenIfPermissive() {
    var translated =
        permissiveTranslator.translate(LINUX_64, FILENAME, statusFailure(LINUX_64, 404));
    assertThat(((FetchException) translated).kind()).isEqualTo(ErrorKind.INVALID_CHANNEL);
  }

  @Test
  void notFoundOnNoArchSubdirectory() {
    var strict = translator.translate(NOARCH, FILENAME, statusFailure(NOARCH, 404));
    assertThat(((FetchException) strict).kind()).isEqualTo(ErrorKind.INVALID_CHANNEL);

    var permissive = permissiveTranslator.translate(NOARCH, FILENAME, statusFailure(NOARCH, 404));
    assertThat(permissive).isInstanceOf(ChannelUnavailableException.class);
    assertThat(((FetchException) permissive).kind()).isEqualTo(ErrorKind.EMPTY_CHANNEL);
    assertThat(((FetchException) permissive).kind().isHard()).isFalse();
  }

  @Test
  void unauthorizedWithToken() {
    var channelUrl = "https://conda.anaconda.org/t/tk-secret-1/private/linux-64";
    var translated = translator.translate(channelUrl, FILENAME, statusFailure(channelUrl, 401));
    assertThat(translated).isInstanceOf(HttpFailureException.class);
    var exception = (HttpFailureException) translated;
    assertThat(exception.kind()).isEqualTo(ErrorKind.UNAUTHORIZED);
    assertThat(exception.helpMessage())
        .contains("The token 'tk-secret-1' given for the URL is invalid");
  }

  @Test
  void unauthorizedThroughChannelAlias() {
    var channelUrl = "https://conda.anaconda.org/private/linux-64";
    var translated = translator.translate(channelUrl, FILENAME, statusFailure(channelUrl, 401));
    var exception = (HttpFailureException) translated;
    assertThat(exception.kind()).isEqualTo(ErrorKind.UNAUTHORIZED);
    assertThat(exception.helpMessage())
        .contains("invalid credentials for this channel")
        .contains("anaconda logout");
  }

  @Test
  void unauthorizedElsewhere() {
    var translated = translator.translate(LINUX_64, FILENAME, statusFailure(LINUX_64, 401));
    var exception = (HttpFailureException) translated;
    assertThat(exception.kind()).isEqualTo(ErrorKind.UNAUTHORIZED);
    assertThat(exception.helpMessage())
        .startsWith("The credentials you have provided for this URL are invalid.")
        .doesNotContain("token");
  }

  @Test
  void serverError() {
    for (int code : new int[] {500, 502, 503}) {
      var translated = translator.translate(LINUX_64, FILENAME, statusFailure(LINUX_64, code));
      var exception = (HttpFailureException) translated;
      assertThat(exception.kind()).isEqualTo(ErrorKind.SERVER_ERROR);
      assertThat(exception.statusCode()).hasValue(code);
      assertThat(exception.helpMessage()).contains("try your request again");
    }
  }

  @Test
  void otherStatus() {
    var translated = translator.translate(LINUX_64, FILENAME, statusFailure(LINUX_64, 429));
    var exception = (HttpFailureException) translated;
    assertThat(exception.kind()).isEqualTo(ErrorKind.GENERIC_HTTP_ERROR);
    assertThat(exception.reason()).hasValue("Too Many Requests");
    assertThat(exception.elapsed()).hasValue(Duration.ofMillis(120));
    assertThat(exception.getMessage())
        .startsWith(
            "HTTP 429 Too Many Requests for url <" + LINUX_64 + "/" + FILENAME + ">\nElapsed: ")
        .doesNotContain("network engineering team");
  }

  @Test
  void failureWithoutResponse() {
    var cause = new ConnectException("Connection refused");
    var translated = translator.translate(LINUX_64, FILENAME, cause);
    assertThat(translated).isInstanceOf(HttpFailureException.class).hasCause(cause);
    var exception = (HttpFailureException) translated;
    assertThat(exception.kind()).isEqualTo(ErrorKind.GENERIC_HTTP_ERROR);
    assertThat(exception.statusCode()).isEmpty();
    assertThat(exception.getMessage())
        .startsWith("HTTP 000 CONNECTION FAILED for url <" + LINUX_64 + "/" + FILENAME + ">");
  }

  @Test
  void timeoutIsGenericFailure() {
    var translated =
        translator.translate(LINUX_64, FILENAME, new HttpTimeoutException("request timed out"));
    assertThat(((FetchException) translated).kind()).isEqualTo(ErrorKind.GENERIC_HTTP_ERROR);
  }

  @Test
  void genericFailureOnDefaultDistributionHost() {
    var channelUrl = "https://repo.anaconda.com/pkgs/main/linux-64";
    var translated = translator.translate(channelUrl, FILENAME, new ConnectException("refused"));
    assertThat(((FetchException) translated).helpMessage())
        .contains("If your current network has https://repo.anaconda.com blocked")
        .contains("network engineering team");
  }

  @Test
  void genericFailureQuotesDecodedUrl() {
    var channelUrl = "https://example.com/my%20channel/linux-64";
    var translated = translator.translate(channelUrl, FILENAME, new ConnectException("refused"));
    assertThat(((FetchException) translated).helpMessage())
        .endsWith("'https://example.com/my channel/linux-64'\n");
  }

  private static HttpStatusException statusFailure(String channelUrl, int statusCode) {
    var response =
        new TransportResponse(
            URI.create(channelUrl + "/" + FILENAME),
            statusCode,
            HttpHeaders.of(Map.of(), (n, v) -> true),
            "",
            Duration.ofMillis(120));
    return new HttpStatusException(response);
  }
}
