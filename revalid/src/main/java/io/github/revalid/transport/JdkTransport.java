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

import static io.github.revalid.internal.Validate.requireArgument;
import static java.util.Objects.requireNonNull;

import io.github.revalid.FetchSettings;
import java.io.IOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.net.ConnectException;
import java.net.Proxy;
import java.net.ProxySelector;
import java.net.Socket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpClient.Redirect;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandlers;
import java.security.GeneralSecurityException;
import java.security.cert.X509Certificate;
import java.time.Duration;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509ExtendedTrustManager;
import org.checkerframework.checker.nullness.qual.MonotonicNonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A {@link Transport} backed by the JDK's {@code HttpClient}. The client follows redirects, and
 * only tunnels through HTTP proxies: requests for which a SOCKS proxy is selected are rejected with
 * an {@link UnsupportedSchemeException}.
 */
public final class JdkTransport implements Transport {
  private static final Logger logger = System.getLogger(JdkTransport.class.getName());

  private static final int PROXY_AUTHENTICATION_REQUIRED = 407;

  private final HttpClient client;
  private final @Nullable ProxySelector proxySelector;
  private final boolean sslVerify;

  private JdkTransport(Builder builder) {
    var clientBuilder = HttpClient.newBuilder().followRedirects(Redirect.NORMAL);
    if (builder.connectTimeout != null) {
      clientBuilder.connectTimeout(builder.connectTimeout);
    }
    if (builder.proxySelector != null) {
      clientBuilder.proxy(builder.proxySelector);
    }
    if (!builder.sslVerify) {
      clientBuilder.sslContext(insecureSslContext());
    } else if (builder.sslContext != null) {
      clientBuilder.sslContext(builder.sslContext);
    }
    client = clientBuilder.build();
    proxySelector = builder.proxySelector;
    sslVerify = builder.sslVerify;
  }

  /** Returns a transport with the connect timeout, TLS verification and proxy of the settings. */
  public static JdkTransport create(FetchSettings settings) {
    var builder =
        newBuilder().connectTimeout(settings.connectTimeout()).sslVerify(settings.sslVerify());
    settings.proxy().ifPresent(builder::proxy);
    return builder.build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  @Override
  public TransportResponse get(TransportRequest request) throws IOException, InterruptedException {
    var uri = request.uri();
    var scheme = uri.getScheme();
    if (!("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
      throw new UnsupportedSchemeException(
          "No connection adapters were found for scheme '" + scheme + "' of " + uri);
    }

    var proxy = selectProxy(uri);
    if (proxy != null && proxy.type() == Proxy.Type.SOCKS) {
      throw new UnsupportedSchemeException(
          "Missing dependencies for SOCKS support: "
              + uri
              + " is configured to go through SOCKS proxy "
              + proxy.address());
    }

    if (!sslVerify && "https".equalsIgnoreCase(scheme) && !request.quietInsecure()) {
      logger.log(
          Level.WARNING,
          "Unverified HTTPS request is being made to {0}. "
              + "Enabling certificate verification is strongly advised",
          uri);
    }

    var requestBuilder = HttpRequest.newBuilder(uri).GET().timeout(request.timeout());
    request
        .headers()
        .map()
        .forEach((name, values) -> values.forEach(value -> requestBuilder.header(name, value)));

    long sentAt = System.nanoTime();
    HttpResponse<String> response;
    try {
      response = client.send(requestBuilder.build(), BodyHandlers.ofString());
    } catch (ConnectException e) {
      if (proxy != null) {
        throw new ProxyConnectException(
            "Unable to connect to proxy " + proxy.address() + " for " + uri, e);
      }
      throw e;
    } catch (IOException e) {
      if (proxy != null && isTunnelFailure(e)) {
        throw new ProxyConnectException(
            "Unable to tunnel through proxy " + proxy.address() + " for " + uri, e);
      }
      throw e;
    }

    var elapsed = Duration.ofNanos(System.nanoTime() - sentAt);
    if (proxy != null && response.statusCode() == PROXY_AUTHENTICATION_REQUIRED) {
      throw new ProxyConnectException(
          "Proxy " + proxy.address() + " requires authentication for " + uri);
    }
    return new TransportResponse(
        response.uri(), response.statusCode(), response.headers(), response.body(), elapsed);
  }

  private @Nullable Proxy selectProxy(URI uri) {
    if (proxySelector == null) {
      return null;
    }
    for (var proxy : proxySelector.select(uri)) {
      if (proxy.type() != Proxy.Type.DIRECT) {
        return proxy;
      }
    }
    return null;
  }

  private static boolean isTunnelFailure(IOException e) {
    var message = e.getMessage();
    return message != null && message.contains("Tunnel failed");
  }

  private static SSLContext insecureSslContext() {
    try {
      var sslContext = SSLContext.getInstance("TLS");
      sslContext.init(null, new TrustManager[] {new TrustingTrustManager()}, null);
      return sslContext;
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("TLS is unavailable", e);
    }
  }

  public static final class Builder {
    private @MonotonicNonNull Duration connectTimeout;
    private @MonotonicNonNull ProxySelector proxySelector;
    private @MonotonicNonNull SSLContext sslContext;
    private boolean sslVerify = true;

    Builder() {}

    public Builder connectTimeout(Duration connectTimeout) {
      requireNonNull(connectTimeout);
      requireArgument(
          !(connectTimeout.isNegative() || connectTimeout.isZero()),
          "non-positive duration: %s",
          connectTimeout);
      this.connectTimeout = connectTimeout;
      return this;
    }

    public Builder proxy(ProxySelector proxySelector) {
      this.proxySelector = requireNonNull(proxySelector);
      return this;
    }

    /** Sets the {@code SSLContext} used when certificate verification is enabled. */
    public Builder sslContext(SSLContext sslContext) {
      this.sslContext = requireNonNull(sslContext);
      return this;
    }

    /** Sets whether server certificates are verified. Verification is enabled by default. */
    public Builder sslVerify(boolean sslVerify) {
      this.sslVerify = sslVerify;
      return this;
    }

    public JdkTransport build() {
      return new JdkTransport(this);
    }
  }

  /** Accepts any certificate chain for any host. */
  private static final class TrustingTrustManager extends X509ExtendedTrustManager {
    TrustingTrustManager() {}

    @Override
    public void checkClientTrusted(X509Certificate[] chain, String authType, Socket socket) {}

    @Override
    public void checkServerTrusted(X509Certificate[] chain, String authType, Socket socket) {}

    @Override
    public void checkClientTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {}

    @Override
    public void checkServerTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {}

    @Override
    public void checkClientTrusted(X509Certificate[] chain, String authType) {}

    @Override
    public void checkServerTrusted(X509Certificate[] chain, String authType) {}

    @Override
    public X509Certificate[] getAcceptedIssuers() {
      return new X509Certificate[0];
    }
  }
}
