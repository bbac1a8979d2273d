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

package io.github.revalid;

import static io.github.revalid.internal.Validate.requireArgument;
import static java.util.Objects.requireNonNull;

import java.net.ProxySelector;
import java.net.URI;
import java.time.Duration;
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.MonotonicNonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Settings consulted when fetching index documents. Settings that aren't set explicitly fall back
 * to the following system properties, then to built-in defaults:
 *
 * <ul>
 *   <li>{@value #SSL_VERIFY_PROP} (default {@code true})
 *   <li>{@value #CONNECT_TIMEOUT_PROP} (default 9150)
 *   <li>{@value #READ_TIMEOUT_PROP} (default 60000)
 *   <li>{@value #ALLOW_NON_CHANNEL_URLS_PROP} (default {@code false})
 * </ul>
 */
public final class FetchSettings {
  static final String SSL_VERIFY_PROP = "io.github.revalid.sslVerify";
  static final String CONNECT_TIMEOUT_PROP = "io.github.revalid.connectTimeoutMillis";
  static final String READ_TIMEOUT_PROP = "io.github.revalid.readTimeoutMillis";
  static final String ALLOW_NON_CHANNEL_URLS_PROP = "io.github.revalid.allowNonChannelUrls";

  static final long DEFAULT_CONNECT_TIMEOUT_MILLIS = 9150;
  static final long DEFAULT_READ_TIMEOUT_MILLIS = 60_000;

  static final URI DEFAULT_DISTRIBUTION_HOST = URI.create("https://repo.anaconda.com/");
  static final URI DEFAULT_CHANNEL_ALIAS = URI.create("https://conda.anaconda.org");
  static final URI DEFAULT_CONFIG_HELP_URL = URI.create("https://conda.io/docs/config.html");

  private final boolean sslVerify;
  private final Duration connectTimeout;
  private final Duration readTimeout;
  private final boolean allowNonChannelUrls;
  private final URI defaultDistributionHost;
  private final URI channelAlias;
  private final URI configHelpUrl;
  private final Optional<ProxySelector> proxy;

  private FetchSettings(Builder builder) {
    sslVerify =
        builder.sslVerify != null
            ? builder.sslVerify
            : Boolean.parseBoolean(System.getProperty(SSL_VERIFY_PROP, "true"));
    connectTimeout =
        builder.connectTimeout != null
            ? builder.connectTimeout
            : millisProperty(CONNECT_TIMEOUT_PROP, DEFAULT_CONNECT_TIMEOUT_MILLIS);
    readTimeout =
        builder.readTimeout != null
            ? builder.readTimeout
            : millisProperty(READ_TIMEOUT_PROP, DEFAULT_READ_TIMEOUT_MILLIS);
    allowNonChannelUrls =
        builder.allowNonChannelUrls != null
            ? builder.allowNonChannelUrls
            : Boolean.getBoolean(ALLOW_NON_CHANNEL_URLS_PROP);
    defaultDistributionHost =
        builder.defaultDistributionHost != null
            ? builder.defaultDistributionHost
            : DEFAULT_DISTRIBUTION_HOST;
    channelAlias = builder.channelAlias != null ? builder.channelAlias : DEFAULT_CHANNEL_ALIAS;
    configHelpUrl = builder.configHelpUrl != null ? builder.configHelpUrl : DEFAULT_CONFIG_HELP_URL;
    proxy = Optional.ofNullable(builder.proxy);
  }

  /** Returns settings made only of system properties and defaults. */
  public static FetchSettings defaults() {
    return newBuilder().build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /** Returns whether server certificates are verified. */
  public boolean sslVerify() {
    return sslVerify;
  }

  public Duration connectTimeout() {
    return connectTimeout;
  }

  /** Returns the timeout bounding one whole request, from sending it to reading its body. */
  public Duration readTimeout() {
    return readTimeout;
  }

  /**
   * Returns whether a channel's {@code noarch} subdirectory that can't be found is treated as an
   * empty channel rather than an invalid one.
   */
  public boolean allowNonChannelUrls() {
    return allowNonChannelUrls;
  }

  /**
   * Returns the host the default channels are served from. Failures fetching from it get a hint
   * about network policies blocking it.
   */
  public URI defaultDistributionHost() {
    return defaultDistributionHost;
  }

  /** Returns the URL that channel names are resolved against. */
  public URI channelAlias() {
    return channelAlias;
  }

  /** Returns the URL that error messages refer users to for configuration help. */
  public URI configHelpUrl() {
    return configHelpUrl;
  }

  public Optional<ProxySelector> proxy() {
    return proxy;
  }

  @Override
  public String toString() {
    return "FetchSettings[sslVerify="
        + sslVerify
        + ", connectTimeout="
        + connectTimeout
        + ", readTimeout="
        + readTimeout
        + ", allowNonChannelUrls="
        + allowNonChannelUrls
        + ", defaultDistributionHost="
        + defaultDistributionHost
        + ", channelAlias="
        + channelAlias
        + "]";
  }

  private static Duration millisProperty(String name, long defaultMillis) {
    long millis = Long.getLong(name, defaultMillis);
    requireArgument(millis > 0, "non-positive %s: %d", name, millis);
    return Duration.ofMillis(millis);
  }

  private static Duration requirePositiveDuration(Duration duration) {
    requireNonNull(duration);
    requireArgument(
        !(duration.isNegative() || duration.isZero()), "non-positive duration: %s", duration);
    return duration;
  }

  public static final class Builder {
    private @MonotonicNonNull Boolean sslVerify;
    private @MonotonicNonNull Duration connectTimeout;
    private @MonotonicNonNull Duration readTimeout;
    private @MonotonicNonNull Boolean allowNonChannelUrls;
    private @MonotonicNonNull URI defaultDistributionHost;
    private @MonotonicNonNull URI channelAlias;
    private @MonotonicNonNull URI configHelpUrl;
    private @Nullable ProxySelector proxy;

    Builder() {}

    public Builder sslVerify(boolean sslVerify) {
      this.sslVerify = sslVerify;
      return this;
    }

    public Builder connectTimeout(Duration connectTimeout) {
      this.connectTimeout = requirePositiveDuration(connectTimeout);
      return this;
    }

    public Builder readTimeout(Duration readTimeout) {
      this.readTimeout = requirePositiveDuration(readTimeout);
      return this;
    }

    public Builder allowNonChannelUrls(boolean allowNonChannelUrls) {
      this.allowNonChannelUrls = allowNonChannelUrls;
      return this;
    }

    public Builder defaultDistributionHost(URI defaultDistributionHost) {
      this.defaultDistributionHost = requireNonNull(defaultDistributionHost);
      return this;
    }

    public Builder channelAlias(URI channelAlias) {
      this.channelAlias = requireNonNull(channelAlias);
      return this;
    }

    public Builder configHelpUrl(URI configHelpUrl) {
      this.configHelpUrl = requireNonNull(configHelpUrl);
      return this;
    }

    public Builder proxy(ProxySelector proxy) {
      this.proxy = requireNonNull(proxy);
      return this;
    }

    public FetchSettings build() {
      return new FetchSettings(this);
    }
  }
}
