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

import static java.util.Objects.requireNonNull;

import io.github.revalid.FetchSettings;
import io.github.revalid.HttpStatus;
import io.github.revalid.error.ChannelUnavailableException;
import io.github.revalid.error.ErrorKind;
import io.github.revalid.error.HttpFailureException;
import io.github.revalid.error.MissingDependencyException;
import io.github.revalid.error.ProxyException;
import io.github.revalid.error.TlsException;
import io.github.revalid.transport.HttpStatusException;
import io.github.revalid.transport.ProxyConnectException;
import io.github.revalid.transport.TransportResponse;
import io.github.revalid.transport.UnsupportedSchemeException;
import java.io.IOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.net.URI;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.function.BooleanSupplier;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Translates failures of fetching an index document into {@link
 * io.github.revalid.error.FetchException FetchExceptions} that tell users what went wrong and what
 * they can do about it.
 */
public final class ErrorTranslator {
  private static final Logger logger = System.getLogger(ErrorTranslator.class.getName());

  private static final int MAX_CAUSE_DEPTH = 16;

  static final String SOCKS_CAPABILITY = "SOCKS proxy support";

  static final String SOCKS_HELP_MESSAGE =
      "Your current working environment is configured to use a SOCKS proxy, but SOCKS proxy\n"
          + "support is not installed. To proceed, remove your proxy configuration, install a\n"
          + "transport with SOCKS support, and then you can re-enable your proxy configuration.\n";

  private final FetchSettings settings;
  private final BooleanSupplier tlsAvailable;

  public ErrorTranslator(FetchSettings settings) {
    this(settings, ErrorTranslator::isTlsAvailable);
  }

  /**
   * Creates a translator that asks {@code tlsAvailable} whether the runtime has a usable TLS
   * implementation when a TLS failure is translated.
   */
  public ErrorTranslator(FetchSettings settings, BooleanSupplier tlsAvailable) {
    this.settings = requireNonNull(settings);
    this.tlsAvailable = requireNonNull(tlsAvailable);
  }

  /**
   * Translates a failure of fetching {@code filename} from {@code channelUrl}. The returned
   * exception is meant to be thrown in place of {@code failure}. It's either a {@code
   * FetchException}, or {@code failure} itself if it has no translation.
   */
  public IOException translate(String channelUrl, String filename, IOException failure) {
    requireNonNull(channelUrl);
    requireNonNull(filename);
    requireNonNull(failure);
    var url = ChannelUrls.join(channelUrl, filename);
    if (failure instanceof ProxyConnectException) {
      return new ProxyException(url, failure);
    }
    if (failure instanceof UnsupportedSchemeException) {
      var message = failure.getMessage();
      return message != null && message.contains("SOCKS")
          ? new MissingDependencyException(url, SOCKS_CAPABILITY, SOCKS_HELP_MESSAGE, failure)
          : failure;
    }

    var sslFailure = findSslFailure(failure);
    if (sslFailure != null) {
      return translateTlsFailure(url, failure, sslFailure);
    }
    return translateHttpFailure(channelUrl, filename, url, failure);
  }

  private TlsException translateTlsFailure(String url, IOException failure, SSLException cause) {
    if (!tlsAvailable.getAsBoolean()) {
      return new TlsException(
          ErrorKind.TLS_UNAVAILABLE,
          url,
          "TLS appears to be unavailable on this machine. TLS is required to\n"
              + "download and install packages.\n\n"
              + "Exception: "
              + cause
              + "\n",
          failure);
    }
    return new TlsException(
        ErrorKind.TLS_VERIFICATION_ERROR,
        url,
        "Encountered an SSL error. Most likely a certificate verification issue.\n\n"
            + "Exception: "
            + cause
            + "\n",
        failure);
  }

  private IOException translateHttpFailure(
      String channelUrl, String filename, String url, IOException failure) {
    var response =
        failure instanceof HttpStatusException ? ((HttpStatusException) failure).response() : null;
    var statusCode = response != null ? response.statusCode() : null;
    var reason = response != null ? response.reasonPhrase().orElse(null) : null;
    var elapsed = response != null ? response.elapsed() : null;

    if (statusCode != null && (statusCode == 403 || statusCode == 404)) {
      return translateMissingChannel(
          channelUrl, filename, url, statusCode, reason, elapsed, failure);
    }

    String helpMessage;
    ErrorKind kind;
    if (statusCode != null && statusCode == 401) {
      kind = ErrorKind.UNAUTHORIZED;
      helpMessage = unauthorizedHelpMessage(channelUrl);
    } else if (statusCode != null && HttpStatus.isServerError(statusCode)) {
      kind = ErrorKind.SERVER_ERROR;
      helpMessage =
          "A remote server error occurred when trying to retrieve this URL.\n\n"
              + "A 500-type error (e.g. 500, 501, 502, 503, etc.) indicates the server failed to\n"
              + "fulfill a valid request. The problem may be spurious, and will resolve itself if "
              + "you\n"
              + "try your request again. If the problem persists, consider notifying the "
              + "maintainer\n"
              + "of the remote server.\n";
    } else {
      kind = ErrorKind.GENERIC_HTTP_ERROR;
      helpMessage = genericHelpMessage(channelUrl);
    }
    return new HttpFailureException(kind, url, statusCode, reason, elapsed, helpMessage, failure);
  }

  /**
   * A missing document makes the channel invalid, unless it's the {@code noarch} subdirectory that
   * is missing, which some channels don't provide. Such channels are considered empty if
   * non-channel URLs are allowed.
   */
  private ChannelUnavailableException translateMissingChannel(
      String channelUrl,
      String filename,
      String url,
      int statusCode,
      @Nullable String reason,
      @Nullable Duration elapsed,
      IOException failure) {
    ErrorKind kind;
    if (!ChannelUrls.isNoArch(channelUrl)) {
      logger.log(
          Level.INFO, "Unable to retrieve {0} (response: {1}) for {2}", filename, statusCode, url);
      kind = ErrorKind.INVALID_CHANNEL;
    } else if (settings.allowNonChannelUrls()) {
      logger.log(
          Level.WARNING,
          "Unable to retrieve {0} (response: {1}) for {2}",
          filename,
          statusCode,
          url);
      kind = ErrorKind.EMPTY_CHANNEL;
    } else {
      kind = ErrorKind.INVALID_CHANNEL;
    }

    var helpMessage =
        kind == ErrorKind.EMPTY_CHANNEL
            ? "The channel provides no "
                + filename
                + " for this subdirectory.\n"
                + "It will be treated as an empty channel.\n"
            : "The channel is not accessible or is invalid.\n\n"
                + "You will need to adjust your configuration to proceed.\n"
                + "Check the channels you have configured and their URLs.\n"
                + "Further configuration help can be found at <"
                + settings.configHelpUrl()
                + ">.\n";
    return new ChannelUnavailableException(
        kind, channelUrl, url, statusCode, reason, elapsed, helpMessage, failure);
  }

  private String unauthorizedHelpMessage(String channelUrl) {
    var token = ChannelUrls.token(channelUrl);
    if (token.isPresent()) {
      return "The token '"
          + token.get()
          + "' given for the URL is invalid.\n\n"
          + "If this token was pulled from anaconda-client, you will need to use\n"
          + "anaconda-client to reauthenticate.\n\n"
          + "If you supplied this token directly, you will need to adjust your\n"
          + "configuration to proceed.\n\n"
          + "Further configuration help can be found at <"
          + settings.configHelpUrl()
          + ">.\n";
    }

    // This won't trigger if the channel is reached through a URL other than the configured alias.
    if (channelUrl.contains(ChannelUrls.location(settings.channelAlias()))) {
      return "The remote server has indicated you are using invalid credentials for this "
          + "channel.\n\n"
          + "If the remote site is anaconda.org or follows the Anaconda Server API, you\n"
          + "will need to\n"
          + "    (a) remove the invalid token from your system with `anaconda logout`, "
          + "optionally\n"
          + "        followed by collecting a new token with `anaconda login`, or\n"
          + "    (b) provide a valid token directly.\n\n"
          + "Further configuration help can be found at <"
          + settings.configHelpUrl()
          + ">.\n";
    }

    return "The credentials you have provided for this URL are invalid.\n\n"
        + "You will need to modify your configuration to proceed.\n"
        + "Further configuration help can be found at <"
        + settings.configHelpUrl()
        + ">.\n";
  }

  private String genericHelpMessage(String channelUrl) {
    var message =
        new StringBuilder(
            "An HTTP error occurred when trying to retrieve this URL.\n"
                + "HTTP errors are often intermittent, and a simple retry will get you on your "
                + "way.\n");
    var defaultHost = settings.defaultDistributionHost();
    if (channelUrl.startsWith(defaultHost.toString())) {
      message
          .append("\nIf your current network has ")
          .append(siteOf(defaultHost))
          .append(" blocked, please file\n")
          .append("a support request with your network engineering team.\n\n");
    }
    return message.append('\'').append(ChannelUrls.unquote(channelUrl)).append("'\n").toString();
  }

  private static String siteOf(URI uri) {
    return uri.getScheme() + "://" + uri.getRawAuthority();
  }

  private static @Nullable SSLException findSslFailure(Throwable failure) {
    Throwable cause = failure;
    for (int depth = 0; cause != null && depth < MAX_CAUSE_DEPTH; depth++) {
      if (cause instanceof SSLException) {
        return (SSLException) cause;
      }
      cause = cause.getCause();
    }
    return null;
  }

  private static boolean isTlsAvailable() {
    try {
      SSLContext.getDefault();
      return true;
    } catch (NoSuchAlgorithmException e) {
      logger.log(Level.DEBUG, "No default SSLContext", e);
      return false;
    }
  }
}
