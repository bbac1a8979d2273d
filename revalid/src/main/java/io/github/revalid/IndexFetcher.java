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

import static java.util.Objects.requireNonNull;

import io.github.revalid.error.ChannelUnavailableException;
import io.github.revalid.error.ErrorKind;
import io.github.revalid.internal.ChannelUrls;
import io.github.revalid.internal.ErrorTranslator;
import io.github.revalid.internal.ExchangeLogging;
import io.github.revalid.transport.HttpStatusException;
import io.github.revalid.transport.JdkTransport;
import io.github.revalid.transport.Transport;
import io.github.revalid.transport.TransportRequest;
import io.github.revalid.transport.TransportResponse;
import java.io.IOException;
import java.net.MalformedURLException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.function.Consumer;
import org.checkerframework.checker.nullness.qual.MonotonicNonNull;

/**
 * Fetches index documents from channels, asking the server to skip the download if the document
 * hasn't changed since it was last fetched.
 *
 * <p>The validators to revalidate with are read from the {@link ValidatorRecord} passed to {@link
 * #fetch(String, String, ValidatorRecord)}. If the server sends a new body, the record is
 * repopulated in place from the response headers, and the caller is expected to write the body
 * somewhere then {@link ValidatorStore#save(ValidatorRecord) save} the record. An {@code
 * IndexFetcher} keeps no reference to records and can be shared among threads.
 *
 * <pre>{@code
 * var fetcher = IndexFetcher.create();
 * var store = ValidatorStore.forArtifact(Path.of("cache", "linux-64.json"));
 * var record = store.load();
 * var outcome = fetcher.fetch("https://conda.anaconda.org/conda-forge/linux-64", record);
 * if (outcome.isFresh()) {
 *   Files.writeString(store.artifactFile(), outcome.body().orElseThrow());
 *   store.save(record);
 * }
 * }</pre>
 */
public final class IndexFetcher {
  private static final Logger logger = System.getLogger(IndexFetcher.class.getName());

  /** The name of the index document requested when none is given. */
  public static final String DEFAULT_FILENAME = "repodata.json";

  static final String IF_NONE_MATCH = "If-None-Match";
  static final String IF_MODIFIED_SINCE = "If-Modified-Since";

  private final FetchSettings settings;
  private final Transport transport;
  private final ErrorTranslator translator;

  private IndexFetcher(Builder builder) {
    settings = builder.settings != null ? builder.settings : FetchSettings.defaults();
    transport = builder.transport != null ? builder.transport : JdkTransport.create(settings);
    translator = new ErrorTranslator(settings);
  }

  /** Returns a fetcher with default settings and a {@link JdkTransport}. */
  public static IndexFetcher create() {
    return newBuilder().build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public FetchSettings settings() {
    return settings;
  }

  public Transport transport() {
    return transport;
  }

  /** Fetches {@value #DEFAULT_FILENAME} from the given channel. */
  public FetchOutcome fetch(String channelUrl, ValidatorRecord record)
      throws IOException, InterruptedException {
    return fetch(channelUrl, DEFAULT_FILENAME, record);
  }

  /**
   * Fetches {@code filename} from the given channel, revalidating with {@code record}'s validators
   * if it has any.
   *
   * @return a {@linkplain FetchOutcome#isFresh() fresh} outcome if the server sent a new body, in
   *     which case {@code record} has been repopulated from the response. A {@linkplain
   *     FetchOutcome#isNotModified() not modified} outcome if the server confirmed the cached body
   *     is current, in which case {@code record} is untouched. Or an {@linkplain
   *     FetchOutcome#isEmpty() empty} outcome if the document is missing from a channel that's
   *     allowed to lack it.
   * @throws io.github.revalid.error.FetchException if the document couldn't be fetched
   * @throws MalformedURLException if the channel URL can't be parsed
   * @throws IOException if the channel URL has a scheme the transport doesn't support
   */
  public FetchOutcome fetch(String channelUrl, String filename, ValidatorRecord record)
      throws IOException, InterruptedException {
    requireNonNull(channelUrl);
    requireNonNull(filename);
    requireNonNull(record);
    var request = newRequest(ChannelUrls.join(channelUrl, filename), record);
    TransportResponse response;
    try {
      response = exchange(request);
    } catch (IOException e) {
      var translated = translator.translate(channelUrl, filename, e);
      if (translated instanceof ChannelUnavailableException
          && ((ChannelUnavailableException) translated).kind() == ErrorKind.EMPTY_CHANNEL) {
        return FetchOutcome.empty((ChannelUnavailableException) translated);
      }
      throw translated;
    }

    if (HttpStatus.isNotModified(response.statusCode())) {
      return FetchOutcome.notModified();
    }
    repopulate(record, channelUrl, response);
    return FetchOutcome.fresh(response.body());
  }

  /** Sends the request, throwing an {@code HttpStatusException} if it's neither 2xx nor 304. */
  private TransportResponse exchange(TransportRequest request)
      throws IOException, InterruptedException {
    var response = transport.get(request);
    logger.log(Level.DEBUG, () -> ExchangeLogging.describe(request, response));
    if (!(HttpStatus.isSuccessful(response.statusCode())
        || HttpStatus.isNotModified(response.statusCode()))) {
      throw new HttpStatusException(response);
    }
    return response;
  }

  private TransportRequest newRequest(String url, ValidatorRecord record)
      throws MalformedURLException {
    var builder =
        TransportRequest.newBuilder(ChannelUrls.toUri(url))
            .timeout(settings.readTimeout())
            .quietInsecure(!settings.sslVerify());
    if (!record.etag().isEmpty()) {
      builder.header(IF_NONE_MATCH, record.etag());
    }
    if (!record.lastModified().isEmpty()) {
      builder.header(IF_MODIFIED_SINCE, record.lastModified());
    }
    return builder.build();
  }

  private static void repopulate(
      ValidatorRecord record, String channelUrl, TransportResponse response) {
    record.clear();
    record.setSourceUrl(channelUrl);
    copyHeader(response, "ETag", record::setEtag);
    copyHeader(response, "Last-Modified", record::setLastModified);
    copyHeader(response, "Cache-Control", record::setCacheControl);
  }

  private static void copyHeader(
      TransportResponse response, String name, Consumer<String> setter) {
    response.headers().firstValue(name).filter(value -> !value.isEmpty()).ifPresent(setter);
  }

  public static final class Builder {
    private @MonotonicNonNull FetchSettings settings;
    private @MonotonicNonNull Transport transport;

    Builder() {}

    /** Sets the settings. {@link FetchSettings#defaults()} is used if not set. */
    public Builder settings(FetchSettings settings) {
      this.settings = requireNonNull(settings);
      return this;
    }

    /**
     * Sets the transport requests are sent through. A {@link JdkTransport} {@link
     * JdkTransport#create(FetchSettings) created} from the settings is used if not set.
     */
    public Builder transport(Transport transport) {
      this.transport = requireNonNull(transport);
      return this;
    }

    public IndexFetcher build() {
      return new IndexFetcher(this);
    }
  }
}
