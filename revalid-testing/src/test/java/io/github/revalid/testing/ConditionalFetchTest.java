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

package io.github.revalid.testing;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.revalid.FetchOutcome;
import io.github.revalid.FetchSettings;
import io.github.revalid.IndexCache;
import io.github.revalid.IndexFetcher;
import io.github.revalid.ValidatorRecord;
import io.github.revalid.ValidatorStore;
import io.github.revalid.error.ErrorKind;
import io.github.revalid.error.FetchException;
import io.github.revalid.error.MissingDependencyException;
import io.github.revalid.error.ProxyException;
import io.github.revalid.transport.ProxyConnectException;
import io.github.revalid.transport.UnsupportedSchemeException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Runs whole fetch/save cycles against scripted channels. */
class ConditionalFetchTest {
  private static final String CHANNEL = "https://conda.example.com/main/linux-64";
  private static final String DOCUMENT = "{\"packages\": {\"a-1.0-0.tar.bz2\": {}}}";

  @Test
  void fetchSaveRevalidate(@TempDir Path directory) throws Exception {
    var transport =
        new StubTransport()
            .handleRequests(
                StubTransport.serving(DOCUMENT, "\"v1\"", "Sat, 01 Jun 2024 00:00:00 GMT"));
    var fetcher = IndexFetcher.newBuilder().transport(transport).build();
    var store = ValidatorStore.forArtifact(directory.resolve("main-linux-64.json"));

    var record = store.load();
    var outcome = fetcher.fetch(CHANNEL, record);
    assertThat(outcome.kind()).isEqualTo(FetchOutcome.Kind.FRESH);
    assertThat(record.etag()).isEqualTo("\"v1\"");
    assertThat(record.sourceUrl()).isEqualTo(CHANNEL);
    Files.writeString(store.artifactFile(), outcome.body().orElseThrow(), UTF_8);
    store.save(record);

    var reloaded = store.load();
    assertThat(reloaded.etag()).isEqualTo("\"v1\"");
    var revalidated = fetcher.fetch(CHANNEL, reloaded);
    assertThat(revalidated.kind()).isEqualTo(FetchOutcome.Kind.NOT_MODIFIED);
    assertThat(reloaded).isEqualTo(store.load());

    assertThat(transport.requestCount()).isEqualTo(2);
    assertThat(transport.takeRequest().headers().map()).isEmpty();
    var conditional = transport.takeRequest();
    assertThat(conditional.uri().toString()).isEqualTo(CHANNEL + "/repodata.json");
    assertThat(conditional.headers().firstValue("If-None-Match")).hasValue("\"v1\"");
    assertThat(conditional.headers().firstValue("If-Modified-Since"))
        .hasValue("Sat, 01 Jun 2024 00:00:00 GMT");
  }

  @Test
  void cacheRefreshesOnlyWhenChanged(@TempDir Path directory) throws Exception {
    var transport =
        new StubTransport()
            .enqueue(StubTransport.serving(DOCUMENT, "\"v1\"", ""))
            .enqueue(StubTransport.serving(DOCUMENT, "\"v1\"", ""))
            .enqueue(StubTransport.serving("{\"packages\": {}}", "\"v2\"", ""));
    var cache =
        IndexCache.create(directory, IndexFetcher.newBuilder().transport(transport).build());

    assertThat(cache.refresh(CHANNEL).kind()).isEqualTo(FetchOutcome.Kind.FRESH);
    var unchanged = cache.refresh(CHANNEL);
    assertThat(unchanged.kind()).isEqualTo(FetchOutcome.Kind.NOT_MODIFIED);
    assertThat(unchanged.text()).isEqualTo(DOCUMENT);

    var changed = cache.refresh(CHANNEL);
    assertThat(changed.kind()).isEqualTo(FetchOutcome.Kind.FRESH);
    assertThat(changed.text()).isEqualTo("{\"packages\": {}}");
    assertThat(cache.storeFor(CHANNEL, "repodata.json").load().etag()).isEqualTo("\"v2\"");
  }

  @Test
  void emptyNoArchSubdirectory(@TempDir Path directory) throws Exception {
    var transport = new StubTransport().enqueue(404, "");
    var fetcher =
        IndexFetcher.newBuilder()
            .transport(transport)
            .settings(FetchSettings.newBuilder().allowNonChannelUrls(true).build())
            .build();
    var index =
        IndexCache.create(directory, fetcher).refresh("https://conda.example.com/main/noarch");
    assertThat(index.kind()).isEqualTo(FetchOutcome.Kind.EMPTY);
    assertThat(index.text()).isEqualTo("{}");
  }

  @Test
  void proxyFailure() {
    var transport = new StubTransport().enqueueFailure(new ProxyConnectException("refused"));
    var fetcher = IndexFetcher.newBuilder().transport(transport).build();
    assertThatThrownBy(() -> fetcher.fetch(CHANNEL, new ValidatorRecord()))
        .isInstanceOfSatisfying(
            ProxyException.class, e -> assertThat(e.kind()).isEqualTo(ErrorKind.PROXY_ERROR));
  }

  @Test
  void socksFailure() {
    var transport =
        new StubTransport()
            .enqueueFailure(
                new UnsupportedSchemeException("Missing dependencies for SOCKS support"));
    var fetcher = IndexFetcher.newBuilder().transport(transport).build();
    assertThatThrownBy(() -> fetcher.fetch(CHANNEL, new ValidatorRecord()))
        .isInstanceOfSatisfying(
            MissingDependencyException.class,
            e -> assertThat(e.kind()).isEqualTo(ErrorKind.MISSING_OPTIONAL_DEPENDENCY));
  }

  @Test
  void serverErrorIsHard() {
    var transport = new StubTransport().enqueue(502, "bad gateway");
    var fetcher = IndexFetcher.newBuilder().transport(transport).build();
    assertThatThrownBy(() -> fetcher.fetch(CHANNEL, new ValidatorRecord()))
        .isInstanceOfSatisfying(
            FetchException.class,
            e -> {
              assertThat(e.kind()).isEqualTo(ErrorKind.SERVER_ERROR);
              assertThat(e.kind().isHard()).isTrue();
            });
  }
}
