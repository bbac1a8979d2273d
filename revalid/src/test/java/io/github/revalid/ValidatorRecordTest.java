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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class ValidatorRecordTest {
  @Test
  void newRecordIsEmpty() {
    var record = new ValidatorRecord();
    assertThat(record.etag()).isEmpty();
    assertThat(record.lastModified()).isEmpty();
    assertThat(record.cacheControl()).isEmpty();
    assertThat(record.sourceUrl()).isEmpty();
    assertThat(record.size()).isZero();
    assertThat(record.mtimeNs()).isZero();
    assertThat(record.extensions()).isEmpty();
    assertThat(record.hasValidators()).isFalse();
  }

  @Test
  void nullValidatorsBecomeEmpty() {
    var record = new ValidatorRecord();
    record.setEtag("\"abc\"");
    record.setEtag(null);
    record.setLastModified(null);
    record.setCacheControl(null);
    record.setSourceUrl(null);
    assertThat(record.etag()).isEmpty();
    assertThat(record.lastModified()).isEmpty();
    assertThat(record.cacheControl()).isEmpty();
    assertThat(record.sourceUrl()).isEmpty();
  }

  @Test
  void hasValidators() {
    var record = new ValidatorRecord();
    record.setCacheControl("max-age=30");
    assertThat(record.hasValidators()).isFalse();

    record.setEtag("\"abc\"");
    assertThat(record.hasValidators()).isTrue();

    record.setEtag("");
    record.setLastModified("Sat, 01 Jun 2024 00:00:00 GMT");
    assertThat(record.hasValidators()).isTrue();
  }

  @Test
  void extensionsKeepInsertionOrder() {
    var record = new ValidatorRecord();
    record.putExtension("zeta", 1);
    record.putExtension("alpha", "a");
    record.putExtension("mu", List.of(1, 2));
    assertThat(record.extensions()).containsKeys("zeta", "alpha", "mu");
    assertThat(List.copyOf(record.extensions().keySet())).containsExactly("zeta", "alpha", "mu");

    record.removeExtension("alpha");
    assertThat(record.extensions()).containsOnlyKeys("zeta", "mu");
  }

  @Test
  void extensionsCantShadowPersistedFields() {
    var record = new ValidatorRecord();
    for (var name : List.of("etag", "mod", "cache_control", "size", "mtime_ns", "url")) {
      assertThatIllegalArgumentException().isThrownBy(() -> record.putExtension(name, "x"));
    }
    for (var name : List.of("_etag", "_mod", "_cache_control", "_url")) {
      assertThatIllegalArgumentException().isThrownBy(() -> record.putExtension(name, "x"));
    }
  }

  @Test
  void extensionsViewIsUnmodifiable() {
    var record = new ValidatorRecord();
    assertThatThrownBy(() -> record.extensions().put("a", "b"))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void invalidateKeepsModificationTimeSourceUrlAndExtensions() {
    var record = populatedRecord();
    record.invalidate();
    assertThat(record.etag()).isEmpty();
    assertThat(record.lastModified()).isEmpty();
    assertThat(record.cacheControl()).isEmpty();
    assertThat(record.size()).isZero();
    assertThat(record.mtimeNs()).isEqualTo(2000L);
    assertThat(record.sourceUrl()).isEqualTo("https://example.com/channel/linux-64");
    assertThat(record.extensions()).containsEntry("has_zst", true);
  }

  @Test
  void clearResetsEverything() {
    var record = populatedRecord();
    record.clear();
    assertThat(record).isEqualTo(new ValidatorRecord());
  }

  @Test
  void copyIsIndependent() {
    var record = populatedRecord();
    var copy = record.copy();
    assertThat(copy).isEqualTo(record).hasSameHashCodeAs(record);

    copy.setEtag("\"other\"");
    copy.putExtension("more", 1);
    assertThat(record.etag()).isEqualTo("\"abc\"");
    assertThat(record.extensions()).doesNotContainKey("more");
  }

  private static ValidatorRecord populatedRecord() {
    var record = new ValidatorRecord();
    record.setEtag("\"abc\"");
    record.setLastModified("Sat, 01 Jun 2024 00:00:00 GMT");
    record.setCacheControl("public, max-age=30");
    record.setSourceUrl("https://example.com/channel/linux-64");
    record.stamp(1000L, 2000L);
    record.putExtension("has_zst", true);
    return record;
  }
}
