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
import static java.util.Objects.requireNonNullElse;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The validators of one cached index document, along with the stat of the artifact file they were
 * saved against. A record is mutable: {@link IndexFetcher} repopulates it in place after a
 * successful fetch and {@link ValidatorStore#save(ValidatorRecord)} stamps the artifact's stat
 * into it.
 *
 * <p>Besides the well-known fields, a record carries an ordered map of extension fields that are
 * persisted untouched, so that state written by newer versions survives being loaded and saved by
 * older ones.
 */
public final class ValidatorRecord {
  private String etag = "";
  private String lastModified = "";
  private String cacheControl = "";
  private String sourceUrl = "";
  private long size;
  private long mtimeNs;
  private final Map<String, @Nullable Object> extensions = new LinkedHashMap<>();

  public ValidatorRecord() {}

  /** Returns the {@code ETag} of the cached document, or an empty string if unknown. */
  public String etag() {
    return etag;
  }

  public void setEtag(@Nullable String etag) {
    this.etag = requireNonNullElse(etag, "");
  }

  /** Returns the {@code Last-Modified} of the cached document, or an empty string if unknown. */
  public String lastModified() {
    return lastModified;
  }

  public void setLastModified(@Nullable String lastModified) {
    this.lastModified = requireNonNullElse(lastModified, "");
  }

  /** Returns the {@code Cache-Control} of the cached document, or an empty string if unknown. */
  public String cacheControl() {
    return cacheControl;
  }

  public void setCacheControl(@Nullable String cacheControl) {
    this.cacheControl = requireNonNullElse(cacheControl, "");
  }

  /** Returns the channel URL the document was fetched from, or an empty string if unknown. */
  public String sourceUrl() {
    return sourceUrl;
  }

  public void setSourceUrl(@Nullable String sourceUrl) {
    this.sourceUrl = requireNonNullElse(sourceUrl, "");
  }

  /** Returns the artifact's size in bytes as of the last save, or {@code 0}. */
  public long size() {
    return size;
  }

  /** Returns the artifact's modification time in nanoseconds as of the last save, or {@code 0}. */
  public long mtimeNs() {
    return mtimeNs;
  }

  /** Returns whether this record has any validator that can make a request conditional. */
  public boolean hasValidators() {
    return !etag.isEmpty() || !lastModified.isEmpty();
  }

  /**
   * Returns an unmodifiable view of the extension fields, in insertion order. A field that's
   * persisted as a JSON {@code null} maps to {@code null}.
   */
  public Map<String, @Nullable Object> extensions() {
    return Collections.unmodifiableMap(extensions);
  }

  /**
   * Sets an extension field. Extension names can't shadow the well-known persisted fields or their
   * legacy aliases. A {@code null} value is persisted as a JSON {@code null}.
   */
  public void putExtension(String name, @Nullable Object value) {
    requireNonNull(name);
    requireArgument(
        !ValidatorRecordCodec.isReservedName(name), "reserved field name: '%s'", name);
    extensions.put(name, value);
  }

  public void removeExtension(String name) {
    extensions.remove(requireNonNull(name));
  }

  /** Resets every field, extension fields included. */
  public void clear() {
    etag = "";
    lastModified = "";
    cacheControl = "";
    sourceUrl = "";
    size = 0;
    mtimeNs = 0;
    extensions.clear();
  }

  /** Returns a deep-enough copy: extension values are shared. */
  public ValidatorRecord copy() {
    var copy = new ValidatorRecord();
    copy.etag = etag;
    copy.lastModified = lastModified;
    copy.cacheControl = cacheControl;
    copy.sourceUrl = sourceUrl;
    copy.size = size;
    copy.mtimeNs = mtimeNs;
    copy.extensions.putAll(extensions);
    return copy;
  }

  void stamp(long size, long mtimeNs) {
    this.size = size;
    this.mtimeNs = mtimeNs;
  }

  /**
   * Drops the validators so that the next fetch is unconditional. The modification time, source URL
   * and extension fields are kept.
   */
  void invalidate() {
    etag = "";
    lastModified = "";
    cacheControl = "";
    size = 0;
  }

  void putExtensionUnchecked(String name, @Nullable Object value) {
    extensions.put(name, value);
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (obj == this) {
      return true;
    }
    if (!(obj instanceof ValidatorRecord)) {
      return false;
    }
    var other = (ValidatorRecord) obj;
    return etag.equals(other.etag)
        && lastModified.equals(other.lastModified)
        && cacheControl.equals(other.cacheControl)
        && sourceUrl.equals(other.sourceUrl)
        && size == other.size
        && mtimeNs == other.mtimeNs
        && extensions.equals(other.extensions);
  }

  @Override
  public int hashCode() {
    return Objects.hash(etag, lastModified, cacheControl, sourceUrl, size, mtimeNs, extensions);
  }

  @Override
  public String toString() {
    return "ValidatorRecord[etag="
        + etag
        + ", lastModified="
        + lastModified
        + ", cacheControl="
        + cacheControl
        + ", sourceUrl="
        + sourceUrl
        + ", size="
        + size
        + ", mtimeNs="
        + mtimeNs
        + ", extensions="
        + extensions
        + "]";
  }
}
