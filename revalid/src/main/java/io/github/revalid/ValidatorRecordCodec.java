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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.cfg.JsonNodeFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.util.Map;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Reads and writes the JSON state file that accompanies a cached artifact. The persisted names are
 * {@code etag}, {@code mod}, {@code cache_control}, {@code size}, {@code mtime_ns} and {@code url}.
 * Older state files used underscore-prefixed names for some of these, which are migrated on
 * decode.
 */
final class ValidatorRecordCodec {
  static final String ETAG = "etag";
  static final String LAST_MODIFIED = "mod";
  static final String CACHE_CONTROL = "cache_control";
  static final String SIZE = "size";
  static final String MTIME_NS = "mtime_ns";
  static final String URL = "url";

  /** Legacy name to canonical name. */
  static final Map<String, String> LEGACY_ALIASES =
      Map.of(
          "_etag", ETAG,
          "_mod", LAST_MODIFIED,
          "_cache_control", CACHE_CONTROL,
          "_url", URL);

  private static final Set<String> CANONICAL_NAMES =
      Set.of(ETAG, LAST_MODIFIED, CACHE_CONTROL, SIZE, MTIME_NS, URL);

  /** Reads decimals as {@code BigDecimal}s as written so extension fields keep their precision. */
  private static final ObjectMapper MAPPER =
      new ObjectMapper()
          .enable(SerializationFeature.INDENT_OUTPUT)
          .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
          .configure(JsonNodeFeature.STRIP_TRAILING_BIGDECIMAL_ZEROES, false);

  private ValidatorRecordCodec() {}

  static boolean isReservedName(String name) {
    return CANONICAL_NAMES.contains(name) || LEGACY_ALIASES.containsKey(name);
  }

  static ValidatorRecord decode(String json) throws IOException {
    var tree = MAPPER.readTree(json);
    if (tree == null || !tree.isObject()) {
      throw new IOException("state is not a JSON object");
    }

    var node = migrateLegacyNames((ObjectNode) tree);
    var record = new ValidatorRecord();
    record.setEtag(textOf(node.get(ETAG)));
    record.setLastModified(textOf(node.get(LAST_MODIFIED)));
    record.setCacheControl(textOf(node.get(CACHE_CONTROL)));
    record.setSourceUrl(textOf(node.get(URL)));
    record.stamp(longOf(node.get(SIZE)), longOf(node.get(MTIME_NS)));

    var fields = node.fields();
    while (fields.hasNext()) {
      var field = fields.next();
      if (!CANONICAL_NAMES.contains(field.getKey())) {
        record.putExtensionUnchecked(
            field.getKey(), MAPPER.treeToValue(field.getValue(), Object.class));
      }
    }
    return record;
  }

  static String encode(ValidatorRecord record) {
    var node = MAPPER.createObjectNode();
    node.put(ETAG, record.etag());
    node.put(LAST_MODIFIED, record.lastModified());
    node.put(CACHE_CONTROL, record.cacheControl());
    node.put(SIZE, record.size());
    node.put(MTIME_NS, record.mtimeNs());
    node.put(URL, record.sourceUrl());
    record
        .extensions()
        .forEach(
            (name, value) ->
                node.set(name, value != null ? MAPPER.valueToTree(value) : node.nullNode()));
    try {
      return MAPPER.writeValueAsString(node);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("unserializable extension field", e);
    }
  }

  /**
   * Rewrites legacy names to their canonical counterparts. A canonical name that's already present
   * takes precedence over its legacy alias.
   */
  static ObjectNode migrateLegacyNames(ObjectNode node) {
    for (var name : LEGACY_ALIASES.keySet()) {
      var legacyValue = node.remove(name);
      if (legacyValue != null) {
        var canonicalName = LEGACY_ALIASES.get(name);
        if (!node.has(canonicalName)) {
          node.set(canonicalName, legacyValue);
        }
      }
    }
    return node;
  }

  private static String textOf(@Nullable JsonNode node) {
    return node != null && node.isValueNode() && !node.isNull() ? node.asText() : "";
  }

  private static long longOf(@Nullable JsonNode node) {
    return node != null && node.isIntegralNumber() ? node.asLong() : 0L;
  }
}
