/*
 * Copyright 2013-2020 The OpenZipkin Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License
 * is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied. See the License for the specific language governing permissions and limitations under
 * the License.
 */
package xraylite.propagation;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads and writes the {@code X-Amzn-Trace-Id} format. Fields are separated by {@code ;} and
 * written in a fixed order: {@code Root}, {@code Parent}, {@code Sampled}, then any additional
 * data.
 *
 * <p>Ex. {@code Root=1-5759e988-bd862e3fe1be46a994272793;Parent=53995c3f42cd8ad8;Sampled=1}
 */
public final class AmznTraceIdFormat {
  static final String ROOT = "Root", PARENT = "Parent", SAMPLED = "Sampled", SELF = "Self";

  /**
   * Parses the header, trimming whitespace around each field. The value of a field is everything
   * after its first {@code =}. An empty {@code Parent} is read as no parent, and other fields are
   * kept as-is, even with an empty key.
   *
   * @throws IllegalArgumentException on a field without {@code =} or a missing or empty root
   */
  public static Header parseAmznTraceId(String amznTraceId) {
    if (amznTraceId == null) throw new NullPointerException("amznTraceId == null");

    TraceId traceId = null;
    SegmentId parentId = null;
    SamplingDecision samplingDecision = SamplingDecision.UNKNOWN;
    LinkedHashMap<String, String> additionalData = null;

    for (String field : amznTraceId.split(";", -1)) {
      field = field.trim();
      int equals = field.indexOf('=');
      if (equals == -1) {
        throw new IllegalArgumentException("invalid key=value: no '=' found in '" + field + "'");
      }
      String key = field.substring(0, equals), value = field.substring(equals + 1);
      if (key.equals(ROOT)) {
        if (value.isEmpty()) throw new IllegalArgumentException("empty Root in '" + field + "'");
        traceId = TraceId.of(value);
      } else if (key.equals(PARENT)) {
        parentId = value.isEmpty() ? null : SegmentId.of(value); // empty means no parent
      } else if (key.equals(SAMPLED)) {
        samplingDecision = SamplingDecision.fromValue(value);
      } else if (key.equals(SELF)) {
        // ALB adds this for its own request logs. We drop it
      } else {
        if (additionalData == null) additionalData = new LinkedHashMap<>();
        additionalData.put(key, value);
      }
    }

    if (traceId == null) {
      throw new IllegalArgumentException("missing Root in '" + amznTraceId + "'");
    }
    Header.Builder builder =
        Header.newBuilder(traceId).parentId(parentId).samplingDecision(samplingDecision);
    if (additionalData != null) builder.additionalData.putAll(additionalData);
    return builder.build();
  }

  public static String writeAmznTraceId(Header header) {
    if (header == null) throw new NullPointerException("header == null");
    StringBuilder result = new StringBuilder(74); // common size with root, parent and sampled
    result.append(ROOT).append('=').append(header.traceId);
    if (header.parentId != null) {
      result.append(';').append(PARENT).append('=').append(header.parentId);
    }
    String sampled = header.samplingDecision.field();
    if (sampled != null) result.append(';').append(sampled);
    for (Map.Entry<String, String> entry : header.additionalData.entrySet()) {
      result.append(';').append(entry.getKey()).append('=').append(entry.getValue());
    }
    return result.toString();
  }

  static boolean isReserved(String key) {
    return key.equals(ROOT) || key.equals(PARENT) || key.equals(SAMPLED) || key.equals(SELF);
  }

  AmznTraceIdFormat() {
  }
}
