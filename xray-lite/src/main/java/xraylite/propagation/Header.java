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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import xraylite.internal.Nullable;

/**
 * The parsed form of the {@value #NAME} header, which carries the trace ID, parent segment and
 * sampling decision between services.
 *
 * <p>Fields this library doesn't interpret, such as {@code Lineage}, are kept in {@link
 * #additionalData()} so that they pass through to downstream calls. The {@code Self} field is
 * dropped, as it is only meaningful to the load balancer that added it.
 *
 * <p>Instances are immutable. Use {@link #toBuilder()} or the {@code with} methods to derive a
 * new header.
 */
public final class Header {
  /** The HTTP header name. Compare case-insensitively, as http/2 transports downcase names. */
  public static final String NAME = "X-Amzn-Trace-Id";

  /**
   * Parses header text like {@code Root=1-5759e988-bd862e3fe1be46a994272793;Sampled=1}.
   *
   * @throws IllegalArgumentException if a field lacks a {@code =} or the root is missing or empty
   */
  public static Header parse(String amznTraceId) {
    return AmznTraceIdFormat.parseAmznTraceId(amznTraceId);
  }

  public static Builder newBuilder(TraceId traceId) {
    return new Builder(traceId);
  }

  final TraceId traceId;
  @Nullable final SegmentId parentId;
  final SamplingDecision samplingDecision;
  final Map<String, String> additionalData;

  Header(TraceId traceId, @Nullable SegmentId parentId, SamplingDecision samplingDecision,
      Map<String, String> additionalData) {
    this.traceId = traceId;
    this.parentId = parentId;
    this.samplingDecision = samplingDecision;
    this.additionalData = additionalData;
  }

  public TraceId traceId() {
    return traceId;
  }

  @Nullable public SegmentId parentId() {
    return parentId;
  }

  public SamplingDecision samplingDecision() {
    return samplingDecision;
  }

  /** Unrecognized fields in the order they were read or added. Unmodifiable. */
  public Map<String, String> additionalData() {
    return additionalData;
  }

  /** Returns a copy of this header with the given parent, usually the ID of a new subsegment. */
  public Header withParentId(SegmentId parentId) {
    if (parentId == null) throw new NullPointerException("parentId == null");
    if (parentId.equals(this.parentId)) return this;
    return new Header(traceId, parentId, samplingDecision, additionalData);
  }

  public Header withSamplingDecision(SamplingDecision samplingDecision) {
    if (samplingDecision == null) throw new NullPointerException("samplingDecision == null");
    if (samplingDecision == this.samplingDecision) return this;
    return new Header(traceId, parentId, samplingDecision, additionalData);
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof Header)) return false;
    Header that = (Header) o;
    return traceId.equals(that.traceId)
        && (parentId == null ? that.parentId == null : parentId.equals(that.parentId))
        && samplingDecision == that.samplingDecision
        && additionalData.equals(that.additionalData);
  }

  @Override public int hashCode() {
    int h = 1000003;
    h ^= traceId.hashCode();
    h *= 1000003;
    h ^= parentId == null ? 0 : parentId.hashCode();
    h *= 1000003;
    h ^= samplingDecision.hashCode();
    h *= 1000003;
    h ^= additionalData.hashCode();
    return h;
  }

  /** Returns the header value, for example {@code Root=1-5759e988-bd862e3fe1be46a994272793}. */
  @Override public String toString() {
    return AmznTraceIdFormat.writeAmznTraceId(this);
  }

  public static final class Builder {
    TraceId traceId;
    SegmentId parentId;
    SamplingDecision samplingDecision = SamplingDecision.UNKNOWN;
    final LinkedHashMap<String, String> additionalData = new LinkedHashMap<>();

    Builder(TraceId traceId) {
      if (traceId == null) throw new NullPointerException("traceId == null");
      this.traceId = traceId;
    }

    Builder(Header source) {
      this.traceId = source.traceId;
      this.parentId = source.parentId;
      this.samplingDecision = source.samplingDecision;
      this.additionalData.putAll(source.additionalData);
    }

    public Builder traceId(TraceId traceId) {
      if (traceId == null) throw new NullPointerException("traceId == null");
      this.traceId = traceId;
      return this;
    }

    /** Null clears the parent. */
    public Builder parentId(@Nullable SegmentId parentId) {
      this.parentId = parentId;
      return this;
    }

    public Builder samplingDecision(SamplingDecision samplingDecision) {
      if (samplingDecision == null) throw new NullPointerException("samplingDecision == null");
      this.samplingDecision = samplingDecision;
      return this;
    }

    /**
     * Adds or replaces a field that will be written after the well-known ones. Replacing a key
     * keeps its original position.
     *
     * @throws IllegalArgumentException if the key is reserved or either side would corrupt the
     * header format
     */
    public Builder putAdditionalData(String key, String value) {
      if (key == null) throw new NullPointerException("key == null");
      if (value == null) throw new NullPointerException("value == null");
      if (key.isEmpty() || key.indexOf('=') != -1 || key.indexOf(';') != -1) {
        throw new IllegalArgumentException("invalid key: " + key);
      }
      if (value.indexOf(';') != -1) {
        throw new IllegalArgumentException("invalid value for " + key + ": " + value);
      }
      if (AmznTraceIdFormat.isReserved(key)) {
        throw new IllegalArgumentException(key + " is a reserved field");
      }
      additionalData.put(key, value);
      return this;
    }

    public Header build() {
      Map<String, String> data = additionalData.isEmpty()
          ? Collections.<String, String>emptyMap()
          : Collections.unmodifiableMap(new LinkedHashMap<>(additionalData));
      return new Header(traceId, parentId, samplingDecision, data);
    }
  }
}
