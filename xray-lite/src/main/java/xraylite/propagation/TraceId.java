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

import xraylite.internal.Platform;

import static xraylite.internal.HexCodec.writeHexInt;
import static xraylite.internal.HexCodec.writeHexLong;

/**
 * Identifies an end-to-end trace. Generated values look like {@code
 * 1-58406520-a006649127e371903a2de979}: a version, the epoch seconds in hex, and 96 random bits.
 *
 * <p>Parsed values are kept verbatim, so a trace ID from another tracer round-trips unchanged.
 */
public final class TraceId {
  /** Creates a new trace ID, version 1, stamped with the current epoch seconds. */
  public static TraceId create() {
    Platform platform = Platform.get();
    long high = platform.nextTraceIdHigh();
    char[] result = new char[35];
    result[0] = '1'; // version
    result[1] = '-'; // delimiter
    writeHexInt(result, 2, (int) (high >>> 32L));
    result[10] = '-';
    writeHexInt(result, 11, (int) high);
    writeHexLong(result, 19, platform.randomLong());
    return new TraceId(new String(result));
  }

  /** Wraps an already rendered trace ID, such as the {@code Root} field of a header. */
  public static TraceId of(String value) {
    if (value == null) throw new NullPointerException("value == null");
    if (value.isEmpty()) throw new IllegalArgumentException("trace ID is empty");
    return new TraceId(value);
  }

  final String value;

  TraceId(String value) {
    this.value = value;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof TraceId)) return false;
    return value.equals(((TraceId) o).value);
  }

  @Override public int hashCode() {
    return value.hashCode();
  }

  /** Returns the rendered form, for example {@code 1-58406520-a006649127e371903a2de979}. */
  @Override public String toString() {
    return value;
  }
}
