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

import xraylite.internal.HexCodec;
import xraylite.internal.Platform;

/** Identifies one segment or subsegment, rendered as 16 lower-hex characters when generated. */
public final class SegmentId {
  public static SegmentId create() {
    long nextId = Platform.get().randomLong();
    while (nextId == 0L) nextId = Platform.get().randomLong();
    return new SegmentId(HexCodec.toLowerHex(nextId));
  }

  /** Wraps an already rendered segment ID, such as the {@code Parent} field of a header. */
  public static SegmentId of(String value) {
    if (value == null) throw new NullPointerException("value == null");
    if (value.isEmpty()) throw new IllegalArgumentException("segment ID is empty");
    return new SegmentId(value);
  }

  final String value;

  SegmentId(String value) {
    this.value = value;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof SegmentId)) return false;
    return value.equals(((SegmentId) o).value);
  }

  @Override public int hashCode() {
    return value.hashCode();
  }

  @Override public String toString() {
    return value;
  }
}
