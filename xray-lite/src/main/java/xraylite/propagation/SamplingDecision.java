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

import xraylite.internal.Nullable;

/**
 * The {@code Sampled} field of a trace header. This is only parsed and forwarded: no decision is
 * made locally.
 */
public enum SamplingDecision {
  SAMPLED("Sampled=1"),
  NOT_SAMPLED("Sampled=0"),
  /** {@code Sampled=?}: the receiver is asked to decide. */
  REQUESTED("Sampled=?"),
  /** The field was absent or had an unrecognized value. Not written. */
  UNKNOWN(null);

  @Nullable final String field;

  SamplingDecision(@Nullable String field) {
    this.field = field;
  }

  /** Returns the header field, like {@code Sampled=1}, or null when {@link #UNKNOWN}. */
  @Nullable public String field() {
    return field;
  }

  static SamplingDecision fromValue(String value) {
    if (value.equals("1")) return SAMPLED;
    if (value.equals("0")) return NOT_SAMPLED;
    if (value.equals("?")) return REQUESTED;
    return UNKNOWN;
  }
}
