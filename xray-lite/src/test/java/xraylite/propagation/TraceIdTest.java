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

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TraceIdTest {
  @Test void create_format() {
    String traceId = TraceId.create().toString();

    assertThat(traceId).matches("1-[0-9a-f]{8}-[0-9a-f]{24}");
  }

  @Test void create_epochSeconds() {
    long epochSeconds = System.currentTimeMillis() / 1000;

    String traceId = TraceId.create().toString();

    assertThat(Long.parseLong(traceId.substring(2, 10), 16))
        .isBetween(epochSeconds, epochSeconds + 1);
  }

  @Test void create_unique() {
    assertThat(TraceId.create()).isNotEqualTo(TraceId.create());
  }

  @Test void of_keepsValueVerbatim() {
    assertThat(TraceId.of("Hello")).hasToString("Hello");
  }

  @Test void of_equality() {
    assertThat(TraceId.of("1-5759e988-bd862e3fe1be46a994272793"))
        .isEqualTo(TraceId.of("1-5759e988-bd862e3fe1be46a994272793"))
        .hasSameHashCodeAs(TraceId.of("1-5759e988-bd862e3fe1be46a994272793"));
  }

  @Test void of_rejectsEmpty() {
    assertThatThrownBy(() -> TraceId.of(""))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> TraceId.of(null))
        .isInstanceOf(NullPointerException.class);
  }
}
