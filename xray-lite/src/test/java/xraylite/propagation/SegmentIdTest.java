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

class SegmentIdTest {
  @Test void create_sixteenLowerHex() {
    assertThat(SegmentId.create().toString()).matches("[0-9a-f]{16}");
  }

  @Test void create_nonZero() {
    for (int i = 0; i < 1000; i++) {
      assertThat(SegmentId.create().toString()).isNotEqualTo("0000000000000000");
    }
  }

  @Test void of_equality() {
    assertThat(SegmentId.of("53995c3f42cd8ad8"))
        .isEqualTo(SegmentId.of("53995c3f42cd8ad8"))
        .isNotEqualTo(SegmentId.of("463ac35c9f6413ad"));
  }

  @Test void of_rejectsEmpty() {
    assertThatThrownBy(() -> SegmentId.of(""))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
