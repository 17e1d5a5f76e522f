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
package xraylite.segment;

import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;
import xraylite.propagation.SegmentId;
import xraylite.propagation.TraceId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SubsegmentTest {
  AtomicLong time = new AtomicLong(1600000000000000L);
  TraceId traceId = TraceId.of("1-581cf771-a006649127e371903a2de979");
  SegmentId parentId = SegmentId.of("53995c3f42cd8ad8");
  Subsegment subsegment = Subsegment.begin(traceId, parentId, "S3", time::get);

  @Test void begin() {
    assertThat(subsegment.id()).isNotNull();
    assertThat(subsegment.id().toString()).hasSize(16);
    assertThat(subsegment.traceId()).isEqualTo(traceId);
    assertThat(subsegment.parentId()).isEqualTo(parentId);
    assertThat(subsegment.name()).isEqualTo("S3");
    assertThat(subsegment.startTimestamp()).isEqualTo(1600000000000000L);
    assertThat(subsegment.endTimestamp()).isZero();
    assertThat(subsegment.inProgress()).isTrue();
    assertThat(subsegment.namespace()).isNull();
    assertThat(subsegment.aws()).isNull();
    assertThat(subsegment.http()).isNull();
  }

  @Test void begin_freshIds() {
    Subsegment other = Subsegment.begin(traceId, parentId, "S3", time::get);

    assertThat(other.id()).isNotEqualTo(subsegment.id());
  }

  @Test void end() {
    time.addAndGet(250000L);

    subsegment.end(time::get);

    assertThat(subsegment.endTimestamp()).isEqualTo(1600000000250000L);
    assertThat(subsegment.inProgress()).isFalse();
  }

  @Test void end_neverBeforeStart() {
    time.addAndGet(-1000L);

    subsegment.end(time::get);

    assertThat(subsegment.endTimestamp()).isEqualTo(subsegment.startTimestamp());
  }

  @Test void namespaceIfAbsent_doesntOverwrite() {
    subsegment.namespaceIfAbsent("aws");
    subsegment.namespaceIfAbsent("remote");

    assertThat(subsegment.namespace()).isEqualTo("aws");
  }

  @Test void awsIfAbsent_fieldsAreIndependent() {
    subsegment.awsOperationIfAbsent("GetObject");
    subsegment.awsRequestIdIfAbsent("abc");
    subsegment.awsOperationIfAbsent("PutObject");
    subsegment.awsRequestIdIfAbsent("def");

    assertThat(subsegment.aws().operation()).isEqualTo("GetObject");
    assertThat(subsegment.aws().requestId()).isEqualTo("abc");
  }

  @Test void httpRequestIfAbsent_doesntOverwrite() {
    subsegment.httpRequestIfAbsent("GET", "http://a/");
    subsegment.httpRequestIfAbsent("POST", "http://b/");

    assertThat(subsegment.http().request().method()).isEqualTo("GET");
    assertThat(subsegment.http().request().url()).isEqualTo("http://a/");
    assertThat(subsegment.http().response()).isNull();
  }

  @Test void httpResponseStatusIfAbsent_withoutRequest() {
    subsegment.httpResponseStatusIfAbsent(404);
    subsegment.httpResponseStatusIfAbsent(200);

    assertThat(subsegment.http().request()).isNull();
    assertThat(subsegment.http().response().status()).isEqualTo(404);
  }

  @Test void httpResponseStatusIfAbsent_thenRequest() {
    subsegment.httpResponseStatusIfAbsent(503);
    subsegment.httpRequestIfAbsent("GET", "http://a/");

    assertThat(subsegment.http().request().method()).isEqualTo("GET");
    assertThat(subsegment.http().response().status()).isEqualTo(503);
  }

  @Test void httpResponseStatusIfAbsent_rejectsInvalid() {
    assertThatThrownBy(() -> subsegment.httpResponseStatusIfAbsent(0))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test void begin_rejectsNulls() {
    assertThatThrownBy(() -> Subsegment.begin(null, parentId, "S3", time::get))
        .isInstanceOf(NullPointerException.class)
        .hasMessage("traceId == null");
    assertThatThrownBy(() -> Subsegment.begin(traceId, parentId, null, time::get))
        .isInstanceOf(NullPointerException.class)
        .hasMessage("name == null");
  }
}
