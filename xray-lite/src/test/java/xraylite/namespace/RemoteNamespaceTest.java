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
package xraylite.namespace;

import org.junit.jupiter.api.Test;
import xraylite.propagation.TraceId;
import xraylite.segment.Subsegment;

import static org.assertj.core.api.Assertions.assertThat;

class RemoteNamespaceTest {
  RemoteNamespace namespace = RemoteNamespace.create("api.example.com", "GET",
      "https://api.example.com/users");
  Subsegment subsegment = Subsegment.begin(
      TraceId.of("1-581cf771-a006649127e371903a2de979"), null, "api", () -> 1000000L);

  @Test void name_ignoresPrefix() {
    assertThat(namespace.name("prefix-")).isEqualTo("api.example.com");
  }

  @Test void update() {
    namespace.update(subsegment);

    assertThat(subsegment.namespace()).isEqualTo("remote");
    assertThat(subsegment.http().request().method()).isEqualTo("GET");
    assertThat(subsegment.http().request().url()).isEqualTo("https://api.example.com/users");
    assertThat(subsegment.http().response()).isNull();
    assertThat(subsegment.aws()).isNull();
  }

  @Test void update_thenResponseStatus() {
    namespace.update(subsegment);
    namespace.responseStatus(503);
    namespace.update(subsegment);

    assertThat(subsegment.http().request().method()).isEqualTo("GET");
    assertThat(subsegment.http().response().status()).isEqualTo(503);
  }

  @Test void responseStatusBeforeRequest() {
    subsegment.httpResponseStatusIfAbsent(404);

    namespace.responseStatus(200).update(subsegment);

    assertThat(subsegment.http().request().url()).isEqualTo("https://api.example.com/users");
    assertThat(subsegment.http().response().status()).isEqualTo(404);
  }
}
