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
package xraylite;

import org.junit.jupiter.api.Test;
import xraylite.internal.Platform;
import xraylite.namespace.CustomNamespace;
import xraylite.namespace.RemoteNamespace;
import xraylite.propagation.Header;
import xraylite.test.TestClient;

import static org.assertj.core.api.Assertions.assertThat;

class SubsegmentContextTest {
  TestClient client = new TestClient();
  Header header = Header.parse("Root=1-5759e988-bd862e3fe1be46a994272793;Sampled=1");
  SubsegmentContext context = SubsegmentContext.newBuilder(client, header)
      .clock(() -> 1600000000000000L)
      .build();

  @Test void defaults() {
    SubsegmentContext context = SubsegmentContext.newBuilder(client, header).build();

    assertThat(context.namePrefix()).isEmpty();
    assertThat(context.clock()).hasToString(Platform.get().clock().toString());
    assertThat(context.client()).isSameAs(client);
    assertThat(context.header()).isSameAs(header);
  }

  @Test void enterSubsegment() {
    try (SubsegmentSession<RemoteNamespace> session = context.enterSubsegment(
        RemoteNamespace.create("api", "GET", "http://api/users"))) {
      assertThat(session.xAmznTraceId())
          .startsWith("Root=1-5759e988-bd862e3fe1be46a994272793;Parent=")
          .endsWith(";Sampled=1");
      session.namespace().responseStatus(200);
    }

    assertThat(client.records()).hasSize(2);
    assertThat(client.records().get(1))
        .startsWith("{\"name\":\"api\",")
        .contains("\"start_time\":1600000000.000000,\"end_time\":1600000000.000000,")
        .contains("\"http\":{\"request\":{\"method\":\"GET\",\"url\":\"http://api/users\"},"
            + "\"response\":{\"status\":200}}");
  }

  @Test void sessionsAreSiblings() {
    SubsegmentSession<CustomNamespace> one = context.enterSubsegment(CustomNamespace.create("a"));
    SubsegmentSession<CustomNamespace> two = context.enterSubsegment(CustomNamespace.create("b"));

    assertThat(one.header().parentId()).isNotEqualTo(two.header().parentId());
    assertThat(client.records()).allSatisfy(json -> assertThat(json).doesNotContain("parent_id"));
  }

  @Test void withNamePrefix() {
    SubsegmentContext prefixed = context.withNamePrefix("orders-");

    prefixed.enterSubsegment(CustomNamespace.create("render"));

    assertThat(prefixed.namePrefix()).isEqualTo("orders-");
    assertThat(context.namePrefix()).isEmpty();
    assertThat(prefixed.clock()).isSameAs(context.clock());
    assertThat(client.records().get(0)).startsWith("{\"name\":\"orders-render\",");
  }
}
