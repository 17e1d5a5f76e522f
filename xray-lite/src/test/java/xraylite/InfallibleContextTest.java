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

import java.util.Collections;
import java.util.Properties;
import org.junit.jupiter.api.Test;
import xraylite.namespace.AwsNamespace;
import xraylite.namespace.CustomNamespace;
import xraylite.propagation.Header;
import xraylite.test.TestClient;

import static org.assertj.core.api.Assertions.assertThat;

class InfallibleContextTest {
  TestClient client = new TestClient();
  Header header = Header.parse("Root=1-5759e988-bd862e3fe1be46a994272793;Sampled=1");

  @Test void create_delegates() {
    SubsegmentContext delegate = SubsegmentContext.newBuilder(client, header).build();

    InfallibleContext context = InfallibleContext.create(() -> delegate);
    try (SubsegmentSession<CustomNamespace> session =
             context.enterSubsegment(CustomNamespace.create("work"))) {
      assertThat(session.isNoop()).isFalse();
    }

    assertThat(context.isNoop()).isFalse();
    assertThat(context.delegate()).isSameAs(delegate);
    assertThat(client.records()).hasSize(2);
  }

  @Test void create_failure_enterReturnsFailed() {
    InfallibleContext context = InfallibleContext.create(() -> SubsegmentContext.newBuilder(
        client, LambdaEnvironment.header(Collections.<String, String>emptyMap(), new Properties()))
        .build());

    SubsegmentSession<AwsNamespace> session =
        context.enterSubsegment(AwsNamespace.create("S3", "GetObject"));

    assertThat(context.isNoop()).isTrue();
    assertThat(session.isNoop()).isTrue();
    assertThat(session.xAmznTraceId()).isNull();
    session.close();
    assertThat(client.records()).isEmpty();
  }

  @Test void create_badHeader_isNoop() {
    InfallibleContext context = InfallibleContext.create(
        () -> SubsegmentContext.newBuilder(client, Header.parse("Sampled=1")).build());

    assertThat(context.isNoop()).isTrue();
  }

  @Test void fromLambdaEnv_neverThrows() {
    InfallibleContext context = InfallibleContext.fromLambdaEnv(client);

    context.enterSubsegment(CustomNamespace.create("work")).close();
  }
}
