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

import java.io.IOException;
import xraylite.client.Client;
import xraylite.internal.Platform;
import xraylite.namespace.Namespace;
import xraylite.propagation.Header;
import xraylite.segment.Subsegment;

/** A session whose in-progress record was sent. */
final class EnteredSubsegmentSession<N extends Namespace> extends SubsegmentSession<N> {
  final Client client;
  final Header header;
  final N namespace;
  final Subsegment subsegment;
  final Clock clock;
  boolean closed;

  EnteredSubsegmentSession(Client client, Header header, N namespace, Subsegment subsegment,
      Clock clock) {
    this.client = client;
    this.header = header;
    this.namespace = namespace;
    this.subsegment = subsegment;
    this.clock = clock;
  }

  @Override public boolean isNoop() {
    return false;
  }

  @Override public Header header() {
    return header;
  }

  @Override public String xAmznTraceId() {
    return header.toString();
  }

  @Override public N namespace() {
    return namespace;
  }

  @Override public void close() {
    if (closed) return;
    closed = true;
    try {
      subsegment.end(clock);
      namespace.update(subsegment);
      client.send(subsegment);
    } catch (IOException | RuntimeException e) {
      Platform.get().log("error sending end of subsegment {0}", subsegment.id(), e);
    }
  }

  @Override public String toString() {
    return "EnteredSubsegmentSession{id=" + subsegment.id() + ", name=" + subsegment.name() + "}";
  }
}
