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

import java.io.Closeable;
import java.io.IOException;
import xraylite.client.Client;
import xraylite.internal.Nullable;
import xraylite.internal.Platform;
import xraylite.namespace.Namespace;
import xraylite.propagation.Header;
import xraylite.segment.Subsegment;

/**
 * Tracks one subsegment from begin to end. A session is either entered, meaning the in-progress
 * record was sent, or {@linkplain #isNoop() noop}, meaning it wasn't and nothing else will be.
 *
 * <p>Usage is like this:
 * <pre>{@code
 * try (SubsegmentSession<AwsNamespace> session = context.enterSubsegment(namespace)) {
 *   String traceId = session.xAmznTraceId();
 *   if (traceId != null) request.header(Header.NAME, traceId);
 *   Response response = invoke(request);
 *   AwsNamespace ns = session.namespace();
 *   if (ns != null) {
 *     ns.responseStatus(response.status());
 *     if (response.requestId() != null) ns.requestId(response.requestId());
 *   }
 * }
 * }</pre>
 *
 * <p>Sessions are owned by the caller that entered them and are not thread-safe. None of the
 * methods here throw: failures to send are logged at {@linkplain java.util.logging.Level#FINE
 * fine} level.
 *
 * @param <N> the namespace describing the work, mutable until close
 */
public abstract class SubsegmentSession<N extends Namespace> implements Closeable {
  /**
   * Begins a subsegment under the header and sends it. Returns a noop session if the client is
   * noop or the send failed.
   */
  public static <N extends Namespace> SubsegmentSession<N> create(Client client, Header header,
      N namespace, String namePrefix, Clock clock) {
    if (client == null) throw new NullPointerException("client == null");
    if (header == null) throw new NullPointerException("header == null");
    if (namespace == null) throw new NullPointerException("namespace == null");
    if (namePrefix == null) throw new NullPointerException("namePrefix == null");
    if (clock == null) throw new NullPointerException("clock == null");
    if (client.isNoop()) return failed();

    Subsegment subsegment;
    try {
      subsegment = Subsegment.begin(header.traceId(), header.parentId(),
          namespace.name(namePrefix), clock);
      namespace.update(subsegment);
      client.send(subsegment);
    } catch (IOException | RuntimeException e) {
      Platform.get().log("error sending subsegment for {0}", namespace, e);
      return failed();
    }
    return new EnteredSubsegmentSession<>(client, header.withParentId(subsegment.id()), namespace,
        subsegment, clock);
  }

  /** Returns a session that sends nothing. */
  @SuppressWarnings("unchecked")
  public static <N extends Namespace> SubsegmentSession<N> failed() {
    return (SubsegmentSession<N>) (SubsegmentSession<?>) FailedSubsegmentSession.INSTANCE;
  }

  /** Returns true if the subsegment wasn't sent, so nothing will be recorded on close. */
  public abstract boolean isNoop();

  /**
   * Returns the header to propagate to the callee, whose parent is this subsegment, or null when
   * {@linkplain #isNoop() noop}.
   */
  @Nullable public abstract Header header();

  /**
   * Returns the {@value Header#NAME} header value to add to the outgoing request, or null when
   * {@linkplain #isNoop() noop}.
   */
  @Nullable public abstract String xAmznTraceId();

  /**
   * Returns the namespace so that response details can be added before close, or null when
   * {@linkplain #isNoop() noop}.
   */
  @Nullable public abstract N namespace();

  /** Ends the subsegment and sends it. Only the first call has any effect. */
  @Override public abstract void close();

  SubsegmentSession() {
  }
}
