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

import xraylite.client.Client;
import xraylite.internal.Platform;
import xraylite.namespace.Namespace;
import xraylite.propagation.Header;

/**
 * Enters subsegments under one trace header, sending them with a shared client.
 *
 * <p>Create one per inbound request, as the header differs each time:
 * <pre>{@code
 * context = SubsegmentContext.newBuilder(client, Header.parse(request.header(Header.NAME)))
 *   .namePrefix("orders-")
 *   .build();
 * }</pre>
 */
public final class SubsegmentContext implements Context {
  /**
   * Returns a context for the current Lambda invocation.
   *
   * @throws ConfigException if the trace header isn't available
   */
  public static SubsegmentContext fromLambdaEnv(Client client) {
    return newBuilder(client, LambdaEnvironment.header()).build();
  }

  public static Builder newBuilder(Client client, Header header) {
    return new Builder(client, header);
  }

  public static final class Builder {
    final Client client;
    final Header header;
    String namePrefix = "";
    Clock clock;

    Builder(Client client, Header header) {
      if (client == null) throw new NullPointerException("client == null");
      if (header == null) throw new NullPointerException("header == null");
      this.client = client;
      this.header = header;
    }

    Builder(SubsegmentContext source) {
      this.client = source.client;
      this.header = source.header;
      this.namePrefix = source.namePrefix;
      this.clock = source.clock;
    }

    /** Prepended to the names of custom subsegments. Defaults to empty. */
    public Builder namePrefix(String namePrefix) {
      if (namePrefix == null) throw new NullPointerException("namePrefix == null");
      this.namePrefix = namePrefix;
      return this;
    }

    /** Defaults to the system clock, with microsecond precision where available. */
    public Builder clock(Clock clock) {
      if (clock == null) throw new NullPointerException("clock == null");
      this.clock = clock;
      return this;
    }

    public SubsegmentContext build() {
      if (clock == null) clock = Platform.get().clock();
      return new SubsegmentContext(this);
    }
  }

  final Client client;
  final Header header;
  final String namePrefix;
  final Clock clock;

  SubsegmentContext(Builder builder) {
    this.client = builder.client;
    this.header = builder.header;
    this.namePrefix = builder.namePrefix;
    this.clock = builder.clock;
  }

  public Client client() {
    return client;
  }

  /** The inbound header. Subsegments entered here are its children. */
  public Header header() {
    return header;
  }

  public String namePrefix() {
    return namePrefix;
  }

  public Clock clock() {
    return clock;
  }

  /** Returns a copy of this context using a different name prefix. */
  public SubsegmentContext withNamePrefix(String namePrefix) {
    return new Builder(this).namePrefix(namePrefix).build();
  }

  @Override public <N extends Namespace> SubsegmentSession<N> enterSubsegment(N namespace) {
    return SubsegmentSession.create(client, header, namespace, namePrefix, clock);
  }

  @Override public String toString() {
    return "SubsegmentContext{header=" + header + ", namePrefix=" + namePrefix + "}";
  }
}
