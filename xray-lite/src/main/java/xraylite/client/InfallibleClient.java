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
package xraylite.client;

import java.io.IOException;
import java.util.function.Supplier;
import xraylite.internal.Nullable;
import xraylite.internal.Platform;
import xraylite.segment.Subsegment;
import zipkin2.CheckResult;

/**
 * A client whose construction cannot fail. When the delegate can't be built, for example because
 * the daemon address isn't configured, this becomes a noop that drops every record. The cause is
 * logged and reported by {@link #check()}.
 *
 * <p>This lets tracing be wired unconditionally without affecting the application when the
 * daemon isn't set up.
 */
public final class InfallibleClient extends Client {
  /** Returns a client built from the environment, or a noop if that failed. */
  public static InfallibleClient fromLambdaEnv() {
    return create(DaemonClient::fromLambdaEnv);
  }

  public static InfallibleClient create(Supplier<? extends Client> factory) {
    if (factory == null) throw new NullPointerException("factory == null");
    try {
      Client delegate = factory.get();
      if (delegate == null) throw new NullPointerException("factory returned null");
      return new InfallibleClient(delegate, null);
    } catch (RuntimeException e) {
      Platform.get().log("error creating client; segments will not be sent", e);
      return new InfallibleClient(null, e);
    }
  }

  @Nullable final Client delegate;
  @Nullable final RuntimeException cause;

  InfallibleClient(@Nullable Client delegate, @Nullable RuntimeException cause) {
    this.delegate = delegate;
    this.cause = cause;
  }

  /** Returns the client in use, or null if construction failed. */
  @Nullable public Client delegate() {
    return delegate;
  }

  @Override public boolean isNoop() {
    return delegate == null || delegate.isNoop();
  }

  @Override public void send(Subsegment subsegment) throws IOException {
    if (delegate != null) delegate.send(subsegment);
  }

  @Override public CheckResult check() {
    if (delegate != null) return delegate.check();
    return CheckResult.failed(cause);
  }

  @Override public void close() throws IOException {
    if (delegate != null) delegate.close();
  }

  @Override public String toString() {
    return delegate != null ? delegate.toString() : "NoopClient{cause=" + cause + "}";
  }
}
