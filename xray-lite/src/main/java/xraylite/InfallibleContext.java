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

import java.util.function.Supplier;
import xraylite.client.Client;
import xraylite.internal.Nullable;
import xraylite.internal.Platform;
import xraylite.namespace.Namespace;

/**
 * A context whose construction cannot fail. If the delegate can't be built, for example when no
 * trace header was received, every session entered is {@linkplain SubsegmentSession#isNoop()
 * noop}.
 */
public final class InfallibleContext implements Context {
  /** Returns a context for the current Lambda invocation, or a noop one if that failed. */
  public static InfallibleContext fromLambdaEnv(Client client) {
    if (client == null) throw new NullPointerException("client == null");
    return create(() -> SubsegmentContext.fromLambdaEnv(client));
  }

  public static InfallibleContext create(Supplier<? extends Context> factory) {
    if (factory == null) throw new NullPointerException("factory == null");
    try {
      Context delegate = factory.get();
      if (delegate == null) throw new NullPointerException("factory returned null");
      return new InfallibleContext(delegate);
    } catch (RuntimeException e) {
      Platform.get().log("error creating context; subsegments will not be sent", e);
      return new InfallibleContext(null);
    }
  }

  @Nullable final Context delegate;

  InfallibleContext(@Nullable Context delegate) {
    this.delegate = delegate;
  }

  /** Returns the context in use, or null if construction failed. */
  @Nullable public Context delegate() {
    return delegate;
  }

  public boolean isNoop() {
    return delegate == null;
  }

  @Override public <N extends Namespace> SubsegmentSession<N> enterSubsegment(N namespace) {
    if (delegate == null) return SubsegmentSession.failed();
    return delegate.enterSubsegment(namespace);
  }

  @Override public String toString() {
    return delegate != null ? delegate.toString() : "NoopContext{}";
  }
}
