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

import xraylite.namespace.Namespace;
import xraylite.propagation.Header;

/** A session whose subsegment was never sent. Stateless, so shared. */
final class FailedSubsegmentSession extends SubsegmentSession<Namespace> {
  static final FailedSubsegmentSession INSTANCE = new FailedSubsegmentSession();

  @Override public boolean isNoop() {
    return true;
  }

  @Override public Header header() {
    return null;
  }

  @Override public String xAmznTraceId() {
    return null;
  }

  @Override public Namespace namespace() {
    return null;
  }

  @Override public void close() {
  }

  @Override public String toString() {
    return "FailedSubsegmentSession{}";
  }
}
