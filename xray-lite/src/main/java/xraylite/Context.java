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

/** Starts subsegments under the current trace header. */
public interface Context {
  /**
   * Begins a subsegment and sends it as in progress. This never throws: when the record could not
   * be sent, the session returned is {@linkplain SubsegmentSession#isNoop() noop}.
   *
   * <p>Close the result, ideally with try-with-resources, to end the subsegment.
   */
  <N extends Namespace> SubsegmentSession<N> enterSubsegment(N namespace);
}
