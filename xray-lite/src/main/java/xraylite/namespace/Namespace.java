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

import xraylite.segment.Subsegment;

/**
 * Describes what a subsegment is calling: it names the subsegment and decorates it with details
 * such as the AWS operation or HTTP request.
 *
 * <p>{@link #update(Subsegment)} is called when the subsegment begins and again when it ends, so
 * details learned in between, such as a response status, are included in the final record.
 * Implementations must only use the "if absent" setters of {@link Subsegment}.
 */
public interface Namespace {
  /**
   * Returns the subsegment name.
   *
   * @param prefix the context's name prefix, which implementations may ignore
   */
  String name(String prefix);

  void update(Subsegment subsegment);
}
