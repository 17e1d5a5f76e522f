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
package xraylite.segment;

import xraylite.internal.Nullable;

/** The {@code aws} block of a subsegment: details of a call to an AWS service. */
public final class AwsOperation {
  @Nullable String operation, requestId;

  AwsOperation() {
  }

  /** The API name, for example {@code GetObject}. */
  @Nullable public String operation() {
    return operation;
  }

  /** The request ID the service returned, for correlation with its logs. */
  @Nullable public String requestId() {
    return requestId;
  }
}
