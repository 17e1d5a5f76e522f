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

/** The {@code http} block of a subsegment. Request and response are filled independently. */
public final class Http {
  @Nullable HttpRequest request;
  @Nullable HttpResponse response;

  Http() {
  }

  @Nullable public HttpRequest request() {
    return request;
  }

  @Nullable public HttpResponse response() {
    return response;
  }
}
