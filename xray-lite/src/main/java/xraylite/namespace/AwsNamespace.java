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

import xraylite.internal.Nullable;
import xraylite.segment.Subsegment;

/**
 * A call to an AWS service, such as {@code S3 GetObject}. The subsegment is named after the
 * service so the X-Ray console groups calls per service.
 */
public final class AwsNamespace implements Namespace {
  public static final String NAMESPACE = "aws";

  public static AwsNamespace create(String service, String operation) {
    return new AwsNamespace(service, operation);
  }

  final String service, operation;
  @Nullable String requestId;
  int responseStatus;

  AwsNamespace(String service, String operation) {
    if (service == null) throw new NullPointerException("service == null");
    if (operation == null) throw new NullPointerException("operation == null");
    this.service = service;
    this.operation = operation;
  }

  public String service() {
    return service;
  }

  public String operation() {
    return operation;
  }

  @Nullable public String requestId() {
    return requestId;
  }

  /**
   * Sets the request ID returned by the service, usually after the response arrived. Check the
   * response has one first: null is rejected.
   */
  public AwsNamespace requestId(String requestId) {
    if (requestId == null) throw new NullPointerException("requestId == null");
    this.requestId = requestId;
    return this;
  }

  public int responseStatus() {
    return responseStatus;
  }

  public AwsNamespace responseStatus(int responseStatus) {
    if (responseStatus <= 0) throw new IllegalArgumentException("responseStatus <= 0");
    this.responseStatus = responseStatus;
    return this;
  }

  @Override public String name(String prefix) {
    return service;
  }

  @Override public void update(Subsegment subsegment) {
    subsegment.namespaceIfAbsent(NAMESPACE);
    subsegment.awsOperationIfAbsent(operation);
    if (requestId != null) subsegment.awsRequestIdIfAbsent(requestId);
    if (responseStatus != 0) subsegment.httpResponseStatusIfAbsent(responseStatus);
  }

  @Override public String toString() {
    return "AwsNamespace{service=" + service + ", operation=" + operation + "}";
  }
}
