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

/** An HTTP call to a service that isn't instrumented with X-Ray. */
public final class RemoteNamespace implements Namespace {
  public static final String NAMESPACE = "remote";

  public static RemoteNamespace create(String name, String method, String url) {
    return new RemoteNamespace(name, method, url);
  }

  final String name, method, url;
  int responseStatus;

  RemoteNamespace(String name, String method, String url) {
    if (name == null) throw new NullPointerException("name == null");
    if (method == null) throw new NullPointerException("method == null");
    if (url == null) throw new NullPointerException("url == null");
    this.name = name;
    this.method = method;
    this.url = url;
  }

  public String method() {
    return method;
  }

  public String url() {
    return url;
  }

  public int responseStatus() {
    return responseStatus;
  }

  public RemoteNamespace responseStatus(int responseStatus) {
    if (responseStatus <= 0) throw new IllegalArgumentException("responseStatus <= 0");
    this.responseStatus = responseStatus;
    return this;
  }

  @Override public String name(String prefix) {
    return name;
  }

  @Override public void update(Subsegment subsegment) {
    subsegment.namespaceIfAbsent(NAMESPACE);
    subsegment.httpRequestIfAbsent(method, url);
    if (responseStatus != 0) subsegment.httpResponseStatusIfAbsent(responseStatus);
  }

  @Override public String toString() {
    return "RemoteNamespace{name=" + name + ", method=" + method + ", url=" + url + "}";
  }
}
