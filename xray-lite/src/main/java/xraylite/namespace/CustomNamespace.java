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

/** Local work, named with the context's prefix. Adds no details to the subsegment. */
public final class CustomNamespace implements Namespace {
  public static CustomNamespace create(String name) {
    return new CustomNamespace(name);
  }

  final String name;

  CustomNamespace(String name) {
    if (name == null) throw new NullPointerException("name == null");
    this.name = name;
  }

  @Override public String name(String prefix) {
    return prefix + name;
  }

  @Override public void update(Subsegment subsegment) {
  }

  @Override public String toString() {
    return "CustomNamespace{name=" + name + "}";
  }
}
