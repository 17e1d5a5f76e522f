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
package xraylite.test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import xraylite.client.Client;
import xraylite.segment.Subsegment;

/** Records the JSON of each subsegment sent, or fails every send when configured to. */
public final class TestClient extends Client {
  final List<String> records = new ArrayList<>();
  IOException failure;

  /** Subsequent sends throw this instead of recording. */
  public TestClient failWith(IOException failure) {
    this.failure = failure;
    return this;
  }

  @Override public synchronized void send(Subsegment subsegment) throws IOException {
    if (failure != null) throw failure;
    records.add(subsegment.toString());
  }

  public synchronized List<String> records() {
    return new ArrayList<>(records);
  }

  @Override public String toString() {
    return "TestClient{}";
  }
}
