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
package xraylite.client;

import java.io.IOException;
import xraylite.segment.Subsegment;
import zipkin2.Component;

/**
 * Sends subsegment records to an X-Ray collector, usually the local daemon. Implementations are
 * shared by any number of sessions and must be safe for concurrent use.
 *
 * <p>Sending is best-effort: a client never retries or buffers. Callers decide what to do with a
 * failure, and sessions only log it.
 */
public abstract class Client extends Component {
  /**
   * Sends the current state of the subsegment as a single record.
   *
   * @throws IOException if the record could not be encoded or written
   */
  public abstract void send(Subsegment subsegment) throws IOException;

  /** Returns true if this client drops every record, so callers can skip building them. */
  public boolean isNoop() {
    return false;
  }
}
