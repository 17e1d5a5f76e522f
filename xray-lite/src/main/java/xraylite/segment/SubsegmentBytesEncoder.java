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

import java.util.List;
import xraylite.internal.codec.JsonWriter;
import xraylite.internal.codec.SubsegmentJsonWriter;
import xraylite.internal.codec.WriteBuffer;
import zipkin2.codec.BytesEncoder;
import zipkin2.codec.Encoding;

/** Encodes subsegments as the documents the X-Ray daemon accepts. */
public enum SubsegmentBytesEncoder implements BytesEncoder<Subsegment> {
  /** The only format the daemon accepts: a UTF-8 JSON object per subsegment. */
  JSON {
    final WriteBuffer.Writer<Subsegment> writer = new SubsegmentJsonWriter();

    @Override public Encoding encoding() {
      return Encoding.JSON;
    }

    @Override public int sizeInBytes(Subsegment input) {
      return writer.sizeInBytes(input);
    }

    @Override public byte[] encode(Subsegment input) {
      return JsonWriter.write(writer, input);
    }

    @Override public byte[] encodeList(List<Subsegment> input) {
      return JsonWriter.writeList(writer, input);
    }
  }
}
