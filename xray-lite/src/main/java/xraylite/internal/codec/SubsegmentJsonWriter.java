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
package xraylite.internal.codec;

import xraylite.segment.AwsOperation;
import xraylite.segment.Http;
import xraylite.segment.HttpRequest;
import xraylite.segment.HttpResponse;
import xraylite.segment.Subsegment;

import static xraylite.internal.codec.WriteBuffer.asciiSizeInBytes;
import static xraylite.internal.codec.WriteBuffer.epochSecondsSizeInBytes;
import static xraylite.internal.codec.WriteBuffer.jsonEscapedSizeInBytes;

/**
 * Writes a subsegment document as accepted by the X-Ray daemon. Times are fractional epoch
 * seconds. Absent fields are omitted, and {@code in_progress} is only written while true.
 */
// @Immutable
public final class SubsegmentJsonWriter implements WriteBuffer.Writer<Subsegment> {
  @Override public int sizeInBytes(Subsegment value) {
    int sizeInBytes = 1; // {
    sizeInBytes += 9; // "name":""
    sizeInBytes += jsonEscapedSizeInBytes(value.name());
    sizeInBytes += 8; // ,"id":""
    sizeInBytes += jsonEscapedSizeInBytes(value.id().toString());
    sizeInBytes += 14; // ,"start_time":
    sizeInBytes += epochSecondsSizeInBytes(value.startTimestamp());
    if (value.endTimestamp() != 0L) {
      sizeInBytes += 12; // ,"end_time":
      sizeInBytes += epochSecondsSizeInBytes(value.endTimestamp());
    }
    if (value.inProgress()) sizeInBytes += 19; // ,"in_progress":true
    sizeInBytes += 14; // ,"trace_id":""
    sizeInBytes += jsonEscapedSizeInBytes(value.traceId().toString());
    if (value.parentId() != null) {
      sizeInBytes += 15; // ,"parent_id":""
      sizeInBytes += jsonEscapedSizeInBytes(value.parentId().toString());
    }
    sizeInBytes += 20; // ,"type":"subsegment"
    if (value.namespace() != null) {
      sizeInBytes += 15; // ,"namespace":""
      sizeInBytes += jsonEscapedSizeInBytes(value.namespace());
    }
    if (value.http() != null) {
      sizeInBytes += 8; // ,"http":
      sizeInBytes += httpSizeInBytes(value.http());
    }
    if (value.aws() != null) {
      sizeInBytes += 7; // ,"aws":
      sizeInBytes += awsSizeInBytes(value.aws());
    }
    return sizeInBytes + 1; // }
  }

  @Override public void write(Subsegment value, WriteBuffer b) {
    b.writeAscii("{\"name\":\"");
    b.writeJsonEscaped(value.name());
    b.writeAscii("\",\"id\":\"");
    b.writeJsonEscaped(value.id().toString());
    b.writeAscii("\",\"start_time\":");
    b.writeEpochSeconds(value.startTimestamp());
    if (value.endTimestamp() != 0L) {
      b.writeAscii(",\"end_time\":");
      b.writeEpochSeconds(value.endTimestamp());
    }
    if (value.inProgress()) b.writeAscii(",\"in_progress\":true");
    b.writeAscii(",\"trace_id\":\"");
    b.writeJsonEscaped(value.traceId().toString());
    b.writeByte('"');
    if (value.parentId() != null) {
      b.writeAscii(",\"parent_id\":\"");
      b.writeJsonEscaped(value.parentId().toString());
      b.writeByte('"');
    }
    b.writeAscii(",\"type\":\"");
    b.writeAscii(Subsegment.TYPE);
    b.writeByte('"');
    if (value.namespace() != null) {
      b.writeAscii(",\"namespace\":\"");
      b.writeJsonEscaped(value.namespace());
      b.writeByte('"');
    }
    if (value.http() != null) {
      b.writeAscii(",\"http\":");
      writeHttp(value.http(), b);
    }
    if (value.aws() != null) {
      b.writeAscii(",\"aws\":");
      writeAws(value.aws(), b);
    }
    b.writeByte('}');
  }

  static int httpSizeInBytes(Http http) {
    int sizeInBytes = 1; // {
    if (http.request() != null) {
      sizeInBytes += 10; // "request":
      sizeInBytes += httpRequestSizeInBytes(http.request());
    }
    if (http.response() != null) {
      if (sizeInBytes > 1) sizeInBytes++; // ,
      sizeInBytes += 11; // "response":
      sizeInBytes += httpResponseSizeInBytes(http.response());
    }
    return sizeInBytes + 1; // }
  }

  static void writeHttp(Http http, WriteBuffer b) {
    b.writeByte('{');
    boolean wroteField = false;
    if (http.request() != null) {
      b.writeAscii("\"request\":");
      writeHttpRequest(http.request(), b);
      wroteField = true;
    }
    if (http.response() != null) {
      if (wroteField) b.writeByte(',');
      b.writeAscii("\"response\":");
      writeHttpResponse(http.response(), b);
    }
    b.writeByte('}');
  }

  static int httpRequestSizeInBytes(HttpRequest request) {
    int sizeInBytes = 1; // {
    if (request.method() != null) {
      sizeInBytes += 11; // "method":""
      sizeInBytes += jsonEscapedSizeInBytes(request.method());
    }
    if (request.url() != null) {
      if (sizeInBytes > 1) sizeInBytes++; // ,
      sizeInBytes += 8; // "url":""
      sizeInBytes += jsonEscapedSizeInBytes(request.url());
    }
    return sizeInBytes + 1; // }
  }

  static void writeHttpRequest(HttpRequest request, WriteBuffer b) {
    b.writeByte('{');
    boolean wroteField = false;
    if (request.method() != null) {
      b.writeAscii("\"method\":\"");
      b.writeJsonEscaped(request.method());
      b.writeByte('"');
      wroteField = true;
    }
    if (request.url() != null) {
      if (wroteField) b.writeByte(',');
      b.writeAscii("\"url\":\"");
      b.writeJsonEscaped(request.url());
      b.writeByte('"');
    }
    b.writeByte('}');
  }

  static int httpResponseSizeInBytes(HttpResponse response) {
    int sizeInBytes = 1; // {
    if (response.status() != 0) {
      sizeInBytes += 9; // "status":
      sizeInBytes += asciiSizeInBytes(response.status());
    }
    return sizeInBytes + 1; // }
  }

  static void writeHttpResponse(HttpResponse response, WriteBuffer b) {
    b.writeByte('{');
    if (response.status() != 0) {
      b.writeAscii("\"status\":");
      b.writeAscii(response.status());
    }
    b.writeByte('}');
  }

  static int awsSizeInBytes(AwsOperation aws) {
    int sizeInBytes = 1; // {
    if (aws.operation() != null) {
      sizeInBytes += 14; // "operation":""
      sizeInBytes += jsonEscapedSizeInBytes(aws.operation());
    }
    if (aws.requestId() != null) {
      if (sizeInBytes > 1) sizeInBytes++; // ,
      sizeInBytes += 15; // "request_id":""
      sizeInBytes += jsonEscapedSizeInBytes(aws.requestId());
    }
    return sizeInBytes + 1; // }
  }

  static void writeAws(AwsOperation aws, WriteBuffer b) {
    b.writeByte('{');
    boolean wroteField = false;
    if (aws.operation() != null) {
      b.writeAscii("\"operation\":\"");
      b.writeJsonEscaped(aws.operation());
      b.writeByte('"');
      wroteField = true;
    }
    if (aws.requestId() != null) {
      if (wroteField) b.writeByte(',');
      b.writeAscii("\"request_id\":\"");
      b.writeJsonEscaped(aws.requestId());
      b.writeByte('"');
    }
    b.writeByte('}');
  }
}
