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

import java.nio.charset.StandardCharsets;
import xraylite.Clock;
import xraylite.internal.Nullable;
import xraylite.propagation.SegmentId;
import xraylite.propagation.TraceId;

/**
 * A unit of work recorded under a parent segment. This is the record sent to the X-Ray daemon,
 * once when begun (in progress) and again when ended.
 *
 * <p>Decoration uses "set if absent" semantics: a value already present is never overwritten.
 * This lets a namespace re-apply its data when the subsegment ends without clobbering fields set
 * in between.
 *
 * <p>This type is not thread-safe. It is owned by a single session.
 */
public final class Subsegment {
  public static final String TYPE = "subsegment";

  /**
   * Starts a new in-progress subsegment with a fresh ID.
   *
   * @param parentId the segment this is a child of, or null if unknown
   */
  public static Subsegment begin(TraceId traceId, @Nullable SegmentId parentId, String name,
      Clock clock) {
    if (traceId == null) throw new NullPointerException("traceId == null");
    if (name == null) throw new NullPointerException("name == null");
    if (clock == null) throw new NullPointerException("clock == null");
    return new Subsegment(SegmentId.create(), traceId, parentId, name,
        clock.currentTimeMicroseconds());
  }

  final SegmentId id;
  final TraceId traceId;
  @Nullable final SegmentId parentId;
  final String name;
  final long startTimestamp;
  long endTimestamp;
  boolean inProgress = true;
  @Nullable String namespace;
  @Nullable AwsOperation aws;
  @Nullable Http http;

  Subsegment(SegmentId id, TraceId traceId, @Nullable SegmentId parentId, String name,
      long startTimestamp) {
    this.id = id;
    this.traceId = traceId;
    this.parentId = parentId;
    this.name = name;
    this.startTimestamp = startTimestamp;
  }

  public SegmentId id() {
    return id;
  }

  public TraceId traceId() {
    return traceId;
  }

  @Nullable public SegmentId parentId() {
    return parentId;
  }

  public String name() {
    return name;
  }

  /** Epoch microseconds when this began. */
  public long startTimestamp() {
    return startTimestamp;
  }

  /** Epoch microseconds when this ended, or zero while {@link #inProgress()}. */
  public long endTimestamp() {
    return endTimestamp;
  }

  public boolean inProgress() {
    return inProgress;
  }

  /** {@code aws}, {@code remote} or null. */
  @Nullable public String namespace() {
    return namespace;
  }

  @Nullable public AwsOperation aws() {
    return aws;
  }

  @Nullable public Http http() {
    return http;
  }

  /**
   * Records the end time and clears the in-progress flag. The end time is never before the start,
   * even if the clock moved backwards.
   */
  public void end(Clock clock) {
    if (clock == null) throw new NullPointerException("clock == null");
    long now = clock.currentTimeMicroseconds();
    endTimestamp = Math.max(now, startTimestamp);
    inProgress = false;
  }

  public void namespaceIfAbsent(String namespace) {
    if (namespace == null) throw new NullPointerException("namespace == null");
    if (this.namespace == null) this.namespace = namespace;
  }

  public void awsOperationIfAbsent(String operation) {
    if (operation == null) throw new NullPointerException("operation == null");
    AwsOperation aws = mutableAws();
    if (aws.operation == null) aws.operation = operation;
  }

  public void awsRequestIdIfAbsent(String requestId) {
    if (requestId == null) throw new NullPointerException("requestId == null");
    AwsOperation aws = mutableAws();
    if (aws.requestId == null) aws.requestId = requestId;
  }

  public void httpRequestIfAbsent(String method, String url) {
    if (method == null) throw new NullPointerException("method == null");
    if (url == null) throw new NullPointerException("url == null");
    Http http = mutableHttp();
    if (http.request == null) http.request = new HttpRequest();
    if (http.request.method == null) http.request.method = method;
    if (http.request.url == null) http.request.url = url;
  }

  /** Sets the response status, independently of whether request details are known. */
  public void httpResponseStatusIfAbsent(int status) {
    if (status <= 0) throw new IllegalArgumentException("status <= 0");
    Http http = mutableHttp();
    if (http.response == null) http.response = new HttpResponse();
    if (http.response.status == 0) http.response.status = status;
  }

  AwsOperation mutableAws() {
    if (aws == null) aws = new AwsOperation();
    return aws;
  }

  Http mutableHttp() {
    if (http == null) http = new Http();
    return http;
  }

  /** Returns the JSON representation sent to the daemon. */
  @Override public String toString() {
    return new String(SubsegmentBytesEncoder.JSON.encode(this), StandardCharsets.UTF_8);
  }
}
