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
package xraylite;

/**
 * Epoch microseconds used for {@linkplain xraylite.segment.Subsegment#startTimestamp() start} and
 * {@linkplain xraylite.segment.Subsegment#endTimestamp() end} times of a subsegment.
 *
 * <p>This type is safe to implement as a lambda, or use as a method reference. Tests use this to
 * pin timestamps.
 */
// @FunctionalInterface. Do not add methods as it will break API!
public interface Clock {

  long currentTimeMicroseconds();
}
