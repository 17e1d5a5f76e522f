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

import xraylite.internal.Nullable;

/** Raised when tracing can't be configured from the environment. */
public final class ConfigException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public enum Reason {
    MISSING_VARIABLE,
    BAD_CONFIG
  }

  public static ConfigException missingVariable(String name) {
    return new ConfigException(Reason.MISSING_VARIABLE, name,
        "missing environment variable: " + name, null);
  }

  public static ConfigException badConfig(String message, @Nullable Throwable cause) {
    return new ConfigException(Reason.BAD_CONFIG, null, message, cause);
  }

  final Reason reason;
  @Nullable final String variable;

  ConfigException(Reason reason, @Nullable String variable, String message,
      @Nullable Throwable cause) {
    super(message, cause);
    this.reason = reason;
    this.variable = variable;
  }

  public Reason reason() {
    return reason;
  }

  /** The name of the missing environment variable, or null. */
  @Nullable public String variable() {
    return variable;
  }
}
