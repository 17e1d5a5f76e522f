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

import java.net.InetSocketAddress;
import java.util.Map;
import java.util.Properties;
import xraylite.client.DaemonAddress;
import xraylite.propagation.Header;

/**
 * Reads tracing configuration supplied by AWS Lambda.
 *
 * <p>The trace header changes on each invocation. The Java runtime publishes it in the system
 * property {@value #TRACE_HEADER_PROPERTY}, so that is read before the environment variable
 * {@value #TRACE_HEADER_VARIABLE}. Read it per invocation: don't cache the result.
 */
public final class LambdaEnvironment {
  public static final String TRACE_HEADER_VARIABLE = "_X_AMZN_TRACE_ID";
  public static final String TRACE_HEADER_PROPERTY = "com.amazonaws.xray.traceHeader";
  public static final String DAEMON_ADDRESS_VARIABLE = "AWS_XRAY_DAEMON_ADDRESS";

  /** @throws ConfigException if the header is missing or malformed */
  public static Header header() {
    return header(System.getenv(), System.getProperties());
  }

  public static Header header(Map<String, String> env, Properties properties) {
    String value = properties.getProperty(TRACE_HEADER_PROPERTY);
    if (value == null || value.isEmpty()) value = env.get(TRACE_HEADER_VARIABLE);
    if (value == null || value.isEmpty()) {
      throw ConfigException.missingVariable(TRACE_HEADER_VARIABLE);
    }
    try {
      return Header.parse(value);
    } catch (IllegalArgumentException e) {
      throw ConfigException.badConfig("invalid trace header: " + e.getMessage(), e);
    }
  }

  /** @throws ConfigException if the address is missing or malformed */
  public static InetSocketAddress daemonAddress() {
    return daemonAddress(System.getenv());
  }

  public static InetSocketAddress daemonAddress(Map<String, String> env) {
    String value = env.get(DAEMON_ADDRESS_VARIABLE);
    if (value == null || value.isEmpty()) {
      throw ConfigException.missingVariable(DAEMON_ADDRESS_VARIABLE);
    }
    try {
      return DaemonAddress.parse(value);
    } catch (IllegalArgumentException e) {
      throw ConfigException.badConfig(
          "invalid " + DAEMON_ADDRESS_VARIABLE + ": " + e.getMessage(), e);
    }
  }

  LambdaEnvironment() {
  }
}
