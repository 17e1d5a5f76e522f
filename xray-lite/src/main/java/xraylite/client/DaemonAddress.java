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

import java.net.InetSocketAddress;

/**
 * Parses the daemon address format used by {@code AWS_XRAY_DAEMON_ADDRESS}: {@code host:port},
 * {@code [ipv6]:port}, or the dual form {@code tcp:host:port udp:host:port}. Only the UDP address
 * is used, as segments are sent as datagrams.
 */
public final class DaemonAddress {
  public static final String DEFAULT_HOST = "127.0.0.1";
  public static final int DEFAULT_PORT = 2000;

  /** The address the daemon listens on when not configured. */
  public static InetSocketAddress defaultAddress() {
    return new InetSocketAddress(DEFAULT_HOST, DEFAULT_PORT);
  }

  /** @throws IllegalArgumentException if the input isn't a resolvable address */
  public static InetSocketAddress parse(String address) {
    if (address == null) throw new NullPointerException("address == null");
    String udp = address.trim();
    if (udp.isEmpty()) throw new IllegalArgumentException("daemon address is empty");
    if (udp.indexOf(' ') != -1) udp = udpPart(udp);
    if (udp.startsWith("udp:")) udp = udp.substring(4);

    int colon = udp.lastIndexOf(':');
    if (colon <= 0 || colon == udp.length() - 1) {
      throw new IllegalArgumentException("expected host:port, but was " + address);
    }
    String host = udp.substring(0, colon);
    if (host.charAt(0) == '[') {
      if (host.charAt(host.length() - 1) != ']') {
        throw new IllegalArgumentException("unterminated IPv6 literal in " + address);
      }
      host = host.substring(1, host.length() - 1);
    } else if (host.indexOf(':') != -1) {
      throw new IllegalArgumentException("IPv6 literals must be bracketed in " + address);
    }
    if (host.isEmpty()) throw new IllegalArgumentException("empty host in " + address);

    int port;
    try {
      port = Integer.parseInt(udp.substring(colon + 1));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("invalid port in " + address, e);
    }
    if (port < 1 || port > 0xffff) {
      throw new IllegalArgumentException("port out of range in " + address);
    }

    InetSocketAddress result = new InetSocketAddress(host, port);
    if (result.isUnresolved()) {
      throw new IllegalArgumentException("could not resolve " + host + " in " + address);
    }
    return result;
  }

  static String udpPart(String dual) {
    for (String part : dual.split(" ")) {
      if (part.startsWith("udp:")) return part;
    }
    throw new IllegalArgumentException("no udp address in " + dual);
  }

  DaemonAddress() {
  }
}
