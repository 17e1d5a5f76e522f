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
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DaemonAddressTest {
  @Test void hostPort() {
    assertThat(DaemonAddress.parse("127.0.0.1:2000"))
        .isEqualTo(new InetSocketAddress("127.0.0.1", 2000));
  }

  @Test void trimsWhitespace() {
    assertThat(DaemonAddress.parse(" 169.254.79.129:2000\n"))
        .isEqualTo(new InetSocketAddress("169.254.79.129", 2000));
  }

  @Test void ipv6() {
    InetSocketAddress address = DaemonAddress.parse("[::1]:2000");

    assertThat(address.getAddress().isLoopbackAddress()).isTrue();
    assertThat(address.getPort()).isEqualTo(2000);
  }

  @Test void udpPrefix() {
    assertThat(DaemonAddress.parse("udp:127.0.0.1:3000"))
        .isEqualTo(new InetSocketAddress("127.0.0.1", 3000));
  }

  @Test void dualForm_usesUdp() {
    assertThat(DaemonAddress.parse("tcp:127.0.0.1:2000 udp:127.0.0.2:2001"))
        .isEqualTo(new InetSocketAddress("127.0.0.2", 2001));
    assertThat(DaemonAddress.parse("udp:127.0.0.2:2001 tcp:127.0.0.1:2000"))
        .isEqualTo(new InetSocketAddress("127.0.0.2", 2001));
  }

  @Test void dualForm_noUdp() {
    assertThatThrownBy(() -> DaemonAddress.parse("tcp:127.0.0.1:2000 tcp:127.0.0.2:2001"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("no udp address in tcp:127.0.0.1:2000 tcp:127.0.0.2:2001");
  }

  @ParameterizedTest
  @ValueSource(strings = {
      "",
      "127.0.0.1",
      "127.0.0.1:",
      ":2000",
      "127.0.0.1:abc",
      "127.0.0.1:0",
      "127.0.0.1:65536",
      "::1:2000",
      "[::1:2000",
      "tcp:127.0.0.1:2000"
  })
  void invalid(String address) {
    assertThatThrownBy(() -> DaemonAddress.parse(address))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test void defaultAddress() {
    assertThat(DaemonAddress.defaultAddress())
        .isEqualTo(new InetSocketAddress("127.0.0.1", 2000));
  }
}
