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
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.DatagramChannel;
import java.nio.charset.StandardCharsets;
import xraylite.LambdaEnvironment;
import xraylite.segment.Subsegment;
import xraylite.segment.SubsegmentBytesEncoder;
import zipkin2.CheckResult;
import zipkin2.codec.BytesEncoder;
import zipkin2.codec.Encoding;

/**
 * Sends each subsegment as one UDP datagram to the X-Ray daemon.
 *
 * <p>The channel is connected and non-blocking: when the send buffer is full, {@link
 * #send(Subsegment)} fails immediately instead of delaying the traced work.
 *
 * <p>Ex.
 * <pre>{@code
 * client = DaemonClient.create(DaemonAddress.parse("127.0.0.1:2000"));
 * }</pre>
 */
public final class DaemonClient extends Client {
  static final byte[] HEADER =
      "{\"format\": \"json\", \"version\": 1}\n".getBytes(StandardCharsets.US_ASCII);

  /** Returns a client sending to the address in {@code AWS_XRAY_DAEMON_ADDRESS}. */
  public static DaemonClient fromLambdaEnv() {
    return create(LambdaEnvironment.daemonAddress());
  }

  public static DaemonClient create(InetSocketAddress address) {
    return newBuilder().address(address).build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /** Frames an encoded record with the daemon header: {@code {"format": "json", "version": 1}}. */
  public static byte[] packet(byte[] payload) {
    if (payload == null) throw new NullPointerException("payload == null");
    byte[] result = new byte[HEADER.length + payload.length];
    System.arraycopy(HEADER, 0, result, 0, HEADER.length);
    System.arraycopy(payload, 0, result, HEADER.length, payload.length);
    return result;
  }

  public static final class Builder {
    InetSocketAddress address = DaemonAddress.defaultAddress();
    BytesEncoder<Subsegment> encoder = SubsegmentBytesEncoder.JSON;

    /** Defaults to the daemon's standard address, {@code 127.0.0.1:2000}. */
    public Builder address(InetSocketAddress address) {
      if (address == null) throw new NullPointerException("address == null");
      this.address = address;
      return this;
    }

    /** Defaults to {@link SubsegmentBytesEncoder#JSON}. Only JSON encoders are accepted. */
    public Builder encoder(BytesEncoder<Subsegment> encoder) {
      if (encoder == null) throw new NullPointerException("encoder == null");
      if (encoder.encoding() != Encoding.JSON) {
        throw new IllegalArgumentException(
            "Encoding.JSON is the only format the daemon accepts, but was " + encoder.encoding());
      }
      this.encoder = encoder;
      return this;
    }

    /** @throws UncheckedIOException if the socket could not be opened */
    public DaemonClient build() {
      DatagramChannel channel = null;
      try {
        channel = DatagramChannel.open();
        channel.configureBlocking(false);
        channel.connect(address);
        return new DaemonClient(this, channel);
      } catch (IOException e) {
        if (channel != null) {
          try {
            channel.close();
          } catch (IOException suppressed) {
            e.addSuppressed(suppressed);
          }
        }
        throw new UncheckedIOException("could not open a socket to " + address, e);
      }
    }

    Builder() {
    }
  }

  final InetSocketAddress address;
  final BytesEncoder<Subsegment> encoder;
  final DatagramChannel channel;

  DaemonClient(Builder builder, DatagramChannel channel) {
    this.address = builder.address;
    this.encoder = builder.encoder;
    this.channel = channel;
  }

  public InetSocketAddress address() {
    return address;
  }

  public BytesEncoder<Subsegment> encoder() {
    return encoder;
  }

  @Override public void send(Subsegment subsegment) throws IOException {
    if (subsegment == null) throw new NullPointerException("subsegment == null");
    byte[] payload;
    try {
      payload = encoder.encode(subsegment);
    } catch (RuntimeException e) {
      throw new IOException("could not encode " + subsegment.id(), e);
    }
    byte[] packet = packet(payload);
    int written = channel.write(ByteBuffer.wrap(packet));
    if (written != packet.length) {
      throw new IOException("send buffer full: wrote " + written + "/" + packet.length + " bytes");
    }
  }

  /** Reports failure after {@link #close()}. A UDP channel can't see whether the daemon is up. */
  @Override public CheckResult check() {
    if (channel.isOpen()) return CheckResult.OK;
    return CheckResult.failed(new ClosedChannelException());
  }

  @Override public void close() throws IOException {
    channel.close();
  }

  @Override public String toString() {
    return "DaemonClient{address=" + address + "}";
  }
}
