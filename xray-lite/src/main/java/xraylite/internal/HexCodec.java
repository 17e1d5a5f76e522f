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
package xraylite.internal;

// code originally imported from zipkin.Util
public final class HexCodec {
  static final char[] HEX_DIGITS =
      {'0', '1', '2', '3', '4', '5', '6', '7', '8', '9', 'a', 'b', 'c', 'd', 'e', 'f'};

  /** Returns 16 lower-hex characters, left-padded with zeros. */
  public static String toLowerHex(long v) {
    char[] data = new char[16];
    writeHexLong(data, 0, v);
    return new String(data);
  }

  /** Inspired by {@code okio.Buffer.writeLong} */
  public static void writeHexLong(char[] data, int pos, long v) {
    writeHexInt(data, pos, (int) (v >>> 32L));
    writeHexInt(data, pos + 8, (int) v);
  }

  /** Writes 8 lower-hex characters for the input at the given offset. */
  public static void writeHexInt(char[] data, int pos, int v) {
    writeHexByte(data, pos + 0, (byte) ((v >>> 24) & 0xff));
    writeHexByte(data, pos + 2, (byte) ((v >>> 16) & 0xff));
    writeHexByte(data, pos + 4, (byte) ((v >>> 8) & 0xff));
    writeHexByte(data, pos + 6, (byte) (v & 0xff));
  }

  static void writeHexByte(char[] data, int pos, byte b) {
    data[pos + 0] = HEX_DIGITS[(b >> 4) & 0xf];
    data[pos + 1] = HEX_DIGITS[b & 0xf];
  }

  HexCodec() {
  }
}
