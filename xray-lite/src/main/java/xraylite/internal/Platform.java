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

import java.util.concurrent.ThreadLocalRandom;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import xraylite.Clock;
import xraylite.SubsegmentSession;

/**
 * Access to platform-specific features.
 *
 * <p>Note: Logging is centralized here to avoid classloader problems.
 */
public class Platform {
  private static final Platform PLATFORM = new Platform();
  private static final Logger LOG = Logger.getLogger(SubsegmentSession.class.getName());

  public static Platform get() {
    return PLATFORM;
  }

  /** Like {@link Logger#log(Level, String)} */
  public void log(String msg, @Nullable Throwable thrown) {
    if (!LOG.isLoggable(Level.FINE)) return; // fine level to not fill logs
    LOG.log(Level.FINE, msg, thrown);
  }

  /** Like {@link Logger#log(Level, String, Object)}, except with a throwable arg */
  public void log(String msg, Object param1, @Nullable Throwable thrown) {
    if (!LOG.isLoggable(Level.FINE)) return; // fine level to not fill logs
    LogRecord lr = new LogRecord(Level.FINE, msg);
    Object[] params = {param1};
    lr.setParameters(params);
    if (thrown != null) lr.setThrown(thrown);
    LOG.log(lr);
  }

  /**
   * Pseudo-random numbers used for segment and trace IDs. These are not secrets, so this favors
   * speed over a {@link java.security.SecureRandom}.
   */
  public long randomLong() {
    return ThreadLocalRandom.current().nextLong();
  }

  /**
   * Returns the epoch seconds in the upper 4-bytes and a random number in the lower 4-bytes. This
   * is the first 64 bits of an X-Ray trace ID, version 1.
   */
  public long nextTraceIdHigh() {
    return nextTraceIdHigh(System.currentTimeMillis() / 1000,
        ThreadLocalRandom.current().nextInt());
  }

  static long nextTraceIdHigh(long epochSeconds, int random) {
    return (epochSeconds & 0xffffffffL) << 32
        | (random & 0xffffffffL);
  }

  public Clock clock() {
    return new Clock() {
      @Override public long currentTimeMicroseconds() {
        java.time.Instant instant = java.time.Clock.systemUTC().instant();
        return (instant.getEpochSecond() * 1000000) + (instant.getNano() / 1000);
      }

      @Override public String toString() {
        return "Clock.systemUTC().instant()";
      }
    };
  }

  @Override public String toString() {
    return "Platform{}";
  }

  Platform() {
  }
}
