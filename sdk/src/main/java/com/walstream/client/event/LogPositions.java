package com.walstream.client.event;

/**
 * Formatting for unsigned 64-bit WAL positions.
 *
 * <p>Positions are rendered the way PostgreSQL renders an LSN: the high and low 32-bit halves in
 * upper-case hex separated by a slash, for example {@code 16/B374D848}.
 */
public final class LogPositions {

  private LogPositions() {}

  public static String format(long position) {
    return Long.toHexString(position >>> 32).toUpperCase()
        + "/"
        + Long.toHexString(position & 0xFFFFFFFFL).toUpperCase();
  }
}
