package com.walstream.client;

/**
 * Represents the lifecycle state of one connection attempt.
 *
 * <p>State transitions follow this pattern:
 *
 * <pre>
 * IDLE → DIALING → SESSION_OPENING → ACTIVE → CLOSED_BY_REMOTE
 *           ↓              ↓            ↓
 *           └──────────────┴────────→ CLOSED_BY_ERROR
 *
 * any state → CANCELLED (shutdown requested)
 * </pre>
 *
 * <p>There is no paused or draining state. Every closed state ends the attempt and the connection
 * manager decides whether to start a new one.
 */
public enum SessionState {
  /** No attempt has started yet */
  IDLE,

  /** Establishing the transport connection */
  DIALING,

  /** Transport is up, starting the bidirectional session */
  SESSION_OPENING,

  /** Session is open and events are being received and acknowledged */
  ACTIVE,

  /** The remote ended the stream in an orderly way */
  CLOSED_BY_REMOTE,

  /** The attempt failed while dialing, opening, receiving, dispatching or acknowledging */
  CLOSED_BY_ERROR,

  /** Shutdown was requested and the attempt stopped without error */
  CANCELLED
}
