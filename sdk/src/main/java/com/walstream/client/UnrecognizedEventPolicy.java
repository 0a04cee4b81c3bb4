package com.walstream.client;

/**
 * Decides what happens when the server sends a message whose variant this client does not know.
 *
 * <p>Such a message carries no readable log position, so it can never be acknowledged. The policy
 * only controls how loudly it is skipped.
 */
public enum UnrecognizedEventPolicy {
  /** Skip the message without acknowledging it and log at debug level. */
  SKIP,

  /** Skip the message without acknowledging it and log a warning. */
  WARN
}
