package com.walstream.client.event;

/** The four row-level change variants delivered by the CDC service. */
public enum ChangeEventKind {
  INSERT(true),
  UPDATE(true),
  DELETE(true),
  TRUNCATE(false);

  private final boolean hasPayload;

  ChangeEventKind(boolean hasPayload) {
    this.hasPayload = hasPayload;
  }

  /**
   * Returns whether events of this kind carry a row payload.
   *
   * @return true for INSERT, UPDATE and DELETE
   */
  public boolean hasPayload() {
    return hasPayload;
  }
}
