package com.walstream.client.event;

import com.walstream.client.DeleteEvent;
import com.walstream.client.InsertEvent;
import com.walstream.client.TruncateEvent;
import com.walstream.client.UpdateEvent;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * A single row-level change received from the CDC service.
 *
 * <p>The log position is an unsigned 64-bit WAL offset stored in a {@code long}. Compare positions
 * with {@link Long#compareUnsigned(long, long)} and render them with {@link LogPositions}.
 *
 * <p>The payload is the serialized row as sent by the server and is treated as opaque text. It is
 * present for {@link ChangeEventKind#INSERT}, {@link ChangeEventKind#UPDATE} and {@link
 * ChangeEventKind#DELETE}, and absent for {@link ChangeEventKind#TRUNCATE}.
 */
public final class ChangeEvent {
  private final ChangeEventKind kind;
  private final String schema;
  private final String table;
  @Nullable private final String payload;
  private final long logPosition;

  private ChangeEvent(
      ChangeEventKind kind,
      String schema,
      String table,
      @Nullable String payload,
      long logPosition) {
    this.kind = kind;
    this.schema = schema;
    this.table = table;
    this.payload = payload;
    this.logPosition = logPosition;
  }

  /**
   * Creates an event of a payload-carrying kind.
   *
   * @throws IllegalArgumentException if {@code kind} is {@link ChangeEventKind#TRUNCATE}
   */
  @Nonnull
  public static ChangeEvent of(
      @Nonnull ChangeEventKind kind,
      @Nonnull String schema,
      @Nonnull String table,
      @Nonnull String payload,
      long logPosition) {
    Objects.requireNonNull(kind, "kind cannot be null");
    if (!kind.hasPayload()) {
      throw new IllegalArgumentException(kind + " events do not carry a payload");
    }
    return new ChangeEvent(
        kind,
        Objects.requireNonNull(schema, "schema cannot be null"),
        Objects.requireNonNull(table, "table cannot be null"),
        Objects.requireNonNull(payload, "payload cannot be null"),
        logPosition);
  }

  /** Creates a truncate event, which has no payload. */
  @Nonnull
  public static ChangeEvent truncate(
      @Nonnull String schema, @Nonnull String table, long logPosition) {
    return new ChangeEvent(
        ChangeEventKind.TRUNCATE,
        Objects.requireNonNull(schema, "schema cannot be null"),
        Objects.requireNonNull(table, "table cannot be null"),
        null,
        logPosition);
  }

  static ChangeEvent fromInsert(InsertEvent event) {
    return of(
        ChangeEventKind.INSERT,
        event.getSchema(),
        event.getTable(),
        event.getJsonPayload(),
        event.getPgLsn());
  }

  static ChangeEvent fromUpdate(UpdateEvent event) {
    return of(
        ChangeEventKind.UPDATE,
        event.getSchema(),
        event.getTable(),
        event.getJsonPayload(),
        event.getPgLsn());
  }

  static ChangeEvent fromDelete(DeleteEvent event) {
    return of(
        ChangeEventKind.DELETE,
        event.getSchema(),
        event.getTable(),
        event.getJsonPayload(),
        event.getPgLsn());
  }

  static ChangeEvent fromTruncate(TruncateEvent event) {
    return truncate(event.getSchema(), event.getTable(), event.getPgLsn());
  }

  @Nonnull
  public ChangeEventKind getKind() {
    return kind;
  }

  @Nonnull
  public String getSchema() {
    return schema;
  }

  @Nonnull
  public String getTable() {
    return table;
  }

  /** Returns {@code schema.table}. */
  @Nonnull
  public String getQualifiedTableName() {
    return schema + "." + table;
  }

  /**
   * Returns the row payload.
   *
   * @return the payload, or empty for truncate events
   */
  @Nonnull
  public Optional<String> getPayload() {
    return Optional.ofNullable(payload);
  }

  /** Returns the unsigned WAL position at which this change was recorded. */
  public long getLogPosition() {
    return logPosition;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof ChangeEvent)) return false;
    ChangeEvent that = (ChangeEvent) o;
    return logPosition == that.logPosition
        && kind == that.kind
        && schema.equals(that.schema)
        && table.equals(that.table)
        && Objects.equals(payload, that.payload);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, schema, table, payload, logPosition);
  }

  @Override
  public String toString() {
    return "ChangeEvent{"
        + kind
        + " "
        + getQualifiedTableName()
        + " at "
        + LogPositions.format(logPosition)
        + "}";
  }
}
