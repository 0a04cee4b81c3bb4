package com.walstream.client.cli;

import com.walstream.client.event.ChangeEvent;
import com.walstream.client.event.ChangeEventConsumer;
import java.io.PrintStream;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nonnull;

/**
 * Prints one line per change event.
 *
 * <p>Events with a payload are printed as {@code INSERT public.users: {"id":1}}, truncates as
 * {@code TRUNCATE public.users}.
 */
class ConsoleEventPrinter implements ChangeEventConsumer {
  private final PrintStream out;

  ConsoleEventPrinter(@Nonnull PrintStream out) {
    this.out = Objects.requireNonNull(out, "out cannot be null");
  }

  @Override
  public void accept(@Nonnull ChangeEvent event) {
    out.println(format(event));
    out.flush();
  }

  static String format(ChangeEvent event) {
    String line = event.getKind() + " " + event.getQualifiedTableName();
    Optional<String> payload = event.getPayload();
    return payload.isPresent() ? line + ": " + payload.get() : line;
  }
}
