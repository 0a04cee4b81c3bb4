package com.walstream.client.cli;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.walstream.client.event.ChangeEvent;
import com.walstream.client.event.ChangeEventKind;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

/** Tests for the console event printer. */
class ConsoleEventPrinterTest {

  @Test
  void testFormatWithPayload() {
    ChangeEvent event =
        ChangeEvent.of(ChangeEventKind.INSERT, "public", "users", "{\"id\":1}", 100);

    assertEquals("INSERT public.users: {\"id\":1}", ConsoleEventPrinter.format(event));
  }

  @Test
  void testFormatTruncate() {
    assertEquals(
        "TRUNCATE public.users",
        ConsoleEventPrinter.format(ChangeEvent.truncate("public", "users", 200)));
  }

  @Test
  void testPrintsOneLinePerEvent() {
    ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    PrintStream out = new PrintStream(buffer, true);
    ConsoleEventPrinter printer = new ConsoleEventPrinter(out);

    printer.accept(ChangeEvent.of(ChangeEventKind.UPDATE, "s", "t", "{}", 1));
    printer.accept(ChangeEvent.of(ChangeEventKind.DELETE, "s", "t", "{\"id\":2}", 2));

    String[] lines = new String(buffer.toByteArray(), StandardCharsets.UTF_8).split("\\R");
    assertArrayEquals(new String[] {"UPDATE s.t: {}", "DELETE s.t: {\"id\":2}"}, lines);
  }

  @Test
  void testFlushesAfterEachEvent() {
    PrintStream out = mock(PrintStream.class);
    ConsoleEventPrinter printer = new ConsoleEventPrinter(out);

    printer.accept(ChangeEvent.truncate("public", "users", 200));

    verify(out).println("TRUNCATE public.users");
    verify(out).flush();
  }
}
