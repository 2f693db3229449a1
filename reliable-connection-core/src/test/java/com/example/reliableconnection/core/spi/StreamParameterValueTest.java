package com.example.reliableconnection.core.spi;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class StreamParameterValueTest {

  @Test
  @DisplayName("Should open the stream once until reset")
  void shouldReuseStreamUntilReset() throws IOException {
    final var opened = new AtomicInteger();
    final var value =
        new StreamParameterValue(
            () -> {
              opened.incrementAndGet();
              return new ByteArrayInputStream(new byte[] {42});
            });

    final var first = value.stream();
    assertSame(first, value.stream());
    assertEquals(42, first.read());

    value.reset();
    final var second = value.stream();

    assertNotSame(first, second);
    assertEquals(42, second.read());
    assertEquals(2, opened.get());
  }

  @Test
  @DisplayName("Should close the current stream on reset")
  void shouldCloseOnReset() {
    final var closed = new AtomicInteger();
    final var value =
        new StreamParameterValue(
            () ->
                new ByteArrayInputStream(new byte[0]) {
                  @Override
                  public void close() {
                    closed.incrementAndGet();
                  }
                });

    value.reset();
    value.stream();
    value.reset();
    value.reset();

    assertEquals(1, closed.get());
  }

  @Test
  @DisplayName("Should surface close failures and still reopen afterwards")
  void shouldWrapCloseFailure() {
    final var value =
        new StreamParameterValue(
            () ->
                new InputStream() {
                  @Override
                  public int read() {
                    return -1;
                  }

                  @Override
                  public void close() throws IOException {
                    throw new IOException("disk gone");
                  }
                });
    value.stream();

    assertThrows(UncheckedIOException.class, value::reset);
    assertDoesNotThrow(value::stream);
  }

  @Test
  @DisplayName("Should reject an opener that returns null")
  void shouldRejectNullStream() {
    assertThrows(NullPointerException.class, () -> new StreamParameterValue(() -> null).stream());
  }
}
