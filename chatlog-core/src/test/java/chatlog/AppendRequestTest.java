package chatlog;

import chatlog.model.MessageKind;
import chatlog.model.StoredTimestamp;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class AppendRequestTest {

  @Test
  void onlyTextIsRequired() {
    AppendRequest request = AppendRequest.builder("hello").build();
    assertEquals("hello", request.text());
    assertNull(request.id());
    assertNull(request.sender());
    assertNull(request.recipient());
    assertNull(request.timestamp());
    assertEquals(MessageKind.MESSAGE, request.kind());
  }

  @Test
  void blankTextIsRejected() {
    MalformedInputException ex = assertThrows(MalformedInputException.class,
        () -> AppendRequest.builder("  ").build());
    assertEquals(ErrorKind.MALFORMED_INPUT, ex.kind());
    assertFalse(ex.retryable());
    assertThrows(MalformedInputException.class, () -> AppendRequest.builder(null).build());
  }

  @Test
  void blankIdIsRejected() {
    assertThrows(MalformedInputException.class, () -> AppendRequest.builder("x").id(" ").build());
  }

  @Test
  void blankFieldsBecomeDefaults() {
    AppendRequest request = AppendRequest.of(" ", "", "text", "  ");
    assertNull(request.sender());
    assertNull(request.recipient());
    assertEquals(MessageKind.MESSAGE, request.kind());
  }

  @Test
  void unknownKindIsKeptVerbatim() {
    AppendRequest request = AppendRequest.of("a", "b", "text", "custom_kind");
    assertEquals("custom_kind", request.kind().code());
    assertTrue(request.kind().isMergeable());
  }

  @Test
  void carriesCallerIdAndTimestamp() {
    Instant at = Instant.parse("2026-02-09T10:00:00Z");
    AppendRequest request = AppendRequest.builder("x")
        .id("2026-02-09T10-00-00Z_agent")
        .kind(MessageKind.TASK)
        .timestamp(StoredTimestamp.of(at))
        .build();
    assertEquals("2026-02-09T10-00-00Z_agent", request.id());
    assertEquals(MessageKind.TASK, request.kind());
    assertEquals(StoredTimestamp.of(at), request.timestamp());
  }

  @Test
  void structuredTimestampOutsideColumnRangeIsRejected() {
    assertThrows(MalformedInputException.class, () -> AppendRequest.builder("x")
        .timestamp(StoredTimestamp.of(Instant.parse("0999-12-31T23:59:59Z"))).build());
    assertThrows(MalformedInputException.class, () -> AppendRequest.builder("x")
        .timestamp(StoredTimestamp.of(Instant.parse("+10000-01-01T00:00:00Z"))).build());

    assertNotNull(AppendRequest.builder("x").timestamp(StoredTimestamp.of(AppendRequest.MIN_STRUCTURED)).build());
    assertNotNull(AppendRequest.builder("x").timestamp(StoredTimestamp.of(Instant.parse("2040-01-01T00:00:00Z"))).build());
  }

  @Test
  void toStringOmitsText() {
    assertFalse(AppendRequest.builder("secret body").build().toString().contains("secret"));
  }
}
