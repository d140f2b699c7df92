package chatlog.thought;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ThoughtTypeTest {

  @Test
  void findIgnoresCaseAndWhitespace() {
    assertEquals(Optional.of(ThoughtType.INSIGHT), ThoughtType.find(" insight "));
    assertEquals(Optional.of(ThoughtType.PROGRESS), ThoughtType.find("Progress"));
  }

  @Test
  void findRejectsUnknownNames() {
    assertTrue(ThoughtType.find("musing").isEmpty());
    assertTrue(ThoughtType.find("").isEmpty());
    assertTrue(ThoughtType.find(null).isEmpty());
  }

  @Test
  void parseFallsBackToThought() {
    assertEquals(ThoughtType.THOUGHT, ThoughtType.parse("musing"));
    assertEquals(ThoughtType.THOUGHT, ThoughtType.parse(null));
    assertEquals(ThoughtType.CONCERN, ThoughtType.parse("concern"));
  }
}
