package io.campaign.util;

import io.campaign.model.RecipientTarget;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DefaultTargetCodecTest {

  private final TargetCodec codec = TargetCodec.getDefault();

  @Test
  void emptyListEncodesAsNull() {
    assertNull(codec.toJson(List.of()));
    assertNull(codec.toJson(null));
  }

  @Test
  void encodesEmailAndOptionalName() {
    String json = codec.toJson(List.of(new RecipientTarget("a@x.com", "Ann"), RecipientTarget.of("b@x.com")));

    assertEquals("[{\"email\":\"a@x.com\",\"name\":\"Ann\"},{\"email\":\"b@x.com\"}]", json);
  }

  @Test
  void escapesSpecialCharacters() {
    String json = codec.toJson(List.of(new RecipientTarget("a@x.com", "Say \"hi\"\n\\")));

    assertTrue(json.contains("\\\"hi\\\""));
    assertTrue(json.contains("\\n"));
    assertTrue(json.contains("\\\\"));
  }

  @Test
  void parsesWhatItWrites() {
    List<RecipientTarget> targets = List.of(
        new RecipientTarget(" Mixed@Case.com ", "O'Brien \"Jr\""),
        RecipientTarget.of("plain@x.com"));

    assertEquals(targets, codec.parse(codec.toJson(targets)));
  }

  @Test
  void parseToleratesWhitespaceNullNameAndUnknownKeys() {
    String json = " [ { \"email\" : \"a@x.com\" , \"name\" : null , \"extra\" : \"ignored\" } ] ";

    assertEquals(List.of(RecipientTarget.of("a@x.com")), codec.parse(json));
  }

  @Test
  void parseHandlesUnicodeEscapes() {
    assertEquals("Zoë", codec.parse("[{\"email\":\"z@x.com\",\"name\":\"Zo\\u00eb\"}]").get(0).name());
  }

  @Test
  void parseEmptyInputs() {
    assertTrue(codec.parse(null).isEmpty());
    assertTrue(codec.parse("").isEmpty());
    assertTrue(codec.parse("null").isEmpty());
    assertTrue(codec.parse("[]").isEmpty());
  }

  @Test
  void parseRejectsMalformedInput() {
    assertThrows(IllegalArgumentException.class, () -> codec.parse("{\"email\":\"a@x.com\"}"));
    assertThrows(IllegalArgumentException.class, () -> codec.parse("[{\"name\":\"Ann\"}]"));
    assertThrows(IllegalArgumentException.class, () -> codec.parse("[{\"email\":\"a@x.com\""));
    assertThrows(IllegalArgumentException.class, () -> codec.parse("[{\"email\":42}]"));
    assertThrows(IllegalArgumentException.class, () -> codec.parse("[{\"email\":\"\\q\"}]"));
  }
}
