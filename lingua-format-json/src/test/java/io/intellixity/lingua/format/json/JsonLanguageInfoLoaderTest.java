package io.intellixity.lingua.format.json;

import io.intellixity.lingua.core.info.LanguageInfo;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

final class JsonLanguageInfoLoaderTest {
  @TempDir
  Path dir;

  @Test
  void readsLanguageObject() throws IOException {
    Path file = dir.resolve("lang.json");
    Files.writeString(file, "{\"language\":{\"id\":\"he\",\"name\":\"Hebrew\",\"nativeName\":\"עברית\","
        + "\"isRightToLeft\":true,\"uiFont\":\"Arial\",\"fallbackFont\":\"Tahoma\"},\"Strings\":{}}",
        StandardCharsets.UTF_8);

    assertEquals(new LanguageInfo("he", "Hebrew", "עברית", true, "Arial", "Tahoma"),
        new JsonLanguageInfoLoader().loadFromFile(file));
  }

  @Test
  void missingMembersDefault() throws IOException {
    Path file = dir.resolve("lang.json");
    Files.writeString(file, "{\"language\":{\"id\":\"it\",\"isRightToLeft\":\"no\"}}", StandardCharsets.UTF_8);

    LanguageInfo info = new JsonLanguageInfoLoader().loadFromFile(file);

    assertEquals("it", info.id());
    assertEquals("", info.uiFont());
    assertFalse(info.rightToLeft());
  }

  @Test
  void missingLanguageObjectGivesEmptyInfo() throws IOException {
    Path file = dir.resolve("lang.json");
    Files.writeString(file, "{}", StandardCharsets.UTF_8);
    assertTrue(new JsonLanguageInfoLoader().loadFromFile(file).isEmpty());
  }

  @Test
  void unreadableFilePropagates() throws IOException {
    Path file = dir.resolve("lang.json");
    Files.writeString(file, "{ nope", StandardCharsets.UTF_8);
    assertThrows(IOException.class, () -> new JsonLanguageInfoLoader().loadFromFile(file));
  }
}
