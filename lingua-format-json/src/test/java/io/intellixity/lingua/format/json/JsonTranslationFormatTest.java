package io.intellixity.lingua.format.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.lingua.core.encode.KeyEncoder;
import io.intellixity.lingua.core.format.PersistenceFormat;
import io.intellixity.lingua.core.store.InMemoryTranslationStore;
import io.intellixity.lingua.core.store.TranslationStore;
import io.intellixity.lingua.spi.engine.EngineRegistry;
import io.intellixity.lingua.spi.engine.EngineSettings;
import io.intellixity.lingua.spi.engine.TranslationEngine;
import io.intellixity.lingua.testkit.Application;
import io.intellixity.lingua.testkit.Widgets;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class JsonTranslationFormatTest {
  private static final ObjectMapper JSON = new ObjectMapper();

  @TempDir
  Path dir;

  private static TranslationEngine engine() {
    return EngineRegistry.discover().create(PersistenceFormat.JSON, Widgets.registry());
  }

  @Test
  void writesOneObjectLevelPerContainer() throws IOException {
    Path file = dir.resolve("App.json");
    engine().save(Widgets.sampleTree(), file);

    JsonNode top = JSON.readTree(file.toFile());
    JsonNode form = top.get("App").get("Form1");
    assertEquals("Main window", form.get("Caption").asText());
    JsonNode button = form.get("Panel1").get("Button1");
    assertEquals("OK", button.get("Caption").asText());
    assertEquals("Confirm", button.get("Tooltip").get("Title").asText());
    assertNull(button.get("Name"));
    assertNull(button.get("Tag"));
    assertEquals("Line one\nLine two", form.get("Panel1").get("Label1").get("Caption").asText());
    assertEquals("Red§Green§Blue", form.get("ListBox1").get("Items").asText());
    assertTrue(top.get(JsonTranslationFormat.STRINGS).isObject());
    assertTrue(Files.readString(file).contains("\n"), "pretty printed");
  }

  @Test
  void roundTripsTextListsAndNestedValues() throws IOException {
    Path file = dir.resolve("App.json");
    Application source = Widgets.sampleTree();
    Widgets.listBox1(source).setItems(List.of("Rosso", "Ve§rde", "Blu\r\nscuro", "[x]"));
    Widgets.button1(source).getTooltip().setBody("Applica le modifiche");
    engine().save(source, file);

    Application target = Widgets.sampleTree();
    engine().load(target, file, null);

    assertEquals(List.of("Rosso", "Ve§rde", "Blu\r\nscuro", "[x]"), Widgets.listBox1(target).getItems());
    assertEquals("Applica le modifiche", Widgets.button1(target).getTooltip().getBody());
  }

  @Test
  void saveKeepsExistingStrings() throws IOException {
    Path file = dir.resolve("App.json");
    String key = KeyEncoder.hash("Hello");
    Files.writeString(file, "{\"Strings\":{\"" + key + "\":\"Ciao\"},\"Other\":{}}", StandardCharsets.UTF_8);

    engine().save(Widgets.sampleTree(), file);

    JsonNode top = JSON.readTree(file.toFile());
    assertEquals("Ciao", top.get("Strings").get(key).asText());
    assertNotNull(top.get("App"));
  }

  @Test
  void stringsFeedStoreAndTranslate() throws IOException {
    Path file = dir.resolve("runtime.json");
    Files.writeString(file, "{\"Strings\":{\"" + KeyEncoder.hash("Two lines").toLowerCase() + "\":\"Due\\nrighe\"}}",
        StandardCharsets.UTF_8);
    TranslationStore store = new InMemoryTranslationStore();
    TranslationEngine e = engine();

    assertTrue(e.load(null, file, store).isCompleted());

    assertEquals("Due\nrighe", e.translate("Two lines"));
    assertEquals("Due\nrighe", store.tryGet("Two lines").orElseThrow());
  }

  @Test
  void unknownMembersAreIgnoredAndRootMatchesIgnoringCase() throws IOException {
    Path file = dir.resolve("App.json");
    Files.writeString(file, "{\"app\":{\"Form1\":{\"Caption\":\"Finestra\",\"Missing\":{\"Caption\":\"x\"},"
        + "\"Unknown\":\"y\",\"Items\":[1,2]}}}", StandardCharsets.UTF_8);
    Application app = Widgets.sampleTree();

    assertTrue(engine().load(app, file, null).isCompleted());
    assertEquals("Finestra", Widgets.form(app).getCaption());
  }

  @Test
  void actionBoundCaptionIsSavedButNotApplied() throws IOException {
    Path file = dir.resolve("App.json");
    Application app = Widgets.sampleTree();
    engine().save(app, file);
    assertEquals("Open", JSON.readTree(file.toFile()).get("App").get("Form1").get("Button2").get("Caption").asText());

    Files.writeString(file, "{\"App\":{\"Form1\":{\"Button2\":{\"Caption\":\"Apri\"}}}}", StandardCharsets.UTF_8);
    engine().load(app, file, null);
    assertEquals("Open", Widgets.button2(app).getCaption());
  }

  @Test
  void excludedTypesAndAttributesAreSkipped() throws IOException {
    Path file = dir.resolve("App.json");
    TranslationEngine e = EngineRegistry.discover().create(PersistenceFormat.JSON,
        EngineSettings.defaults(Widgets.registry())
            .withExcludedTypes(List.of("TPanel"))
            .withExcludedAttributes(List.of("Tooltip")));
    e.save(Widgets.sampleTree(), file);

    JsonNode form = JSON.readTree(file.toFile()).get("App").get("Form1");
    assertNull(form.get("Panel1"));
    assertNull(form.get("Button2").get("Tooltip"));
  }

  @Test
  void nonObjectDocumentIsAnIoFailure() throws IOException {
    Path file = dir.resolve("App.json");
    Files.writeString(file, "[1, 2]", StandardCharsets.UTF_8);
    assertThrows(IOException.class, () -> engine().load(Widgets.sampleTree(), file, null));

    Files.writeString(file, "{ broken", StandardCharsets.UTF_8);
    assertThrows(JsonProcessingException.class, () -> engine().load(Widgets.sampleTree(), file, null));
  }

  @Test
  void listJoinEdgeCases() {
    assertEquals("", JsonTranslationFormat.joinList(List.of()));
    assertEquals(List.of(), JsonTranslationFormat.splitList(""));
    assertEquals(List.of("", ""), JsonTranslationFormat.splitList("§"));
    assertEquals("a[§]b§c", JsonTranslationFormat.joinList(List.of("a§b", "c")));
    assertEquals(List.of("a§b", "c"), JsonTranslationFormat.splitList("a[§]b§c"));
    assertEquals(List.of("[", ""), JsonTranslationFormat.splitList("[[]§"));
  }
}
