package io.intellixity.lingua.coordination;

import io.intellixity.lingua.core.encode.KeyEncoder;
import io.intellixity.lingua.core.error.LanguageConfigurationException;
import io.intellixity.lingua.core.format.PersistenceFormat;
import io.intellixity.lingua.spi.engine.EngineRegistry;
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

final class LanguageCoordinatorTest {
  @TempDir
  Path root;

  private final EngineRegistry registry = EngineRegistry.discover();

  private static CoordinatorOptions options() {
    return CoordinatorOptions.defaults(Widgets.registry()).withRegisterOnStart(false);
  }

  static void write(Path file, String text) throws IOException {
    Files.createDirectories(file.getParent());
    Files.writeString(file, text, StandardCharsets.UTF_8);
  }

  private LanguageCoordinator open(Application app, CoordinatorOptions options) throws IOException {
    return LanguageCoordinator.open(registry, null, app, options);
  }

  @Test
  void resolvesFileAndReportsMissingFileAsDomainError() throws IOException {
    RecordingListener l = new RecordingListener();
    LanguageCoordinator c = open(Widgets.sampleTree(), options().withRootPath(root).withLanguage("it").withListener(l));

    assertEquals(root.resolve("it").resolve("App.lng"), c.file());
    assertTrue(c.isReady());
    assertTrue(c.isStarted());
    assertEquals(List.of("beforeLoad", "error"), l.events);
    assertTrue(l.errors.get(0).message().contains("App.lng"));
    assertFalse(Files.exists(root.resolve("it")), "folder is created only with auto-create");
  }

  @Test
  void loadsOnOpenAndFiresAfterLoad() throws IOException {
    write(root.resolve("it/App.lng"), "[Form1]\nCaption=Finestra principale\n\n[strings]\n"
        + KeyEncoder.hash("Hello") + "=Ciao\n");
    RecordingListener l = new RecordingListener();
    Application app = Widgets.sampleTree();

    LanguageCoordinator c = open(app, options().withRootPath(root).withLanguage("it").withListener(l));

    assertEquals(List.of("beforeLoad", "afterLoad"), l.events);
    assertEquals("Finestra principale", Widgets.form(app).getCaption());
    assertEquals("Ciao", c.translate("Hello"));
    assertEquals("Other", c.translate("Other"));
  }

  @Test
  void languageChangeRecomputesFileAndReloads() throws IOException {
    write(root.resolve("it/App.lng"), "[Form1]\nCaption=Finestra\n");
    write(root.resolve("de/App.lng"), "[Form1]\nCaption=Fenster\n");
    Application app = Widgets.sampleTree();
    LanguageCoordinator c = open(app, options().withRootPath(root).withLanguage("it"));
    assertEquals("Finestra", Widgets.form(app).getCaption());

    c.setLanguage("de");

    assertEquals(root.resolve("de").resolve("App.lng"), c.file());
    assertEquals("Fenster", Widgets.form(app).getCaption());
  }

  @Test
  void blankLanguageIsAConfigurationError() throws IOException {
    LanguageCoordinator c = open(Widgets.sampleTree(), options());
    assertThrows(LanguageConfigurationException.class, () -> c.setLanguage(""));
    assertThrows(LanguageConfigurationException.class, () -> c.setLanguage("  "));
    assertThrows(LanguageConfigurationException.class, () -> c.setLanguage(null));
  }

  @Test
  void explicitFileWinsUntilLanguageChanges() throws IOException {
    write(root.resolve("fr/App.lng"), "[Form1]\nCaption=Fenêtre\n");
    Application app = Widgets.sampleTree();
    LanguageCoordinator c = open(app, options());

    c.setFile(root.resolve("fr/App.lng"));
    assertEquals("fr", c.language());
    assertEquals(root.toAbsolutePath(), c.rootPath());
    assertEquals("Fenêtre", Widgets.form(app).getCaption());

    c.setFormat(PersistenceFormat.FLAT_INI);
    assertEquals(root.resolve("fr/App.lng"), c.file());

    c.setLanguage("it");
    assertEquals(root.toAbsolutePath().resolve("it").resolve("App.clng"), c.file());
  }

  @Test
  void formatChangeRecomputesExtension() throws IOException {
    LanguageCoordinator c = open(Widgets.sampleTree(), options().withRootPath(root).withLanguage("it"));
    c.setFormat(PersistenceFormat.FLAT_INI);
    assertEquals(PersistenceFormat.FLAT_INI, c.format());
    assertEquals(root.resolve("it").resolve("App.clng"), c.file());
  }

  @Test
  void loadIsSilentWhenNoFileIsResolved() throws IOException {
    RecordingListener l = new RecordingListener();
    LanguageCoordinator c = open(Widgets.sampleTree(), options().withListener(l));
    c.load();
    assertFalse(c.isReady());
    assertTrue(l.events.isEmpty());
  }

  @Test
  void cancelledLoadLeavesTreeAndStoreUntouched() throws IOException {
    write(root.resolve("it/App.lng"), "[Form1]\nCaption=Finestra\n");
    RecordingListener l = new RecordingListener();
    l.cancelLoad = true;
    Application app = Widgets.sampleTree();

    open(app, options().withRootPath(root).withLanguage("it").withListener(l));

    assertEquals("Main window", Widgets.form(app).getCaption());
    assertEquals(List.of("beforeLoad"), l.events);
  }

  @Test
  void saveWithoutFileIsAConfigurationError() throws IOException {
    LanguageCoordinator c = open(Widgets.sampleTree(), options());
    assertThrows(LanguageConfigurationException.class, c::save);
  }

  @Test
  void saveIntoMissingFolderPropagatesIoFailure() throws IOException {
    LanguageCoordinator c = open(Widgets.sampleTree(), options().withRootPath(root).withLanguage("it"));
    assertThrows(IOException.class, c::save);
  }

  @Test
  void saveWithAutoCreateWritesStarterFile() throws IOException {
    RecordingListener l = new RecordingListener();
    LanguageCoordinator c = open(Widgets.sampleTree(), options().withRootPath(root).withLanguage("it").withListener(l));
    c.setCreateIfMissing(true);
    l.events.clear();

    c.save();

    assertTrue(Files.readString(root.resolve("it/App.lng")).contains("[Form1.Panel1.Button1]\nCaption=OK"));
    assertEquals(List.of("beforeSave", "afterSave"), l.events);
  }

  @Test
  void cancelledSaveWritesNothing() throws IOException {
    RecordingListener l = new RecordingListener();
    l.cancelSave = true;
    LanguageCoordinator c = open(Widgets.sampleTree(), options().withRootPath(root).withLanguage("it").withListener(l));
    c.setCreateIfMissing(true);
    c.save();
    assertFalse(Files.exists(root.resolve("it/App.lng")));
  }

  @Test
  void autoCreateOnOpenMaterializesFile() throws IOException {
    RecordingListener l = new RecordingListener();
    CoordinatorOptions o = options().withRootPath(root).withLanguage("it").withListener(l);
    open(Widgets.sampleTree(), o.withSettings(o.settings().withCreateIfMissing(true)));

    assertTrue(Files.exists(root.resolve("it/App.lng")));
    assertEquals(List.of("beforeLoad", "afterLoad"), l.events);
  }

  @Test
  void excludeOnActionSetterReachesEngine() throws IOException {
    write(root.resolve("it/App.lng"), "[Form1.Button2]\nCaption=Apri\n");
    Application app = Widgets.sampleTree();
    LanguageCoordinator c = open(app, options().withRootPath(root).withLanguage("it"));
    assertEquals("Open", Widgets.button2(app).getCaption());

    c.setExcludeOnAction(false);
    c.load();

    assertFalse(c.settings().excludeOnAction());
    assertEquals("Apri", Widgets.button2(app).getCaption());
  }

  @Test
  void excludedAttributesSetterReachesEngine() throws IOException {
    write(root.resolve("it/App.lng"), "[Form1]\nCaption=Finestra\nHint=Suggerimento\n");
    Application app = Widgets.sampleTree();
    LanguageCoordinator c = open(app, options().withRootPath(root).withLanguage("it"));
    Widgets.form(app).setHint("");

    c.setExcludedAttributes(List.of("Hint"));
    c.load();

    assertEquals("", Widgets.form(app).getHint());
    assertEquals("Finestra", Widgets.form(app).getCaption());
  }

  @Test
  void unregisteredFormatFailsFast() {
    EngineRegistry empty = new EngineRegistry();
    assertThrows(LanguageConfigurationException.class,
        () -> LanguageCoordinator.open(empty, null, Widgets.sampleTree(), options()));
  }

  @Test
  void engineCreationFailureIsReportedAndLeavesCoordinatorNotReady() throws IOException {
    FlakyFormat.INSTANCES.set(0);
    EngineRegistry flaky = new EngineRegistry();
    flaky.register(PersistenceFormat.INI, FlakyFormat.class);
    RecordingListener l = new RecordingListener();

    LanguageCoordinator c = LanguageCoordinator.open(flaky, null, Widgets.sampleTree(),
        options().withRootPath(root).withLanguage("it").withListener(l));

    assertFalse(c.isReady());
    assertEquals(List.of("error"), l.events);
    assertTrue(l.errors.get(0).cause() instanceof LanguageConfigurationException);
  }
}
