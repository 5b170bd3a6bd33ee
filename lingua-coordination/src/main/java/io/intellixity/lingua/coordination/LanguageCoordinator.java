package io.intellixity.lingua.coordination;

import io.intellixity.lingua.core.error.LanguageConfigurationException;
import io.intellixity.lingua.core.error.LanguageError;
import io.intellixity.lingua.core.format.PersistenceFormat;
import io.intellixity.lingua.core.info.LanguageInfo;
import io.intellixity.lingua.core.model.Container;
import io.intellixity.lingua.core.store.InMemoryTranslationStore;
import io.intellixity.lingua.core.store.TranslationStore;
import io.intellixity.lingua.spi.engine.EngineRegistry;
import io.intellixity.lingua.spi.engine.EngineResult;
import io.intellixity.lingua.spi.engine.EngineSettings;
import io.intellixity.lingua.spi.engine.TranslationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Per-container facade: resolves the translation file, owns one store and one engine, and exposes
 * cancellable load/save with listener hooks.\n
 *
 * File resolution: {@code <rootPath>/<language>/<containerName><ext>}, recomputed whenever root path or
 * language changes. {@link #setFile(Path)} takes precedence until the next root path or language change.\n
 *
 * Error policy:\n
 * - {@link LanguageError.DomainError}: logged, reported to {@link CoordinatorListener#onError}, operation stops\n
 * - {@link LanguageError.ConfigurationError}: thrown as {@link LanguageConfigurationException}\n
 * - {@link IOException}: propagates unchanged\n
 */
public final class LanguageCoordinator implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(LanguageCoordinator.class);

  private final EngineRegistry registry;
  private final LanguageServer server;
  private final Container container;
  private final boolean registerOnStart;
  private final TranslationStore store = new InMemoryTranslationStore();
  private final List<CoordinatorListener> listeners = new CopyOnWriteArrayList<>();

  private volatile Path rootPath;
  private volatile String language;
  private volatile Path file;
  private volatile boolean fileExplicit;
  private volatile PersistenceFormat format;
  private volatile EngineSettings settings;
  private volatile TranslationEngine engine;
  private volatile LanguageInfo languageInfo = LanguageInfo.empty();
  private volatile boolean started;

  private LanguageCoordinator(EngineRegistry registry, LanguageServer server, Container container,
                              CoordinatorOptions options) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.server = server;
    this.container = Objects.requireNonNull(container, "container");
    Objects.requireNonNull(options, "options");
    this.registerOnStart = options.registerOnStart();
    this.listeners.addAll(options.listeners());
    this.format = options.format();
    this.settings = options.settings();
    this.rootPath = options.rootPath();
    this.language = blankToNull(options.language());
    recomputeFile();
    this.engine = createEngine(format);
  }

  /** Coordinator bound to {@code server}, using the server's engine registry. */
  public static LanguageCoordinator open(LanguageServer server, Container container, CoordinatorOptions options)
      throws IOException {
    Objects.requireNonNull(server, "server");
    return open(server.registry(), server, container, options);
  }

  /**
   * Construct, self-register with {@code server} (when given and {@code registerOnStart} is set), then
   * start and load the resolved file, if any. A failed first load unregisters the coordinator again.
   *
   * @param server may be null for a standalone coordinator
   * @throws LanguageConfigurationException when the format is not registered
   */
  public static LanguageCoordinator open(EngineRegistry registry, LanguageServer server, Container container,
                                         CoordinatorOptions options) throws IOException {
    LanguageCoordinator c = new LanguageCoordinator(registry, server, container, options);
    try {
      if (c.registerOnStart && server != null) server.registerClient(c);
      c.started = true;
      c.load();
    } catch (IOException | RuntimeException e) {
      // The caller never sees c; the server must not keep reloading it.
      c.close();
      throw e;
    }
    return c;
  }

  public Container container() { return container; }
  public Path rootPath() { return rootPath; }
  public String language() { return language; }
  public Path file() { return file; }
  public PersistenceFormat format() { return format; }
  public EngineSettings settings() { return settings; }
  public LanguageInfo languageInfo() { return languageInfo; }
  public TranslationStore store() { return store; }
  public boolean isStarted() { return started; }

  /** An engine exists and a file is resolved. */
  public boolean isReady() {
    return engine != null && file != null;
  }

  public void addListener(CoordinatorListener listener) {
    listeners.add(Objects.requireNonNull(listener, "listener"));
  }

  public void removeListener(CoordinatorListener listener) {
    listeners.remove(listener);
  }

  /** @throws LanguageConfigurationException for a null or blank id */
  public void setLanguage(String language) throws IOException {
    if (language == null || language.isBlank()) {
      throw new LanguageConfigurationException("Language id is empty for " + container.name());
    }
    this.language = language.trim();
    this.fileExplicit = false;
    recomputeFile();
    reloadIfStarted();
  }

  public void setRootPath(Path rootPath) throws IOException {
    this.rootPath = rootPath;
    this.fileExplicit = false;
    recomputeFile();
    reloadIfStarted();
  }

  /** Explicit file; language becomes its folder name and root path the folder's parent. */
  public void setFile(Path file) throws IOException {
    this.file = file;
    this.fileExplicit = file != null;
    Path folder = file == null ? null : file.toAbsolutePath().getParent();
    if (folder != null && folder.getFileName() != null) {
      this.language = folder.getFileName().toString();
      this.rootPath = folder.getParent();
    }
    reloadIfStarted();
  }

  /** Switch format: recreate the engine, re-derive the file extension (unless explicit) and reload. */
  public void setFormat(PersistenceFormat format) throws IOException {
    Objects.requireNonNull(format, "format");
    if (format == this.format) return;
    this.format = format;
    this.engine = createEngine(format);
    if (!fileExplicit) recomputeFile();
    reloadIfStarted();
  }

  /** Server push: language, root path and format applied together, followed by a single reload. */
  public void applyServerState(String language, Path rootPath, PersistenceFormat format) throws IOException {
    if (language == null || language.isBlank()) {
      throw new LanguageConfigurationException("Language id is empty for " + container.name());
    }
    this.language = language.trim();
    this.rootPath = rootPath;
    this.fileExplicit = false;
    if (format != null && format != this.format) {
      this.format = format;
      this.engine = createEngine(format);
    }
    recomputeFile();
    reloadIfStarted();
  }

  public void setLanguageInfo(LanguageInfo info) {
    this.languageInfo = info == null ? LanguageInfo.empty() : info;
  }

  public void setExcludedTypes(Collection<String> names) {
    updateSettings(settings.withExcludedTypes(names));
  }

  public void setExcludedAttributes(Collection<String> names) {
    updateSettings(settings.withExcludedAttributes(names));
  }

  public void setExcludeOnAction(boolean excludeOnAction) {
    updateSettings(settings.withExcludeOnAction(excludeOnAction));
  }

  public void setCreateIfMissing(boolean createIfMissing) {
    updateSettings(settings.withCreateIfMissing(createIfMissing));
  }

  public void load() throws IOException {
    load(container, file);
  }

  public void load(Container target) throws IOException {
    load(target, file);
  }

  /** Silent no-op when not ready; a cancelled before-event skips the load. */
  public void load(Container target, Path file) throws IOException {
    TranslationEngine e = engine;
    if (e == null || file == null || target == null) return;
    LanguageEvent event = new LanguageEvent(this, target, file);
    for (CoordinatorListener l : listeners) l.beforeLoad(event);
    if (event.isCancelled()) return;

    store.clear();
    EngineResult r = e.load(target, file, store);
    debug("load", file, r);
    if (!handle("load", r)) return;
    for (CoordinatorListener l : listeners) l.afterLoad(event);
  }

  /** @throws LanguageConfigurationException when no file is resolved */
  public void save() throws IOException {
    save(container, file);
  }

  public void save(Container target) throws IOException {
    save(target, file);
  }

  public void save(Container target, Path file) throws IOException {
    if (file == null) {
      throw new LanguageConfigurationException("No translation file resolved for " + container.name());
    }
    TranslationEngine e = engine;
    if (e == null || target == null) return;
    LanguageEvent event = new LanguageEvent(this, target, file);
    for (CoordinatorListener l : listeners) l.beforeSave(event);
    if (event.isCancelled()) return;

    EngineResult r = e.save(target, file);
    debug("save", file, r);
    if (!handle("save", r)) return;
    for (CoordinatorListener l : listeners) l.afterSave(event);
  }

  /** Own store first, then the server; {@code s} itself when neither knows it. */
  public String translate(String s) {
    if (s == null || s.isEmpty()) return s;
    var local = store.tryGet(s);
    if (local.isPresent()) return local.get();
    return server == null ? s : server.translate(s);
  }

  /** Unregister from the server; the coordinator stops reloading on state changes. */
  @Override
  public void close() {
    started = false;
    if (server != null) server.unregisterClient(this);
  }

  private void reloadIfStarted() throws IOException {
    if (started) load();
  }

  private void recomputeFile() {
    if (fileExplicit) return;
    Path root = rootPath;
    String lang = language;
    if (root == null || lang == null) return;
    this.file = root.resolve(lang).resolve(format.fileName(container.name()));
  }

  private void updateSettings(EngineSettings next) {
    this.settings = next;
    TranslationEngine e = engine;
    if (e != null) e.updateSettings(s -> next);
  }

  /**
   * Unregistered formats are configuration errors and throw; any other creation failure is reported as a
   * domain error and leaves the coordinator without an engine.
   */
  private TranslationEngine createEngine(PersistenceFormat format) {
    if (!registry.isRegistered(format)) {
      throw new LanguageConfigurationException("No translation format registered for " + format);
    }
    try {
      return registry.create(format, settings);
    } catch (LanguageConfigurationException ex) {
      reportDomainError("createEngine", LanguageError.domain("Cannot create " + format.id() + " engine for " +
          container.name(), ex));
      return null;
    }
  }

  /** @return true when the operation completed */
  private boolean handle(String op, EngineResult r) {
    if (r instanceof EngineResult.Completed) return true;
    LanguageError error = ((EngineResult.Rejected) r).error();
    if (error instanceof LanguageError.DomainError de) {
      reportDomainError(op, de);
      return false;
    }
    throw error.toException();
  }

  private void reportDomainError(String op, LanguageError.DomainError error) {
    log.warn("lingua.coordinator op={} container={} error={}", op, container.name(), error.message());
    for (CoordinatorListener l : listeners) l.onError(this, error);
  }

  private void debug(String op, Path file, EngineResult r) {
    if (!log.isDebugEnabled()) return;
    log.debug("lingua.coordinator op={} container={} language={} format={} file={} result={}",
        op, container.name(), language, format.id(), file, r.getClass().getSimpleName());
  }

  private static String blankToNull(String s) {
    return (s == null || s.isBlank()) ? null : s.trim();
  }
}
