package io.intellixity.lingua.coordination;

import io.intellixity.lingua.core.format.PersistenceFormat;
import io.intellixity.lingua.core.info.LanguageInfo;
import io.intellixity.lingua.core.model.ContainerTypeRegistry;
import io.intellixity.lingua.core.store.InMemoryTranslationStore;
import io.intellixity.lingua.core.store.TranslationStore;
import io.intellixity.lingua.spi.engine.EngineRegistry;
import io.intellixity.lingua.spi.engine.EngineResult;
import io.intellixity.lingua.spi.engine.EngineSettings;
import io.intellixity.lingua.spi.engine.TranslationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Shared language service federating many {@link LanguageCoordinator}s.\n
 *
 * Create one per application, inject it into coordinators and {@link #close()} it at shutdown.\n
 *
 * Once language and root path are set and {@code <root>/<language>} exists, every state change runs:\n
 * 1) runtime strings ({@code runtime<ext>}) into a fresh shared store, swapped in atomically\n
 * 2) language, root path and format pushed to every client\n
 * 3) metadata ({@code lang<ext>}) read\n
 * 4) metadata pushed to every client\n
 * 5) change listeners notified\n
 *
 * The client list is guarded by its monitor for register, unregister and synchronization.
 */
public final class LanguageServer implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(LanguageServer.class);

  private final EngineRegistry registry;
  private final EngineSettings engineSettings;
  private final List<LanguageCoordinator> clients = new ArrayList<>();
  private final List<LanguageChangeListener> changeListeners = new CopyOnWriteArrayList<>();
  private final AtomicReference<TranslationStore> store = new AtomicReference<>(new InMemoryTranslationStore());

  private volatile String language;
  private volatile Path rootPath;
  private volatile PersistenceFormat format = PersistenceFormat.INI;
  private volatile LanguageInfo languageInfo = LanguageInfo.empty();
  private volatile boolean closed;

  public LanguageServer(EngineRegistry registry) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.engineSettings = EngineSettings.defaults(new ContainerTypeRegistry());
  }

  public EngineRegistry registry() { return registry; }
  public String language() { return language; }
  public Path rootPath() { return rootPath; }
  public PersistenceFormat format() { return format; }
  public LanguageInfo languageInfo() { return languageInfo; }
  public boolean isClosed() { return closed; }

  /** Idempotent; a client registered while the server can sync is synchronized immediately. */
  public void registerClient(LanguageCoordinator client) throws IOException {
    if (client == null) return;
    synchronized (clients) {
      if (clients.contains(client)) return;
      clients.add(client);
      if (canSync()) {
        client.applyServerState(language, rootPath, format);
        client.setLanguageInfo(languageInfo);
      }
    }
  }

  public void unregisterClient(LanguageCoordinator client) {
    if (client == null) return;
    synchronized (clients) {
      clients.remove(client);
    }
  }

  public List<LanguageCoordinator> clients() {
    synchronized (clients) {
      return List.copyOf(clients);
    }
  }

  public void addChangeListener(LanguageChangeListener listener) {
    changeListeners.add(Objects.requireNonNull(listener, "listener"));
  }

  public void removeChangeListener(LanguageChangeListener listener) {
    changeListeners.remove(listener);
  }

  public void setLanguage(String language) throws IOException {
    this.language = (language == null || language.isBlank()) ? null : language.trim();
    updateData();
  }

  public void setRootPath(Path rootPath) throws IOException {
    this.rootPath = rootPath;
    updateData();
  }

  public void setFormat(PersistenceFormat format) throws IOException {
    this.format = Objects.requireNonNull(format, "format");
    updateData();
  }

  /** Apply all three values, then synchronize once. */
  public void configure(String language, Path rootPath, PersistenceFormat format) throws IOException {
    this.language = (language == null || language.isBlank()) ? null : language.trim();
    this.rootPath = rootPath;
    if (format != null) this.format = format;
    updateData();
  }

  /** Language and root path are set and the language folder exists. */
  public boolean canSync() {
    String l = language;
    Path r = rootPath;
    return !closed && l != null && r != null && Files.isDirectory(r.resolve(l));
  }

  /** Shared runtime string for {@code s}, or {@code s} itself; empty for null or empty input. */
  public String translate(String s) {
    if (s == null || s.isEmpty()) return "";
    return store.get().tryGet(s).orElse(s);
  }

  /** Drop every client and listener. Idempotent. */
  @Override
  public void close() {
    closed = true;
    synchronized (clients) {
      clients.clear();
    }
    changeListeners.clear();
  }

  private void updateData() throws IOException {
    if (!canSync()) return;
    long start = System.nanoTime();
    importRuntimeStrings();
    synchronizeClients();
    importLanguageInfo();
    synchronizeClientsInfo();
    for (LanguageChangeListener l : changeListeners) l.languageChanged(language, rootPath);
    if (log.isDebugEnabled()) {
      log.debug("lingua.server op=updateData language={} rootPath={} format={} strings={} clients={} durationMs={}",
          language, rootPath, format.id(), store.get().size(), clients().size(),
          (System.nanoTime() - start) / 1_000_000.0);
    }
  }

  private Path languageFolder() {
    return rootPath.resolve(language);
  }

  private void importRuntimeStrings() throws IOException {
    TranslationStore fresh = new InMemoryTranslationStore();
    Path file = languageFolder().resolve(format.fileName(PersistenceFormat.RUNTIME_FILE_NAME));
    if (Files.exists(file)) {
      EngineResult r = engine().load(null, file, fresh);
      if (r instanceof EngineResult.Rejected rejected) throw rejected.error().toException();
    }
    store.set(fresh);
  }

  private void synchronizeClients() throws IOException {
    // Snapshot: a client's listeners may close it or register another client mid-push.
    for (LanguageCoordinator c : clients()) c.applyServerState(language, rootPath, format);
  }

  private void importLanguageInfo() throws IOException {
    Path file = languageFolder().resolve(format.fileName(PersistenceFormat.INFO_FILE_NAME));
    languageInfo = Files.exists(file) ? engine().readLanguageInfo(file) : LanguageInfo.empty();
  }

  private void synchronizeClientsInfo() {
    for (LanguageCoordinator c : clients()) c.setLanguageInfo(languageInfo);
  }

  private TranslationEngine engine() {
    return registry.create(format, engineSettings);
  }
}
