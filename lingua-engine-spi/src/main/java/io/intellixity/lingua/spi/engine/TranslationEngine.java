package io.intellixity.lingua.spi.engine;

import io.intellixity.lingua.core.encode.KeyEncoder;
import io.intellixity.lingua.core.error.LanguageError;
import io.intellixity.lingua.core.format.PersistenceFormat;
import io.intellixity.lingua.core.info.LanguageInfo;
import io.intellixity.lingua.core.model.AttributeDescriptor;
import io.intellixity.lingua.core.model.Container;
import io.intellixity.lingua.core.model.ContainerType;
import io.intellixity.lingua.core.store.TranslationStore;
import io.intellixity.lingua.spi.format.FormatContext;
import io.intellixity.lingua.spi.format.TranslationFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiConsumer;
import java.util.function.UnaryOperator;

/**
 * Orchestrator shared by every file format.\n
 *
 * Responsibilities:\n
 * - existence and auto-create policy\n
 * - eligibility (via {@link EligibilityRules}) exposed to the format through a {@link FormatContext}\n
 * - the runtime dictionary filled by the last load\n
 *
 * The {@link TranslationFormat} only parses and writes. One engine per owner; not shared between threads
 * while loading or saving.
 */
public final class TranslationEngine {
  private static final Logger log = LoggerFactory.getLogger(TranslationEngine.class);

  private final TranslationFormat format;
  private volatile EngineSettings settings;
  private final Map<String, String> runtimeStrings = new ConcurrentHashMap<>();

  public TranslationEngine(TranslationFormat format, EngineSettings settings) {
    this.format = Objects.requireNonNull(format, "format");
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  public PersistenceFormat format() {
    return format.format();
  }

  public EngineSettings settings() {
    return settings;
  }

  public void updateSettings(UnaryOperator<EngineSettings> change) {
    this.settings = Objects.requireNonNull(change.apply(settings), "settings");
  }

  /**
   * Apply {@code file} onto the tree below {@code root} and collect its runtime strings.\n
   *
   * A missing file is rejected with a domain error unless auto-create is on, in which case the current
   * tree is saved first. The runtime dictionary and {@code store} (when given) are cleared before parsing.
   *
   * @param root traversal root, or null to read runtime strings only
   * @param store receives the runtime strings as well, may be null
   */
  public EngineResult load(Container root, Path file, TranslationStore store) throws IOException {
    if (file == null) return EngineResult.rejected(LanguageError.configuration("No file resolved for load"));
    EngineSettings s = settings;
    if (!Files.exists(file)) {
      if (!s.createIfMissing() || root == null) {
        return EngineResult.rejected(LanguageError.domain("Translation file not found: " + file));
      }
      EngineResult created = save(root, file);
      if (!created.isCompleted()) return created;
    }

    long start = System.nanoTime();
    runtimeStrings.clear();
    if (store != null) store.clear();
    format.deserialize(new EngineContext(s), root, file, (key, value) -> {
      if (key == null || key.isEmpty()) return;
      String v = value == null ? "" : value;
      runtimeStrings.put(key, v);
      if (store != null) store.setRaw(key, v);
    });
    debugDone("load", file, System.nanoTime() - start);
    return EngineResult.completed(file);
  }

  /** Write the tree below {@code root}; a null file is a configuration error. */
  public EngineResult save(Container root, Path file) throws IOException {
    Objects.requireNonNull(root, "root");
    if (file == null) return EngineResult.rejected(LanguageError.configuration("No file resolved for save"));
    EngineSettings s = settings;
    Path dir = file.toAbsolutePath().getParent();
    if (dir != null && !Files.isDirectory(dir) && s.createIfMissing()) {
      Files.createDirectories(dir);
    }

    long start = System.nanoTime();
    format.serialize(new EngineContext(s), root, file);
    debugDone("save", file, System.nanoTime() - start);
    return EngineResult.completed(file);
  }

  /** Runtime string for {@code s} from the last load, or {@code s} itself. Never throws. */
  public String translate(String s) {
    if (s == null || s.isEmpty()) return s;
    String v = runtimeStrings.get(KeyEncoder.hash(s));
    return v == null ? s : v;
  }

  public LanguageInfo readLanguageInfo(Path file) throws IOException {
    return format.infoLoader().loadFromFile(file);
  }

  /** Sorted copy of the runtime dictionary (hashed key to value). */
  public Map<String, String> runtimeStrings() {
    return Collections.unmodifiableMap(new TreeMap<>(runtimeStrings));
  }

  private void debugDone(String op, Path file, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("lingua.engine op={} format={} file={} runtimeStrings={} durationMs={}",
        op, format.format().id(), file, runtimeStrings.size(), durationNanos / 1_000_000.0);
  }

  private static final class EngineContext implements FormatContext {
    private final EngineSettings settings;
    private final EligibilityRules rules;

    EngineContext(EngineSettings settings) {
      this.settings = settings;
      this.rules = new EligibilityRules(settings);
    }

    @Override
    public ContainerType<?> typeOf(Object value) {
      return settings.types().typeOf(value);
    }

    @Override
    public boolean isIncluded(Container container) {
      return container != null && rules.isIncluded(typeOf(container));
    }

    @Override
    public List<AttributeDescriptor<?>> persistableAttributes(Object value) {
      if (value == null) return List.of();
      List<AttributeDescriptor<?>> out = new ArrayList<>();
      for (AttributeDescriptor<?> a : typeOf(value).attributes()) {
        if (rules.isPersistable(a)) out.add(a);
      }
      return out;
    }

    @Override
    public boolean isApplicable(Container owner, AttributeDescriptor<?> attribute) {
      return rules.isApplicable(owner, attribute);
    }

    @Override
    public boolean apply(Container owner, Object target, String attributeName, Object value) {
      if (target == null) return false;
      AttributeDescriptor<?> a = typeOf(target).attribute(attributeName);
      if (a == null || !rules.isApplicable(owner, a)) return false;
      boolean accepted = switch (a.kind()) {
        case TEXT -> value instanceof String;
        case TEXT_LIST -> value instanceof List<?>;
        case NESTED -> false;
      };
      if (!accepted) return false;
      a.write(target, value);
      return true;
    }

    @Override
    public void forEachContainer(Container root, BiConsumer<String, Container> visitor) {
      TreeNavigator.forEachDescendant(root, this::isIncluded, visitor);
    }

    @Override
    public Container resolve(Container root, String qualifiedName) {
      return TreeNavigator.resolve(root, qualifiedName, this::isIncluded);
    }
  }
}
