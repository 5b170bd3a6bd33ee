package io.intellixity.lingua.spi.engine;

import io.intellixity.lingua.core.error.LanguageConfigurationException;
import io.intellixity.lingua.core.format.PersistenceFormat;
import io.intellixity.lingua.core.model.ContainerTypeRegistry;
import io.intellixity.lingua.core.util.LinguaFactoriesLoader;
import io.intellixity.lingua.spi.format.TranslationFormat;
import io.intellixity.lingua.spi.format.TranslationFormatProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps persistence formats to {@link TranslationFormat} classes.\n
 *
 * Semantics:\n
 * - register probes the class once (no-arg instantiation, contract and format check) and fails fast\n
 * - the first registration for a format wins; later ones are ignored\n
 * - create builds a fresh engine and format instance on every call\n
 */
public final class EngineRegistry {
  private static final Logger log = LoggerFactory.getLogger(EngineRegistry.class);

  private final Map<PersistenceFormat, Class<? extends TranslationFormat>> classes = new ConcurrentHashMap<>();

  /** Registry with every format listed by {@link TranslationFormatProvider}s in META-INF/lingua.factories. */
  public static EngineRegistry discover() {
    return discover(LinguaFactoriesLoader.load(TranslationFormatProvider.class));
  }

  public static EngineRegistry discover(ClassLoader cl) {
    return discover(LinguaFactoriesLoader.load(TranslationFormatProvider.class, cl));
  }

  static EngineRegistry discover(List<TranslationFormatProvider> providers) {
    EngineRegistry r = new EngineRegistry();
    for (TranslationFormatProvider p : providers) {
      if (p == null) continue;
      Map<PersistenceFormat, Class<? extends TranslationFormat>> fs = p.formats();
      if (fs == null) continue;
      fs.forEach(r::register);
    }
    return r;
  }

  /**
   * @return true when the class became active for {@code format}, false when the format was already taken
   * @throws LanguageConfigurationException when the class cannot be instantiated, is not a
   *         {@link TranslationFormat} or handles another format
   */
  public boolean register(PersistenceFormat format, Class<?> formatClass) {
    Objects.requireNonNull(format, "format");
    Objects.requireNonNull(formatClass, "formatClass");
    TranslationFormat probe = probe(formatClass);
    if (probe.format() != format) {
      throw new LanguageConfigurationException("Format class " + formatClass.getName() + " handles " +
          probe.format() + ", cannot be registered for " + format);
    }
    @SuppressWarnings("unchecked")
    Class<? extends TranslationFormat> c = (Class<? extends TranslationFormat>) formatClass;
    Class<? extends TranslationFormat> existing = classes.putIfAbsent(format, c);
    if (log.isDebugEnabled()) {
      log.debug("lingua.registry op=register format={} class={} active={}",
          format.id(), formatClass.getName(), existing == null ? formatClass.getName() : existing.getName());
    }
    return existing == null;
  }

  public void unregister(PersistenceFormat format) {
    if (format == null) return;
    if (classes.remove(format) != null && log.isDebugEnabled()) {
      log.debug("lingua.registry op=unregister format={}", format.id());
    }
  }

  public boolean isRegistered(PersistenceFormat format) {
    return format != null && classes.containsKey(format);
  }

  public Set<PersistenceFormat> formats() {
    EnumSet<PersistenceFormat> s = EnumSet.noneOf(PersistenceFormat.class);
    s.addAll(classes.keySet());
    return Collections.unmodifiableSet(s);
  }

  /** Registered class for {@code format}, or null. */
  public Class<? extends TranslationFormat> formatClass(PersistenceFormat format) {
    return format == null ? null : classes.get(format);
  }

  public TranslationEngine create(PersistenceFormat format, ContainerTypeRegistry types) {
    return create(format, EngineSettings.defaults(types));
  }

  /** @throws LanguageConfigurationException when nothing is registered for {@code format} */
  public TranslationEngine create(PersistenceFormat format, EngineSettings settings) {
    Objects.requireNonNull(settings, "settings");
    Class<? extends TranslationFormat> c = formatClass(format);
    if (c == null) {
      throw new LanguageConfigurationException("No translation format registered for " + format);
    }
    return new TranslationEngine(probe(c), settings);
  }

  private static TranslationFormat probe(Class<?> formatClass) {
    if (!TranslationFormat.class.isAssignableFrom(formatClass)) {
      throw new LanguageConfigurationException("Class " + formatClass.getName() + " does not implement " +
          TranslationFormat.class.getName());
    }
    Object instance;
    try {
      instance = formatClass.getDeclaredConstructor().newInstance();
    } catch (ReflectiveOperationException | RuntimeException | LinkageError e) {
      throw new LanguageConfigurationException("Cannot instantiate translation format " + formatClass.getName(), e);
    }
    TranslationFormat f = (TranslationFormat) instance;
    if (f.format() == null) {
      throw new LanguageConfigurationException("Translation format " + formatClass.getName() + " reports no format");
    }
    return f;
  }
}
