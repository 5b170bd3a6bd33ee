package io.intellixity.lingua.core.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URL;
import java.util.*;

/**
 * spring.factories-style discovery for lingua extensions.\n
 *
 * Reads every {@code META-INF/lingua.factories} resource on the classpath. Each resource is a Java
 * Properties file mapping an SPI interface to implementation classes:\n
 *
 * <pre>
 * io.intellixity.lingua.spi.format.TranslationFormatProvider=com.acme.PoFormatProvider,com.acme.XliffFormatProvider
 * </pre>
 *
 * Values may be comma-separated; whitespace is ignored; duplicates keep their first position.
 */
public final class LinguaFactoriesLoader {
  private static final Logger log = LoggerFactory.getLogger(LinguaFactoriesLoader.class);

  public static final String RESOURCE = "META-INF/lingua.factories";

  private LinguaFactoriesLoader() {}

  public static <T> List<T> load(Class<T> spiType) {
    return load(spiType, Thread.currentThread().getContextClassLoader());
  }

  public static <T> List<T> load(Class<T> spiType, ClassLoader cl) {
    Objects.requireNonNull(spiType, "spiType");
    if (cl == null) cl = LinguaFactoriesLoader.class.getClassLoader();

    LinkedHashSet<String> implNames = new LinkedHashSet<>();
    Enumeration<URL> resources;
    try {
      resources = cl.getResources(RESOURCE);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to enumerate " + RESOURCE, e);
    }

    while (resources.hasMoreElements()) {
      URL url = resources.nextElement();
      Properties p = new Properties();
      try (InputStream in = url.openStream()) {
        p.load(in);
      } catch (IOException e) {
        throw new UncheckedIOException("Failed to load " + RESOURCE + " from " + url, e);
      }
      List<String> names = implementationNames(p, spiType);
      logResource(url, spiType, names);
      implNames.addAll(names);
    }

    List<T> out = new ArrayList<>(implNames.size());
    for (String implName : implNames) {
      out.add(newInstance(implName, spiType, cl));
    }
    if (log.isDebugEnabled()) {
      log.debug("lingua.factories op=load spi={} implementations={}", spiType.getName(), implNames);
    }
    return out;
  }

  private static void logResource(URL url, Class<?> spiType, List<String> names) {
    if (!log.isDebugEnabled()) return;
    log.debug("lingua.factories op=read resource={} spi={} listed={}", url, spiType.getSimpleName(), names.size());
  }

  static List<String> implementationNames(Properties p, Class<?> spiType) {
    String v = p.getProperty(spiType.getName());
    if (v == null || v.isBlank()) return List.of();
    List<String> names = new ArrayList<>();
    for (String part : v.split(",")) {
      String name = part.trim();
      if (!name.isEmpty()) names.add(name);
    }
    return names;
  }

  private static <T> T newInstance(String implName, Class<T> spiType, ClassLoader cl) {
    Class<?> raw;
    try {
      raw = Class.forName(implName, true, cl);
    } catch (ClassNotFoundException e) {
      throw new IllegalStateException("Class " + implName + " listed in " + RESOURCE + " was not found", e);
    }
    if (!spiType.isAssignableFrom(raw)) {
      throw new IllegalStateException("Class " + implName + " does not implement " + spiType.getName());
    }
    try {
      return spiType.cast(raw.getDeclaredConstructor().newInstance());
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Failed to instantiate " + implName + " for SPI " + spiType.getName(), e);
    }
  }
}
