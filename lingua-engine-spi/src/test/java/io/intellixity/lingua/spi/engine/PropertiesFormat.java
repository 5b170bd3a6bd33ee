package io.intellixity.lingua.spi.engine;

import io.intellixity.lingua.core.format.PersistenceFormat;
import io.intellixity.lingua.core.info.LanguageInfo;
import io.intellixity.lingua.core.info.LanguageInfoLoader;
import io.intellixity.lingua.core.model.AttributeDescriptor;
import io.intellixity.lingua.core.model.AttributeKind;
import io.intellixity.lingua.core.model.Container;
import io.intellixity.lingua.spi.format.FormatContext;
import io.intellixity.lingua.spi.format.RuntimeStringSink;
import io.intellixity.lingua.spi.format.TranslationFormat;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Minimal format for engine tests: {@code <qualifiedName>|<attribute>=value} and {@code strings.<key>=value}
 * in a java.util.Properties file.
 */
public class PropertiesFormat implements TranslationFormat {
  static final String STRINGS_PREFIX = "strings.";

  @Override
  public PersistenceFormat format() {
    return PersistenceFormat.JSON;
  }

  @Override
  public void deserialize(FormatContext ctx, Container root, Path file, RuntimeStringSink strings) throws IOException {
    Properties p = read(file);
    for (String key : p.stringPropertyNames()) {
      String value = p.getProperty(key);
      if (key.startsWith(STRINGS_PREFIX)) {
        strings.put(key.substring(STRINGS_PREFIX.length()), value);
        continue;
      }
      int bar = key.indexOf('|');
      if (root == null || bar < 0) continue;
      Container c = ctx.resolve(root, key.substring(0, bar));
      if (c != null) ctx.apply(c, c, key.substring(bar + 1), value);
    }
  }

  @Override
  public void serialize(FormatContext ctx, Container root, Path file) throws IOException {
    Properties p = new Properties();
    ctx.forEachContainer(root, (qn, c) -> {
      for (AttributeDescriptor<?> a : ctx.persistableAttributes(c)) {
        if (a.kind() != AttributeKind.TEXT) continue;
        Object v = a.read(c);
        p.setProperty(qn + "|" + a.name(), v == null ? "" : v.toString());
      }
    });
    try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
      p.store(w, null);
    }
  }

  @Override
  public LanguageInfoLoader infoLoader() {
    return file -> {
      Properties p = read(file);
      return new LanguageInfo(p.getProperty("language.id"), p.getProperty("language.name"), null, false, null, null);
    };
  }

  static Properties read(Path file) throws IOException {
    Properties p = new Properties();
    try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      p.load(r);
    }
    return p;
  }
}
