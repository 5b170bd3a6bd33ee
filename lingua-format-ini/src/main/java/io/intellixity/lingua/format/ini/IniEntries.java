package io.intellixity.lingua.format.ini;

import io.intellixity.lingua.core.encode.KeyEncoder;
import io.intellixity.lingua.core.format.PersistenceFormat;
import io.intellixity.lingua.core.model.AttributeDescriptor;
import io.intellixity.lingua.core.model.AttributeKind;
import io.intellixity.lingua.core.model.Container;
import io.intellixity.lingua.spi.format.FormatContext;
import io.intellixity.lingua.spi.format.RuntimeStringSink;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.function.BiConsumer;

/** Encoding rules shared by the hierarchical and flat INI formats. */
final class IniEntries {
  /** Runtime string table, hashed key to value. */
  static final String STRINGS_SECTION = "strings";
  /** Value of menu separators; never written. */
  static final String SEPARATOR_CAPTION = "-";

  private IniEntries() {}

  /** Existing file content (sections this save does not touch are kept), or an empty document. */
  static IniDocument open(Path file, PersistenceFormat format) throws IOException {
    return Files.exists(file) ? IniDocument.read(file, format.commentStart()) : new IniDocument(format.commentStart());
  }

  static int readStrings(IniDocument doc, RuntimeStringSink strings) {
    IniDocument.Section s = doc.section(STRINGS_SECTION);
    if (s == null) return 0;
    int n = 0;
    for (var e : s.entries().entrySet()) {
      strings.put(e.getKey().trim().toUpperCase(Locale.ROOT), KeyEncoder.restoreMultiline(e.getValue()));
      n++;
    }
    return n;
  }

  /** Persistable text attributes of {@code c} as (normalized key, single-line value). */
  static void textEntries(FormatContext ctx, Container c, BiConsumer<String, String> out) {
    for (AttributeDescriptor<?> a : ctx.persistableAttributes(c)) {
      if (a.kind() != AttributeKind.TEXT) continue;
      Object v = a.read(c);
      String s = v == null ? "" : v.toString();
      if (SEPARATOR_CAPTION.equals(s)) continue;
      out.accept(KeyEncoder.normalizeKey(a.name()), KeyEncoder.joinMultiline(s));
    }
  }

  /** Apply one stored entry; returns true when the attribute was written. */
  static boolean apply(FormatContext ctx, Container c, String storedKey, String storedValue) {
    return ctx.apply(c, c, KeyEncoder.denormalizeKey(storedKey), KeyEncoder.restoreMultiline(storedValue));
  }
}
