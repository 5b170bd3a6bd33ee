package io.intellixity.lingua.format.ini;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * In-memory INI file.\n
 *
 * Parsing rules:\n
 * - UTF-8, a leading BOM is dropped\n
 * - blank lines and lines starting with the comment character are ignored\n
 * - section and key lookups are case-insensitive, insertion order is kept\n
 * - {@code key=value} splits at the first '='; the key is trimmed, the value kept verbatim\n
 * - entries before the first section header are ignored; a repeated key keeps the last value\n
 *
 * Rendering writes {@code \n} line ends and a blank line between sections.
 */
public final class IniDocument {
  private static final char BOM = '\uFEFF';

  private final String commentStart;
  private final Map<String, Section> sections = new LinkedHashMap<>();

  public IniDocument() {
    this(";");
  }

  public IniDocument(String commentStart) {
    this.commentStart = (commentStart == null || commentStart.isEmpty()) ? ";" : commentStart;
  }

  public static IniDocument read(Path file, String commentStart) throws IOException {
    return parse(Files.readString(file, StandardCharsets.UTF_8), commentStart);
  }

  public static IniDocument parse(String text, String commentStart) {
    IniDocument doc = new IniDocument(commentStart);
    if (text == null || text.isEmpty()) return doc;
    if (text.charAt(0) == BOM) text = text.substring(1);

    Section current = null;
    for (String raw : text.split("\r\n|\n|\r", -1)) {
      String line = raw.strip();
      if (line.isEmpty() || line.startsWith(doc.commentStart)) continue;
      if (line.startsWith("[") && line.endsWith("]")) {
        current = doc.section(line.substring(1, line.length() - 1).trim(), true);
        continue;
      }
      if (current == null) continue;
      int eq = raw.indexOf('=');
      if (eq <= 0) continue;
      String key = raw.substring(0, eq).trim();
      if (key.isEmpty()) continue;
      current.put(key, raw.substring(eq + 1));
    }
    return doc;
  }

  public void write(Path file) throws IOException {
    Files.writeString(file, render(), StandardCharsets.UTF_8);
  }

  public String render() {
    StringBuilder sb = new StringBuilder();
    boolean first = true;
    for (Section s : sections.values()) {
      if (!first) sb.append('\n');
      first = false;
      sb.append('[').append(s.name()).append("]\n");
      s.entries().forEach((k, v) -> sb.append(k).append('=').append(v).append('\n'));
    }
    return sb.toString();
  }

  public boolean hasSection(String name) {
    return name != null && sections.containsKey(lookupKey(name));
  }

  /** Section by name (case-insensitive), or null. */
  public Section section(String name) {
    return name == null ? null : sections.get(lookupKey(name));
  }

  public Section section(String name, boolean create) {
    Objects.requireNonNull(name, "name");
    Section s = section(name);
    if (s == null && create) {
      s = new Section(name);
      sections.put(lookupKey(name), s);
    }
    return s;
  }

  public void removeSection(String name) {
    if (name != null) sections.remove(lookupKey(name));
  }

  public List<Section> sections() {
    return Collections.unmodifiableList(new ArrayList<>(sections.values()));
  }

  private static String lookupKey(String name) {
    return name.toLowerCase(Locale.ROOT);
  }

  /** One {@code [section]} with its ordered entries. */
  public static final class Section {
    private final String name;
    private final Map<String, String> keys = new LinkedHashMap<>();
    private final Map<String, String> values = new LinkedHashMap<>();

    private Section(String name) {
      this.name = name;
    }

    public String name() {
      return name;
    }

    public String get(String key) {
      return key == null ? null : values.get(lookupKey(key));
    }

    public String get(String key, String defaultValue) {
      String v = get(key);
      return v == null ? defaultValue : v;
    }

    public void put(String key, String value) {
      Objects.requireNonNull(key, "key");
      String k = lookupKey(key);
      keys.putIfAbsent(k, key);
      values.put(k, value == null ? "" : value);
    }

    public void remove(String key) {
      if (key == null) return;
      String k = lookupKey(key);
      keys.remove(k);
      values.remove(k);
    }

    public boolean isEmpty() {
      return values.isEmpty();
    }

    /** Entries with their original key spelling, in insertion order. */
    public Map<String, String> entries() {
      Map<String, String> out = new LinkedHashMap<>();
      values.forEach((k, v) -> out.put(keys.get(k), v));
      return out;
    }
  }
}
