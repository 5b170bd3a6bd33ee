package io.intellixity.lingua.core.format;

import io.intellixity.lingua.core.error.LanguageConfigurationException;

import java.util.Locale;

/** Selects which translation format handles a language file. */
public enum PersistenceFormat {
  /** Structured/nested JSON. */
  JSON("json", ".json", ""),
  /** Hierarchical text: one INI section per container. */
  INI("ini", ".lng", ";"),
  /** Flat text: a single INI section, keys qualified with the container path. */
  FLAT_INI("ini-flat", ".clng", ";");

  /** File name (without extension) of the runtime-strings file in a language folder. */
  public static final String RUNTIME_FILE_NAME = "runtime";
  /** File name (without extension) of the language metadata file in a language folder. */
  public static final String INFO_FILE_NAME = "lang";

  private final String id;
  private final String extension;
  private final String commentStart;

  PersistenceFormat(String id, String extension, String commentStart) {
    this.id = id;
    this.extension = extension;
    this.commentStart = commentStart;
  }

  /** Configuration identifier, e.g. {@code ini-flat}. */
  public String id() { return id; }

  /** File extension including the leading dot. */
  public String extension() { return extension; }

  /** Line comment prefix, empty when the format has none. */
  public String commentStart() { return commentStart; }

  public String fileName(String baseName) {
    return baseName + extension;
  }

  /** Resolve a configuration value: either the {@link #id()} or the enum constant name, case-insensitive. */
  public static PersistenceFormat fromId(String value) {
    if (value == null || value.isBlank()) throw new LanguageConfigurationException("Persistence format is blank");
    String v = value.trim();
    for (PersistenceFormat f : values()) {
      if (f.id.equalsIgnoreCase(v) || f.name().equalsIgnoreCase(v.replace('-', '_'))) return f;
    }
    throw new LanguageConfigurationException("Unknown persistence format: " + value.toLowerCase(Locale.ROOT));
  }
}
