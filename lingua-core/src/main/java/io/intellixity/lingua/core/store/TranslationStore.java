package io.intellixity.lingua.core.store;

import java.util.Map;
import java.util.Optional;

/**
 * Resolved translations keyed by {@link io.intellixity.lingua.core.encode.KeyEncoder#hash(String)}.\n
 *
 * Callers always pass the original (untranslated) string; the store hashes it.
 * {@link #setRaw(String, String)} is reserved for keys that were already hashed, typically read from a file.
 */
public interface TranslationStore {
  void clear();

  /** Hash {@code originalKey} and store {@code value} under it. */
  void set(String originalKey, String value);

  /** Store {@code value} under an already hashed key. */
  void setRaw(String hashedKey, String value);

  /** Look up the translation of {@code originalKey}. Never throws on a miss. */
  Optional<String> tryGet(String originalKey);

  boolean isEmpty();

  int size();

  /** Read-only copy of the content (hashed key -> value). */
  Map<String, String> snapshot();
}
