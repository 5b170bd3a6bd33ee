package io.intellixity.lingua.core.store;

import io.intellixity.lingua.core.encode.KeyEncoder;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/** Default {@link TranslationStore}: a concurrent map, safe for concurrent readers. */
public final class InMemoryTranslationStore implements TranslationStore {
  private final Map<String, String> items = new ConcurrentHashMap<>();

  @Override
  public void clear() {
    items.clear();
  }

  @Override
  public void set(String originalKey, String value) {
    setRaw(KeyEncoder.hash(originalKey), value);
  }

  @Override
  public void setRaw(String hashedKey, String value) {
    Objects.requireNonNull(hashedKey, "hashedKey");
    items.put(hashedKey, value == null ? "" : value);
  }

  @Override
  public Optional<String> tryGet(String originalKey) {
    return Optional.ofNullable(items.get(KeyEncoder.hash(originalKey)));
  }

  @Override
  public boolean isEmpty() {
    return items.isEmpty();
  }

  @Override
  public int size() {
    return items.size();
  }

  @Override
  public Map<String, String> snapshot() {
    // sorted for stable file output
    return Collections.unmodifiableMap(new TreeMap<>(items));
  }
}
