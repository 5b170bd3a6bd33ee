package io.intellixity.lingua.spi.format;

/** Receives generic runtime strings while a file is parsed. */
@FunctionalInterface
public interface RuntimeStringSink {
  /**
   * @param hashedKey key as stored in the file (already hashed)
   * @param value decoded value, line breaks restored
   */
  void put(String hashedKey, String value);
}
