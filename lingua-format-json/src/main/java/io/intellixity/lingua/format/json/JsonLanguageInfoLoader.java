package io.intellixity.lingua.format.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.lingua.core.info.LanguageInfo;
import io.intellixity.lingua.core.info.LanguageInfoLoader;

import java.io.IOException;
import java.nio.file.Path;

/** Reads the top-level {@code "language"} object; absent members default to empty / false. */
public final class JsonLanguageInfoLoader implements LanguageInfoLoader {
  private static final ObjectMapper JSON = new ObjectMapper();

  public static final String MEMBER = "language";

  @Override
  public LanguageInfo loadFromFile(Path file) throws IOException {
    JsonNode top = JSON.readTree(file.toFile());
    if (top == null || !top.isObject()) return LanguageInfo.empty();
    JsonNode l = top.get(MEMBER);
    if (l == null || !l.isObject()) return LanguageInfo.empty();
    return new LanguageInfo(
        textOrEmpty(l.get("id")),
        textOrEmpty(l.get("name")),
        textOrEmpty(l.get("nativeName")),
        bool(l.get("isRightToLeft")),
        textOrEmpty(l.get("uiFont")),
        textOrEmpty(l.get("fallbackFont")));
  }

  private static String textOrEmpty(JsonNode n) {
    return (n == null || n.isNull() || !n.isValueNode()) ? "" : n.asText().trim();
  }

  private static boolean bool(JsonNode n) {
    if (n == null || n.isNull()) return false;
    if (n.isBoolean()) return n.booleanValue();
    if (n.isNumber()) return n.intValue() != 0;
    String s = n.asText().trim();
    return s.equalsIgnoreCase("true") || s.equals("1") || s.equalsIgnoreCase("yes");
  }
}
