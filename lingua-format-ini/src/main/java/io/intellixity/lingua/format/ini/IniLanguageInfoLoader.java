package io.intellixity.lingua.format.ini;

import io.intellixity.lingua.core.info.LanguageInfo;
import io.intellixity.lingua.core.info.LanguageInfoLoader;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;

/** Reads section {@code [Language]}; absent keys default to empty / false. */
public final class IniLanguageInfoLoader implements LanguageInfoLoader {
  public static final String SECTION = "Language";

  @Override
  public LanguageInfo loadFromFile(Path file) throws IOException {
    IniDocument.Section s = IniDocument.read(file, ";").section(SECTION);
    if (s == null) return LanguageInfo.empty();
    return new LanguageInfo(
        s.get("Id", "").trim(),
        s.get("Name", "").trim(),
        s.get("NativeName", "").trim(),
        parseBoolean(s.get("IsRightToLeft")),
        s.get("UIFont", "").trim(),
        s.get("FallbackFont", "").trim());
  }

  static boolean parseBoolean(String v) {
    if (v == null) return false;
    return switch (v.trim().toLowerCase(Locale.ROOT)) {
      case "true", "1", "yes" -> true;
      default -> false;
    };
  }
}
