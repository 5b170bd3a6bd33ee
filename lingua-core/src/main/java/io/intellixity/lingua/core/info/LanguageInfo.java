package io.intellixity.lingua.core.info;

/**
 * Metadata describing one language, independent of its translations.\n
 *
 * @param id BCP-47 identifier such as {@code it-IT} or {@code ar-SA}\n
 * @param name English name\n
 * @param nativeName name as written by native speakers\n
 * @param rightToLeft true for right-to-left scripts\n
 * @param uiFont suggested UI font, may be empty\n
 * @param fallbackFont font used when {@code uiFont} is unavailable, may be empty\n
 */
public record LanguageInfo(String id,
                           String name,
                           String nativeName,
                           boolean rightToLeft,
                           String uiFont,
                           String fallbackFont) {
  private static final LanguageInfo EMPTY = new LanguageInfo("", "", "", false, "", "");

  public LanguageInfo {
    id = nz(id);
    name = nz(name);
    nativeName = nz(nativeName);
    uiFont = nz(uiFont);
    fallbackFont = nz(fallbackFont);
  }

  public static LanguageInfo empty() {
    return EMPTY;
  }

  public boolean isEmpty() {
    return equals(EMPTY);
  }

  private static String nz(String s) {
    return s == null ? "" : s;
  }
}
