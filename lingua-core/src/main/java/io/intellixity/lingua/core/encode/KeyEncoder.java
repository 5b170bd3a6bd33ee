package io.intellixity.lingua.core.encode;

import java.nio.charset.StandardCharsets;
import java.util.zip.CRC32;

/**
 * Pure string utilities used to build stable translation keys and to store
 * arbitrary text in line-oriented files.\n
 *
 * - {@link #hash(String)}: CRC-32 over UTF-16 code units (low byte first), 8 uppercase hex digits\n
 * - {@link #escape(String)}/{@link #unescape(String)}: bracket tokens for line breaks and the list separator\n
 * - {@link #joinMultiline(String)}/{@link #restoreMultiline(String)}: two-character placeholders for single-line values\n
 * - {@link #normalizeKey(String)}/{@link #denormalizeKey(String)}: INI-reserved characters in storage keys\n
 *
 * Every pair is reversible for any input; {@code null} is treated as the empty string.
 */
public final class KeyEncoder {
  /** Reserved separator for list-typed values. */
  public static final char LIST_SEPARATOR = '§';
  /** Placeholder written instead of a line break by {@link #joinMultiline(String)}. */
  public static final String LINE_PLACEHOLDER = "~~";

  private static final String[][] ESCAPE_TOKENS = {
      {"[CRLF]", "\r\n"},
      {"[LF]", "\n"},
      {"[CR]", "\r"},
      {"[" + LIST_SEPARATOR + "]", String.valueOf(LIST_SEPARATOR)},
      {"[[]", "["}
  };

  private static final String[][] KEY_TOKENS = {
      {"[EQUAL]", "="},
      {"[SEMICOLON]", ";"},
      {"[[]", "["},
      {"''", "'"}
  };

  private KeyEncoder() {}

  /** Deterministic 8-hex-digit key for {@code s}. */
  public static String hash(String s) {
    CRC32 crc = new CRC32();
    crc.update(nz(s).getBytes(StandardCharsets.UTF_16LE));
    return String.format("%08X", crc.getValue());
  }

  public static String escape(String s) {
    String in = nz(s);
    StringBuilder out = new StringBuilder(in.length() + 8);
    for (int i = 0; i < in.length(); i++) {
      char c = in.charAt(i);
      if (c == '[') out.append("[[]");
      else if (c == LIST_SEPARATOR) out.append('[').append(LIST_SEPARATOR).append(']');
      else if (c == '\r' && i + 1 < in.length() && in.charAt(i + 1) == '\n') {
        out.append("[CRLF]");
        i++;
      } else if (c == '\r') out.append("[CR]");
      else if (c == '\n') out.append("[LF]");
      else out.append(c);
    }
    return out.toString();
  }

  public static String unescape(String s) {
    return decodeTokens(nz(s), ESCAPE_TOKENS);
  }

  public static String joinMultiline(String s) {
    String in = nz(s);
    StringBuilder out = new StringBuilder(in.length() + 8);
    for (int i = 0; i < in.length(); i++) {
      char c = in.charAt(i);
      switch (c) {
        case '~' -> out.append("~-");
        case '\n' -> out.append(LINE_PLACEHOLDER);
        case '\r' -> out.append("~r");
        default -> out.append(c);
      }
    }
    return out.toString();
  }

  public static String restoreMultiline(String s) {
    String in = nz(s);
    if (in.indexOf('~') < 0) return in;
    StringBuilder out = new StringBuilder(in.length());
    for (int i = 0; i < in.length(); i++) {
      char c = in.charAt(i);
      if (c != '~' || i + 1 >= in.length()) {
        out.append(c);
        continue;
      }
      char next = in.charAt(i + 1);
      switch (next) {
        case '~' -> out.append('\n');
        case '-' -> out.append('~');
        case 'r' -> out.append('\r');
        default -> {
          // hand-edited files may contain a bare '~'
          out.append(c);
          continue;
        }
      }
      i++;
    }
    return out.toString();
  }

  public static String normalizeKey(String s) {
    String in = nz(s);
    StringBuilder out = new StringBuilder(in.length() + 8);
    for (int i = 0; i < in.length(); i++) {
      char c = in.charAt(i);
      switch (c) {
        case '=' -> out.append("[EQUAL]");
        case ';' -> out.append("[SEMICOLON]");
        case '[' -> out.append("[[]");
        case '\'' -> out.append("''");
        default -> out.append(c);
      }
    }
    return out.toString();
  }

  public static String denormalizeKey(String s) {
    return decodeTokens(nz(s), KEY_TOKENS);
  }

  /** Doubles backslashes so a Windows path survives formats that treat them as escapes. */
  public static String normalizePath(String s) {
    return nz(s).replace("\\", "\\\\");
  }

  private static String decodeTokens(String in, String[][] tokens) {
    StringBuilder out = new StringBuilder(in.length());
    int i = 0;
    outer:
    while (i < in.length()) {
      for (String[] t : tokens) {
        if (in.startsWith(t[0], i)) {
          out.append(t[1]);
          i += t[0].length();
          continue outer;
        }
      }
      out.append(in.charAt(i++));
    }
    return out.toString();
  }

  private static String nz(String s) {
    return s == null ? "" : s;
  }
}
