package io.intellixity.lingua.core.model;

/** Dot-joined container paths, e.g. {@code Panel1.Button1}. */
public final class QualifiedName {
  public static final char SEPARATOR = '.';

  private QualifiedName() {}

  public static String join(String parent, String name) {
    if (parent == null || parent.isEmpty()) return name == null ? "" : name;
    if (name == null || name.isEmpty()) return parent;
    return parent + SEPARATOR + name;
  }

  public static String[] split(String qualified) {
    if (qualified == null || qualified.isEmpty()) return new String[0];
    return qualified.split("\\.");
  }

  public static String lastSegment(String qualified) {
    if (qualified == null) return "";
    int i = qualified.lastIndexOf(SEPARATOR);
    return i < 0 ? qualified : qualified.substring(i + 1);
  }
}
