package io.intellixity.lingua.core.model;

/** Value shape of a declared attribute. */
public enum AttributeKind {
  /** Plain string. */
  TEXT,
  /** Ordered list of strings. */
  TEXT_LIST,
  /** Structured value that is not a Container; its own type is looked up in the registry. */
  NESTED
}
