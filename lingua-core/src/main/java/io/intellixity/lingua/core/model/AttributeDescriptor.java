package io.intellixity.lingua.core.model;

import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Declared attribute of a container (or nested value) type.\n
 *
 * Accessors are plain functions supplied at registration time, no reflection involved.\n
 *
 * @param name attribute name as written to files\n
 * @param kind value shape\n
 * @param published false for attributes that exist but are not exposed for external inspection\n
 * @param getter reader, null when the attribute cannot be read\n
 * @param setter writer, null for read-only attributes\n
 */
public record AttributeDescriptor<C>(String name,
                                     AttributeKind kind,
                                     boolean published,
                                     Function<? super C, ?> getter,
                                     BiConsumer<? super C, Object> setter) {
  public AttributeDescriptor {
    if (name == null || name.isBlank()) throw new IllegalArgumentException("name is required");
    Objects.requireNonNull(kind, "kind");
  }

  public boolean readable() {
    return getter != null;
  }

  public boolean writable() {
    return setter != null;
  }

  /** Read the value from an instance of the owning type. */
  @SuppressWarnings("unchecked")
  public Object read(Object owner) {
    if (getter == null) throw new IllegalStateException("Attribute " + name + " is not readable");
    return getter.apply((C) owner);
  }

  /** Write a value onto an instance of the owning type. */
  @SuppressWarnings("unchecked")
  public void write(Object owner, Object value) {
    if (setter == null) throw new IllegalStateException("Attribute " + name + " is read-only");
    setter.accept((C) owner, value);
  }
}
