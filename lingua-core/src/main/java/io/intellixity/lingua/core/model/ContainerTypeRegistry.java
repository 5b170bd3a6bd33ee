package io.intellixity.lingua.core.model;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-type attribute metadata, declared explicitly at startup.\n
 *
 * Lookup order for an instance:\n
 * - exact class\n
 * - nearest registered superclass\n
 * - an empty type (nothing to translate), cached\n
 */
public final class ContainerTypeRegistry {
  private final Map<Class<?>, ContainerType<?>> declared = new ConcurrentHashMap<>();
  private final Map<Class<?>, ContainerType<?>> resolved = new ConcurrentHashMap<>();

  public ContainerTypeRegistry register(ContainerType<?> type) {
    Objects.requireNonNull(type, "type");
    declared.put(type.javaType(), type);
    resolved.clear();
    return this;
  }

  public boolean isDeclared(Class<?> javaType) {
    return declared.containsKey(javaType);
  }

  public ContainerType<?> typeOf(Object instance) {
    Objects.requireNonNull(instance, "instance");
    return typeOf(instance.getClass());
  }

  public ContainerType<?> typeOf(Class<?> javaType) {
    Objects.requireNonNull(javaType, "javaType");
    return resolved.computeIfAbsent(javaType, this::resolve);
  }

  private ContainerType<?> resolve(Class<?> javaType) {
    for (Class<?> c = javaType; c != null && c != Object.class; c = c.getSuperclass()) {
      ContainerType<?> t = declared.get(c);
      if (t != null) return t;
    }
    return ContainerType.empty(javaType);
  }
}
