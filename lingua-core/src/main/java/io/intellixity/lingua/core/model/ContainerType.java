package io.intellixity.lingua.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Attribute metadata for one Java type (a {@link Container} or a nested value).\n
 *
 * The logical {@link #name()} is what type exclusion lists match against.
 */
public final class ContainerType<C> {
  private final Class<C> javaType;
  private final String name;
  private final List<AttributeDescriptor<C>> attributes;
  private final Map<String, AttributeDescriptor<C>> byName;

  private ContainerType(Class<C> javaType, String name, List<AttributeDescriptor<C>> attributes) {
    this.javaType = javaType;
    this.name = name;
    this.attributes = List.copyOf(attributes);
    Map<String, AttributeDescriptor<C>> m = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    for (AttributeDescriptor<C> a : this.attributes) {
      if (m.putIfAbsent(a.name(), a) != null) {
        throw new IllegalArgumentException("Duplicate attribute '" + a.name() + "' on " + name);
      }
    }
    this.byName = Collections.unmodifiableMap(m);
  }

  public Class<C> javaType() { return javaType; }
  public String name() { return name; }
  public List<AttributeDescriptor<C>> attributes() { return attributes; }

  /** Attribute by name (case-insensitive), or null. */
  public AttributeDescriptor<C> attribute(String attributeName) {
    return attributeName == null ? null : byName.get(attributeName);
  }

  /** A type that declares nothing. */
  public static <C> ContainerType<C> empty(Class<C> javaType) {
    return new ContainerType<>(javaType, javaType.getSimpleName(), List.of());
  }

  public static <C> Builder<C> builder(Class<C> javaType) {
    return new Builder<>(javaType);
  }

  @Override
  public String toString() {
    return "ContainerType[" + name + ", attributes=" + attributes.size() + "]";
  }

  public static final class Builder<C> {
    private final Class<C> javaType;
    private String name;
    private final List<AttributeDescriptor<C>> attributes = new ArrayList<>();

    private Builder(Class<C> javaType) {
      this.javaType = Objects.requireNonNull(javaType, "javaType");
      this.name = javaType.getSimpleName();
    }

    /** Override the logical type name (defaults to the simple class name). */
    public Builder<C> named(String name) {
      if (name == null || name.isBlank()) throw new IllegalArgumentException("name is blank");
      this.name = name;
      return this;
    }

    public Builder<C> text(String name, Function<? super C, String> getter, BiConsumer<? super C, String> setter) {
      Objects.requireNonNull(setter, "setter");
      return attribute(new AttributeDescriptor<C>(name, AttributeKind.TEXT, true, getter,
          (c, v) -> setter.accept(c, v == null ? null : v.toString())));
    }

    public Builder<C> readOnlyText(String name, Function<? super C, String> getter) {
      return attribute(new AttributeDescriptor<C>(name, AttributeKind.TEXT, true, getter, null));
    }

    /** A text attribute that is not published: persisted nowhere. */
    public Builder<C> internalText(String name, Function<? super C, String> getter, BiConsumer<? super C, String> setter) {
      Objects.requireNonNull(setter, "setter");
      return attribute(new AttributeDescriptor<C>(name, AttributeKind.TEXT, false, getter,
          (c, v) -> setter.accept(c, v == null ? null : v.toString())));
    }

    @SuppressWarnings("unchecked")
    public Builder<C> textList(String name,
                               Function<? super C, List<String>> getter,
                               BiConsumer<? super C, List<String>> setter) {
      Objects.requireNonNull(setter, "setter");
      return attribute(new AttributeDescriptor<C>(name, AttributeKind.TEXT_LIST, true, getter,
          (c, v) -> setter.accept(c, v == null ? List.of() : (List<String>) v)));
    }

    /** A structured value mutated in place; its own type must be registered to carry attributes. */
    public Builder<C> nested(String name, Function<? super C, ?> getter) {
      return attribute(new AttributeDescriptor<C>(name, AttributeKind.NESTED, true, getter, null));
    }

    public Builder<C> attribute(AttributeDescriptor<C> descriptor) {
      attributes.add(Objects.requireNonNull(descriptor, "descriptor"));
      return this;
    }

    public ContainerType<C> build() {
      return new ContainerType<>(javaType, name, attributes);
    }
  }
}
