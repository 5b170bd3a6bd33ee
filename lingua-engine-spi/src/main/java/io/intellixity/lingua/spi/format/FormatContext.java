package io.intellixity.lingua.spi.format;

import io.intellixity.lingua.core.model.AttributeDescriptor;
import io.intellixity.lingua.core.model.Container;
import io.intellixity.lingua.core.model.ContainerType;

import java.util.List;
import java.util.function.BiConsumer;

/**
 * What a {@link TranslationFormat} may ask of the engine for one load or save.\n
 *
 * Settings are captured when the operation starts; a context is never reused across operations.
 */
public interface FormatContext {
  /** Registered metadata for a container or nested value (empty type when undeclared). */
  ContainerType<?> typeOf(Object value);

  /** False when the container's type is excluded; its subtree is then skipped too. */
  boolean isIncluded(Container container);

  /**
   * Attributes of {@code value} a save writes: structurally eligible and not excluded by name.\n
   * Includes action-managed attributes (they are saved but not applied on load).
   */
  List<AttributeDescriptor<?>> persistableAttributes(Object value);

  /** Full load-time test, including the action rule evaluated against {@code owner}. */
  boolean isApplicable(Container owner, AttributeDescriptor<?> attribute);

  /**
   * Write {@code value} onto {@code target} when the attribute exists and is applicable.\n
   *
   * @param owner container whose action state governs the decision; {@code target} itself or the
   *              container owning a nested value
   * @param value {@code String} for text attributes, {@code List<String>} for text lists
   * @return true when the value was written
   */
  boolean apply(Container owner, Object target, String attributeName, Object value);

  /**
   * Visit every included descendant of {@code root} (root excluded) in pre-order with its qualified name.
   */
  void forEachContainer(Container root, BiConsumer<String, Container> visitor);

  /** Container for a qualified name below {@code root}, or null. */
  Container resolve(Container root, String qualifiedName);
}
