package io.intellixity.lingua.core.model;

import java.util.List;

/**
 * A node of a translatable object tree.\n
 *
 * Names are unique among siblings. The tree root is owned by the caller; children must stay stable
 * for the duration of a load or save. Attributes are not exposed here: they are declared per type in a
 * {@link ContainerTypeRegistry}.
 */
public interface Container {
  String name();

  List<? extends Container> children();

  /** True when an action delegate drives this container's Caption/Hint/Text-like attributes. */
  default boolean hasAction() {
    return false;
  }

  /** Direct child with the given name (case-insensitive), or null. */
  default Container findChild(String name) {
    if (name == null || name.isEmpty()) return null;
    for (Container c : children()) {
      if (c != null && name.equalsIgnoreCase(c.name())) return c;
    }
    return null;
  }
}
