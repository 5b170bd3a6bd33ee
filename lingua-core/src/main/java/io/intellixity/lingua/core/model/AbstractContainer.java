package io.intellixity.lingua.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** Convenience base: a name plus an ordered list of children. */
public abstract class AbstractContainer implements Container {
  private final String name;
  private final List<Container> children = new ArrayList<>();

  protected AbstractContainer(String name) {
    this.name = Objects.requireNonNull(name, "name");
  }

  @Override
  public final String name() {
    return name;
  }

  @Override
  public final List<Container> children() {
    return Collections.unmodifiableList(children);
  }

  /** Append a child and return it. */
  public <T extends Container> T add(T child) {
    Objects.requireNonNull(child, "child");
    if (findChild(child.name()) != null) {
      throw new IllegalArgumentException("Duplicate child name '" + child.name() + "' under '" + name + "'");
    }
    children.add(child);
    return child;
  }

  public boolean remove(Container child) {
    return children.remove(child);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + name + "]";
  }
}
