package io.intellixity.lingua.testkit;

import io.intellixity.lingua.core.model.AbstractContainer;

/** Invisible tree root that owns forms; declares no attributes. */
public final class Application extends AbstractContainer {
  public Application(String name) {
    super(name);
  }
}
