package io.intellixity.lingua.testkit;

import io.intellixity.lingua.core.model.AbstractContainer;

/** Base for the fixture widgets: every widget carries a hint and may be bound to an {@link Action}. */
public abstract class Widget extends AbstractContainer {
  private String hint = "";
  private Action action;

  protected Widget(String name) {
    super(name);
  }

  public String getHint() { return hint; }
  public void setHint(String hint) { this.hint = hint; }

  public Action getAction() { return action; }

  /** Bind an action; like a UI toolkit, the action pushes its caption and hint onto the widget. */
  public void setAction(Action action) {
    this.action = action;
    if (action != null) action.applyTo(this);
  }

  @Override
  public boolean hasAction() {
    return action != null;
  }

  void applyActionCaption(String caption) {}
}
