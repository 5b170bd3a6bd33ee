package io.intellixity.lingua.testkit;

/** Action delegate: the authoritative source of caption and hint for the widgets bound to it. */
public final class Action {
  private final String caption;
  private final String hint;

  public Action(String caption, String hint) {
    this.caption = caption;
    this.hint = hint;
  }

  public String caption() { return caption; }
  public String hint() { return hint; }

  void applyTo(Widget w) {
    w.setHint(hint);
    w.applyActionCaption(caption);
  }
}
