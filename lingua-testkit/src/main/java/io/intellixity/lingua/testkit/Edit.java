package io.intellixity.lingua.testkit;

/** Single-line input; its {@code Text} attribute is action-managed. */
public final class Edit extends Widget {
  private String text = "";

  public Edit(String name) {
    super(name);
  }

  public Edit(String name, String text) {
    super(name);
    this.text = text;
  }

  public String getText() { return text; }
  public void setText(String text) { this.text = text; }

  @Override
  void applyActionCaption(String caption) { this.text = caption; }
}
