package io.intellixity.lingua.testkit;

/** Static text. */
public final class Label extends Widget {
  private String caption = "";

  public Label(String name) {
    super(name);
  }

  public Label(String name, String caption) {
    super(name);
    this.caption = caption;
  }

  public String getCaption() { return caption; }
  public void setCaption(String caption) { this.caption = caption; }

  @Override
  void applyActionCaption(String caption) { this.caption = caption; }
}
