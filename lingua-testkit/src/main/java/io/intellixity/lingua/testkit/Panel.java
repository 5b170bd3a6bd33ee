package io.intellixity.lingua.testkit;

/** Grouping widget. */
public final class Panel extends Widget {
  private String caption = "";

  public Panel(String name) {
    super(name);
  }

  public Panel(String name, String caption) {
    super(name);
    this.caption = caption;
  }

  public String getCaption() { return caption; }
  public void setCaption(String caption) { this.caption = caption; }

  @Override
  void applyActionCaption(String caption) { this.caption = caption; }
}
