package io.intellixity.lingua.testkit;

/** Top-level window. */
public final class Form extends Widget {
  private String caption = "";

  public Form(String name) {
    super(name);
  }

  public Form(String name, String caption) {
    super(name);
    this.caption = caption;
  }

  public String getCaption() { return caption; }
  public void setCaption(String caption) { this.caption = caption; }

  @Override
  void applyActionCaption(String caption) { this.caption = caption; }
}
