package io.intellixity.lingua.testkit;

/** Push button; {@code tag} is internal state and {@code tooltip} a nested value. */
public final class Button extends Widget {
  private String caption = "";
  private String helpKeyword = "";
  private String tag = "";
  private final Tooltip tooltip = new Tooltip();

  public Button(String name) {
    super(name);
  }

  public Button(String name, String caption) {
    super(name);
    this.caption = caption;
  }

  public String getCaption() { return caption; }
  public void setCaption(String caption) { this.caption = caption; }

  public String getHelpKeyword() { return helpKeyword; }
  public void setHelpKeyword(String helpKeyword) { this.helpKeyword = helpKeyword; }

  public String getTag() { return tag; }
  public void setTag(String tag) { this.tag = tag; }

  public Tooltip getTooltip() { return tooltip; }

  @Override
  void applyActionCaption(String caption) { this.caption = caption; }
}
