package io.intellixity.lingua.examples.screen;

/** Button; when {@code shared} it is driven by an application-wide command and its caption is not reloaded. */
public final class Command extends ScreenElement {
  private String caption = "";
  private final boolean shared;

  public Command(String name, String caption, boolean shared) {
    super(name);
    this.caption = caption;
    this.shared = shared;
  }

  public String getCaption() { return caption; }
  public void setCaption(String caption) { this.caption = caption; }

  @Override
  public boolean hasAction() {
    return shared;
  }
}
