package io.intellixity.lingua.examples.screen;

/** Top-level demo window. */
public final class Screen extends ScreenElement {
  private String title = "";

  public Screen(String name, String title) {
    super(name);
    this.title = title;
  }

  public String getTitle() { return title; }
  public void setTitle(String title) { this.title = title; }
}
