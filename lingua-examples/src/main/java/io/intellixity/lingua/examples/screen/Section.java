package io.intellixity.lingua.examples.screen;

/** Titled group of fields. */
public final class Section extends ScreenElement {
  private String heading = "";

  public Section(String name, String heading) {
    super(name);
    this.heading = heading;
  }

  public String getHeading() { return heading; }
  public void setHeading(String heading) { this.heading = heading; }
}
