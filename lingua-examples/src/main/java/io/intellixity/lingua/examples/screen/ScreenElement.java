package io.intellixity.lingua.examples.screen;

import io.intellixity.lingua.core.model.AbstractContainer;

/** Base of the demo screen nodes; every element carries a tooltip. */
public abstract class ScreenElement extends AbstractContainer {
  private String tooltip = "";

  protected ScreenElement(String name) {
    super(name);
  }

  public String getTooltip() { return tooltip; }
  public void setTooltip(String tooltip) { this.tooltip = tooltip; }
}
