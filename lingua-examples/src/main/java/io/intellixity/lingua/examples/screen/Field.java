package io.intellixity.lingua.examples.screen;

import java.util.ArrayList;
import java.util.List;

/** Input with a label, a placeholder and optional choices. */
public final class Field extends ScreenElement {
  private String label = "";
  private String placeholder = "";
  private List<String> choices = new ArrayList<>();

  public Field(String name, String label, String placeholder) {
    super(name);
    this.label = label;
    this.placeholder = placeholder;
  }

  public String getLabel() { return label; }
  public void setLabel(String label) { this.label = label; }
  public String getPlaceholder() { return placeholder; }
  public void setPlaceholder(String placeholder) { this.placeholder = placeholder; }
  public List<String> getChoices() { return List.copyOf(choices); }
  public void setChoices(List<String> choices) { this.choices = new ArrayList<>(choices); }
}
