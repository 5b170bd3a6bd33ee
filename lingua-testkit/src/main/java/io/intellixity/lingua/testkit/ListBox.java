package io.intellixity.lingua.testkit;

import java.util.ArrayList;
import java.util.List;

/** List of text items. */
public final class ListBox extends Widget {
  private List<String> items = new ArrayList<>();

  public ListBox(String name, String... items) {
    super(name);
    this.items = new ArrayList<>(List.of(items));
  }

  public List<String> getItems() { return List.copyOf(items); }
  public void setItems(List<String> items) { this.items = new ArrayList<>(items); }
}
