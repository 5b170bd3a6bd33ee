package io.intellixity.lingua.testkit;

/** Nested structured value owned by a {@link Button}; not a container. */
public final class Tooltip {
  private String title = "";
  private String body = "";

  public String getTitle() { return title; }
  public void setTitle(String title) { this.title = title; }

  public String getBody() { return body; }
  public void setBody(String body) { this.body = body; }
}
