package io.intellixity.lingua.examples.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "lingua")
public class LinguaProperties {
  /** Folder holding one sub-folder per language. */
  private String rootPath = "languages";
  private String language = "en";
  /** Format id: ini, ini-flat or json. */
  private String format = "ini";
  private boolean createIfMissing = true;
  private boolean excludeOnAction = true;
  private List<String> excludedTypes = new ArrayList<>();
  private List<String> excludedAttributes = new ArrayList<>();

  public String getRootPath() { return rootPath; }
  public void setRootPath(String rootPath) { this.rootPath = rootPath; }
  public String getLanguage() { return language; }
  public void setLanguage(String language) { this.language = language; }
  public String getFormat() { return format; }
  public void setFormat(String format) { this.format = format; }
  public boolean isCreateIfMissing() { return createIfMissing; }
  public void setCreateIfMissing(boolean createIfMissing) { this.createIfMissing = createIfMissing; }
  public boolean isExcludeOnAction() { return excludeOnAction; }
  public void setExcludeOnAction(boolean excludeOnAction) { this.excludeOnAction = excludeOnAction; }
  public List<String> getExcludedTypes() { return excludedTypes; }
  public void setExcludedTypes(List<String> excludedTypes) { this.excludedTypes = excludedTypes; }
  public List<String> getExcludedAttributes() { return excludedAttributes; }
  public void setExcludedAttributes(List<String> excludedAttributes) { this.excludedAttributes = excludedAttributes; }
}
