package io.intellixity.lingua.examples.service;

import io.intellixity.lingua.coordination.LanguageCoordinator;
import io.intellixity.lingua.coordination.LanguageServer;
import io.intellixity.lingua.core.encode.KeyEncoder;
import io.intellixity.lingua.core.error.LanguageConfigurationException;
import io.intellixity.lingua.core.model.AttributeDescriptor;
import io.intellixity.lingua.core.model.AttributeKind;
import io.intellixity.lingua.core.model.Container;
import io.intellixity.lingua.core.model.ContainerTypeRegistry;
import io.intellixity.lingua.core.model.QualifiedName;
import io.intellixity.lingua.examples.config.LinguaProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

@Service
public final class TranslationService {
  private static final Logger log = LoggerFactory.getLogger(TranslationService.class);

  private final LanguageServer server;
  private final LanguageCoordinator coordinator;
  private final ContainerTypeRegistry types;
  private final LinguaProperties props;

  public TranslationService(LanguageServer server,
                            LanguageCoordinator coordinator,
                            ContainerTypeRegistry types,
                            LinguaProperties props) {
    this.server = server;
    this.coordinator = coordinator;
    this.types = types;
    this.props = props;
  }

  /** Key under which {@code text} is stored in the runtime strings section. */
  public String keyFor(String text) {
    return KeyEncoder.hash(text == null ? "" : text);
  }

  public String translate(String text) {
    return coordinator.translate(text);
  }

  public String language() {
    return server.language();
  }

  /** Switches every registered screen; the server reloads them all before returning. */
  public void switchLanguage(String language) throws IOException {
    if (language == null || language.isBlank()) throw new LanguageConfigurationException("Language id is blank");
    String id = language.trim();
    Path root = server.rootPath().normalize();
    Path folder = root.resolve(id).normalize();
    if (!root.equals(folder.getParent()) || !id.equals(folder.getFileName().toString())) {
      throw new LanguageConfigurationException("Language id must name a folder directly under " + root + ": " + language);
    }
    if (!Files.isDirectory(folder)) {
      if (!props.isCreateIfMissing()) throw new LanguageConfigurationException("Unknown language: " + language);
      Files.createDirectories(folder);
    }
    log.info("lingua.examples op=switchLanguage from={} to={}", server.language(), id);
    server.setLanguage(id);
  }

  /** Current screen texts keyed by {@code qualifiedName|Attribute}; the root is keyed by its own name. */
  public Map<String, Object> screenTexts() {
    Map<String, Object> out = new LinkedHashMap<>();
    Container root = coordinator.container();
    collect(root, root.name(), out);
    for (Container child : root.children()) walk(child, child.name(), out);
    return out;
  }

  public Path saveScreen() throws IOException {
    coordinator.save();
    log.info("lingua.examples op=saveScreen file={}", coordinator.file());
    return coordinator.file();
  }

  private void walk(Container c, String qn, Map<String, Object> out) {
    collect(c, qn, out);
    for (Container child : c.children()) walk(child, QualifiedName.join(qn, child.name()), out);
  }

  private void collect(Container c, String qn, Map<String, Object> out) {
    for (AttributeDescriptor<?> a : types.typeOf(c).attributes()) {
      if (!a.published() || !a.readable() || a.kind() == AttributeKind.NESTED) continue;
      out.put(qn + "|" + a.name(), a.read(c));
    }
  }
}
