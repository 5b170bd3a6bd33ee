package io.intellixity.lingua.format.ini;

import io.intellixity.lingua.core.encode.KeyEncoder;
import io.intellixity.lingua.core.format.PersistenceFormat;
import io.intellixity.lingua.core.info.LanguageInfoLoader;
import io.intellixity.lingua.core.model.Container;
import io.intellixity.lingua.core.model.QualifiedName;
import io.intellixity.lingua.spi.format.FormatContext;
import io.intellixity.lingua.spi.format.RuntimeStringSink;
import io.intellixity.lingua.spi.format.TranslationFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * {@code .clng} files: every attribute in section {@code [UIElements]} keyed by
 * {@code QualifiedName.Attribute}; loading splits the key at its last dot.
 */
public final class FlatIniFormat implements TranslationFormat {
  private static final Logger log = LoggerFactory.getLogger(FlatIniFormat.class);

  public static final String ELEMENTS_SECTION = "UIElements";

  private final IniLanguageInfoLoader infoLoader = new IniLanguageInfoLoader();

  @Override
  public PersistenceFormat format() {
    return PersistenceFormat.FLAT_INI;
  }

  @Override
  public void deserialize(FormatContext ctx, Container root, Path file, RuntimeStringSink strings) throws IOException {
    IniDocument doc = IniDocument.read(file, format().commentStart());
    int stringCount = IniEntries.readStrings(doc, strings);
    int applied = 0;
    IniDocument.Section elements = doc.section(ELEMENTS_SECTION);
    if (root != null && elements != null) {
      for (var e : elements.entries().entrySet()) {
        String key = KeyEncoder.denormalizeKey(e.getKey());
        int dot = key.lastIndexOf(QualifiedName.SEPARATOR);
        if (dot <= 0 || dot == key.length() - 1) continue;
        Container c = ctx.resolve(root, key.substring(0, dot));
        if (c == null) continue;
        if (ctx.apply(c, c, key.substring(dot + 1), KeyEncoder.restoreMultiline(e.getValue()))) applied++;
      }
    }
    if (log.isDebugEnabled()) {
      log.debug("lingua.ini op=deserialize layout=flat file={} entries={} applied={} strings={}",
          file, elements == null ? 0 : elements.entries().size(), applied, stringCount);
    }
  }

  @Override
  public void serialize(FormatContext ctx, Container root, Path file) throws IOException {
    IniDocument doc = IniEntries.open(file, format());
    IniDocument.Section elements = doc.section(ELEMENTS_SECTION, true);
    ctx.forEachContainer(root, (qualifiedName, c) ->
        IniEntries.textEntries(ctx, c, (key, value) ->
            elements.put(KeyEncoder.normalizeKey(qualifiedName) + QualifiedName.SEPARATOR + key, value)));
    doc.write(file);
  }

  @Override
  public LanguageInfoLoader infoLoader() {
    return infoLoader;
  }
}
