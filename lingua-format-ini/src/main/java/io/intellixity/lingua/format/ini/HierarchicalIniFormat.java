package io.intellixity.lingua.format.ini;

import io.intellixity.lingua.core.format.PersistenceFormat;
import io.intellixity.lingua.core.info.LanguageInfoLoader;
import io.intellixity.lingua.core.model.Container;
import io.intellixity.lingua.spi.format.FormatContext;
import io.intellixity.lingua.spi.format.RuntimeStringSink;
import io.intellixity.lingua.spi.format.TranslationFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * {@code .lng} files: one section per container, named by its qualified name.\n
 *
 * <pre>
 * [Form1.Button1]
 * Caption=OK
 * Hint=Confirm
 *
 * [strings]
 * F1BE01B9=Va bene
 * </pre>
 *
 * Nested values and text lists are not written.
 */
public final class HierarchicalIniFormat implements TranslationFormat {
  private static final Logger log = LoggerFactory.getLogger(HierarchicalIniFormat.class);

  private final IniLanguageInfoLoader infoLoader = new IniLanguageInfoLoader();

  @Override
  public PersistenceFormat format() {
    return PersistenceFormat.INI;
  }

  @Override
  public void deserialize(FormatContext ctx, Container root, Path file, RuntimeStringSink strings) throws IOException {
    IniDocument doc = IniDocument.read(file, format().commentStart());
    int stringCount = IniEntries.readStrings(doc, strings);
    int applied = 0;
    if (root != null) {
      for (IniDocument.Section s : doc.sections()) {
        if (s.name().equalsIgnoreCase(IniEntries.STRINGS_SECTION)
            || s.name().equalsIgnoreCase(IniLanguageInfoLoader.SECTION)) continue;
        Container c = ctx.resolve(root, s.name());
        if (c == null) continue;
        for (var e : s.entries().entrySet()) {
          if (IniEntries.apply(ctx, c, e.getKey(), e.getValue())) applied++;
        }
      }
    }
    if (log.isDebugEnabled()) {
      log.debug("lingua.ini op=deserialize file={} sections={} applied={} strings={}",
          file, doc.sections().size(), applied, stringCount);
    }
  }

  @Override
  public void serialize(FormatContext ctx, Container root, Path file) throws IOException {
    IniDocument doc = IniEntries.open(file, format());
    ctx.forEachContainer(root, (qualifiedName, c) ->
        IniEntries.textEntries(ctx, c, (key, value) -> doc.section(qualifiedName, true).put(key, value)));
    doc.write(file);
  }

  @Override
  public LanguageInfoLoader infoLoader() {
    return infoLoader;
  }
}
