package io.intellixity.lingua.coordination;

import io.intellixity.lingua.core.format.PersistenceFormat;
import io.intellixity.lingua.core.info.LanguageInfoLoader;
import io.intellixity.lingua.core.model.Container;
import io.intellixity.lingua.format.ini.HierarchicalIniFormat;
import io.intellixity.lingua.spi.format.FormatContext;
import io.intellixity.lingua.spi.format.RuntimeStringSink;
import io.intellixity.lingua.spi.format.TranslationFormat;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;

/** Passes the registry probe, then refuses to be instantiated again. */
public final class FlakyFormat implements TranslationFormat {
  static final AtomicInteger INSTANCES = new AtomicInteger();

  private final HierarchicalIniFormat delegate = new HierarchicalIniFormat();

  public FlakyFormat() {
    if (INSTANCES.incrementAndGet() > 1) throw new IllegalStateException("engine resources exhausted");
  }

  @Override
  public PersistenceFormat format() {
    return PersistenceFormat.INI;
  }

  @Override
  public void deserialize(FormatContext ctx, Container root, Path file, RuntimeStringSink strings) throws IOException {
    delegate.deserialize(ctx, root, file, strings);
  }

  @Override
  public void serialize(FormatContext ctx, Container root, Path file) throws IOException {
    delegate.serialize(ctx, root, file);
  }

  @Override
  public LanguageInfoLoader infoLoader() {
    return delegate.infoLoader();
  }
}
