package io.intellixity.lingua.format.json;

import io.intellixity.lingua.core.format.PersistenceFormat;
import io.intellixity.lingua.spi.engine.EngineRegistry;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class JsonFormatProviderTest {
  @Test
  void factoriesFileRegistersJson() {
    EngineRegistry r = EngineRegistry.discover();
    assertEquals(Set.of(PersistenceFormat.JSON), r.formats());
    assertEquals(JsonTranslationFormat.class, r.formatClass(PersistenceFormat.JSON));
  }
}
