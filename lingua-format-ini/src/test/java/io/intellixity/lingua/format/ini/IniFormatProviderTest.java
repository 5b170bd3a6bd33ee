package io.intellixity.lingua.format.ini;

import io.intellixity.lingua.core.format.PersistenceFormat;
import io.intellixity.lingua.spi.engine.EngineRegistry;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class IniFormatProviderTest {
  @Test
  void factoriesFileRegistersBothIniLayouts() {
    EngineRegistry r = EngineRegistry.discover();
    assertEquals(HierarchicalIniFormat.class, r.formatClass(PersistenceFormat.INI));
    assertEquals(FlatIniFormat.class, r.formatClass(PersistenceFormat.FLAT_INI));
    assertFalse(r.isRegistered(PersistenceFormat.JSON));
  }
}
