package io.intellixity.lingua.spi.engine;

import io.intellixity.lingua.core.model.ContainerTypeRegistry;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable engine configuration. Name sets compare case-insensitively.\n
 *
 * @param excludedTypes container type names skipped with their subtree\n
 * @param excludedAttributes attribute names never saved nor applied\n
 * @param excludeOnAction when set, action-managed attributes of action-bound containers are not applied on load\n
 * @param createIfMissing load materializes a missing file; save creates missing parent directories\n
 * @param actionAttributes attribute names an action delegate drives\n
 * @param types per-type attribute metadata\n
 */
public record EngineSettings(Set<String> excludedTypes,
                             Set<String> excludedAttributes,
                             boolean excludeOnAction,
                             boolean createIfMissing,
                             Set<String> actionAttributes,
                             ContainerTypeRegistry types) {
  public static final List<String> DEFAULT_ACTION_ATTRIBUTES = List.of("Caption", "Hint", "Text");

  public EngineSettings {
    excludedTypes = names(excludedTypes);
    excludedAttributes = names(excludedAttributes);
    actionAttributes = names(actionAttributes);
    Objects.requireNonNull(types, "types");
  }

  /** No exclusions, action exclusion on, auto-create off. */
  public static EngineSettings defaults(ContainerTypeRegistry types) {
    return new EngineSettings(Set.of(), Set.of(), true, false, Set.copyOf(DEFAULT_ACTION_ATTRIBUTES), types);
  }

  public EngineSettings withExcludedTypes(Collection<String> names) {
    return new EngineSettings(names(names), excludedAttributes, excludeOnAction, createIfMissing, actionAttributes, types);
  }

  public EngineSettings withExcludedAttributes(Collection<String> names) {
    return new EngineSettings(excludedTypes, names(names), excludeOnAction, createIfMissing, actionAttributes, types);
  }

  public EngineSettings withExcludeOnAction(boolean v) {
    return new EngineSettings(excludedTypes, excludedAttributes, v, createIfMissing, actionAttributes, types);
  }

  public EngineSettings withCreateIfMissing(boolean v) {
    return new EngineSettings(excludedTypes, excludedAttributes, excludeOnAction, v, actionAttributes, types);
  }

  public EngineSettings withActionAttributes(Collection<String> names) {
    return new EngineSettings(excludedTypes, excludedAttributes, excludeOnAction, createIfMissing, names(names), types);
  }

  public EngineSettings withTypes(ContainerTypeRegistry types) {
    return new EngineSettings(excludedTypes, excludedAttributes, excludeOnAction, createIfMissing, actionAttributes, types);
  }

  private static Set<String> names(Collection<String> in) {
    TreeSet<String> s = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
    if (in != null) {
      for (String n : in) {
        if (n != null && !n.isBlank()) s.add(n.trim());
      }
    }
    return Collections.unmodifiableSet(s);
  }
}
