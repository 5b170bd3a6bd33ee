package io.intellixity.lingua.spi.engine;

import io.intellixity.lingua.core.model.AttributeDescriptor;
import io.intellixity.lingua.core.model.AttributeKind;
import io.intellixity.lingua.core.model.Container;
import io.intellixity.lingua.core.model.ContainerType;

import java.util.Objects;

/**
 * Two-level attribute eligibility.\n
 *
 * 1) structural: static, looks at the descriptor only\n
 * 2) contextual: exclusion list plus the action rule, looks at the owning container\n
 *
 * Save persists {@link #isPersistable}; load applies {@link #isApplicable}. The first is a superset of
 * the second, so action-driven values are written but never re-applied.
 */
public final class EligibilityRules {
  /** Identity attribute; never translated. */
  public static final String NAME_ATTRIBUTE = "Name";

  private final EngineSettings settings;

  public EligibilityRules(EngineSettings settings) {
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  /**
   * Published, not the identity attribute, readable and (except for nested values, mutated in place)
   * writable.
   */
  public static boolean isStructural(AttributeDescriptor<?> a) {
    if (a == null || !a.published()) return false;
    if (NAME_ATTRIBUTE.equalsIgnoreCase(a.name())) return false;
    if (!a.readable()) return false;
    return a.kind() == AttributeKind.NESTED || a.writable();
  }

  public boolean isPersistable(AttributeDescriptor<?> a) {
    return isStructural(a) && !settings.excludedAttributes().contains(a.name());
  }

  public boolean isApplicable(Container owner, AttributeDescriptor<?> a) {
    if (!isPersistable(a)) return false;
    return !(settings.excludeOnAction()
        && owner != null
        && owner.hasAction()
        && settings.actionAttributes().contains(a.name()));
  }

  public boolean isIncluded(ContainerType<?> type) {
    return type != null && !settings.excludedTypes().contains(type.name());
  }
}
