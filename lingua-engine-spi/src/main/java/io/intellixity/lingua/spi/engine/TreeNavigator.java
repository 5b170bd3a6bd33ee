package io.intellixity.lingua.spi.engine;

import io.intellixity.lingua.core.model.Container;
import io.intellixity.lingua.core.model.QualifiedName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.BiConsumer;
import java.util.function.Predicate;

/** Tree walking and qualified-name resolution below a traversal root (the root itself is never named). */
public final class TreeNavigator {
  private static final Logger log = LoggerFactory.getLogger(TreeNavigator.class);

  private TreeNavigator() {}

  /** Pre-order over descendants; a container failing {@code included} is skipped with its subtree. */
  public static void forEachDescendant(Container root,
                                       Predicate<Container> included,
                                       BiConsumer<String, Container> visitor) {
    if (root == null) return;
    walk(root, "", included, visitor);
  }

  private static void walk(Container parent, String parentName, Predicate<Container> included,
                           BiConsumer<String, Container> visitor) {
    for (Container child : parent.children()) {
      if (child == null || !included.test(child)) continue;
      String qn = QualifiedName.join(parentName, child.name());
      visitor.accept(qn, child);
      walk(child, qn, included, visitor);
    }
  }

  /**
   * Walk down segment by segment. When a segment is missing (renamed or removed ancestor) fall back to
   * a depth-first search of the whole tree for the last segment.\n
   *
   * The fallback binds to the first container carrying that leaf name, which may be the wrong one when
   * several containers share it.
   */
  public static Container resolve(Container root, String qualifiedName, Predicate<Container> included) {
    if (root == null) return null;
    String[] segments = QualifiedName.split(qualifiedName);
    if (segments.length == 0) return null;

    Container current = root;
    for (String s : segments) {
      Container next = current.findChild(s);
      if (next == null || !included.test(next)) {
        current = null;
        break;
      }
      current = next;
    }
    if (current != null) return current;

    String leaf = segments[segments.length - 1];
    Container found = findByName(root, leaf, included);
    if (log.isDebugEnabled()) {
      log.debug("lingua.engine op=resolveFallback qualifiedName={} leaf={} found={}",
          qualifiedName, leaf, found == null ? "null" : found.name());
    }
    return found;
  }

  private static Container findByName(Container parent, String name, Predicate<Container> included) {
    for (Container child : parent.children()) {
      if (child == null || !included.test(child)) continue;
      if (name.equalsIgnoreCase(child.name())) return child;
      Container deeper = findByName(child, name, included);
      if (deeper != null) return deeper;
    }
    return null;
  }
}
