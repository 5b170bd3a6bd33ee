package io.intellixity.lingua.format.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.intellixity.lingua.core.encode.KeyEncoder;
import io.intellixity.lingua.core.format.PersistenceFormat;
import io.intellixity.lingua.core.info.LanguageInfoLoader;
import io.intellixity.lingua.core.model.AttributeDescriptor;
import io.intellixity.lingua.core.model.AttributeKind;
import io.intellixity.lingua.core.model.Container;
import io.intellixity.lingua.spi.format.FormatContext;
import io.intellixity.lingua.spi.format.RuntimeStringSink;
import io.intellixity.lingua.spi.format.TranslationFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * {@code .json} files: one object level per container, root included.\n
 *
 * <pre>
 * {
 *   "App" : {
 *     "Form1" : {
 *       "Caption" : "Main window",
 *       "ListBox1" : { "Items" : "Red§Green§Blue" },
 *       "Button1" : { "Caption" : "OK", "Tooltip" : { "Title" : "Confirm" } }
 *     }
 *   },
 *   "Strings" : { "F1BE01B9" : "Va bene" }
 * }
 * </pre>
 *
 * Text lists are escaped and joined with {@link KeyEncoder#LIST_SEPARATOR}; nested values become objects
 * described by their own registered type. An existing {@code Strings} map survives a save. Unknown members
 * are ignored on load.
 */
public final class JsonTranslationFormat implements TranslationFormat {
  private static final Logger log = LoggerFactory.getLogger(JsonTranslationFormat.class);
  private static final ObjectMapper JSON = new ObjectMapper();

  /** Reserved top-level member holding runtime strings. */
  public static final String STRINGS = "Strings";
  static final int MAX_NESTING = 16;

  private final JsonLanguageInfoLoader infoLoader = new JsonLanguageInfoLoader();

  @Override
  public PersistenceFormat format() {
    return PersistenceFormat.JSON;
  }

  @Override
  public void deserialize(FormatContext ctx, Container root, Path file, RuntimeStringSink strings) throws IOException {
    JsonNode top = readObject(file);
    int stringCount = 0;
    JsonNode s = top.get(STRINGS);
    if (s != null && s.isObject()) {
      for (Iterator<Map.Entry<String, JsonNode>> it = s.fields(); it.hasNext(); ) {
        Map.Entry<String, JsonNode> e = it.next();
        if (!e.getValue().isValueNode() || e.getValue().isNull()) continue;
        strings.put(e.getKey().trim().toUpperCase(Locale.ROOT), e.getValue().asText());
        stringCount++;
      }
    }

    int applied = 0;
    if (root != null) {
      JsonNode rootNode = member(top, root.name());
      if (rootNode != null && rootNode.isObject() && ctx.isIncluded(root)) {
        applied = applyContainer(ctx, root, rootNode);
      }
    }
    if (log.isDebugEnabled()) {
      log.debug("lingua.json op=deserialize file={} applied={} strings={}", file, applied, stringCount);
    }
  }

  @Override
  public void serialize(FormatContext ctx, Container root, Path file) throws IOException {
    JsonNode existingStrings = null;
    if (Files.exists(file)) {
      existingStrings = readObject(file).get(STRINGS);
    }

    ObjectNode top = JSON.createObjectNode();
    top.set(root.name(), ctx.isIncluded(root) ? containerNode(ctx, root) : JSON.createObjectNode());
    top.set(STRINGS, existingStrings != null && existingStrings.isObject() ? existingStrings : JSON.createObjectNode());
    JSON.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), top);
  }

  @Override
  public LanguageInfoLoader infoLoader() {
    return infoLoader;
  }

  static String joinList(List<?> items) {
    if (items == null || items.isEmpty()) return "";
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < items.size(); i++) {
      if (i > 0) sb.append(KeyEncoder.LIST_SEPARATOR);
      Object item = items.get(i);
      sb.append(KeyEncoder.escape(item == null ? "" : item.toString()));
    }
    return sb.toString();
  }

  /** Split at bare separators; three-character bracket tokens such as {@code [§]} are kept whole. */
  static List<String> splitList(String joined) {
    List<String> out = new ArrayList<>();
    if (joined == null || joined.isEmpty()) return out;
    StringBuilder cur = new StringBuilder();
    for (int i = 0; i < joined.length(); i++) {
      char c = joined.charAt(i);
      if (c == '[' && i + 2 < joined.length() && joined.charAt(i + 2) == ']') {
        cur.append(joined, i, i + 3);
        i += 2;
      } else if (c == KeyEncoder.LIST_SEPARATOR) {
        out.add(KeyEncoder.unescape(cur.toString()));
        cur.setLength(0);
      } else {
        cur.append(c);
      }
    }
    out.add(KeyEncoder.unescape(cur.toString()));
    return out;
  }

  private static JsonNode readObject(Path file) throws IOException {
    JsonNode top = JSON.readTree(file.toFile());
    if (top == null || !top.isObject()) {
      throw new IOException("Translation file " + file + " does not hold a JSON object");
    }
    return top;
  }

  /** Exact member first, then a case-insensitive match. */
  private static JsonNode member(JsonNode node, String name) {
    JsonNode exact = node.get(name);
    if (exact != null) return exact;
    for (Iterator<String> it = node.fieldNames(); it.hasNext(); ) {
      String n = it.next();
      if (n.equalsIgnoreCase(name) && !n.equals(STRINGS)) return node.get(n);
    }
    return null;
  }

  private static ObjectNode containerNode(FormatContext ctx, Container c) {
    ObjectNode n = valueNode(ctx, c, 0);
    for (Container child : c.children()) {
      if (child == null || !ctx.isIncluded(child)) continue;
      n.set(child.name(), containerNode(ctx, child));
    }
    return n;
  }

  private static ObjectNode valueNode(FormatContext ctx, Object value, int depth) {
    ObjectNode n = JSON.createObjectNode();
    for (AttributeDescriptor<?> a : ctx.persistableAttributes(value)) {
      Object v = a.read(value);
      switch (a.kind()) {
        case TEXT -> n.put(a.name(), v == null ? "" : v.toString());
        case TEXT_LIST -> n.put(a.name(), joinList(v instanceof List<?> l ? l : List.of()));
        case NESTED -> {
          if (v != null && depth < MAX_NESTING) n.set(a.name(), valueNode(ctx, v, depth + 1));
        }
      }
    }
    return n;
  }

  private static int applyContainer(FormatContext ctx, Container c, JsonNode node) {
    int applied = 0;
    for (Iterator<Map.Entry<String, JsonNode>> it = node.fields(); it.hasNext(); ) {
      Map.Entry<String, JsonNode> e = it.next();
      JsonNode v = e.getValue();
      if (v.isObject()) {
        Container child = c.findChild(e.getKey());
        if (child != null) {
          if (ctx.isIncluded(child)) applied += applyContainer(ctx, child, v);
          continue;
        }
      }
      applied += applyMember(ctx, c, c, e.getKey(), v, 0);
    }
    return applied;
  }

  private static int applyMember(FormatContext ctx, Container owner, Object target, String name, JsonNode v, int depth) {
    AttributeDescriptor<?> a = ctx.typeOf(target).attribute(name);
    if (a == null) return 0;
    if (a.kind() == AttributeKind.NESTED) {
      if (!v.isObject() || depth >= MAX_NESTING || !ctx.isApplicable(owner, a)) return 0;
      Object nested = a.read(target);
      if (nested == null) return 0;
      int applied = 0;
      for (Iterator<Map.Entry<String, JsonNode>> it = v.fields(); it.hasNext(); ) {
        Map.Entry<String, JsonNode> e = it.next();
        applied += applyMember(ctx, owner, nested, e.getKey(), e.getValue(), depth + 1);
      }
      return applied;
    }
    if (!v.isValueNode() || v.isNull()) return 0;
    Object value = a.kind() == AttributeKind.TEXT_LIST ? splitList(v.asText()) : v.asText();
    return ctx.apply(owner, target, a.name(), value) ? 1 : 0;
  }
}
