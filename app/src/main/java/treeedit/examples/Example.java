package treeedit.examples;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;
import treeedit.model.Edge;
import treeedit.model.TreeBuilders;
import treeedit.model.TreePair;

/** Built-in tree pairs, each returned as fresh tree instances. */
public final class Example {
  private static final Map<String, Supplier<TreePair>> EXAMPLES = buildExamples();

  private Example() {}

  /** Single node {@code a} on both sides. */
  public static TreePair singleNode() {
    return new TreePair(
        TreeBuilders.fromParentIndices(List.of("a"), List.of(-1)),
        TreeBuilders.fromParentIndices(List.of("a"), List.of(-1)));
  }

  /** {@code a(b)} mapped into a lone {@code a}. */
  public static TreePair droppedChild() {
    return new TreePair(
        TreeBuilders.fromParentIndices(List.of("a", "b"), List.of(-1, 0)),
        TreeBuilders.fromParentIndices(List.of("a"), List.of(-1)));
  }

  /** Identical chains {@code a -> b -> c}. */
  public static TreePair chain() {
    return new TreePair(
        TreeBuilders.fromParentIndices(List.of("a", "b", "c"), List.of(-1, 0, 1)),
        TreeBuilders.fromParentIndices(List.of("a", "b", "c"), List.of(-1, 0, 1)));
  }

  /** {@code r(x, y)} mapped into {@code r(y, x)}. */
  public static TreePair swappedSiblings() {
    return new TreePair(
        TreeBuilders.fromParentIndices(List.of("r", "x", "y"), List.of(-1, 0, 0)),
        TreeBuilders.fromParentIndices(List.of("r", "y", "x"), List.of(-1, 0, 0)));
  }

  /** A relabeled and reshaped pair given as edge lists. */
  public static TreePair relabeled() {
    return new TreePair(
        TreeBuilders.fromEdges(
            List.of(edge("A", "B"), edge("A", "C"), edge("B", "D"), edge("C", "E")), List.of()),
        TreeBuilders.fromEdges(
            List.of(
                edge("A", "B"), edge("A", "F"), edge("B", "D"), edge("F", "E"), edge("F", "G")),
            List.of()));
  }

  public static List<String> names() {
    return List.copyOf(EXAMPLES.keySet());
  }

  public static TreePair byName(String name) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Unknown example: " + name);
    }
    Supplier<TreePair> supplier = EXAMPLES.get(name.trim().toLowerCase(Locale.ROOT));
    if (supplier == null) {
      throw new IllegalArgumentException("Unknown example: " + name + " (known: " + names() + ")");
    }
    return supplier.get();
  }

  private static Edge edge(String parent, String child) {
    return new Edge(parent, child, 0);
  }

  private static Map<String, Supplier<TreePair>> buildExamples() {
    Map<String, Supplier<TreePair>> examples = new LinkedHashMap<>();
    examples.put("single", Example::singleNode);
    examples.put("dropped-child", Example::droppedChild);
    examples.put("chain", Example::chain);
    examples.put("swapped-siblings", Example::swappedSiblings);
    examples.put("relabeled", Example::relabeled);
    return Collections.unmodifiableMap(examples);
  }
}
