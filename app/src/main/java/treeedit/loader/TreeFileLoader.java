package treeedit.loader;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import treeedit.model.Edge;
import treeedit.model.LabeledTree;
import treeedit.model.TreeBuilders;
import treeedit.model.TreePair;

/**
 * Reads a source/target tree pair from a text file.
 *
 * <p>Two layouts are accepted. In the parent-index layout each tree starts with its node count,
 * followed by one {@code label parentIndex} line per node ({@code -1} marks the root). In the
 * edge-list layout each line is {@code parentLabel childLabel} (or a lone label), and the trees are
 * separated by a {@code # Tree 2} comment or, when the file has no such comment, by the first blank
 * line. Other lines starting with {@code #} are comments. The layout is picked from the first
 * content line: a single integer means parent-index.
 */
public final class TreeFileLoader {
  private static final Splitter TOKENS =
      Splitter.on(CharMatcher.whitespace()).trimResults().omitEmptyStrings();
  private static final String SECOND_TREE_MARKER = "tree 2";

  public enum Format {
    PARENT_INDEX,
    EDGE_LIST
  }

  public TreePair load(Path path) throws IOException {
    if (!Files.exists(path)) {
      throw new IOException("Tree file not found: " + path);
    }
    return parse(Files.readAllLines(path, StandardCharsets.UTF_8), path.toString());
  }

  /**
   * Parses the lines of a tree-pair description.
   *
   * @param sourceName used in error messages
   * @throws IOException if the description is malformed
   */
  public TreePair parse(List<String> lines, String sourceName) throws IOException {
    List<Line> numbered = new ArrayList<>(lines.size());
    for (int i = 0; i < lines.size(); i++) {
      numbered.add(new Line(i + 1, lines.get(i).trim()));
    }
    Format format = detectFormat(numbered);
    if (format == null) {
      throw new IOException(sourceName + ": no tree description found");
    }
    try {
      return format == Format.PARENT_INDEX
          ? parseParentIndex(numbered, sourceName)
          : parseEdgeList(numbered, sourceName);
    } catch (IllegalArgumentException ex) {
      throw new IOException(sourceName + ": " + ex.getMessage(), ex);
    }
  }

  /** Layout of the description, or {@code null} when it has no content lines. */
  static Format detectFormat(List<Line> lines) {
    for (Line line : lines) {
      if (line.isContent()) {
        List<String> tokens = line.tokens();
        return tokens.size() == 1 && isInteger(tokens.get(0))
            ? Format.PARENT_INDEX
            : Format.EDGE_LIST;
      }
    }
    return null;
  }

  private TreePair parseParentIndex(List<Line> lines, String sourceName) throws IOException {
    List<Line> content = lines.stream().filter(Line::isContent).toList();
    int[] cursor = {0};
    LabeledTree source = readCountedTree(content, cursor, sourceName, "first");
    LabeledTree target = readCountedTree(content, cursor, sourceName, "second");
    if (cursor[0] < content.size()) {
      throw new IOException(
          sourceName + ": unexpected content after the second tree at line "
              + content.get(cursor[0]).number());
    }
    return new TreePair(source, target);
  }

  private LabeledTree readCountedTree(
      List<Line> content, int[] cursor, String sourceName, String which) throws IOException {
    if (cursor[0] >= content.size()) {
      throw new IOException(sourceName + ": missing " + which + " tree");
    }
    Line header = content.get(cursor[0]++);
    List<String> headerTokens = header.tokens();
    if (headerTokens.size() != 1 || !isInteger(headerTokens.get(0))) {
      throw new IOException(
          sourceName + ": expected node count at line " + header.number() + ": " + header.text());
    }
    int count = Integer.parseInt(headerTokens.get(0));
    if (count < 1) {
      throw new IOException(
          sourceName + ": node count must be positive at line " + header.number());
    }
    int available = content.size() - cursor[0];
    if (count > available) {
      throw new IOException(
          sourceName + ": " + which + " tree declares " + count + " nodes but has " + available);
    }
    List<String> labels = new ArrayList<>(count);
    List<Integer> parents = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      Line line = content.get(cursor[0]++);
      List<String> tokens = line.tokens();
      if (tokens.size() != 2 || !isInteger(tokens.get(1))) {
        throw new IOException(
            sourceName + ": expected 'label parentIndex' at line " + line.number() + ": "
                + line.text());
      }
      labels.add(tokens.get(0));
      parents.add(Integer.parseInt(tokens.get(1)));
    }
    return TreeBuilders.fromParentIndices(labels, parents);
  }

  private TreePair parseEdgeList(List<Line> lines, String sourceName) throws IOException {
    boolean hasMarker = lines.stream().anyMatch(Line::isSecondTreeMarker);
    List<List<Edge>> edges = List.of(new ArrayList<>(), new ArrayList<>());
    List<List<String>> isolated = List.of(new ArrayList<>(), new ArrayList<>());
    int tree = 0;
    for (Line line : lines) {
      if (line.isSecondTreeMarker()) {
        if (tree == 1) {
          throw new IOException(
              sourceName + ": second tree marker repeated at line " + line.number());
        }
        tree = 1;
        continue;
      }
      if (line.text().isEmpty()) {
        boolean firstTreeStarted = !edges.get(0).isEmpty() || !isolated.get(0).isEmpty();
        if (!hasMarker && tree == 0 && firstTreeStarted) {
          tree = 1;
        }
        continue;
      }
      if (!line.isContent()) {
        continue;
      }
      List<String> tokens = line.tokens();
      switch (tokens.size()) {
        case 1 -> isolated.get(tree).add(tokens.get(0));
        case 2 -> edges.get(tree).add(new Edge(tokens.get(0), tokens.get(1), line.number()));
        default -> throw new IOException(
            sourceName + ": expected 'parent child' at line " + line.number() + ": "
                + line.text());
      }
    }
    if (edges.get(1).isEmpty() && isolated.get(1).isEmpty()) {
      throw new IOException(sourceName + ": missing second tree");
    }
    LabeledTree source = TreeBuilders.fromEdges(edges.get(0), isolated.get(0));
    LabeledTree target = TreeBuilders.fromEdges(edges.get(1), isolated.get(1));
    return new TreePair(source, target);
  }

  private static boolean isInteger(String token) {
    try {
      Integer.parseInt(token);
      return true;
    } catch (NumberFormatException ex) {
      return false;
    }
  }

  /** A trimmed input line with its 1-based line number. */
  record Line(int number, String text) {

    boolean isContent() {
      return !text.isEmpty() && !text.startsWith("#");
    }

    boolean isSecondTreeMarker() {
      return text.startsWith("#") && text.toLowerCase(Locale.ROOT).contains(SECOND_TREE_MARKER);
    }

    List<String> tokens() {
      return TOKENS.splitToList(text);
    }
  }
}
