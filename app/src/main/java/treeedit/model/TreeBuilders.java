package treeedit.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Builds numbered {@link LabeledTree}s from parent-index records or edge lists. */
public final class TreeBuilders {
  public static final int ROOT_MARKER = -1;

  private TreeBuilders() {}

  /**
   * Builds a tree where node {@code i} carries {@code labels.get(i)} and hangs below node {@code
   * parents.get(i)}. Exactly one entry must be {@link #ROOT_MARKER}. Children keep the order of
   * their records.
   */
  public static LabeledTree fromParentIndices(List<String> labels, List<Integer> parents) {
    Objects.requireNonNull(labels, "labels");
    Objects.requireNonNull(parents, "parents");
    if (labels.size() != parents.size()) {
      throw new IllegalArgumentException(
          "Got " + labels.size() + " labels but " + parents.size() + " parent indices");
    }
    if (labels.isEmpty()) {
      throw new IllegalArgumentException("A tree needs at least one node");
    }
    LabeledTree tree = new LabeledTree();
    int root = ROOT_MARKER;
    for (int i = 0; i < labels.size(); i++) {
      tree.createNode(labels.get(i));
      int parent = parents.get(i);
      if (parent == ROOT_MARKER) {
        if (root != ROOT_MARKER) {
          throw new IllegalArgumentException(
              "Nodes " + root + " and " + i + " are both marked as root");
        }
        root = i;
      } else if (parent < 0 || parent >= labels.size()) {
        throw new IllegalArgumentException(
            "Node " + i + " (" + labels.get(i) + ") refers to missing parent " + parent);
      } else if (parent == i) {
        throw new IllegalArgumentException("Node " + i + " is its own parent");
      }
    }
    if (root == ROOT_MARKER) {
      throw new IllegalArgumentException("No node is marked as root (parent index -1)");
    }
    tree.setRoot(root);
    for (int i = 0; i < labels.size(); i++) {
      if (i != root) {
        tree.addChild(parents.get(i), i);
      }
    }
    return numbered(tree);
  }

  /**
   * Builds a tree from parent/child label pairs. Node ids follow the order in which labels first
   * appear; {@code isolated} labels declare nodes that appear in no edge. The root is the only node
   * that is never a child.
   */
  public static LabeledTree fromEdges(List<Edge> edges, List<String> isolated) {
    Objects.requireNonNull(edges, "edges");
    Objects.requireNonNull(isolated, "isolated");
    LabeledTree tree = new LabeledTree();
    Map<String, Integer> ids = new LinkedHashMap<>();
    for (String label : isolated) {
      ids.computeIfAbsent(label, tree::createNode);
    }
    for (Edge edge : edges) {
      ids.computeIfAbsent(edge.parent(), tree::createNode);
      ids.computeIfAbsent(edge.child(), tree::createNode);
    }
    if (ids.isEmpty()) {
      throw new IllegalArgumentException("A tree needs at least one node");
    }

    Map<String, Edge> parentEdge = new LinkedHashMap<>();
    for (Edge edge : edges) {
      Edge previous = parentEdge.putIfAbsent(edge.child(), edge);
      if (previous != null) {
        throw new IllegalArgumentException(
            "Node "
                + edge.child()
                + " has two parents: "
                + previous.parent()
                + " and "
                + edge.parent()
                + describeLine(edge));
      }
    }

    List<String> roots = new ArrayList<>();
    for (String label : ids.keySet()) {
      if (!parentEdge.containsKey(label)) {
        roots.add(label);
      }
    }
    if (roots.isEmpty()) {
      throw new IllegalArgumentException("Every node has a parent, so the tree has no root");
    }
    if (roots.size() > 1) {
      throw new IllegalArgumentException("Description has more than one root: " + roots);
    }

    tree.setRoot(ids.get(roots.get(0)));
    for (Edge edge : edges) {
      tree.addChild(ids.get(edge.parent()), ids.get(edge.child()));
    }
    return numbered(tree);
  }

  private static LabeledTree numbered(LabeledTree tree) {
    try {
      tree.assignPreorderAndDepth();
    } catch (IllegalStateException ex) {
      throw new IllegalArgumentException("Malformed tree: " + ex.getMessage(), ex);
    }
    return tree;
  }

  private static String describeLine(Edge edge) {
    return edge.lineNumber() > 0 ? " (line " + edge.lineNumber() + ")" : "";
  }
}
