package treeedit.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Ordered, labeled tree that owns all of its nodes.
 *
 * <p>Nodes are addressed by their id, which is the position at which {@link #createNode(String)}
 * created them. A tree used as the mapping target additionally owns a single sentinel node that
 * stands for "no image". The sentinel has no parent, no depth and no preorder index, and it is not
 * counted by {@link #size()}.
 *
 * <p>Usage follows a build-then-freeze lifecycle: create nodes, set the root, link children, then
 * call {@link #assignPreorderAndDepth()} once. Linking children afterwards leaves the preorder and
 * depth values stale.
 */
public final class LabeledTree {
  public static final String SENTINEL_LABEL = "lambda";
  public static final int NO_NODE = TreeNode.UNASSIGNED;

  private final List<TreeNode> nodes = new ArrayList<>();
  private int root = NO_NODE;
  private int sentinel = NO_NODE;
  private int[] preorderToNode;

  public int createNode(String label) {
    if (label == null || label.isBlank()) {
      throw new IllegalArgumentException("Node label must not be blank");
    }
    if (SENTINEL_LABEL.equals(label)) {
      throw new IllegalArgumentException(
          "Node label '" + SENTINEL_LABEL + "' is reserved for the sentinel");
    }
    int id = nodes.size();
    nodes.add(new TreeNode(id, label));
    return id;
  }

  public void setRoot(int node) {
    TreeNode candidate = node(node);
    if (node == sentinel) {
      throw new IllegalArgumentException("The sentinel cannot be the root");
    }
    if (candidate.hasParent()) {
      throw new IllegalArgumentException("Root " + candidate + " already has a parent");
    }
    root = node;
  }

  public void addChild(int parent, int child) {
    TreeNode parentNode = node(parent);
    TreeNode childNode = node(child);
    if (parent == sentinel || child == sentinel) {
      throw new IllegalArgumentException("The sentinel cannot take part in edges");
    }
    if (parent == child) {
      throw new IllegalArgumentException("Node " + childNode + " cannot be its own child");
    }
    if (child == root) {
      throw new IllegalArgumentException("Root " + childNode + " cannot become a child");
    }
    if (childNode.hasParent()) {
      throw new IllegalArgumentException(
          "Node " + childNode + " already has parent " + nodes.get(childNode.parent()));
    }
    parentNode.attachChild(child);
    childNode.setParent(parent);
  }

  /**
   * Walks the tree depth-first from the root, numbering nodes in preorder (root first, children
   * left to right) and recording their depth.
   *
   * @throws IllegalStateException if no root is set or some node is unreachable from the root
   */
  public void assignPreorderAndDepth() {
    if (root == NO_NODE) {
      throw new IllegalStateException("Tree has no root");
    }
    int[] order = new int[size()];
    int counter = 0;
    Deque<int[]> stack = new ArrayDeque<>();
    stack.push(new int[] {root, 0});
    while (!stack.isEmpty()) {
      int[] frame = stack.pop();
      TreeNode current = nodes.get(frame[0]);
      current.setDepth(frame[1]);
      current.setPreorder(counter);
      order[counter++] = current.id();
      List<Integer> children = current.children();
      for (int i = children.size() - 1; i >= 0; i--) {
        stack.push(new int[] {children.get(i), frame[1] + 1});
      }
    }
    if (counter != order.length) {
      throw new IllegalStateException(
          "Only " + counter + " of " + order.length + " nodes are reachable from the root");
    }
    preorderToNode = order;
  }

  /** Returns the sentinel id, creating the sentinel on first use. */
  public int ensureSentinel() {
    if (sentinel == NO_NODE) {
      sentinel = nodes.size();
      nodes.add(new TreeNode(sentinel, SENTINEL_LABEL));
    }
    return sentinel;
  }

  public boolean hasSentinel() {
    return sentinel != NO_NODE;
  }

  /** Sentinel id, or {@link #NO_NODE} when the tree has none. */
  public int sentinel() {
    return sentinel;
  }

  public boolean isSentinel(int node) {
    return sentinel != NO_NODE && node == sentinel;
  }

  public int root() {
    return root;
  }

  /** Number of real nodes, excluding the sentinel. */
  public int size() {
    return hasSentinel() ? nodes.size() - 1 : nodes.size();
  }

  public TreeNode node(int id) {
    if (id < 0 || id >= nodes.size()) {
      throw new IllegalArgumentException("Unknown node id " + id);
    }
    return nodes.get(id);
  }

  public String label(int id) {
    return node(id).label();
  }

  public int depth(int id) {
    requireNumbered();
    return node(id).depth();
  }

  public int preorder(int id) {
    requireNumbered();
    return node(id).preorder();
  }

  public int parent(int id) {
    return node(id).parent();
  }

  public List<Integer> children(int id) {
    return node(id).children();
  }

  /** The node holding the given preorder index. */
  public int nodeAtPreorder(int preorderIndex) {
    requireNumbered();
    return preorderToNode[preorderIndex];
  }

  /** Real node ids in preorder; never contains the sentinel. */
  public List<Integer> nodesInPreorder() {
    requireNumbered();
    List<Integer> result = new ArrayList<>(preorderToNode.length);
    for (int id : preorderToNode) {
      result.add(id);
    }
    return Collections.unmodifiableList(result);
  }

  public boolean isNumbered() {
    return preorderToNode != null && preorderToNode.length == size();
  }

  private void requireNumbered() {
    if (!isNumbered()) {
      throw new IllegalStateException("assignPreorderAndDepth() has not been called");
    }
  }

  /** Renders the tree as a nested s-expression, e.g. {@code (a (b) (c))}. */
  @Override
  public String toString() {
    if (root == NO_NODE) {
      return "()";
    }
    StringBuilder sb = new StringBuilder();
    render(root, sb);
    return sb.toString();
  }

  private void render(int id, StringBuilder sb) {
    TreeNode current = nodes.get(id);
    sb.append('(').append(current.label());
    for (int child : current.children()) {
      sb.append(' ');
      render(child, sb);
    }
    sb.append(')');
  }
}
