package treeedit.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A node of a {@link LabeledTree}. Parent and children are stored as ids into the owning tree, so
 * a node never holds a reference to another node.
 */
public final class TreeNode {
  static final int UNASSIGNED = -1;

  private final int id;
  private final String label;
  private final List<Integer> children = new ArrayList<>();
  private int parent = UNASSIGNED;
  private int depth = UNASSIGNED;
  private int preorder = UNASSIGNED;

  TreeNode(int id, String label) {
    this.id = id;
    this.label = label;
  }

  public int id() {
    return id;
  }

  public String label() {
    return label;
  }

  /** Parent id, or {@code -1} for the root and the sentinel. */
  public int parent() {
    return parent;
  }

  public List<Integer> children() {
    return Collections.unmodifiableList(children);
  }

  public int depth() {
    return depth;
  }

  public int preorder() {
    return preorder;
  }

  public boolean hasParent() {
    return parent != UNASSIGNED;
  }

  void attachChild(int child) {
    children.add(child);
  }

  void setParent(int parent) {
    this.parent = parent;
  }

  void setDepth(int depth) {
    this.depth = depth;
  }

  void setPreorder(int preorder) {
    this.preorder = preorder;
  }

  @Override
  public String toString() {
    return label + "#" + id;
  }
}
