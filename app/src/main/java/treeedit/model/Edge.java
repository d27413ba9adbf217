package treeedit.model;

import java.util.Objects;

/**
 * Immutable parent-to-child link in an edge-list tree description. Labels double as node
 * identities, so a label may appear as a child at most once per tree.
 */
public final class Edge {
  private final String parent;
  private final String child;
  private final int lineNumber;

  public Edge(String parent, String child, int lineNumber) {
    this.parent = Objects.requireNonNull(parent, "parent");
    this.child = Objects.requireNonNull(child, "child");
    this.lineNumber = lineNumber;
  }

  public String parent() {
    return parent;
  }

  public String child() {
    return child;
  }

  /** Source line the edge was read from, or {@code 0} for edges built in code. */
  public int lineNumber() {
    return lineNumber;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Edge other)) {
      return false;
    }
    return lineNumber == other.lineNumber
        && parent.equals(other.parent)
        && child.equals(other.child);
  }

  @Override
  public int hashCode() {
    return Objects.hash(parent, child, lineNumber);
  }

  @Override
  public String toString() {
    return parent + " -> " + child;
  }
}
