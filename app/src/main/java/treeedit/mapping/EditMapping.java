package treeedit.mapping;

import java.util.Arrays;
import java.util.BitSet;
import java.util.Objects;
import treeedit.model.LabeledTree;

/**
 * A complete mapping from every source node to a target node or to the target's sentinel.
 * Instances are immutable.
 */
public final class EditMapping {
  private final LabeledTree source;
  private final LabeledTree target;
  private final int[] images;

  EditMapping(LabeledTree source, LabeledTree target, int[] images) {
    this.source = Objects.requireNonNull(source, "source");
    this.target = Objects.requireNonNull(target, "target");
    this.images = Objects.requireNonNull(images, "images");
  }

  public LabeledTree source() {
    return source;
  }

  public LabeledTree target() {
    return target;
  }

  /** Target node id for {@code sourceNode}; the target's sentinel id when the node is deleted. */
  public int imageOf(int sourceNode) {
    return images[sourceNode];
  }

  public boolean isDeleted(int sourceNode) {
    return target.isSentinel(images[sourceNode]);
  }

  public int size() {
    return images.length;
  }

  /** Target nodes hit by at least one source node, indexed by target preorder. */
  public BitSet mappedTargetPreorders() {
    BitSet mapped = new BitSet(target.size());
    for (int image : images) {
      if (!target.isSentinel(image)) {
        mapped.set(target.preorder(image));
      }
    }
    return mapped;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof EditMapping other)) {
      return false;
    }
    return source == other.source && target == other.target && Arrays.equals(images, other.images);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(images);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("{");
    boolean first = true;
    for (int node : source.nodesInPreorder()) {
      if (!first) {
        sb.append(", ");
      }
      sb.append(source.label(node)).append(" -> ").append(target.label(images[node]));
      first = false;
    }
    return sb.append('}').toString();
  }
}
