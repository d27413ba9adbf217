package treeedit.mapping;

import java.util.Arrays;
import treeedit.model.LabeledTree;

/**
 * The assignment being grown along one path of the search. Entries are added and removed in
 * strict stack order, mirroring the recursion.
 */
final class PartialAssignment {
  private static final int UNASSIGNED = -1;

  private final LabeledTree source;
  private final LabeledTree target;
  private final int[] images;
  private int assigned;

  PartialAssignment(LabeledTree source, LabeledTree target) {
    this.source = source;
    this.target = target;
    this.images = new int[source.size()];
    Arrays.fill(images, UNASSIGNED);
  }

  void assign(int sourceNode, int targetNode) {
    if (images[sourceNode] != UNASSIGNED) {
      throw new IllegalStateException("Source node " + sourceNode + " is already assigned");
    }
    images[sourceNode] = targetNode;
    assigned++;
  }

  void unassign(int sourceNode) {
    if (images[sourceNode] == UNASSIGNED) {
      throw new IllegalStateException("Source node " + sourceNode + " is not assigned");
    }
    images[sourceNode] = UNASSIGNED;
    assigned--;
  }

  int size() {
    return assigned;
  }

  boolean isComplete() {
    return assigned == images.length;
  }

  /** Immutable copy of a complete assignment. */
  EditMapping snapshot() {
    if (!isComplete()) {
      throw new IllegalStateException(
          "Only " + assigned + " of " + images.length + " source nodes are assigned");
    }
    return new EditMapping(source, target, images.clone());
  }
}
