package treeedit.mapping;

import java.util.BitSet;
import treeedit.model.LabeledTree;

/**
 * Builds the initial {@link CandidateMap}: every source node may be deleted, or mapped to any
 * target node at the same depth. Depth-mismatched pairs can never be part of a structure-preserving
 * mapping and are pruned here rather than during search.
 */
public final class CandidateSetBuilder {

  /**
   * Sets up candidates for mapping {@code source} into {@code target}. Adds the sentinel to {@code
   * target} if it has none yet.
   *
   * @throws IllegalArgumentException if either tree is not numbered or the source has a sentinel
   */
  public CandidateMap build(LabeledTree source, LabeledTree target) {
    requireNumbered(source, "source");
    requireNumbered(target, "target");
    if (source.hasSentinel()) {
      throw new IllegalArgumentException("The source tree must not carry a sentinel");
    }
    target.ensureSentinel();

    int maxDepth = 0;
    for (int node : target.nodesInPreorder()) {
      maxDepth = Math.max(maxDepth, target.depth(node));
    }
    BitSet[] byDepth = new BitSet[maxDepth + 1];
    for (int d = 0; d <= maxDepth; d++) {
      byDepth[d] = new BitSet(target.size() + 1);
    }
    for (int node : target.nodesInPreorder()) {
      byDepth[target.depth(node)].set(CandidateMap.bitFor(target.preorder(node)));
    }

    BitSet[] rows = new BitSet[source.size()];
    for (int v = 0; v < rows.length; v++) {
      BitSet row = new BitSet(target.size() + 1);
      row.set(CandidateMap.SENTINEL_BIT);
      int depth = source.depth(v);
      if (depth <= maxDepth) {
        row.or(byDepth[depth]);
      }
      rows[v] = row;
    }
    return new CandidateMap(target, rows);
  }

  private static void requireNumbered(LabeledTree tree, String role) {
    if (!tree.isNumbered()) {
      throw new IllegalArgumentException(
          "The " + role + " tree has not been numbered; call assignPreorderAndDepth() first");
    }
  }
}
