package treeedit.mapping;

import java.util.BitSet;
import treeedit.model.LabeledTree;

/**
 * Derives the candidate snapshot that follows from fixing one source node to one target node.
 *
 * <p>Three rules are applied in a single pass over a copy of the current snapshot:
 *
 * <ol>
 *   <li><b>Injectivity</b>: a real target node is removed from every other source node. The
 *       sentinel stays available to everyone.
 *   <li><b>Ancestor consistency</b>: children of a deleted node may only be deleted; children of a
 *       mapped node may only map to children of its image, or be deleted.
 *   <li><b>Sibling order</b>: later siblings of the fixed node lose every real candidate that
 *       precedes the image in target preorder.
 * </ol>
 *
 * <p>The sibling rule only looks forward. An earlier sibling that is still unassigned is never
 * restricted by a later one; since the enumerator assigns in preorder this situation does not
 * arise during a normal search.
 */
public final class ConstraintRefiner {
  private final LabeledTree source;

  public ConstraintRefiner(LabeledTree source) {
    this.source = source;
  }

  /**
   * Returns a new snapshot reflecting {@code sourceNode -> targetNode}. {@code current} is left
   * untouched.
   */
  public CandidateMap refine(CandidateMap current, int sourceNode, int targetNode) {
    LabeledTree target = current.target();
    boolean deleted = target.isSentinel(targetNode);
    BitSet[] rows = current.copyRows();

    if (!deleted) {
      int imageBit = CandidateMap.bitFor(target.preorder(targetNode));
      for (int other = 0; other < rows.length; other++) {
        if (other != sourceNode) {
          rows[other].clear(imageBit);
        }
      }
    }

    BitSet childMask = new BitSet();
    childMask.set(CandidateMap.SENTINEL_BIT);
    if (!deleted) {
      for (int child : target.children(targetNode)) {
        childMask.set(CandidateMap.bitFor(target.preorder(child)));
      }
    }
    for (int child : source.children(sourceNode)) {
      rows[child].and(childMask);
    }

    int parent = source.parent(sourceNode);
    if (!deleted && parent != LabeledTree.NO_NODE) {
      int sourceOrder = source.preorder(sourceNode);
      int imageBit = CandidateMap.bitFor(target.preorder(targetNode));
      for (int sibling : source.children(parent)) {
        if (source.preorder(sibling) > sourceOrder) {
          rows[sibling].clear(CandidateMap.SENTINEL_BIT + 1, imageBit);
        }
      }
    }
    return new CandidateMap(target, rows);
  }
}
