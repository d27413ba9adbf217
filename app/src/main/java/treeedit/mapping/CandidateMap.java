package treeedit.mapping;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.List;
import java.util.Objects;
import treeedit.model.LabeledTree;
import treeedit.util.BitsetUtils;

/**
 * Immutable snapshot of the target candidates still open to each source node.
 *
 * <p>Each source node owns one row. Bit {@code 0} of a row stands for the sentinel (deletion); bit
 * {@code p + 1} stands for the target node with preorder index {@code p}. Iterating a row in bit
 * order therefore yields the sentinel first and then target nodes in target preorder.
 */
public final class CandidateMap {
  static final int SENTINEL_BIT = 0;

  private final LabeledTree target;
  private final BitSet[] rows;

  /** Takes ownership of {@code rows}; callers must not keep a reference. */
  CandidateMap(LabeledTree target, BitSet[] rows) {
    this.target = Objects.requireNonNull(target, "target");
    this.rows = Objects.requireNonNull(rows, "rows");
  }

  static int bitFor(int preorder) {
    return preorder + 1;
  }

  /** Candidate target node ids for {@code sourceNode}, sentinel first, then target preorder. */
  public List<Integer> candidates(int sourceNode) {
    BitSet row = row(sourceNode);
    List<Integer> result = new ArrayList<>(row.cardinality());
    for (int bit = row.nextSetBit(0); bit >= 0; bit = row.nextSetBit(bit + 1)) {
      result.add(nodeForBit(bit));
    }
    return result;
  }

  public boolean allows(int sourceNode, int targetNode) {
    int bit =
        target.isSentinel(targetNode) ? SENTINEL_BIT : bitFor(target.preorder(targetNode));
    return row(sourceNode).get(bit);
  }

  public int candidateCount(int sourceNode) {
    return row(sourceNode).cardinality();
  }

  public int sourceCount() {
    return rows.length;
  }

  LabeledTree target() {
    return target;
  }

  /** Independent copy of every row, for building the next snapshot. */
  BitSet[] copyRows() {
    return BitsetUtils.deepCopy(rows);
  }

  private BitSet row(int sourceNode) {
    if (sourceNode < 0 || sourceNode >= rows.length) {
      throw new IllegalArgumentException("Unknown source node " + sourceNode);
    }
    return rows[sourceNode];
  }

  private int nodeForBit(int bit) {
    return bit == SENTINEL_BIT ? target.sentinel() : target.nodeAtPreorder(bit - 1);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CandidateMap other)) {
      return false;
    }
    return target == other.target && Arrays.equals(rows, other.rows);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(rows);
  }

  /** Rows as bit signatures, e.g. {@code {0=[0,1], 1=[0,2,3]}}. */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("{");
    for (int i = 0; i < rows.length; i++) {
      if (i > 0) {
        sb.append(", ");
      }
      sb.append(i).append('=').append(BitsetUtils.signature(rows[i]));
    }
    return sb.append('}').toString();
  }
}
