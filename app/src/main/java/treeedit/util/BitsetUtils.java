package treeedit.util;

import java.util.BitSet;

/** Helpers for {@link BitSet} rows indexed by preorder position. */
public final class BitsetUtils {
  private BitsetUtils() {}

  public static BitSet copy(BitSet bitSet) {
    return bitSet == null ? new BitSet() : (BitSet) bitSet.clone();
  }

  /** Copies every row so that the result shares no {@link BitSet} with {@code rows}. */
  public static BitSet[] deepCopy(BitSet[] rows) {
    BitSet[] copy = new BitSet[rows.length];
    for (int i = 0; i < rows.length; i++) {
      copy[i] = copy(rows[i]);
    }
    return copy;
  }

  public static String signature(BitSet bitSet) {
    StringBuilder builder = new StringBuilder();
    builder.append('[');
    boolean first = true;
    for (int i = bitSet.nextSetBit(0); i >= 0; i = bitSet.nextSetBit(i + 1)) {
      if (!first) {
        builder.append(',');
      }
      builder.append(i);
      first = false;
    }
    return builder.append(']').toString();
  }
}
