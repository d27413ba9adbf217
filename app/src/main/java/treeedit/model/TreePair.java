package treeedit.model;

import java.util.Objects;

/** The source tree to be mapped and the target tree it is mapped into. */
public record TreePair(LabeledTree source, LabeledTree target) {

  public TreePair {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(target, "target");
    if (source == target) {
      throw new IllegalArgumentException("Source and target must be distinct tree instances");
    }
  }
}
