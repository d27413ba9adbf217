package treeedit.cost;

import java.util.Locale;
import java.util.Objects;
import treeedit.model.LabeledTree;

/**
 * One step of an edit script derived from a mapping.
 *
 * @param sourceLabel label of the source node, or {@link LabeledTree#SENTINEL_LABEL} for inserts
 * @param targetLabel label of the target node, or {@link LabeledTree#SENTINEL_LABEL} for deletes
 */
public record EditOperation(Type type, String sourceLabel, String targetLabel, int cost) {

  public enum Type {
    DELETE,
    INSERT,
    SUBSTITUTE,
    MATCH
  }

  public EditOperation {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(sourceLabel, "sourceLabel");
    Objects.requireNonNull(targetLabel, "targetLabel");
  }

  public static EditOperation delete(String sourceLabel, int cost) {
    return new EditOperation(Type.DELETE, sourceLabel, LabeledTree.SENTINEL_LABEL, cost);
  }

  public static EditOperation insert(String targetLabel, int cost) {
    return new EditOperation(Type.INSERT, LabeledTree.SENTINEL_LABEL, targetLabel, cost);
  }

  public boolean isChange() {
    return type != Type.MATCH;
  }

  @Override
  public String toString() {
    return type.name().toLowerCase(Locale.ROOT)
        + "("
        + sourceLabel
        + ", "
        + targetLabel
        + ")";
  }
}
