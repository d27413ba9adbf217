package treeedit.cost;

/** Weights charged per deleted, inserted and relabeled node. */
public record EditCosts(int deletion, int insertion, int substitution) {

  public EditCosts {
    if (deletion < 0 || insertion < 0 || substitution < 0) {
      throw new IllegalArgumentException(
          "Edit costs must be non-negative: " + deletion + "/" + insertion + "/" + substitution);
    }
  }

  public static EditCosts unit() {
    return new EditCosts(1, 1, 1);
  }
}
