package treeedit.mapping;

import java.util.List;
import java.util.Objects;

/**
 * Mappings collected by one search, in discovery order.
 *
 * @param terminationReason {@code null} when the search ran to completion
 */
public record SearchOutcome(
    List<EditMapping> solutions, long branchesExplored, String terminationReason) {

  public SearchOutcome {
    Objects.requireNonNull(solutions, "solutions");
    solutions = List.copyOf(solutions);
  }

  public boolean isComplete() {
    return terminationReason == null;
  }

  public int size() {
    return solutions.size();
  }
}
