package treeedit.mapping;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import treeedit.core.EnumerationOptions;
import treeedit.model.LabeledTree;

/**
 * Exhaustive enumeration of structure-preserving mappings from a source tree into a target tree.
 *
 * <p>The search walks the source in preorder, one recursion level per node. At each level every
 * surviving candidate is tried in candidate order (sentinel first, then target preorder), so the
 * order of the returned mappings is deterministic. Each level works on its own refined {@link
 * CandidateMap} snapshot; only the {@link PartialAssignment} is shared, and it is pushed before
 * descending and popped after returning.
 *
 * <p>Every candidate is visited even when a cheap mapping has already been found: the full
 * solution set is the result, not a single optimum.
 */
public final class BacktrackingEnumerator {
  public static final String TIME_BUDGET_EXCEEDED = "time_budget_exceeded";
  public static final String SOLUTION_LIMIT_REACHED = "solution_limit_reached";

  private final CandidateSetBuilder candidateSetBuilder = new CandidateSetBuilder();

  public SearchOutcome enumerate(LabeledTree source, LabeledTree target) {
    return enumerate(source, target, EnumerationOptions.defaults());
  }

  public SearchOutcome enumerate(
      LabeledTree source, LabeledTree target, EnumerationOptions options) {
    CandidateMap initial = candidateSetBuilder.build(source, target);
    return enumerate(source, target, initial, options);
  }

  /** Runs the search from a prepared initial snapshot. */
  public SearchOutcome enumerate(
      LabeledTree source, LabeledTree target, CandidateMap initial, EnumerationOptions options) {
    EnumerationOptions effective = EnumerationOptions.normalize(options);
    Search search = new Search(source, target, effective);
    search.extend(0, initial);
    return new SearchOutcome(search.solutions, search.branches, search.terminationReason);
  }

  private static final class Search {
    private final List<Integer> preorder;
    private final ConstraintRefiner refiner;
    private final PartialAssignment assignment;
    private final List<EditMapping> solutions = new ArrayList<>();
    private final long startNs;
    private final long budgetNs;
    private final int solutionLimit;
    private long branches;
    private String terminationReason;

    Search(LabeledTree source, LabeledTree target, EnumerationOptions options) {
      this.preorder = source.nodesInPreorder();
      this.refiner = new ConstraintRefiner(source);
      this.assignment = new PartialAssignment(source, target);
      this.startNs = System.nanoTime();
      this.budgetNs = TimeUnit.MILLISECONDS.toNanos(options.timeBudgetMs());
      this.solutionLimit = options.solutionLimit();
    }

    /** Returns {@code false} once a bound has stopped the search. */
    boolean extend(int index, CandidateMap candidates) {
      int node = preorder.get(index);
      boolean last = index == preorder.size() - 1;
      for (int image : candidates.candidates(node)) {
        if (overBudget()) {
          return false;
        }
        branches++;
        assignment.assign(node, image);
        boolean keepGoing = true;
        if (last) {
          solutions.add(assignment.snapshot());
          if (solutionLimit > 0 && solutions.size() >= solutionLimit) {
            terminationReason = SOLUTION_LIMIT_REACHED;
            keepGoing = false;
          }
        } else {
          CandidateMap refined = refiner.refine(candidates, node, image);
          keepGoing = extend(index + 1, refined);
        }
        assignment.unassign(node);
        if (!keepGoing) {
          return false;
        }
      }
      return true;
    }

    /** The budget is only checked once a first mapping (the all-deletion one) exists. */
    private boolean overBudget() {
      if (terminationReason != null) {
        return true;
      }
      if (budgetNs > 0 && !solutions.isEmpty() && System.nanoTime() - startNs > budgetNs) {
        terminationReason = TIME_BUDGET_EXCEEDED;
        return true;
      }
      return false;
    }
  }
}
