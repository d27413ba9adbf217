package treeedit.cost;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import treeedit.mapping.EditMapping;
import treeedit.model.LabeledTree;

/**
 * Scores complete mappings.
 *
 * <p>The cost of a mapping is the weighted sum of deletions (source nodes mapped to the sentinel),
 * insertions (real target nodes outside the image) and substitutions (mapped pairs whose labels
 * differ). Equal labels cost nothing.
 */
public final class EditCostEvaluator {
  private final EditCosts costs;

  public EditCostEvaluator() {
    this(EditCosts.unit());
  }

  public EditCostEvaluator(EditCosts costs) {
    this.costs = Objects.requireNonNull(costs, "costs");
  }

  public EditCosts costs() {
    return costs;
  }

  public int cost(EditMapping mapping) {
    LabeledTree source = mapping.source();
    LabeledTree target = mapping.target();
    int deletions = 0;
    int substitutions = 0;
    for (int node = 0; node < mapping.size(); node++) {
      if (mapping.isDeleted(node)) {
        deletions++;
      } else if (!source.label(node).equals(target.label(mapping.imageOf(node)))) {
        substitutions++;
      }
    }
    int insertions = target.size() - mapping.mappedTargetPreorders().cardinality();
    return deletions * costs.deletion()
        + insertions * costs.insertion()
        + substitutions * costs.substitution();
  }

  /**
   * Spells a mapping out as operations: one per source node in source preorder, then one insert
   * per unmapped target node in target preorder.
   */
  public EditScript script(EditMapping mapping) {
    LabeledTree source = mapping.source();
    LabeledTree target = mapping.target();
    List<EditOperation> operations = new ArrayList<>();
    int total = 0;
    for (int node : source.nodesInPreorder()) {
      String label = source.label(node);
      EditOperation op;
      if (mapping.isDeleted(node)) {
        op = EditOperation.delete(label, costs.deletion());
      } else {
        String image = target.label(mapping.imageOf(node));
        op =
            label.equals(image)
                ? new EditOperation(EditOperation.Type.MATCH, label, image, 0)
                : new EditOperation(
                    EditOperation.Type.SUBSTITUTE, label, image, costs.substitution());
      }
      operations.add(op);
      total += op.cost();
    }
    BitSet mapped = mapping.mappedTargetPreorders();
    for (int p = mapped.nextClearBit(0); p < target.size(); p = mapped.nextClearBit(p + 1)) {
      EditOperation op =
          EditOperation.insert(target.label(target.nodeAtPreorder(p)), costs.insertion());
      operations.add(op);
      total += op.cost();
    }
    return new EditScript(operations, total);
  }

  public List<ScoredMapping> scoreAll(List<EditMapping> solutions) {
    List<ScoredMapping> scored = new ArrayList<>(solutions.size());
    for (int i = 0; i < solutions.size(); i++) {
      EditMapping mapping = solutions.get(i);
      scored.add(new ScoredMapping(i, mapping, cost(mapping)));
    }
    return scored;
  }

  /** Scores {@code solutions} and keeps the first mapping with the smallest cost. */
  public Optional<ScoredMapping> minimum(List<EditMapping> solutions) {
    return firstMinimum(scoreAll(solutions));
  }

  /** Summarizes already scored mappings; empty when {@code scored} is empty. */
  public Optional<CostSummary> summarize(List<ScoredMapping> scored) {
    Optional<ScoredMapping> best = firstMinimum(scored);
    if (best.isEmpty()) {
      return Optional.empty();
    }
    Map<Integer, Integer> histogram = new LinkedHashMap<>();
    for (ScoredMapping entry : scored) {
      histogram.merge(entry.cost(), 1, Integer::sum);
    }
    ScoredMapping witness = best.get();
    return Optional.of(new CostSummary(witness, histogram.get(witness.cost()), histogram));
  }

  /** Single scan; ties go to the earliest entry. */
  private static Optional<ScoredMapping> firstMinimum(List<ScoredMapping> scored) {
    ScoredMapping best = null;
    for (ScoredMapping entry : scored) {
      if (best == null || entry.cost() < best.cost()) {
        best = entry;
      }
    }
    return Optional.ofNullable(best);
  }
}
