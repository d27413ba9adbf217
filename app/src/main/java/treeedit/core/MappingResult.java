package treeedit.core;

import java.util.List;
import java.util.Objects;
import treeedit.cost.CostSummary;
import treeedit.cost.EditScript;
import treeedit.cost.ScoredMapping;
import treeedit.model.LabeledTree;
import treeedit.pipeline.EnumerationRun;

/**
 * Aggregated outcome of enumerating and scoring the mappings between two trees.
 *
 * @param mappings reported mappings in enumeration order; only minimal ones when the options ask
 *     for that
 * @param totalMappings number of mappings the search produced, before any filtering
 * @param witnessScript edit script of {@code summary.witness()}
 * @param terminationReason {@code null} when the search ran to completion
 */
public record MappingResult(
    LabeledTree source,
    LabeledTree target,
    EnumerationOptions options,
    List<ScoredMapping> mappings,
    int totalMappings,
    CostSummary summary,
    EditScript witnessScript,
    EnumerationRun run,
    String terminationReason) {

  public MappingResult {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(target, "target");
    Objects.requireNonNull(options, "options");
    Objects.requireNonNull(mappings, "mappings");
    Objects.requireNonNull(summary, "summary");
    Objects.requireNonNull(witnessScript, "witnessScript");
    Objects.requireNonNull(run, "run");
    mappings = List.copyOf(mappings);
  }

  public int minimumCost() {
    return summary.minimumCost();
  }

  public boolean isComplete() {
    return terminationReason == null;
  }

  public long elapsedMillis() {
    return run.totalMs();
  }
}
