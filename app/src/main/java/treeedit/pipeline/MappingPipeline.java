package treeedit.pipeline;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import treeedit.core.EnumerationOptions;
import treeedit.core.MappingResult;
import treeedit.cost.CostSummary;
import treeedit.cost.EditCostEvaluator;
import treeedit.cost.EditScript;
import treeedit.cost.ScoredMapping;
import treeedit.mapping.BacktrackingEnumerator;
import treeedit.mapping.CandidateMap;
import treeedit.mapping.CandidateSetBuilder;
import treeedit.mapping.SearchOutcome;
import treeedit.model.LabeledTree;
import treeedit.model.TreePair;

/**
 * Orchestrates one run: candidate setup, exhaustive search, then scoring and minimum selection.
 */
public final class MappingPipeline {
  private static final Logger LOG = LoggerFactory.getLogger(MappingPipeline.class);

  private final CandidateSetBuilder candidateSetBuilder = new CandidateSetBuilder();
  private final BacktrackingEnumerator enumerator = new BacktrackingEnumerator();

  public MappingResult run(TreePair pair, EnumerationOptions options) {
    return run(pair.source(), pair.target(), options);
  }

  public MappingResult run(LabeledTree source, LabeledTree target, EnumerationOptions options) {
    EnumerationOptions effective = EnumerationOptions.normalize(options);
    LOG.info(
        "Enumerating mappings of {} source nodes into {} target nodes...",
        source.size(),
        target.size());
    if (effective.isBounded()) {
      LOG.info(
          "Search bounds: time budget {} ms, solution limit {}",
          effective.timeBudgetMs(),
          effective.solutionLimit());
    }
    EnumerationRun run = new EnumerationRun();
    long totalStart = System.nanoTime();

    CandidateMap initial;
    try (EnumerationRun.Timer ignored = run.startTimer(EnumerationRun.Phase.CANDIDATE_SETUP)) {
      initial = candidateSetBuilder.build(source, target);
    }
    LOG.debug("Initial candidates: {}", initial);

    SearchOutcome outcome;
    try (EnumerationRun.Timer ignored = run.startTimer(EnumerationRun.Phase.SEARCH)) {
      outcome = enumerator.enumerate(source, target, initial, effective);
    }
    run.recordPhaseCount(EnumerationRun.Phase.SEARCH, outcome.branchesExplored());

    EditCostEvaluator evaluator = new EditCostEvaluator(effective.costs());
    List<ScoredMapping> scored;
    CostSummary summary;
    EditScript witnessScript;
    try (EnumerationRun.Timer ignored = run.startTimer(EnumerationRun.Phase.SCORING)) {
      scored = evaluator.scoreAll(outcome.solutions());
      summary =
          evaluator
              .summarize(scored)
              .orElseThrow(() -> new IllegalStateException("Search produced no mappings"));
      witnessScript = evaluator.script(summary.witness().mapping());
    }
    run.recordPhaseCount(EnumerationRun.Phase.SCORING, scored.size());

    int minimumCost = summary.minimumCost();
    List<ScoredMapping> reported =
        effective.onlyMinimal()
            ? scored.stream().filter(s -> s.cost() == minimumCost).toList()
            : scored;
    run.recordPhaseMs(EnumerationRun.Phase.TOTAL, (System.nanoTime() - totalStart) / 1_000_000);

    LOG.info(
        "Found {} mappings in {} ms ({} branches explored)",
        scored.size(),
        run.totalMs(),
        outcome.branchesExplored());
    LOG.info(
        "Minimum edit distance: {} ({} minimal mappings)",
        minimumCost,
        summary.minimalCount());
    if (!outcome.isComplete()) {
      LOG.warn("Enumeration terminated early: {}", outcome.terminationReason());
    }

    return new MappingResult(
        source,
        target,
        effective,
        reported,
        scored.size(),
        summary,
        witnessScript,
        run,
        outcome.terminationReason());
  }
}
