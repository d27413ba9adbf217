package treeedit.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import treeedit.core.EnumerationOptions;
import treeedit.core.MappingResult;
import treeedit.cost.EditCosts;
import treeedit.cost.EditOperation;
import treeedit.cost.ScoredMapping;
import treeedit.examples.Example;
import treeedit.mapping.BacktrackingEnumerator;

final class MappingPipelineTest {

  private final MappingPipeline pipeline = new MappingPipeline();

  @Test
  void reportsAllMappingsAndMinimum() {
    MappingResult result = pipeline.run(Example.chain(), EnumerationOptions.defaults());

    assertEquals(4, result.totalMappings());
    assertEquals(4, result.mappings().size());
    assertEquals(0, result.minimumCost());
    assertEquals(3, result.summary().witness().index(), "Identity is enumerated last");
    assertEquals(3, result.witnessScript().count(EditOperation.Type.MATCH));
    assertTrue(result.witnessScript().changes().isEmpty());
    assertTrue(result.isComplete());
    assertNull(result.terminationReason());
    assertEquals(4, result.run().mappingsScored());
    assertTrue(result.run().branchesExplored() >= 4);
  }

  @Test
  void onlyMinimalKeepsIndicesAndTotals() {
    EnumerationOptions options = new EnumerationOptions(0, 0, EditCosts.unit(), true);

    MappingResult result = pipeline.run(Example.swappedSiblings(), options);

    assertEquals(7, result.totalMappings());
    assertEquals(3, result.mappings().size());
    for (ScoredMapping scored : result.mappings()) {
      assertEquals(2, scored.cost());
    }
    assertEquals(2, result.mappings().get(0).index());
  }

  @Test
  void boundedRunCarriesTerminationReason() {
    EnumerationOptions options = new EnumerationOptions(0, 1, EditCosts.unit(), false);

    MappingResult result = pipeline.run(Example.relabeled(), options);

    assertFalse(result.isComplete());
    assertEquals(BacktrackingEnumerator.SOLUTION_LIMIT_REACHED, result.terminationReason());
    assertEquals(1, result.totalMappings());
    assertEquals(11, result.minimumCost(), "Only the all-deletion mapping was found");
  }

  @Test
  void nullOptionsFallBackToDefaults() {
    MappingResult result = pipeline.run(Example.singleNode(), null);

    assertEquals(EnumerationOptions.defaults(), result.options());
    assertEquals(0, result.minimumCost());
  }

  @Test
  void runMetricsAddUp() {
    EnumerationRun run = new EnumerationRun();
    run.recordPhase(EnumerationRun.Phase.SEARCH, 5, 40);
    run.recordPhaseMs(EnumerationRun.Phase.SCORING, 2);
    run.recordPhaseMs(EnumerationRun.Phase.TOTAL, 10);

    assertEquals(40, run.branchesExplored());
    assertEquals(3, run.overheadMs());
    assertTrue(run.toString().contains("Search:          5 ms (40 branches)"), run.toString());
  }
}
