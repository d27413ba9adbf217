package treeedit.mapping;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import treeedit.model.LabeledTree;
import treeedit.model.TreeBuilders;

final class CandidateSetBuilderTest {

  private final CandidateSetBuilder builder = new CandidateSetBuilder();

  @Test
  void offersSentinelAndSameDepthTargets() {
    LabeledTree source = TreeBuilders.fromParentIndices(List.of("a", "b", "c"), List.of(-1, 0, 0));
    LabeledTree target =
        TreeBuilders.fromParentIndices(List.of("x", "y", "z", "w"), List.of(-1, 0, 1, 0));

    CandidateMap candidates = builder.build(source, target);
    int sentinel = target.sentinel();

    assertTrue(target.hasSentinel(), "Building candidates adds the target sentinel");
    assertEquals(3, candidates.sourceCount());
    assertEquals(List.of(sentinel, 0), candidates.candidates(0));
    assertEquals(List.of(sentinel, 1, 3), candidates.candidates(1), "Depth-1 nodes in preorder");
    assertEquals(List.of(sentinel, 1, 3), candidates.candidates(2));
    assertFalse(candidates.allows(1, 2), "z sits at depth 2");
    assertTrue(candidates.allows(1, sentinel));
  }

  @Test
  void deeperSourceNodesCanOnlyBeDeleted() {
    LabeledTree source = TreeBuilders.fromParentIndices(List.of("a", "b"), List.of(-1, 0));
    LabeledTree target = TreeBuilders.fromParentIndices(List.of("a"), List.of(-1));

    CandidateMap candidates = builder.build(source, target);

    assertEquals(List.of(target.sentinel()), candidates.candidates(1));
    assertEquals(1, candidates.candidateCount(1));
  }

  @Test
  void rebuildingGivesAnEqualSnapshot() {
    LabeledTree source = TreeBuilders.fromParentIndices(List.of("a", "b"), List.of(-1, 0));
    LabeledTree target = TreeBuilders.fromParentIndices(List.of("a", "b"), List.of(-1, 0));

    CandidateMap first = builder.build(source, target);
    int sentinel = target.sentinel();
    CandidateMap second = builder.build(source, target);

    assertEquals(first, second);
    assertEquals(sentinel, target.sentinel(), "Sentinel is not added twice");
    assertEquals(2, target.size());
    assertEquals("{0=[0,1], 1=[0,2]}", first.toString());
  }

  @Test
  void rejectsSourceWithSentinelAndUnnumberedTrees() {
    LabeledTree source = TreeBuilders.fromParentIndices(List.of("a"), List.of(-1));
    LabeledTree target = TreeBuilders.fromParentIndices(List.of("a"), List.of(-1));
    source.ensureSentinel();
    assertThrows(IllegalArgumentException.class, () -> builder.build(source, target));

    LabeledTree raw = new LabeledTree();
    raw.setRoot(raw.createNode("a"));
    assertThrows(IllegalArgumentException.class, () -> builder.build(raw, target));
  }
}
