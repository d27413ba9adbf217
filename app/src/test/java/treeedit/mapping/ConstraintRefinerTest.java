package treeedit.mapping;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import treeedit.model.LabeledTree;
import treeedit.model.TreeBuilders;

final class ConstraintRefinerTest {
  // source r(x, y): r=0, x=1, y=2; target r(y, x): r=0, y=1, x=2
  private LabeledTree source;
  private LabeledTree target;
  private ConstraintRefiner refiner;
  private CandidateMap initial;
  private int sentinel;

  @BeforeEach
  void setUp() {
    source = TreeBuilders.fromParentIndices(List.of("r", "x", "y"), List.of(-1, 0, 0));
    target = TreeBuilders.fromParentIndices(List.of("r", "y", "x"), List.of(-1, 0, 0));
    initial = new CandidateSetBuilder().build(source, target);
    refiner = new ConstraintRefiner(source);
    sentinel = target.sentinel();
  }

  @Test
  void leavesInputSnapshotUntouched() {
    String before = initial.toString();

    CandidateMap refined = refiner.refine(initial, 0, 0);

    assertEquals(before, initial.toString());
    assertNotEquals(initial, refined);
  }

  @Test
  void childrenOfDeletedNodeAreDeleted() {
    CandidateMap refined = refiner.refine(initial, 0, sentinel);

    assertEquals(List.of(sentinel), refined.candidates(1));
    assertEquals(List.of(sentinel), refined.candidates(2));
  }

  @Test
  void childrenOfMappedNodeFollowTheImage() {
    LabeledTree wide =
        TreeBuilders.fromParentIndices(List.of("r", "a", "b", "c"), List.of(-1, 0, 0, 1));
    LabeledTree deep =
        TreeBuilders.fromParentIndices(List.of("r", "p", "q", "s", "t"), List.of(-1, 0, 1, 0, 3));
    CandidateMap start = new CandidateSetBuilder().build(wide, deep);
    ConstraintRefiner wideRefiner = new ConstraintRefiner(wide);

    CandidateMap refined = wideRefiner.refine(start, 1, 3);

    assertEquals(List.of(deep.sentinel(), 4), refined.candidates(3), "c may only go below s");
  }

  @Test
  void mappedTargetIsRemovedFromOtherRows() {
    CandidateMap afterRoot = refiner.refine(initial, 0, 0);
    CandidateMap refined = refiner.refine(afterRoot, 1, 1);

    assertEquals(List.of(sentinel, 1, 2), refined.candidates(1), "Own row is kept");
    assertEquals(List.of(sentinel, 2), refined.candidates(2));
  }

  @Test
  void laterSiblingsMustFollowInTargetOrder() {
    CandidateMap afterRoot = refiner.refine(initial, 0, 0);

    CandidateMap refined = refiner.refine(afterRoot, 1, 2);

    assertEquals(List.of(sentinel), refined.candidates(2), "Nothing lies after x in target order");
  }

  @Test
  void earlierSiblingsAreNotRestrictedByOrder() {
    CandidateMap afterRoot = refiner.refine(initial, 0, 0);

    CandidateMap refined = refiner.refine(afterRoot, 2, 2);

    assertEquals(
        List.of(sentinel, 1),
        refined.candidates(1),
        "Only injectivity applies to the earlier sibling x");
  }

  @Test
  void deletionKeepsSiblingRows() {
    CandidateMap afterRoot = refiner.refine(initial, 0, 0);

    CandidateMap refined = refiner.refine(afterRoot, 1, sentinel);

    assertEquals(afterRoot.candidates(2), refined.candidates(2));
  }
}
