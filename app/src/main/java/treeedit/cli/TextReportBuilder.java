package treeedit.cli;

import treeedit.core.MappingResult;
import treeedit.cost.EditOperation;
import treeedit.cost.ScoredMapping;
import treeedit.mapping.EditMapping;
import treeedit.model.LabeledTree;

/** Plain-text report: every reported mapping, its cost, and a summary. */
final class TextReportBuilder {

  String build(MappingResult result) {
    StringBuilder sb = new StringBuilder();
    sb.append("Tree 1: ").append(result.source()).append('\n');
    sb.append("Tree 2: ").append(result.target()).append('\n');

    for (ScoredMapping scored : result.mappings()) {
      sb.append('\n').append("Solution ").append(scored.index() + 1).append(":\n");
      appendPairs(sb, scored.mapping());
      sb.append("Edit distance: ").append(scored.cost()).append('\n');
    }

    sb.append('\n');
    sb.append("Number of valid mappings: ").append(result.totalMappings()).append('\n');
    if (result.options().onlyMinimal()) {
      sb.append("Minimal mappings shown: ").append(result.mappings().size()).append('\n');
    }
    sb.append("Minimum edit distance: ")
        .append(result.minimumCost())
        .append(" (solution ")
        .append(result.summary().witness().index() + 1)
        .append(")\n");
    sb.append("Edit script:\n");
    for (EditOperation op : result.witnessScript().operations()) {
      sb.append("  ").append(op).append('\n');
    }
    if (!result.isComplete()) {
      sb.append("Search stopped early: ").append(result.terminationReason()).append('\n');
    }
    return sb.toString();
  }

  private void appendPairs(StringBuilder sb, EditMapping mapping) {
    LabeledTree source = mapping.source();
    LabeledTree target = mapping.target();
    for (int node : source.nodesInPreorder()) {
      sb.append(source.label(node))
          .append(" -> ")
          .append(target.label(mapping.imageOf(node)))
          .append('\n');
    }
  }
}
