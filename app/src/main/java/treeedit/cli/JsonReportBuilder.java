package treeedit.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import treeedit.core.MappingResult;
import treeedit.cost.EditOperation;
import treeedit.cost.ScoredMapping;
import treeedit.mapping.EditMapping;
import treeedit.model.LabeledTree;
import treeedit.pipeline.EnumerationRun;

final class JsonReportBuilder {
  private static final String VERSION = "1.0.0";
  private final Gson gson = new GsonBuilder().setPrettyPrinting().create();

  String build(MappingResult result) {
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("meta", meta(result));
    root.put("trees", trees(result));
    root.put("solutions", solutions(result.mappings()));
    root.put("minimum", minimum(result));
    if (result.terminationReason() != null) {
      root.put("termination_reason", result.terminationReason());
    }
    return gson.toJson(root);
  }

  private Map<String, Object> meta(MappingResult result) {
    EnumerationRun run = result.run();
    Map<String, Object> meta = new LinkedHashMap<>();
    meta.put("version", VERSION);
    meta.put("time_ms", run.totalMs());
    meta.put("search_ms", run.searchMs());
    meta.put("branches_explored", run.branchesExplored());
    meta.put("total_mappings", result.totalMappings());
    meta.put("only_minimal", result.options().onlyMinimal());
    Map<String, Object> costs = new LinkedHashMap<>();
    costs.put("deletion", result.options().costs().deletion());
    costs.put("insertion", result.options().costs().insertion());
    costs.put("substitution", result.options().costs().substitution());
    meta.put("costs", costs);
    return meta;
  }

  private Map<String, Object> trees(MappingResult result) {
    Map<String, Object> trees = new LinkedHashMap<>();
    trees.put("source", treeSummary(result.source()));
    trees.put("target", treeSummary(result.target()));
    return trees;
  }

  private Map<String, Object> treeSummary(LabeledTree tree) {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("shape", tree.toString());
    map.put("size", tree.size());
    return map;
  }

  private List<Map<String, Object>> solutions(List<ScoredMapping> mappings) {
    List<Map<String, Object>> list = new ArrayList<>(mappings.size());
    for (ScoredMapping scored : mappings) {
      Map<String, Object> map = new LinkedHashMap<>();
      map.put("index", scored.index() + 1);
      map.put("cost", scored.cost());
      map.put("pairs", pairs(scored.mapping()));
      list.add(map);
    }
    return list;
  }

  private List<Map<String, Object>> pairs(EditMapping mapping) {
    LabeledTree source = mapping.source();
    LabeledTree target = mapping.target();
    List<Map<String, Object>> pairs = new ArrayList<>(mapping.size());
    for (int node : source.nodesInPreorder()) {
      Map<String, Object> pair = new LinkedHashMap<>();
      pair.put("source", source.label(node));
      pair.put("target", target.label(mapping.imageOf(node)));
      pair.put("deleted", mapping.isDeleted(node));
      pairs.add(pair);
    }
    return pairs;
  }

  private Map<String, Object> minimum(MappingResult result) {
    Map<String, Object> minimum = new LinkedHashMap<>();
    minimum.put("cost", result.minimumCost());
    minimum.put("solution", result.summary().witness().index() + 1);
    minimum.put("minimal_count", result.summary().minimalCount());
    Map<String, Integer> histogram = new LinkedHashMap<>();
    result.summary().histogram().forEach((cost, count) -> histogram.put(cost.toString(), count));
    minimum.put("cost_histogram", histogram);
    List<Map<String, Object>> script = new ArrayList<>();
    for (EditOperation op : result.witnessScript().operations()) {
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("op", op.type().name().toLowerCase(Locale.ROOT));
      entry.put("source", op.sourceLabel());
      entry.put("target", op.targetLabel());
      entry.put("cost", op.cost());
      script.add(entry);
    }
    minimum.put("edit_script", script);
    return minimum;
  }
}
