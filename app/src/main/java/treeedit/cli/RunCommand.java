package treeedit.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import treeedit.core.EnumerationOptions;
import treeedit.core.MappingResult;
import treeedit.cost.EditCosts;
import treeedit.model.TreePair;
import treeedit.pipeline.MappingPipeline;

/** Handles the primary `run` command. */
final class RunCommand {
  private static final Logger LOG = LoggerFactory.getLogger(RunCommand.class);
  static final int EXIT_OK = 0;
  static final int EXIT_BOUNDED = 3;

  private final PrintStream out;

  RunCommand(PrintStream out) {
    this.out = out;
  }

  int execute(String[] args) throws IOException {
    CliOptions cliOptions = parseRunArgs(args);
    TreePair pair = CliParsers.loadPair(cliOptions);

    MappingResult result = new MappingPipeline().run(pair, cliOptions.enumerationOptions());

    String report =
        switch (cliOptions.format()) {
          case JSON -> new JsonReportBuilder().build(result);
          case TEXT -> new TextReportBuilder().build(result);
        };
    out.print(report);
    if (cliOptions.format() == CliOptions.OutputFormat.JSON) {
      out.println();
    }
    out.flush();

    logSummary(result);
    return result.isComplete() ? EXIT_OK : EXIT_BOUNDED;
  }

  CliOptions parseRunArgs(String[] args) {
    String[] effectiveArgs = stripCommand(args);
    CliOptions.Builder builder = CliOptions.builder();
    Map<String, OptionSpec> specs = optionSpecs();

    for (int i = 0; i < effectiveArgs.length; i++) {
      ParsedArg parsed = ParsedArg.parse(effectiveArgs[i]);
      OptionSpec spec = specs.get(parsed.option());
      if (spec == null) {
        throw new IllegalArgumentException("Unknown option: " + effectiveArgs[i]);
      }

      String value = parsed.value();
      if (spec.requiresValue() && (value == null || value.isBlank())) {
        if (i + 1 >= effectiveArgs.length) {
          throw new IllegalArgumentException("Missing value for " + parsed.option());
        }
        value = effectiveArgs[++i];
      }
      spec.apply(builder, value);
    }

    return builder.build();
  }

  private Map<String, OptionSpec> optionSpecs() {
    EnumerationOptions defaults = EnumerationOptions.defaults();
    EditCosts unit = EditCosts.unit();
    Map<String, OptionSpec> specs = new LinkedHashMap<>();
    specs.put("--file", OptionSpec.withValue((b, raw) -> b.treeFile(raw)));
    specs.put("--example", OptionSpec.withValue((b, raw) -> b.exampleName(raw)));
    specs.put(
        "--format", OptionSpec.withValue((b, raw) -> b.format(CliParsers.parseFormat(raw))));
    specs.put(
        "--time-budget-ms",
        OptionSpec.withValue(
            (b, raw) ->
                b.timeBudgetMs(
                    CliParsers.parseLong(raw, defaults.timeBudgetMs(), "--time-budget-ms"))));
    specs.put(
        "--max-solutions",
        OptionSpec.withValue(
            (b, raw) ->
                b.maxSolutions(
                    CliParsers.parseInt(raw, defaults.solutionLimit(), "--max-solutions"))));
    specs.put("--only-minimal", OptionSpec.flag(b -> b.onlyMinimal(true)));
    specs.put(
        "--deletion-cost",
        OptionSpec.withValue(
            (b, raw) ->
                b.deletionCost(CliParsers.parseInt(raw, unit.deletion(), "--deletion-cost"))));
    specs.put(
        "--insertion-cost",
        OptionSpec.withValue(
            (b, raw) ->
                b.insertionCost(CliParsers.parseInt(raw, unit.insertion(), "--insertion-cost"))));
    specs.put(
        "--substitution-cost",
        OptionSpec.withValue(
            (b, raw) ->
                b.substitutionCost(
                    CliParsers.parseInt(raw, unit.substitution(), "--substitution-cost"))));
    return specs;
  }

  private String[] stripCommand(String[] args) {
    if (args == null || args.length == 0) {
      return new String[0];
    }
    if ("run".equalsIgnoreCase(args[0])) {
      return Arrays.copyOfRange(args, 1, args.length);
    }
    return args;
  }

  private void logSummary(MappingResult result) {
    LOG.info("Enumeration took {} ms", result.elapsedMillis());
    LOG.info("Valid mappings: {}", result.totalMappings());
    LOG.info(
        "Minimum edit distance: {} (solution {})",
        result.minimumCost(),
        result.summary().witness().index() + 1);
    if (!result.isComplete()) {
      LOG.info("Result is partial ({}).", result.terminationReason());
    }
  }

  private record ParsedArg(String option, String value) {
    static ParsedArg parse(String raw) {
      if (raw == null || raw.isBlank()) {
        throw new IllegalArgumentException("Unknown option: " + raw);
      }
      if (raw.startsWith("--")) {
        int equalsIndex = raw.indexOf('=');
        if (equalsIndex > 0) {
          String value = raw.substring(equalsIndex + 1);
          return new ParsedArg(raw.substring(0, equalsIndex), value.isEmpty() ? null : value);
        }
      }
      return new ParsedArg(raw, null);
    }
  }

  private record OptionSpec(boolean requiresValue, BiConsumer<CliOptions.Builder, String> apply) {
    static OptionSpec withValue(BiConsumer<CliOptions.Builder, String> consumer) {
      return new OptionSpec(true, consumer);
    }

    static OptionSpec flag(Consumer<CliOptions.Builder> consumer) {
      return new OptionSpec(false, (builder, ignored) -> consumer.accept(builder));
    }

    void apply(CliOptions.Builder builder, String value) {
      apply.accept(builder, value);
    }
  }
}
