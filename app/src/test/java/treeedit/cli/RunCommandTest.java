package treeedit.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import treeedit.cost.EditCosts;

final class RunCommandTest {

  @TempDir Path tempDir;

  private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
  private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

  @Test
  void parsesAllOptions() {
    CliOptions options =
        new RunCommand(out)
            .parseRunArgs(
                new String[] {
                  "run",
                  "--example=chain",
                  "--format",
                  "json",
                  "--time-budget-ms",
                  "250",
                  "--max-solutions=9",
                  "--only-minimal",
                  "--deletion-cost",
                  "2",
                  "--insertion-cost=3",
                  "--substitution-cost",
                  "4"
                });

    assertEquals("chain", options.exampleName());
    assertEquals(CliOptions.OutputFormat.JSON, options.format());
    assertEquals(250, options.timeBudgetMs());
    assertEquals(9, options.maxSolutions());
    assertTrue(options.onlyMinimal());
    assertEquals(new EditCosts(2, 3, 4), options.costs());
    assertEquals(9, options.enumerationOptions().solutionLimit());
  }

  @Test
  void rejectsBadArguments() {
    RunCommand command = new RunCommand(out);

    assertThrows(
        IllegalArgumentException.class,
        () -> command.parseRunArgs(new String[] {"--example", "chain", "--bogus"}));
    assertThrows(
        IllegalArgumentException.class, () -> command.parseRunArgs(new String[] {"--file"}));
    assertThrows(
        IllegalArgumentException.class,
        () -> command.parseRunArgs(new String[] {"--example", "chain", "--format", "xml"}));
    assertThrows(
        IllegalArgumentException.class,
        () -> command.parseRunArgs(new String[] {"--example", "chain", "--max-solutions", "x"}));
    assertThrows(
        IllegalArgumentException.class,
        () -> command.parseRunArgs(new String[] {"--example", "chain", "--file", "a.txt"}),
        "Two inputs");
    assertThrows(
        IllegalArgumentException.class,
        () -> command.parseRunArgs(new String[] {"--only-minimal"}),
        "No input");
    assertThrows(
        IllegalArgumentException.class,
        () ->
            command.parseRunArgs(new String[] {"--example", "chain", "--deletion-cost", "-1"}));
  }

  @Test
  void printsTextReport() throws IOException {
    int exit = new RunCommand(out).execute(new String[] {"run", "--example", "dropped-child"});

    String text = output();
    assertEquals(RunCommand.EXIT_OK, exit);
    assertTrue(text.contains("Solution 1:\na -> lambda\nb -> lambda\nEdit distance: 3"), text);
    assertTrue(text.contains("Solution 2:\na -> a\nb -> lambda\nEdit distance: 1"), text);
    assertTrue(text.contains("Number of valid mappings: 2"), text);
    assertTrue(text.contains("Minimum edit distance: 1 (solution 2)"), text);
    assertTrue(text.contains("  delete(b, lambda)"), text);
  }

  @Test
  void readsTreeFile() throws IOException {
    Path file = tempDir.resolve("pair.txt");
    Files.write(file, List.of("1", "a -1", "1", "b -1"), StandardCharsets.UTF_8);

    int exit = new RunCommand(out).execute(new String[] {"--file", file.toString()});

    String text = output();
    assertEquals(RunCommand.EXIT_OK, exit);
    assertTrue(text.contains("a -> b\nEdit distance: 1"), text);
    assertTrue(text.contains("  substitute(a, b)"), text);
  }

  @Test
  void boundedRunExitsWithThree() throws IOException {
    int exit =
        new RunCommand(out)
            .execute(new String[] {"--example", "relabeled", "--max-solutions", "2"});

    assertEquals(RunCommand.EXIT_BOUNDED, exit);
    assertTrue(output().contains("Search stopped early: solution_limit_reached"), output());
  }

  private String output() {
    return buffer.toString(StandardCharsets.UTF_8);
  }
}
