package treeedit.cli;

import java.io.IOException;
import java.io.PrintStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import treeedit.examples.Example;

/**
 * Command-line entrypoint.
 *
 * <p>Usage:
 *
 * <ul>
 *   <li>{@code run (--file <path> | --example <name>) [options]} enumerates and scores mappings
 *   <li>{@code examples} lists the built-in tree pairs
 * </ul>
 */
public final class Main {
  private static final Logger LOG = LoggerFactory.getLogger(Main.class);
  static final int EXIT_ERROR = 1;

  private Main() {}

  public static void main(String[] args) {
    System.exit(run(args, System.out, System.err));
  }

  static int run(String[] args, PrintStream out, PrintStream err) {
    String command = args != null && args.length > 0 ? args[0] : "";
    try {
      if ("examples".equalsIgnoreCase(command)) {
        for (String name : Example.names()) {
          out.println(name);
        }
        return RunCommand.EXIT_OK;
      }
      if ("help".equalsIgnoreCase(command) || "--help".equals(command) || command.isEmpty()) {
        printUsage(out);
        return command.isEmpty() ? EXIT_ERROR : RunCommand.EXIT_OK;
      }
      return new RunCommand(out).execute(args);
    } catch (IllegalArgumentException | IOException ex) {
      LOG.error("{}", ex.getMessage());
      err.println("Error: " + ex.getMessage());
      printUsage(err);
      return EXIT_ERROR;
    }
  }

  private static void printUsage(PrintStream stream) {
    stream.println(
        """
        Usage:
          run (--file <path> | --example <name>) [options]
          examples

        Options:
          --format text|json          output format (default text)
          --time-budget-ms <ms>       stop the search after this budget (0 = unbounded)
          --max-solutions <n>         stop after n mappings (0 = unbounded)
          --only-minimal              report only minimum-cost mappings
          --deletion-cost <n>         weight of a deletion (default 1)
          --insertion-cost <n>        weight of an insertion (default 1)
          --substitution-cost <n>     weight of a substitution (default 1)""");
  }
}
