package DFAMin;

import DFAMin.Completeness.CompletenessAnalyzer;
import DFAMin.Completeness.MissingTransition;
import DFAMin.Completeness.Statistics;
import DFAMin.Minimization.MinimizationResult;
import DFAMin.Minimization.MooreMinimizer;
import DFAMin.Model.AutomatonModel;
import DFAMin.Model.AutomatonValidator;
import DFAMin.Model.InvalidAutomatonException;
import DFAMin.Serialization.AutomatonSerializer;
import DFAMin.Serialization.BAExport;
import DFAMin.Simulation.BatchResult;
import DFAMin.Simulation.SimulationEngine;
import DFAMin.Simulation.SimulationResult;

import java.io.BufferedReader;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

public class DFAMinCommandLine {
  static final String EXAMPLE_PREFIX = "example:";
  static final int EXIT_OK = 0;
  static final int EXIT_INVALID = 1;

  public static void main(String[] args) {
    String baFilename = null;
    List<String> positional = new ArrayList<>(2);

    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if ("--debug".equalsIgnoreCase(arg)) {
        // must happen before the first logger is created
        System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", "debug");
      } else if ("--writeBA".equalsIgnoreCase(arg)) {
        if (i + 1 >= args.length || args[i + 1].startsWith("-")) {
          System.err.println("Missing value for --writeBA");
          printUsageAndExit();
        }
        baFilename = args[++i];
      } else if (arg.startsWith("-")) {
        printUsageAndExit();
      } else {
        positional.add(arg);
      }
    }

    if (positional.size() == 1 && "examples".equalsIgnoreCase(positional.get(0))) {
      listExamples(System.out);
      return;
    }
    if (positional.size() < 2) {
      printUsageAndExit();
    }

    int code = run(positional.get(0), positional.get(1), positional.subList(2, positional.size()),
        baFilename, System.in, System.out);
    if (code != EXIT_OK) {
      System.exit(code);
    }
  }

  private static void printUsageAndExit() {
    System.out.println(
        "DFAMin [--debug] [--writeBA <BA output file>] <command> <JSON file | example:<name>> [inputs...]");
    System.out.println("[--debug] : Log every refinement round and simulation crash");
    System.out.println("[--writeBA <BA output file>] : Write the (minimized) DFA to the specified file in BA format");
    System.out.println();
    System.out.println("<command> : one of the choices below:");
    System.out.println("  stats: statistics and missing transitions.");
    System.out.println("  simulate <input>...: run each input, one symbol per character.");
    System.out.println("  batch: run every line read from standard input.");
    System.out.println("  minimize: Moore minimization; prints the refinement trace and minimized DFA as JSON.");
    System.out.println("  examples: list the bundled examples (no file needed).");
    System.out.println();
    System.out.println("<JSON file> : automaton in the interchange format {states, transitions, alphabet}.");
    System.out.println("example:<name> : one of " + ExampleAutomata.names());
    System.exit(0);
  }

  /**
   * Run one command.
   * @param command - stats, simulate, batch or minimize
   * @param source - JSON file path, or example:name
   * @param inputs - inputs for simulate
   * @param baFilename - BA output file, or null
   * @return process exit code
   */
  static int run(String command, String source, List<String> inputs, String baFilename,
                 InputStream in, PrintStream out) {
    final AutomatonModel model;
    try {
      model = load(source);
    } catch (InvalidAutomatonException e) {
      out.println("Invalid automaton:");
      e.getProblems().forEach(p -> out.println("  " + p));
      return EXIT_INVALID;
    }

    switch (command.toLowerCase(Locale.ROOT)) {
      case "stats" -> stats(model, out);
      case "simulate" -> {
        for (String input : inputs) {
          printResult(input, SimulationEngine.simulate(model, input), out);
        }
      }
      case "batch" -> batch(model, in, out);
      case "minimize" -> {
        MinimizationResult result = MooreMinimizer.minimize(model);
        out.println(AutomatonSerializer.toJson(result));
        out.println("Original DFA size: " + result.getOriginalStateCount());
        out.println("Minimized DFA size: " + result.getMinimizedStateCount());
        if (baFilename != null) {
          return writeBAFile(baFilename, result.getMinimized(), out);
        }
        return EXIT_OK;
      }
      default -> throw new IllegalStateException("Unexpected command: " + command);
    }
    if (baFilename != null) {
      return writeBAFile(baFilename, model, out);
    }
    return EXIT_OK;
  }

  static AutomatonModel load(String source) throws InvalidAutomatonException {
    if (source.startsWith(EXAMPLE_PREFIX)) {
      String name = source.substring(EXAMPLE_PREFIX.length());
      if (!ExampleAutomata.names().contains(name)) {
        throw new InvalidAutomatonException("Unknown example '" + name + "', expected one of " + ExampleAutomata.names());
      }
      return ExampleAutomata.load(name);
    }
    try (InputStream is = new FileInputStream(source)) {
      return AutomatonSerializer.read(is);
    } catch (IOException ex) {
      throw new UncheckedIOException(ex);
    }
  }

  private static void stats(AutomatonModel model, PrintStream out) {
    Statistics stats = CompletenessAnalyzer.statistics(model);
    out.println("States: " + stats.stateCount());
    out.println("Final states: " + stats.finalStateCount());
    out.println("Transitions: " + stats.transitionCount());
    out.println("Alphabet size: " + stats.alphabetSize());
    out.println("Completeness: " + String.format(Locale.ROOT, "%.1f", stats.completenessPercent()) + "%");
    out.println("Complete: " + stats.isComplete());
    List<MissingTransition> missing = CompletenessAnalyzer.missingTransitions(model);
    if (!missing.isEmpty()) {
      out.println("Missing transitions: "
          + missing.stream().map(MissingTransition::toString).collect(Collectors.joining(" ")));
    }
    for (String problem : AutomatonValidator.validate(model)) {
      out.println("Warning: " + problem);
    }
  }

  private static void batch(AutomatonModel model, InputStream in, PrintStream out) {
    BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
    List<String> lines = reader.lines().collect(Collectors.toList());
    int passed = 0;
    List<BatchResult> results = SimulationEngine.batch(model, lines);
    for (BatchResult r : results) {
      out.println((r.accepted() ? "PASS " : "FAIL ") + r.input()
          + (r.error() != null ? " (" + r.error() + ")" : ""));
      if (r.accepted()) {
        passed++;
      }
    }
    out.println(passed + "/" + results.size() + " accepted");
  }

  private static void printResult(String input, SimulationResult result, PrintStream out) {
    String verdict = switch (result.outcome()) {
      case ACCEPTED -> "ACCEPTED";
      case REJECTED -> "REJECTED";
      case STUCK -> "REJECTED (stuck at " + result.stuckAt() + ": " + result.reason() + ")";
      case NO_START_STATE -> "REJECTED (" + result.reason() + ")";
    };
    out.println("\"" + input + "\": " + verdict + " path " + result.path());
  }

  private static void listExamples(PrintStream out) {
    for (String name : ExampleAutomata.names()) {
      out.println(name + " - " + ExampleAutomata.describe(name));
    }
  }

  private static int writeBAFile(String filename, AutomatonModel model, PrintStream out) {
    out.println("Writing to file: " + filename);
    try (OutputStream os = new FileOutputStream(filename)) {
      BAExport.write(model, os);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    } catch (InvalidAutomatonException e) {
      out.println("Cannot write BA file: " + e.getMessage());
      return EXIT_INVALID;
    }
    return EXIT_OK;
  }
}
