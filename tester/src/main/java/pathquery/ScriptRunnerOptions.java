package pathquery;

import pathquery.eval.QueryOptions;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

/**
 * Command-line options of the script runner.
 */
public class ScriptRunnerOptions {

  private static final String GRAPH_DIR = "d";
  private static final String OUTPUT = "o";
  private static final String PARALLEL = "p";
  private static final String MAX_STATES = "m";
  private static final String ENDPOINTS = "e";
  private static final String CASES = "c";
  private static final String HELP = "h";

  private final Options options;
  private final CommandLine cmd;

  private ScriptRunnerOptions(Options options, CommandLine cmd) {
    this.options = options;
    this.cmd = cmd;
  }

  private static Options defaultOptions() {
    final var options = new Options();
    options.addOption(GRAPH_DIR, "graph-dir", true, "directory in which graph names are resolved");
    options.addOption(OUTPUT, "output", true, "rendering of printed graphs: summary or dot");
    options.addOption(PARALLEL, "parallel", false, "compute reachable pairs on several threads");
    options.addOption(MAX_STATES, "max-states", true, "largest product automaton to build");
    options.addOption(ENDPOINTS, "default-endpoints", true, "endpoints of loaded graphs: all or none");
    options.addOption(CASES, "cases", false, "treat the files as golden case files");
    options.addOption(HELP, "help", false, "print usage message");
    return options;
  }

  public static ScriptRunnerOptions create(String[] args) throws ParseException {
    final Options options = defaultOptions();
    final CommandLine cmd = new DefaultParser().parse(options, args);
    return new ScriptRunnerOptions(options, cmd);
  }

  public void printUsage(PrintStream sout) {
    final var helpFormatter = new HelpFormatter();
    final var printWriter = new PrintWriter(new OutputStreamWriter(sout, StandardCharsets.UTF_8));
    helpFormatter.printHelp(
      printWriter,
      helpFormatter.getWidth(),
      "pathquery [options] files...",
      null,
      options,
      helpFormatter.getLeftPadding(),
      helpFormatter.getDescPadding(),
      null
    );
    printWriter.flush();
  }

  public boolean displayHelp() {
    return cmd.hasOption(HELP) || cmd.getArgList().isEmpty();
  }

  public boolean runCases() {
    return cmd.hasOption(CASES);
  }

  public List<Path> getFiles() {
    return cmd.getArgList().stream().map(Paths::get).collect(Collectors.toList());
  }

  /**
   * Settings for the programs run.
   *
   * @throws ParseException if an option value is not understood
   */
  public QueryOptions getQueryOptions() throws ParseException {
    final var builder = QueryOptions.builder().parallelReachability(cmd.hasOption(PARALLEL));

    final String graphDir = cmd.getOptionValue(GRAPH_DIR);
    if (graphDir != null) {
      builder.graphDirectory(Paths.get(graphDir));
    }

    final String output = cmd.getOptionValue(OUTPUT);
    if (output != null) {
      builder.outputFormat(parseEnum(QueryOptions.OutputFormat.class, OUTPUT, output));
    }

    final String endpoints = cmd.getOptionValue(ENDPOINTS);
    if ("all".equalsIgnoreCase(endpoints)) {
      builder.defaultEndpoints(QueryOptions.DefaultEndpoints.ALL_VERTICES);
    } else if ("none".equalsIgnoreCase(endpoints)) {
      builder.defaultEndpoints(QueryOptions.DefaultEndpoints.NO_VERTICES);
    } else if (endpoints != null) {
      throw new ParseException("Unknown value '" + endpoints + "' for option -" + ENDPOINTS);
    }

    final String maxStates = cmd.getOptionValue(MAX_STATES);
    if (maxStates != null) {
      try {
        builder.maxProductStates(Long.parseLong(maxStates));
      } catch (IllegalArgumentException e) {
        throw new ParseException("Invalid value '" + maxStates + "' for option -" + MAX_STATES);
      }
    }

    return builder.build();
  }

  private static <E extends Enum<E>> E parseEnum(Class<E> type, String option, String value)
      throws ParseException {
    try {
      return Enum.valueOf(type, value.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new ParseException("Unknown value '" + value + "' for option -" + option);
    }
  }
}
