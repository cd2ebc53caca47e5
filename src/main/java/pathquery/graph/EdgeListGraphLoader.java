package pathquery.graph;

import pathquery.ErrorMessage;
import pathquery.QueryException;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads graphs stored as edge lists.
 *
 * Every line of the file is one edge {@code from to [label]}, with the fields
 * separated by whitespace or commas. Vertices are integers. An edge without a
 * label becomes an epsilon transition. Blank lines and lines starting with
 * {@code #} are skipped.
 *
 * A name is resolved by trying, in order: the name as a path; the name inside
 * the graph directory; the name with a {@code .csv} extension inside the
 * graph directory; the bundled classpath resource {@code graphs/<name>.csv}.
 */
public final class EdgeListGraphLoader implements GraphLoader {

  private static final Logger LOG = LoggerFactory.getLogger(EdgeListGraphLoader.class);

  private static final Pattern SEPARATOR = Pattern.compile("[\\s,]+");

  private static final String RESOURCE_DIRECTORY = "graphs/";

  private final Path graphDirectory;
  private final boolean allVerticesAreEndpoints;

  /**
   * @param graphDirectory directory in which graph names are resolved
   * @param allVerticesAreEndpoints whether every vertex of a loaded graph is
   *                                initial and accepting (otherwise none is)
   */
  public EdgeListGraphLoader(Path graphDirectory, boolean allVerticesAreEndpoints) {
    this.graphDirectory = graphDirectory;
    this.allVerticesAreEndpoints = allVerticesAreEndpoints;
  }

  @Override
  public Automaton load(String nameOrPath) {
    final List<Path> candidates = candidatePaths(nameOrPath);
    for (Path candidate : candidates) {
      if (Files.isRegularFile(candidate)) {
        try (Reader reader = Files.newBufferedReader(candidate, StandardCharsets.UTF_8)) {
          return loaded(nameOrPath, candidate.toString(), reader);
        } catch (IOException e) {
          throw QueryException.of(e, ErrorMessage.Load.GRAPH_UNREADABLE, nameOrPath, e.getMessage());
        }
      }
    }

    final String resource = RESOURCE_DIRECTORY + nameOrPath + ".csv";
    final InputStream stream = EdgeListGraphLoader.class.getClassLoader().getResourceAsStream(resource);
    if (stream != null) {
      try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
        return loaded(nameOrPath, "classpath:" + resource, reader);
      } catch (IOException e) {
        throw QueryException.of(e, ErrorMessage.Load.GRAPH_UNREADABLE, nameOrPath, e.getMessage());
      }
    }

    final var lookedFor = new ArrayList<String>();
    candidates.forEach(path -> lookedFor.add(path.toString()));
    lookedFor.add("classpath:" + resource);
    throw QueryException.of(ErrorMessage.Load.GRAPH_NOT_FOUND, nameOrPath, String.join(", ", lookedFor));
  }

  private List<Path> candidatePaths(String nameOrPath) {
    final var candidates = new ArrayList<Path>();
    resolve(nameOrPath).ifPresent(candidates::add);
    resolve(graphDirectory, nameOrPath).ifPresent(candidates::add);
    resolve(graphDirectory, nameOrPath + ".csv").ifPresent(candidates::add);
    return candidates;
  }

  private static Optional<Path> resolve(String path) {
    try {
      return Optional.of(Path.of(path));
    } catch (InvalidPathException e) {
      return Optional.empty();
    }
  }

  private static Optional<Path> resolve(Path directory, String path) {
    try {
      return Optional.of(directory.resolve(path));
    } catch (InvalidPathException e) {
      return Optional.empty();
    }
  }

  private Automaton loaded(String name, String source, Reader reader) throws IOException {
    final Automaton graph = read(name, reader);
    LOG.info("Loaded graph '{}' from {}: {}", name, source, graph.info());
    return graph;
  }

  /**
   * Read an edge list.
   *
   * @param name name of the graph (for error messages)
   * @param reader edge list
   * @return graph as an automaton
   */
  Automaton read(String name, Reader reader) throws IOException {
    final var builder = Automaton.builder();
    final var lines = new BufferedReader(reader);

    String line;
    int lineNumber = 0;
    while ((line = lines.readLine()) != null) {
      lineNumber++;
      final String trimmed = line.trim();
      if (trimmed.isEmpty() || trimmed.startsWith("#")) {
        continue;
      }

      final String[] fields = SEPARATOR.split(trimmed);
      if (fields.length < 2 || fields.length > 3) {
        throw QueryException.of(ErrorMessage.Load.MALFORMED_EDGE, name, lineNumber, trimmed);
      }

      final StateId from;
      final StateId to;
      try {
        from = StateId.of(Long.parseLong(fields[0]));
        to = StateId.of(Long.parseLong(fields[1]));
      } catch (NumberFormatException e) {
        throw QueryException.of(e, ErrorMessage.Load.MALFORMED_EDGE, name, lineNumber, trimmed);
      }

      if (fields.length == 3) {
        builder.addTransition(from, fields[2], to);
      } else {
        builder.addEpsilon(from, to);
      }
    }

    final Automaton graph = builder.build();
    if (allVerticesAreEndpoints) {
      return graph.withStart(graph.states()).withFinals(graph.states());
    }
    return graph;
  }
}
