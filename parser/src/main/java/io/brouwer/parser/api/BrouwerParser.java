package io.brouwer.parser.api;

import io.brouwer.parser.ast.Node;
import io.brouwer.parser.impl.Cursor;
import io.brouwer.parser.impl.Grammar;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point turning brouwer source text into an immutable {@link Node} tree.
 *
 * <p>A parser holds nothing but its {@link ParserOptions} and may be shared between threads; every
 * call to {@code parse} works on its own cursor.
 *
 * <pre>{@code
 * Node root = BrouwerParser.create().parse(Path.of("Main.br"));
 * AstPrinter.print(root, System.out);
 * }</pre>
 */
public final class BrouwerParser {

  private static final Logger LOG = LoggerFactory.getLogger(BrouwerParser.class);

  private final ParserOptions options;

  private BrouwerParser(ParserOptions options) {
    this.options = Objects.requireNonNull(options, "options");
  }

  /** Creates a parser configured from system properties. */
  public static BrouwerParser create() {
    return create(ParserOptions.defaults());
  }

  public static BrouwerParser create(ParserOptions options) {
    return new BrouwerParser(options);
  }

  public ParserOptions options() {
    return options;
  }

  /**
   * Parses an in-memory source.
   *
   * @return the {@code Root} node
   * @throws BrouwerSyntaxException on the first syntax error
   * @throws EmptyProgramException if the source has no module declaration
   */
  public Node parse(CharSequence source) {
    return parse(Objects.requireNonNull(source, "source"), "<input>");
  }

  /**
   * Reads {@code file} as strict UTF-8 and parses it.
   *
   * @throws IOException if the file cannot be read or is not valid UTF-8
   */
  public Node parse(Path file) throws IOException {
    StringWriter text = new StringWriter();
    try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      reader.transferTo(text);
    }
    return parse(text.toString(), file.toString());
  }

  private Node parse(CharSequence source, String sourceName) {
    long start = System.nanoTime();
    LOG.debug("Parsing {} ({} chars)", sourceName, source.length());
    Node root = new Grammar(new Cursor(source), options).parseRoot();
    if (LOG.isDebugEnabled()) {
      LOG.debug("Parsed {} in {} ms", sourceName, (System.nanoTime() - start) / 1_000_000);
    }
    return root;
  }
}
