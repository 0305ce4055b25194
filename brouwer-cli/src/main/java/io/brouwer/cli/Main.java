package io.brouwer.cli;

import io.brouwer.parser.api.BrouwerParser;
import io.brouwer.parser.api.BrouwerSyntaxException;
import io.brouwer.parser.api.EmptyProgramException;
import io.brouwer.parser.ast.AstPrinter;
import io.brouwer.parser.ast.Node;
import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/** Parses a brouwer source file and prints its syntax tree. */
@CommandLine.Command(
    name = "brouwer",
    description = "Parse a brouwer source file and print its syntax tree",
    version = "0.1.0",
    mixinStandardHelpOptions = true)
public class Main implements Callable<Integer> {

  private static final Logger LOG = LoggerFactory.getLogger(Main.class);

  static final int EXIT_OK = 0;
  static final int EXIT_ERROR = 1;
  static final int EXIT_NO_PROGRAM = 2;

  @CommandLine.Parameters(index = "0", paramLabel = "FILE", description = "Source file to parse")
  private Path file;

  public static void main(String[] args) {
    int exitCode = commandLine().execute(args);
    System.exit(exitCode);
  }

  static CommandLine commandLine() {
    CommandLine commandLine = new CommandLine(new Main());
    commandLine.getCommandSpec().exitCodeOnInvalidInput(EXIT_ERROR);
    return commandLine;
  }

  @Override
  public Integer call() {
    Node root;
    try {
      root = BrouwerParser.create().parse(file);
    } catch (IOException e) {
      LOG.debug("Failed to read {}", file, e);
      System.err.println("Error: cannot read " + file + ": " + describe(e));
      return EXIT_ERROR;
    } catch (BrouwerSyntaxException e) {
      System.err.println("syntax error: " + e.getMessage());
      return EXIT_ERROR;
    } catch (EmptyProgramException e) {
      System.err.println(e.getMessage());
      return EXIT_NO_PROGRAM;
    }
    AstPrinter.print(root, System.out);
    System.out.flush();
    return EXIT_OK;
  }

  private static String describe(IOException e) {
    String message = e.getMessage();
    return message == null ? e.getClass().getSimpleName() : message;
  }
}
