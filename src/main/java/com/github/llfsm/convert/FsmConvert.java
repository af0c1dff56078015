package com.github.llfsm.convert;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.llfsm.Diagnostic;
import com.github.llfsm.LLFSMException;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import picocli.CommandLine.Model.CommandSpec;

/**
 * Command line front end of the {@link Converter}.
 */
@Command(name = "fsmconvert", mixinStandardHelpOptions = true,
    description = "Convert LLFSM machines between languages or combine them into an arrangement")
public final class FsmConvert implements Callable<Integer> {
  private static final Logger logger = LogManager.getLogger(FsmConvert.class.getSimpleName());

  @Spec
  private CommandSpec spec;

  @Parameters(paramLabel = "<machine>", arity = "1..*",
      description = "Machine directories, with or without the .machine extension")
  private List<Path> inputs;

  @Option(names = {"-a", "--arrangement"},
      description = "Create an arrangement, even from a single machine")
  private boolean arrangement;

  @Option(names = {"-f", "--format"}, paramLabel = "<fmt>",
      description = "Output format: c, c++, objc++, vhdl (default: the input's language)")
  private String format;

  @Option(names = {"-i", "--introspectable"}, description = "Generate state name lookups")
  private boolean introspectable;

  @Option(names = {"-n", "--non-suspensible"}, description = "Generate non-suspensible code")
  private boolean nonSuspensible;

  @Option(names = {"-o", "--output"}, paramLabel = "<path>",
      description = "Output directory (default: rewrite a single machine in place)")
  private Path output;

  @Option(names = {"-v", "--verbose"}, description = "Print a summary of what was converted")
  private boolean verbose;

  private final Converter converter;

  public FsmConvert() {
    this(new Converter());
  }

  FsmConvert(final Converter converter) {
    this.converter = converter;
  }

  @Override
  public Integer call() {
    final PrintWriter out = spec.commandLine().getOut();
    final PrintWriter err = spec.commandLine().getErr();
    try {
      final ConversionRequest request = ConversionRequest.ConversionRequestBuilder.newBuilder()
          .inputs(inputs).format(format).arrangement(arrangement).suspensible(!nonSuspensible)
          .introspectable(introspectable).output(output).verbose(verbose).build();
      final ConversionSummary summary = converter.convert(request);
      for (final Diagnostic diagnostic : summary.getDiagnostics()) {
        err.println("warning: " + diagnostic);
      }
      if (request.isVerbose()) {
        out.println(summary.describe());
      }
      out.flush();
      err.flush();
      return 0;
    } catch (LLFSMException conversionIssue) {
      logger.debug("Conversion failed", conversionIssue);
      err.println("fsmconvert: " + conversionIssue.getMessage());
      err.flush();
      return 1;
    }
  }

  public static int run(final String... args) {
    return new CommandLine(new FsmConvert()).execute(args);
  }

  public static void main(final String[] args) {
    System.exit(run(args));
  }

}
