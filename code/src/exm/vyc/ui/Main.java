/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.vyc.ui;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;

import exm.vyc.ast.ModuleNode;
import exm.vyc.ast.ParseTree;
import exm.vyc.ast.TreeBuilder;
import exm.vyc.ast.json.AstJson;
import exm.vyc.ast.json.ParseTreeReader;
import exm.vyc.common.Logging;
import exm.vyc.common.Settings;
import exm.vyc.common.exceptions.InvalidOptionException;
import exm.vyc.common.exceptions.UnsupportedSyntaxException;
import exm.vyc.common.exceptions.UserException;
import exm.vyc.common.exceptions.VYCFatal;
import exm.vyc.common.exceptions.VYCRuntimeError;
import exm.vyc.frontend.AstPipeline;

/**
 * Command line interface: reads a JSON parse tree, builds the typed tree,
 * optionally folds constants and writes the tree as JSON.  Other options
 * are passed indirectly through Java properties.  See Settings.java
 * for handling of these options.
 */
public class Main {
  private static final String FOLD_FLAG = "f";
  private static final String COMPACT_FLAG = "c";
  private static final String OUTPUT_FLAG = "o";
  private static final String HELP_FLAG = "h";

  public static void main(String[] args) {
    System.exit(run(args, System.out, System.err));
  }

  /**
   * @return exit code
   */
  public static int run(String[] args, PrintStream out, PrintStream err) {
    try {
      Args vycArgs = processArgs(args, out, err);
      Logger logger = setup(err);
      compile(logger, vycArgs, out, err);
      return ExitCode.SUCCESS.code();
    } catch (VYCFatal ex) {
      return ex.exitCode;
    } catch (VYCRuntimeError ex) {
      err.println("Internal error: " + ex.getMessage());
      Logging.getVYCLogger().error("Internal error", ex);
      return ExitCode.ERROR_INTERNAL.code();
    }
  }

  private static Options initOptions() {
    Options opts = new Options();
    opts.addOption(FOLD_FLAG, "fold", false,
                   "Replace constant expressions with their values");
    opts.addOption(COMPACT_FLAG, "compact", false,
                   "Write JSON without indentation");
    opts.addOption(OUTPUT_FLAG, "output", true,
                   "Write to file instead of standard output");
    opts.addOption(HELP_FLAG, "help", false, "Print this message");
    return opts;
  }

  private static Args processArgs(String[] args, PrintStream out,
                                  PrintStream err) {
    Options opts = initOptions();

    CommandLine cmd;
    try {
      CommandLineParser parser = new DefaultParser();
      cmd = parser.parse(opts, args);
    } catch (ParseException ex) {
      // Use Apache CLI-provided messages
      err.println(ex.getMessage());
      usage(opts, err);
      throw new VYCFatal(ExitCode.ERROR_COMMAND.code());
    }

    if (cmd.hasOption(HELP_FLAG)) {
      usage(opts, out);
      throw new VYCFatal(ExitCode.SUCCESS.code());
    }

    String[] remainingArgs = cmd.getArgs();
    if (remainingArgs.length != 1) {
      err.println("Expected one input file, but got " +
                  remainingArgs.length + " arguments");
      usage(opts, err);
      throw new VYCFatal(ExitCode.ERROR_COMMAND.code());
    }

    return new Args(remainingArgs[0], cmd.getOptionValue(OUTPUT_FLAG),
                    cmd.hasOption(FOLD_FLAG), cmd.hasOption(COMPACT_FLAG));
  }

  private static Logger setup(PrintStream err) {
    try {
      Settings.initProperties();
      String logfile = Settings.get(Settings.LOG_FILE);
      boolean trace = Settings.getBoolean(Settings.LOG_TRACE);
      return Logging.setupLogging(logfile, trace);
    } catch (InvalidOptionException ex) {
      err.println("Error setting up options: " + ex.getMessage());
      throw new VYCFatal(ExitCode.ERROR_COMMAND.code());
    }
  }

  private static void compile(Logger logger, Args args, PrintStream out,
                              PrintStream err) {
    String input = readInput(args.inputFilename, err);
    String json;
    try {
      ParseTree parsed = ParseTreeReader.read(input);
      ModuleNode module = TreeBuilder.fromSettings(logger).buildModule(parsed);
      logger.debug("Built tree with " + module.getDescendants().size() +
                   " nodes from " + args.inputFilename);

      if (args.fold) {
        AstPipeline.standard().runPipeline(logger, module);
      }

      boolean pretty = !args.compact &&
                        Settings.getBoolean(Settings.JSON_PRETTY);
      json = AstJson.toJson(module, pretty);
    } catch (UnsupportedSyntaxException ex) {
      err.println(args.inputFilename + ":" + ex.getMessage());
      throw new VYCFatal(ExitCode.ERROR_PARSER.code());
    } catch (UserException ex) {
      err.println(args.inputFilename + ":" + ex.getMessage());
      throw new VYCFatal(ExitCode.ERROR_USER.code());
    } catch (InvalidOptionException ex) {
      err.println("Error in options: " + ex.getMessage());
      throw new VYCFatal(ExitCode.ERROR_COMMAND.code());
    }

    writeOutput(json, args.outputFilename, out, err);
  }

  private static String readInput(String filename, PrintStream err) {
    try {
      return FileUtils.readFileToString(new File(filename),
                                        StandardCharsets.UTF_8);
    } catch (IOException ex) {
      err.println("Could not read input file " + filename + ": " +
                  ex.getMessage());
      throw new VYCFatal(ExitCode.ERROR_IO.code());
    }
  }

  private static void writeOutput(String json, String outputFilename,
                                  PrintStream out, PrintStream err) {
    if (outputFilename == null) {
      out.println(json);
      return;
    }
    try {
      FileUtils.writeStringToFile(new File(outputFilename), json + "\n",
                                  StandardCharsets.UTF_8);
    } catch (IOException ex) {
      err.println("Could not write output file " + outputFilename + ": " +
                  ex.getMessage());
      throw new VYCFatal(ExitCode.ERROR_IO.code());
    }
  }

  private static void usage(Options opts, PrintStream stream) {
    HelpFormatter fmt = new HelpFormatter();
    PrintWriter writer = new PrintWriter(stream);
    fmt.printHelp(writer, HelpFormatter.DEFAULT_WIDTH, "vyc-ast [options] "
        + "<input.json>", null, opts, HelpFormatter.DEFAULT_LEFT_PAD,
        HelpFormatter.DEFAULT_DESC_PAD, null);
    writer.flush();
  }

  private static class Args {
    public final String inputFilename;
    public final String outputFilename;
    public final boolean fold;
    public final boolean compact;

    public Args(String inputFilename, String outputFilename, boolean fold,
                boolean compact) {
      this.inputFilename = inputFilename;
      this.outputFilename = outputFilename;
      this.fold = fold;
      this.compact = compact;
    }
  }
}
