package symgen.ui;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;
import org.apache.commons.cli.*;
import org.apache.logging.log4j.*;
import org.apache.logging.log4j.core.appender.*;
import org.apache.logging.log4j.core.config.Configurator;
import org.apache.logging.log4j.core.config.builder.api.*;
import org.apache.logging.log4j.core.config.builder.impl.*;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;
import symgen.SymGen;
import symgen.backend.Lang;
import symgen.frontend.Model;
import symgen.frontend.ModelReader;

public class SymGenCmd {
  // logging
  protected static Logger logger = null;

  // options for cmdline parser
  static Options options = new Options();

  // object and function for help text generation
  private static HelpFormatter helper = new HelpFormatter();
  private static void printHelpAndExit(Options options) {
    helper.printHelp("symgen - write the equations of a model in a target language", options);
    System.exit(-1);
  };

  // entrypoint
  public static void main(String[] args) {
    // initialize logging
    // get builder to create new appender
    ConfigurationBuilder<BuiltConfiguration> builder = ConfigurationBuilderFactory.newConfigurationBuilder();
    // generate appender for stdout writing
    AppenderComponentBuilder appenderBuilder =
        builder.newAppender("Stdout", "CONSOLE").addAttribute("target", ConsoleAppender.Target.SYSTEM_OUT);
    // set printing layout
    appenderBuilder.add(builder.newLayout("PatternLayout").addAttribute("pattern", "%-5level: %msg%n%throwable"));
    // create the appender and root logger for the defined pattern
    builder.add(appenderBuilder);
    builder.add(builder.newRootLogger(Level.OFF).add(builder.newAppenderRef("Stdout")));
    // initialize logging and generate logger for current class
    Configurator.initialize(builder.build());
    logger = LogManager.getLogger();

    CommandLineParser parser = new DefaultParser();

    String langNames = Arrays.stream(Lang.values()).map(lang -> lang.serialName).collect(Collectors.joining(", "));
    options.addOption(Option.builder("l")
                          .longOpt("lang")
                          .argName("language")
                          .hasArg()
                          .required(true)
                          .desc("Target language. Must be one of: " + langNames)
                          .build());
    options.addOption(Option.builder("i")
                          .longOpt("input")
                          .argName("model.yaml")
                          .hasArg()
                          .required(true)
                          .desc("YAML-file describing the sets, symbols and equations of the model")
                          .build());
    options.addOption(Option.builder("o")
                          .longOpt("output")
                          .argName("basename")
                          .hasArg()
                          .required(false)
                          .desc("Output path without extension; defaults to the input file name in the current directory")
                          .build());
    options.addOption(Option.builder("c")
                          .longOpt("config")
                          .argName("config.yaml")
                          .hasArg()
                          .required(false)
                          .desc("YAML-file with generation options")
                          .build());
    options.addOption(Option.builder("w")
                          .longOpt("width")
                          .argName("columns")
                          .hasArg()
                          .required(false)
                          .desc("Maximum line width, 0 for the target's default")
                          .build());
    options.addOption(Option.builder("n").longOpt("normalized").required(false).desc("Write equations as LHS - (RHS)").build());
    options.addOption(Option.builder("a").longOpt("alphabetic").required(false).desc("Enumerate set elements alphabetically").build());
    options.addOption(Option.builder().longOpt("calc").required(false).desc("TABLO formula mode").build());
    options.addOption(Option.builder("h").longOpt("help").required(false).desc("Print this message").build());
    options.addOption(Option.builder("q").longOpt("quiet").required(false).desc("Turn off all messages").build());
    options.addOption(Option.builder("v").longOpt("verbose").required(false).desc("Verbose printing").build());
    options.addOption(Option.builder("vv").longOpt("vverbose").required(false).desc("Print debug information and enable -v").build());

    //////////   collect options   //////////
    Lang lang = null;
    Path input = null;
    Path output = null;
    SymGenConfig config = new SymGenConfig();
    try {
      // print help if requested, before required options are checked
      if (Arrays.asList(args).contains("-h") || Arrays.asList(args).contains("--help"))
        printHelpAndExit(options);

      // parse the command line arguments
      CommandLine line = parser.parse(options, args);

      Optional<Lang> langOpt = Lang.fromSerialName(line.getOptionValue("l"));
      if (langOpt.isEmpty()) {
        System.err.println("Unknown language: " + line.getOptionValue("l"));
        printHelpAndExit(options);
      }
      lang = langOpt.get();

      input = Paths.get(line.getOptionValue("i"));
      String inputName = input.getFileName().toString();
      if (inputName.contains("."))
        inputName = inputName.substring(0, inputName.lastIndexOf('.'));
      output = line.hasOption("o") ? Paths.get(line.getOptionValue("o")) : Paths.get(inputName);

      if (line.hasOption("c"))
        config = readConfig(Paths.get(line.getOptionValue("c")));
      if (line.hasOption("w"))
        config.lineLength = Integer.parseInt(line.getOptionValue("w"));
      if (line.hasOption("n"))
        config.normalized = true;
      if (line.hasOption("a"))
        config.alphabeticElements = true;
      if (line.hasOption("calc"))
        config.calcMode = true;

      // set verbosity of printing
      Level logLvl = Level.INFO;
      if (line.hasOption("q"))
        logLvl = Level.OFF;
      if (line.hasOption("v"))
        logLvl = Level.DEBUG;
      if (line.hasOption("vv"))
        logLvl = Level.TRACE;
      Configurator.setAllLevels(LogManager.getRootLogger().getName(), logLvl);
    } catch (ParseException | NumberFormatException exp) {
      // parsing failed - raise error to user
      System.err.println(exp.getMessage());
      printHelpAndExit(options);
    } catch (IOException exp) {
      System.err.println("Cannot read configuration: " + exp.getMessage());
      printHelpAndExit(options);
    }

    //////////   read the model   //////////
    Model model;
    try {
      model = new ModelReader().read(input);
    } catch (IOException e) {
      logger.fatal("Cannot read model {}: {}", input, e.getMessage());
      System.exit(1);
      return;
    }

    //////////   invoke generation   //////////
    Path dir = output.getParent() != null ? output.getParent() : Paths.get("");
    boolean success = new SymGen(config).generate(lang, model, dir, output.getFileName().toString());

    System.exit(success ? 0 : 1);
  }

  // read generation options; keys are the field names of SymGenConfig
  static SymGenConfig readConfig(Path file) throws IOException {
    try (InputStream in = Files.newInputStream(file)) {
      SymGenConfig ret = new Yaml().loadAs(in, SymGenConfig.class);
      return ret != null ? ret : new SymGenConfig();
    } catch (YAMLException e) {
      throw new IOException(e.getMessage(), e);
    }
  }
}
