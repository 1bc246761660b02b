package com.example.dfasim.cli;

import com.example.dfasim.AutomatonSerializer;
import com.example.dfasim.DfaDefinition;
import com.example.dfasim.InvalidDefinitionException;
import com.example.dfasim.InvalidInputException;
import com.example.dfasim.LanguageEnumerator;
import com.example.dfasim.SimulationResult;
import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.helper.HelpScreenException;
import net.sourceforge.argparse4j.impl.Arguments;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.inf.Namespace;
import net.sourceforge.argparse4j.inf.Subparser;
import net.sourceforge.argparse4j.inf.Subparsers;

import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.*;
import java.util.regex.Pattern;

/**
 * Command-line front end: define a DFA, run strings through it, list the
 * strings it accepts, and load or save its JSON definition.
 */
public class DfaSimulatorCli {

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_USAGE = 2;

    private final PrintStream out;
    private final PrintStream err;

    public DfaSimulatorCli(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new DfaSimulatorCli(System.out, System.err).execute(args));
    }

    ArgumentParser buildParser() {
        ArgumentParser parser = ArgumentParsers.newFor("dfa-sim").build()
                .defaultHelp(true)
                .description("Deterministic finite automaton simulator");
        parser.addArgument("-v", "--verbose")
                .action(Arguments.storeTrue())
                .help("log engine activity to stderr");

        Subparsers commands = parser.addSubparsers().dest("command").title("commands");

        commands.addParser("examples").help("list the built-in sample automata");

        Subparser show = commands.addParser("show").help("validate a definition and print it as JSON");
        addSourceArguments(show);

        Subparser run = commands.addParser("run").help("run input strings through the automaton");
        addSourceArguments(run);
        run.addArgument("--separator")
                .help("split each input on this text instead of reading one character per symbol");
        run.addArgument("inputs")
                .nargs("*")
                .help("strings to evaluate (\"\" for the empty string)");

        Subparser generate = commands.addParser("generate").help("list accepted strings, shortest first");
        addSourceArguments(generate);
        generate.addArgument("-n", "--count")
                .type(Integer.class)
                .setDefault(LanguageEnumerator.DEFAULT_MAX_RESULTS)
                .help("maximum number of strings");
        generate.addArgument("--max-length")
                .type(Integer.class)
                .setDefault(LanguageEnumerator.DEFAULT_MAX_LENGTH)
                .help("maximum number of symbols per string");

        Subparser save = commands.addParser("save").help("write the definition to a JSON file");
        addSourceArguments(save);
        save.addArgument("-o", "--output")
                .required(true)
                .help("output file .json");

        return parser;
    }

    private static void addSourceArguments(Subparser parser) {
        parser.addArgument("-f", "--file").help("read the definition from a JSON file");
        parser.addArgument("-e", "--example").help("use a built-in sample automaton");
        parser.addArgument("--states").help("comma separated states");
        parser.addArgument("--alphabet").help("comma separated symbols");
        parser.addArgument("--initial").help("initial state");
        parser.addArgument("--accepting").help("comma separated accepting states");
        parser.addArgument("-t", "--transition")
                .action(Arguments.append())
                .help("transition as source,symbol,target (repeatable)");
    }

    public int execute(String[] args) {
        ArgumentParser parser = buildParser();
        Namespace ns;
        try {
            ns = parser.parseArgs(args);
        } catch (HelpScreenException e) {
            return EXIT_OK;
        } catch (ArgumentParserException e) {
            return usageError(e);
        }

        // slf4j-simple reads its level once, when the first logger is created;
        // no logger may be touched before this point
        if (ns.getBoolean("verbose")) {
            System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", "debug");
        }

        String command = ns.getString("command");
        try {
            if (command == null) {
                throw new ArgumentParserException("No command given", parser);
            }
            switch (command) {
                case "examples":
                    ExampleAutomata.names().forEach(out::println);
                    return EXIT_OK;
                case "show":
                    return show(parser, ns);
                case "run":
                    return run(parser, ns);
                case "generate":
                    return generate(parser, ns);
                case "save":
                    return save(parser, ns);
                default:
                    throw new ArgumentParserException("Unknown command: " + command, parser);
            }
        } catch (ArgumentParserException e) {
            return usageError(e);
        } catch (InvalidDefinitionException e) {
            err.println("Error in definition: " + e.getMessage());
            return EXIT_ERROR;
        } catch (IOException | IllegalStateException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        }
    }

    private int show(ArgumentParser parser, Namespace ns)
            throws ArgumentParserException, IOException, InvalidDefinitionException {
        AutomatonSession session = applySource(parser, ns);
        out.println(AutomatonSerializer.toJson(session.current().get().definition()));
        return EXIT_OK;
    }

    private int run(ArgumentParser parser, Namespace ns)
            throws ArgumentParserException, IOException, InvalidDefinitionException {
        AutomatonSession session = applySource(parser, ns);
        String separator = ns.getString("separator");
        List<String> inputs = ns.getList("inputs");
        if (inputs == null || inputs.isEmpty()) {
            throw new ArgumentParserException("No input strings given", parser);
        }

        int status = EXIT_OK;
        for (String input : inputs) {
            try {
                SimulationResult result = separator == null
                        ? session.run(input)
                        : session.run(tokenize(input, separator));
                TraceFormatter.formatRun(input, result).forEach(out::println);
            } catch (InvalidInputException e) {
                err.println("Error evaluating \"" + input + "\": " + e.getMessage());
                status = EXIT_ERROR;
            }
        }
        return status;
    }

    private int generate(ArgumentParser parser, Namespace ns)
            throws ArgumentParserException, IOException, InvalidDefinitionException {
        int count = ns.getInt("count");
        int maxLength = ns.getInt("max_length");
        if (count < 0 || maxLength < 0) {
            throw new ArgumentParserException("--count and --max-length must not be negative", parser);
        }
        AutomatonSession session = applySource(parser, ns);
        TraceFormatter.formatAccepted(session.enumerate(count, maxLength), count).forEach(out::println);
        return EXIT_OK;
    }

    private int save(ArgumentParser parser, Namespace ns)
            throws ArgumentParserException, IOException, InvalidDefinitionException {
        AutomatonSession session = applySource(parser, ns);
        if (!session.isDefined()) {
            throw new IllegalStateException("No automaton to save");
        }
        Path output = Paths.get(ns.getString("output"));
        try (Writer writer = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
            AutomatonSerializer.write(session.current().get().definition(), writer);
        }
        out.println("Saved automaton to " + output);
        return EXIT_OK;
    }

    private AutomatonSession applySource(ArgumentParser parser, Namespace ns)
            throws ArgumentParserException, IOException, InvalidDefinitionException {
        AutomatonSession session = new AutomatonSession();
        session.apply(readSource(parser, ns));
        return session;
    }

    DfaDefinition readSource(ArgumentParser parser, Namespace ns) throws ArgumentParserException, IOException {
        String file = ns.getString("file");
        String example = ns.getString("example");
        boolean raw = ns.getString("states") != null || ns.getString("alphabet") != null
                || ns.getString("initial") != null || ns.getString("accepting") != null
                || ns.getList("transition") != null;

        int sources = (file != null ? 1 : 0) + (example != null ? 1 : 0) + (raw ? 1 : 0);
        if (sources != 1) {
            throw new ArgumentParserException(
                    "Give exactly one definition source: --file, --example or the raw fields", parser);
        }

        if (file != null) {
            try (Reader reader = Files.newBufferedReader(Paths.get(file), StandardCharsets.UTF_8)) {
                return AutomatonSerializer.read(reader);
            }
        }
        if (example != null) {
            return ExampleAutomata.get(example).orElseThrow(() -> new ArgumentParserException(
                    "Unknown example '" + example + "', choose one of " + ExampleAutomata.names(), parser));
        }
        List<String> rows = ns.getList("transition");
        return RawFieldParser.parse(ns.getString("states"), ns.getString("alphabet"),
                ns.getString("initial"), ns.getString("accepting"), rows);
    }

    static List<String> tokenize(String input, String separator) {
        if (input.isEmpty()) {
            return Collections.emptyList();
        }
        return Arrays.asList(input.split(Pattern.quote(separator), -1));
    }

    private int usageError(ArgumentParserException e) {
        PrintWriter writer = new PrintWriter(err, true);
        if (e.getParser() != null) {
            e.getParser().printUsage(writer);
        }
        writer.println(e.getMessage());
        writer.flush();
        return EXIT_USAGE;
    }
}
