package tome.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import tome.lang.Analyzer;
import tome.lang.Lexer;
import tome.lang.Parser;
import tome.lang.Program;
import tome.lang.ProgramPrinter;
import tome.lang.Severity;

import lombok.RequiredArgsConstructor;

/**
 * Command-line front end. Exit codes follow sysexits: 0 ok, 64 usage, 65 invalid script, 74 I/O.
 */
@RequiredArgsConstructor
public class Tome {

    private static final Logger LOG = LoggerFactory.getLogger(Tome.class);

    static final int EX_OK = 0;
    static final int EX_USAGE = 64;
    static final int EX_DATAERR = 65;
    static final int EX_IOERR = 74;

    static final String USAGE = String.join("\n",
        "Usage: tome check [--format text|json] [--level error|warning|info] [--no-color] <files...>",
        "       tome tokens [--no-color] <file>",
        "       tome graph [--no-color] <file>",
        "       tome print [--no-color] <file>");

    private final PrintStream out;
    private final PrintStream err;

    public static void main(String[] args) {
        System.exit(new Tome(System.out, System.err).run(args));
    }

    public int run(String... args) {
        if (args.length == 0) {
            return usage(null);
        }

        var command = args[0];
        Flags flags;
        try {
            flags = Flags.parse(List.of(args).subList(1, args.length));
        } catch (IllegalArgumentException ex) {
            return usage(ex.getMessage());
        }

        if (!"check".equals(command) && flags.files.size() != 1) {
            return usage("'" + command + "' takes exactly one file");
        }

        LOG.debug("running '{}' on {}", command, flags.files);
        switch (command) {
        case "check":
            return check(flags);
        case "tokens":
            return tokens(flags);
        case "graph":
            return graph(flags);
        case "print":
            return print(flags);
        default:
            return usage("unknown command '" + command + "'");
        }
    }

    private int usage(String problem) {
        if (problem != null) {
            err.println("tome: " + problem);
        }
        err.println(USAGE);
        return EX_USAGE;
    }

    //// commands ////

    private int check(Flags flags) {
        var reporter = reporter(flags);
        var ioFailure = false;
        var invalid = false;

        for (var file : flags.files) {
            var source = read(file, flags);
            if (source.isEmpty()) {
                ioFailure = true;
                continue;
            }

            var program = load(file, source.get(), reporter);
            if (program.isEmpty()) {
                invalid = true;
                continue;
            }

            var result = Analyzer.analyze(program.get());
            reporter.analysis(file, result);
            invalid |= !result.valid();
        }

        if (ioFailure) {
            return EX_IOERR;
        }
        return invalid ? EX_DATAERR : EX_OK;
    }

    private int tokens(Flags flags) {
        var file = flags.files.get(0);
        var source = read(file, flags);
        if (source.isEmpty()) {
            return EX_IOERR;
        }

        var lexed = new Lexer(source.get()).lex();
        if (!lexed.valid()) {
            reporter(flags).lexicalErrors(file, source.get(), lexed.errors());
            return EX_DATAERR;
        }
        lexed.tokens().forEach(out::println);
        return EX_OK;
    }

    private int graph(Flags flags) {
        return withProgram(flags, program ->
            out.println(JsonReporter.GSON.toJson(JsonReporter.network(program.network()))));
    }

    private int print(Flags flags) {
        return withProgram(flags, program -> out.print(new ProgramPrinter().print(program)));
    }

    private int withProgram(Flags flags, Consumer<Program> action) {
        var file = flags.files.get(0);
        var source = read(file, flags);
        if (source.isEmpty()) {
            return EX_IOERR;
        }
        var program = load(file, source.get(), new TextReporter(out, err, flags.color, Severity.ERROR));
        if (program.isEmpty()) {
            return EX_DATAERR;
        }
        action.accept(program.get());
        return EX_OK;
    }

    //// pipeline ////

    private Optional<String> read(String file, Flags flags) {
        try {
            return Optional.of(Files.readString(Paths.get(file), StandardCharsets.UTF_8));
        } catch (IOException | RuntimeException ex) {
            LOG.debug("failed to read {}", file, ex);
            var error = flags.color ? TextReporter.Color.RED.apply("Error") : "Error";
            err.println(error + " reading file " + file + ": " + describe(ex));
            return Optional.empty();
        }
    }

    private static String describe(Exception ex) {
        if (ex instanceof NoSuchFileException) {
            return "no such file";
        }
        return ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
    }

    /** Lexes and parses; reports and returns empty when either stage fails. */
    private Optional<Program> load(String file, String source, Reporter reporter) {
        var lexed = new Lexer(source).lex();
        if (!lexed.valid()) {
            reporter.lexicalErrors(file, source, lexed.errors());
            return Optional.empty();
        }

        var parsed = new Parser(lexed.tokens().iterator(), source).parse();
        if (!parsed.valid()) {
            reporter.syntaxErrors(file, parsed.errors());
            return Optional.empty();
        }
        return parsed.program();
    }

    private Reporter reporter(Flags flags) {
        if ("json".equals(flags.format)) {
            return new JsonReporter(out, flags.level);
        }
        return new TextReporter(out, err, flags.color, flags.level);
    }

    static class Flags {
        String format = "text";
        Severity level = Severity.ERROR;
        boolean color = true;
        final List<String> files = new ArrayList<>();

        static Flags parse(List<String> args) {
            var flags = new Flags();
            for (var i = 0; i < args.size(); i++) {
                var arg = args.get(i);
                switch (arg) {
                case "--format":
                case "-f":
                    flags.format = value(args, ++i, arg);
                    if (!"text".equals(flags.format) && !"json".equals(flags.format)) {
                        throw new IllegalArgumentException("unknown format '" + flags.format + "'");
                    }
                    break;
                case "--level":
                case "-l":
                    flags.level = Severity.fromLabel(value(args, ++i, arg));
                    break;
                case "--no-color":
                    flags.color = false;
                    break;
                default:
                    if (arg.startsWith("-")) {
                        throw new IllegalArgumentException("unknown flag '" + arg + "'");
                    }
                    flags.files.add(arg);
                }
            }
            if (flags.files.isEmpty()) {
                throw new IllegalArgumentException("no input files");
            }
            return flags;
        }

        private static String value(List<String> args, int index, String flag) {
            if (index >= args.size()) {
                throw new IllegalArgumentException("missing value for " + flag);
            }
            return args.get(index);
        }
    }
}
