package tome.cli;

import java.io.PrintStream;
import java.util.List;

import com.google.common.base.Strings;

import tome.lang.AnalysisResult;
import tome.lang.Diagnostic;
import tome.lang.LexError;
import tome.lang.ParserError;
import tome.lang.Severity;

import lombok.RequiredArgsConstructor;

/**
 * Compiler-style text output, one {@code path:line:col: severity: message} line per finding.
 * Lexical and syntax errors are followed by a caret excerpt of the offending line. Errors and
 * warnings go to stderr, suggestions and success messages to stdout.
 */
@RequiredArgsConstructor
class TextReporter implements Reporter {

    enum Color {
        RED(31), GREEN(32), YELLOW(33), BLUE(34), CYAN(36);

        private final int code;

        Color(int code) {
            this.code = code;
        }

        String apply(String text) {
            return "\u001b[" + code + "m" + text + "\u001b[39m";
        }
    }

    private record Line(int line, int column, Severity severity, String message, String excerpt) {}

    private final PrintStream out;
    private final PrintStream err;
    private final boolean color;
    private final Severity level;

    @Override
    public void lexicalErrors(String file, String source, List<LexError> errors) {
        print(file, errors.stream()
            .map(e -> new Line(e.line(), e.column(), Severity.ERROR, e.message(), e.excerpt(source).orElse(null)))
            .toList());
    }

    @Override
    public void syntaxErrors(String file, List<ParserError> errors) {
        print(file, errors.stream()
            .map(e -> new Line(e.line(), e.column(), Severity.ERROR, e.message(), e.excerpt().orElse(null)))
            .toList());
    }

    @Override
    public void analysis(String file, AnalysisResult result) {
        var diagnostics = result.diagnostics(level);
        if (diagnostics.isEmpty() && result.valid()) {
            out.println(style(Color.GREEN, "Analysis of " + file + " completed successfully. No issues found."));
            return;
        }
        print(file, diagnostics.stream()
            .map(TextReporter::line)
            .toList());
    }

    private static Line line(Diagnostic diagnostic) {
        return new Line(diagnostic.line(), diagnostic.column(), diagnostic.severity(), diagnostic.message(), null);
    }

    private void print(String file, List<Line> lines) {
        var width = lines.stream()
            .mapToInt(l -> location(file, l).length())
            .max()
            .orElse(0);

        for (var l : lines) {
            var location = location(file, l);
            var padding = Strings.repeat(" ", width - location.length());
            var text = style(Color.CYAN, location) + padding + " " + label(l.severity()) + " " + l.message();
            var stream = l.severity() == Severity.INFO ? out : err;
            stream.println(text);
            if (l.excerpt() != null) {
                stream.println(l.excerpt());
            }
        }
    }

    private static String location(String file, Line line) {
        return file + ":" + line.line() + ":" + line.column() + ":";
    }

    private String label(Severity severity) {
        var label = severity.label() + ":";
        switch (severity) {
        case ERROR:
            return style(Color.RED, label);
        case WARNING:
            return style(Color.YELLOW, label);
        default:
            return style(Color.BLUE, label);
        }
    }

    private String style(Color c, String text) {
        return color ? c.apply(text) : text;
    }
}
