package tome.cli;

import java.io.PrintStream;
import java.util.List;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import tome.lang.AnalysisResult;
import tome.lang.AnalysisSuggestion;
import tome.lang.Diagnostic;
import tome.lang.LexError;
import tome.lang.NodeNetwork;
import tome.lang.ParserError;
import tome.lang.Severity;

import lombok.RequiredArgsConstructor;

/**
 * Prints one JSON envelope per checked file, typed {@code lexical_errors}, {@code syntax_errors}
 * or {@code analysis_issues}.
 */
@RequiredArgsConstructor
class JsonReporter implements Reporter {

    static final Gson GSON = new GsonBuilder()
        .setPrettyPrinting()
        .disableHtmlEscaping()
        .create();

    private final PrintStream out;
    private final Severity level;

    @Override
    public void lexicalErrors(String file, String source, List<LexError> errors) {
        var array = new JsonArray();
        for (var error : errors) {
            array.add(position(error.line(), error.column(), error.message()));
        }
        out.println(GSON.toJson(envelope("lexical_errors", file, array)));
    }

    @Override
    public void syntaxErrors(String file, List<ParserError> errors) {
        var array = new JsonArray();
        for (var error : errors) {
            array.add(position(error.line(), error.column(), error.message()));
        }
        out.println(GSON.toJson(envelope("syntax_errors", file, array)));
    }

    @Override
    public void analysis(String file, AnalysisResult result) {
        var envelope = envelope("analysis_issues", file, diagnostics(result.errors()));
        if (Severity.WARNING.isAtLeast(level)) {
            envelope.add("warnings", diagnostics(result.warnings()));
        }
        if (Severity.INFO.isAtLeast(level)) {
            envelope.add("suggestions", diagnostics(result.suggestions()));
        }
        out.println(GSON.toJson(envelope));
    }

    private static JsonObject envelope(String type, String file, JsonArray errors) {
        var envelope = new JsonObject();
        envelope.addProperty("type", type);
        envelope.addProperty("file", file);
        envelope.add("errors", errors);
        return envelope;
    }

    private static JsonObject position(int line, int column, String message) {
        var json = new JsonObject();
        json.addProperty("line", line);
        json.addProperty("column", column);
        json.addProperty("message", message);
        return json;
    }

    private static JsonArray diagnostics(List<? extends Diagnostic> diagnostics) {
        var array = new JsonArray();
        for (var diagnostic : diagnostics) {
            var json = position(diagnostic.line(), diagnostic.column(), diagnostic.message());
            json.addProperty("type", diagnostic.tag());
            json.addProperty("endColumn", diagnostic.endColumn());
            if (diagnostic.node() != null) {
                json.addProperty("node", diagnostic.node());
            }
            if (diagnostic instanceof AnalysisSuggestion suggestion && suggestion.fix() != null) {
                json.addProperty("fix", suggestion.fix());
            }
            array.add(json);
        }
        return array;
    }

    static JsonObject network(NodeNetwork network) {
        var nodes = new JsonArray();
        network.nodes().forEach(nodes::add);

        var links = new JsonArray();
        for (var link : network.links()) {
            var json = new JsonObject();
            json.addProperty("source", link.source());
            json.addProperty("target", link.target());
            links.add(json);
        }

        var json = new JsonObject();
        json.add("nodes", nodes);
        json.add("links", links);
        return json;
    }
}
