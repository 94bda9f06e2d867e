package tome.lang;

/**
 * A finding of the {@link Analyzer}. Positions are 1-based, {@code endColumn} exclusive;
 * {@code node} names the dialogue node the finding belongs to, or is {@code null} for
 * program-wide findings.
 */
public sealed interface Diagnostic permits AnalysisError, AnalysisWarning, AnalysisSuggestion {

    /** The stable snake_case tag of the diagnostic type, such as {@code "missing_node"}. */
    String tag();

    String message();

    int line();

    int column();

    int endColumn();

    String node();

    Severity severity();
}
