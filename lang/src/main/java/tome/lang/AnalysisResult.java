package tome.lang;

import com.google.common.collect.ImmutableList;

import lombok.NonNull;

/** {@code valid} is true exactly when there are no errors. */
public record AnalysisResult(
    boolean valid,
    @NonNull ImmutableList<AnalysisError> errors,
    @NonNull ImmutableList<AnalysisWarning> warnings,
    @NonNull ImmutableList<AnalysisSuggestion> suggestions) {

    static AnalysisResult of(
            ImmutableList<AnalysisError> errors,
            ImmutableList<AnalysisWarning> warnings,
            ImmutableList<AnalysisSuggestion> suggestions) {
        return new AnalysisResult(errors.isEmpty(), errors, warnings, suggestions);
    }

    /** All diagnostics at or above {@code minimum}: errors, then warnings, then suggestions. */
    public ImmutableList<Diagnostic> diagnostics(Severity minimum) {
        var all = ImmutableList.<Diagnostic>builder();
        all.addAll(errors);
        if (Severity.WARNING.isAtLeast(minimum)) {
            all.addAll(warnings);
        }
        if (Severity.INFO.isAtLeast(minimum)) {
            all.addAll(suggestions);
        }
        return all.build();
    }

    public boolean isEmpty() {
        return errors.isEmpty() && warnings.isEmpty() && suggestions.isEmpty();
    }
}
