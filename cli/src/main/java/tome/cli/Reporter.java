package tome.cli;

import java.util.List;

import tome.lang.AnalysisResult;
import tome.lang.LexError;
import tome.lang.ParserError;

/** Output sink for the results of checking one file. */
interface Reporter {

    void lexicalErrors(String file, String source, List<LexError> errors);

    void syntaxErrors(String file, List<ParserError> errors);

    void analysis(String file, AnalysisResult result);
}
