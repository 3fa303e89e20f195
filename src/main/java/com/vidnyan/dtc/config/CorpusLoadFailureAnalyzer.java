package com.vidnyan.dtc.config;

import com.vidnyan.dtc.domain.error.CorpusLoadException;
import org.springframework.boot.diagnostics.AbstractFailureAnalyzer;
import org.springframework.boot.diagnostics.FailureAnalysis;

/**
 * Turns a corpus load failure during startup into a short report instead of a stack trace.
 */
public class CorpusLoadFailureAnalyzer extends AbstractFailureAnalyzer<CorpusLoadException> {

    @Override
    protected FailureAnalysis analyze(Throwable rootFailure, CorpusLoadException cause) {
        String where = cause.getLine() > 0 ? "at line " + cause.getLine() : "while reading the source";
        return new FailureAnalysis(
                "The diagnostic code corpus could not be loaded " + where + ": " + cause.getReason(),
                "Fix the corpus file or point dtc.corpus.location at a valid corpus. "
                        + "No records are served from a corpus that fails validation.",
                cause);
    }
}
