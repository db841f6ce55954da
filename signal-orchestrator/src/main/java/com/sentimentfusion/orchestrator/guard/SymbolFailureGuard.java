package com.sentimentfusion.orchestrator.guard;

import com.sentimentfusion.common.model.SymbolAnalysisResult;

import java.time.Instant;

/**
 * Turns a per-symbol pipeline failure into a degraded {@link SymbolAnalysisResult} so a batch
 * run always yields one result per requested symbol.
 *
 * <p>Pure utility: no reactive types, no logging, no state.
 */
public final class SymbolFailureGuard {

    static final String UNKNOWN_ERROR = "Unknown error";

    private SymbolFailureGuard() {}

    /**
     * @param symbol    the requested symbol (may be null or blank)
     * @param error     what the pipeline threw (may be null)
     * @return a result with {@code type=error}, {@code strength=failed}, {@code action=skip};
     *         never {@code null}
     */
    public static SymbolAnalysisResult degrade(String symbol, Throwable error,
                                               Instant timestamp, long executionTimeMs) {
        return SymbolAnalysisResult.degraded(symbol, timestamp, describe(error), executionTimeMs);
    }

    /** Message of the throwable, or its simple class name when it has none. */
    public static String describe(Throwable error) {
        if (error == null) {
            return UNKNOWN_ERROR;
        }
        String message = error.getMessage();
        if (message == null || message.isBlank()) {
            return error.getClass().getSimpleName();
        }
        return message;
    }
}
