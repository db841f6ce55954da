package com.sentimentfusion.orchestrator.service;

import com.sentimentfusion.common.model.SymbolAnalysisResult;
import reactor.core.publisher.Mono;

/**
 * Runs the full fetch, dual-model, agreement and signal pipeline for one symbol.
 */
public interface SymbolAnalyzer {

    Mono<SymbolAnalysisResult> analyzeOne(String symbol);
}
