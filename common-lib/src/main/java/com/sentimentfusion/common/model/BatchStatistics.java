package com.sentimentfusion.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Agreement-type counts over a batch run. Every result falls into exactly one bucket.
 */
public record BatchStatistics(
    @JsonProperty("total_symbols")     int totalSymbols,
    @JsonProperty("full_agreement")    int fullAgreement,
    @JsonProperty("partial_agreement") int partialAgreement,
    @JsonProperty("disagreement")      int disagreement,
    @JsonProperty("errors")            int errors
) {
    public static BatchStatistics empty(int totalSymbols) {
        return new BatchStatistics(totalSymbols, 0, 0, 0, 0);
    }

    /** Returns a copy with {@code result} counted in its bucket. */
    public BatchStatistics record(SymbolAnalysisResult result) {
        if (result.isDegraded() || result.comparison().type() == AgreementType.ERROR) {
            return new BatchStatistics(totalSymbols, fullAgreement, partialAgreement, disagreement, errors + 1);
        }
        if (result.comparison().agree()) {
            return new BatchStatistics(totalSymbols, fullAgreement + 1, partialAgreement, disagreement, errors);
        }
        if (result.comparison().type() == AgreementType.PARTIAL_AGREEMENT) {
            return new BatchStatistics(totalSymbols, fullAgreement, partialAgreement + 1, disagreement, errors);
        }
        return new BatchStatistics(totalSymbols, fullAgreement, partialAgreement, disagreement + 1, errors);
    }

    public int processed() {
        return fullAgreement + partialAgreement + disagreement + errors;
    }
}
