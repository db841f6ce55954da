package com.sentimentfusion.orchestrator.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sentimentfusion.common.model.ErrorSummary;
import com.sentimentfusion.common.model.ModelPair;
import com.sentimentfusion.common.model.ModelResult;
import com.sentimentfusion.common.model.SymbolAnalysisResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.ZoneOffset;
import java.util.function.Consumer;

/**
 * Serialises a {@link SymbolAnalysisResult} into the {@link PredictionRecord} row the storage
 * layer persists. Performs no writes itself.
 */
@Component
public class AnalysisRecordMapper {

    private static final Logger log = LoggerFactory.getLogger(AnalysisRecordMapper.class);

    private final ObjectMapper objectMapper;

    public AnalysisRecordMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public PredictionRecord toRecord(SymbolAnalysisResult result) {
        try {
            PredictionRecord record = new PredictionRecord();
            record.setSymbol(result.symbol());
            if (result.timestamp() != null) {
                record.setAnalyzedAt(result.timestamp());
                record.setPredictionDate(result.timestamp().atZone(ZoneOffset.UTC).toLocalDate());
            }
            if (result.signal() != null) {
                record.setDirection(result.signal().direction().label());
                record.setAction(result.signal().action().name());
                record.setStrength(result.signal().strength().name());
            }
            if (result.comparison() != null) {
                record.setAgreementType(result.comparison().type().label());
                record.setModelsAgree(result.comparison().agree());
            }
            ModelPair models = result.models();
            if (models != null) {
                applyModel(models.modelA(), record::setModelADirection, record::setModelAConfidence);
                applyModel(models.modelB(), record::setModelBDirection, record::setModelBConfidence);
            }
            record.setNewsFetchErrors(result.errorSummary() != null
                ? objectMapper.writeValueAsString(result.errorSummary()) : null);
            record.setExecutionTimeMs(result.executionTimeMs());
            record.setPayload(objectMapper.writeValueAsString(result));
            return record;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(
                "Failed to serialize analysis result for persistence: symbol=" + result.symbol(), e);
        }
    }

    /**
     * Reads a stored {@code newsFetchErrors} column back.
     *
     * @return the summary, or {@code null} for a null, blank or malformed value
     */
    public ErrorSummary readErrorSummary(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, ErrorSummary.class);
        } catch (JsonProcessingException e) {
            log.warn("Skipping unparseable newsFetchErrors JSON: {}", e.getOriginalMessage());
            return null;
        }
    }

    // Invalid models keep their columns null so a failed call is never read as a neutral vote.
    private static void applyModel(ModelResult model,
                                   Consumer<String> direction,
                                   Consumer<Double> confidence) {
        if (model == null || !model.isValid()) {
            return;
        }
        direction.accept(model.direction().label());
        confidence.accept(model.confidence());
    }
}
