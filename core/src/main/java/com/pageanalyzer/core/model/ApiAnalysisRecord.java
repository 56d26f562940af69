package com.pageanalyzer.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** 구조화 API 페이로드 분석 결과 */
public final class ApiAnalysisRecord {
    private final String endpointUrl;
    private final String detectedStructure;
    private final List<Map<String, Object>> extractedRecords;
    private final String detectedSchema;    // nullable: 알려진 스키마에 맞을 때만
    private final double dataQuality;
    private final long processingTimeMs;
    private final String errorMessage;

    public ApiAnalysisRecord(String endpointUrl,
                             String detectedStructure,
                             List<Map<String, Object>> extractedRecords,
                             String detectedSchema,
                             double dataQuality,
                             long processingTimeMs,
                             String errorMessage) {
        this.endpointUrl = Objects.requireNonNull(endpointUrl, "endpointUrl");
        this.detectedStructure = Objects.requireNonNull(detectedStructure, "detectedStructure");
        this.extractedRecords = (extractedRecords == null)
                ? List.of()
                : extractedRecords.stream()
                    .map(m -> Collections.unmodifiableMap(new LinkedHashMap<>(m)))
                    .toList();
        this.detectedSchema = detectedSchema;
        this.dataQuality = Double.isNaN(dataQuality) ? 0.0 : Math.max(0.0, Math.min(1.0, dataQuality));
        this.processingTimeMs = Math.max(0L, processingTimeMs);
        this.errorMessage = errorMessage;
    }

    public static ApiAnalysisRecord error(String endpointUrl, String message, long processingTimeMs) {
        return new ApiAnalysisRecord(endpointUrl, "error", List.of(), null, 0.0, processingTimeMs, message);
    }

    public String getEndpointUrl() { return endpointUrl; }
    public String getDetectedStructure() { return detectedStructure; }
    public List<Map<String, Object>> getExtractedRecords() { return extractedRecords; }
    public String getDetectedSchema() { return detectedSchema; }
    public int getTotalRecords() { return extractedRecords.size(); }
    public double getDataQuality() { return dataQuality; }
    public long getProcessingTimeMs() { return processingTimeMs; }
    public String getErrorMessage() { return errorMessage; }

    public boolean isError() { return errorMessage != null; }
}
