package com.purchasingpower.research.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.purchasingpower.research.model.research.ResearchReport;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response from the research endpoint.
 *
 * On failure {@code errorType} tells the caller what went wrong:
 * INVALID_REQUEST, NO_SOURCES, LLM_UNAVAILABLE or UNEXPECTED.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ResearchResponse {

    public enum ErrorType {
        INVALID_REQUEST,
        NO_SOURCES,
        LLM_UNAVAILABLE,
        UNEXPECTED
    }

    private boolean success;
    private ResearchReport report;

    /**
     * Where the Markdown report was written; null when saving failed.
     */
    private String reportPath;

    private String error;
    private ErrorType errorType;

    public static ResearchResponse success(ResearchReport report, String reportPath) {
        return ResearchResponse.builder()
            .success(true)
            .report(report)
            .reportPath(reportPath)
            .build();
    }

    public static ResearchResponse error(ErrorType errorType, String error) {
        return ResearchResponse.builder()
            .success(false)
            .errorType(errorType)
            .error(error)
            .build();
    }
}
