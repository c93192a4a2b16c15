package com.purchasingpower.research.configuration;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class OutputProperties {

    @NotBlank
    private String reportDir = "reports";

    /**
     * Also dump the fetched sources next to the report (debugging aid).
     */
    private boolean saveIntermediate = false;
}
