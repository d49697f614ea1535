package org.shadowide.st.analysis;

import java.util.Collections;
import java.util.List;

public final class AnalysisResult {

    private final List<StDiagnostic> diagnostics;
    private final ResourceUsage resourceUsage;

    public AnalysisResult(List<StDiagnostic> diagnostics, ResourceUsage resourceUsage) {
        this.diagnostics = Collections.unmodifiableList(diagnostics);
        this.resourceUsage = resourceUsage;
    }

    public List<StDiagnostic> getDiagnostics() {
        return diagnostics;
    }

    public ResourceUsage getResourceUsage() {
        return resourceUsage;
    }
}
