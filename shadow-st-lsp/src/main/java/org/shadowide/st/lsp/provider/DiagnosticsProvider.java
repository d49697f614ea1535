package org.shadowide.st.lsp.provider;

import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.DiagnosticSeverity;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.PublishDiagnosticsParams;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.jsonrpc.messages.Either;
import org.eclipse.lsp4j.services.LanguageClient;
import org.shadowide.st.analysis.AnalysisOptions;
import org.shadowide.st.analysis.AnalysisResult;
import org.shadowide.st.analysis.SemanticAnalyzer;
import org.shadowide.st.analysis.StDiagnostic;
import org.shadowide.st.text.TextLines;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Runs the semantic analyzer and reports its findings as LSP diagnostics.
 */
public class DiagnosticsProvider {

    private static final Logger logger = LoggerFactory.getLogger(DiagnosticsProvider.class);

    public static final String SOURCE = "structured-text";

    private final SemanticAnalyzer analyzer;

    public DiagnosticsProvider() {
        this(new SemanticAnalyzer());
    }

    public DiagnosticsProvider(SemanticAnalyzer analyzer) {
        this.analyzer = analyzer;
    }

    public List<Diagnostic> validateDocumentContent(String content, AnalysisOptions options) {
        if (content == null) {
            return Collections.emptyList();
        }
        List<Diagnostic> diagnostics = new ArrayList<>();
        try {
            AnalysisResult result = analyzer.analyze(content, options);
            String[] lines = TextLines.split(content);
            for (StDiagnostic finding : result.getDiagnostics()) {
                diagnostics.add(toDiagnostic(finding, lines));
            }
            logger.debug("Analysis found {} issue(s), {}", diagnostics.size(), result.getResourceUsage());
        } catch (Exception e) {
            logger.error("Error analyzing document", e);
        }
        return diagnostics;
    }

    public void publishDiagnostics(LanguageClient client, String uri, String content, AnalysisOptions options) {
        if (client == null || uri == null) {
            return;
        }
        publish(client, uri, validateDocumentContent(content, options));
    }

    public void clearDiagnostics(LanguageClient client, String uri) {
        if (client == null || uri == null) {
            return;
        }
        publish(client, uri, Collections.emptyList());
    }

    private static void publish(LanguageClient client, String uri, List<Diagnostic> diagnostics) {
        PublishDiagnosticsParams params = new PublishDiagnosticsParams();
        params.setUri(uri);
        params.setDiagnostics(diagnostics);
        try {
            client.publishDiagnostics(params);
        } catch (Throwable t) {
            logger.debug("Failed to publish diagnostics: {}", t.getMessage());
        }
    }

    static Diagnostic toDiagnostic(StDiagnostic finding, String[] lines) {
        int line = Math.min(Math.max(0, finding.getLine() - 1), lines.length - 1);
        int lineLength = lines[line].length();
        int start = Math.min(finding.getColumn(), lineLength);
        int end = finding.getLength() > 0 ? Math.min(start + finding.getLength(), lineLength) : lineLength;

        Diagnostic diagnostic = new Diagnostic();
        diagnostic.setRange(new Range(new Position(line, start), new Position(line, end)));
        diagnostic.setSeverity(severity(finding.getSeverity()));
        diagnostic.setSource(SOURCE);
        diagnostic.setCode(Either.forLeft(finding.getId()));
        diagnostic.setMessage(finding.getSuggestion() != null
                ? finding.getMessage() + " (" + finding.getSuggestion() + ")"
                : finding.getMessage());
        diagnostic.setData(finding.getCategory().getId());
        return diagnostic;
    }

    private static DiagnosticSeverity severity(org.shadowide.st.analysis.DiagnosticSeverity severity) {
        switch (severity) {
            case ERROR:
                return DiagnosticSeverity.Error;
            case WARNING:
                return DiagnosticSeverity.Warning;
            case INFO:
                return DiagnosticSeverity.Information;
            default:
                return DiagnosticSeverity.Hint;
        }
    }
}
