package org.shadowide.st.lsp;

import org.eclipse.lsp4j.CodeAction;
import org.eclipse.lsp4j.CodeActionParams;
import org.eclipse.lsp4j.CodeLens;
import org.eclipse.lsp4j.CodeLensParams;
import org.eclipse.lsp4j.Command;
import org.eclipse.lsp4j.DidChangeTextDocumentParams;
import org.eclipse.lsp4j.DidCloseTextDocumentParams;
import org.eclipse.lsp4j.DidOpenTextDocumentParams;
import org.eclipse.lsp4j.DidSaveTextDocumentParams;
import org.eclipse.lsp4j.DocumentDiagnosticParams;
import org.eclipse.lsp4j.DocumentDiagnosticReport;
import org.eclipse.lsp4j.DocumentFormattingParams;
import org.eclipse.lsp4j.DocumentHighlight;
import org.eclipse.lsp4j.DocumentHighlightParams;
import org.eclipse.lsp4j.DocumentOnTypeFormattingParams;
import org.eclipse.lsp4j.DocumentRangeFormattingParams;
import org.eclipse.lsp4j.DocumentSymbol;
import org.eclipse.lsp4j.DocumentSymbolParams;
import org.eclipse.lsp4j.FoldingRange;
import org.eclipse.lsp4j.FoldingRangeRequestParams;
import org.eclipse.lsp4j.Location;
import org.eclipse.lsp4j.PrepareRenameDefaultBehavior;
import org.eclipse.lsp4j.PrepareRenameParams;
import org.eclipse.lsp4j.PrepareRenameResult;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.ReferenceParams;
import org.eclipse.lsp4j.RelatedFullDocumentDiagnosticReport;
import org.eclipse.lsp4j.RenameParams;
import org.eclipse.lsp4j.SemanticTokens;
import org.eclipse.lsp4j.SemanticTokensParams;
import org.eclipse.lsp4j.SemanticTokensRangeParams;
import org.eclipse.lsp4j.SymbolInformation;
import org.eclipse.lsp4j.TextDocumentContentChangeEvent;
import org.eclipse.lsp4j.TextEdit;
import org.eclipse.lsp4j.WorkspaceEdit;
import org.eclipse.lsp4j.jsonrpc.messages.Either;
import org.eclipse.lsp4j.jsonrpc.messages.Either3;
import org.eclipse.lsp4j.services.LanguageClient;
import org.eclipse.lsp4j.services.TextDocumentService;
import org.shadowide.st.document.DocumentRegistry;
import org.shadowide.st.lsp.config.StLspSettings;
import org.shadowide.st.lsp.provider.CodeActionProvider;
import org.shadowide.st.lsp.provider.CodeLensProvider;
import org.shadowide.st.lsp.provider.DiagnosticsProvider;
import org.shadowide.st.lsp.provider.DocumentSymbolProvider;
import org.shadowide.st.lsp.provider.FoldingProvider;
import org.shadowide.st.lsp.provider.FormattingProvider;
import org.shadowide.st.lsp.provider.HighlightProvider;
import org.shadowide.st.lsp.provider.ReferenceProvider;
import org.shadowide.st.lsp.provider.RenameProvider;
import org.shadowide.st.lsp.provider.SemanticTokensProvider;
import org.shadowide.st.schedule.DebouncedTask;
import org.shadowide.st.schedule.TaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Structured Text document service. Document state lives in a {@link DocumentRegistry}, so every full-text change
 * from the client is an undoable edit; text the server just produced comes back as a change equal to the current
 * text and is ignored.
 */
public class StTextDocumentService implements TextDocumentService {

    private static final Logger logger = LoggerFactory.getLogger(StTextDocumentService.class);

    private final StLspSettings settings;
    private final DocumentRegistry registry;
    private final TaskScheduler scheduler;
    private final Map<String, DebouncedTask> pendingDiagnostics = new ConcurrentHashMap<>();

    private final FormattingProvider formattingProvider;
    private final SemanticTokensProvider semanticTokensProvider = new SemanticTokensProvider();
    private final DocumentSymbolProvider documentSymbolProvider = new DocumentSymbolProvider();
    private final ReferenceProvider referenceProvider = new ReferenceProvider();
    private final HighlightProvider highlightProvider = new HighlightProvider();
    private final RenameProvider renameProvider = new RenameProvider();
    private final CodeLensProvider codeLensProvider = new CodeLensProvider();
    private final FoldingProvider foldingProvider = new FoldingProvider();
    private final DiagnosticsProvider diagnosticsProvider = new DiagnosticsProvider();
    private final CodeActionProvider codeActionProvider = new CodeActionProvider();

    private volatile LanguageClient client;

    public StTextDocumentService(StLspSettings settings, DocumentRegistry registry, TaskScheduler scheduler) {
        this.settings = settings;
        this.registry = registry;
        this.scheduler = scheduler;
        this.formattingProvider = new FormattingProvider(settings);
    }

    public void setClient(LanguageClient client) {
        this.client = client;
    }

    public LanguageClient getClient() {
        return client;
    }

    public DocumentRegistry getRegistry() {
        return registry;
    }

    public StLspSettings getSettings() {
        return settings;
    }

    /**
     * Current text of each open document, keyed by uri.
     */
    public Map<String, String> openDocuments() {
        Map<String, String> documents = new LinkedHashMap<>();
        for (String uri : registry.getDocumentIds()) {
            String text = getDocumentContent(uri);
            if (text != null) {
                documents.put(uri, text);
            }
        }
        return documents;
    }

    public String getDocumentContent(String uri) {
        if (uri == null || !registry.isOpen(uri)) {
            return null;
        }
        try {
            return registry.getCurrentText(uri);
        } catch (IllegalArgumentException e) {
            // closed concurrently
            return null;
        }
    }

    @Override
    public void didOpen(DidOpenTextDocumentParams params) {
        String uri = params.getTextDocument().getUri();
        String text = params.getTextDocument().getText() != null ? params.getTextDocument().getText() : "";
        registry.open(uri, text);
        logger.info("Document opened: {}", uri);
        publishDiagnostics(uri);
    }

    @Override
    public void didChange(DidChangeTextDocumentParams params) {
        String uri = params.getTextDocument().getUri();
        List<TextDocumentContentChangeEvent> changes = params.getContentChanges();
        if (changes == null || changes.isEmpty()) {
            return;
        }
        // full sync: the last event carries the whole text
        String text = changes.get(changes.size() - 1).getText();
        if (!registry.isOpen(uri)) {
            logger.warn("Change for unopened document {}, opening it", uri);
            registry.open(uri, text);
            documentChanged(uri);
            return;
        }
        if (registry.edit(uri, text)) {
            documentChanged(uri);
        } else {
            logger.debug("Ignoring change that matches the current text of {}", uri);
        }
    }

    @Override
    public void didClose(DidCloseTextDocumentParams params) {
        String uri = params.getTextDocument().getUri();
        DebouncedTask pending = pendingDiagnostics.remove(uri);
        if (pending != null) {
            pending.cancel();
        }
        if (registry.isOpen(uri)) {
            registry.close(uri);
        }
        diagnosticsProvider.clearDiagnostics(client, uri);
        logger.info("Document closed: {}", uri);
    }

    @Override
    public void didSave(DidSaveTextDocumentParams params) {
        String uri = params.getTextDocument().getUri();
        if (!registry.isOpen(uri)) {
            return;
        }
        if (params.getText() != null) {
            registry.markSaved(uri, params.getText());
        } else {
            registry.markSaved(uri);
        }
        logger.info("Document saved: {}", uri);
    }

    /**
     * Schedules diagnostics for a document whose text changed and asks the client to repaint.
     */
    public void documentChanged(String uri) {
        scheduleDiagnostics(uri);
        try {
            if (client != null) {
                client.refreshSemanticTokens();
                client.refreshCodeLenses();
            }
        } catch (Throwable t) {
            logger.debug("Client refresh methods not available: {}", t.getMessage());
        }
    }

    void scheduleDiagnostics(String uri) {
        pendingDiagnostics
                .computeIfAbsent(uri, key -> new DebouncedTask(scheduler, settings.getDebounceMillis()))
                .submit(() -> publishDiagnostics(uri));
    }

    void publishDiagnostics(String uri) {
        String content = getDocumentContent(uri);
        if (content != null) {
            diagnosticsProvider.publishDiagnostics(client, uri, content, settings.toAnalysisOptions());
        }
    }

    /**
     * Drops pending debounced work, since its delay may have changed, and re-validates every open document.
     */
    public void settingsChanged() {
        registry.setMaxUndoStackSize(settings.getMaxUndoStackSize());
        for (DebouncedTask pending : pendingDiagnostics.values()) {
            pending.cancel();
        }
        pendingDiagnostics.clear();
        for (String uri : registry.getDocumentIds()) {
            publishDiagnostics(uri);
        }
    }

    /**
     * LSP 3.17 pull diagnostics.
     */
    @Override
    public CompletableFuture<DocumentDiagnosticReport> diagnostic(DocumentDiagnosticParams params) {
        return CompletableFuture.supplyAsync(() -> {
            String uri = params != null && params.getTextDocument() != null ? params.getTextDocument().getUri() : null;
            String content = getDocumentContent(uri);
            RelatedFullDocumentDiagnosticReport full = new RelatedFullDocumentDiagnosticReport(
                    diagnosticsProvider.validateDocumentContent(content != null ? content : "",
                            settings.toAnalysisOptions()));
            return new DocumentDiagnosticReport(full);
        });
    }

    @Override
    public CompletableFuture<SemanticTokens> semanticTokensFull(SemanticTokensParams params) {
        return CompletableFuture.supplyAsync(() -> {
            String content = getDocumentContent(params.getTextDocument().getUri());
            if (content == null) {
                return new SemanticTokens(Collections.emptyList());
            }
            return new SemanticTokens(semanticTokensProvider.generateSemanticTokens(content));
        });
    }

    @Override
    public CompletableFuture<SemanticTokens> semanticTokensRange(SemanticTokensRangeParams params) {
        return CompletableFuture.supplyAsync(() -> {
            String content = getDocumentContent(params.getTextDocument().getUri());
            if (content == null) {
                return new SemanticTokens(Collections.emptyList());
            }
            return new SemanticTokens(semanticTokensProvider.generateSemanticTokens(content, params.getRange()));
        });
    }

    @Override
    public CompletableFuture<List<Either<SymbolInformation, DocumentSymbol>>> documentSymbol(DocumentSymbolParams params) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                String content = getDocumentContent(params.getTextDocument().getUri());
                if (content == null) {
                    return Collections.emptyList();
                }
                return documentSymbolProvider.generate(content);
            } catch (Exception e) {
                logger.error("Error generating document symbols", e);
                return Collections.emptyList();
            }
        });
    }

    @Override
    public CompletableFuture<List<? extends Location>> references(ReferenceParams params) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                String uri = params.getTextDocument().getUri();
                String content = getDocumentContent(uri);
                if (content == null) {
                    return Collections.emptyList();
                }
                String symbol = referenceProvider.getSymbolAtPosition(content, params.getPosition());
                if (symbol == null) {
                    return Collections.emptyList();
                }
                return referenceProvider.findReferences(content, symbol, uri);
            } catch (Exception e) {
                logger.error("Error finding references", e);
                return Collections.emptyList();
            }
        });
    }

    @Override
    public CompletableFuture<List<? extends DocumentHighlight>> documentHighlight(DocumentHighlightParams params) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                String content = getDocumentContent(params.getTextDocument().getUri());
                if (content == null) {
                    return Collections.emptyList();
                }
                String symbol = referenceProvider.getSymbolAtPosition(content, params.getPosition());
                if (symbol == null) {
                    return Collections.emptyList();
                }
                return highlightProvider.findSymbolHighlights(content, symbol);
            } catch (Exception e) {
                logger.error("Error during document highlight", e);
                return Collections.emptyList();
            }
        });
    }

    @Override
    public CompletableFuture<List<? extends TextEdit>> formatting(DocumentFormattingParams params) {
        return CompletableFuture.supplyAsync(() -> {
            String content = getDocumentContent(params.getTextDocument().getUri());
            return formattingProvider.formatDocument(content, params.getOptions());
        });
    }

    @Override
    public CompletableFuture<List<? extends TextEdit>> rangeFormatting(DocumentRangeFormattingParams params) {
        return CompletableFuture.supplyAsync(() -> {
            String content = getDocumentContent(params.getTextDocument().getUri());
            return formattingProvider.formatRange(content, params.getRange(), params.getOptions());
        });
    }

    @Override
    public CompletableFuture<List<? extends TextEdit>> onTypeFormatting(DocumentOnTypeFormattingParams params) {
        return CompletableFuture.supplyAsync(() -> {
            String content = getDocumentContent(params.getTextDocument().getUri());
            return formattingProvider.formatOnType(content, params.getPosition(), params.getCh(), params.getOptions());
        });
    }

    @Override
    public CompletableFuture<List<FoldingRange>> foldingRange(FoldingRangeRequestParams params) {
        return CompletableFuture.supplyAsync(() ->
                foldingProvider.createFoldingRanges(getDocumentContent(params.getTextDocument().getUri())));
    }

    @Override
    public CompletableFuture<WorkspaceEdit> rename(RenameParams params) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                String uri = params.getTextDocument().getUri();
                String content = getDocumentContent(uri);
                if (content == null) {
                    return new WorkspaceEdit();
                }
                return renameProvider.rename(content, params.getPosition(), params.getNewName(), uri);
            } catch (Exception e) {
                logger.error("Error during rename operation", e);
                return new WorkspaceEdit();
            }
        });
    }

    @Override
    public CompletableFuture<Either3<Range, PrepareRenameResult, PrepareRenameDefaultBehavior>> prepareRename(
            PrepareRenameParams params) {
        return CompletableFuture.supplyAsync(() -> {
            String content = getDocumentContent(params.getTextDocument().getUri());
            if (content == null) {
                return null;
            }
            PrepareRenameResult result = renameProvider.prepareRename(content, params.getPosition());
            if (result == null) {
                return null;
            }
            return Either3.<Range, PrepareRenameResult, PrepareRenameDefaultBehavior>forSecond(result);
        });
    }

    @Override
    public CompletableFuture<List<? extends CodeLens>> codeLens(CodeLensParams params) {
        return CompletableFuture.supplyAsync(() -> {
            String uri = params.getTextDocument().getUri();
            String content = getDocumentContent(uri);
            if (content == null) {
                return Collections.emptyList();
            }
            return codeLensProvider.generateCodeLenses(uri, content);
        });
    }

    @Override
    public CompletableFuture<CodeLens> resolveCodeLens(CodeLens unresolved) {
        return CompletableFuture.completedFuture(codeLensProvider.resolveCodeLens(unresolved));
    }

    @Override
    public CompletableFuture<List<Either<Command, CodeAction>>> codeAction(CodeActionParams params) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                String content = getDocumentContent(params.getTextDocument().getUri());
                return codeActionProvider.codeActions(content, params);
            } catch (Exception e) {
                logger.error("Error computing code actions", e);
                return Collections.emptyList();
            }
        });
    }
}
