package org.shadowide.st.lsp;

import org.eclipse.lsp4j.CodeActionKind;
import org.eclipse.lsp4j.CodeActionOptions;
import org.eclipse.lsp4j.CodeLensOptions;
import org.eclipse.lsp4j.DiagnosticRegistrationOptions;
import org.eclipse.lsp4j.DocumentOnTypeFormattingOptions;
import org.eclipse.lsp4j.ExecuteCommandOptions;
import org.eclipse.lsp4j.InitializeParams;
import org.eclipse.lsp4j.InitializeResult;
import org.eclipse.lsp4j.RenameOptions;
import org.eclipse.lsp4j.SaveOptions;
import org.eclipse.lsp4j.SemanticTokensWithRegistrationOptions;
import org.eclipse.lsp4j.ServerCapabilities;
import org.eclipse.lsp4j.ServerInfo;
import org.eclipse.lsp4j.SetTraceParams;
import org.eclipse.lsp4j.TextDocumentSyncKind;
import org.eclipse.lsp4j.TextDocumentSyncOptions;
import org.eclipse.lsp4j.jsonrpc.messages.Either;
import org.eclipse.lsp4j.services.LanguageClient;
import org.eclipse.lsp4j.services.LanguageClientAware;
import org.eclipse.lsp4j.services.LanguageServer;
import org.eclipse.lsp4j.services.TextDocumentService;
import org.eclipse.lsp4j.services.WorkspaceService;
import org.shadowide.st.document.DocumentRegistry;
import org.shadowide.st.lsp.config.StLspSettings;
import org.shadowide.st.lsp.provider.SemanticTokensProvider;
import org.shadowide.st.schedule.ExecutorTaskScheduler;
import org.shadowide.st.schedule.TaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collections;
import java.util.concurrent.CompletableFuture;

/**
 * Structured Text Language Server Implementation
 */
public class StLanguageServer implements LanguageServer, LanguageClientAware {

    private static final Logger logger = LoggerFactory.getLogger(StLanguageServer.class);

    private final StLspSettings settings;
    private final TaskScheduler scheduler;
    private final boolean ownsScheduler;
    private final StTextDocumentService textDocumentService;
    private final StWorkspaceService workspaceService;
    private LanguageClient client;

    public StLanguageServer() {
        this(new StLspSettings(), new ExecutorTaskScheduler(), true);
    }

    /**
     * @param scheduler runs debounced diagnostics; stays open when the server shuts down
     */
    public StLanguageServer(StLspSettings settings, TaskScheduler scheduler) {
        this(settings, scheduler, false);
    }

    private StLanguageServer(StLspSettings settings, TaskScheduler scheduler, boolean ownsScheduler) {
        this.settings = settings;
        this.scheduler = scheduler;
        this.ownsScheduler = ownsScheduler;
        DocumentRegistry registry = new DocumentRegistry(settings.getMaxUndoStackSize());
        this.textDocumentService = new StTextDocumentService(settings, registry, scheduler);
        this.workspaceService = new StWorkspaceService(textDocumentService, settings);
        logger.info("Structured Text Language Server initialized");
    }

    @Override
    public CompletableFuture<InitializeResult> initialize(InitializeParams params) {
        logger.info("Initializing Structured Text Language Server");

        ServerCapabilities capabilities = new ServerCapabilities();

        // full text sync, saves carry the text
        TextDocumentSyncOptions sync = new TextDocumentSyncOptions();
        sync.setOpenClose(true);
        sync.setChange(TextDocumentSyncKind.Full);
        sync.setSave(Either.forRight(new SaveOptions(true)));
        capabilities.setTextDocumentSync(sync);

        capabilities.setDocumentSymbolProvider(true);
        capabilities.setDiagnosticProvider(new DiagnosticRegistrationOptions());

        capabilities.setDocumentFormattingProvider(true);
        capabilities.setDocumentRangeFormattingProvider(true);
        capabilities.setDocumentOnTypeFormattingProvider(
                new DocumentOnTypeFormattingOptions(";", Collections.singletonList("\n")));

        capabilities.setReferencesProvider(true);
        capabilities.setDocumentHighlightProvider(true);
        capabilities.setRenameProvider(new RenameOptions(true));
        capabilities.setFoldingRangeProvider(true);
        capabilities.setWorkspaceSymbolProvider(true);

        CodeLensOptions codeLensOptions = new CodeLensOptions();
        codeLensOptions.setResolveProvider(false);
        capabilities.setCodeLensProvider(codeLensOptions);

        capabilities.setCodeActionProvider(new CodeActionOptions(
                Arrays.asList(CodeActionKind.RefactorExtract, CodeActionKind.QuickFix)));
        capabilities.setExecuteCommandProvider(new ExecuteCommandOptions(StCommands.ALL));

        SemanticTokensWithRegistrationOptions semanticTokensOptions =
                new SemanticTokensWithRegistrationOptions(SemanticTokensProvider.legend(), true, true);
        capabilities.setSemanticTokensProvider(semanticTokensOptions);

        InitializeResult result = new InitializeResult(capabilities);
        result.setServerInfo(new ServerInfo("Structured Text Language Server", "1.0.0"));

        logger.info("Structured Text Language Server initialized successfully");
        return CompletableFuture.completedFuture(result);
    }

    @Override
    public CompletableFuture<Object> shutdown() {
        logger.info("Shutting down Structured Text Language Server");
        if (ownsScheduler && scheduler instanceof AutoCloseable) {
            try {
                ((AutoCloseable) scheduler).close();
            } catch (Exception e) {
                logger.warn("Failed to stop scheduler", e);
            }
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public void exit() {
        // the WebSocket host shares the JVM with other sessions, so exit only ends this session
        logger.info("Structured Text Language Server exit requested by client");
    }

    @Override
    public StTextDocumentService getTextDocumentService() {
        return textDocumentService;
    }

    @Override
    public StWorkspaceService getWorkspaceService() {
        return workspaceService;
    }

    public StLspSettings getSettings() {
        return settings;
    }

    @Override
    public void connect(LanguageClient client) {
        this.client = client;
        this.textDocumentService.setClient(client);
        this.workspaceService.setClient(client);
        logger.info("Language client connected");
    }

    public LanguageClient getClient() {
        return client;
    }

    /**
     * Clients may send {@code $/setTrace} with 'off' | 'messages' | 'verbose'.
     */
    @Override
    public void setTrace(SetTraceParams params) {
        logger.info("SetTrace notification received: {}", params != null ? params.getValue() : null);
    }
}
