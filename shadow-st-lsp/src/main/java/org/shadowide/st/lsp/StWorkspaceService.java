package org.shadowide.st.lsp;

import com.google.gson.JsonObject;
import org.apache.commons.lang3.StringUtils;
import org.eclipse.lsp4j.ApplyWorkspaceEditParams;
import org.eclipse.lsp4j.DidChangeConfigurationParams;
import org.eclipse.lsp4j.DidChangeWatchedFilesParams;
import org.eclipse.lsp4j.ExecuteCommandParams;
import org.eclipse.lsp4j.MessageParams;
import org.eclipse.lsp4j.MessageType;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.SymbolInformation;
import org.eclipse.lsp4j.TextEdit;
import org.eclipse.lsp4j.WorkspaceEdit;
import org.eclipse.lsp4j.WorkspaceSymbol;
import org.eclipse.lsp4j.WorkspaceSymbolParams;
import org.eclipse.lsp4j.jsonrpc.messages.Either;
import org.eclipse.lsp4j.services.LanguageClient;
import org.eclipse.lsp4j.services.WorkspaceService;
import org.shadowide.st.diff.DiffChange;
import org.shadowide.st.diff.DiffEngine;
import org.shadowide.st.document.DocumentRegistry;
import org.shadowide.st.lsp.config.ConfigurationService;
import org.shadowide.st.lsp.config.StLspSettings;
import org.shadowide.st.lsp.provider.DocumentRanges;
import org.shadowide.st.lsp.provider.ReferenceProvider;
import org.shadowide.st.lsp.provider.SymbolProvider;
import org.shadowide.st.refactor.ExtractFunctionEngine;
import org.shadowide.st.refactor.ExtractFunctionResult;
import org.shadowide.st.refactor.RenameEngine;
import org.shadowide.st.refactor.RenameResult;
import org.shadowide.st.tag.TagUsageAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Workspace service: configuration, workspace symbols and the {@code st.*} commands.
 * Commands that change a document record the change in the registry first and then ask the client to apply it.
 */
public class StWorkspaceService implements WorkspaceService {

    private static final Logger logger = LoggerFactory.getLogger(StWorkspaceService.class);

    private final StTextDocumentService textDocumentService;
    private final StLspSettings settings;

    private final SymbolProvider symbolProvider = new SymbolProvider();
    private final ReferenceProvider referenceProvider = new ReferenceProvider();
    private final TagUsageAnalyzer tagUsageAnalyzer = new TagUsageAnalyzer();
    private final RenameEngine renameEngine = new RenameEngine();
    private final ExtractFunctionEngine extractFunctionEngine = new ExtractFunctionEngine();
    private final DiffEngine diffEngine = new DiffEngine();

    private volatile LanguageClient client;

    public StWorkspaceService(StTextDocumentService textDocumentService, StLspSettings settings) {
        this.textDocumentService = textDocumentService;
        this.settings = settings;
    }

    public void setClient(LanguageClient client) {
        this.client = client;
    }

    @Override
    public CompletableFuture<Either<List<? extends SymbolInformation>, List<? extends WorkspaceSymbol>>> symbol(
            WorkspaceSymbolParams params) {
        logger.debug("Workspace symbol search requested: {}", params.getQuery());
        return CompletableFuture.supplyAsync(() -> {
            List<SymbolInformation> symbols = symbolProvider.searchWorkspaceSymbols(
                    textDocumentService.openDocuments(), params.getQuery());
            return Either.forLeft(symbols);
        });
    }

    @Override
    public void didChangeConfiguration(DidChangeConfigurationParams params) {
        logger.debug("Configuration changed: {}", params.getSettings());
        try {
            Object config = params.getSettings();
            boolean changed = false;
            if (config instanceof JsonObject) {
                changed = ConfigurationService.apply((JsonObject) config, settings);
            } else if (config instanceof Map) {
                @SuppressWarnings("unchecked")
                Map<String, Object> configMap = (Map<String, Object>) config;
                changed = ConfigurationService.apply(configMap, settings);
            }
            if (changed) {
                textDocumentService.settingsChanged();
                logger.info("Configuration updated: {}", settings);
            }
        } catch (Exception e) {
            logger.error("Failed to handle configuration change", e);
        }
    }

    @Override
    public void didChangeWatchedFiles(DidChangeWatchedFilesParams params) {
        logger.debug("Watched files changed: {}", params.getChanges().size());
    }

    @Override
    public CompletableFuture<Object> executeCommand(ExecuteCommandParams params) {
        return CompletableFuture.supplyAsync(() -> {
            String command = params.getCommand();
            CommandArguments args = new CommandArguments(command, params.getArguments());
            logger.debug("Executing command {}", command);
            try {
                switch (command) {
                    case StCommands.ANALYZE_TAGS:
                        return analyzeTags(args);
                    case StCommands.EXTRACT_FUNCTION:
                        return extractFunction(args);
                    case StCommands.RENAME_SYMBOL:
                        return renameSymbol(args);
                    case StCommands.PREVIEW_CHANGES:
                        return pendingChanges(args.requireString(0));
                    case StCommands.REJECT_CHANGE:
                        return rejectChange(args);
                    case StCommands.UNDO:
                        return undo(args.requireString(0));
                    case StCommands.REDO:
                        return redo(args.requireString(0));
                    case StCommands.SHOW_REFERENCES:
                        return showReferences(args);
                    default:
                        logger.warn("Unknown command: {}", command);
                        return null;
                }
            } catch (IllegalArgumentException e) {
                logger.warn("Rejected command {}: {}", command, e.getMessage());
                showMessage(MessageType.Warning, e.getMessage());
                return null;
            } catch (Exception e) {
                logger.error("Error executing command " + command, e);
                return null;
            }
        });
    }

    private Object analyzeTags(CommandArguments args) {
        String text = currentText(args.requireString(0));
        String query = args.optionalString(1);
        return StringUtils.isBlank(query) ? tagUsageAnalyzer.analyze(text) : tagUsageAnalyzer.search(text, query);
    }

    private ExtractFunctionResult extractFunction(CommandArguments args) {
        String uri = args.requireString(0);
        String text = currentText(uri);
        ExtractFunctionResult result = extractFunctionEngine.extractFunction(text, args.requireInt(1),
                args.requireInt(2), args.requireString(3), args.optionalString(4));
        if (result.isSuccess()) {
            replaceText(uri, text, result.getNewContent(), "Extract function");
        } else {
            showMessage(MessageType.Warning, result.getMessage());
        }
        return result;
    }

    private RenameResult renameSymbol(CommandArguments args) {
        String uri = args.requireString(0);
        String target = args.requireString(1);
        String newName = args.requireString(2);
        String mode = args.optionalString(3);
        String text = currentText(uri);
        RenameResult result = StCommands.RENAME_MODE_PATTERN.equalsIgnoreCase(mode)
                ? renameEngine.renameMatching(text, target, newName)
                : renameEngine.rename(text, target, newName);
        if (result.isNoOp()) {
            showMessage(MessageType.Info, "No occurrences of '" + target + "' found");
        } else {
            replaceText(uri, text, result.getContent(), "Rename " + target);
        }
        return result;
    }

    private List<DiffChange> rejectChange(CommandArguments args) {
        String uri = args.requireString(0);
        String changeId = args.requireString(1);
        String text = currentText(uri);
        for (DiffChange change : registry().diff(uri)) {
            if (change.getChangeId().equals(changeId)) {
                replaceText(uri, text, diffEngine.reject(text, change), "Reject change");
                return pendingChanges(uri);
            }
        }
        throw new IllegalArgumentException("No pending change " + changeId + " in " + uri);
    }

    /**
     * Saved against working text without the unchanged lines. Change ids are those of the full diff.
     */
    private List<DiffChange> pendingChanges(String uri) {
        List<DiffChange> changes = new ArrayList<>();
        for (DiffChange change : registry().diff(uri)) {
            if (change.isChange()) {
                changes.add(change);
            }
        }
        return changes;
    }

    private String undo(String uri) {
        String before = currentText(uri);
        String restored = registry().undo(uri);
        if (restored != null) {
            applyText(uri, before, restored, "Undo");
        }
        return restored;
    }

    private String redo(String uri) {
        String before = currentText(uri);
        String restored = registry().redo(uri);
        if (restored != null) {
            applyText(uri, before, restored, "Redo");
        }
        return restored;
    }

    private Object showReferences(CommandArguments args) {
        String uri = args.requireString(0);
        String text = currentText(uri);
        String symbol = referenceProvider.getSymbolAtPosition(text,
                new Position(args.requireInt(1), args.requireInt(2)));
        return symbol == null ? Collections.emptyList() : referenceProvider.findReferences(text, symbol, uri);
    }

    /**
     * Records {@code after} as an undoable edit and sends it to the client.
     */
    private void replaceText(String uri, String before, String after, String label) {
        if (registry().edit(uri, after)) {
            applyText(uri, before, after, label);
        }
    }

    private void applyText(String uri, String before, String after, String label) {
        textDocumentService.documentChanged(uri);
        LanguageClient current = client;
        if (current == null) {
            return;
        }
        WorkspaceEdit edit = new WorkspaceEdit(Collections.singletonMap(uri,
                Collections.singletonList(new TextEdit(DocumentRanges.wholeDocument(before), after))));
        try {
            current.applyEdit(new ApplyWorkspaceEditParams(edit, label)).whenComplete((response, error) -> {
                if (error != null) {
                    logger.error("Client failed to apply '" + label + "' to " + uri, error);
                } else if (response != null && !response.isApplied()) {
                    logger.warn("Client declined '{}' on {}: {}", label, uri, response.getFailureReason());
                }
            });
        } catch (Throwable t) {
            logger.debug("Client applyEdit not available: {}", t.getMessage());
        }
    }

    private void showMessage(MessageType type, String message) {
        LanguageClient current = client;
        if (current != null && message != null) {
            current.showMessage(new MessageParams(type, message));
        }
    }

    private String currentText(String uri) {
        return registry().getCurrentText(uri);
    }

    private DocumentRegistry registry() {
        return textDocumentService.getRegistry();
    }
}
