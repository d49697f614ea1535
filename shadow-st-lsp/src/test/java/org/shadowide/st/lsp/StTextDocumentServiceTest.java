package org.shadowide.st.lsp;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import org.eclipse.lsp4j.DidChangeConfigurationParams;
import org.eclipse.lsp4j.DidChangeTextDocumentParams;
import org.eclipse.lsp4j.DidCloseTextDocumentParams;
import org.eclipse.lsp4j.DidOpenTextDocumentParams;
import org.eclipse.lsp4j.DidSaveTextDocumentParams;
import org.eclipse.lsp4j.DocumentDiagnosticParams;
import org.eclipse.lsp4j.DocumentDiagnosticReport;
import org.eclipse.lsp4j.ExecuteCommandParams;
import org.eclipse.lsp4j.InitializeParams;
import org.eclipse.lsp4j.InitializeResult;
import org.eclipse.lsp4j.MessageType;
import org.eclipse.lsp4j.TextDocumentContentChangeEvent;
import org.eclipse.lsp4j.TextDocumentIdentifier;
import org.eclipse.lsp4j.TextDocumentItem;
import org.eclipse.lsp4j.VersionedTextDocumentIdentifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.shadowide.st.diff.ChangeType;
import org.shadowide.st.diff.DiffChange;
import org.shadowide.st.lsp.config.StLspSettings;
import org.shadowide.st.refactor.ExtractFunctionResult;
import org.shadowide.st.refactor.RefactorError;
import org.shadowide.st.refactor.RenameResult;
import org.shadowide.st.schedule.ManualTaskScheduler;
import org.shadowide.st.tag.DeclaredTag;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StTextDocumentServiceTest {

    private static final String URI = "file:///plc/main.st";
    private static final String TEXT = "VAR\n  X : INT;\nEND_VAR\nX := X + 1;";

    private ManualTaskScheduler scheduler;
    private RecordingClient client;
    private StLanguageServer server;

    @BeforeEach
    void setUp() {
        scheduler = new ManualTaskScheduler();
        client = new RecordingClient();
        server = new StLanguageServer(new StLspSettings(), scheduler);
        server.connect(client);
        server.getTextDocumentService().didOpen(
                new DidOpenTextDocumentParams(new TextDocumentItem(URI, "structured-text", 1, TEXT)));
    }

    private void change(String text) {
        server.getTextDocumentService().didChange(new DidChangeTextDocumentParams(
                new VersionedTextDocumentIdentifier(URI, 2),
                Collections.singletonList(new TextDocumentContentChangeEvent(text))));
    }

    private Object execute(String command, Object... arguments) {
        return server.getWorkspaceService().executeCommand(
                new ExecuteCommandParams(command, Arrays.asList(arguments))).join();
    }

    private String current() {
        return server.getTextDocumentService().getDocumentContent(URI);
    }

    @Test
    void advertisesCommandsAndFullSync() {
        InitializeResult result = server.initialize(new InitializeParams()).join();
        assertEquals(StCommands.ALL, result.getCapabilities().getExecuteCommandProvider().getCommands());
        assertNotNull(result.getCapabilities().getSemanticTokensProvider());
        assertEquals("Structured Text Language Server", result.getServerInfo().getName());
    }

    @Test
    void openPublishesDiagnosticsImmediately() {
        assertEquals(1, client.diagnostics.size());
        assertEquals(URI, client.diagnostics.get(0).getUri());
    }

    @Test
    void changesAreDebounced() {
        change(TEXT + "\nX := 2;");
        change(TEXT + "\nX := 3;");
        assertEquals(1, client.diagnostics.size());

        scheduler.advance(999);
        assertEquals(1, client.diagnostics.size());
        scheduler.advance(1);
        assertEquals(2, client.diagnostics.size());
    }

    @Test
    void undoCommandRestoresPreviousTextAndIgnoresEcho() {
        change(TEXT + "\nX := 2;");
        assertEquals(TEXT, execute(StCommands.UNDO, URI));
        assertEquals(TEXT, current());
        assertEquals(TEXT, client.lastEditText(URI));

        // the client echoes the applied edit back as a change
        change(TEXT);
        assertEquals(TEXT + "\nX := 2;", execute(StCommands.REDO, new JsonPrimitive(URI)));
        assertNull(execute(StCommands.REDO, URI));
    }

    @Test
    void renameCommandAppliesAndIsUndoable() {
        RenameResult result = (RenameResult) execute(StCommands.RENAME_SYMBOL, URI, "X", "Count",
                StCommands.RENAME_MODE_LITERAL);
        assertEquals(3, result.getChanges());
        assertEquals("VAR\n  Count : INT;\nEND_VAR\nCount := Count + 1;", current());
        assertEquals(current(), client.lastEditText(URI));

        assertEquals(TEXT, execute(StCommands.UNDO, URI));
    }

    @Test
    void extractFunctionFailureIsReportedWithoutEdit() {
        ExtractFunctionResult result = (ExtractFunctionResult) execute(StCommands.EXTRACT_FUNCTION, URI, 3, 2, "Calc");
        assertFalse(result.isSuccess());
        assertEquals(RefactorError.INVALID_SELECTION, result.getError());
        assertTrue(client.edits.isEmpty());
        assertEquals(MessageType.Warning, client.messages.get(0).getType());
        assertEquals(TEXT, current());
    }

    @Test
    void extractFunctionAppendsRoutine() {
        ExtractFunctionResult result = (ExtractFunctionResult) execute(StCommands.EXTRACT_FUNCTION, URI,
                new JsonPrimitive(1), new JsonPrimitive(3), "Decl", "INT");
        assertTrue(result.isSuccess());
        assertTrue(current().startsWith(TEXT));
        assertTrue(current().contains("FUNCTION Decl : INT"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void previewAndRejectChanges() {
        change("VAR\n  X : INT;\nEND_VAR\nX := X + 2;");
        List<DiffChange> changes = (List<DiffChange>) execute(StCommands.PREVIEW_CHANGES, URI);
        assertEquals(1, changes.size());
        assertEquals(ChangeType.MODIFIED, changes.get(0).getType());
        assertEquals("modify-0", changes.get(0).getChangeId());
        assertEquals(Integer.valueOf(4), changes.get(0).getModifiedLine());

        List<DiffChange> remaining = (List<DiffChange>) execute(StCommands.REJECT_CHANGE, URI,
                changes.get(0).getChangeId());
        assertTrue(remaining.isEmpty());
        assertEquals(TEXT, current());
    }

    @Test
    @SuppressWarnings("unchecked")
    void analyzeTagsReportsUsage() {
        List<DeclaredTag> tags = (List<DeclaredTag>) execute(StCommands.ANALYZE_TAGS, URI);
        assertEquals(1, tags.size());
        assertEquals("X", tags.get(0).getName());
        assertEquals(Arrays.asList(4), tags.get(0).getUsageLines());
    }

    @Test
    void commandOnClosedDocumentIsRejected() {
        server.getTextDocumentService().didClose(new DidCloseTextDocumentParams(new TextDocumentIdentifier(URI)));
        assertNull(execute(StCommands.UNDO, URI));
        assertEquals(MessageType.Warning, client.messages.get(0).getType());
        // closing clears the published diagnostics
        assertTrue(client.diagnostics.get(client.diagnostics.size() - 1).getDiagnostics().isEmpty());
    }

    @Test
    @SuppressWarnings("unchecked")
    void saveMakesDocumentClean() {
        change(TEXT + "\nX := 2;");
        server.getTextDocumentService().didSave(new DidSaveTextDocumentParams(new TextDocumentIdentifier(URI)));
        assertTrue(((List<DiffChange>) execute(StCommands.PREVIEW_CHANGES, URI)).isEmpty());
    }

    @Test
    void configurationChangeRevalidatesOpenDocuments() {
        StLspSettings settings = server.getSettings();
        JsonObject config = JsonParser.parseString(
                "{\"structuredText\": {\"diagnostics\": {\"debounceMillis\": 10}}}").getAsJsonObject();
        server.getWorkspaceService().didChangeConfiguration(new DidChangeConfigurationParams(config));
        assertEquals(10, settings.getDebounceMillis());
        assertEquals(2, client.diagnostics.size());

        change(TEXT + "\nX := 2;");
        scheduler.advance(10);
        assertEquals(3, client.diagnostics.size());
    }

    @Test
    void pullDiagnosticsUseCurrentText() {
        change("VAR\n  X : INT;\n  Y : INT;\nEND_VAR\nX := X + 1;");
        DocumentDiagnosticReport report = server.getTextDocumentService()
                .diagnostic(new DocumentDiagnosticParams(new TextDocumentIdentifier(URI))).join();
        assertEquals(1, report.getLeft().getItems().size());
        assertEquals("unused-Y", report.getLeft().getItems().get(0).getCode().getLeft());
    }
}
