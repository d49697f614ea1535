package org.shadowide.st.lsp.provider;

import org.eclipse.lsp4j.DocumentHighlight;
import org.eclipse.lsp4j.DocumentHighlightKind;
import org.eclipse.lsp4j.Location;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.PrepareRenameResult;
import org.eclipse.lsp4j.TextEdit;
import org.eclipse.lsp4j.WorkspaceEdit;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RenameProviderTest {

    private static final String URI = "file:///plc/main.st";
    private static final String TEXT = "VAR\n X: BOOL;\nEND_VAR\nIF X THEN X:=FALSE; END_IF;";

    @Test
    void renameEditsEveryOccurrence() {
        WorkspaceEdit edit = new RenameProvider().rename(TEXT, new Position(1, 1), "Flag", URI);
        List<TextEdit> edits = edit.getChanges().get(URI);
        assertEquals(3, edits.size());
        assertEquals(new Position(1, 1), edits.get(0).getRange().getStart());
        assertEquals(new Position(3, 3), edits.get(1).getRange().getStart());
        assertEquals(new Position(3, 10), edits.get(2).getRange().getStart());
        for (TextEdit textEdit : edits) {
            assertEquals("Flag", textEdit.getNewText());
        }
    }

    @Test
    void invalidNewNameProducesNoEdit() {
        assertTrue(new RenameProvider().rename(TEXT, new Position(1, 1), "1abc", URI).getChanges().isEmpty());
        assertTrue(new RenameProvider().rename(TEXT, new Position(1, 1), "END_IF", URI).getChanges().isEmpty());
    }

    @Test
    void prepareRenameRejectsKeywords() {
        RenameProvider provider = new RenameProvider();
        assertNull(provider.prepareRename(TEXT, new Position(3, 1)));
        PrepareRenameResult result = provider.prepareRename(TEXT, new Position(3, 4));
        assertEquals("X", result.getPlaceholder());
        assertEquals(new Position(3, 3), result.getRange().getStart());
    }

    @Test
    void referencesAreWholeWordAndCaseInsensitive() {
        ReferenceProvider provider = new ReferenceProvider();
        String text = "VAR\n  Speed : INT;\n  SpeedMax : INT;\nEND_VAR\nspeed := SpeedMax;";
        assertEquals("Speed", provider.getSymbolAtPosition(text, new Position(1, 4)));
        List<Location> locations = provider.findReferences(text, "Speed", URI);
        assertEquals(2, locations.size());
        assertEquals(4, locations.get(1).getRange().getStart().getLine());
        assertEquals(0, locations.get(1).getRange().getStart().getCharacter());
    }

    @Test
    void assignmentTargetsAreWriteHighlights() {
        List<DocumentHighlight> highlights = new HighlightProvider().findSymbolHighlights(TEXT, "X");
        assertEquals(3, highlights.size());
        assertEquals(DocumentHighlightKind.Read, highlights.get(0).getKind());
        assertEquals(DocumentHighlightKind.Read, highlights.get(1).getKind());
        assertEquals(DocumentHighlightKind.Write, highlights.get(2).getKind());
    }
}
