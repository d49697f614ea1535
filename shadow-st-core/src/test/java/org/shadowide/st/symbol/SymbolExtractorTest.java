package org.shadowide.st.symbol;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SymbolExtractorTest {

    private static final String SOURCE = String.join("\n",
            "PROGRAM Main",
            "VAR",
            "  counter : INT := 0; (* loop counter *)",
            "  unused : BOOL;",
            "END_VAR",
            "counter := counter + 1;",
            "END_PROGRAM",
            "FUNCTION Add : INT",
            "VAR_INPUT",
            "  a : INT;",
            "  b : INT;",
            "END_VAR",
            "Add := a + b;",
            "END_FUNCTION");

    private final SymbolExtractor extractor = new SymbolExtractor();

    @Test
    void extractsRoutinesWithVariables() {
        List<StSymbol> symbols = extractor.extract(SOURCE);
        assertEquals(2, symbols.size());

        StSymbol main = symbols.get(0);
        assertEquals("Main", main.getName());
        assertEquals(SymbolKind.PROGRAM, main.getKind());
        assertEquals(1, main.getDeclarationLine());
        assertEquals(7, main.getEndLine());
        assertEquals(8, main.getColumn());
        assertTrue(main.isUsed());
        assertEquals(2, main.getChildren().size());

        StSymbol add = symbols.get(1);
        assertEquals(SymbolKind.FUNCTION, add.getKind());
        assertEquals("INT", add.getDataType());
        assertEquals(14, add.getEndLine());
        assertEquals(1, add.getReferenceCount());
    }

    @Test
    void variablesCarryDeclarationDetails() {
        StSymbol counter = extractor.extract(SOURCE).get(0).getChildren().get(0);
        assertEquals("counter", counter.getName());
        assertEquals(SymbolKind.VARIABLE, counter.getKind());
        assertEquals("INT", counter.getDataType());
        assertEquals("0", counter.getInitialValue());
        assertEquals("loop counter", counter.getDescription());
        assertEquals("Main", counter.getScope());
        assertEquals(3, counter.getDeclarationLine());
        assertEquals(2, counter.getColumn());
        assertEquals("VAR", counter.getSection());
    }

    @Test
    void referenceCountSkipsDeclarationLine() {
        List<StSymbol> symbols = extractor.extract(SOURCE);
        StSymbol counter = symbols.get(0).getChildren().get(0);
        StSymbol unused = symbols.get(0).getChildren().get(1);
        assertEquals(2, counter.getReferenceCount());
        assertEquals(6, counter.getReferences().get(0).getLine());
        assertTrue(counter.isUsed());
        assertEquals(0, unused.getReferenceCount());
        assertFalse(unused.isUsed());

        StSymbol a = symbols.get(1).getChildren().get(0);
        assertEquals("VAR_INPUT", a.getSection());
        assertEquals(1, a.getReferenceCount());
    }

    @Test
    void commentsAreNotReferences() {
        String text = "PROGRAM p\nVAR\n  x : INT;\nEND_VAR\n// x is unused\n(* x *)\nEND_PROGRAM";
        StSymbol x = extractor.extract(text).get(0).getChildren().get(0);
        assertEquals(0, x.getReferenceCount());
    }

    @Test
    void malformedDeclarationsAreSkipped() {
        String text = "PROGRAM p\nVAR\n  this is not valid\n  ok : INT;\n  : REAL;\nEND_VAR\nEND_PROGRAM";
        List<StSymbol> children = extractor.extract(text).get(0).getChildren();
        assertEquals(1, children.size());
        assertEquals("ok", children.get(0).getName());
    }

    @Test
    void variablesOutsideRoutinesAreGlobal() {
        List<StSymbol> symbols = extractor.extract("VAR_GLOBAL\n  g : REAL;\nEND_VAR\nPROGRAM p\nEND_PROGRAM");
        assertEquals(2, symbols.size());
        assertEquals(SymbolKind.VARIABLE, symbols.get(0).getKind());
        assertEquals(SymbolExtractor.GLOBAL_SCOPE, symbols.get(0).getScope());
        assertEquals(SymbolKind.PROGRAM, symbols.get(1).getKind());
    }

    @Test
    void structuresBecomeUdtSymbols() {
        String text = "TYPE Motor :\nSTRUCT\n  speed : REAL;\nEND_STRUCT\nEND_TYPE";
        List<StSymbol> symbols = extractor.extract(text);
        assertEquals(1, symbols.size());
        assertEquals(SymbolKind.UDT, symbols.get(0).getKind());
        assertEquals("Motor", symbols.get(0).getName());
        assertEquals("speed", symbols.get(0).getChildren().get(0).getName());
        assertEquals(4, symbols.get(0).getEndLine());
    }

    @Test
    void unterminatedRoutineRunsToEnd() {
        StSymbol fb = extractor.extract("FUNCTION_BLOCK Valve\nVAR\n  open : BOOL;\nEND_VAR").get(0);
        assertEquals(SymbolKind.FUNCTION_BLOCK, fb.getKind());
        assertNull(fb.getDataType());
        assertEquals(4, fb.getEndLine());
    }

    @Test
    void emptyTextHasNoSymbols() {
        assertTrue(extractor.extract("").isEmpty());
    }
}
