package org.shadowide.st.lsp.provider;

import org.eclipse.lsp4j.DocumentSymbol;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.SymbolInformation;
import org.eclipse.lsp4j.SymbolKind;
import org.eclipse.lsp4j.jsonrpc.messages.Either;
import org.shadowide.st.symbol.StSymbol;
import org.shadowide.st.symbol.SymbolExtractor;
import org.shadowide.st.text.TextLines;

import java.util.ArrayList;
import java.util.List;

public class DocumentSymbolProvider {

    private final SymbolExtractor symbolExtractor;

    public DocumentSymbolProvider() {
        this(new SymbolExtractor());
    }

    public DocumentSymbolProvider(SymbolExtractor symbolExtractor) {
        this.symbolExtractor = symbolExtractor;
    }

    public List<Either<SymbolInformation, DocumentSymbol>> generate(String text) {
        List<Either<SymbolInformation, DocumentSymbol>> symbols = new ArrayList<>();
        if (text == null) {
            return symbols;
        }
        String[] lines = TextLines.split(text);
        for (StSymbol symbol : symbolExtractor.extract(text)) {
            symbols.add(Either.forRight(toDocumentSymbol(symbol, lines)));
        }
        return symbols;
    }

    private DocumentSymbol toDocumentSymbol(StSymbol symbol, String[] lines) {
        int start = symbol.getDeclarationLine() - 1;
        int end = Math.max(start, symbol.getEndLine() - 1);
        Range range = new Range(new Position(start, 0), new Position(end, lines[end].length()));
        Range selection = DocumentRanges.span(start, symbol.getColumn(), symbol.getName().length());

        DocumentSymbol documentSymbol = new DocumentSymbol();
        documentSymbol.setName(symbol.getName());
        documentSymbol.setKind(kindOf(symbol));
        documentSymbol.setDetail(symbol.getDataType());
        documentSymbol.setRange(range);
        documentSymbol.setSelectionRange(selection);
        if (!symbol.getChildren().isEmpty()) {
            List<DocumentSymbol> children = new ArrayList<>();
            for (StSymbol child : symbol.getChildren()) {
                children.add(toDocumentSymbol(child, lines));
            }
            documentSymbol.setChildren(children);
        }
        return documentSymbol;
    }

    static SymbolKind kindOf(StSymbol symbol) {
        switch (symbol.getKind()) {
            case PROGRAM:
                return SymbolKind.Module;
            case FUNCTION:
                return SymbolKind.Function;
            case FUNCTION_BLOCK:
                return SymbolKind.Class;
            case UDT:
                return SymbolKind.Struct;
            default:
                return SymbolExtractor.GLOBAL_SCOPE.equals(symbol.getScope()) ? SymbolKind.Variable : SymbolKind.Field;
        }
    }
}
