package org.shadowide.st.lsp.provider;

import org.eclipse.lsp4j.Location;
import org.eclipse.lsp4j.SymbolInformation;
import org.eclipse.lsp4j.SymbolKind;
import org.shadowide.st.tag.DeclaredTag;
import org.shadowide.st.tag.TagUsageAnalyzer;
import org.shadowide.st.text.TextLines;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Workspace symbol search over the declared tags of the open documents.
 */
public class SymbolProvider {

    private static final Logger logger = LoggerFactory.getLogger(SymbolProvider.class);

    private final TagUsageAnalyzer tagUsageAnalyzer;

    public SymbolProvider() {
        this(new TagUsageAnalyzer());
    }

    public SymbolProvider(TagUsageAnalyzer tagUsageAnalyzer) {
        this.tagUsageAnalyzer = tagUsageAnalyzer;
    }

    /**
     * @param documents uri to current text
     * @param query     regular expression, or a literal when it does not compile
     */
    @SuppressWarnings("deprecation")
    public List<SymbolInformation> searchWorkspaceSymbols(Map<String, String> documents, String query) {
        List<SymbolInformation> symbols = new ArrayList<>();
        for (Map.Entry<String, String> document : documents.entrySet()) {
            String[] lines = TextLines.split(document.getValue());
            for (DeclaredTag tag : tagUsageAnalyzer.search(document.getValue(), query)) {
                int line = tag.getDeclarationLine() - 1;
                SymbolInformation symbol = new SymbolInformation();
                symbol.setName(tag.getName());
                symbol.setKind(SymbolKind.Variable);
                symbol.setContainerName(tag.getType());
                symbol.setLocation(new Location(document.getKey(), DocumentRanges.line(lines, line)));
                symbols.add(symbol);
            }
        }
        logger.debug("Workspace symbol query '{}' matched {} tag(s)", query, symbols.size());
        return symbols;
    }
}
