package org.shadowide.st.lsp.provider;

import org.eclipse.lsp4j.Location;
import org.eclipse.lsp4j.Position;
import org.shadowide.st.refactor.RenameEngine;
import org.shadowide.st.symbol.StReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Whole-word occurrences of the identifier under the cursor.
 */
public class ReferenceProvider {

    private static final Logger logger = LoggerFactory.getLogger(ReferenceProvider.class);

    private final RenameEngine renameEngine;

    public ReferenceProvider() {
        this(new RenameEngine());
    }

    public ReferenceProvider(RenameEngine renameEngine) {
        this.renameEngine = renameEngine;
    }

    public String getSymbolAtPosition(String content, Position position) {
        return DocumentRanges.wordAt(content, position);
    }

    public List<Location> findReferences(String content, String symbol, String uri) {
        List<Location> locations = new ArrayList<>();
        for (StReference reference : renameEngine.findOccurrences(content, symbol)) {
            locations.add(new Location(uri,
                    DocumentRanges.span(reference.getLine() - 1, reference.getColumn(), reference.getLength())));
        }
        logger.debug("Found {} references to '{}' in {}", locations.size(), symbol, uri);
        return locations;
    }
}
