package org.shadowide.st.lsp.provider;

import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.SemanticTokenModifiers;
import org.eclipse.lsp4j.SemanticTokenTypes;
import org.eclipse.lsp4j.SemanticTokensLegend;
import org.shadowide.st.lexer.StLexer;
import org.shadowide.st.lexer.StToken;
import org.shadowide.st.lexer.StTokenType;
import org.shadowide.st.symbol.StSymbol;
import org.shadowide.st.symbol.SymbolExtractor;
import org.shadowide.st.symbol.SymbolKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Semantic tokens for whole documents and ranges.
 * The order of {@link #TOKEN_TYPES} and {@link #TOKEN_MODIFIERS} is the legend the server advertises.
 */
public class SemanticTokensProvider {

    private static final Logger logger = LoggerFactory.getLogger(SemanticTokensProvider.class);

    public static final List<String> TOKEN_TYPES = Collections.unmodifiableList(Arrays.asList(
            SemanticTokenTypes.Keyword,
            SemanticTokenTypes.Type,
            SemanticTokenTypes.Variable,
            SemanticTokenTypes.Function,
            SemanticTokenTypes.Struct,
            SemanticTokenTypes.Comment,
            SemanticTokenTypes.String,
            SemanticTokenTypes.Number,
            SemanticTokenTypes.Operator
    ));

    public static final List<String> TOKEN_MODIFIERS = Collections.unmodifiableList(Arrays.asList(
            SemanticTokenModifiers.Declaration
    ));

    private static final int MODIFIER_DECLARATION = 1;

    private final StLexer lexer;
    private final SymbolExtractor symbolExtractor;

    public SemanticTokensProvider() {
        this(new StLexer(), new SymbolExtractor());
    }

    public SemanticTokensProvider(StLexer lexer, SymbolExtractor symbolExtractor) {
        this.lexer = lexer;
        this.symbolExtractor = symbolExtractor;
    }

    public static SemanticTokensLegend legend() {
        return new SemanticTokensLegend(TOKEN_TYPES, TOKEN_MODIFIERS);
    }

    public List<Integer> generateSemanticTokens(String content) {
        return generateSemanticTokens(content, null);
    }

    /**
     * @param range only tokens on lines inside the range, or all when {@code null}
     */
    public List<Integer> generateSemanticTokens(String content, Range range) {
        if (content == null || content.isEmpty()) {
            return Collections.emptyList();
        }
        try {
            Names names = names(symbolExtractor.extract(content));
            List<List<StToken>> lines = lexer.tokenize(content);
            int firstLine = range != null ? range.getStart().getLine() : 0;
            int lastLine = range != null ? range.getEnd().getLine() : lines.size() - 1;

            List<Integer> encoded = new ArrayList<>();
            int prevLine = 0;
            int prevChar = 0;
            for (int lineIndex = Math.max(0, firstLine); lineIndex <= lastLine && lineIndex < lines.size(); lineIndex++) {
                for (StToken token : lines.get(lineIndex)) {
                    int type = typeIndex(token, names);
                    if (type < 0) {
                        continue;
                    }
                    int deltaLine = lineIndex - prevLine;
                    int deltaChar = deltaLine == 0 ? token.getStart() - prevChar : token.getStart();
                    encoded.add(deltaLine);
                    encoded.add(deltaChar);
                    encoded.add(token.getLength());
                    encoded.add(type);
                    encoded.add(modifiers(token, lineIndex + 1, names));
                    prevLine = lineIndex;
                    prevChar = token.getStart();
                }
            }
            return encoded;
        } catch (Exception e) {
            logger.error("Error generating semantic tokens", e);
            return Collections.emptyList();
        }
    }

    private static int typeIndex(StToken token, Names names) {
        switch (token.getType()) {
            case KEYWORD:
                return TOKEN_TYPES.indexOf(SemanticTokenTypes.Keyword);
            case TYPE:
                return TOKEN_TYPES.indexOf(SemanticTokenTypes.Type);
            case IDENTIFIER: {
                String upper = token.getText().toUpperCase(Locale.ROOT);
                if (names.routines.contains(upper)) {
                    return TOKEN_TYPES.indexOf(SemanticTokenTypes.Function);
                }
                if (names.types.contains(upper)) {
                    return TOKEN_TYPES.indexOf(SemanticTokenTypes.Struct);
                }
                return TOKEN_TYPES.indexOf(SemanticTokenTypes.Variable);
            }
            case COMMENT:
                return TOKEN_TYPES.indexOf(SemanticTokenTypes.Comment);
            case STRING:
                return TOKEN_TYPES.indexOf(SemanticTokenTypes.String);
            case NUMBER:
                return TOKEN_TYPES.indexOf(SemanticTokenTypes.Number);
            case OPERATOR:
                return TOKEN_TYPES.indexOf(SemanticTokenTypes.Operator);
            default:
                // invalid spans are left to the client's own colouring
                return -1;
        }
    }

    private static int modifiers(StToken token, int line, Names names) {
        if (!token.is(StTokenType.IDENTIFIER)) {
            return 0;
        }
        return names.declarations.contains(line + ":" + token.getStart()) ? MODIFIER_DECLARATION : 0;
    }

    private static Names names(List<StSymbol> symbols) {
        Names names = new Names();
        for (StSymbol symbol : SymbolExtractor.flatten(symbols)) {
            String upper = symbol.getName().toUpperCase(Locale.ROOT);
            if (symbol.getKind().isRoutine()) {
                names.routines.add(upper);
            } else if (symbol.getKind() == SymbolKind.UDT) {
                names.types.add(upper);
            }
            names.declarations.add(symbol.getDeclarationLine() + ":" + symbol.getColumn());
        }
        return names;
    }

    private static final class Names {
        final Set<String> routines = new HashSet<>();
        final Set<String> types = new HashSet<>();
        final Set<String> declarations = new HashSet<>();
    }
}
