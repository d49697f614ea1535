package org.shadowide.st.lsp.provider;

import org.eclipse.lsp4j.FoldingRange;
import org.eclipse.lsp4j.FoldingRangeKind;
import org.shadowide.st.lexer.LexerState;
import org.shadowide.st.lexer.StLexer;
import org.shadowide.st.lexer.StToken;
import org.shadowide.st.lexer.StTokenType;
import org.shadowide.st.text.TextLines;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Locale;

/**
 * Folding for routines, VAR sections, control blocks, type declarations and multi-line comments.
 */
public class FoldingProvider {

    private static final Logger logger = LoggerFactory.getLogger(FoldingProvider.class);

    private final StLexer lexer;

    public FoldingProvider() {
        this(new StLexer());
    }

    public FoldingProvider(StLexer lexer) {
        this.lexer = lexer;
    }

    public List<FoldingRange> createFoldingRanges(String content) {
        try {
            if (content == null || content.trim().isEmpty()) {
                return Collections.emptyList();
            }
            List<FoldingRange> foldingRanges = new ArrayList<>();
            Deque<Block> open = new ArrayDeque<>();
            String[] lines = TextLines.split(content);
            LexerState state = LexerState.ROOT;
            int commentStart = -1;

            for (int lineIndex = 0; lineIndex < lines.length; lineIndex++) {
                StLexer.LineTokens lineTokens = lexer.tokenizeLine(lines[lineIndex], state);
                if (state != LexerState.BLOCK_COMMENT && lineTokens.getEndState() == LexerState.BLOCK_COMMENT) {
                    commentStart = lineIndex;
                } else if (state == LexerState.BLOCK_COMMENT && lineTokens.getEndState() != LexerState.BLOCK_COMMENT) {
                    addRange(foldingRanges, commentStart, lineIndex, FoldingRangeKind.Comment);
                    commentStart = -1;
                }
                state = lineTokens.getEndState();

                for (StToken token : lineTokens.getTokens()) {
                    if (!token.is(StTokenType.KEYWORD)) {
                        continue;
                    }
                    String keyword = token.getText().toUpperCase(Locale.ROOT);
                    if (keyword.startsWith("END_")) {
                        close(open, blockName(keyword.substring(4)), lineIndex, foldingRanges);
                    } else if (isOpening(keyword)) {
                        open.push(new Block(blockName(keyword), lineIndex));
                    }
                }
            }
            return foldingRanges;
        } catch (Exception e) {
            logger.error("Error creating folding ranges", e);
            return Collections.emptyList();
        }
    }

    private static boolean isOpening(String keyword) {
        switch (keyword) {
            case "PROGRAM":
            case "FUNCTION":
            case "FUNCTION_BLOCK":
            case "IF":
            case "CASE":
            case "FOR":
            case "WHILE":
            case "REPEAT":
            case "STRUCT":
            case "TYPE":
                return true;
            default:
                return keyword.startsWith("VAR");
        }
    }

    /**
     * VAR_INPUT and friends all close with END_VAR.
     */
    private static String blockName(String keyword) {
        return keyword.startsWith("VAR") ? "VAR" : keyword;
    }

    private static void close(Deque<Block> open, String name, int endLine, List<FoldingRange> foldingRanges) {
        boolean matched = false;
        for (Block block : open) {
            if (block.name.equals(name)) {
                matched = true;
                break;
            }
        }
        if (!matched) {
            return;
        }
        // unwinds blocks that were never closed
        while (!open.isEmpty()) {
            Block block = open.pop();
            if (block.name.equals(name)) {
                addRange(foldingRanges, block.startLine, endLine, "VAR".equals(name) ? FoldingRangeKind.Region : null);
                return;
            }
        }
    }

    private static void addRange(List<FoldingRange> foldingRanges, int startLine, int endLine, String kind) {
        if (startLine < 0 || endLine <= startLine) {
            return;
        }
        FoldingRange range = new FoldingRange(startLine, endLine);
        if (kind != null) {
            range.setKind(kind);
        }
        foldingRanges.add(range);
    }

    private static final class Block {
        final String name;
        final int startLine;

        Block(String name, int startLine) {
            this.name = name;
            this.startLine = startLine;
        }
    }
}
