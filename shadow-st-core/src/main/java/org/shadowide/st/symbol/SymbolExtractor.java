package org.shadowide.st.symbol;

import org.apache.commons.lang3.Validate;
import org.shadowide.st.lexer.StLexer;
import org.shadowide.st.lexer.StToken;
import org.shadowide.st.lexer.StTokenType;
import org.shadowide.st.text.TextLines;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds the symbol table of one document.
 * <p>
 * Routine headers ({@code PROGRAM}, {@code FUNCTION}, {@code FUNCTION_BLOCK}) and {@code TYPE} structures become
 * top-level symbols. Variables are only recognized inside {@code VAR*...END_VAR} blocks, or as members inside a
 * {@code STRUCT}, and become children of the enclosing routine or structure; outside any routine they are top
 * level with scope {@code global}. Reference counts come from a second pass over the identifier tokens of every
 * other line.
 */
public class SymbolExtractor {

    private static final Logger logger = LoggerFactory.getLogger(SymbolExtractor.class);

    public static final String GLOBAL_SCOPE = "global";

    private static final Pattern ROUTINE = Pattern.compile(
            "^(PROGRAM|FUNCTION_BLOCK|FUNCTION)\\s+([A-Za-z_][A-Za-z0-9_]*)(?:\\s*:\\s*([A-Za-z_][A-Za-z0-9_]*))?",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern ROUTINE_END = Pattern.compile(
            "^END_(PROGRAM|FUNCTION_BLOCK|FUNCTION)\\s*;?\\s*$", Pattern.CASE_INSENSITIVE);

    private static final Pattern TYPE_START = Pattern.compile(
            "^TYPE(?:\\s+([A-Za-z_][A-Za-z0-9_]*)\\s*:?\\s*(STRUCT)?)?\\s*;?\\s*$", Pattern.CASE_INSENSITIVE);

    private static final Pattern TYPE_END = Pattern.compile("^END_TYPE\\s*;?\\s*$", Pattern.CASE_INSENSITIVE);

    private static final Pattern STRUCT_START = Pattern.compile(
            "^([A-Za-z_][A-Za-z0-9_]*)\\s*:\\s*STRUCT\\s*$", Pattern.CASE_INSENSITIVE);

    private static final Pattern STRUCT_END = Pattern.compile("^END_STRUCT\\s*;?\\s*$", Pattern.CASE_INSENSITIVE);

    private final StLexer lexer;

    public SymbolExtractor() {
        this(new StLexer());
    }

    public SymbolExtractor(StLexer lexer) {
        this.lexer = lexer;
    }

    public List<StSymbol> extract(String text) {
        Validate.notNull(text, "text");
        String[] lines = TextLines.split(text);
        List<StSymbol> symbols = new ArrayList<>();

        StSymbol routine = null;
        StSymbol structure = null;
        boolean inTypeBlock = false;
        String section = null;

        for (int i = 0; i < lines.length; i++) {
            int lineNumber = i + 1;
            String line = lines[i];
            String trimmed = line.trim();
            if (trimmed.isEmpty() || TextLines.isCommentLine(trimmed)) {
                continue;
            }

            if (section != null) {
                if (VarDeclarationParser.isBlockEnd(trimmed)) {
                    section = null;
                } else {
                    VarDeclaration declaration = VarDeclarationParser.parse(line, lineNumber, section);
                    if (declaration != null) {
                        StSymbol variable = StSymbol.variable(declaration,
                                routine == null ? GLOBAL_SCOPE : routine.getName());
                        if (routine == null) {
                            symbols.add(variable);
                        } else {
                            routine.addChild(variable);
                        }
                    }
                }
                continue;
            }

            String blockStart = VarDeclarationParser.blockStart(trimmed);
            if (blockStart != null) {
                section = blockStart;
                continue;
            }

            if (inTypeBlock) {
                if (structure != null && STRUCT_END.matcher(trimmed).matches()) {
                    structure.setEndLine(lineNumber);
                    structure = null;
                    continue;
                }
                if (TYPE_END.matcher(trimmed).matches()) {
                    if (structure != null) {
                        structure.setEndLine(lineNumber);
                    }
                    structure = null;
                    inTypeBlock = false;
                    continue;
                }
                if (structure == null) {
                    Matcher struct = STRUCT_START.matcher(trimmed);
                    if (struct.matches()) {
                        structure = new StSymbol(struct.group(1), SymbolKind.UDT, null, lineNumber,
                                offset(line, trimmed) + struct.start(1), GLOBAL_SCOPE);
                        symbols.add(structure);
                    }
                    continue;
                }
                VarDeclaration member = VarDeclarationParser.parse(line, lineNumber, "STRUCT");
                if (member != null) {
                    structure.addChild(StSymbol.variable(member, structure.getName()));
                }
                continue;
            }

            Matcher type = TYPE_START.matcher(trimmed);
            if (type.matches()) {
                inTypeBlock = true;
                if (type.group(1) != null) {
                    structure = new StSymbol(type.group(1), SymbolKind.UDT, null, lineNumber,
                            offset(line, trimmed) + type.start(1), GLOBAL_SCOPE);
                    symbols.add(structure);
                }
                continue;
            }

            Matcher header = ROUTINE.matcher(trimmed);
            if (header.find()) {
                String name = header.group(2);
                routine = new StSymbol(name, routineKind(header.group(1)), header.group(3), lineNumber,
                        offset(line, trimmed) + header.start(2), GLOBAL_SCOPE);
                symbols.add(routine);
                continue;
            }

            if (routine != null && ROUTINE_END.matcher(trimmed).matches()) {
                routine.setEndLine(lineNumber);
                routine = null;
            }
        }
        if (routine != null) {
            // unterminated routine runs to the end of the document
            routine.setEndLine(lines.length);
        }

        countReferences(symbols, lines);
        if (logger.isDebugEnabled()) {
            logger.debug("Extracted {} top-level symbols from {} lines", symbols.size(), lines.length);
        }
        return symbols;
    }

    /**
     * Routines only, in document order.
     */
    public List<StSymbol> extractRoutines(String text) {
        List<StSymbol> routines = new ArrayList<>();
        for (StSymbol symbol : extract(text)) {
            if (symbol.getKind().isRoutine()) {
                routines.add(symbol);
            }
        }
        return routines;
    }

    /**
     * All symbols, parents before their children.
     */
    public static List<StSymbol> flatten(List<StSymbol> symbols) {
        List<StSymbol> flat = new ArrayList<>();
        for (StSymbol symbol : symbols) {
            flat.add(symbol);
            flat.addAll(symbol.getChildren());
        }
        return flat;
    }

    private void countReferences(List<StSymbol> symbols, String[] lines) {
        Map<String, List<StReference>> occurrences = new HashMap<>();
        List<List<StToken>> tokens = lexer.tokenize(TextLines.join(lines));
        for (int i = 0; i < tokens.size(); i++) {
            for (StToken token : tokens.get(i)) {
                if (token.is(StTokenType.IDENTIFIER)) {
                    occurrences.computeIfAbsent(token.getText().toUpperCase(Locale.ROOT), k -> new ArrayList<>())
                            .add(new StReference(i + 1, token.getStart(), token.getLength()));
                }
            }
        }
        for (StSymbol symbol : flatten(symbols)) {
            List<StReference> references = new ArrayList<>();
            for (StReference reference : occurrences.getOrDefault(symbol.getName().toUpperCase(Locale.ROOT),
                    new ArrayList<>())) {
                if (reference.getLine() != symbol.getDeclarationLine()) {
                    references.add(reference);
                }
            }
            symbol.setReferences(references);
        }
    }

    private static int offset(String line, String trimmed) {
        return Math.max(0, line.indexOf(trimmed));
    }

    private static SymbolKind routineKind(String keyword) {
        String upper = keyword.toUpperCase(Locale.ROOT);
        if ("PROGRAM".equals(upper)) {
            return SymbolKind.PROGRAM;
        }
        if ("FUNCTION_BLOCK".equals(upper)) {
            return SymbolKind.FUNCTION_BLOCK;
        }
        return SymbolKind.FUNCTION;
    }
}
