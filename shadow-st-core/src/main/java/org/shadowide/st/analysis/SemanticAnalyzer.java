package org.shadowide.st.analysis;

import org.apache.commons.lang3.Validate;
import org.shadowide.st.lexer.StLexer;
import org.shadowide.st.lexer.StToken;
import org.shadowide.st.lexer.StTokenType;
import org.shadowide.st.rule.RuleOutcome;
import org.shadowide.st.rule.ValidationRule;
import org.shadowide.st.symbol.StSymbol;
import org.shadowide.st.symbol.SymbolExtractor;
import org.shadowide.st.symbol.SymbolKind;
import org.shadowide.st.symbol.VarDeclaration;
import org.shadowide.st.symbol.VarDeclarationParser;
import org.shadowide.st.text.TextLines;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-level checks on top of the lexer and the symbol table: unused variables, direct I/O addresses, deep loop
 * nesting, costly math and string calls, and initial values that break a tag's validation rules. Also estimates
 * resource usage.
 */
public class SemanticAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(SemanticAnalyzer.class);

    private static final Set<String> LOOP_OPEN = new HashSet<>(Arrays.asList("FOR", "WHILE", "REPEAT"));
    private static final Set<String> LOOP_CLOSE = new HashSet<>(Arrays.asList("END_FOR", "END_WHILE", "END_REPEAT"));
    private static final Set<String> HEAVY_MATH = new HashSet<>(Arrays.asList(
            "SIN", "COS", "TAN", "SQRT", "EXP", "LOG", "POW"));
    private static final Set<String> STRING_FUNCTIONS = new HashSet<>(Arrays.asList(
            "CONCAT", "INSERT", "DELETE", "FIND", "REPLACE"));

    private static final Pattern STRING_TYPE = Pattern.compile("^W?STRING(?:\\((\\d+)\\)|\\[(\\d+)\\])?$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern ARRAY_TYPE = Pattern.compile(
            "^ARRAY\\s*\\[\\s*(-?\\d+)\\s*\\.\\.\\s*(-?\\d+)\\s*\\]\\s*OF\\s+(.+)$", Pattern.CASE_INSENSITIVE);

    private final StLexer lexer;
    private final SymbolExtractor symbolExtractor;

    public SemanticAnalyzer() {
        this(new StLexer(), new SymbolExtractor());
    }

    public SemanticAnalyzer(StLexer lexer, SymbolExtractor symbolExtractor) {
        this.lexer = lexer;
        this.symbolExtractor = symbolExtractor;
    }

    public AnalysisResult analyze(String text, AnalysisOptions options) {
        Validate.notNull(text, "text");
        Validate.notNull(options, "options");
        String[] lines = TextLines.split(text);
        List<List<StToken>> tokens = lexer.tokenize(text);
        List<StDiagnostic> diagnostics = new ArrayList<>();

        String section = null;
        int loopDepth = 0;
        int cpu = 0;
        double scanTime = 0;
        long memory = 0;

        for (int i = 0; i < lines.length; i++) {
            int lineNumber = i + 1;
            String trimmed = lines[i].trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            String blockStart = VarDeclarationParser.blockStart(trimmed);
            if (blockStart != null) {
                section = blockStart;
                continue;
            }
            if (VarDeclarationParser.isBlockEnd(trimmed)) {
                section = null;
                continue;
            }
            if (section != null) {
                VarDeclaration declaration = VarDeclarationParser.parse(lines[i], lineNumber, section);
                if (declaration != null) {
                    memory += estimateTypeSize(declaration.getDataType());
                    checkRules(declaration, options, lines[i], diagnostics);
                }
                continue;
            }

            boolean directIo = false;
            boolean heavyMath = false;
            boolean stringOp = false;
            for (StToken token : tokens.get(i)) {
                String upper = token.getText().toUpperCase(Locale.ROOT);
                if (token.is(StTokenType.KEYWORD) && LOOP_OPEN.contains(upper)) {
                    loopDepth++;
                    cpu += 5;
                    scanTime += 0.5;
                    if (loopDepth > options.getMaxLoopDepth()) {
                        diagnostics.add(new StDiagnostic("loop-depth-" + lineNumber, lineNumber, token.getStart(),
                                token.getLength(), DiagnosticSeverity.WARNING, DiagnosticCategory.PERFORMANCE,
                                "Deeply nested loops (depth: " + loopDepth + ") may cause performance issues",
                                "Consider refactoring to reduce loop nesting"));
                    }
                } else if (token.is(StTokenType.KEYWORD) && LOOP_CLOSE.contains(upper)) {
                    loopDepth = Math.max(0, loopDepth - 1);
                } else if (token.is(StTokenType.IDENTIFIER) && upper.startsWith("%") && !directIo) {
                    directIo = true;
                    diagnostics.add(new StDiagnostic("unsafe-io-" + lineNumber, lineNumber, token.getStart(),
                            token.getLength(), DiagnosticSeverity.ERROR, DiagnosticCategory.UNSAFE_IO,
                            "Direct I/O access without validation detected",
                            "Use mapped tags instead of direct I/O addresses"));
                } else if (token.is(StTokenType.IDENTIFIER) && HEAVY_MATH.contains(upper) && !heavyMath) {
                    heavyMath = true;
                    cpu += 2;
                    scanTime += 0.1;
                    diagnostics.add(new StDiagnostic("heavy-math-" + lineNumber, lineNumber, token.getStart(),
                            token.getLength(), DiagnosticSeverity.INFO, DiagnosticCategory.PERFORMANCE,
                            "Resource-intensive mathematical operation detected",
                            "Consider caching results if called frequently"));
                } else if (token.is(StTokenType.IDENTIFIER) && STRING_FUNCTIONS.contains(upper) && !stringOp) {
                    stringOp = true;
                    cpu += 1;
                    scanTime += 0.05;
                    diagnostics.add(new StDiagnostic("string-op-" + lineNumber, lineNumber, token.getStart(),
                            token.getLength(), DiagnosticSeverity.INFO, DiagnosticCategory.PERFORMANCE,
                            "String operations can impact scan time", null));
                }
            }
        }

        addUnusedVariables(text, diagnostics);
        diagnostics.sort(Comparator.comparingInt(StDiagnostic::getLine).thenComparingInt(StDiagnostic::getColumn));
        ResourceUsage usage = new ResourceUsage(Math.min(100, cpu), memory, scanTime);
        logger.debug("Semantic analysis produced {} diagnostics, {}", diagnostics.size(), usage);
        return new AnalysisResult(diagnostics, usage);
    }

    private void addUnusedVariables(String text, List<StDiagnostic> diagnostics) {
        for (StSymbol symbol : symbolExtractor.extract(text)) {
            if (symbol.getKind() == SymbolKind.VARIABLE) {
                addIfUnused(symbol, diagnostics);
            } else if (symbol.getKind().isRoutine()) {
                for (StSymbol child : symbol.getChildren()) {
                    addIfUnused(child, diagnostics);
                }
            }
        }
    }

    private static void addIfUnused(StSymbol variable, List<StDiagnostic> diagnostics) {
        if (variable.isUsed()) {
            return;
        }
        diagnostics.add(new StDiagnostic("unused-" + variable.getName(), variable.getDeclarationLine(),
                variable.getColumn(), variable.getName().length(), DiagnosticSeverity.HINT,
                DiagnosticCategory.RESOURCE, "Variable '" + variable.getName() + "' declared but never used",
                "Remove unused variable '" + variable.getName() + "' to save memory"));
    }

    private static void checkRules(VarDeclaration declaration, AnalysisOptions options, String line,
                                   List<StDiagnostic> diagnostics) {
        if (declaration.getInitialValue() == null) {
            return;
        }
        List<ValidationRule> rules = options.rulesFor(declaration.getName());
        for (int r = 0; r < rules.size(); r++) {
            ValidationRule rule = rules.get(r);
            if (rule.evaluate(declaration.getInitialValue()) != RuleOutcome.FAIL) {
                continue;
            }
            int column = line.indexOf(declaration.getInitialValue());
            diagnostics.add(new StDiagnostic(
                    "rule-" + (rule.getId() != null ? rule.getId() : rule.getType() + r) + "-" + declaration.getLine(),
                    declaration.getLine(), column < 0 ? declaration.getColumn() : column,
                    column < 0 ? declaration.getName().length() : declaration.getInitialValue().length(),
                    DiagnosticSeverity.of(rule.getSeverity()), DiagnosticCategory.VALIDATION,
                    declaration.getName() + ": " + rule.getMessage(), null));
        }
    }

    /**
     * Bytes a variable of {@code type} occupies; unknown and user types count as 4.
     */
    static long estimateTypeSize(String type) {
        String upper = type.trim().toUpperCase(Locale.ROOT);
        Matcher array = ARRAY_TYPE.matcher(upper);
        if (array.matches()) {
            long count = Long.parseLong(array.group(2)) - Long.parseLong(array.group(1)) + 1;
            return Math.max(0, count) * estimateTypeSize(array.group(3));
        }
        Matcher string = STRING_TYPE.matcher(upper);
        if (string.matches()) {
            String size = string.group(1) != null ? string.group(1) : string.group(2);
            long chars = size != null ? Long.parseLong(size) : 80;
            return upper.startsWith("W") ? chars * 2 : chars;
        }
        switch (upper) {
            case "BOOL":
            case "BYTE":
            case "SINT":
            case "USINT":
                return 1;
            case "INT":
            case "UINT":
            case "WORD":
                return 2;
            case "LINT":
            case "ULINT":
            case "LWORD":
            case "LREAL":
            case "LTIME":
                return 8;
            default:
                return 4;
        }
    }
}
