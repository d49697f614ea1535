package org.shadowide.st.lsp.provider;

import org.eclipse.lsp4j.CodeAction;
import org.eclipse.lsp4j.CodeActionKind;
import org.eclipse.lsp4j.CodeActionParams;
import org.eclipse.lsp4j.Command;
import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.TextEdit;
import org.eclipse.lsp4j.WorkspaceEdit;
import org.eclipse.lsp4j.jsonrpc.messages.Either;
import org.shadowide.st.lsp.StCommands;
import org.shadowide.st.refactor.ExtractFunctionEngine;
import org.shadowide.st.text.TextLines;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Extract-function refactoring for multi-line selections and removal of unused declarations.
 */
public class CodeActionProvider {

    public static final String DEFAULT_FUNCTION_NAME = "NewFunction";

    private static final String UNUSED_PREFIX = "unused-";

    public List<Either<Command, CodeAction>> codeActions(String content, CodeActionParams params) {
        if (content == null || params == null) {
            return Collections.emptyList();
        }
        List<Either<Command, CodeAction>> actions = new ArrayList<>();
        String uri = params.getTextDocument().getUri();
        String[] lines = TextLines.split(content);

        Range range = params.getRange();
        if (range != null) {
            int startLine = range.getStart().getLine();
            int endLine = range.getEnd().getLine();
            if (range.getEnd().getCharacter() == 0 && endLine > startLine) {
                endLine--;
            }
            if (startLine < endLine && endLine < lines.length) {
                // command arguments use 1-based lines
                Command command = new Command("Extract to function", StCommands.EXTRACT_FUNCTION,
                        Arrays.<Object>asList(uri, startLine + 1, endLine + 1, DEFAULT_FUNCTION_NAME,
                                ExtractFunctionEngine.DEFAULT_RETURN_TYPE));
                CodeAction extract = new CodeAction("Extract to function");
                extract.setKind(CodeActionKind.RefactorExtract);
                extract.setCommand(command);
                actions.add(Either.forRight(extract));
            }
        }

        if (params.getContext() != null && params.getContext().getDiagnostics() != null) {
            for (Diagnostic diagnostic : params.getContext().getDiagnostics()) {
                CodeAction fix = removeUnused(uri, lines, diagnostic);
                if (fix != null) {
                    actions.add(Either.forRight(fix));
                }
            }
        }
        return actions;
    }

    private static CodeAction removeUnused(String uri, String[] lines, Diagnostic diagnostic) {
        if (diagnostic.getCode() == null || !diagnostic.getCode().isLeft()) {
            return null;
        }
        String code = diagnostic.getCode().getLeft();
        if (code == null || !code.startsWith(UNUSED_PREFIX)) {
            return null;
        }
        int line = diagnostic.getRange().getStart().getLine();
        if (line < 0 || line >= lines.length) {
            return null;
        }
        String name = code.substring(UNUSED_PREFIX.length());
        Range deletion = line + 1 < lines.length
                ? new Range(new Position(line, 0), new Position(line + 1, 0))
                : DocumentRanges.line(lines, line);

        CodeAction fix = new CodeAction("Remove unused variable '" + name + "'");
        fix.setKind(CodeActionKind.QuickFix);
        fix.setDiagnostics(Collections.singletonList(diagnostic));
        fix.setEdit(new WorkspaceEdit(Collections.singletonMap(uri,
                Collections.singletonList(new TextEdit(deletion, "")))));
        return fix;
    }
}
