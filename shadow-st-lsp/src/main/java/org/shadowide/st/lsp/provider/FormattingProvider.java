package org.shadowide.st.lsp.provider;

import org.eclipse.lsp4j.FormattingOptions;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.TextEdit;
import org.shadowide.st.format.FormatOptions;
import org.shadowide.st.format.StFormatter;
import org.shadowide.st.lsp.config.StLspSettings;
import org.shadowide.st.text.TextLines;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Document, range and on-type formatting.
 */
public class FormattingProvider {

    private static final Logger logger = LoggerFactory.getLogger(FormattingProvider.class);

    private final StFormatter formatter;
    private final StLspSettings settings;

    public FormattingProvider(StLspSettings settings) {
        this(new StFormatter(), settings);
    }

    public FormattingProvider(StFormatter formatter, StLspSettings settings) {
        this.formatter = formatter;
        this.settings = settings;
    }

    /**
     * Formats the whole document as a single edit. No edit when the text is already formatted.
     */
    public List<TextEdit> formatDocument(String content, FormattingOptions options) {
        if (content == null) {
            return Collections.emptyList();
        }
        try {
            String formatted = formatter.format(content, toFormatOptions(options));
            if (formatted.equals(content)) {
                return Collections.emptyList();
            }
            logger.debug("Formatted document ({} lines)", TextLines.lineCount(content));
            return Collections.singletonList(new TextEdit(DocumentRanges.wholeDocument(content), formatted));
        } catch (Exception e) {
            logger.error("Error formatting document", e);
            return Collections.emptyList();
        }
    }

    /**
     * Re-indents the lines touched by {@code range}. Indentation depth is taken from the whole document.
     */
    public List<TextEdit> formatRange(String content, Range range, FormattingOptions options) {
        if (content == null || range == null) {
            return Collections.emptyList();
        }
        try {
            String[] lines = TextLines.split(content);
            int startLine = Math.max(0, range.getStart().getLine());
            int endLine = Math.min(lines.length - 1, range.getEnd().getLine());
            if (range.getEnd().getCharacter() == 0 && endLine > startLine) {
                endLine--;
            }
            return indentEdits(lines, startLine, endLine, toFormatOptions(options));
        } catch (Exception e) {
            logger.error("Error formatting range", e);
            return Collections.emptyList();
        }
    }

    /**
     * After a newline the new line is indented; after {@code ;} the current line is.
     */
    public List<TextEdit> formatOnType(String content, Position position, String ch, FormattingOptions options) {
        if (content == null || position == null) {
            return Collections.emptyList();
        }
        if (!"\n".equals(ch) && !";".equals(ch)) {
            return Collections.emptyList();
        }
        try {
            String[] lines = TextLines.split(content);
            int line = position.getLine();
            if (line < 0 || line >= lines.length) {
                return Collections.emptyList();
            }
            FormatOptions formatOptions = toFormatOptions(options);
            if ("\n".equals(ch) && TextLines.isBlank(lines[line])) {
                String indent = formatOptions.indent(formatter.levelAfter(lines, line));
                if (indent.equals(lines[line])) {
                    return Collections.emptyList();
                }
                return Collections.singletonList(new TextEdit(DocumentRanges.line(lines, line), indent));
            }
            return indentEdits(lines, line, line, formatOptions);
        } catch (Exception e) {
            logger.error("Error during on-type formatting", e);
            return Collections.emptyList();
        }
    }

    private List<TextEdit> indentEdits(String[] lines, int startLine, int endLine, FormatOptions options) {
        List<TextEdit> edits = new ArrayList<>();
        int[] levels = formatter.indentLevels(lines);
        for (int i = startLine; i <= endLine; i++) {
            String formatted = formatter.formatLine(lines[i], levels[i], options);
            if (!formatted.equals(lines[i])) {
                edits.add(new TextEdit(DocumentRanges.line(lines, i), formatted));
            }
        }
        return edits;
    }

    /**
     * Client options win over the configured defaults.
     */
    FormatOptions toFormatOptions(FormattingOptions options) {
        if (options == null || options.getTabSize() < 1) {
            return settings.toFormatOptions();
        }
        return new FormatOptions(options.getTabSize(), options.isInsertSpaces());
    }
}
