package org.shadowide.st.format;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

/**
 * Indentation settings for {@link StFormatter}.
 */
public final class FormatOptions {

    public static final int DEFAULT_TAB_SIZE = 2;

    private final int tabSize;
    private final boolean insertSpaces;

    public FormatOptions(int tabSize, boolean insertSpaces) {
        Validate.isTrue(tabSize >= 1, "tabSize must be at least 1, got %d", tabSize);
        this.tabSize = tabSize;
        this.insertSpaces = insertSpaces;
    }

    public static FormatOptions defaults() {
        return new FormatOptions(DEFAULT_TAB_SIZE, true);
    }

    public static FormatOptions spaces(int tabSize) {
        return new FormatOptions(tabSize, true);
    }

    public int getTabSize() {
        return tabSize;
    }

    public boolean isInsertSpaces() {
        return insertSpaces;
    }

    /**
     * Leading whitespace for the given nesting level.
     */
    public String indent(int level) {
        if (level <= 0) {
            return "";
        }
        if (insertSpaces) {
            return StringUtils.repeat(" ", level * tabSize);
        }
        return StringUtils.repeat("\t", level);
    }

    @Override
    public String toString() {
        return "FormatOptions{tabSize=" + tabSize + ", insertSpaces=" + insertSpaces + '}';
    }
}
