package org.shadowide.st.lexer;

/**
 * A classified span on one line. Offsets are 0-based, {@code end} is exclusive.
 */
public final class StToken {

    private final StTokenType type;
    private final int start;
    private final int end;
    private final String text;

    public StToken(StTokenType type, int start, int end, String text) {
        this.type = type;
        this.start = start;
        this.end = end;
        this.text = text;
    }

    public StTokenType getType() {
        return type;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public int getLength() {
        return end - start;
    }

    public String getText() {
        return text;
    }

    public boolean is(StTokenType type) {
        return this.type == type;
    }

    @Override
    public String toString() {
        return type + "[" + start + "," + end + ")'" + text + "'";
    }
}
