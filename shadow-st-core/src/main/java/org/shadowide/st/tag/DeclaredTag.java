package org.shadowide.st.tag;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A variable declared in the document together with every line its name appears on.
 */
public final class DeclaredTag {

    private final String name;
    private final String type;
    private final String initialValue;
    private final String description;
    private final int declarationLine;
    private final List<Integer> allLines;
    private final List<Integer> usageLines;

    public DeclaredTag(String name, String type, String initialValue, String description, int declarationLine,
                       List<Integer> allLines) {
        this.name = name;
        this.type = type;
        this.initialValue = initialValue;
        this.description = description;
        this.declarationLine = declarationLine;
        this.allLines = Collections.unmodifiableList(new ArrayList<>(allLines));
        List<Integer> usage = new ArrayList<>();
        for (Integer line : allLines) {
            if (line != declarationLine) {
                usage.add(line);
            }
        }
        this.usageLines = Collections.unmodifiableList(usage);
    }

    public String getName() {
        return name;
    }

    public String getType() {
        return type;
    }

    public String getInitialValue() {
        return initialValue;
    }

    public String getDescription() {
        return description;
    }

    public int getDeclarationLine() {
        return declarationLine;
    }

    /**
     * 1-based lines containing the name, declaration included.
     */
    public List<Integer> getAllLines() {
        return allLines;
    }

    /**
     * {@link #getAllLines()} without the declaration line.
     */
    public List<Integer> getUsageLines() {
        return usageLines;
    }

    public int getUsageCount() {
        return usageLines.size();
    }

    public boolean isUsed() {
        return !usageLines.isEmpty();
    }

    @Override
    public String toString() {
        return name + " : " + type + " declared@" + declarationLine + " used@" + usageLines;
    }
}
