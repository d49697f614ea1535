package org.shadowide.st.analysis;

/**
 * Size and branching figures of one routine body.
 */
public final class RoutineMetrics {

    private final String routineName;
    private final int linesOfCode;
    private final int numberOfVariables;
    private final int numberOfBranches;

    public RoutineMetrics(String routineName, int linesOfCode, int numberOfVariables, int numberOfBranches) {
        this.routineName = routineName;
        this.linesOfCode = linesOfCode;
        this.numberOfVariables = numberOfVariables;
        this.numberOfBranches = numberOfBranches;
    }

    public String getRoutineName() {
        return routineName;
    }

    /**
     * Non-blank, non-comment lines between header and end keyword.
     */
    public int getLinesOfCode() {
        return linesOfCode;
    }

    public int getNumberOfVariables() {
        return numberOfVariables;
    }

    public int getNumberOfBranches() {
        return numberOfBranches;
    }

    public int getCyclomaticComplexity() {
        return numberOfBranches + 1;
    }

    @Override
    public String toString() {
        return routineName + "{loc=" + linesOfCode + ", vars=" + numberOfVariables + ", complexity="
                + getCyclomaticComplexity() + '}';
    }
}
