package org.shadowide.st.diff;

import org.apache.commons.lang3.Validate;
import org.shadowide.st.text.TextLines;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Index-aligned line comparison of a saved and a working snapshot.
 * <p>
 * Line {@code i} of one side is only ever compared with line {@code i} of the other, so an inserted line shows up as
 * a run of modifications followed by one addition. The change preview keys its per-line accept and reject actions
 * on this alignment.
 */
public class DiffEngine {

    private static final Logger logger = LoggerFactory.getLogger(DiffEngine.class);

    /**
     * One entry per line index up to the longer of the two texts.
     */
    public List<DiffChange> diff(String originalText, String modifiedText) {
        Validate.notNull(originalText, "originalText");
        Validate.notNull(modifiedText, "modifiedText");
        String[] original = TextLines.split(originalText);
        String[] modified = TextLines.split(modifiedText);
        int maxLines = Math.max(original.length, modified.length);
        Map<ChangeType, Integer> counters = new EnumMap<>(ChangeType.class);
        List<DiffChange> changes = new ArrayList<>(maxLines);

        for (int i = 0; i < maxLines; i++) {
            String before = i < original.length ? original[i] : null;
            String after = i < modified.length ? modified[i] : null;
            int lineNumber = i + 1;
            if (before == null) {
                changes.add(new DiffChange(nextId(counters, ChangeType.ADDED), ChangeType.ADDED,
                        null, lineNumber, null, after));
            } else if (after == null) {
                changes.add(new DiffChange(nextId(counters, ChangeType.REMOVED), ChangeType.REMOVED,
                        lineNumber, null, before, null));
            } else if (!before.equals(after)) {
                changes.add(new DiffChange(nextId(counters, ChangeType.MODIFIED), ChangeType.MODIFIED,
                        lineNumber, lineNumber, before, after));
            } else {
                changes.add(new DiffChange(nextId(counters, ChangeType.UNCHANGED), ChangeType.UNCHANGED,
                        lineNumber, lineNumber, before, after));
            }
        }
        return changes;
    }

    /**
     * Entries other than {@link ChangeType#UNCHANGED}.
     */
    public List<DiffChange> changesOnly(String originalText, String modifiedText) {
        List<DiffChange> result = new ArrayList<>();
        for (DiffChange change : diff(originalText, modifiedText)) {
            if (change.isChange()) {
                result.add(change);
            }
        }
        return result;
    }

    public int countChanges(String originalText, String modifiedText) {
        return changesOnly(originalText, modifiedText).size();
    }

    /**
     * Undoes one change in the working text: a modified line gets its original text back, an added line is removed
     * and a removed line is re-inserted at its original position. When the working text no longer holds the line
     * the change describes, the text is returned unchanged.
     */
    public String reject(String workingText, DiffChange change) {
        Validate.notNull(workingText, "workingText");
        Validate.notNull(change, "change");
        List<String> lines = new ArrayList<>(TextLines.splitToList(workingText));
        switch (change.getType()) {
            case MODIFIED: {
                int index = change.getOriginalLine() - 1;
                if (!lineEquals(lines, index, change.getModifiedText())) {
                    return stale(workingText, change);
                }
                lines.set(index, change.getOriginalText());
                break;
            }
            case ADDED: {
                int index = change.getModifiedLine() - 1;
                if (!lineEquals(lines, index, change.getModifiedText()) || lines.size() == 1) {
                    return stale(workingText, change);
                }
                lines.remove(index);
                break;
            }
            case REMOVED: {
                int index = Math.min(Math.max(0, change.getOriginalLine() - 1), lines.size());
                lines.add(index, change.getOriginalText());
                break;
            }
            default:
                return workingText;
        }
        return TextLines.join(lines);
    }

    private static boolean lineEquals(List<String> lines, int index, String expected) {
        return index >= 0 && index < lines.size() && lines.get(index).equals(expected);
    }

    private static String stale(String workingText, DiffChange change) {
        logger.debug("Change {} no longer applies to the working text", change.getChangeId());
        return workingText;
    }

    private static String nextId(Map<ChangeType, Integer> counters, ChangeType type) {
        int n = counters.merge(type, 1, Integer::sum) - 1;
        return type.getIdPrefix() + "-" + n;
    }
}
