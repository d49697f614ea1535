package org.shadowide.st.diff;

public enum ChangeType {
    ADDED("added", "add"),
    REMOVED("removed", "remove"),
    MODIFIED("modified", "modify"),
    UNCHANGED("unchanged", "same");

    private final String id;
    private final String idPrefix;

    ChangeType(String id, String idPrefix) {
        this.id = id;
        this.idPrefix = idPrefix;
    }

    public String getId() {
        return id;
    }

    /**
     * Prefix of the change ids of this kind, e.g. {@code add} in {@code add-3}.
     */
    public String getIdPrefix() {
        return idPrefix;
    }
}
