package com.moddock.core.domain;

/**
 * What a report is filed against. At most one target per report.
 * Stored as three nullable columns on {@link Report}; everywhere else it is
 * one of these variants.
 */
public sealed interface ReportTarget
        permits ReportTarget.Project, ReportTarget.Version, ReportTarget.User, ReportTarget.None {

    ItemType itemType();

    record Project(long id) implements ReportTarget {
        @Override
        public ItemType itemType() { return ItemType.PROJECT; }
    }

    record Version(long id) implements ReportTarget {
        @Override
        public ItemType itemType() { return ItemType.VERSION; }
    }

    record User(long id) implements ReportTarget {
        @Override
        public ItemType itemType() { return ItemType.USER; }
    }

    record None() implements ReportTarget {
        @Override
        public ItemType itemType() { return ItemType.UNKNOWN; }
    }

    static ReportTarget none() {
        return new None();
    }

    static ReportTarget of(ItemType type, long id) {
        switch (type) {
            case PROJECT: return new Project(id);
            case VERSION: return new Version(id);
            case USER: return new User(id);
            default: throw new IllegalArgumentException("No target for item type " + type);
        }
    }

    /**
     * Rebuilds the target from the stored columns. Project wins over version,
     * version over user, if a row ever carries more than one.
     */
    static ReportTarget fromColumns(Long projectId, Long versionId, Long userId) {
        if (projectId != null) {
            return new Project(projectId);
        }
        if (versionId != null) {
            return new Version(versionId);
        }
        if (userId != null) {
            return new User(userId);
        }
        return none();
    }

    enum ItemType {
        PROJECT("project"),
        VERSION("version"),
        USER("user"),
        UNKNOWN("unknown");

        private final String value;

        ItemType(String value) {
            this.value = value;
        }

        public String value() {
            return value;
        }

        /**
         * Parses the wire name. Anything unrecognised maps to {@link #UNKNOWN}.
         */
        public static ItemType fromValue(String value) {
            if (value != null) {
                for (ItemType type : values()) {
                    if (type.value.equalsIgnoreCase(value)) {
                        return type;
                    }
                }
            }
            return UNKNOWN;
        }
    }
}
