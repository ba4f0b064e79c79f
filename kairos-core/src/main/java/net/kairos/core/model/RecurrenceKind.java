package net.kairos.core.model;

public enum RecurrenceKind {
    ONCE, CRON, UNKNOWN;

    public static RecurrenceKind from(String s) {
        if (s == null) return UNKNOWN;
        try { return RecurrenceKind.valueOf(s.trim().toUpperCase()); } catch (IllegalArgumentException e) { return UNKNOWN; }
    }
    public String code() { return name(); }
}
