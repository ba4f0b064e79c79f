package net.kairos.core.model;

public enum ExecutionKind {
    SHELL, HTTP, UNKNOWN;

    public static ExecutionKind from(String s) {
        if (s == null) return UNKNOWN;
        try { return ExecutionKind.valueOf(s.trim().toUpperCase()); } catch (IllegalArgumentException e) { return UNKNOWN; }
    }
    public String code() { return name(); }
}
