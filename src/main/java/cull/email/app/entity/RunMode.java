package cull.email.app.entity;

public enum RunMode {
    /** Report what would be disposed; no mutation is sent to Gmail. */
    DRY_RUN,
    EXECUTE
}
