package de.levingamer8.greaterlauncher.core;

/**
 * A mod or preset referenced by id/name is not part of the current state.
 * Callers re-query the current catalog or preset list and retry.
 */
public class NotFoundException extends RuntimeException {

    public enum Kind { MOD, PRESET }

    private final Kind kind;
    private final String reference;

    public NotFoundException(Kind kind, String reference) {
        super(kind.name().toLowerCase() + " not found: " + reference);
        this.kind = kind;
        this.reference = reference;
    }

    public Kind kind() { return kind; }

    public String reference() { return reference; }
}
