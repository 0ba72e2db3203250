package com.vidnyan.sysml.domain.model;

/**
 * Specialization edge kinds as a bitmask lattice. A kind includes every kind
 * whose bits it contains, so a redefinition is also a subsetting and a specialization.
 */
public enum SpecializationKind {
    NONE(0),
    SPECIALIZATION(1),
    SUBCLASSIFICATION((1 << 1) | 1),
    TYPING((1 << 2) | 1),
    CONJUGATED_PORT_TYPING((1 << 3) | (1 << 2) | 1),
    CONJUGATION(1 << 4),
    SUBSETTING((1 << 5) | 1),
    REDEFINITION((1 << 6) | (1 << 5) | 1),
    REFERENCE((1 << 7) | (1 << 5) | 1);

    private final int mask;

    SpecializationKind(int mask) {
        this.mask = mask;
    }

    public int mask() {
        return mask;
    }

    /**
     * True if an edge of this kind passes a {@code filter}. {@code NONE} passes everything.
     */
    public boolean matches(SpecializationKind filter) {
        return filter == null || (mask & filter.mask) == filter.mask;
    }
}
