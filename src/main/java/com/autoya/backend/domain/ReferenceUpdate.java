package com.autoya.backend.domain;

import java.util.Objects;

import lombok.EqualsAndHashCode;

/**
 * Requested change to an optional entity reference during a partial update.
 *
 * Three outcomes are possible: leave the reference as stored, point it at
 * another row by id, or clear it.
 */
@EqualsAndHashCode
public final class ReferenceUpdate {

    public enum Mode {
        KEEP,
        ASSIGN,
        CLEAR
    }

    private static final ReferenceUpdate KEEP = new ReferenceUpdate(Mode.KEEP, null);
    private static final ReferenceUpdate CLEAR = new ReferenceUpdate(Mode.CLEAR, null);

    private final Mode mode;
    private final Long id;

    private ReferenceUpdate(Mode mode, Long id) {
        this.mode = mode;
        this.id = id;
    }

    public static ReferenceUpdate keep() {
        return KEEP;
    }

    public static ReferenceUpdate clear() {
        return CLEAR;
    }

    /**
     * @param id id of the row to reference, must not be null
     */
    public static ReferenceUpdate assign(Long id) {
        return new ReferenceUpdate(Mode.ASSIGN, Objects.requireNonNull(id, "id"));
    }

    public Mode getMode() {
        return mode;
    }

    /**
     * @return referenced id, only meaningful for {@link Mode#ASSIGN}
     */
    public Long getId() {
        return id;
    }

    public boolean isKeep() {
        return mode == Mode.KEEP;
    }

    @Override
    public String toString() {
        return mode == Mode.ASSIGN ? "ASSIGN(" + id + ")" : mode.name();
    }
}
