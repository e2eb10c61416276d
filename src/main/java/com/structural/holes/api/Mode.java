package com.structural.holes.api;

/**
 * Selects which ties of a directed network count toward investment and
 * constraint.
 *
 * <ul>
 * <li>{@link #BOTH}: symmetrized. The neighbor set is the union of in- and
 * out-neighbors and tie strength is {@code w(i,j) + w(j,i)}. A missing
 * direction contributes 0.</li>
 * <li>{@link #OUT}: outgoing ties only, tie strength {@code w(i,j)}.</li>
 * <li>{@link #IN}: incoming ties only, tie strength {@code w(j,i)}.</li>
 * </ul>
 *
 * On an undirected network all three modes produce the same values.
 */
public enum Mode {
    BOTH,
    OUT,
    IN;

    /**
     * Parses a mode name, case-insensitively.
     *
     * @throws InvalidModeException if the text is null or names no mode.
     */
    public static Mode fromString(String text) {
        if (text != null) {
            for (Mode m : Mode.values()) {
                if (m.name().equalsIgnoreCase(text)) {
                    return m;
                }
            }
        }
        throw new InvalidModeException("mode must be both, out or in, got " + text);
    }
}
