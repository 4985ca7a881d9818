package io.github.jakubt4.constellation.model;

import java.util.List;

/**
 * Identity of one constellation member. Natural order is by {@code index}.
 */
public record SatelliteId(int plane, int slot, int index, String name) implements Comparable<SatelliteId> {

    private static final List<String> GREEK_ALPHABET = List.of(
            "Alpha", "Beta", "Gamma", "Delta", "Epsilon", "Zeta",
            "Eta", "Theta", "Iota", "Kappa", "Lambda", "Mu",
            "Nu", "Xi", "Omicron", "Pi", "Rho", "Sigma",
            "Tau", "Upsilon", "Phi", "Chi", "Psi", "Omega");

    public static SatelliteId of(final int plane, final int slot, final ConstellationConfig config) {
        final var index = Math.addExact(Math.multiplyExact(plane, config.satellitesPerPlane()), slot);
        return new SatelliteId(plane, slot, index, nameOf(index));
    }

    static String nameOf(final int index) {
        return index < GREEK_ALPHABET.size() ? GREEK_ALPHABET.get(index) : "Satellite-" + index;
    }

    @Override
    public int compareTo(final SatelliteId other) {
        return Integer.compare(index, other.index);
    }
}
