package org.metadump.catalog;

import java.util.ArrayList;
import java.util.List;

/**
 * Version tag of the source cluster, consumed by the renderer to choose version-specific syntax.
 * <p>
 * Versions compare numerically by dotted components, so {@code "4.3.99"} is before {@code "5"}.
 * Missing components count as zero.
 *
 * @param version the dotted version string, e.g. {@code "5.28.4"}.
 */
public record SourceVersion(String version) implements Comparable<SourceVersion> {

    public SourceVersion {
        if (version == null || version.isBlank()) {
            throw new IllegalArgumentException("Source version must not be empty");
        }
        for (String part : version.trim().split("\\.")) {
            if (!part.chars().allMatch(Character::isDigit) || part.isEmpty()) {
                throw new IllegalArgumentException("Malformed source version: " + version);
            }
        }
        version = version.trim();
    }

    public boolean before(String other) {
        return compareTo(new SourceVersion(other)) < 0;
    }

    public boolean atLeast(String other) {
        return compareTo(new SourceVersion(other)) >= 0;
    }

    @Override
    public int compareTo(SourceVersion other) {
        List<Integer> mine = components();
        List<Integer> theirs = other.components();
        int length = Math.max(mine.size(), theirs.size());
        for (int i = 0; i < length; i++) {
            int a = i < mine.size() ? mine.get(i) : 0;
            int b = i < theirs.size() ? theirs.get(i) : 0;
            if (a != b) {
                return Integer.compare(a, b);
            }
        }
        return 0;
    }

    private List<Integer> components() {
        List<Integer> parts = new ArrayList<>();
        for (String part : version.split("\\.")) {
            parts.add(Integer.parseInt(part));
        }
        return parts;
    }

    @Override
    public String toString() {
        return version;
    }
}
