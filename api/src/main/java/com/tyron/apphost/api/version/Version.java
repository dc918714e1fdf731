package com.tyron.apphost.api.version;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A four component version number: {@code major.minor.build.revision}.
 * <p>
 * Missing trailing components parse as zero, so {@code "8.1"} equals {@code "8.1.0.0"}.
 */
public final class Version implements Comparable<Version> {

    private final int major;
    private final int minor;
    private final int build;
    private final int revision;

    public Version(int major, int minor, int build, int revision) {
        if (major < 0 || minor < 0 || build < 0 || revision < 0) {
            throw new IllegalArgumentException("Version components must be non-negative: "
                    + major + "." + minor + "." + build + "." + revision);
        }
        this.major = major;
        this.minor = minor;
        this.build = build;
        this.revision = revision;
    }

    public Version(int major, int minor, int build) {
        this(major, minor, build, 0);
    }

    /**
     * Parses a version of one to four dot separated numeric components.
     *
     * @throws IllegalArgumentException if {@code text} is not a valid version.
     */
    public static Version parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("version == null or blank");
        }
        String[] parts = text.trim().split("\\.", -1);
        if (parts.length > 4) {
            throw new IllegalArgumentException("Too many version components: " + text);
        }

        int[] values = new int[4];
        for (int i = 0; i < parts.length; i++) {
            try {
                values[i] = Integer.parseInt(parts[i]);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid version component '" + parts[i] + "' in " + text, e);
            }
        }
        return new Version(values[0], values[1], values[2], values[3]);
    }

    public int getMajor() {
        return major;
    }

    public int getMinor() {
        return minor;
    }

    public int getBuild() {
        return build;
    }

    public int getRevision() {
        return revision;
    }

    /**
     * Formats the first {@code fieldCount} components, e.g. {@code toString(3)} gives {@code "8.1.3"}.
     *
     * @throws IllegalArgumentException if {@code fieldCount} is not between 1 and 4.
     */
    @NotNull
    public String toString(int fieldCount) {
        if (fieldCount < 1 || fieldCount > 4) {
            throw new IllegalArgumentException("fieldCount must be between 1 and 4: " + fieldCount);
        }
        int[] values = {major, minor, build, revision};
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < fieldCount; i++) {
            if (i > 0) sb.append('.');
            sb.append(values[i]);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return toString(4);
    }

    @Override
    public int compareTo(@NotNull Version o) {
        int c = Integer.compare(major, o.major);
        if (c != 0) return c;
        c = Integer.compare(minor, o.minor);
        if (c != 0) return c;
        c = Integer.compare(build, o.build);
        if (c != 0) return c;
        return Integer.compare(revision, o.revision);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Version other)) return false;
        return major == other.major && minor == other.minor
                && build == other.build && revision == other.revision;
    }

    @Override
    public int hashCode() {
        return Objects.hash(major, minor, build, revision);
    }
}
