package com.tyron.apphost.api.version;

import org.junit.jupiter.api.Test;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class VersionTest {

    @Test
    public void toStringTruncatesToRequestedComponents() {
        Version v = new Version(8, 1, 3, 42);

        assertEquals("8", v.toString(1));
        assertEquals("8.1", v.toString(2));
        assertEquals("8.1.3", v.toString(3));
        assertEquals("8.1.3.42", v.toString());
    }

    @Test
    public void toStringRejectsOutOfRangeFieldCount() {
        Version v = new Version(1, 2, 3);

        assertThrows(IllegalArgumentException.class, () -> v.toString(0));
        assertThrows(IllegalArgumentException.class, () -> v.toString(5));
    }

    @Test
    public void parseFillsMissingComponentsWithZero() {
        assertEquals(new Version(8, 1, 0, 0), Version.parse("8.1"));
        assertEquals(new Version(8, 1, 3, 0), Version.parse(" 8.1.3 "));
        assertEquals("8.1.0", Version.parse("8.1").toString(3));
    }

    @Test
    public void parseRejectsMalformedInput() {
        assertThrows(IllegalArgumentException.class, () -> Version.parse(null));
        assertThrows(IllegalArgumentException.class, () -> Version.parse(""));
        assertThrows(IllegalArgumentException.class, () -> Version.parse("8.x.3"));
        assertThrows(IllegalArgumentException.class, () -> Version.parse("1.2.3.4.5"));
        assertThrows(IllegalArgumentException.class, () -> Version.parse("1..3"));
        assertThrows(IllegalArgumentException.class, () -> new Version(-1, 0, 0));
    }

    @Test
    public void versionsOrderComponentWise() {
        assertThat(Version.parse("8.1.3")).isGreaterThan(Version.parse("8.0.9"));
        assertThat(Version.parse("8.1.3.1")).isGreaterThan(Version.parse("8.1.3"));
        assertThat(Version.parse("7.9")).isLessThan(Version.parse("8"));
        assertThat(Version.parse("8.1.3")).isEquivalentAccordingToCompareTo(new Version(8, 1, 3, 0));
    }
}
