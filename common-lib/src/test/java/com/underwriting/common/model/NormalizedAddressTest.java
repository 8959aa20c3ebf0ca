package com.underwriting.common.model;

import com.underwriting.common.exception.InvalidAddressException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NormalizedAddressTest {

    @Nested
    @DisplayName("of() component cleanup")
    class Normalization {

        @Test
        @DisplayName("trims, collapses whitespace and upper-cases every component")
        void cleansComponents() {
            NormalizedAddress address = NormalizedAddress.of("  123   main st. ", " boston ", "ma", " 02129 ");

            assertEquals("123 MAIN ST", address.line1());
            assertEquals("BOSTON", address.city());
            assertEquals("MA", address.state());
            assertEquals("02129", address.zip());
        }

        @Test
        @DisplayName("ZIP+4 keeps only the five-digit prefix")
        void zipPlusFour() {
            assertEquals("02129", NormalizedAddress.of("1 A St", "Boston", "MA", "02129-1234").zip());
        }

        @Test
        @DisplayName("spelling variants share one cache key")
        void variantsShareCacheKey() {
            NormalizedAddress a = NormalizedAddress.of("123 Main St", "Boston", "MA", "02129");
            NormalizedAddress b = NormalizedAddress.of("123  MAIN st,", "boston", "ma", "02129-0001");

            assertEquals(a, b);
            assertEquals(a.cacheKey(), b.cacheKey());
            assertEquals(64, a.cacheKey().length());
        }

        @Test
        @DisplayName("different addresses get different cache keys")
        void distinctKeys() {
            assertNotEquals(
                NormalizedAddress.of("123 Main St", "Boston", "MA", "02129").cacheKey(),
                NormalizedAddress.of("124 Main St", "Boston", "MA", "02129").cacheKey());
        }
    }

    @Nested
    @DisplayName("validation")
    class Validation {

        @Test
        @DisplayName("blank line1 → InvalidAddressException naming the component")
        void blankLine1() {
            InvalidAddressException e = assertThrows(InvalidAddressException.class,
                () -> NormalizedAddress.of("   ", "Boston", "MA", "02129"));
            assertEquals("line1", e.getComponent());
        }

        @Test
        @DisplayName("null city rejected")
        void nullCity() {
            InvalidAddressException e = assertThrows(InvalidAddressException.class,
                () -> NormalizedAddress.of("1 A St", null, "MA", "02129"));
            assertEquals("city", e.getComponent());
        }

        @Test
        @DisplayName("three-letter state rejected")
        void badState() {
            InvalidAddressException e = assertThrows(InvalidAddressException.class,
                () -> NormalizedAddress.of("1 A St", "Boston", "MAS", "02129"));
            assertEquals("state", e.getComponent());
        }

        @Test
        @DisplayName("four-digit zip rejected")
        void badZip() {
            InvalidAddressException e = assertThrows(InvalidAddressException.class,
                () -> NormalizedAddress.of("1 A St", "Boston", "MA", "0212"));
            assertEquals("zip", e.getComponent());
        }

        @Test
        @DisplayName("punctuation-only line1 rejected")
        void punctuationOnly() {
            assertThrows(InvalidAddressException.class,
                () -> NormalizedAddress.of("...", "Boston", "MA", "02129"));
        }
    }

    @Nested
    @DisplayName("parse() / format()")
    class OneLineForm {

        @Test
        @DisplayName("parses 'line1, city, STATE ZIP'")
        void parsesOneLine() {
            NormalizedAddress address = NormalizedAddress.parse("123 Main St, Boston, MA 02129");

            assertEquals(NormalizedAddress.of("123 Main St", "Boston", "MA", "02129"), address);
            assertEquals("123 MAIN ST, BOSTON, MA 02129", address.format());
        }

        @Test
        @DisplayName("unit segments before the city fold into line1")
        void unitSegment() {
            NormalizedAddress address = NormalizedAddress.parse("123 Main St, Apt 4, Boston, MA 02129");

            assertEquals("123 MAIN ST, APT 4", address.line1());
            assertEquals("BOSTON", address.city());
        }

        @Test
        @DisplayName("format() output parses back to the same address")
        void formatParses() {
            NormalizedAddress address = NormalizedAddress.of("9 Elm Rd", "Austin", "TX", "78701");
            assertEquals(address, NormalizedAddress.parse(address.format()));
        }

        @Test
        @DisplayName("missing city segment rejected")
        void missingSegment() {
            assertThrows(InvalidAddressException.class, () -> NormalizedAddress.parse("123 Main St, MA 02129"));
        }

        @Test
        @DisplayName("missing zip rejected")
        void missingZip() {
            assertThrows(InvalidAddressException.class, () -> NormalizedAddress.parse("123 Main St, Boston, MA"));
        }
    }
}
