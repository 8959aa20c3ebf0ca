package com.underwriting.propertydata.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.underwriting.common.model.AreaRentBenchmark;
import com.underwriting.common.model.NormalizedAddress;
import com.underwriting.common.model.ProviderErrorKind;
import com.underwriting.common.model.ProviderResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HudFmrProviderTest {

    private static final NormalizedAddress ADDRESS = NormalizedAddress.parse("123 Main St, Boston, MA 02129");

    private static final String FMR = """
        {"data": {"year": 2025, "fmr": {"0": 2100, "1": 2300, "2": 2700, "3": 3300, "4": 3600}}}
        """;

    /** Clock whose instant tests move by hand. */
    private static final class MutableClock extends Clock {
        private Instant now = Instant.parse("2026-02-01T00:00:00Z");

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }

        void advance(Duration by) {
            now = now.plus(by);
        }
    }

    private final StubExchange exchange = new StubExchange();
    private final MutableClock clock = new MutableClock();
    private final HudFmrProvider provider =
        new HudFmrProvider(exchange.client(), new ObjectMapper(), clock, "", Duration.ofMinutes(720), 2);

    @Test
    @DisplayName("bedroom table becomes the benchmark, headline is the median")
    void benchmarkFromTable() {
        exchange.json(FMR);

        AreaRentBenchmark benchmark = provider.fetchForArea(ADDRESS).block().areaBenchmark();

        assertEquals("02129", benchmark.areaKey());
        assertEquals(2700.0, benchmark.medianRent());
        assertEquals(2025, benchmark.year());
        assertEquals(Map.of(0, 2100.0, 1, 2300.0, 2, 2700.0, 3, 3300.0, 4, 3600.0), benchmark.bedroomRents());
        assertNull(benchmark.sampleSize());
        assertNull(exchange.lastRequest().headers().getFirst(HttpHeaders.AUTHORIZATION));
    }

    @Test
    @DisplayName("named bedroom keys are understood")
    void namedKeys() {
        exchange.json("{\"data\": {\"basicdata\": {\"Efficiency\": 1500, \"One-Bedroom\": 1700}}}");

        AreaRentBenchmark benchmark = provider.fetchForArea(ADDRESS).block().areaBenchmark();

        assertEquals(1600.0, benchmark.medianRent());
        assertEquals(List.of(0, 1), List.copyOf(benchmark.bedroomRents().keySet()));
    }

    @Test
    @DisplayName("same zip is served from the provider's table cache until it expires")
    void cachesByZip() {
        exchange.json(FMR);
        NormalizedAddress neighbour = NormalizedAddress.parse("9 Bunker Hill St, Boston, MA 02129");

        ProviderResult first = provider.fetchForArea(ADDRESS).block();
        ProviderResult second = provider.fetchForArea(neighbour).block();
        assertSame(first, second);
        assertEquals(1, exchange.requests().size());

        clock.advance(Duration.ofMinutes(721));
        provider.fetchForArea(ADDRESS).block();
        assertEquals(2, exchange.requests().size());
    }

    @Test
    @DisplayName("expired zip is dropped on read even when the refetch fails")
    void expiredZipEvicted() {
        exchange.json(FMR).status(HttpStatus.BAD_GATEWAY);
        provider.fetchForArea(ADDRESS).block();
        assertEquals(1, provider.cachedZipCount());

        clock.advance(Duration.ofMinutes(721));

        assertFalse(provider.fetchForArea(ADDRESS).block().isSuccess());
        assertEquals(0, provider.cachedZipCount());
    }

    @Test
    @DisplayName("zip table count is bounded, oldest fetch evicted first")
    void boundedByZipCount() {
        exchange.json(FMR);
        NormalizedAddress charlestown = ADDRESS;
        NormalizedAddress backBay = NormalizedAddress.parse("1 Newbury St, Boston, MA 02116");
        NormalizedAddress southEnd = NormalizedAddress.parse("5 Tremont St, Boston, MA 02118");

        provider.fetchForArea(charlestown).block();
        clock.advance(Duration.ofMinutes(1));
        provider.fetchForArea(backBay).block();
        clock.advance(Duration.ofMinutes(1));
        provider.fetchForArea(southEnd).block();

        assertEquals(2, provider.cachedZipCount());
        assertEquals(3, exchange.requests().size());

        provider.fetchForArea(southEnd).block();
        provider.fetchForArea(backBay).block();
        assertEquals(3, exchange.requests().size());

        provider.fetchForArea(charlestown).block();
        assertEquals(4, exchange.requests().size());
    }

    @Test
    @DisplayName("property-level lookup is unsupported and sends nothing")
    void propertyLevelUnsupported() {
        exchange.json(FMR);

        assertEquals(ProviderErrorKind.UNAVAILABLE, provider.fetchForProperty(ADDRESS).block().error());
        assertTrue(exchange.requests().isEmpty());
    }

    @Test
    @DisplayName("failures are not cached")
    void failuresNotCached() {
        exchange.status(HttpStatus.BAD_GATEWAY).json(FMR);

        assertEquals(ProviderErrorKind.UNAVAILABLE, provider.fetchForArea(ADDRESS).block().error());
        assertTrue(provider.fetchForArea(ADDRESS).block().isSuccess());
        assertEquals(2, exchange.requests().size());
    }

    @Test
    @DisplayName("empty table → UNAVAILABLE")
    void emptyTable() {
        exchange.json("{\"data\": {\"fmr\": {}}}");
        assertEquals(ProviderErrorKind.UNAVAILABLE, provider.fetchForArea(ADDRESS).block().error());
    }
}
