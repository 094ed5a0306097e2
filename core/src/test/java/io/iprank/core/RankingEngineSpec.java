package io.iprank.core;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class RankingEngineSpec {

    private static final long NOW = 1_700_000_000_000L;

    private final TestStatStore store = new TestStatStore();
    private final RankingEngine engine = new RankingEngine(store, AggregationSettings.defaults());

    private void put(String partition, String endpoint, double ewma, long n, long ageMillis) {
        store.save(partition, new EndpointStat(endpoint, ewma, n, NOW - ageMillis));
    }

    @Test
    void confidence_penalty_lets_well_sampled_endpoint_win() {
        put("AS1", "steady", 50.0, 10, 0);
        put("AS1", "lucky", 80.0, 2, 0);

        List<RankedResult> top = engine.computeTop("AS1", NOW, 100);

        assertEquals(2, top.size());
        assertEquals("steady", top.get(0).endpoint());
        assertEquals(50.0, top.get(0).score(), 1e-9);
        assertEquals("lucky", top.get(1).endpoint());
        assertEquals(48.0, top.get(1).score(), 1e-9);
    }

    @Test
    void stale_endpoint_decays_below_five_percent_after_three_tau() {
        put("AS1", "old", 100.0, 10, 3 * 180_000L);

        RankedResult r = engine.computeTop("AS1", NOW, 10).get(0);

        assertTrue(r.score() <= 0.05 * r.ewma(), "score=" + r.score());
        assertEquals(100.0, r.ewma(), 0.0);
    }

    @Test
    void one_tau_keeps_about_thirty_seven_percent() {
        put("AS1", "e", 100.0, 10, 180_000L);
        assertEquals(100.0 * Math.exp(-1), engine.computeTop("AS1", NOW, 1).get(0).score(), 1e-9);
    }

    @Test
    void future_timestamps_are_clamped_to_age_zero() {
        put("AS1", "skewed", 30.0, 10, -60_000L);
        assertEquals(30.0, engine.computeTop("AS1", NOW, 1).get(0).score(), 1e-9);
    }

    @Test
    void ancient_timestamp_decays_instead_of_wrapping_to_fresh() {
        store.save("AS1", new EndpointStat("ancient", 40.0, 5, Long.MIN_VALUE));

        RankedResult r = engine.computeTop("AS1", NOW, 1).get(0);

        assertEquals(0.0, r.score(), 1e-9);
        assertTrue(r.score() <= 0.05 * r.ewma(), "score=" + r.score());
    }

    @Test
    void respects_limit_and_returns_only_stored_endpoints() {
        for (int i = 0; i < 50; i++) {
            put("AS1", "ip-" + i, i, 10, 0);
        }
        put("AS2", "elsewhere", 1_000.0, 10, 0);

        List<RankedResult> top = engine.computeTop("AS1", NOW, 7);

        assertEquals(7, top.size());
        assertEquals("ip-49", top.get(0).endpoint());
        Set<String> names = top.stream().map(RankedResult::endpoint).collect(Collectors.toSet());
        assertFalse(names.contains("elsewhere"));
    }

    @Test
    void returns_everything_when_fewer_than_limit() {
        put("AS1", "a", 1.0, 1, 0);
        put("AS1", "b", 2.0, 1, 0);
        assertEquals(2, engine.computeTop("AS1", NOW, 100).size());
        assertTrue(engine.computeTop("empty", NOW, 100).isEmpty());
    }

    @Test
    void sorted_descending_with_endpoint_tie_break_and_deterministic() {
        put("AS1", "c", 10.0, 10, 0);
        put("AS1", "a", 10.0, 10, 0);
        put("AS1", "b", 10.0, 10, 0);
        put("AS1", "z", 11.0, 10, 0);
        put("AS1", "y", 3.0, 1, 5_000);

        List<RankedResult> first = engine.computeTop("AS1", NOW, 100);
        List<RankedResult> second = engine.computeTop("AS1", NOW, 100);

        assertEquals(List.of("z", "a", "b", "c", "y"),
                first.stream().map(RankedResult::endpoint).toList());
        assertEquals(first, second);
        for (int i = 1; i < first.size(); i++) {
            assertTrue(first.get(i - 1).score() >= first.get(i).score());
        }
    }

    @Test
    void tie_break_survives_heap_truncation() {
        put("AS1", "d", 10.0, 10, 0);
        put("AS1", "b", 10.0, 10, 0);
        put("AS1", "a", 10.0, 10, 0);
        put("AS1", "c", 10.0, 10, 0);

        assertEquals(List.of("a", "b"),
                engine.computeTop("AS1", NOW, 2).stream().map(RankedResult::endpoint).toList());
    }

    @Test
    void rejects_non_positive_limit() {
        assertThrows(IllegalArgumentException.class, () -> engine.computeTop("AS1", NOW, 0));
    }

    @Test
    void scan_does_not_mutate_state() {
        put("AS1", "a", 5.0, 3, 1_000);
        int saves = store.saves.get();

        engine.computeTop("AS1", NOW, 10);

        assertEquals(saves, store.saves.get());
        assertEquals(3, store.load("AS1", "a").orElseThrow().sampleCount());
    }
}
