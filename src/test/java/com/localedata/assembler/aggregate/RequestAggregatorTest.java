package com.localedata.assembler.aggregate;

import static org.assertj.core.api.Assertions.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.SortedSet;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.jupiter.api.Test;

import com.localedata.assembler.model.CategoryToken;

/**
 * Unit tests for RequestAggregator.
 */
class RequestAggregatorTest {

    private static final List<String> CATEGORIES = List.of(
            "dateformats", "numberformats", "ctype", "zoneinfo", "nfc/Latn", "charmaps", "sysres", "dateformats");

    @Test
    void testDuplicatesAreIgnored() {
        RequestAggregator aggregator = new RequestAggregator();

        assertThat(aggregator.record("sysres")).isTrue();
        assertThat(aggregator.record("sysres")).isFalse();
        assertThat(aggregator.record(CategoryToken.of("sysres"))).isFalse();
        assertThat(aggregator.size()).isEqualTo(1);
    }

    @Test
    void testBlankNamesAreIgnored() {
        RequestAggregator aggregator = new RequestAggregator();

        assertThat(aggregator.record("")).isFalse();
        assertThat(aggregator.record((String) null)).isFalse();
        assertThat(aggregator.snapshot()).isEmpty();
    }

    @Test
    void testSnapshotDoesNotDependOnArrivalOrder() {
        RequestAggregator inOrder = new RequestAggregator();
        CATEGORIES.forEach(inOrder::record);

        List<String> shuffled = new ArrayList<>(CATEGORIES);
        Collections.shuffle(shuffled, new Random(42));
        RequestAggregator outOfOrder = new RequestAggregator();
        shuffled.forEach(outOfOrder::record);

        assertThat(outOfOrder.snapshot()).containsExactlyElementsOf(inOrder.snapshot());
    }

    @Test
    void testSnapshotIsNotAffectedByLaterRecords() {
        RequestAggregator aggregator = new RequestAggregator();
        aggregator.record("ctype");

        SortedSet<CategoryToken> snapshot = aggregator.snapshot();
        aggregator.record("sysres");

        assertThat(snapshot).containsExactly(CategoryToken.of("ctype"));
        assertThatThrownBy(() -> snapshot.add(CategoryToken.of("x")))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void testConcurrentRecording() throws Exception {
        RequestAggregator aggregator = new RequestAggregator();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int unit = 0; unit < 64; unit++) {
                int offset = unit;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < 50; i++) {
                        aggregator.record("category" + ((offset + i) % 40));
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(aggregator.size()).isEqualTo(40);
        assertThat(aggregator.snapshot()).hasSize(40);
    }
}
