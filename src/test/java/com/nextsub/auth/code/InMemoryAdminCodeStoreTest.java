package com.nextsub.auth.code;

import com.nextsub.auth.model.ClientInfo;
import com.nextsub.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryAdminCodeStoreTest {

    private static final String ADMIN = "admin@nextsubscription.local";
    private static final ClientInfo CLIENT = new ClientInfo("10.0.0.1", "JUnit");

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    private final InMemoryAdminCodeStore store = new InMemoryAdminCodeStore(clock);

    @Test
    void issueStoresClientAndExpiry() {
        String id = store.issue(ADMIN, "digest", Duration.ofMinutes(10), 5, CLIENT).id();

        AdminCodeRecord record = store.loadLive(ADMIN).orElseThrow();
        assertThat(record.id()).isEqualTo(id);
        assertThat(record.expiresAt()).isEqualTo(Instant.parse("2024-05-01T10:10:00Z"));
        assertThat(record.clientIp()).isEqualTo("10.0.0.1");
        assertThat(record.userAgent()).isEqualTo("JUnit");
        assertThat(record.attemptsUsed()).isZero();
    }

    @Test
    void newIssueReplacesPreviousRecord() {
        String first = store.issue(ADMIN, "digest-a", Duration.ofMinutes(10), 5, CLIENT).id();
        String second = store.issue(ADMIN, "digest-b", Duration.ofMinutes(10), 5, CLIENT).id();

        assertThat(store.loadLatest(ADMIN)).get().extracting(AdminCodeRecord::id).isEqualTo(second);
        assertThat(store.recordFailedAttempt(first)).isEqualTo(-1);
        assertThat(store.consume(first)).isFalse();
    }

    @Test
    void expiredRecordIsNotLive() {
        store.issue(ADMIN, "digest", Duration.ofMinutes(10), 5, CLIENT);

        clock.advance(Duration.ofMinutes(10));

        assertThat(store.loadLive(ADMIN)).isEmpty();
        assertThat(store.loadLatest(ADMIN)).isPresent();
    }

    @Test
    void failedAttemptsInvalidateAtBudget() {
        String id = store.issue(ADMIN, "digest", Duration.ofMinutes(10), 3, CLIENT).id();

        assertThat(store.recordFailedAttempt(id)).isEqualTo(1);
        assertThat(store.recordFailedAttempt(id)).isEqualTo(2);
        assertThat(store.loadLive(ADMIN)).isPresent();
        assertThat(store.recordFailedAttempt(id)).isEqualTo(3);

        AdminCodeRecord record = store.loadLatest(ADMIN).orElseThrow();
        assertThat(record.consumed()).isTrue();
        assertThat(record.isExhausted()).isTrue();
        assertThat(store.loadLive(ADMIN)).isEmpty();
        assertThat(store.recordFailedAttempt(id)).isEqualTo(3);
    }

    @Test
    void issueReturnsStoredRecord() {
        AdminCodeRecord issued = store.issue(ADMIN, "digest", Duration.ofMinutes(10), 5, CLIENT);

        assertThat(store.loadLatest(ADMIN)).contains(issued);
    }

    @Test
    void concurrentFailedAttemptsAreCountedUpToBudget() throws Exception {
        String id = store.issue(ADMIN, "digest", Duration.ofMinutes(10), 5, CLIENT).id();
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Integer>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return store.recordFailedAttempt(id);
                }));
            }
            start.countDown();
            for (Future<Integer> result : results) {
                assertThat(result.get(5, TimeUnit.SECONDS)).isBetween(1, 5);
            }
        } finally {
            pool.shutdownNow();
        }

        AdminCodeRecord record = store.loadLatest(ADMIN).orElseThrow();
        assertThat(record.attemptsUsed()).isEqualTo(Math.min(threads, 5));
        assertThat(record.consumed()).isTrue();
    }

    @Test
    void consumeSucceedsOnlyOnce() {
        String id = store.issue(ADMIN, "digest", Duration.ofMinutes(10), 5, CLIENT).id();

        assertThat(store.consume(id)).isTrue();
        assertThat(store.consume(id)).isFalse();
        assertThat(store.loadLive(ADMIN)).isEmpty();
    }

    @Test
    void concurrentConsumeHasSingleWinner() throws Exception {
        String id = store.issue(ADMIN, "digest", Duration.ofMinutes(10), 5, CLIENT).id();
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return store.consume(id);
                }));
            }
            start.countDown();
            int winners = 0;
            for (Future<Boolean> result : results) {
                if (result.get(5, TimeUnit.SECONDS)) {
                    winners++;
                }
            }
            assertThat(winners).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }
}
