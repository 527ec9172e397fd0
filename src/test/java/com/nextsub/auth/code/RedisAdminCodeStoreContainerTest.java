package com.nextsub.auth.code;

import com.nextsub.auth.model.ClientInfo;
import com.nextsub.support.RedisContainerBaseTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class RedisAdminCodeStoreContainerTest extends RedisContainerBaseTest {

    private static final ClientInfo CLIENT = new ClientInfo("10.0.0.1", "JUnit");
    private static final Duration TTL = Duration.ofMinutes(10);

    @Autowired
    private RedisAdminCodeStore store;

    @Autowired
    private StringRedisTemplate redisTemplate;

    private String principal;

    @BeforeEach
    void setUp() {
        principal = "admin-" + UUID.randomUUID() + "@nextsubscription.local";
    }

    @Test
    void issueReturnsWhatIsStored() {
        AdminCodeRecord issued = store.issue(principal, "digest", TTL, 5, CLIENT);

        assertThat(store.loadLive(principal)).contains(issued);
        assertThat(redisTemplate.getExpire("admin:code:rec:" + issued.id(), TimeUnit.MINUTES)).isBetween(39L, 40L);
    }

    @Test
    void issueReplacesPreviousRecord() {
        AdminCodeRecord first = store.issue(principal, "digest-a", TTL, 5, CLIENT);
        AdminCodeRecord second = store.issue(principal, "digest-b", TTL, 5, CLIENT);

        assertThat(store.loadLatest(principal)).get().extracting(AdminCodeRecord::id).isEqualTo(second.id());
        assertThat(redisTemplate.opsForHash().get("admin:code:rec:" + first.id(), "consumed")).isEqualTo("1");
        assertThat(store.consume(first.id())).isFalse();
        assertThat(store.recordFailedAttempt(first.id())).isZero();
        assertThat(store.loadLive(principal)).get().extracting(AdminCodeRecord::attemptsUsed).isEqualTo(0);
    }

    @Test
    void failedAttemptConsumesRecordAtBudget() {
        String id = store.issue(principal, "digest", TTL, 3, CLIENT).id();

        assertThat(store.recordFailedAttempt(id)).isEqualTo(1);
        assertThat(store.recordFailedAttempt(id)).isEqualTo(2);
        assertThat(store.loadLive(principal)).isPresent();
        assertThat(store.recordFailedAttempt(id)).isEqualTo(3);

        assertThat(store.loadLive(principal)).isEmpty();
        AdminCodeRecord record = store.loadLatest(principal).orElseThrow();
        assertThat(record.consumed()).isTrue();
        assertThat(record.attemptsUsed()).isEqualTo(3);
        assertThat(store.recordFailedAttempt(id)).isEqualTo(3);
        assertThat(store.consume(id)).isFalse();
    }

    @Test
    void secondConsumeReturnsFalse() {
        String id = store.issue(principal, "digest", TTL, 5, CLIENT).id();

        assertThat(store.consume(id)).isTrue();
        assertThat(store.consume(id)).isFalse();
        assertThat(store.loadLive(principal)).isEmpty();
    }

    @Test
    void unknownRecordIsReportedAsMissing() {
        assertThat(store.recordFailedAttempt("no-such-record")).isEqualTo(-1);
        assertThat(store.consume("no-such-record")).isFalse();
    }

    @Test
    void concurrentFailedAttemptsAreCountedUpToBudget() throws Exception {
        String id = store.issue(principal, "digest", TTL, 5, CLIENT).id();
        int threads = 12;
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
                assertThat(result.get(10, TimeUnit.SECONDS)).isBetween(1, 5);
            }
        } finally {
            pool.shutdownNow();
        }

        AdminCodeRecord record = store.loadLatest(principal).orElseThrow();
        assertThat(record.attemptsUsed()).isEqualTo(5);
        assertThat(record.consumed()).isTrue();
    }
}
