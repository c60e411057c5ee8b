package io.github.dredis.store;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.LockSupport;
import java.util.stream.IntStream;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MemoryStoreParallelTest {
    private static final int N = 1000;

    private MemoryStore     store;
    private ExecutorService executorService;

    @BeforeEach
    void beforeEach() {
        store = new MemoryStore();
        executorService = Executors.newFixedThreadPool(16);
    }

    @AfterEach
    void afterEach() throws InterruptedException {
        executorService.shutdownNow();
        assertTrue(executorService.awaitTermination(10, TimeUnit.SECONDS));
    }

    @RepeatedTest(5)
    void saddSameKeyLosesNoUpdates() throws Exception {
        ByteString key = ByteString.copyFromUtf8("k");
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Integer>> futures = new ArrayList<>();
        for (int i = 0; i < N; i++) {
            ByteString member = ByteString.copyFromUtf8("m" + i);
            futures.add(executorService.submit(() -> {
                start.await();
                return store.sadd(key, Collections.singletonList(member));
            }));
        }
        start.countDown();

        for (Future<Integer> f : futures) {
            assertEquals(1, f.get(10, TimeUnit.SECONDS).intValue());
        }
        SetValue set = (SetValue) store.get(key).get();
        assertEquals(N, set.getMembers().size());
    }

    @RepeatedTest(5)
    void hsetSameKeyLosesNoUpdates() {
        ByteString key = ByteString.copyFromUtf8("h");
        IntStream.range(0, N).parallel()
                .forEach(i -> assertFalse(store.hset(key, ByteString.copyFromUtf8("f" + i), ByteString.copyFromUtf8("v" + i))));

        assertEquals(N, store.hgetall(key).size());
        assertEquals(1, store.size());
    }

    @Test
    void parallelSetOnDistinctKeys() {
        IntStream.range(0, N).parallel()
                .forEach(i -> store.set(ByteString.copyFromUtf8("k" + i), ByteString.copyFromUtf8("v" + i)));

        assertEquals(N, store.size());
        IntStream.range(0, N).forEach(i ->
                assertEquals(ByteString.copyFromUtf8("v" + i), store.getString(ByteString.copyFromUtf8("k" + i)).get()));
    }

    @Test
    void busyKeyDoesNotBlockOtherKeys() throws Exception {
        ByteString busy = ByteString.copyFromUtf8("busy");
        CountDownLatch inside = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        // 一个线程长时间占用busy的锁
        List<ByteString> blockingMembers = new java.util.AbstractList<ByteString>() {
            @Override
            public ByteString get(int index) {
                inside.countDown();
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return ByteString.copyFromUtf8("m");
            }

            @Override
            public int size() {
                return 1;
            }
        };
        Future<Integer> holder = executorService.submit(() -> store.sadd(busy, blockingMembers));
        assertTrue(inside.await(10, TimeUnit.SECONDS));

        Future<?> other = executorService.submit(() -> store.set(ByteString.copyFromUtf8("other"), ByteString.copyFromUtf8("v")));
        other.get(5, TimeUnit.SECONDS);
        assertEquals(ByteString.copyFromUtf8("v"), store.getString(ByteString.copyFromUtf8("other")).get());

        Future<Boolean> sameKey = executorService.submit(() -> store.sismember(busy, ByteString.copyFromUtf8("m")));
        LockSupport.parkNanos(TimeUnit.MILLISECONDS.toNanos(100));
        assertFalse(sameKey.isDone());

        release.countDown();
        assertEquals(1, holder.get(5, TimeUnit.SECONDS).intValue());
        assertTrue(sameKey.get(5, TimeUnit.SECONDS));
    }
}
