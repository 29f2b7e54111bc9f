package miniredis.db;

import miniredis.commands.CommandDispatcher;
import miniredis.protocol.BulkString;
import miniredis.protocol.RespArray;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class KeyValueStoreConcurrencyTest {

    @Test
    public void testConcurrentSetsAreNotLost() throws Exception {
        KeyValueStore store = new KeyValueStore();
        CommandDispatcher dispatcher = new CommandDispatcher(store);

        int threadCount = 8;
        int keysPerThread = 500;
        ExecutorService es = Executors.newFixedThreadPool(threadCount);
        CountDownLatch latch = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        for (int t = 0; t < threadCount; t++) {
            final int id = t;
            futures.add(es.submit(() -> {
                latch.await(); // Sync start
                for (int i = 0; i < keysPerThread; i++) {
                    dispatcher.execute(RespArray.ofBulkStrings("SET", "k" + id + ":" + i, String.valueOf(i)));
                }
                return null;
            }));
        }

        latch.countDown(); // Go!
        for (Future<?> f : futures) f.get(10, TimeUnit.SECONDS);
        es.shutdown();

        assertEquals(threadCount * keysPerThread, store.size());
        for (int t = 0; t < threadCount; t++) {
            assertEquals(BulkString.of("42"),
                    dispatcher.execute(RespArray.ofBulkStrings("GET", "k" + t + ":42")).getValue());
        }
    }

    @Test
    public void testConcurrentDeleteReportsExistenceOnce() throws Exception {
        KeyValueStore store = new KeyValueStore();
        AtomicInteger deleted = new AtomicInteger(0);

        for (int round = 0; round < 200; round++) {
            store.set("race", "v");
            int threadCount = 4;
            ExecutorService es = Executors.newFixedThreadPool(threadCount);
            CountDownLatch latch = new CountDownLatch(1);
            for (int t = 0; t < threadCount; t++) {
                es.submit(() -> {
                    latch.await();
                    if (store.delete("race")) deleted.incrementAndGet();
                    return null;
                });
            }
            latch.countDown();
            es.shutdown();
            assertTrue(es.awaitTermination(5, TimeUnit.SECONDS));
        }

        assertEquals(200, deleted.get(), "exactly one DELETE per round should see the key");
    }

    @Test
    public void testReadersSeeWholeValues() throws Exception {
        KeyValueStore store = new KeyValueStore();
        store.set("k", "a");
        AtomicInteger bad = new AtomicInteger(0);

        Thread writer = new Thread(() -> {
            for (int i = 0; i < 5000; i++) {
                store.set("k", (i % 2 == 0) ? "aaaa" : "bbbb");
            }
        });
        Thread reader = new Thread(() -> {
            for (int i = 0; i < 5000; i++) {
                String v = store.get("k");
                if (!v.equals("a") && !v.equals("aaaa") && !v.equals("bbbb")) bad.incrementAndGet();
            }
        });

        writer.start();
        reader.start();
        writer.join();
        reader.join();

        assertEquals(0, bad.get());
    }
}
