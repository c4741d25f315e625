// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.vsjbuf.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static uk.co.farowl.vsjbuf.runtime.UnitTestSupport.bytes;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import uk.co.farowl.vsjbuf.buffer.PyBuffer;

/**
 * Race threads that export a {@code bytearray} against a thread that
 * tries to extend it. Every export must be counted and released, and
 * no reader may see the content change under it.
 */
@DisplayName("A bytearray shared between threads")
class PyByteArrayConcurrencyTest {

    /** Logger for the test. */
    static final Logger logger =
            LoggerFactory.getLogger(PyByteArrayConcurrencyTest.class);

    /** Threads that read through exports. */
    static final int READERS = 8;

    /** Exports made by each reader. */
    static final int READS = 2000;

    /** Attempts to append made by the writer. */
    static final int WRITES = 500;

    @Test
    @DisplayName("counts every export and grows only when free")
    void exportsAndResize() throws Exception {
        final byte[] initial = bytes(10, 20, 30, 40);
        PyByteArray ba = new PyByteArray(initial);
        AtomicInteger appended = new AtomicInteger();
        AtomicInteger refused = new AtomicInteger();
        Queue<Throwable> failures = new ConcurrentLinkedQueue<>();

        // All threads start together when the last arrives
        CyclicBarrier start = new CyclicBarrier(READERS + 1);
        Thread[] threads = new Thread[READERS + 1];

        for (int t = 0; t < READERS; t++) {
            threads[t] = new Thread(() -> {
                try {
                    start.await();
                    for (int i = 0; i < READS; i++) {
                        try (PyBuffer b = ba.getBuffer()) {
                            byte[] seen = b.toByteArray();
                            // Content may only have grown at the end
                            assertEquals(b.getDescriptor().getLen(),
                                    seen.length);
                            for (int k = 0; k < initial.length; k++) {
                                assertEquals(initial[k], seen[k]);
                            }
                        }
                    }
                } catch (Throwable e) {
                    failures.add(e);
                }
            }, "reader-" + t);
        }

        threads[READERS] = new Thread(() -> {
            try {
                start.await();
                for (int i = 0; i < WRITES; i++) {
                    try (PyByteArray.Resizable r = ba.tryResizableOpt()) {
                        if (r == null) {
                            refused.incrementAndGet();
                        } else {
                            r.append(bytes(i), 0, 1);
                            appended.incrementAndGet();
                        }
                    }
                }
            } catch (Throwable e) {
                failures.add(e);
            }
        }, "writer");

        for (Thread t : threads) { t.start(); }
        for (Thread t : threads) { t.join(60_000); }

        for (Thread t : threads) {
            assertTrue(!t.isAlive(), () -> t.getName() + " still running");
        }
        for (Throwable e : failures) {
            logger.error("failure in thread", e);
        }
        assertTrue(failures.isEmpty(), "failures in threads");

        logger.atDebug().setMessage("appended {}, refused {}")
                .addArgument(appended::get).addArgument(refused::get).log();
        assertEquals(WRITES, appended.get() + refused.get());
        assertEquals(0, ba.getExports());
        assertEquals(initial.length + appended.get(), ba.size());

        // Now free to grow
        ba.append(1);
    }
}
