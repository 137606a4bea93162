package app;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryUsage;

/**
 * Progress line for long batch runs.
 */
final class BatchProgressLogger {

    private static final Logger log = LoggerFactory.getLogger(BatchProgressLogger.class);

    private final int total;
    private final int logEvery;
    private final long loopStartNs;

    BatchProgressLogger(int total, int logEvery) {
        this.total = total;
        this.logEvery = Math.max(1, logEvery);
        this.loopStartNs = System.nanoTime();
    }

    boolean isDue(int done) {
        return done % logEvery == 0 || done == total;
    }

    void logProgress(int done, int success, int skip, String lastModel) {
        if (!isDue(done)) return;
        long elapsed = (System.nanoTime() - loopStartNs) / 1_000_000L;

        MemoryUsage heap = ManagementFactory.getMemoryMXBean().getHeapMemoryUsage();
        long usedMb = heap.getUsed() / (1024 * 1024);
        long maxMb = heap.getMax() / (1024 * 1024);

        log.info("[PROGRESS] {}/{} success={} skip={} elapsed={}ms heap={}/{}MB last={}",
                done, total, success, skip, elapsed, usedMb, maxMb, lastModel);
    }
}
