package biz.kryukov.dev.healthprobe.probes;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryUsage;

/**
 * Source of heap usage figures for the {@code memory} probe.
 */
public interface MemoryMetrics {

    /** Returns the used heap in bytes. */
    long usedBytes();

    /** Returns the heap limit in bytes. */
    long totalBytes();

    /**
     * Heap usage of the running JVM. The limit is the maximum heap size, or the committed
     * size when no maximum is defined.
     */
    static MemoryMetrics jvm() {
        return new MemoryMetrics() {
            @Override
            public long usedBytes() {
                return heap().getUsed();
            }

            @Override
            public long totalBytes() {
                MemoryUsage heap = heap();
                return heap.getMax() > 0 ? heap.getMax() : heap.getCommitted();
            }

            private MemoryUsage heap() {
                return ManagementFactory.getMemoryMXBean().getHeapMemoryUsage();
            }
        };
    }
}
