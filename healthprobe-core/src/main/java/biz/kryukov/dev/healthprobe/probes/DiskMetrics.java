package biz.kryukov.dev.healthprobe.probes;

import java.io.IOException;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Source of free/total space figures for the {@code disk_space} probe.
 */
public interface DiskMetrics {

    /** Returns the bytes available to this JVM. */
    long usableBytes() throws IOException;

    /** Returns the size of the file store in bytes. */
    long totalBytes() throws IOException;

    /** Space of the file store holding {@code path}. */
    static DiskMetrics forPath(Path path) {
        return new DiskMetrics() {
            @Override
            public long usableBytes() throws IOException {
                return store().getUsableSpace();
            }

            @Override
            public long totalBytes() throws IOException {
                return store().getTotalSpace();
            }

            private FileStore store() throws IOException {
                return Files.getFileStore(path);
            }
        };
    }
}
