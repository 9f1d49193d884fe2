package com.bidscope.export;

import com.bidscope.config.BidScopeProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Deletes export files older than the retention window.
 */
@Component
public class ExportFileJanitor {

    private static final Logger log = LoggerFactory.getLogger(ExportFileJanitor.class);

    private final Path directory;
    private final Duration retention;
    private final Clock clock;

    @Autowired
    public ExportFileJanitor(BidScopeProperties properties) {
        this(Paths.get(properties.getExport().getDirectory()), properties.getExport().getRetention(),
            Clock.systemUTC());
    }

    ExportFileJanitor(Path directory, Duration retention, Clock clock) {
        this.directory = directory;
        this.retention = retention;
        this.clock = clock;
    }

    /**
     * Run hourly at minute 30
     */
    @Scheduled(cron = "${bidscope.export.cleanup-cron:0 30 * * * *}")
    public void scheduledCleanup() {
        try {
            int deleted = cleanup();
            if (deleted > 0) {
                log.info("Export cleanup removed {} files older than {}", deleted, retention);
            }
        } catch (IOException e) {
            log.error("Export cleanup failed in {}", directory, e);
        }
    }

    public int cleanup() throws IOException {
        if (!Files.isDirectory(directory)) {
            return 0;
        }
        Instant cutoff = clock.instant().minus(retention);
        int deleted = 0;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*.csv")) {
            for (Path file : files) {
                if (Files.getLastModifiedTime(file).toInstant().isBefore(cutoff)) {
                    Files.deleteIfExists(file);
                    deleted++;
                    log.debug("Deleted expired export {}", file.getFileName());
                }
            }
        }
        return deleted;
    }
}
