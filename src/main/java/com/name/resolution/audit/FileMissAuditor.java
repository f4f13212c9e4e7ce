package com.name.resolution.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Append-only file implementation of {@link MissAuditor}.
 *
 * <p>Each miss is written as one line, {@code yyyy/MM/dd HH:mm:ss ID=<id> reason=<reason>},
 * and flushed immediately. If the file cannot be opened, lines go to a diagnostic stream
 * (stderr by default) prefixed with {@code [NAME_MISS] } instead. Write failures are
 * logged and dropped.</p>
 */
public class FileMissAuditor implements MissAuditor {
    private static final Logger log = LoggerFactory.getLogger(FileMissAuditor.class);

    public static final String DEFAULT_PATH = "name_service_miss.log";
    static final String FALLBACK_PREFIX = "[NAME_MISS] ";

    private static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm:ss");

    private final Writer writer;
    private final String prefix;
    private final boolean usingFallback;
    private final Clock clock;
    private final ZoneId zone;

    public FileMissAuditor(Path path) {
        this(path, System.err, Clock.systemDefaultZone());
    }

    public FileMissAuditor(Path path, PrintStream fallback, Clock clock) {
        this.clock = clock;
        this.zone = clock.getZone();
        Writer opened = open(path);
        if (opened != null) {
            this.writer = opened;
            this.prefix = "";
            this.usingFallback = false;
            log.info("Name miss log initialized: {}", path);
        } else {
            this.writer = new OutputStreamWriter(fallback, StandardCharsets.UTF_8);
            this.prefix = FALLBACK_PREFIX;
            this.usingFallback = true;
        }
    }

    @Override
    public void record(String id, MissReason reason) {
        String line = prefix + TIMESTAMP_FORMAT.format(clock.instant().atZone(zone))
                + " ID=" + id + " reason=" + reason.getCode();
        synchronized (writer) {
            try {
                writer.write(line);
                writer.write(System.lineSeparator());
                writer.flush();
            } catch (IOException e) {
                log.warn("miss.audit.write_failed id={} reason={} error={}", id, reason.getCode(), e.getMessage());
            }
        }
    }

    /**
     * True when the log file could not be opened and lines go to the diagnostic stream.
     */
    public boolean isUsingFallback() {
        return usingFallback;
    }

    @Override
    public void close() {
        if (usingFallback) {
            // never close the diagnostic stream
            return;
        }
        synchronized (writer) {
            try {
                writer.close();
            } catch (IOException e) {
                log.warn("miss.audit.close_failed error={}", e.getMessage());
            }
        }
    }

    private static Writer open(Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            return new BufferedWriter(new OutputStreamWriter(
                    Files.newOutputStream(path, StandardOpenOption.CREATE,
                            StandardOpenOption.WRITE, StandardOpenOption.APPEND),
                    StandardCharsets.UTF_8));
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to open name miss log {}: {}, using diagnostic stream", path, e.getMessage());
            return null;
        }
    }
}
