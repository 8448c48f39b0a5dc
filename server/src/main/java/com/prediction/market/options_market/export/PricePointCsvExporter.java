package com.prediction.market.options_market.export;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Optional;

import com.prediction.market.options_market.entity.PricePoint;

import lombok.extern.slf4j.Slf4j;

/**
 * Writes one CSV row per emitted point, flushing after every row so the file
 * can be tailed while the simulation runs.
 */
@Slf4j
public class PricePointCsvExporter implements PricePointRecorder {

    static final String HEADER = "timestamp,price,movement,volume,bid_ask_spread,resolved_outcome";

    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Path directory;
    private final String fileName;
    private final Clock clock;

    private BufferedWriter writer;
    private Path file;

    /**
     * @param directory target directory, created on open
     * @param fileName  fixed file name, or null to derive one from outcome and time
     */
    public PricePointCsvExporter(Path directory, String fileName, Clock clock) {
        this.directory = directory;
        this.fileName = fileName;
        this.clock = clock;
    }

    @Override
    public synchronized void open(boolean resolvedOutcome, int totalPoints) {
        if (writer != null) {
            log.warn("CSV export already open: {}", file);
            return;
        }
        Path target = directory.resolve(fileName != null ? fileName : defaultFileName(resolvedOutcome, totalPoints));
        try {
            Files.createDirectories(directory);
            writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
            writer.write(HEADER);
            writer.newLine();
            writer.flush();
            file = target;
            log.info("CSV export started: {}", target);
        } catch (IOException e) {
            log.error("Failed to open CSV export {}, export disabled for this run", target, e);
            closeQuietly();
        }
    }

    @Override
    public synchronized void record(PricePoint point) {
        if (writer == null) {
            return;
        }
        try {
            writer.write(toRow(point));
            writer.newLine();
            writer.flush();
        } catch (IOException e) {
            log.error("Failed to write point {} to {}, export disabled for this run",
                    point.getSequenceIndex(), file, e);
            closeQuietly();
        }
    }

    @Override
    public synchronized void close() {
        if (writer == null) {
            return;
        }
        try {
            writer.close();
            log.info("CSV export closed: {}", file);
        } catch (IOException e) {
            log.warn("Failed to close CSV export {}", file, e);
        } finally {
            writer = null;
        }
    }

    public synchronized Optional<Path> getFile() {
        return Optional.ofNullable(file);
    }

    static String toRow(PricePoint point) {
        String outcome = point.getResolvedOutcome() == null ? "" : point.getResolvedOutcome().toString();
        return String.format(Locale.ROOT, "%s,%.2f,%.3f,%d,%.2f,%s",
                point.getTimestamp(),
                point.getPrice(),
                point.getMovement(),
                point.getVolume(),
                point.getBidAskSpread(),
                outcome);
    }

    private String defaultFileName(boolean resolvedOutcome, int totalPoints) {
        String stamp = LocalDateTime.now(clock).format(FILE_STAMP);
        return String.format("LIVE_market_%s_%s_T%d.csv", resolvedOutcome ? "YES" : "NO", stamp, totalPoints);
    }

    private void closeQuietly() {
        if (writer == null) {
            return;
        }
        try {
            writer.close();
        } catch (IOException e) {
            log.debug("Ignoring close failure after export error on {}", file, e);
        } finally {
            writer = null;
        }
    }
}
