package com.autoposter.variation;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Semaphore;
import java.util.function.BooleanSupplier;

/**
 * Produces re-encoded copies of a source video that differ in content hash while staying
 * visually equivalent.
 * <p>
 * Every invocation drives one transcoder subprocess. At most
 * {@link VariationSettings#getMaxConcurrentTranscodes()} run at once; further callers wait
 * for a permit without holding anything else. Cancellation is cooperative and observed between
 * pipeline stages, a running transcode is never killed for it.
 */
@Slf4j
public class VariationEngine {

    private static final BooleanSupplier NEVER_CANCELLED = () -> false;
    private static final Duration VERSION_CHECK_TIMEOUT = Duration.ofSeconds(15);

    private final VariationSettings settings;
    private final CommandRunner runner;
    private final VideoProbe probe;
    private final Semaphore transcodePermits;
    private final String ffmpeg;

    private volatile boolean encoderVerified;

    public VariationEngine(VariationSettings settings) {
        this(settings, new ProcessCommandRunner());
    }

    public VariationEngine(VariationSettings settings, CommandRunner runner) {
        this.settings = settings;
        this.runner = runner;
        this.probe = new VideoProbe(runner, settings);
        this.transcodePermits = new Semaphore(Math.max(1, settings.getMaxConcurrentTranscodes()), true);
        this.ffmpeg = FFmpegCommandBuilder.resolveBinary(settings.getFfmpegPath(), "ffmpeg");
    }

    /**
     * Creates one variation of {@code source} in {@code outputDir} under a fresh file name.
     */
    public VariationResult createVariation(Path source, long seed, Path outputDir) {
        return createVariation(source, seed, outputDir.resolve(generateUniqueFileName("variation")), NEVER_CANCELLED);
    }

    /**
     * Creates the variation used by an upload job. The job id is the seed, so a retried job
     * reproduces the same parameter vector.
     */
    public VariationResult createJobVariation(Path source, long jobId, Path outputDir, BooleanSupplier cancelled) {
        return createVariation(source, jobId, outputDir.resolve(generateUniqueFileName("job_" + jobId)), cancelled);
    }

    public VariationResult createVariation(Path source, long seed, Path output, BooleanSupplier cancelled) {
        checkCancelled(cancelled, VariationException.Stage.PREPARE);
        if (source == null || !Files.isRegularFile(source)) {
            throw new VariationException(VariationException.Kind.SOURCE_NOT_FOUND, VariationException.Stage.PREPARE,
                    "Source video not found: " + source);
        }
        ensureEncoderAvailable();
        prepareOutputDirectory(output);

        VideoInfo info = probe.probe(source);
        VariationParameters params = VariationParameters.fromSeed(seed);
        log.info("Creating variation of {} with seed {} -> {}", source.getFileName(), seed, output.getFileName());

        checkCancelled(cancelled, VariationException.Stage.ENCODE);
        List<String> command = FFmpegCommandBuilder.buildVariationCommand(ffmpeg, source, output, params, info, settings);
        transcode(command, output);

        if (cancelled.getAsBoolean()) {
            deleteQuietly(output);
            throw new VariationException(VariationException.Kind.CANCELLED, VariationException.Stage.HASH,
                    "Cancelled after encode of " + output.getFileName());
        }

        String hash;
        try {
            hash = ContentDigest.sha256(output);
        } catch (IOException e) {
            throw new VariationException(VariationException.Kind.ENCODE_FAILED, VariationException.Stage.HASH,
                    "Could not digest " + output, e.getMessage(), e);
        }
        return new VariationResult(seed, params, source, output, hash, info);
    }

    public BatchResult batch(Path source, int count, Path outputDir) {
        return batch(source, count, outputDir, 1L, NEVER_CANCELLED);
    }

    /**
     * Runs the pipeline {@code count} times with seeds {@code baseSeed + i}. Item failures are
     * recorded on the returned result and never stop the remaining items. Once cancelled, the
     * items not yet started are recorded as cancelled.
     */
    public BatchResult batch(Path source, int count, Path outputDir, long baseSeed, BooleanSupplier cancelled) {
        log.info("Batch processing: {} variations of {}", count, source);
        List<VariationAttempt> attempts = new ArrayList<>(Math.max(count, 0));

        for (int i = 0; i < count; i++) {
            long seed = baseSeed + i;
            try {
                VariationResult result = createVariation(source, seed,
                        outputDir.resolve(generateUniqueFileName("variation_" + (i + 1))), cancelled);
                attempts.add(VariationAttempt.succeeded(i, result));
                log.info("Batch progress: {}/{} completed", i + 1, count);
            } catch (VariationException e) {
                log.error("Failed to create variation {} of {}: {}", i + 1, count, e.getMessage());
                attempts.add(VariationAttempt.failed(i, seed, e));
            } catch (RuntimeException e) {
                log.error("Unexpected failure creating variation {} of {}", i + 1, count, e);
                attempts.add(VariationAttempt.failed(i, seed, new VariationException(
                        VariationException.Kind.ENCODE_FAILED, VariationException.Stage.ENCODE,
                        String.valueOf(e.getMessage()), null, e)));
            }
        }

        BatchResult result = new BatchResult(count, attempts);
        log.info("Batch processing completed: {}/{} successful", result.getSucceeded(), count);
        return result;
    }

    /**
     * Digests every file and reports colliding pairs. Missing files are listed and skipped.
     */
    public UniquenessReport verifyUniqueness(Collection<Path> paths) {
        Map<String, Path> firstSeen = new HashMap<>();
        List<HashCollision> collisions = new ArrayList<>();
        List<Path> missing = new ArrayList<>();

        for (Path path : paths) {
            if (!Files.isRegularFile(path)) {
                log.warn("File not found for hash check: {}", path);
                missing.add(path);
                continue;
            }
            String hash;
            try {
                hash = ContentDigest.sha256(path);
            } catch (IOException e) {
                log.warn("Could not digest {}: {}", path, e.getMessage());
                missing.add(path);
                continue;
            }
            Path previous = firstSeen.putIfAbsent(hash, path);
            if (previous != null) {
                collisions.add(new HashCollision(hash, previous, path));
            }
        }

        UniquenessReport report = new UniquenessReport(paths.size(), firstSeen.size(), collisions, missing);
        log.info("Hash verification: {} unique out of {} files", report.getUniqueHashes(), report.getTotalFiles());
        return report;
    }

    /**
     * Verifies once that the encoder can be started. Later calls return immediately.
     */
    public void ensureEncoderAvailable() {
        if (encoderVerified) {
            return;
        }
        try {
            CommandResult result = runner.run(FFmpegCommandBuilder.buildVersionCommand(ffmpeg), VERSION_CHECK_TIMEOUT);
            if (!result.isSuccess()) {
                throw new VariationException(VariationException.Kind.ENCODER_UNAVAILABLE,
                        VariationException.Stage.PREPARE, "ffmpeg -version failed",
                        DiagnosticParser.parse(result.getOutput()));
            }
            encoderVerified = true;
            log.info("FFmpeg found: {}", result.getOutput().lines().findFirst().orElse(ffmpeg));
        } catch (IOException e) {
            throw new VariationException(VariationException.Kind.ENCODER_UNAVAILABLE, VariationException.Stage.PREPARE,
                    "ffmpeg is not installed or not accessible: " + ffmpeg, e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new VariationException(VariationException.Kind.CANCELLED, VariationException.Stage.PREPARE,
                    "Interrupted while checking ffmpeg");
        }
    }

    public int availableTranscodeSlots() {
        return transcodePermits.availablePermits();
    }

    public static String generateUniqueFileName(String prefix) {
        return prefix + "_" + UUID.randomUUID() + ".mp4";
    }

    private void transcode(List<String> command, Path output) {
        try {
            transcodePermits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new VariationException(VariationException.Kind.CANCELLED, VariationException.Stage.ENCODE,
                    "Interrupted while waiting for a transcode slot");
        }

        CommandResult result;
        try {
            result = runner.run(command, settings.getEncodeTimeout());
        } catch (IOException e) {
            throw new VariationException(VariationException.Kind.ENCODER_UNAVAILABLE, VariationException.Stage.ENCODE,
                    "ffmpeg could not be started", e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            deleteQuietly(output);
            throw new VariationException(VariationException.Kind.CANCELLED, VariationException.Stage.ENCODE,
                    "Interrupted during encode");
        } finally {
            transcodePermits.release();
        }

        if (result.isTimedOut()) {
            deleteQuietly(output);
            throw new VariationException(VariationException.Kind.TIMEOUT, VariationException.Stage.ENCODE,
                    "Encode exceeded " + settings.getEncodeTimeout());
        }
        if (result.getExitCode() != 0) {
            deleteQuietly(output);
            throw new VariationException(VariationException.Kind.ENCODE_FAILED, VariationException.Stage.ENCODE,
                    "ffmpeg exited with code " + result.getExitCode(), DiagnosticParser.parse(result.getOutput()));
        }
        if (!Files.isRegularFile(output)) {
            throw new VariationException(VariationException.Kind.ENCODE_FAILED, VariationException.Stage.ENCODE,
                    "ffmpeg reported success but produced no file: " + output);
        }
    }

    private void prepareOutputDirectory(Path output) {
        Path parent = output.toAbsolutePath().getParent();
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new VariationException(VariationException.Kind.ENCODE_FAILED, VariationException.Stage.PREPARE,
                    "Cannot create output directory " + parent, e.getMessage(), e);
        }
    }

    private void checkCancelled(BooleanSupplier cancelled, VariationException.Stage stage) {
        if (cancelled.getAsBoolean()) {
            throw new VariationException(VariationException.Kind.CANCELLED, stage, "Variation cancelled");
        }
    }

    private void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Failed to clean up partial output {}: {}", path, e.getMessage());
        }
    }
}
