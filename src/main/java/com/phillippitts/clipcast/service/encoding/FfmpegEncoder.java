package com.phillippitts.clipcast.service.encoding;

import com.phillippitts.clipcast.config.properties.EncoderProperties;
import com.phillippitts.clipcast.domain.Dimensions;
import com.phillippitts.clipcast.domain.OutputFormat;
import com.phillippitts.clipcast.exception.EncodeError;
import com.phillippitts.clipcast.exception.EncodingException;
import com.phillippitts.clipcast.exception.EncodingExceptionBuilder;
import com.phillippitts.clipcast.util.LogSanitizer;
import com.phillippitts.clipcast.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.function.IntConsumer;

/**
 * {@link MediaEncoder} driving the ffmpeg CLI.
 *
 * <p>GIF encodes run a palette pass first and fall back to a direct encode when it fails.
 * WebP and MP4 are single-pass. Progress is parsed from ffmpeg's {@code frame=} status lines.
 */
public class FfmpegEncoder implements MediaEncoder {

    private static final Logger LOG = LogManager.getLogger(FfmpegEncoder.class);

    static final String PALETTE_FILE = "palette.png";
    static final int PALETTE_DONE_PERCENT = 30;
    private static final int ERROR_STDERR_CHARS = 500;

    private final FfmpegLocator locator;
    private final FfmpegProcessRunner runner;
    private final EncoderProperties props;

    public FfmpegEncoder(FfmpegLocator locator, FfmpegProcessRunner runner, EncoderProperties props) {
        this.locator = Objects.requireNonNull(locator, "locator");
        this.runner = Objects.requireNonNull(runner, "runner");
        this.props = Objects.requireNonNull(props, "props");
    }

    @Override
    public EncodedMedia encode(List<Path> frames, Path output, EncodeParameters params, IntConsumer onProgress) {
        Objects.requireNonNull(output, "output");
        Objects.requireNonNull(params, "params");
        IntConsumer progress = onProgress == null ? p -> { } : onProgress;
        if (frames == null || frames.isEmpty()) {
            throw new EncodingException(EncodeError.NO_FRAMES, "No frames to encode");
        }

        Path ffmpeg = locator.require();
        prepareOutput(output);
        Dimensions source = readDimensions(frames.get(0));
        LOG.info("Encoding {} frames ({}) to {} at {} fps", frames.size(), source, params.format(), params.fps());
        progress.accept(0);

        return switch (params.format()) {
            case GIF -> encodeGif(ffmpeg, frames, output, params, source, progress);
            case WEBP -> encodeWebp(ffmpeg, frames, output, params, source, progress);
            case MP4 -> encodeMp4(ffmpeg, frames, output, params, source, progress);
        };
    }

    private EncodedMedia encodeGif(Path ffmpeg, List<Path> frames, Path output, EncodeParameters params,
                                   Dimensions source, IntConsumer progress) {
        GifParameters gif = GifParameters.forQuality(QualityMapper.gifQuality(params.quality()), params.fastMode());
        int fps = gif.fps(params.fps());
        Dimensions target = new Dimensions(Math.max(1, (int) (source.width() * gif.scale())),
                Math.max(1, (int) (source.height() * gif.scale())));
        String scale = "fps=" + fps + ",scale=" + target.width() + ":" + target.height() + ":flags=lanczos";
        List<String> input = FrameInputPattern.inputArgs(frames.get(0), fps);
        Path palette = frames.get(0).toAbsolutePath().getParent().resolve(PALETTE_FILE);
        LOG.debug("GIF params: tier={} fps={} size={} maxColors={} dither={}",
                gif.tier(), fps, target, gif.maxColors(), gif.dither());

        try {
            boolean usePalette = generatePalette(ffmpeg, input, scale, gif, palette);
            List<String> cmd = new ArrayList<>();
            cmd.add(ffmpeg.toString());
            cmd.add("-y");
            cmd.addAll(input);
            if (usePalette) {
                progress.accept(PALETTE_DONE_PERCENT);
                cmd.add("-i");
                cmd.add(palette.toString());
                cmd.add("-lavfi");
                cmd.add(scale + " [x]; [x][1:v] paletteuse=dither=" + gif.dither());
            } else {
                cmd.add("-vf");
                cmd.add(scale);
            }
            cmd.add(output.toString());

            int base = usePalette ? PALETTE_DONE_PERCENT : 0;
            int span = usePalette ? 65 : 95;
            return runEncode(cmd, OutputFormat.GIF, frames.size(), output, target,
                    props.timeoutFor(OutputFormat.GIF), base, span, progress);
        } finally {
            deleteQuietly(palette);
        }
    }

    private boolean generatePalette(Path ffmpeg, List<String> input, String scale, GifParameters gif, Path palette) {
        List<String> cmd = new ArrayList<>();
        cmd.add(ffmpeg.toString());
        cmd.add("-y");
        cmd.addAll(input);
        cmd.add("-vf");
        cmd.add(scale + ",palettegen=max_colors=" + gif.maxColors() + ":stats_mode=single");
        cmd.add(palette.toString());
        try {
            FfmpegProcessRunner.RunResult r = runner.run(cmd, palette.getParent(), props.paletteTimeout(), null);
            if (r.succeeded() && Files.exists(palette)) {
                LOG.debug("Palette generated in {}ms", r.durationMs());
                return true;
            }
            LOG.info("Palette pass failed (exit={}, timedOut={}); encoding GIF directly", r.exitCode(), r.timedOut());
        } catch (EncodingException e) {
            LOG.info("Palette pass could not run ({}); encoding GIF directly", e.getMessage());
        }
        deleteQuietly(palette);
        return false;
    }

    private EncodedMedia encodeWebp(Path ffmpeg, List<Path> frames, Path output, EncodeParameters params,
                                    Dimensions source, IntConsumer progress) {
        List<String> cmd = new ArrayList<>();
        cmd.add(ffmpeg.toString());
        cmd.addAll(List.of("-y", "-stats", "-threads", "0"));
        cmd.addAll(FrameInputPattern.inputArgs(frames.get(0), params.fps()));
        cmd.addAll(List.of("-c:v", "libwebp",
                "-lossless", "0",
                "-quality", String.valueOf(QualityMapper.webpQuality(params.quality())),
                "-compression_level", "0",
                "-method", "0",
                "-loop", "0"));
        cmd.add(output.toString());
        return runEncode(cmd, OutputFormat.WEBP, frames.size(), output, source,
                props.timeoutFor(OutputFormat.WEBP), 0, 95, progress);
    }

    private EncodedMedia encodeMp4(Path ffmpeg, List<Path> frames, Path output, EncodeParameters params,
                                   Dimensions source, IntConsumer progress) {
        Dimensions even = source.evenSized();
        int crf = QualityMapper.mp4Crf(params.quality());
        // baseline has no lossless mode
        int adjustedCrf = Math.max(1, crf);
        String profile = crf <= 5 ? "high" : "baseline";

        List<String> cmd = new ArrayList<>();
        cmd.add(ffmpeg.toString());
        cmd.addAll(List.of("-y", "-stats"));
        cmd.addAll(FrameInputPattern.inputArgs(frames.get(0), params.fps()));
        cmd.addAll(List.of("-vf", "scale=" + even.width() + ":" + even.height(),
                "-c:v", "libx264",
                "-profile:v", profile,
                "-level", "3.0",
                "-pix_fmt", "yuv420p",
                "-preset", "fast",
                "-crf", String.valueOf(adjustedCrf),
                "-movflags", "faststart"));
        cmd.add(output.toString());
        return runEncode(cmd, OutputFormat.MP4, frames.size(), output, even,
                props.timeoutFor(OutputFormat.MP4), 0, 95, progress);
    }

    private EncodedMedia runEncode(List<String> cmd, OutputFormat format, int totalFrames, Path output,
                                   Dimensions dimensions, Duration timeout, int base, int span,
                                   IntConsumer progress) {
        LOG.debug("ffmpeg command: {}", cmd);
        FfmpegProgressParser parser = new FfmpegProgressParser(totalFrames, base, span, progress);
        FfmpegProcessRunner.RunResult r = runner.run(cmd, output.toAbsolutePath().getParent(), timeout, parser::accept);
        parser.finish();

        if (r.timedOut()) {
            throw failure(format + " encode timed out after " + timeout.toSeconds() + "s", EncodeError.TIMEOUT,
                    r, format, totalFrames);
        }
        if (r.exitCode() != 0) {
            EncodeError error = CrashClassifier.classify(r.exitCode(), r.abortSeen());
            throw failure(format + " encode failed: " + error.userHint(), error, r, format, totalFrames);
        }
        long size = sizeOf(output);
        if (size <= 0) {
            throw failure(format + " encode failed: " + EncodeError.OUTPUT_MISSING.userHint(),
                    EncodeError.OUTPUT_MISSING, r, format, totalFrames);
        }
        progress.accept(100);
        LOG.info("Encoded {} ({} bytes, {}) in {}ms", output.getFileName(), size, dimensions, r.durationMs());
        return new EncodedMedia(output, dimensions, size, r.durationMs());
    }

    private static EncodingException failure(String message, EncodeError error, FfmpegProcessRunner.RunResult r,
                                             OutputFormat format, int frames) {
        EncodingExceptionBuilder b = EncodingExceptionBuilder.create(message, error)
                .durationMs(r.durationMs())
                .metadata("format", format)
                .metadata("frames", frames);
        if (!r.timedOut()) {
            b.exitCode(r.exitCode());
        }
        if (!r.stderrTail().isEmpty()) {
            b.metadata("stderr", LogSanitizer.tail(r.stderrTail(), ERROR_STDERR_CHARS));
        }
        EncodingException e = b.build();
        LOG.warn("{}", e.getMessage());
        return e;
    }

    private static void prepareOutput(Path output) {
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.deleteIfExists(output);
        } catch (IOException e) {
            throw EncodingExceptionBuilder.create("Cannot prepare output " + output, EncodeError.IO)
                    .cause(e)
                    .build();
        }
    }

    /** Reads the image header only. */
    static Dimensions readDimensions(Path frame) {
        long start = System.nanoTime();
        try (ImageInputStream in = ImageIO.createImageInputStream(frame.toFile())) {
            if (in != null) {
                Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
                if (readers.hasNext()) {
                    ImageReader reader = readers.next();
                    try {
                        reader.setInput(in);
                        return new Dimensions(reader.getWidth(0), reader.getHeight(0));
                    } finally {
                        reader.dispose();
                    }
                }
            }
        } catch (IOException | IllegalArgumentException e) {
            throw EncodingExceptionBuilder.create("Unreadable frame " + frame.getFileName(), EncodeError.IO)
                    .cause(e)
                    .durationMs(TimeUtils.elapsedMillis(start))
                    .build();
        }
        throw EncodingExceptionBuilder.create("Unsupported frame image " + frame.getFileName(), EncodeError.IO)
                .build();
    }

    private static long sizeOf(Path file) {
        try {
            return Files.exists(file) ? Files.size(file) : -1L;
        } catch (IOException e) {
            LOG.debug("Cannot size {}: {}", file, e.toString());
            return -1L;
        }
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LOG.debug("Could not delete {}: {}", file, e.toString());
        }
    }
}
