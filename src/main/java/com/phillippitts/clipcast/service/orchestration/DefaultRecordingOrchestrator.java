package com.phillippitts.clipcast.service.orchestration;

import com.phillippitts.clipcast.config.properties.CaptureProperties;
import com.phillippitts.clipcast.domain.AppState;
import com.phillippitts.clipcast.domain.CaptureMethod;
import com.phillippitts.clipcast.domain.CaptureRegion;
import com.phillippitts.clipcast.domain.MediaItem;
import com.phillippitts.clipcast.domain.OutputFormat;
import com.phillippitts.clipcast.domain.ProcessingStage;
import com.phillippitts.clipcast.domain.RecordingSession;
import com.phillippitts.clipcast.domain.RecordingSettings;
import com.phillippitts.clipcast.exception.CaptureException;
import com.phillippitts.clipcast.exception.ClipCastException;
import com.phillippitts.clipcast.exception.EncoderNotFoundException;
import com.phillippitts.clipcast.exception.EncodingException;
import com.phillippitts.clipcast.service.capture.CaptureQuality;
import com.phillippitts.clipcast.service.capture.CaptureRequest;
import com.phillippitts.clipcast.service.capture.CaptureStrategyChain;
import com.phillippitts.clipcast.service.capture.FrameSequence;
import com.phillippitts.clipcast.service.capture.ScreenCaptureStrategy;
import com.phillippitts.clipcast.service.encoding.EncodeParameters;
import com.phillippitts.clipcast.service.encoding.EncodedMedia;
import com.phillippitts.clipcast.service.encoding.MediaEncoder;
import com.phillippitts.clipcast.service.encoding.QualityMapper;
import com.phillippitts.clipcast.service.media.MediaCatalog;
import com.phillippitts.clipcast.service.orchestration.event.RecordingCompletedEvent;
import com.phillippitts.clipcast.service.orchestration.event.RecordingFailedEvent;
import com.phillippitts.clipcast.service.orchestration.event.RecordingStartedEvent;
import com.phillippitts.clipcast.service.settings.SettingsProvider;
import com.phillippitts.clipcast.service.state.StateRepository;
import com.phillippitts.clipcast.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.SmartLifecycle;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Drives one recording session at a time from start trigger to finished {@link MediaItem}.
 *
 * <p><b>Session lifecycle:</b>
 * <ol>
 *   <li>{@link #startRecording} creates a frame directory, starts the first working capture
 *       backend and moves the state repository to {@code Recording}</li>
 *   <li>a periodic tick publishes frame count, recorded duration and on-disk size, switches to
 *       the next backend when the current one produces nothing or stalls, and stops the session
 *       at the maximum duration</li>
 *   <li>{@link #stopRecording} stops capture (blocking until no more frames are written), moves
 *       to {@code Processing} and encodes on the encode executor</li>
 *   <li>the encode either completes the session or ends in a recoverable error</li>
 * </ol>
 *
 * <p><b>Pause:</b> accounting only. Backends keep writing frames; paused intervals are left out
 * of the recorded duration.
 *
 * <p><b>Error Handling:</b> capture and encode failures never escape this class. Each is turned
 * into one {@link StateRepository#handleError(String, Throwable, boolean) handleError(...,
 * recoverable=true)} call and a {@link RecordingFailedEvent}.
 *
 * <p><b>Shutdown:</b> stopping the lifecycle cancels the active session and discards its frames.
 */
public class DefaultRecordingOrchestrator implements RecordingController, SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(DefaultRecordingOrchestrator.class);

    static final String MDC_SESSION_ID = "sessionId";

    private final StateRepository stateRepository;
    private final CaptureStrategyChain captureChain;
    private final MediaEncoder encoder;
    private final FrameDirectoryManager frameDirectories;
    private final OutputFileNamer fileNamer;
    private final MediaItemFactory mediaItemFactory;
    private final MediaCatalog mediaCatalog;
    private final SettingsProvider settingsProvider;
    private final ApplicationEventPublisher publisher;
    private final Executor encodeExecutor;
    private final ScheduledExecutorService scheduler;
    private final CaptureProperties captureProperties;
    private final long tickIntervalMs;
    private final LongSupplier ticker;
    private final Clock clock;

    private final Object lock = new Object();
    private ActiveSession active; // guarded by lock
    private volatile boolean running;

    DefaultRecordingOrchestrator(DefaultRecordingOrchestratorBuilder b) {
        this.stateRepository = b.stateRepository();
        this.captureChain = b.captureChain();
        this.encoder = b.encoder();
        this.frameDirectories = b.frameDirectories();
        this.fileNamer = b.fileNamer();
        this.mediaItemFactory = b.mediaItemFactory();
        this.mediaCatalog = b.mediaCatalog();
        this.settingsProvider = b.settingsProvider();
        this.publisher = b.publisher();
        this.encodeExecutor = b.encodeExecutor();
        this.scheduler = b.scheduler();
        this.captureProperties = b.captureProperties();
        this.tickIntervalMs = b.tickIntervalMs();
        this.ticker = b.ticker();
        this.clock = b.clock();
    }

    // ---- lifecycle ------------------------------------------------------------------------

    @Override
    public void start() {
        if (running) {
            return;
        }
        RecordingSettings settings = settingsProvider.load();
        frameDirectories.purgeStale(settings.tempDirectory());
        stateRepository.initialize(settings, mediaCatalog.recent(settings.maxRecentItems()));
        running = true;
        LOG.info("Recording orchestrator ready (format={}, fps={}, quality={}, maxDuration={}s)",
                settings.defaultFormat(), settings.defaultFps(), settings.defaultQuality(),
                settings.defaultMaxDurationSeconds());
    }

    @Override
    public void stop() {
        if (!running) {
            return;
        }
        running = false;
        if (cancelRecording()) {
            LOG.info("Active recording cancelled on shutdown");
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    // ---- RecordingController --------------------------------------------------------------

    @Override
    public boolean startRecording(CaptureRegion area) {
        synchronized (lock) {
            AppState state = stateRepository.current();
            if (active != null || state instanceof AppState.Recording || state instanceof AppState.Processing) {
                LOG.debug("startRecording ignored in state {}", state.name());
                return false;
            }
            RecordingSettings settings = stateRepository.settings();
            OutputFormat format = settings.defaultFormat();
            int fps = CaptureQuality.captureFps(format, settings.defaultFps(), settings.defaultQuality(),
                    settings.fastMode());

            Path frameDir;
            try {
                frameDir = frameDirectories.createSessionDirectory(settings.tempDirectory(), LocalDateTime.now(clock));
            } catch (ClipCastException e) {
                fail(null, "frame_directory", "Could not prepare recording: " + e.getMessage(), e);
                return false;
            }

            CaptureRequest request = new CaptureRequest(area, fps, settings.captureScale(),
                    CaptureQuality.jpegPercent(settings.defaultQuality()), frameDir,
                    settings.captureMouseCursor(), 0);
            ScreenCaptureStrategy strategy;
            try {
                strategy = captureChain.start(request);
            } catch (CaptureException e) {
                frameDirectories.deleteRecursively(frameDir);
                fail(null, "capture_" + e.getKind().name().toLowerCase(Locale.ROOT),
                        "Could not start screen capture: " + e.getMessage(), e);
                return false;
            }

            RecordingSession session = stateRepository.startRecording(area, format,
                    settings.defaultMaxDurationSeconds(), strategy.method(), frameDir);
            ActiveSession s = new ActiveSession(session, request, settings, strategy, ticker.getAsLong());
            s.tick = scheduler.scheduleAtFixedRate(this::tickSafely, tickIntervalMs, tickIntervalMs,
                    TimeUnit.MILLISECONDS);
            active = s;

            ThreadContext.put(MDC_SESSION_ID, session.id());
            try {
                LOG.info("Recording started: backend={}, area={}, format={}, fps={}, maxDuration={}s, dir={}",
                        strategy.name(), area == null ? "full screen" : area, format, fps,
                        session.maxDurationSeconds(), frameDir);
            } finally {
                ThreadContext.remove(MDC_SESSION_ID);
            }
            publisher.publishEvent(new RecordingStartedEvent(session.id(), strategy.method(), clock.instant()));
            return true;
        }
    }

    @Override
    public boolean pauseRecording() {
        synchronized (lock) {
            ActiveSession s = active;
            if (s == null) {
                LOG.debug("pauseRecording ignored: not recording");
                return false;
            }
            if (!stateRepository.togglePause()) {
                return false;
            }
            long now = ticker.getAsLong();
            if (s.paused) {
                s.pausedNanos += now - s.pauseStartedNanos;
                s.paused = false;
                LOG.info("Recording resumed");
            } else {
                s.pauseStartedNanos = now;
                s.paused = true;
                LOG.info("Recording paused");
            }
            return true;
        }
    }

    @Override
    public boolean stopRecording() {
        ActiveSession s = detach();
        if (s == null) {
            LOG.debug("stopRecording ignored: not recording");
            return false;
        }
        ThreadContext.put(MDC_SESSION_ID, s.id);
        try {
            stopQuietly(s.strategy);
            long now = ticker.getAsLong();
            List<Path> frames;
            try {
                frames = frameDirectories.listFrames(s.frameDir());
            } catch (UncheckedIOException e) {
                frameDirectories.deleteRecursively(s.frameDir());
                fail(s.id, "frame_directory", "Could not read captured frames: " + e.getMessage(), e);
                return false;
            }
            double seconds = s.recordedSeconds(now);
            stateRepository.updateRecordingProgress(frames.size(), seconds, FrameSequence.totalBytes(frames), null);
            if (!stateRepository.stopRecording()) {
                LOG.info("Session left Recording before it could be stopped; discarding frames");
                frameDirectories.deleteRecursively(s.frameDir());
                return false;
            }
            long durationMs = Math.round(seconds * 1000.0);
            LOG.info("Recording stopped: frames={}, duration={}ms; encoding {}", frames.size(), durationMs, s.format);
            encodeExecutor.execute(() -> encode(s, frames, durationMs));
            return true;
        } finally {
            ThreadContext.remove(MDC_SESSION_ID);
        }
    }

    @Override
    public boolean cancelRecording() {
        ActiveSession s = detach();
        if (s == null) {
            LOG.debug("cancelRecording ignored: not recording");
            return false;
        }
        ThreadContext.put(MDC_SESSION_ID, s.id);
        try {
            stopQuietly(s.strategy);
            frameDirectories.deleteRecursively(s.frameDir());
            stateRepository.cancelCurrentOperation();
            LOG.info("Recording cancelled");
            return true;
        } finally {
            ThreadContext.remove(MDC_SESSION_ID);
        }
    }

    @Override
    public boolean isRecording() {
        synchronized (lock) {
            return active != null;
        }
    }

    // ---- supervision ----------------------------------------------------------------------

    private void tickSafely() {
        try {
            tick();
        } catch (RuntimeException e) {
            // An exception would cancel the periodic task for good
            LOG.warn("Recording tick failed: {}", e.toString());
        }
    }

    /**
     * One supervision step. Package-private so tests can drive time explicitly.
     */
    void tick() {
        boolean stopNow = false;
        synchronized (lock) {
            ActiveSession s = active;
            if (s == null) {
                return;
            }
            ThreadContext.put(MDC_SESSION_ID, s.id);
            try {
                long now = ticker.getAsLong();
                List<Path> frames;
                try {
                    frames = frameDirectories.listFrames(s.frameDir());
                } catch (UncheckedIOException e) {
                    abandon(s, "frame_directory", "Could not read captured frames: " + e.getMessage(), e);
                    return;
                }
                int count = frames.size();
                if (count != s.lastFrameCount) {
                    s.lastFrameCount = count;
                    s.lastFrameChangeNanos = now;
                }

                String problem = supervise(s, count, now);
                if (problem != null && !switchBackend(s, problem, now)) {
                    if (count == 0) {
                        abandon(s, "capture_exhausted", "Screen capture failed and no other capture method is "
                                + "available (" + problem + ")", null);
                        return;
                    }
                    LOG.warn("No capture backend left ({}); keeping the {} frames captured so far", problem, count);
                    stopNow = true;
                }

                double seconds = s.recordedSeconds(now);
                stateRepository.updateRecordingProgress(count, seconds, FrameSequence.totalBytes(frames),
                        s.strategy.name());
                if (seconds >= s.maxDurationSeconds) {
                    LOG.info("Maximum duration of {}s reached", s.maxDurationSeconds);
                    stopNow = true;
                }
            } finally {
                ThreadContext.remove(MDC_SESSION_ID);
            }
        }
        if (stopNow) {
            stopRecording();
        }
    }

    /** @return why the current backend should be replaced, or null if it is healthy */
    private String supervise(ActiveSession s, int count, long now) {
        if (!s.strategy.isRunning()) {
            return s.strategy.name() + " stopped unexpectedly";
        }
        if (count <= s.framesAtBackendStart) {
            long waitedMs = TimeUtils.nanosToMillis(now - s.backendStartedNanos);
            return waitedMs >= captureProperties.noFrameTimeoutMs() ? "no frames after " + waitedMs + "ms" : null;
        }
        // The native stream delivers frames in bursts, so gaps are not a stall
        if (s.strategy.method() == CaptureMethod.SCREEN_CAPTURE_KIT) {
            return null;
        }
        long idleMs = TimeUtils.nanosToMillis(now - s.lastFrameChangeNanos);
        return idleMs >= captureProperties.stallTimeoutMs() ? "no new frame for " + idleMs + "ms" : null;
    }

    // Caller holds the lock
    private boolean switchBackend(ActiveSession s, String reason, long now) {
        Optional<ScreenCaptureStrategy> next = captureChain.fallbackFrom(s.strategy, s.request, reason);
        if (next.isEmpty()) {
            return false;
        }
        ScreenCaptureStrategy strategy = next.get();
        s.strategy = strategy;
        s.backendStartedNanos = now;
        s.framesAtBackendStart = s.lastFrameCount;
        s.lastFrameChangeNanos = now;
        stateRepository.updateCaptureMethod(strategy.method(), strategy.name());
        return true;
    }

    // Caller holds the lock
    private void abandon(ActiveSession s, String reason, String message, Throwable cause) {
        active = null;
        s.tick.cancel(false);
        stopQuietly(s.strategy);
        frameDirectories.deleteRecursively(s.frameDir());
        fail(s.id, reason, message, cause);
    }

    private ActiveSession detach() {
        synchronized (lock) {
            ActiveSession s = active;
            if (s != null) {
                active = null;
                s.tick.cancel(false);
            }
            return s;
        }
    }

    // ---- encoding -------------------------------------------------------------------------

    private void encode(ActiveSession s, List<Path> frames, long durationMs) {
        ThreadContext.put(MDC_SESSION_ID, s.id);
        long startNanos = ticker.getAsLong();
        try {
            int fps = QualityMapper.effectiveFps(frames.size(), durationMs, s.request.fps());
            Path output = fileNamer.resolve(s.settings, s.format, LocalDateTime.now(clock));
            EncodeParameters params = new EncodeParameters(s.format, fps, s.settings.defaultQuality(),
                    s.settings.fastMode());
            stateRepository.updateProcessingProgress(0.0, ProcessingStage.ENCODING, null);

            EncodedMedia media = encoder.encode(frames, output, params, percent -> onEncodeProgress(percent, startNanos));

            stateRepository.setProcessingStage(ProcessingStage.UPDATING_INDEX);
            MediaItem item = mediaItemFactory.create(s.id, media, s.format, durationMs, frames.size(), fps,
                    s.strategy.method());
            if (!stateRepository.completeProcessing(item)) {
                LOG.info("Session left Processing while encoding; {} kept on disk but not catalogued",
                        item.filePath());
                return;
            }
            mediaCatalog.add(item);
            LOG.info("Recording saved: {} ({} bytes, {} in {}ms)", item.filePath(), item.sizeBytes(),
                    media.dimensions(), media.encodeMs());
            publisher.publishEvent(new RecordingCompletedEvent(s.id, item, media.encodeMs(), clock.instant()));
        } catch (EncodingException e) {
            String tag = e.getError().tag();
            fail(s.id, tag, "Encoding failed [" + tag + "]: " + e.getMessage(), e);
        } catch (EncoderNotFoundException e) {
            fail(s.id, "encoder_not_found", e.getMessage(), e);
        } catch (RuntimeException e) {
            fail(s.id, "unexpected", "Encoding failed: " + e, e);
        } finally {
            frameDirectories.deleteRecursively(s.frameDir());
            ThreadContext.remove(MDC_SESSION_ID);
        }
    }

    private void onEncodeProgress(int percent, long startNanos) {
        Duration eta = null;
        if (percent > 0 && percent < 100) {
            long elapsedMs = TimeUtils.nanosToMillis(ticker.getAsLong() - startNanos);
            eta = Duration.ofMillis(elapsedMs * (100 - percent) / percent);
        }
        ProcessingStage stage = percent >= 100 ? ProcessingStage.SAVING : ProcessingStage.ENCODING;
        stateRepository.updateProcessingProgress(percent / 100.0, stage, eta);
    }

    private void fail(String sessionId, String reason, String message, Throwable cause) {
        LOG.warn("Recording failed ({}): {}", reason, message);
        stateRepository.handleError(message, cause, true);
        publisher.publishEvent(new RecordingFailedEvent(sessionId, reason, message, clock.instant()));
    }

    private static void stopQuietly(ScreenCaptureStrategy strategy) {
        try {
            strategy.stop();
        } catch (RuntimeException e) {
            LOG.warn("Stopping capture backend {} failed: {}", strategy.name(), e.toString());
        }
    }

    /**
     * Mutable bookkeeping for the running session. Guarded by the orchestrator lock while
     * attached; owned by a single thread after {@link #detach()}.
     */
    private static final class ActiveSession {
        final String id;
        final CaptureRequest request;
        final RecordingSettings settings;
        final OutputFormat format;
        final int maxDurationSeconds;
        final long startedNanos;

        ScreenCaptureStrategy strategy;
        ScheduledFuture<?> tick;
        long backendStartedNanos;
        int framesAtBackendStart;
        int lastFrameCount;
        long lastFrameChangeNanos;
        boolean paused;
        long pausedNanos;
        long pauseStartedNanos;

        ActiveSession(RecordingSession session, CaptureRequest request, RecordingSettings settings,
                      ScreenCaptureStrategy strategy, long nowNanos) {
            this.id = session.id();
            this.request = request;
            this.settings = settings;
            this.format = session.outputFormat();
            this.maxDurationSeconds = session.maxDurationSeconds();
            this.strategy = strategy;
            this.startedNanos = nowNanos;
            this.backendStartedNanos = nowNanos;
            this.lastFrameChangeNanos = nowNanos;
        }

        Path frameDir() {
            return request.outputDir();
        }

        double recordedSeconds(long nowNanos) {
            long excluded = pausedNanos + (paused ? nowNanos - pauseStartedNanos : 0L);
            return Math.max(0L, nowNanos - startedNanos - excluded) / 1_000_000_000.0;
        }
    }
}
