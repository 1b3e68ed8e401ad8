package com.phillippitts.clipcast.service.orchestration;

import com.phillippitts.clipcast.config.properties.CaptureProperties;
import com.phillippitts.clipcast.service.capture.CaptureStrategyChain;
import com.phillippitts.clipcast.service.encoding.MediaEncoder;
import com.phillippitts.clipcast.service.media.MediaCatalog;
import com.phillippitts.clipcast.service.settings.SettingsProvider;
import com.phillippitts.clipcast.service.state.StateRepository;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.LongSupplier;

/**
 * Builder for {@link DefaultRecordingOrchestrator}, which has more collaborators than a
 * constructor reads well with.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * DefaultRecordingOrchestrator orchestrator = DefaultRecordingOrchestratorBuilder.builder()
 *     .stateRepository(repository)
 *     .captureChain(chain)
 *     .encoder(encoder)
 *     .mediaCatalog(catalog)
 *     .settingsProvider(settings)
 *     .publisher(publisher)
 *     .encodeExecutor(encodeExecutor)
 *     .scheduler(scheduler)
 *     .captureProperties(captureProperties)
 *     .build();
 * }</pre>
 *
 * <p>The tick interval, clocks, file namer, frame directory manager and media item factory
 * have production defaults; tests replace the clocks to simulate elapsed time.
 */
public final class DefaultRecordingOrchestratorBuilder {

    private StateRepository stateRepository;
    private CaptureStrategyChain captureChain;
    private MediaEncoder encoder;
    private MediaCatalog mediaCatalog;
    private SettingsProvider settingsProvider;
    private ApplicationEventPublisher publisher;
    private Executor encodeExecutor;
    private ScheduledExecutorService scheduler;
    private CaptureProperties captureProperties;

    private FrameDirectoryManager frameDirectories;
    private OutputFileNamer fileNamer;
    private MediaItemFactory mediaItemFactory;
    private long tickIntervalMs = 1000L;
    private LongSupplier ticker = System::nanoTime;
    private Clock clock = Clock.systemDefaultZone();

    private DefaultRecordingOrchestratorBuilder() {
    }

    public static DefaultRecordingOrchestratorBuilder builder() {
        return new DefaultRecordingOrchestratorBuilder();
    }

    public DefaultRecordingOrchestratorBuilder stateRepository(StateRepository stateRepository) {
        this.stateRepository = stateRepository;
        return this;
    }

    public DefaultRecordingOrchestratorBuilder captureChain(CaptureStrategyChain captureChain) {
        this.captureChain = captureChain;
        return this;
    }

    public DefaultRecordingOrchestratorBuilder encoder(MediaEncoder encoder) {
        this.encoder = encoder;
        return this;
    }

    public DefaultRecordingOrchestratorBuilder mediaCatalog(MediaCatalog mediaCatalog) {
        this.mediaCatalog = mediaCatalog;
        return this;
    }

    public DefaultRecordingOrchestratorBuilder settingsProvider(SettingsProvider settingsProvider) {
        this.settingsProvider = settingsProvider;
        return this;
    }

    public DefaultRecordingOrchestratorBuilder publisher(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
        return this;
    }

    public DefaultRecordingOrchestratorBuilder encodeExecutor(Executor encodeExecutor) {
        this.encodeExecutor = encodeExecutor;
        return this;
    }

    public DefaultRecordingOrchestratorBuilder scheduler(ScheduledExecutorService scheduler) {
        this.scheduler = scheduler;
        return this;
    }

    public DefaultRecordingOrchestratorBuilder captureProperties(CaptureProperties captureProperties) {
        this.captureProperties = captureProperties;
        return this;
    }

    public DefaultRecordingOrchestratorBuilder frameDirectories(FrameDirectoryManager frameDirectories) {
        this.frameDirectories = frameDirectories;
        return this;
    }

    public DefaultRecordingOrchestratorBuilder fileNamer(OutputFileNamer fileNamer) {
        this.fileNamer = fileNamer;
        return this;
    }

    public DefaultRecordingOrchestratorBuilder mediaItemFactory(MediaItemFactory mediaItemFactory) {
        this.mediaItemFactory = mediaItemFactory;
        return this;
    }

    public DefaultRecordingOrchestratorBuilder tickIntervalMs(long tickIntervalMs) {
        if (tickIntervalMs <= 0) {
            throw new IllegalArgumentException("tickIntervalMs must be > 0");
        }
        this.tickIntervalMs = tickIntervalMs;
        return this;
    }

    /** Monotonic nanosecond source for duration accounting and backend supervision. */
    public DefaultRecordingOrchestratorBuilder ticker(LongSupplier ticker) {
        this.ticker = Objects.requireNonNull(ticker, "ticker");
        return this;
    }

    /** Wall clock for file names, ids and event timestamps. */
    public DefaultRecordingOrchestratorBuilder clock(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        return this;
    }

    /**
     * @throws NullPointerException if a required collaborator is missing
     */
    public DefaultRecordingOrchestrator build() {
        Objects.requireNonNull(stateRepository, "stateRepository is required");
        Objects.requireNonNull(captureChain, "captureChain is required");
        Objects.requireNonNull(encoder, "encoder is required");
        Objects.requireNonNull(mediaCatalog, "mediaCatalog is required");
        Objects.requireNonNull(settingsProvider, "settingsProvider is required");
        Objects.requireNonNull(publisher, "publisher is required");
        Objects.requireNonNull(encodeExecutor, "encodeExecutor is required");
        Objects.requireNonNull(scheduler, "scheduler is required");
        Objects.requireNonNull(captureProperties, "captureProperties is required");
        if (frameDirectories == null) {
            frameDirectories = new FrameDirectoryManager();
        }
        if (fileNamer == null) {
            fileNamer = new OutputFileNamer();
        }
        if (mediaItemFactory == null) {
            mediaItemFactory = new MediaItemFactory(clock);
        }
        return new DefaultRecordingOrchestrator(this);
    }

    StateRepository stateRepository() {
        return stateRepository;
    }

    CaptureStrategyChain captureChain() {
        return captureChain;
    }

    MediaEncoder encoder() {
        return encoder;
    }

    MediaCatalog mediaCatalog() {
        return mediaCatalog;
    }

    SettingsProvider settingsProvider() {
        return settingsProvider;
    }

    ApplicationEventPublisher publisher() {
        return publisher;
    }

    Executor encodeExecutor() {
        return encodeExecutor;
    }

    ScheduledExecutorService scheduler() {
        return scheduler;
    }

    CaptureProperties captureProperties() {
        return captureProperties;
    }

    FrameDirectoryManager frameDirectories() {
        return frameDirectories;
    }

    OutputFileNamer fileNamer() {
        return fileNamer;
    }

    MediaItemFactory mediaItemFactory() {
        return mediaItemFactory;
    }

    long tickIntervalMs() {
        return tickIntervalMs;
    }

    LongSupplier ticker() {
        return ticker;
    }

    Clock clock() {
        return clock;
    }
}
