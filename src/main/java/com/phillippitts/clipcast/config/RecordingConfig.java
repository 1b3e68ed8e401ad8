package com.phillippitts.clipcast.config;

import com.phillippitts.clipcast.config.properties.CaptureProperties;
import com.phillippitts.clipcast.config.properties.DebounceProperties;
import com.phillippitts.clipcast.config.properties.RecordingProperties;
import com.phillippitts.clipcast.service.area.AreaSelector;
import com.phillippitts.clipcast.service.area.FullScreenAreaSelector;
import com.phillippitts.clipcast.service.capture.CaptureStrategyChain;
import com.phillippitts.clipcast.service.debounce.DebounceManager;
import com.phillippitts.clipcast.service.encoding.MediaEncoder;
import com.phillippitts.clipcast.service.media.InMemoryMediaCatalog;
import com.phillippitts.clipcast.service.media.MediaCatalog;
import com.phillippitts.clipcast.service.orchestration.DefaultRecordingOrchestrator;
import com.phillippitts.clipcast.service.orchestration.DefaultRecordingOrchestratorBuilder;
import com.phillippitts.clipcast.service.orchestration.RecordingCountdown;
import com.phillippitts.clipcast.service.orchestration.RecordingTriggerListener;
import com.phillippitts.clipcast.service.settings.PropertiesSettingsProvider;
import com.phillippitts.clipcast.service.settings.SettingsProvider;
import com.phillippitts.clipcast.service.state.StateBroadcaster;
import com.phillippitts.clipcast.service.state.StateRepository;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the state repository, the recording orchestrator and its collaborators explicitly.
 * Every long-lived executor created here is shut down with the context.
 */
@Configuration
public class RecordingConfig {

    private final RecordingProperties recordingProperties;
    private final CaptureProperties captureProperties;
    private final DebounceProperties debounceProperties;

    public RecordingConfig(RecordingProperties recordingProperties,
                           CaptureProperties captureProperties,
                           DebounceProperties debounceProperties) {
        this.recordingProperties = recordingProperties;
        this.captureProperties = captureProperties;
        this.debounceProperties = debounceProperties;
    }

    /** Delivers state snapshots to subscribers off the caller's thread. */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService stateBroadcastExecutor() {
        return Executors.newSingleThreadExecutor(daemonThreads("state-broadcast-"));
    }

    /** Session ticks, countdown steps and debounce timers. */
    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService recordingScheduler() {
        return Executors.newScheduledThreadPool(2, daemonThreads("recording-timer-"));
    }

    @Bean
    public StateRepository stateRepository(@Qualifier("stateBroadcastExecutor") ExecutorService executor) {
        return new StateRepository(new StateBroadcaster(executor));
    }

    @Bean(destroyMethod = "shutdown")
    public DebounceManager debounceManager(@Qualifier("recordingScheduler") ScheduledExecutorService scheduler) {
        return new DebounceManager(scheduler);
    }

    @Bean
    public SettingsProvider settingsProvider() {
        return new PropertiesSettingsProvider(recordingProperties);
    }

    @Bean
    public MediaCatalog mediaCatalog() {
        return new InMemoryMediaCatalog();
    }

    @Bean
    public AreaSelector areaSelector() {
        return new FullScreenAreaSelector();
    }

    @Bean
    public DefaultRecordingOrchestrator recordingOrchestrator(StateRepository stateRepository,
                                                              CaptureStrategyChain captureStrategyChain,
                                                              MediaEncoder mediaEncoder,
                                                              MediaCatalog mediaCatalog,
                                                              SettingsProvider settingsProvider,
                                                              ApplicationEventPublisher publisher,
                                                              @Qualifier("encodeExecutor") Executor encodeExecutor,
                                                              @Qualifier("recordingScheduler")
                                                              ScheduledExecutorService scheduler) {
        return DefaultRecordingOrchestratorBuilder.builder()
                .stateRepository(stateRepository)
                .captureChain(captureStrategyChain)
                .encoder(mediaEncoder)
                .mediaCatalog(mediaCatalog)
                .settingsProvider(settingsProvider)
                .publisher(publisher)
                .encodeExecutor(encodeExecutor)
                .scheduler(scheduler)
                .captureProperties(captureProperties)
                .tickIntervalMs(recordingProperties.getTickIntervalMs())
                .build();
    }

    @Bean
    public RecordingCountdown recordingCountdown(StateRepository stateRepository,
                                                 DefaultRecordingOrchestrator recordingOrchestrator,
                                                 @Qualifier("recordingScheduler") ScheduledExecutorService scheduler) {
        return new RecordingCountdown(stateRepository, recordingOrchestrator, scheduler);
    }

    @Bean
    public RecordingTriggerListener recordingTriggerListener(DefaultRecordingOrchestrator recordingOrchestrator,
                                                             RecordingCountdown recordingCountdown,
                                                             StateRepository stateRepository,
                                                             DebounceManager debounceManager,
                                                             AreaSelector areaSelector) {
        return new RecordingTriggerListener(recordingOrchestrator, recordingCountdown, stateRepository,
                debounceManager, debounceProperties, areaSelector);
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
