package com.phillippitts.clipcast.service.capture;

import com.phillippitts.clipcast.domain.CaptureMethod;
import com.phillippitts.clipcast.exception.CaptureException;
import com.phillippitts.clipcast.service.capture.event.CaptureFallbackEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Starts the first capture backend that works, in {@link CaptureStrategySelector} order, and
 * moves a running session to the next backend when the current one fails.
 */
public class CaptureStrategyChain {

    private static final Logger LOG = LogManager.getLogger(CaptureStrategyChain.class);

    private final Map<CaptureMethod, ScreenCaptureStrategy> strategies;
    private final Platform platform;
    private final CaptureMethod preferred;
    private final ApplicationEventPublisher publisher;

    public CaptureStrategyChain(List<ScreenCaptureStrategy> strategies, Platform platform,
                                CaptureMethod preferred, ApplicationEventPublisher publisher) {
        Objects.requireNonNull(strategies, "strategies");
        this.platform = Objects.requireNonNull(platform, "platform");
        this.preferred = preferred == null ? CaptureMethod.AUTO : preferred;
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        Map<CaptureMethod, ScreenCaptureStrategy> byMethod = new EnumMap<>(CaptureMethod.class);
        for (ScreenCaptureStrategy s : strategies) {
            byMethod.putIfAbsent(s.method(), s);
        }
        this.strategies = byMethod;
    }

    /** Backends in the order they would be tried right now. */
    public List<ScreenCaptureStrategy> candidates() {
        Set<CaptureMethod> available = EnumSet.noneOf(CaptureMethod.class);
        for (ScreenCaptureStrategy s : strategies.values()) {
            try {
                if (s.isAvailable()) {
                    available.add(s.method());
                }
            } catch (RuntimeException | LinkageError e) {
                LOG.debug("Availability check of {} failed: {}", s.name(), e.toString());
            }
        }
        List<ScreenCaptureStrategy> ordered = new ArrayList<>();
        for (CaptureMethod m : CaptureStrategySelector.order(platform, available, preferred)) {
            ordered.add(strategies.get(m));
        }
        return ordered;
    }

    /**
     * Starts the first candidate that accepts the request.
     *
     * @throws CaptureException of kind UNAVAILABLE when every candidate failed
     */
    public ScreenCaptureStrategy start(CaptureRequest request) {
        return startFrom(candidates(), request, null)
                .orElseThrow(() -> CaptureException.unavailable("chain", "No capture backend could start"));
    }

    /**
     * Stops {@code current} and starts the next backend after it, continuing the frame
     * sequence where {@code current} stopped.
     *
     * @return the started backend, or empty when none is left
     */
    public Optional<ScreenCaptureStrategy> fallbackFrom(ScreenCaptureStrategy current, CaptureRequest request,
                                                        String reason) {
        Objects.requireNonNull(current, "current");
        stopQuietly(current);

        List<ScreenCaptureStrategy> all = candidates();
        int pos = all.indexOf(current);
        List<ScreenCaptureStrategy> rest = pos < 0 ? all : all.subList(pos + 1, all.size());
        rest = new ArrayList<>(rest);
        rest.remove(current);

        LOG.warn("Capture backend {} failed ({}); trying {}", current.name(), reason,
                rest.isEmpty() ? "nothing" : rest.get(0).name());
        publisher.publishEvent(new CaptureFallbackEvent(current.method(),
                rest.isEmpty() ? null : rest.get(0).method(), reason, Instant.now()));

        int next = FrameSequence.nextIndex(request.outputDir());
        return startFrom(rest, request.withStartIndex(next), current.method());
    }

    private Optional<ScreenCaptureStrategy> startFrom(List<ScreenCaptureStrategy> order, CaptureRequest request,
                                                      CaptureMethod fellBackFrom) {
        for (int i = 0; i < order.size(); i++) {
            ScreenCaptureStrategy s = order.get(i);
            try {
                s.start(request);
                LOG.info("Capture started with {} (fps={}, scale={}, startIndex={}{})", s.name(), request.fps(),
                        request.scale(), request.startIndex(),
                        fellBackFrom == null ? "" : ", fallbackFrom=" + fellBackFrom);
                return Optional.of(s);
            } catch (RuntimeException | LinkageError e) {
                stopQuietly(s);
                ScreenCaptureStrategy next = i + 1 < order.size() ? order.get(i + 1) : null;
                LOG.warn("Capture backend {} did not start: {}", s.name(), e.toString());
                publisher.publishEvent(new CaptureFallbackEvent(s.method(),
                        next == null ? null : next.method(), describe(e), Instant.now()));
            }
        }
        return Optional.empty();
    }

    private static String describe(Throwable e) {
        if (e instanceof CaptureException ce) {
            return ce.getKind() + (ce.getCode() != null ? "(" + ce.getCode() + ")" : "");
        }
        return e.getClass().getSimpleName();
    }

    private static void stopQuietly(ScreenCaptureStrategy s) {
        try {
            s.stop();
        } catch (RuntimeException e) {
            LOG.debug("Stopping {} failed: {}", s.name(), e.toString());
        }
    }
}
