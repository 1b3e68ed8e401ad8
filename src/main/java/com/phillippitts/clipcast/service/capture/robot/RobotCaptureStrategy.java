package com.phillippitts.clipcast.service.capture.robot;

import com.phillippitts.clipcast.domain.CaptureMethod;
import com.phillippitts.clipcast.domain.CaptureRegion;
import com.phillippitts.clipcast.exception.CaptureException;
import com.phillippitts.clipcast.service.capture.CaptureRequest;
import com.phillippitts.clipcast.service.capture.DisplayEnvironment;
import com.phillippitts.clipcast.service.capture.DisplayInfo;
import com.phillippitts.clipcast.service.capture.FrameSequence;
import com.phillippitts.clipcast.service.capture.ScreenCaptureStrategy;
import com.phillippitts.clipcast.service.process.ProcessSupport;
import com.phillippitts.clipcast.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.awt.AWTException;
import java.awt.GraphicsEnvironment;
import java.awt.Rectangle;
import java.awt.Robot;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

/**
 * Cross-platform capture backend that grabs pixels with {@link java.awt.Robot} on a daemon
 * thread and writes each grab as a JPEG.
 *
 * <p>Grabbing is synchronous, so the achieved rate drops below the target on large regions.
 * The loop sleeps only for the remainder of each frame period.
 */
public final class RobotCaptureStrategy implements ScreenCaptureStrategy {

    private static final Logger LOG = LogManager.getLogger(RobotCaptureStrategy.class);

    /** Minimal pixel-grab surface so the loop can run against a fake screen in tests. */
    interface ScreenGrabber {
        BufferedImage grab(Rectangle area);
    }

    /** Creates a grabber; throws when the platform refuses screen access. */
    interface GrabberFactory {
        ScreenGrabber create() throws AWTException;
    }

    private static final class AwtScreenGrabber implements ScreenGrabber {
        private final Robot robot;

        AwtScreenGrabber() throws AWTException {
            this.robot = new Robot();
        }

        @Override
        public BufferedImage grab(Rectangle area) {
            return robot.createScreenCapture(area);
        }
    }

    private final DisplayEnvironment display;
    private final GrabberFactory grabberFactory;
    private final BooleanSupplier availability;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger framesWritten = new AtomicInteger();
    private volatile Thread loop;

    public RobotCaptureStrategy(DisplayEnvironment display) {
        this(display, AwtScreenGrabber::new, () -> !GraphicsEnvironment.isHeadless());
    }

    // Package-private for tests
    RobotCaptureStrategy(DisplayEnvironment display, GrabberFactory grabberFactory, BooleanSupplier availability) {
        this.display = Objects.requireNonNull(display, "display");
        this.grabberFactory = Objects.requireNonNull(grabberFactory, "grabberFactory");
        this.availability = Objects.requireNonNull(availability, "availability");
    }

    @Override
    public String name() {
        return "robot";
    }

    @Override
    public CaptureMethod method() {
        return CaptureMethod.ROBOT_API;
    }

    @Override
    public boolean isAvailable() {
        return availability.getAsBoolean();
    }

    @Override
    public synchronized void start(CaptureRequest request) {
        if (running.get()) {
            throw CaptureException.startFailed(name(), "Capture already running", null);
        }
        if (!isAvailable()) {
            throw CaptureException.unavailable(name(), "No graphics environment");
        }
        Rectangle area = resolveArea(request.region());
        ScreenGrabber grabber;
        try {
            Files.createDirectories(request.outputDir());
            grabber = grabberFactory.create();
        } catch (AWTException | SecurityException e) {
            throw CaptureException.unavailable(name(), "Screen access refused", e);
        } catch (IOException e) {
            throw CaptureException.startFailed(name(), "Cannot create " + request.outputDir(), e);
        }

        JpegFrameWriter writer = new JpegFrameWriter(request.jpegQuality(), request.scale());
        framesWritten.set(0);
        running.set(true);
        Thread t = new Thread(() -> runLoop(grabber, writer, area, request), "robot-capture");
        t.setDaemon(true);
        loop = t;
        t.start();
        LOG.info("Robot capture started: area={}x{}@{},{} fps={} jpegQuality={}",
                area.width, area.height, area.x, area.y, request.fps(), writer.compression());
    }

    private void runLoop(ScreenGrabber grabber, JpegFrameWriter writer, Rectangle area, CaptureRequest request) {
        long periodNanos = 1_000_000_000L / request.fps();
        int index = request.startIndex();
        long next = System.nanoTime();
        while (running.get()) {
            try {
                BufferedImage frame = grabber.grab(area);
                if (request.captureCursor()) {
                    CursorOverlay.draw(frame, area, display.pointerLocation().orElse(null));
                }
                writer.write(frame, FrameSequence.frame(request.outputDir(), index));
                index++;
                framesWritten.incrementAndGet();
            } catch (IOException | RuntimeException e) {
                LOG.warn("Robot capture stopped after {} frames: {}", framesWritten.get(), e.toString());
                running.set(false);
                break;
            }
            next += periodNanos;
            long sleepNanos = next - System.nanoTime();
            if (sleepNanos > 0) {
                try {
                    Thread.sleep(sleepNanos / 1_000_000L, (int) (sleepNanos % 1_000_000L));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            } else {
                // Behind schedule; restart the cadence instead of bursting
                next = System.nanoTime();
            }
        }
        running.set(false);
    }

    private Rectangle resolveArea(CaptureRegion region) {
        if (region != null) {
            return new Rectangle(region.x(), region.y(), region.width(), region.height());
        }
        List<DisplayInfo> displays = display.displays();
        DisplayInfo d = DisplayInfo.pick(displays, null, display.pointerLocation().orElse(null));
        if (d == null) {
            throw CaptureException.unavailable(name(), "No display to capture");
        }
        return d.bounds();
    }

    @Override
    public void stop() {
        Thread t;
        synchronized (this) {
            running.set(false);
            t = loop;
            loop = null;
        }
        if (t != null) {
            ProcessSupport.joinQuietly(t, ProcessTimeouts.CAPTURE_THREAD_STOP_TIMEOUT);
            if (t.isAlive()) {
                t.interrupt();
                ProcessSupport.joinQuietly(t, ProcessTimeouts.READER_CLEANUP_TIMEOUT);
            }
            LOG.info("Robot capture stopped ({} frames)", framesWritten.get());
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    int framesWritten() {
        return framesWritten.get();
    }
}
