package com.phillippitts.clipcast.config;

import com.phillippitts.clipcast.config.properties.CaptureProperties;
import com.phillippitts.clipcast.config.properties.EncoderProperties;
import com.phillippitts.clipcast.service.capture.AwtDisplayEnvironment;
import com.phillippitts.clipcast.service.capture.CaptureStrategyChain;
import com.phillippitts.clipcast.service.capture.DisplayEnvironment;
import com.phillippitts.clipcast.service.capture.Platform;
import com.phillippitts.clipcast.service.capture.ScreenCaptureStrategy;
import com.phillippitts.clipcast.service.capture.ffmpeg.FfmpegCaptureStrategy;
import com.phillippitts.clipcast.service.capture.robot.RobotCaptureStrategy;
import com.phillippitts.clipcast.service.capture.sck.JnaNativeCaptureBridge;
import com.phillippitts.clipcast.service.capture.sck.NativeLibraryLoader;
import com.phillippitts.clipcast.service.capture.sck.ScreenCaptureKitStrategy;
import com.phillippitts.clipcast.service.encoding.FfmpegEncoder;
import com.phillippitts.clipcast.service.encoding.FfmpegLocator;
import com.phillippitts.clipcast.service.encoding.FfmpegProcessRunner;
import com.phillippitts.clipcast.service.encoding.MediaEncoder;
import com.phillippitts.clipcast.service.process.DefaultProcessFactory;
import com.phillippitts.clipcast.service.process.ProcessFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;

/**
 * Wires the capture backends and the ffmpeg encoder.
 *
 * <p>All three backends are always registered; which ones run on this machine is decided per
 * session by their availability checks, so a missing native library or ffmpeg binary never
 * prevents startup.
 */
@Configuration
public class CaptureConfig {

    @Bean
    public Platform platform() {
        return Platform.current();
    }

    @Bean
    public DisplayEnvironment displayEnvironment() {
        return new AwtDisplayEnvironment();
    }

    @Bean
    public ProcessFactory processFactory() {
        return new DefaultProcessFactory();
    }

    /**
     * Shared by the encoder, the ffmpeg capture backend and the health indicator so the binary
     * is searched for only once.
     */
    @Bean
    public FfmpegLocator ffmpegLocator(EncoderProperties encoderProperties) {
        return new FfmpegLocator(encoderProperties.ffmpegPath());
    }

    @Bean(destroyMethod = "close")
    public FfmpegProcessRunner ffmpegProcessRunner(ProcessFactory processFactory) {
        return new FfmpegProcessRunner(processFactory);
    }

    @Bean
    public MediaEncoder mediaEncoder(FfmpegLocator locator, FfmpegProcessRunner runner,
                                     EncoderProperties encoderProperties) {
        return new FfmpegEncoder(locator, runner, encoderProperties);
    }

    @Bean
    public ScreenCaptureKitStrategy screenCaptureKitStrategy(DisplayEnvironment display, Platform platform) {
        NativeLibraryLoader loader = new NativeLibraryLoader();
        return new ScreenCaptureKitStrategy(() -> JnaNativeCaptureBridge.load(loader), display, platform);
    }

    @Bean
    public RobotCaptureStrategy robotCaptureStrategy(DisplayEnvironment display) {
        return new RobotCaptureStrategy(display);
    }

    @Bean
    public FfmpegCaptureStrategy ffmpegCaptureStrategy(FfmpegLocator locator, DisplayEnvironment display,
                                                       Platform platform, ProcessFactory processFactory,
                                                       CaptureProperties captureProperties) {
        return new FfmpegCaptureStrategy(locator, display, platform, processFactory,
                Duration.ofMillis(captureProperties.stopGraceMs()));
    }

    @Bean
    public CaptureStrategyChain captureStrategyChain(List<ScreenCaptureStrategy> strategies, Platform platform,
                                                     CaptureProperties captureProperties,
                                                     ApplicationEventPublisher publisher) {
        return new CaptureStrategyChain(strategies, platform, captureProperties.preferredMethod(), publisher);
    }
}
