/**
 * Screen capture backends.
 *
 * <p>Every backend implements {@link com.phillippitts.clipcast.service.capture.ScreenCaptureStrategy}
 * and writes the same numbered JPEG sequence ({@link com.phillippitts.clipcast.service.capture.FrameSequence})
 * into a per-session directory, so the encoder never needs to know which backend ran.
 *
 * <p>The set of backends is closed:
 * <ul>
 *   <li>{@code sck} - ScreenCaptureKit display stream through a JNA bridge (macOS only)</li>
 *   <li>{@code robot} - {@link java.awt.Robot} pixel grabs, the universal fallback</li>
 *   <li>{@code ffmpeg} - an ffmpeg grabber subprocess (avfoundation, gdigrab, x11grab)</li>
 * </ul>
 * {@link com.phillippitts.clipcast.service.capture.CaptureStrategySelector} orders them for a
 * platform and {@link com.phillippitts.clipcast.service.capture.CaptureStrategyChain} starts
 * the first one that works.
 */
package com.phillippitts.clipcast.service.capture;
