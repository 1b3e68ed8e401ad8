/**
 * Exception hierarchy of the recording core.
 *
 * <p>All exceptions extend {@link com.phillippitts.clipcast.exception.ClipCastException}
 * (unchecked). Capture and encode failures carry a machine-readable kind so the orchestrator
 * can turn them into a user-facing, recoverable error state and metrics can tag the reason.
 *
 * <ul>
 *   <li>{@link com.phillippitts.clipcast.exception.CaptureException} - backend unavailable or failed to start</li>
 *   <li>{@link com.phillippitts.clipcast.exception.EncodingException} - transcoder failures, see
 *       {@link com.phillippitts.clipcast.exception.EncodeError}</li>
 *   <li>{@link com.phillippitts.clipcast.exception.EncoderNotFoundException} - no ffmpeg binary located</li>
 * </ul>
 */
package com.phillippitts.clipcast.exception;
