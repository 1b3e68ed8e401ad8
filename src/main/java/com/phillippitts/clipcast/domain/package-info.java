/**
 * Domain models for the recording pipeline.
 *
 * <p>All types here are immutable values. The application state is modelled as the sealed
 * {@link com.phillippitts.clipcast.domain.AppState} hierarchy; exactly one variant is live at
 * any time and it is only ever replaced, never mutated, by
 * {@link com.phillippitts.clipcast.service.state.StateRepository}.
 *
 * <p>Key domain concepts:
 * <ul>
 *   <li>{@link com.phillippitts.clipcast.domain.RecordingSession} - one capture attempt with its
 *       accumulated frame/duration telemetry</li>
 *   <li>{@link com.phillippitts.clipcast.domain.CaptureRegion} - absolute screen rectangle</li>
 *   <li>{@link com.phillippitts.clipcast.domain.MediaItem} - finished artifact handed to the catalog</li>
 *   <li>{@link com.phillippitts.clipcast.domain.RecordingSettings} - settings the pipeline reads</li>
 * </ul>
 */
package com.phillippitts.clipcast.domain;
