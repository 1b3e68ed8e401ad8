/**
 * Global exception handling for REST responses.
 *
 * <p>Exception mapping:
 * <ul>
 *   <li>{@link com.phillippitts.clipcast.exception.CaptureException} to 503</li>
 *   <li>{@link com.phillippitts.clipcast.exception.EncoderNotFoundException} to 503</li>
 *   <li>{@link com.phillippitts.clipcast.exception.EncodingException} to 500</li>
 *   <li>{@code IllegalArgumentException} and unreadable bodies to 400</li>
 *   <li>anything else to 500</li>
 * </ul>
 */
package com.phillippitts.clipcast.presentation.exception;
