/**
 * Logging infrastructure: Log4j2 ThreadContext (MDC) population for REST calls.
 *
 * <p>MDC keys:
 * <ul>
 *   <li>{@code requestId} - one per HTTP request, taken from {@code X-Request-ID} or generated</li>
 *   <li>{@code sessionId} - set by the recording orchestrator while a session is capturing or
 *       encoding; carried into executor threads by the task decorator</li>
 * </ul>
 *
 * @see com.phillippitts.clipcast.config.logging.MdcFilter
 */
package com.phillippitts.clipcast.config.logging;
