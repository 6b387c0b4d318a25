/**
 * Logging infrastructure and MDC (Mapped Diagnostic Context) configuration.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.attendancekiosk.config.logging.MdcFilter} - Servlet filter
 *       that puts {@code requestId}, {@code operatorId} and {@code deviceId} into MDC for every
 *       HTTP request</li>
 * </ul>
 *
 * <p>MDC Keys:
 * <ul>
 *   <li>{@code requestId} - Unique identifier for each HTTP request (UUID format)</li>
 *   <li>{@code deviceId} - Kiosk id, also set on sync passes</li>
 *   <li>{@code syncPass} - Short id of the running sync pass</li>
 * </ul>
 *
 * <p>Log Format:
 * <pre>
 * 2026-10-19 08:12:03.114 [sync-1] [requestId] [kiosk-01] LEVEL logger.name - message
 * </pre>
 *
 * @see com.phillippitts.attendancekiosk.config.logging.MdcFilter
 * @since 1.0
 */
package com.phillippitts.attendancekiosk.config.logging;
