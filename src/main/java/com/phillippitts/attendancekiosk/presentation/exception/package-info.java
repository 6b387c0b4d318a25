/**
 * Global exception handling for the REST endpoints.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.phillippitts.attendancekiosk.exception.EventStoreException} → 503 Service Unavailable</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "EventStoreException",
 *   "message": "Local event store unavailable",
 *   "details": "Please retry in a few seconds",
 *   "timestamp": "2026-10-19T08:02:11.529Z"
 * }
 * </pre>
 */
package com.phillippitts.attendancekiosk.presentation.exception;
