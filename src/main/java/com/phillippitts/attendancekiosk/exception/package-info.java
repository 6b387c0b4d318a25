/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.attendancekiosk.exception.AttendanceKioskException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.attendancekiosk.exception.VisionInputException} - Malformed
 *       detection frame; the frame is skipped</li>
 *   <li>{@link com.phillippitts.attendancekiosk.exception.EventStoreException} - Local persistence
 *       failure; retried on the decision path, then surfaced to the operator</li>
 *   <li>{@link com.phillippitts.attendancekiosk.exception.NetworkTransientException} - Backend
 *       unreachable or retryable status; retried with backoff, never discarded</li>
 *   <li>{@link com.phillippitts.attendancekiosk.exception.BackendRejectionException} - 4xx from
 *       the backend; the event is failed permanently and kept for manual review</li>
 *   <li>{@link com.phillippitts.attendancekiosk.exception.InvalidConfigurationException} - Bad
 *       configuration; fails fast at startup</li>
 * </ul>
 *
 * @see com.phillippitts.attendancekiosk.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.attendancekiosk.exception;
