/**
 * Presentation layer (read-only REST endpoints and exception handling).
 *
 * <p>Controllers are thin adapters over the service layer: they never change pipeline state.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - kiosk status and failed event inspection</li>
 *   <li>{@code presentation.exception} - exception to HTTP response mapping</li>
 * </ul>
 *
 * @see com.phillippitts.attendancekiosk.presentation.controller.KioskStatusController
 * @since 1.0
 */
package com.phillippitts.attendancekiosk.presentation;
