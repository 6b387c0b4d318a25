/**
 * REST controllers.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code GET /status} - connectivity, pending event count, last sync error and today's counters</li>
 *   <li>{@code GET /events/failed} - rejected events and events whose retry round is used up</li>
 * </ul>
 *
 * @see com.phillippitts.attendancekiosk.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.attendancekiosk.presentation.controller;
