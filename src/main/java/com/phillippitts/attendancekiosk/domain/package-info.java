/**
 * Immutable domain types of the attendance pipeline: per-frame detections, track status,
 * attendance windows, decisions and the durable {@link com.phillippitts.attendancekiosk.domain.AttendanceEvent}.
 */
package com.phillippitts.attendancekiosk.domain;
