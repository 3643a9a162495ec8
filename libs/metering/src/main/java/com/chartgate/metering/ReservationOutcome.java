package com.chartgate.metering;

/**
 * What the usage store saw while deciding a reservation.
 *
 * @param granted   whether the reservation was stored
 * @param committed the period's confirmed count
 * @param inFlight  live reservations for the period, including the new one when granted
 */
public record ReservationOutcome(boolean granted, long committed, long inFlight) {}
