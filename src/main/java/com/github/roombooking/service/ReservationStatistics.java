package com.github.roombooking.service;

import com.github.roombooking.Reservation;

/**
 * Counts reservations created and cancelled through a service.
 *
 * <p>Counts only what this listener has observed since it was registered. Not thread-safe.</p>
 */
public final class ReservationStatistics implements ReservationListener {

    private long totalCreated;
    private long totalCancelled;

    @Override
    public void onCreated(Reservation reservation) {
        totalCreated++;
    }

    @Override
    public void onCancelled(Reservation reservation) {
        totalCancelled++;
    }

    public long getTotalCreated() {
        return totalCreated;
    }

    public long getTotalCancelled() {
        return totalCancelled;
    }

    /**
     * Returns created minus cancelled.
     *
     * @return the number of observed reservations still active
     */
    public long getActive() {
        return totalCreated - totalCancelled;
    }

    @Override
    public String toString() {
        return "ReservationStatistics[created=" + totalCreated
            + ", cancelled=" + totalCancelled
            + ", active=" + getActive() + "]";
    }
}
