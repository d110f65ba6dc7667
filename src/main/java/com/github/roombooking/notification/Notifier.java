package com.github.roombooking.notification;

import com.github.roombooking.Reservation;

/**
 * Receives reservation state changes after they have been persisted.
 *
 * <p>A {@code false} return reports that delivery failed. Callers treat that as
 * non-fatal; the reservation stays committed.</p>
 */
public interface Notifier {

    /**
     * Called after a new reservation has been stored.
     *
     * @param reservation the confirmed reservation
     * @return true if the notification was delivered
     */
    boolean notifyConfirmed(Reservation reservation);

    /**
     * Called after a cancellation has been stored.
     *
     * @param reservation the cancelled reservation
     * @return true if the notification was delivered
     */
    boolean notifyCancelled(Reservation reservation);
}
