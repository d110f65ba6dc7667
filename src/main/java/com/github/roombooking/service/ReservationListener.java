package com.github.roombooking.service;

import com.github.roombooking.Reservation;

/**
 * Observer of committed reservation transitions.
 *
 * <p>Called after the repository write and the notifier. Exceptions thrown by a listener
 * are logged and do not affect the operation's result.</p>
 */
public interface ReservationListener {

    default void onCreated(Reservation reservation) {
    }

    default void onCancelled(Reservation reservation) {
    }
}
