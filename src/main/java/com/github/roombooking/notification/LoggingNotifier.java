package com.github.roombooking.notification;

import com.github.roombooking.Reservation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Notifier} that writes one INFO line per event.
 */
public final class LoggingNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotifier.class);

    @Override
    public boolean notifyConfirmed(Reservation reservation) {
        log.info("Reservation confirmed: {} for {} in {} ({} - {})",
            reservation.getId(),
            reservation.getUserName(),
            reservation.getRoom().name(),
            reservation.getStartTime(),
            reservation.getEndTime());
        return true;
    }

    @Override
    public boolean notifyCancelled(Reservation reservation) {
        log.info("Reservation cancelled: {} for {} in {}",
            reservation.getId(),
            reservation.getUserName(),
            reservation.getRoom().name());
        return true;
    }
}
