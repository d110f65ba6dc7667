package com.github.roombooking.notification;

import com.github.roombooking.Reservation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Fans each event out to several notifiers.
 *
 * <p>Every delegate is called even if an earlier one returns false or throws; the result
 * is true only if all of them succeeded. A delegate that throws is logged and counted as
 * a failed delivery.</p>
 */
public final class CompositeNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(CompositeNotifier.class);

    private final List<Notifier> delegates;

    public CompositeNotifier(List<? extends Notifier> delegates) {
        this.delegates = List.copyOf(Objects.requireNonNull(delegates, "delegates must not be null"));
    }

    public static CompositeNotifier of(Notifier... delegates) {
        return new CompositeNotifier(List.of(delegates));
    }

    @Override
    public boolean notifyConfirmed(Reservation reservation) {
        return fanOut(reservation, n -> n.notifyConfirmed(reservation));
    }

    @Override
    public boolean notifyCancelled(Reservation reservation) {
        return fanOut(reservation, n -> n.notifyCancelled(reservation));
    }

    public List<Notifier> getDelegates() {
        return delegates;
    }

    private boolean fanOut(Reservation reservation, Predicate<Notifier> call) {
        boolean delivered = true;
        for (Notifier delegate : delegates) {
            try {
                delivered &= call.test(delegate);
            } catch (RuntimeException e) {
                log.warn("Notifier {} failed for {}: {}",
                    delegate.getClass().getSimpleName(), reservation.getId(), e.getMessage());
                delivered = false;
            }
        }
        return delivered;
    }
}
