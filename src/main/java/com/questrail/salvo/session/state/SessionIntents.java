package com.questrail.salvo.session.state;

import com.questrail.salvo.protocol.model.ErrorMessage;
import com.questrail.salvo.protocol.model.SalvoMessage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * SessionIntents
 * -----------------------------------------------------------------------------
 * Immutable, ordered list of outbound deliveries emitted by the
 * {@link SessionStateReducer}, plus the rejection reason if the input was refused.
 *
 * <h2>Role in the architecture</h2>
 * {@code SessionIntents} is the bridge between:
 * <ul>
 *   <li>pure, deterministic turn arbitration</li>
 *   <li>side-effecting sends on the players' connections</li>
 * </ul>
 *
 * The reducer decides <b>what is sent to whom</b>; the owning
 * {@code GameSession} performs the sends, in list order, while it still holds
 * the session lock.
 */
public final class SessionIntents
{
    /**
     * One message addressed to one slot.
     */
    public record Delivery(Slot target, SalvoMessage message) {
        public Delivery {
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(message, "message");
        }
    }

    private static final SessionIntents NONE = new SessionIntents(List.of(), null);

    private final List<Delivery> deliveries;
    private final SessionRejection rejection;

    private SessionIntents(List<Delivery> deliveries, SessionRejection rejection) {
        this.deliveries = Collections.unmodifiableList(new ArrayList<>(deliveries));
        this.rejection = rejection;
    }

    public List<Delivery> deliveries() {
        return deliveries;
    }

    public Optional<SessionRejection> rejection() {
        return Optional.ofNullable(rejection);
    }

    public boolean isEmpty() {
        return deliveries.isEmpty() && rejection == null;
    }

    /**
     * Messages addressed to {@code slot}, in delivery order.
     */
    public List<SalvoMessage> messagesFor(Slot slot) {
        List<SalvoMessage> out = new ArrayList<>();
        for (Delivery d : deliveries) {
            if (d.target() == slot) {
                out.add(d.message());
            }
        }
        return out;
    }

    // ---------------------------------------------------------------------
    // Factories
    // ---------------------------------------------------------------------

    public static SessionIntents none() {
        return NONE;
    }

    /**
     * A refusal: no state change; the sender is told why if the rejection has
     * a client message.
     */
    public static SessionIntents rejected(Slot sender, SessionRejection rejection) {
        Objects.requireNonNull(sender, "sender");
        Objects.requireNonNull(rejection, "rejection");
        Builder b = builder();
        if (rejection.clientMessage() != null) {
            b.sendTo(sender, new ErrorMessage(rejection.clientMessage()));
        }
        b.rejection = rejection;
        return b.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<Delivery> deliveries = new ArrayList<>();
        private SessionRejection rejection;

        public Builder sendTo(Slot target, SalvoMessage message) {
            deliveries.add(new Delivery(target, message));
            return this;
        }

        /**
         * Slot one first, then slot two.
         */
        public Builder broadcast(SalvoMessage message) {
            sendTo(Slot.ONE, message);
            sendTo(Slot.TWO, message);
            return this;
        }

        public SessionIntents build() {
            return new SessionIntents(deliveries, rejection);
        }
    }

    @Override
    public String toString() {
        return "SessionIntents{deliveries=" + deliveries + ", rejection=" + rejection + "}";
    }
}
