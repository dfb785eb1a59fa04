package com.janitor.lifecycle;

import java.time.Instant;

/**
 * Outcome of evaluating one resource in one run.
 */
public interface Decision {

    DecisionType getType();

    /**
     * Decision types, in increasing precedence.
     */
    enum DecisionType {
        ALIVE,
        NOTIFY_PENDING,
        EXPIRED
    }

    static Decision alive() {
        return Alive.INSTANCE;
    }

    /**
     * Combine the decisions of two independent branches; the higher precedence wins,
     * the first on a tie.
     */
    static Decision combine(Decision first, Decision second) {
        return second.getType().compareTo(first.getType()) > 0 ? second : first;
    }

    /**
     * Not expired, nothing to do.
     */
    final class Alive implements Decision {

        static final Alive INSTANCE = new Alive();

        private Alive() {
        }

        @Override
        public DecisionType getType() {
            return DecisionType.ALIVE;
        }

        @Override
        public String toString() {
            return "Alive";
        }
    }

    /**
     * Inside the notify-ahead window.
     */
    record NotifyPending(String reason, Instant notifyAt, Instant expiresAt) implements Decision {

        @Override
        public DecisionType getType() {
            return DecisionType.NOTIFY_PENDING;
        }
    }

    /**
     * Expired and deleted.
     */
    record Expired(String reason, Instant expiresAt) implements Decision {

        @Override
        public DecisionType getType() {
            return DecisionType.EXPIRED;
        }
    }
}
