package com.fintech.recurring.entity;

/**
 * Discriminator of an {@link ActorRef}.
 */
public enum ActorKind {
    /**
     * A registered user who belongs to the household.
     */
    MEMBER,

    /**
     * An external contact kept by the household (no login, cannot act).
     */
    CONTACT
}
