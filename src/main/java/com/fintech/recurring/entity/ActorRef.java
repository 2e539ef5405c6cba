package com.fintech.recurring.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Either a household member or an external contact, never both.
 * <p>
 * Used for the payer, the counterparty and each split participant. Owning entities
 * override the column names so each role maps to its own {@code *_kind}/{@code *_id} pair;
 * an absent actor is stored as two nulls.
 */
@Embeddable
@Getter
@EqualsAndHashCode
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ActorRef {

    @Enumerated(EnumType.STRING)
    @Column(name = "actor_kind", length = 10)
    private ActorKind kind;

    @Column(name = "actor_id", length = 64)
    private String id;

    public static ActorRef member(String userId) {
        return new ActorRef(ActorKind.MEMBER, userId);
    }

    public static ActorRef contact(String contactId) {
        return new ActorRef(ActorKind.CONTACT, contactId);
    }

    public boolean isMember() {
        return kind == ActorKind.MEMBER;
    }

    public boolean isContact() {
        return kind == ActorKind.CONTACT;
    }

    /**
     * The user id when this actor is a member, otherwise null.
     */
    public String userId() {
        return isMember() ? id : null;
    }

    /**
     * The contact id when this actor is a contact, otherwise null.
     */
    public String contactId() {
        return isContact() ? id : null;
    }
}
