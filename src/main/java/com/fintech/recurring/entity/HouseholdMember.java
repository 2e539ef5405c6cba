package com.fintech.recurring.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Membership of a user in a household. A user belongs to at most one household.
 */
@Entity
@Table(name = "household_members", indexes = {
        @Index(name = "idx_members_household", columnList = "household_id")
}, uniqueConstraints = {
        @UniqueConstraint(name = "uk_members_user", columnNames = {"user_id"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HouseholdMember {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "household_id", nullable = false, length = 64)
    private String householdId;

    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;
}
