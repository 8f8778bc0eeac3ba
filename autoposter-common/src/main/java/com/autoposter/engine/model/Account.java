package com.autoposter.engine.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Data
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "accounts", indexes = {
    @Index(name = "idx_account_status", columnList = "status")
})
public class Account {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(unique = true)
    private String username;

    @Enumerated(EnumType.STRING)
    private AccountStatus status = AccountStatus.ACTIVE;

    // Static assignment, never re-allocated per job
    private Long proxyId;

    private Instant lastUsedAt;

    public Account(Long id, String username, AccountStatus status, Long proxyId) {
        this.id = id;
        this.username = username;
        this.status = status;
        this.proxyId = proxyId;
    }

    public boolean isActive() {
        return status == AccountStatus.ACTIVE;
    }
}
