package com.autoposter.engine.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Data
@NoArgsConstructor
@Table(name = "proxies")
public class Proxy {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private String host;
    private int port;
    private String username;
    private String password;

    @Enumerated(EnumType.STRING)
    private ProxyType type = ProxyType.RESIDENTIAL;

    @Enumerated(EnumType.STRING)
    private ProxyStatus status = ProxyStatus.ACTIVE;

    private Integer latencyMs;
    private Instant lastCheckedAt;

    public Proxy(Long id, String host, int port) {
        this.id = id;
        this.host = host;
        this.port = port;
    }

    public String address() {
        return host + ":" + port;
    }
}
