package com.qrwallet.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Sliding-window state for one (user, operation) pair: the timestamps of accepted requests still inside the window.
 */
@Entity
@Table(name = "rate_limits")
@Getter
@Setter
@NoArgsConstructor
public class RateLimitWindow {

    /**
     * {@code <userId>_<operation>}
     */
    @Id
    private String id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(nullable = false, length = 64)
    private String operation;

    @Convert(converter = EpochMillisListConverter.class)
    @Column(nullable = false, length = 4000)
    private List<Long> requests = new ArrayList<>();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
