package com.proxyhub.provider.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Upstream subscription owned by a user. Read-only from this service's point of view.
 */
@Data
@NoArgsConstructor
@Table("external_subscriptions")
public class ExternalSubscription {

    @Id
    private Long id;

    private String username;

    private String name;

    private String url;

    /** User-Agent sent upstream; some providers render differently per client. */
    private String userAgent;

    private Integer nodeCount;

    private LocalDateTime lastSyncAt;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
