package com.proxyhub.provider.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Administrator-defined proxy-provider configuration, bound to one external subscription.
 *
 * Column mapping (R2DBC snake_case convention):
 *   externalSubscriptionId → external_subscription_id
 *   excludeFilter          → exclude_filter
 *   excludeType            → exclude_type
 *   geoIpFilter            → geo_ip_filter
 *   processMode            → process_mode
 *
 * filter / excludeFilter / excludeType / geoIpFilter / override are carried through
 * to the refresher untouched.
 */
@Data
@NoArgsConstructor
@Table("proxy_provider_configs")
public class ProviderConfig {

    /** Node list is rendered by this service and cached server-side. */
    public static final String MODE_SERVER = "mmw";

    /** Client fetches the upstream itself; nothing is cached here. */
    public static final String MODE_CLIENT = "client";

    @Id
    private Long id;

    private String username;

    private Long externalSubscriptionId;

    private String name;

    /** http / file */
    private String type;

    /** Refresh cadence in seconds; null or non-positive means the default hour. */
    private Integer interval;

    private String filter;

    private String excludeFilter;

    private String excludeType;

    private String geoIpFilter;

    /** JSON-serialised field overrides */
    private String override;

    private String processMode;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public boolean isServerProcessed() {
        return MODE_SERVER.equals(processMode);
    }

    public int intervalSeconds() {
        return interval == null ? 0 : interval;
    }
}
