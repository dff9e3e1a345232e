package io.b2mash.hms.hmsadmin.usage;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Usage ledger settings.
 *
 * @param defaultLimit limit applied to a metric the tenant's plan does not list
 */
@ConfigurationProperties("hms.usage")
public record UsageProperties(@DefaultValue("1000") long defaultLimit) {}
