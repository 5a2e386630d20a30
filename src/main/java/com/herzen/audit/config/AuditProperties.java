package com.herzen.audit.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Engine settings bound from {@code audit.*}.
 *
 * @param countInProgress           allow IN_PROGRESS courses to be allocated
 * @param releaseUnselectedChildren release courses held by ANY/N_OF children that did not count
 * @param maximumReleaseOrder       which consumed courses a maximum ceiling gives back first
 * @param maxRuleDepth              deepest rule nesting the parser accepts
 * @param evaluationDeadlineMs      wall-clock limit for one audit run, 0 disables it
 * @param recordHistory             log audit run outcomes to the database
 */
@ConfigurationProperties(prefix = "audit")
public record AuditProperties(
        @DefaultValue("false") boolean countInProgress,
        @DefaultValue("false") boolean releaseUnselectedChildren,
        @DefaultValue("MOST_RECENT_FIRST") ReleaseOrder maximumReleaseOrder,
        @DefaultValue("32") int maxRuleDepth,
        @DefaultValue("0") long evaluationDeadlineMs,
        @DefaultValue("true") boolean recordHistory
) {
    public enum ReleaseOrder { MOST_RECENT_FIRST, EARLIEST_FIRST }

    public static AuditProperties defaults() {
        return new AuditProperties(false, false, ReleaseOrder.MOST_RECENT_FIRST, 32, 0, true);
    }
}
