package com.universalcs.routing.engine.cache;

import com.universalcs.routing.rules.RoutingRule;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * One organization's cached rule list.
 *
 * refreshedAt and ttl belong to this entry alone, so a refresh for one
 * organization never extends the lifetime of another's entry.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CachedRuleSet {
    private String organizationId;

    private List<RoutingRule> rules;

    private Instant refreshedAt;

    private Duration ttl;

    /**
     * @param now current time
     * @return true while now is before refreshedAt + ttl
     */
    public boolean isFresh(Instant now) {
        if (refreshedAt == null || ttl == null) {
            return false;
        }
        return now.isBefore(refreshedAt.plus(ttl));
    }
}
