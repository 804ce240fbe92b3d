package com.smurthy.ai.tutor.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically drops expired cache entries that no lookup has touched.
 */
@Component
public class CacheMaintenance {

    private static final Logger log = LoggerFactory.getLogger(CacheMaintenance.class);
    private final SemanticCache cache;

    public CacheMaintenance(SemanticCache cache) {
        this.cache = cache;
    }

    @Scheduled(fixedDelayString = "${tutor.cache.purge-interval:60s}")
    public void purgeExpired() {
        try {
            int removed = cache.purgeExpired();
            if (removed > 0) {
                log.info("Purged {} expired cache entries, {} remain", removed, cache.stats().entries());
            }
        } catch (RuntimeException e) {
            log.error("Cache purge failed: {}", e.getMessage(), e);
        }
    }
}
