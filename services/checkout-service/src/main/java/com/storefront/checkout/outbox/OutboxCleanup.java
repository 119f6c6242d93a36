package com.storefront.checkout.outbox;

import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Purges outbox rows once they have been on the broker for the retention period,
 * counted from {@link OutboxEvent#getPublishedAt()}. Rows still waiting to be
 * published are kept however old they are.
 */
@Component
public class OutboxCleanup {

    private static final Logger log = LoggerFactory.getLogger(OutboxCleanup.class);

    private final OutboxRepository outboxRepository;
    private final MeterRegistry meterRegistry;
    private final Duration retention;
    private final Clock clock;

    @Autowired
    public OutboxCleanup(OutboxRepository outboxRepository,
                         MeterRegistry meterRegistry,
                         @Value("${outbox.cleanup.retention:7d}") Duration retention) {
        this(outboxRepository, meterRegistry, retention, Clock.systemUTC());
    }

    OutboxCleanup(OutboxRepository outboxRepository, MeterRegistry meterRegistry, Duration retention, Clock clock) {
        if (retention.isNegative() || retention.isZero()) {
            throw new IllegalArgumentException("outbox.cleanup.retention must be positive, got " + retention);
        }
        this.outboxRepository = outboxRepository;
        this.meterRegistry = meterRegistry;
        this.retention = retention;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${outbox.cleanup.interval-ms:3600000}")
    @Transactional
    public void purgePublishedEvents() {
        Instant cutoff = clock.instant().minus(retention);
        int purged = outboxRepository.deleteByPublishedTrueAndPublishedAtBefore(cutoff);
        if (purged > 0) {
            meterRegistry.counter("outbox_purged_total").increment(purged);
            log.info("Purged {} outbox events published before {}", purged, cutoff);
        } else {
            log.debug("No outbox events published before {}", cutoff);
        }
    }
}
