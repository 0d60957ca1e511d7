package com.keystone.core.promotion;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Runs the promotion batch on a cron when {@code keystone.promotion.scheduled=true}.
 */
@Component
@EnableScheduling
@ConditionalOnProperty(prefix = "keystone.promotion", name = "scheduled", havingValue = "true")
public class PromotionScheduler {

    private static final Logger log = LoggerFactory.getLogger(PromotionScheduler.class);

    private final PromotionPipeline pipeline;

    public PromotionScheduler(PromotionPipeline pipeline) {
        this.pipeline = pipeline;
    }

    @Scheduled(cron = "${keystone.promotion.scan-cron:0 0 3 * * *}")
    public void run() {
        var expired = pipeline.expireStale();
        var queued = pipeline.scanAndQueue();
        log.info("Scheduled promotion run: {} queued, {} expired", queued.size(), expired.size());
    }
}
