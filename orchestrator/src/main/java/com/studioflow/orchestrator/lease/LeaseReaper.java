package com.studioflow.orchestrator.lease;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Requeues leased jobs whose worker stopped before finishing them. */
@Component
public class LeaseReaper {

    private static final Logger log = LoggerFactory.getLogger(LeaseReaper.class);

    private final JobLeaseService leases;
    private final int             batchSize;

    public LeaseReaper(JobLeaseService leases,
                       @Value("${studioflow.lease.reap-batch-size:100}") int batchSize) {
        this.leases    = leases;
        this.batchSize = batchSize;
    }

    @Scheduled(fixedDelayString = "${studioflow.lease.reap-interval-ms:30000}")
    public void reap() {
        try {
            int expired = leases.expireLeases(batchSize);
            if (expired > 0) {
                log.warn("Expired {} job lease(s)", expired);
            }
        } catch (Exception e) {
            log.warn("Lease expiry sweep failed: {}", e.getMessage());
        }
    }
}
