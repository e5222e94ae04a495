package com.reclaimradar.claims.analysis;

import com.reclaimradar.domain.ClaimableItem;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Customer refunded but the unit never came back. Always empty: the returns report carries no refund data to
 * match against.
 */
@Component
@Order(3)
@Slf4j
public class RefundWithoutReturnPass implements ClaimDetectionPass {

    @Override
    public String name() {
        return "refund-without-return";
    }

    @Override
    public List<ClaimableItem> detect(ClaimAnalysisSnapshot snapshot, Instant now) {
        // TODO: match refunds once the Finances API refund events are ingested.
        log.debug("Refund-without-return detection has no refund source; producing no claims");
        return List.of();
    }
}
