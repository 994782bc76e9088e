package com.riskmodels.service;

import com.riskmodels.dto.TriggerDecision;
import com.riskmodels.dto.TriggerInputs;
import com.riskmodels.dto.TriggerReason;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.Period;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Decides whether a model should be retrained. Has no side effects; the same inputs always
 * give the same decision.
 */
@Slf4j
@Component
public class TriggerEvaluator {

    public static final long DEFAULT_VOLUME_THRESHOLD = 1000;
    public static final String DEFAULT_SCHEDULE_INTERVAL = "P1M";
    public static final String DEFAULT_SCHEDULE_GRACE = "PT24H";

    @Value("${lifecycle.trigger.volume-threshold:" + DEFAULT_VOLUME_THRESHOLD + "}")
    private long volumeThreshold = DEFAULT_VOLUME_THRESHOLD;

    @Value("${lifecycle.trigger.schedule-interval:" + DEFAULT_SCHEDULE_INTERVAL + "}")
    private Period scheduleInterval = Period.parse(DEFAULT_SCHEDULE_INTERVAL);

    /** Slack for the time a scheduled run spends training before the version is stamped. */
    @Value("${lifecycle.trigger.schedule-grace:" + DEFAULT_SCHEDULE_GRACE + "}")
    private Duration scheduleGrace = Duration.parse(DEFAULT_SCHEDULE_GRACE);

    public TriggerDecision evaluate(TriggerInputs inputs) {
        Instant now = inputs.getNow() != null ? inputs.getNow() : Instant.now();
        Set<TriggerReason> reasons = EnumSet.noneOf(TriggerReason.class);

        if (inputs.getDrift() != null && inputs.getDrift().isDriftDetected()) {
            reasons.add(TriggerReason.DRIFT);
        }
        if (inputs.getNewRecordCount() != null && inputs.getNewRecordCount() > volumeThreshold) {
            reasons.add(TriggerReason.VOLUME);
        }
        if (scheduleElapsed(inputs.getLastTrainedAt(), now)) {
            reasons.add(TriggerReason.SCHEDULE);
        }
        if (inputs.isForce()) {
            reasons.add(TriggerReason.FORCED);
        }

        TriggerDecision decision = TriggerDecision.builder()
            .modelName(inputs.getModelName())
            .reasons(Collections.unmodifiableSet(reasons))
            .driftVerdictAvailable(inputs.getDrift() != null)
            .newRecordCount(inputs.getNewRecordCount())
            .lastTrainedAt(inputs.getLastTrainedAt())
            .evaluatedAt(now)
            .requestedBy(inputs.getRequestedBy())
            .build();

        log.debug("Trigger evaluated | model={} | reasons={} | newRecords={} | lastTrainedAt={}",
                  inputs.getModelName(), reasons, inputs.getNewRecordCount(), inputs.getLastTrainedAt());
        return decision;
    }

    /** Calendar interval in UTC, so a monthly schedule is one month whatever its length. */
    private boolean scheduleElapsed(Instant lastTrainedAt, Instant now) {
        if (lastTrainedAt == null) {
            return true;
        }
        Instant due = lastTrainedAt.atZone(ZoneOffset.UTC).plus(scheduleInterval).toInstant().minus(scheduleGrace);
        return !now.isBefore(due);
    }
}
