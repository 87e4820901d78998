package com.vtb.redteam.registry;

import com.vtb.redteam.detection.ResponseEvaluator;
import com.vtb.redteam.detection.SeverityThresholds;
import com.vtb.redteam.models.AttackCategory;
import com.vtb.redteam.payload.PayloadGenerator;
import lombok.Builder;
import lombok.Value;

/**
 * Все, что движок знает об одной категории атак
 */
@Value
@Builder(toBuilder = true)
public class CategoryProfile {
    AttackCategory category;
    PayloadGenerator generator;
    ResponseEvaluator evaluator;
    /** Score, начиная с которого атака считается успешной */
    double successThreshold;
    SeverityThresholds severityThresholds;
    String remediation;
}
