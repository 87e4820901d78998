package com.vtb.redteam.detection;

import com.vtb.redteam.models.Severity;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class DetectionResult {
    double score;
    Severity severity;
    boolean succeeded;
    /** Чуть ниже порога успеха: логируется, но уязвимостью не считается */
    boolean nearMiss;
    @Builder.Default
    List<String> indicators = List.of();
}
