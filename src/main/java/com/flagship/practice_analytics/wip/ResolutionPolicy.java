package com.flagship.practice_analytics.wip;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Translates a {@link Resolution} into the point budget handed to the downsampler.
 */
@Component
public class ResolutionPolicy {

    private final int lowPoints;
    private final int standardPoints;
    private final int highPoints;

    public ResolutionPolicy(@Value("${analytics.resolution.low:60}") int lowPoints,
                            @Value("${analytics.resolution.standard:120}") int standardPoints,
                            @Value("${analytics.resolution.high:365}") int highPoints) {
        this.lowPoints = lowPoints;
        this.standardPoints = standardPoints;
        this.highPoints = highPoints;
    }

    public int targetPoints(Resolution resolution) {
        return switch (resolution) {
            case LOW -> lowPoints;
            case STANDARD -> standardPoints;
            case HIGH -> highPoints;
        };
    }
}
