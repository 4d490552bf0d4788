package im.arun.planindex.config;

import lombok.Data;

@Data
public class PlanIndexConfig {
    private int dpi = 150;
    private double iouThreshold = 0.5;
    private int maxPairingDistancePx = 200;
    private int relationTolerancePx = 50;
    private int bucketSizePx = 50;
    private double pairedConfidenceBoost = 0.1;
    private boolean useFallback = true;
    private String fallbackEndpoint;
    private int fallbackTimeoutSeconds = 60;
    private int fallbackMaxRetries = 3;
    private boolean writeRunLog = false;
    /** Worker threads for page extraction; 0 sizes the pool from the processor count. */
    private int extractionThreads = 0;
}
