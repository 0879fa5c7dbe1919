package com.pacer.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Point-in-time statistics of the response cache.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStatistics {

    /**
     * Number of live entries.
     */
    private int entriesCount;

    /**
     * Bytes currently occupied by all entries.
     */
    private long sizeBytes;

    /**
     * Occupied size in megabytes, rounded to 2 decimals.
     */
    private double sizeMb;

    /**
     * Occupied bytes as a percentage of capacity, rounded to 1 decimal.
     */
    private double utilizationPercentage;

    /**
     * Sum of hit counts over live entries.
     */
    private long totalHits;

    /**
     * Average hits per live entry, rounded to 1 decimal.
     */
    private double avgHitsPerEntry;
}
