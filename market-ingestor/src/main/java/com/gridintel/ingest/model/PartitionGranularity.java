package com.gridintel.ingest.model;

/**
 * Time component of a partition key. The grouping key is always part of the key.
 */
public enum PartitionGranularity {
    NONE,
    YEAR,
    MONTH
}
