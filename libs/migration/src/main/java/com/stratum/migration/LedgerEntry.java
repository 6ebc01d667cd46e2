package com.stratum.migration;

import java.time.Instant;

/**
 * One applied migration, as recorded in the ledger table.
 *
 * @param id surrogate key assigned by the datastore
 * @param version migration version, unique across the ledger
 * @param name script file name the migration was applied from
 * @param checksum lowercase SHA-256 hex digest of the script bytes at apply time
 * @param appliedAt commit time of the migration
 * @param executionTimeMs time spent executing the script
 */
public record LedgerEntry(
        long id,
        long version,
        String name,
        String checksum,
        Instant appliedAt,
        long executionTimeMs) {}
