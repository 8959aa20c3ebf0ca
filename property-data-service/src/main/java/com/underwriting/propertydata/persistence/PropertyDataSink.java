package com.underwriting.propertydata.persistence;

import com.underwriting.common.model.CanonicalPropertyData;
import reactor.core.publisher.Mono;

/**
 * Destination for every freshly merged record. Cache hits are not re-saved.
 *
 * <p>Records are snapshots: a later aggregation for the same address supersedes an
 * earlier one and never edits it. The orchestrator treats a failed save as non-fatal.
 */
public interface PropertyDataSink {

    Mono<Void> save(CanonicalPropertyData record);
}
