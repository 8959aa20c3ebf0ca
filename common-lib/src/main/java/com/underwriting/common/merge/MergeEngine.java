package com.underwriting.common.merge;

import com.underwriting.common.model.CanonicalPropertyData;
import com.underwriting.common.model.NormalizedAddress;
import com.underwriting.common.model.RankedProviderResult;

import java.util.List;

/**
 * Strategy contract for combining provider results into one canonical record.
 *
 * <p>Implementations must be:
 * <ul>
 *   <li><b>Stateless</b>: safe to call concurrently from independent requests</li>
 *   <li><b>Pure</b>: no clock reads, no logging, no reactive types</li>
 *   <li><b>Order-independent</b>: any permutation of {@code results} yields an equal record</li>
 * </ul>
 *
 * <p>Current implementation: {@link PrecedenceMergeStrategy}.
 */
public interface MergeEngine {

    /**
     * @param address the address every result was fetched for
     * @param results successes and failures of one fan-out; at least one must be a success
     * @return the merged record, never {@code null}
     * @throws IllegalArgumentException when {@code results} holds no successful result
     */
    CanonicalPropertyData merge(NormalizedAddress address, List<RankedProviderResult> results);
}
