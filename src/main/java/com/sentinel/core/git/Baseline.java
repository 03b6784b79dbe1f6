package com.sentinel.core.git;

import java.time.Instant;

/**
 * Snapshot of the working tree taken when a Sentinel run begins.
 *
 * @param ref     tree id holding every tracked and untracked, non-ignored file as it was
 *                at that moment (written through a scratch index, so the real index is untouched)
 * @param takenAt snapshot time
 */
public record Baseline(
    String ref,
    Instant takenAt
) {}
