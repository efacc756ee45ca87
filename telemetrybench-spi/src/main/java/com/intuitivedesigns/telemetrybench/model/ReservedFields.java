/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrybench.model;

import java.time.Instant;
import java.util.Set;

/**
 * Envelope fields present in every message, ahead of the topic's own fields.
 */
public final class ReservedFields {

    private ReservedFields() {}

    /** Send time, seconds since the epoch. Set immediately before validation/serialization. */
    public static final String SND_STAMP = "private_sndStamp";

    /** Receive time, seconds since the epoch. Set immediately after decoding. */
    public static final String RCV_STAMP = "private_rcvStamp";

    /** 1-based, per producer. */
    public static final String SEQ_NUM = "private_seqNum";

    /** Only present for indexed components. */
    public static final String INDEX = "private_index";

    public static final Set<String> ALL = Set.of(SND_STAMP, RCV_STAMP, SEQ_NUM, INDEX);

    public static boolean isReserved(String fieldName) {
        return ALL.contains(fieldName);
    }

    /**
     * Current wall-clock time in seconds with sub-millisecond resolution.
     */
    public static double now() {
        final Instant t = Instant.now();
        return t.getEpochSecond() + t.getNano() / 1_000_000_000.0;
    }
}
