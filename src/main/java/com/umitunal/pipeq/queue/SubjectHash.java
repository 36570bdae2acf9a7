package com.umitunal.pipeq.queue;

/**
 * Stable short hash of a subject URL, the join key between leases, dead letters and
 * seen records.
 *
 * 32-bit polynomial hash (multiplier 31) over UTF-16 code units, absolute value, base 36.
 * Changing it orphans every lease, DLQ entry and seen record already in the store.
 */
public final class SubjectHash {

    private SubjectHash() {
    }

    public static String of(String url) {
        int hash = 0;
        for (int i = 0; i < url.length(); i++) {
            hash = 31 * hash + url.charAt(i);
        }
        return Long.toString(Math.abs((long) hash), 36);
    }
}
