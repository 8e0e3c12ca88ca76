package com.immowatch.backend.dedup.model;

import java.util.Comparator;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Unordered pair of listing ids, kept with {@code first < second} so that (a, b) and (b, a) are equal.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CandidatePair implements Comparable<CandidatePair> {

    private static final Comparator<CandidatePair> ORDER = Comparator
            .comparing(CandidatePair::getFirst)
            .thenComparing(CandidatePair::getSecond);

    String first;
    String second;

    public static CandidatePair of(String a, String b) {
        if (a == null || b == null) {
            throw new IllegalArgumentException("Pair ids must not be null");
        }
        if (a.equals(b)) {
            throw new IllegalArgumentException("A listing cannot be paired with itself: " + a);
        }
        return a.compareTo(b) < 0 ? new CandidatePair(a, b) : new CandidatePair(b, a);
    }

    public boolean contains(String id) {
        return first.equals(id) || second.equals(id);
    }

    @Override
    public int compareTo(CandidatePair other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return first + "~" + second;
    }
}
