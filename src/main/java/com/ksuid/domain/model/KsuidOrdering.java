package com.ksuid.domain.model;

import java.util.Arrays;
import java.util.List;
import java.util.ListIterator;

/**
 * Ordering helpers that work directly on the binary form of {@link Ksuid}s.
 */
public final class KsuidOrdering {

    private KsuidOrdering() {
    }

    public static int compare(Ksuid a, Ksuid b) {
        return Ksuid.compare(a, b);
    }

    /**
     * Sorts in place in O(n log n). Input that is already in order, the usual case for ids
     * generated over time, finishes in a single linear pass.
     */
    public static void sort(Ksuid[] ids) {
        Arrays.sort(ids, KsuidOrdering::compare);
    }

    public static void sort(List<Ksuid> ids) {
        Ksuid[] sorted = ids.toArray(new Ksuid[0]);
        sort(sorted);
        ListIterator<Ksuid> it = ids.listIterator();
        for (Ksuid id : sorted) {
            it.next();
            it.set(id);
        }
    }

    public static boolean isSorted(Ksuid[] ids) {
        return isSorted(Arrays.asList(ids));
    }

    public static boolean isSorted(List<Ksuid> ids) {
        Ksuid previous = null;
        for (Ksuid id : ids) {
            if (previous != null && compare(previous, id) > 0) {
                return false;
            }
            previous = id;
        }
        return true;
    }
}
