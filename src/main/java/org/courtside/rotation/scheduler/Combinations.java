package org.courtside.rotation.scheduler;

import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Lazily iterates all k-element index combinations of {@code 0..n-1} in lexicographic order.
 * Each call to {@link Iterator#next()} returns a fresh array.
 */
public final class Combinations implements Iterable<int[]> {

    private final int n;
    private final int k;

    public Combinations(int n, int k) {
        if (n < 0 || k < 0) {
            throw new IllegalArgumentException("n and k must be non-negative, got n=" + n + ", k=" + k);
        }
        this.n = n;
        this.k = k;
    }

    /**
     * Binomial coefficient C(n, k).
     */
    public static long count(int n, int k) {
        if (k < 0 || k > n) {
            return 0;
        }
        int r = Math.min(k, n - k);
        long result = 1;
        for (int i = 1; i <= r; i++) {
            result = result * (n - r + i) / i;
        }
        return result;
    }

    @Override
    public Iterator<int[]> iterator() {
        return new Iterator<>() {
            private int[] next = k <= n ? initial() : null;

            @Override
            public boolean hasNext() {
                return next != null;
            }

            @Override
            public int[] next() {
                if (next == null) {
                    throw new NoSuchElementException();
                }
                int[] current = next;
                next = advance(current);
                return current.clone();
            }
        };
    }

    private int[] initial() {
        int[] first = new int[k];
        for (int i = 0; i < k; i++) {
            first[i] = i;
        }
        return first;
    }

    private int[] advance(int[] current) {
        int[] c = Arrays.copyOf(current, k);
        // rightmost slot that can still move up
        int i = k - 1;
        while (i >= 0 && c[i] == n - k + i) {
            i--;
        }
        if (i < 0) {
            return null;
        }
        c[i]++;
        for (int j = i + 1; j < k; j++) {
            c[j] = c[j - 1] + 1;
        }
        return c;
    }
}
