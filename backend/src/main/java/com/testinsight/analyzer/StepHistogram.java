package com.testinsight.analyzer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Buckets step counts by inclusive upper bounds: bounds {@code [5, 10]} give {@code 0-5, 6-10, 10+}.
 */
public final class StepHistogram {

    public record Bucket(String bucket, long count) {}

    private StepHistogram() {
    }

    public static List<Bucket> of(Collection<Integer> values, List<Integer> upperBounds) {
        List<Integer> bounds = upperBounds.stream().sorted().distinct().toList();
        long[] counts = new long[bounds.size() + 1];
        for (int value : values) {
            int index = bounds.size();
            for (int i = 0; i < bounds.size(); i++) {
                if (value <= bounds.get(i)) {
                    index = i;
                    break;
                }
            }
            counts[index]++;
        }

        List<Bucket> buckets = new ArrayList<>(counts.length);
        int lower = 0;
        for (int i = 0; i < bounds.size(); i++) {
            buckets.add(new Bucket(lower + "-" + bounds.get(i), counts[i]));
            lower = bounds.get(i) + 1;
        }
        String last = bounds.isEmpty() ? "0+" : bounds.get(bounds.size() - 1) + "+";
        buckets.add(new Bucket(last, counts[bounds.size()]));
        return buckets;
    }
}
