package de.bsommerfeld.reviewinsights.analytics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Top-K-per-partition ranking in the application. Works the same on every
 * store, with or without window functions.
 *
 * <ol>
 * <li>Partition the rows by the partition key.</li>
 * <li>Sort each partition by the ranking key in the requested direction.
 * The sort is stable: rows with equal ranking keys keep their input order.
 * That is the tie rule; there is no hidden secondary key.</li>
 * <li>Number each partition's rows 1..n and keep ranks 1..K.</li>
 * <li>Concatenate partitions in ascending partition-key order.</li>
 * </ol>
 *
 * A row whose partition key or ranking key is {@code null} cannot be placed
 * and is left out of the output; it never fails the ranking.
 */
public final class Ranker {

    private static final Logger LOG = LoggerFactory.getLogger(Ranker.class);

    /** Sort direction of the ranking key. */
    public enum Direction {
        ASCENDING,
        DESCENDING
    }

    /**
     * One retained row.
     *
     * @param partition the row's partition key
     * @param rank      1-based position within the partition
     * @param row       the input row itself
     */
    public record Ranked<K, R>(K partition, int rank, R row) {
    }

    private Ranker() {
    }

    /**
     * Ranks {@code rows} within their partitions and keeps the first {@code k}
     * of each.
     *
     * @param rows         candidate rows; their order decides ties
     * @param partitionKey extracts the partition key, {@code null} excludes the row
     * @param rankKey      extracts the ranking key, {@code null} excludes the row
     * @param direction    sort direction of the ranking key
     * @param k            ranks to keep per partition, at least 1
     * @return retained rows ordered by partition key, then rank
     */
    public static <R, K extends Comparable<? super K>, V extends Comparable<? super V>> List<Ranked<K, R>> topPerPartition(
            List<R> rows,
            Function<? super R, ? extends K> partitionKey,
            Function<? super R, ? extends V> rankKey,
            Direction direction,
            int k) {
        if (k < 1) {
            throw new IllegalArgumentException("k must be at least 1, was " + k);
        }

        Map<K, List<Keyed<V, R>>> partitions = new TreeMap<>();
        int excluded = 0;
        for (R row : rows) {
            K partition = partitionKey.apply(row);
            V key = rankKey.apply(row);
            if (partition == null || key == null) {
                excluded++;
                continue;
            }
            partitions.computeIfAbsent(partition, p -> new ArrayList<>()).add(new Keyed<>(key, row));
        }
        if (excluded > 0) {
            LOG.debug("Excluded {} of {} rows without partition or ranking key", excluded, rows.size());
        }

        Comparator<Keyed<V, R>> order = Comparator.comparing((Keyed<V, R> keyed) -> keyed.key());
        if (direction == Direction.DESCENDING) {
            order = order.reversed();
        }

        List<Ranked<K, R>> result = new ArrayList<>();
        for (Map.Entry<K, List<Keyed<V, R>>> partition : partitions.entrySet()) {
            List<Keyed<V, R>> members = partition.getValue();
            // List.sort is a stable merge sort
            members.sort(order);
            int limit = Math.min(k, members.size());
            for (int i = 0; i < limit; i++) {
                result.add(new Ranked<>(partition.getKey(), i + 1, members.get(i).row()));
            }
        }
        return result;
    }

    private record Keyed<V, R>(V key, R row) {
    }
}
