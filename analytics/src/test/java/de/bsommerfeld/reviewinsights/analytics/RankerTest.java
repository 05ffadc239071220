package de.bsommerfeld.reviewinsights.analytics;

import de.bsommerfeld.reviewinsights.analytics.Ranker.Direction;
import de.bsommerfeld.reviewinsights.analytics.Ranker.Ranked;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class RankerTest {

    private record Item(String id, String group, Integer score) {
    }

    private static List<String> ids(List<Ranked<String, Item>> ranked) {
        return ranked.stream().map(r -> r.row().id()).collect(Collectors.toList());
    }

    @Test
    void topPerPartition_shouldOrderByPartitionThenRank() {
        List<Item> rows = List.of(
                new Item("A", "grp1", 5),
                new Item("B", "grp1", 3),
                new Item("C", "grp2", 1));

        List<Ranked<String, Item>> ranked = Ranker.topPerPartition(rows, Item::group, Item::score,
                Direction.ASCENDING, 2);

        assertEquals(List.of("B", "A", "C"), ids(ranked));
        assertEquals(List.of(1, 2, 1), ranked.stream().map(Ranked::rank).collect(Collectors.toList()));
        assertEquals("grp2", ranked.get(2).partition());
    }

    @Test
    void topPerPartition_shouldTruncateEachPartitionToK() {
        List<Item> rows = List.of(
                new Item("A", "g", 4), new Item("B", "g", 2), new Item("C", "g", 3),
                new Item("D", "h", 9));

        assertEquals(List.of("B", "C", "D"),
                ids(Ranker.topPerPartition(rows, Item::group, Item::score, Direction.ASCENDING, 2)));
    }

    @Test
    void topPerPartition_shouldSortDescending() {
        List<Item> rows = List.of(new Item("A", "g", 1), new Item("B", "g", 7), new Item("C", "g", 3));

        assertEquals(List.of("B", "C", "A"),
                ids(Ranker.topPerPartition(rows, Item::group, Item::score, Direction.DESCENDING, 10)));
    }

    @Test
    void topPerPartition_shouldKeepInputOrderForTiesAscending() {
        List<Item> rows = List.of(
                new Item("X", "g", 2), new Item("Y", "g", 1), new Item("Z", "g", 2), new Item("W", "g", 2));

        assertEquals(List.of("Y", "X", "Z"),
                ids(Ranker.topPerPartition(rows, Item::group, Item::score, Direction.ASCENDING, 3)));
    }

    @Test
    void topPerPartition_shouldKeepInputOrderForTiesDescending() {
        // reversing the comparator must not reverse equal elements
        List<Item> rows = List.of(
                new Item("X", "g", 5), new Item("Y", "g", 5), new Item("Z", "g", 9), new Item("W", "g", 5));

        assertEquals(List.of("Z", "X", "Y", "W"),
                ids(Ranker.topPerPartition(rows, Item::group, Item::score, Direction.DESCENDING, 4)));
    }

    @Test
    void topPerPartition_shouldConcatenatePartitionsInKeyOrder() {
        List<Item> rows = List.of(
                new Item("V1", "Video", 1), new Item("B1", "Book", 1), new Item("M1", "Music", 1));

        List<Ranked<String, Item>> ranked = Ranker.topPerPartition(rows, Item::group, Item::score,
                Direction.ASCENDING, 1);

        assertEquals(List.of("Book", "Music", "Video"),
                ranked.stream().map(Ranked::partition).collect(Collectors.toList()));
    }

    @Test
    void topPerPartition_shouldExcludeRowsWithNullKeys() {
        List<Item> rows = List.of(
                new Item("A", null, 1), new Item("B", "g", null), new Item("C", "g", 2));

        assertEquals(List.of("C"),
                ids(Ranker.topPerPartition(rows, Item::group, Item::score, Direction.ASCENDING, 5)));
    }

    @Test
    void topPerPartition_shouldReturnEmptyForEmptyInput() {
        assertTrue(Ranker.topPerPartition(List.<Item>of(), Item::group, Item::score, Direction.ASCENDING, 3)
                .isEmpty());
    }

    @Test
    void topPerPartition_shouldRejectNonPositiveK() {
        List<Item> rows = List.of(new Item("A", "g", 1));
        assertThrows(IllegalArgumentException.class,
                () -> Ranker.topPerPartition(rows, Item::group, Item::score, Direction.ASCENDING, 0));
    }
}
