package com.ivamare.eventsourcing.query;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class PaginatedResultTest {

    private final List<Integer> items = IntStream.rangeClosed(1, 25).boxed().toList();

    @Test
    void shouldCutMiddlePage() {
        PaginatedResult<Integer> page = PaginatedResult.of(items, 2, 10);

        assertEquals(IntStream.rangeClosed(11, 20).boxed().toList(), page.items());
        assertEquals(25, page.totalItems());
        assertEquals(3, page.totalPages());
        assertTrue(page.hasNextPage());
        assertTrue(page.hasPrevPage());
    }

    @Test
    void shouldCutPartialLastPage() {
        PaginatedResult<Integer> page = PaginatedResult.of(items, 3, 10);

        assertEquals(5, page.items().size());
        assertFalse(page.hasNextPage());
    }

    @Test
    void shouldReturnEmptyPageBeyondEnd() {
        PaginatedResult<Integer> page = PaginatedResult.of(items, 5, 10);

        assertTrue(page.items().isEmpty());
        assertEquals(25, page.totalItems());
    }

    @Test
    void shouldRejectInvalidPaging() {
        assertThrows(IllegalArgumentException.class, () -> new PaginatedResult<>(List.of(), 0, 10, 0));
        assertThrows(IllegalArgumentException.class, () -> new PaginatedResult<>(List.of(), 1, 0, 0));
    }

    @Test
    void shouldRejectInvalidPagingWhenCutting() {
        List<String> all = List.of("a", "b", "c");

        assertThrows(IllegalArgumentException.class, () -> PaginatedResult.of(all, 0, 2));
        assertThrows(IllegalArgumentException.class, () -> PaginatedResult.of(all, -3, 2));
        assertThrows(IllegalArgumentException.class, () -> PaginatedResult.of(all, 1, 0));
    }

    @Test
    void shouldHandleHugePageSize() {
        PaginatedResult<String> first = PaginatedResult.of(List.of("a", "b", "c"), 1, Integer.MAX_VALUE);
        PaginatedResult<String> second = PaginatedResult.of(List.of("a", "b", "c"), 2, Integer.MAX_VALUE);

        assertEquals(List.of("a", "b", "c"), first.items());
        assertEquals(1, first.totalPages());
        assertFalse(first.hasNextPage());
        assertTrue(second.items().isEmpty());
    }
}
