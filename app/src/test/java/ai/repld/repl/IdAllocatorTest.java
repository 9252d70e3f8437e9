package ai.repld.repl;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

class IdAllocatorTest {

    @Test
    void testSequentialWhenNoClash() {
        var allocator = new IdAllocator(0, new Random(1));
        assertEquals(1, allocator.nextId(id -> true));
        assertEquals(2, allocator.nextId(id -> true));
        assertEquals(3, allocator.nextId(id -> true));
        assertEquals(3, allocator.lastId());
    }

    @Test
    void testCandidatesAfterClashAreNotSequential() {
        var allocator = new IdAllocator(0, new Random(42));
        var seen = new ArrayList<Integer>();
        var accepted = new ArrayList<Integer>();
        int id = allocator.nextId(candidate -> {
            seen.add(candidate);
            boolean free = seen.size() > 5;
            if (free) {
                accepted.add(candidate);
            }
            return free;
        });

        assertEquals(6, seen.size());
        for (int i = 1; i < seen.size(); i++) {
            int previous = seen.get(i - 1);
            int current = seen.get(i);
            assertNotEquals(previous + 1, current, "candidate " + i + " followed its predecessor: " + seen);
        }
        assertEquals(1, seen.get(0));
        assertTrue(id > 0);
        assertEquals(List.of(id), accepted);
        assertEquals(id, allocator.lastId());
    }

    @Test
    void testClashJumpsAreReproducibleForSameSeed() {
        var first = collectCandidates(new IdAllocator(10, new Random(7)));
        var second = collectCandidates(new IdAllocator(10, new Random(7)));
        assertEquals(first, second);
        assertEquals(11, first.get(0));
    }

    private static List<Integer> collectCandidates(IdAllocator allocator) {
        var seen = new ArrayList<Integer>();
        allocator.nextId(candidate -> {
            seen.add(candidate);
            return seen.size() > 3;
        });
        return seen;
    }

    @Test
    void testNeverReturnsNonPositiveIdAfterOverflow() {
        var allocator = new IdAllocator(Integer.MAX_VALUE, new Random(3));
        var seen = new ArrayList<Integer>();
        int id = allocator.nextId(candidate -> {
            seen.add(candidate);
            return true;
        });
        assertTrue(id > 0);
        assertTrue(seen.stream().allMatch(candidate -> candidate > 0));
    }

    @Test
    void testExhaustionThrows() {
        var allocator = new IdAllocator(0, new Random(5));
        var calls = new int[1];
        var ex = assertThrows(AllocationExhaustedException.class, () -> allocator.nextId(candidate -> {
            calls[0]++;
            return false;
        }));
        assertEquals("Invalid state or algorithm error", ex.getMessage());
        assertTrue(calls[0] <= IdAllocator.MAX_ATTEMPTS);
        assertTrue(calls[0] > 0);
    }

    @Test
    void testIdsAreUniqueAgainstGrowingTakenSet() {
        var allocator = new IdAllocator(0, new Random(11));
        var taken = new HashSet<Integer>();
        for (int i = 0; i < 1000; i++) {
            int id = allocator.nextId(candidate -> !taken.contains(candidate));
            assertTrue(id > 0);
            assertTrue(taken.add(id), "duplicate id " + id);
        }
    }
}
