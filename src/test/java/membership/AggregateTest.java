package membership;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AggregateTest {

    private static Filter fullFilter() {
        Filter filter = Filter.restore(8, List.of(HashAlgorithm.MD5), 0, new byte[]{(byte) 0xff});
        assertTrue(filter.isFull());
        return filter;
    }

    @Test
    public void testAddWithoutChildrenUnderflows() {
        Aggregate aggregate = new Aggregate();
        assertEquals(InsertResult.Status.UNDERFLOW, aggregate.tryAdd("x").status());

        CapacityException e = assertThrows(CapacityException.class, () -> aggregate.add("x"));
        assertTrue(e.isUnderflow());
        assertEquals(0, aggregate.count());
    }

    @Test
    public void testRoutesAroundFullChild() {
        Filter full = fullFilter();
        Filter open = new Filter(1 << 16, "sha1");
        Aggregate aggregate = new Aggregate().attach(full).attach(open);

        for (int i = 0; i < 50; i++) {
            assertSame(open, aggregate.add("item" + i));
        }
        assertEquals(0, full.count());
        assertEquals(50, open.count());
        assertEquals(50, aggregate.count());
    }

    @Test
    public void testAllChildrenFullOverflows() {
        Aggregate aggregate = new Aggregate().attach(fullFilter()).attach(fullFilter());
        assertEquals(InsertResult.Status.OVERFLOW, aggregate.tryAdd("x").status());

        CapacityException e = assertThrows(CapacityException.class, () -> aggregate.add("x"));
        assertTrue(e.isOverflow());
        assertTrue(aggregate.isFull());
    }

    @Test
    public void testEqualChildrenAlternate() {
        Filter first = new Filter(1 << 20, "md5");
        Filter second = new Filter(1 << 20, "md5");
        Aggregate aggregate = new Aggregate().attach(first).attach(second);

        for (int i = 0; i < 100; i++) {
            FilterComponent expected = (i % 2 == 0) ? first : second;
            assertSame(expected, aggregate.add(i));
        }
        assertEquals(50, first.count());
        assertEquals(50, second.count());
    }

    @Test
    public void testWeights() {
        Filter loaded = new Filter(64, "md5");
        for (int i = 0; i < 200; i++) loaded.add(i);
        Filter empty = new Filter(64, "md5");

        Aggregate permissive = new Aggregate().attach(loaded).attach(empty);
        int expectedLoaded = loaded.isFull() ? 0 : (int) (100 - Math.round(loaded.getFalsePositiveProbability() * 100));
        assertArrayEquals(new int[]{expectedLoaded, 100}, permissive.weights());

        Aggregate strict = new Aggregate(AggregateOptions.builder().falseProbabilityThreshold(0.1).build())
                .attach(loaded).attach(empty);
        assertArrayEquals(new int[]{0, 100}, strict.weights());
        for (int i = 0; i < 5; i++) {
            assertSame(empty, strict.add("fresh" + i));
        }
    }

    @Test
    public void testThresholdMakesChildIneligible() {
        Filter child = new Filter(256, "md5", "sha1");
        Aggregate aggregate = new Aggregate(AggregateOptions.builder().falseProbabilityThreshold(0.05).build())
                .attach(child);

        int accepted = 0;
        while (aggregate.tryAdd("item" + accepted).isOk()) {
            accepted++;
            assertTrue(accepted < 10_000);
        }
        assertTrue(child.getFalsePositiveProbability() > 0.05);
        assertFalse(child.isFull());
        assertEquals(accepted, child.count());
    }

    @Test
    public void testHasPollsEveryChild() {
        Filter first = new Filter(1024, "md5", "sha1");
        Filter second = new Filter(1024, "md5", "sha1");
        first.add("only-in-first");
        second.add("only-in-second");
        Aggregate aggregate = new Aggregate().attach(first).attach(second);

        assertTrue(aggregate.has("only-in-first"));
        assertTrue(aggregate.has("only-in-second"));
        for (int i = 0; i < 100; i++) {
            String item = "other" + i;
            assertEquals(first.has(item) || second.has(item), aggregate.has(item));
        }
    }

    @Test
    public void testMatchesOrderedByReliability() {
        Filter crowded = new Filter(1024, "md5", "sha1");
        crowded.add("x");
        for (int i = 0; i < 300; i++) crowded.add(i);
        Filter sparse = new Filter(1024, "md5", "sha1");
        sparse.add("x");

        Aggregate aggregate = new Aggregate().attach(crowded).attach(sparse);
        List<FilterComponent> matches = aggregate.matches("x");
        assertEquals(List.of(sparse, crowded), matches);
    }

    @Test
    public void testNoMatch() {
        Aggregate aggregate = new Aggregate().attach(new Filter(1024, "md5")).attach(new Filter(1024, "sha1"));
        assertTrue(aggregate.matches("anything").isEmpty());
        assertFalse(aggregate.has("anything"));
    }

    @Test
    public void testCountAndFalsePositiveProbability() {
        Filter small = new Filter(128, "md5");
        Filter large = new Filter(4096, "md5");
        for (int i = 0; i < 20; i++) small.add(i);
        for (int i = 0; i < 30; i++) large.add(i);

        Aggregate aggregate = new Aggregate().attach(small).attach(large);
        assertEquals(50, aggregate.count());
        assertEquals(small.getFalsePositiveProbability(), aggregate.getFalsePositiveProbability(), 0.0);
        assertEquals(0.0, new Aggregate().getFalsePositiveProbability(), 0.0);
    }

    @Test
    public void testIsFull() {
        assertTrue(new Aggregate().isFull(), "No child can take items");
        assertFalse(new Aggregate().attach(fullFilter()).attach(new Filter(64, "md5")).isFull());
        assertTrue(new Aggregate().attach(fullFilter()).attach(fullFilter()).isFull());
    }

    @Test
    public void testNestedAggregates() {
        Filter leaf = new Filter(1 << 16, "md5");
        Filter full = fullFilter();
        Aggregate inner = new Aggregate().attach(leaf);
        Aggregate outer = new Aggregate().attach(full).attach(inner);

        assertSame(leaf, outer.add("nested"));
        assertTrue(outer.has("nested"));
        // a saturated filter answers yes to everything, with no inserts it still reports p = 0
        assertEquals(List.of(full, inner), outer.matches("nested"));
        assertEquals(1, outer.count());
    }

    @Test
    public void testNestedOverflowSurfaces() {
        Aggregate inner = new Aggregate(AggregateOptions.builder().falseProbabilityThreshold(0.0).build());
        Filter busy = new Filter(1 << 16, "md5");
        busy.add("already-there");
        inner.attach(busy);

        Aggregate outer = new Aggregate().attach(inner);
        assertEquals(InsertResult.Status.OVERFLOW, outer.tryAdd("x").status());
    }

    @Test
    public void testChildrenView() {
        Filter filter = new Filter(64, "md5");
        Aggregate aggregate = new Aggregate().attach(filter);
        assertEquals(List.of(filter), aggregate.children());
        assertThrows(UnsupportedOperationException.class, () -> aggregate.children().add(filter));
        assertThrows(NullPointerException.class, () -> aggregate.attach(null));
    }

    @Test
    public void testOptionsValidation() {
        assertEquals(1.0, AggregateOptions.defaults().falseProbabilityThreshold());
        assertThrows(IllegalArgumentException.class,
                () -> AggregateOptions.builder().falseProbabilityThreshold(1.5).build());
        assertThrows(IllegalArgumentException.class,
                () -> AggregateOptions.builder().falseProbabilityThreshold(-0.1).build());
    }

    @Test
    public void testInsertResult() {
        Filter filter = new Filter(64, "md5");
        assertSame(filter, InsertResult.ok(filter).handler());
        assertTrue(InsertResult.overflow().needsGrowth());
        assertThrows(IllegalStateException.class, () -> InsertResult.underflow().handler());
        assertThrows(IllegalArgumentException.class, () -> new CapacityException(InsertResult.Status.OK, "ok"));
    }

    @Test
    public void testToStringWhileAttaching() throws InterruptedException {
        Aggregate aggregate = new Aggregate();
        Thread writer = new Thread(() -> {
            for (int i = 0; i < 1000; i++) {
                aggregate.attach(new Filter(8, "md5"));
            }
        });
        writer.start();
        for (int i = 0; i < 100; i++) {
            assertTrue(aggregate.toString().startsWith("Aggregate{children="));
        }
        writer.join();
        assertTrue(aggregate.toString().startsWith("Aggregate{children=1000, count=0"));
    }
}
