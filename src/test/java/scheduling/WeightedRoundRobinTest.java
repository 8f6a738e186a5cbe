package scheduling;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class WeightedRoundRobinTest {

    @Test
    public void testSelectionFollowsWeights() {
        WeightedRoundRobin wrr = new WeightedRoundRobin();
        int[] weights = {5, 1, 1};

        int[] picks = new int[7];
        for (int i = 0; i < picks.length; i++) {
            picks[i] = wrr.next(weights);
        }
        assertArrayEquals(new int[]{0, 0, 0, 0, 0, 1, 2}, picks);
    }

    @Test
    public void testCycleRepeats() {
        WeightedRoundRobin wrr = new WeightedRoundRobin();
        int[] weights = {5, 1, 1};
        for (int i = 0; i < 7; i++) wrr.next(weights);

        int[] counts = new int[3];
        for (int i = 0; i < 7; i++) counts[wrr.next(weights)]++;
        assertArrayEquals(new int[]{5, 1, 1}, counts);
    }

    @Test
    public void testFrequenciesAreProportional() {
        WeightedRoundRobin wrr = new WeightedRoundRobin();
        int[] weights = {4, 2, 2};
        int[] counts = new int[3];
        for (int i = 0; i < 400; i++) counts[wrr.next(weights)]++;
        assertArrayEquals(new int[]{200, 100, 100}, counts);
    }

    @Test
    public void testPicksAreInterleaved() {
        WeightedRoundRobin wrr = new WeightedRoundRobin();
        int[] weights = {4, 2, 2};
        int[] picks = new int[4];
        for (int i = 0; i < picks.length; i++) picks[i] = wrr.next(weights);
        assertArrayEquals(new int[]{0, 0, 1, 2}, picks);
    }

    @Test
    public void testZeroWeightIsNeverSelected() {
        WeightedRoundRobin wrr = new WeightedRoundRobin();
        int[] weights = {0, 3, 0};
        for (int i = 0; i < 20; i++) {
            assertEquals(1, wrr.next(weights));
        }
    }

    @Test
    public void testNoCandidate() {
        WeightedRoundRobin wrr = new WeightedRoundRobin();
        assertEquals(WeightedRoundRobin.NO_CANDIDATE, wrr.next(new int[0]));
        assertEquals(WeightedRoundRobin.NO_CANDIDATE, wrr.next(new int[]{0, 0, 0}));
    }

    @Test
    public void testNoCandidateAfterNonZeroWeights() {
        WeightedRoundRobin wrr = new WeightedRoundRobin();
        assertEquals(0, wrr.next(new int[]{5, 1}));
        assertTimeoutPreemptively(Duration.ofSeconds(2),
                () -> assertEquals(WeightedRoundRobin.NO_CANDIDATE, wrr.next(new int[]{0, 0})));
        assertEquals(0, wrr.next(new int[]{5, 1}));
    }

    @Test
    public void testRestoredStateContinuesCycle() {
        WeightedRoundRobin original = new WeightedRoundRobin();
        int[] weights = {5, 1, 1};
        original.next(weights);
        original.next(weights);

        WeightedRoundRobin restored = new WeightedRoundRobin(original.index(), original.currentWeight());
        for (int i = 0; i < 10; i++) {
            assertEquals(original.next(weights), restored.next(weights));
        }
    }

    @Test
    public void testWeightsMayChangeBetweenCalls() {
        WeightedRoundRobin wrr = new WeightedRoundRobin();
        assertEquals(0, wrr.next(new int[]{100}));
        assertEquals(1, wrr.next(new int[]{100, 100}));
        assertEquals(0, wrr.next(new int[]{100, 100}));
    }

    @Test
    public void testInvalidState() {
        assertThrows(IllegalArgumentException.class, () -> new WeightedRoundRobin(-2, 0));
    }
}
