package com.chatcorpus.incremental;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.chatcorpus.testing.TestMessages;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.TreeSet;
import org.junit.jupiter.api.Test;

class DeltaDetectorTest {

    private final DeltaDetector detector = new DeltaDetector();

    @Test
    void newGuidsAreTheSetDifference() {
        Random random = new Random(7);
        for (int round = 0; round < 50; round++) {
            Set<String> previous = randomGuids(random);
            Set<String> current = randomGuids(random);

            List<String> fresh = detector.detectNew(current, stateWith(previous));

            TreeSet<String> expected = new TreeSet<>(current);
            expected.removeAll(previous);
            assertEquals(new ArrayList<>(expected), fresh);
        }
    }

    @Test
    void subsetOfPreviousYieldsNothing() {
        IncrementalState previous = stateWith(Set.of("a", "b", "c"));

        assertTrue(detector.detectNew(List.of("c", "a"), previous).isEmpty());
    }

    @Test
    void missingStateMeansEverythingIsNew() {
        DeltaResult result = detector.detect(TestMessages.images(3), null);

        assertTrue(result.isFirstRun());
        assertEquals(List.of("m000", "m001", "m002"), result.getNewGuids());
        assertEquals(100.0, result.getPercentNew());
    }

    @Test
    void detectReportsCounts() {
        DeltaResult result = detector.detect(TestMessages.images(4), stateWith(Set.of("m000", "m003", "gone")));

        assertFalse(result.isFirstRun());
        assertEquals(List.of("m001", "m002"), result.getNewGuids());
        assertEquals(2, result.getNewCount());
        assertEquals(4, result.getTotalMessages());
        assertEquals(3, result.getPreviousEnrichedCount());
        assertEquals(50.0, result.getPercentNew());
    }

    private static IncrementalState stateWith(Set<String> guids) {
        IncrementalState state = new IncrementalState();
        state.setEnrichedGuids(new ArrayList<>(guids));
        return state;
    }

    private static Set<String> randomGuids(Random random) {
        Set<String> guids = new TreeSet<>();
        int size = random.nextInt(20);
        for (int i = 0; i < size; i++) {
            guids.add("g" + random.nextInt(30));
        }
        return guids;
    }
}
