package me.ud.ltc.tak.distributed.realtime.starter.service.impl;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Emission Sequencer Test
 *
 * @author takltc
 */
public class EmissionSequencerTest {

    private MutableClock clock;
    private EmissionSequencer sequencer;

    @BeforeEach
    public void setUp() {
        clock = new MutableClock(1_000L);
        sequencer = new EmissionSequencer(clock);
    }

    @Test
    public void testTimestampsStrictlyIncrease() {
        assertEquals(1_000L, sequencer.next());
        assertEquals(1_001L, sequencer.next(), "Frozen clock should still give a new timestamp");

        clock.advance(5_000L);
        assertEquals(6_000L, sequencer.next(), "Timestamps should follow the clock when it is ahead");
    }

    @Test
    public void testReleasesRunInTimestampOrder() {
        List<String> released = new ArrayList<>();
        long first = sequencer.next();
        long second = sequencer.next();
        long third = sequencer.next();

        sequencer.complete(third, () -> released.add("third"));
        sequencer.complete(second, () -> released.add("second"));
        assertTrue(released.isEmpty(), "Nothing runs while the first emission is in flight");
        assertEquals(3, sequencer.getInFlight());

        sequencer.complete(first, () -> released.add("first"));

        assertEquals(Arrays.asList("first", "second", "third"), released);
        assertEquals(0, sequencer.getInFlight());
    }

    @Test
    public void testVisibleThroughStopsBeforeFirstInFlight() {
        long first = sequencer.next();
        long second = sequencer.next();
        sequencer.complete(second, null);

        assertEquals(first - 1, sequencer.visibleThrough(), "Bound should stay below the unfinished emission");

        sequencer.complete(first, null);

        assertEquals(second, sequencer.visibleThrough(), "Every emission is visible once all are stored");
    }

    @Test
    public void testVisibleThroughWhenIdleExcludesTheCurrentMillisecond() {
        assertEquals(999L, sequencer.visibleThrough(),
            "An emission may still take the current millisecond");

        clock.advance(10L);
        long timestamp = sequencer.next();
        assertEquals(1_009L, sequencer.visibleThrough(), "Bound should stay below the emission in flight");
        sequencer.complete(timestamp, null);
        assertEquals(1_010L, sequencer.visibleThrough());
    }

    @Test
    public void testFailingReleaseDoesNotBlockLaterOnes() {
        List<String> released = new ArrayList<>();
        long first = sequencer.next();
        long second = sequencer.next();
        sequencer.complete(second, () -> released.add("second"));

        sequencer.complete(first, () -> {
            throw new IllegalStateException("boom");
        });

        assertEquals(Arrays.asList("second"), released, "Later releases should still run");
    }

    @Test
    public void testUnknownTimestampIsIgnored() {
        long timestamp = sequencer.next();
        sequencer.complete(timestamp, null);

        sequencer.complete(timestamp, () -> fail("Released twice"));

        assertEquals(0, sequencer.getInFlight());
    }
}
