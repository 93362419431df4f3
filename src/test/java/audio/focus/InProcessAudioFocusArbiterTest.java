package audio.focus;

import static org.junit.jupiter.api.Assertions.*;

import audio.AudioAttributes;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

class InProcessAudioFocusArbiterTest {

    private InProcessAudioFocusArbiter arbiter;

    @BeforeEach
    void setUp() {
        arbiter = new InProcessAudioFocusArbiter(Runnable::run);
    }

    @Test
    void testFirstRequestIsGranted() {
        RecordingRequest a = new RecordingRequest(FocusGain.GAIN);

        assertEquals(AudioFocusArbiter.RequestResult.GRANTED, arbiter.requestFocus(a.request));

        assertSame(a.request, arbiter.getFocusHolder().orElseThrow());
        assertTrue(a.changes.isEmpty());
    }

    @Test
    void testRepeatedRequestByHolderChangesNothing() {
        RecordingRequest a = new RecordingRequest(FocusGain.GAIN);
        arbiter.requestFocus(a.request);

        assertEquals(AudioFocusArbiter.RequestResult.GRANTED, arbiter.requestFocus(a.request));

        assertEquals(1, arbiter.getHolderCount());
        assertTrue(a.changes.isEmpty());
    }

    @Test
    @DisplayName("A permanent request takes focus from every other holder")
    void testPermanentGainDropsOthers() {
        RecordingRequest a = new RecordingRequest(FocusGain.GAIN);
        RecordingRequest b = new RecordingRequest(FocusGain.GAIN_TRANSIENT);
        RecordingRequest c = new RecordingRequest(FocusGain.GAIN);
        arbiter.requestFocus(a.request);
        arbiter.requestFocus(b.request);

        arbiter.requestFocus(c.request);

        assertEquals(List.of(FocusChange.LOSS_TRANSIENT, FocusChange.LOSS), a.changes);
        assertEquals(List.of(FocusChange.LOSS), b.changes);
        assertEquals(1, arbiter.getHolderCount());
    }

    @Test
    @DisplayName("Abandoning a transient request returns focus to the previous holder")
    void testTransientGainAndAbandon() {
        RecordingRequest a = new RecordingRequest(FocusGain.GAIN);
        RecordingRequest b = new RecordingRequest(FocusGain.GAIN_TRANSIENT_MAY_DUCK);
        arbiter.requestFocus(a.request);

        arbiter.requestFocus(b.request);
        assertEquals(List.of(FocusChange.LOSS_TRANSIENT_CAN_DUCK), a.changes);
        assertSame(b.request, arbiter.getFocusHolder().orElseThrow());

        arbiter.abandonFocus(b.request);
        assertEquals(
                List.of(FocusChange.LOSS_TRANSIENT_CAN_DUCK, FocusChange.GAIN), a.changes);
        assertTrue(b.changes.isEmpty());
    }

    @Test
    void testAbandonByNonHolderDoesNotNotify() {
        RecordingRequest a = new RecordingRequest(FocusGain.GAIN);
        RecordingRequest b = new RecordingRequest(FocusGain.GAIN_TRANSIENT);
        arbiter.requestFocus(a.request);
        arbiter.requestFocus(b.request);

        arbiter.abandonFocus(a.request);
        arbiter.abandonFocus(new RecordingRequest(FocusGain.GAIN).request);

        assertEquals(List.of(FocusChange.LOSS_TRANSIENT), a.changes);
        assertSame(b.request, arbiter.getFocusHolder().orElseThrow());
        assertEquals(1, arbiter.getHolderCount());
    }

    @Test
    @DisplayName("Locked focus rejects requests and interrupts the holder")
    void testFocusLock() {
        RecordingRequest a = new RecordingRequest(FocusGain.GAIN);
        RecordingRequest b = new RecordingRequest(FocusGain.GAIN);
        arbiter.requestFocus(a.request);

        arbiter.setFocusLocked(true);
        assertTrue(arbiter.isFocusLocked());
        assertEquals(AudioFocusArbiter.RequestResult.FAILED, arbiter.requestFocus(b.request));

        arbiter.setFocusLocked(false);
        assertEquals(List.of(FocusChange.LOSS_TRANSIENT, FocusChange.GAIN), a.changes);
        assertEquals(1, arbiter.getHolderCount());
    }

    @Test
    void testAbandonWhileLockedDoesNotGrantNext() {
        RecordingRequest a = new RecordingRequest(FocusGain.GAIN);
        RecordingRequest b = new RecordingRequest(FocusGain.GAIN_TRANSIENT);
        arbiter.requestFocus(a.request);
        arbiter.requestFocus(b.request);
        arbiter.setFocusLocked(true);

        arbiter.abandonFocus(b.request);

        assertEquals(List.of(FocusChange.LOSS_TRANSIENT), a.changes);
        arbiter.setFocusLocked(false);
        assertEquals(List.of(FocusChange.LOSS_TRANSIENT, FocusChange.GAIN), a.changes);
    }

    @Test
    void testListenerExceptionDoesNotBreakArbiter() {
        AudioFocusRequest failing =
                new AudioFocusRequest(
                        AudioAttributes.DEFAULT,
                        FocusGain.GAIN,
                        change -> {
                            throw new IllegalStateException("boom");
                        });
        RecordingRequest b = new RecordingRequest(FocusGain.GAIN);
        arbiter.requestFocus(failing);

        assertEquals(AudioFocusArbiter.RequestResult.GRANTED, arbiter.requestFocus(b.request));
        assertSame(b.request, arbiter.getFocusHolder().orElseThrow());
    }

    @Test
    @Timeout(5)
    @DisplayName("Changes are dispatched through the executor, outside the arbiter lock")
    void testAsyncDispatch() throws Exception {
        ExecutorService dispatcher = Executors.newSingleThreadExecutor();
        try {
            InProcessAudioFocusArbiter async = new InProcessAudioFocusArbiter(dispatcher);
            CountDownLatch lost = new CountDownLatch(1);
            List<Integer> holderCounts = new CopyOnWriteArrayList<>();
            AudioFocusRequest a =
                    new AudioFocusRequest(
                            AudioAttributes.DEFAULT,
                            FocusGain.GAIN,
                            change -> {
                                // calling back into the arbiter must not deadlock
                                holderCounts.add(async.getHolderCount());
                                lost.countDown();
                            });
            async.requestFocus(a);
            async.requestFocus(new RecordingRequest(FocusGain.GAIN).request);

            assertTrue(lost.await(2, TimeUnit.SECONDS));
            assertEquals(List.of(1), holderCounts);
        } finally {
            dispatcher.shutdownNow();
        }
    }

    private static final class RecordingRequest {
        final List<FocusChange> changes = new CopyOnWriteArrayList<>();
        final AudioFocusRequest request;

        RecordingRequest(FocusGain gain) {
            request = new AudioFocusRequest(AudioAttributes.DEFAULT, gain, changes::add);
        }
    }
}
