package audio.silent;

import static org.junit.jupiter.api.Assertions.*;

import audio.SoundPlayer;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

@Timeout(10)
class SilentSoundPlayerTest {

    private static final Duration BUFFERING = Duration.ofMillis(30);

    private ScheduledExecutorService scheduler;
    private SilentSoundPlayer player;
    private StateRecorder recorder;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        player = new SilentSoundPlayer("rain", scheduler, BUFFERING);
        recorder = new StateRecorder();
        player.setStateChangeListener(recorder);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    void testStartsPaused() {
        assertEquals(SoundPlayer.State.PAUSED, player.getState());
        assertEquals(0F, player.getEffectiveVolume());
    }

    @Test
    @DisplayName("Play buffers, then plays at full volume")
    void testPlay() throws Exception {
        player.setVolume(0.7F);

        player.play();
        assertEquals(SoundPlayer.State.BUFFERING, player.getState());

        recorder.await(SoundPlayer.State.PLAYING);
        awaitEffectiveVolume(0.7F);
        assertEquals(
                List.of(SoundPlayer.State.BUFFERING, SoundPlayer.State.PLAYING), recorder.states);
    }

    @Test
    void testFadeInRampsToVolume() throws Exception {
        player.setFadeInDuration(Duration.ofMillis(100));

        player.play();
        recorder.await(SoundPlayer.State.PLAYING);

        awaitEffectiveVolume(1F);
    }

    @Test
    @DisplayName("Pause with a fade-out goes through PAUSING")
    void testPauseWithFade() throws Exception {
        player.setFadeOutDuration(Duration.ofMillis(100));
        player.play();
        recorder.await(SoundPlayer.State.PLAYING);

        player.pause(false);
        assertEquals(SoundPlayer.State.PAUSING, player.getState());

        recorder.await(SoundPlayer.State.PAUSED);
        assertEquals(0F, player.getEffectiveVolume());
    }

    @Test
    void testImmediatePauseSkipsFade() throws Exception {
        player.setFadeOutDuration(Duration.ofSeconds(5));
        player.play();
        recorder.await(SoundPlayer.State.PLAYING);

        player.pause(true);

        assertEquals(SoundPlayer.State.PAUSED, player.getState());
        assertFalse(recorder.states.contains(SoundPlayer.State.PAUSING));
    }

    @Test
    @DisplayName("Pausing while buffering cancels the pending start")
    void testPauseWhileBuffering() throws Exception {
        player.setFadeOutDuration(Duration.ofSeconds(1));
        player.play();

        player.pause(false);
        assertEquals(SoundPlayer.State.PAUSED, player.getState());

        Thread.sleep(BUFFERING.toMillis() * 3);
        assertEquals(SoundPlayer.State.PAUSED, player.getState());
        assertFalse(recorder.states.contains(SoundPlayer.State.PLAYING));
    }

    @Test
    void testStopWhilePausedIsImmediate() {
        player.setFadeOutDuration(Duration.ofSeconds(1));

        player.stop(false);

        assertEquals(SoundPlayer.State.STOPPED, player.getState());
        assertEquals(List.of(SoundPlayer.State.STOPPED), recorder.states);
    }

    @Test
    void testStopWithFade() throws Exception {
        player.setFadeOutDuration(Duration.ofMillis(100));
        player.play();
        recorder.await(SoundPlayer.State.PLAYING);

        player.stop(false);
        assertEquals(SoundPlayer.State.STOPPING, player.getState());

        recorder.await(SoundPlayer.State.STOPPED);
    }

    @Test
    @DisplayName("A stopped player ignores further commands")
    void testStoppedIsTerminal() throws Exception {
        player.stop(true);

        player.play();
        player.pause(false);
        Thread.sleep(BUFFERING.toMillis() * 2);

        assertEquals(SoundPlayer.State.STOPPED, player.getState());
        assertEquals(List.of(SoundPlayer.State.STOPPED), recorder.states);
    }

    @Test
    void testPlayWhileStoppingComesBack() throws Exception {
        player.setFadeOutDuration(Duration.ofSeconds(5));
        player.play();
        recorder.await(SoundPlayer.State.PLAYING);
        player.stop(false);

        player.play();
        assertEquals(SoundPlayer.State.BUFFERING, player.getState());

        recorder.awaitCount(SoundPlayer.State.PLAYING, 2);
        assertEquals(SoundPlayer.State.PLAYING, player.getState());
    }

    @Test
    void testVolumeChangeWhilePlaying() throws Exception {
        player.play();
        recorder.await(SoundPlayer.State.PLAYING);
        awaitEffectiveVolume(1F);

        player.setVolume(0.25F);

        assertEquals(0.25F, player.getEffectiveVolume());
    }

    @Test
    void testFactoryRejectsNegativeDelay() {
        assertThrows(
                IllegalArgumentException.class,
                () -> new SilentSoundPlayerFactory(scheduler, Duration.ofMillis(-1)));
        SoundPlayer built = new SilentSoundPlayerFactory(scheduler, BUFFERING).buildPlayer("x");
        assertEquals(SoundPlayer.State.PAUSED, built.getState());
    }

    private void awaitEffectiveVolume(float expected) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
        while (Math.abs(player.getEffectiveVolume() - expected) > 1e-4F) {
            if (System.nanoTime() > deadline) {
                fail("Effective volume stayed at " + player.getEffectiveVolume());
            }
            Thread.sleep(5);
        }
    }

    private static final class StateRecorder implements SoundPlayer.StateChangeListener {
        final List<SoundPlayer.State> states = new CopyOnWriteArrayList<>();

        @Override
        public synchronized void onStateChange(SoundPlayer.State state) {
            states.add(state);
            notifyAll();
        }

        void await(SoundPlayer.State state) throws InterruptedException {
            awaitCount(state, 1);
        }

        synchronized void awaitCount(SoundPlayer.State state, int count)
                throws InterruptedException {
            long deadline = System.currentTimeMillis() + 2000;
            while (states.stream().filter(s -> s == state).count() < count) {
                long remaining = deadline - System.currentTimeMillis();
                if (remaining <= 0) {
                    fail("Timed out waiting for " + state + ", saw " + states);
                }
                wait(remaining);
            }
        }
    }
}
