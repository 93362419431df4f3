package audio.focus;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class NoopAudioFocusManagerTest {

    @Test
    void testAlwaysHoldsFocus() {
        DefaultAudioFocusManagerTest.RecordingFocusListener listener =
                new DefaultAudioFocusManagerTest.RecordingFocusListener();
        NoopAudioFocusManager manager = new NoopAudioFocusManager(listener);

        assertTrue(manager.hasFocus());
        manager.requestFocus();
        manager.abandonFocus();

        assertTrue(manager.hasFocus());
        assertEquals(List.of("gained"), listener.events);
    }
}
