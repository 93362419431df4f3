package audio.focus;

import com.google.errorprone.annotations.ThreadSafe;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantLock;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Process-wide audio focus arbitration. Holders are kept on a stack; the top of the stack holds
 * focus.
 *
 * <p>Arbitration rules:
 *
 * <pre>
 * request while locked          -> FAILED
 * request by current top        -> GRANTED, no changes
 * request with GAIN             -> every other holder gets LOSS and is dropped
 * request with GAIN_TRANSIENT   -> previous top gets LOSS_TRANSIENT
 * request with ..._MAY_DUCK     -> previous top gets LOSS_TRANSIENT_CAN_DUCK
 * abandon by top                -> next holder gets GAIN
 * lock                          -> top gets LOSS_TRANSIENT
 * unlock                        -> top gets GAIN
 * </pre>
 *
 * <p>Request results are returned synchronously. Focus changes are delivered through the {@code
 * dispatcher}, never while the arbiter lock is held.
 */
@ThreadSafe
@Slf4j
public class InProcessAudioFocusArbiter implements AudioFocusArbiter {

    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<AudioFocusRequest> holders = new ArrayDeque<>();
    private final Executor dispatcher;
    private boolean focusLocked;

    public InProcessAudioFocusArbiter(@NonNull Executor dispatcher) {
        this.dispatcher = dispatcher;
    }

    @Override
    public RequestResult requestFocus(@NonNull AudioFocusRequest request) {
        List<PendingChange> changes = new ArrayList<>();
        lock.lock();
        try {
            if (focusLocked) {
                log.debug("Focus locked, rejecting {}", request);
                return RequestResult.FAILED;
            }

            AudioFocusRequest top = holders.peekFirst();
            if (top == request) {
                return RequestResult.GRANTED;
            }

            holders.remove(request);
            FocusChange loss = request.getGain().lossForPreviousHolder();
            if (loss == FocusChange.LOSS) {
                for (AudioFocusRequest holder : holders) {
                    changes.add(new PendingChange(holder, FocusChange.LOSS));
                }
                holders.clear();
            } else if (top != null) {
                changes.add(new PendingChange(top, loss));
            }

            holders.push(request);
            log.debug("Focus granted to {} ({} holders)", request, holders.size());
        } finally {
            lock.unlock();
        }

        dispatch(changes);
        return RequestResult.GRANTED;
    }

    @Override
    public void abandonFocus(@NonNull AudioFocusRequest request) {
        List<PendingChange> changes = new ArrayList<>();
        lock.lock();
        try {
            boolean wasTop = holders.peekFirst() == request;
            if (!holders.remove(request)) {
                return;
            }
            log.debug("Focus abandoned by {}", request);

            AudioFocusRequest next = holders.peekFirst();
            if (wasTop && next != null && !focusLocked) {
                changes.add(new PendingChange(next, FocusChange.GAIN));
            }
        } finally {
            lock.unlock();
        }

        dispatch(changes);
    }

    /**
     * Locks or unlocks focus, as the platform does while a call is in progress. While locked, new
     * requests fail and the current holder is transiently interrupted.
     */
    public void setFocusLocked(boolean locked) {
        List<PendingChange> changes = new ArrayList<>();
        lock.lock();
        try {
            if (focusLocked == locked) {
                return;
            }
            focusLocked = locked;
            log.info("Audio focus {}", locked ? "locked" : "unlocked");

            AudioFocusRequest top = holders.peekFirst();
            if (top != null) {
                changes.add(
                        new PendingChange(
                                top, locked ? FocusChange.LOSS_TRANSIENT : FocusChange.GAIN));
            }
        } finally {
            lock.unlock();
        }

        dispatch(changes);
    }

    public boolean isFocusLocked() {
        lock.lock();
        try {
            return focusLocked;
        } finally {
            lock.unlock();
        }
    }

    /** The request currently holding focus, if any. */
    public Optional<AudioFocusRequest> getFocusHolder() {
        lock.lock();
        try {
            return Optional.ofNullable(holders.peekFirst());
        } finally {
            lock.unlock();
        }
    }

    public int getHolderCount() {
        lock.lock();
        try {
            return holders.size();
        } finally {
            lock.unlock();
        }
    }

    private void dispatch(List<PendingChange> changes) {
        for (PendingChange change : changes) {
            dispatcher.execute(() -> deliver(change));
        }
    }

    private void deliver(PendingChange change) {
        try {
            change.request().getListener().onFocusChange(change.change());
        } catch (Exception e) {
            log.warn("Error in focus change listener for {}", change.request(), e);
        }
    }

    private record PendingChange(AudioFocusRequest request, FocusChange change) {}
}
