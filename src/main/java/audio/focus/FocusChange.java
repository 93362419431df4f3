package audio.focus;

/** Focus changes delivered by an {@link AudioFocusArbiter} to a holder. */
public enum FocusChange {
    GAIN,
    LOSS,
    LOSS_TRANSIENT,
    LOSS_TRANSIENT_CAN_DUCK;

    public boolean isTransientLoss() {
        return this == LOSS_TRANSIENT || this == LOSS_TRANSIENT_CAN_DUCK;
    }
}
