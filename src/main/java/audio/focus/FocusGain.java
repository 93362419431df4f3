package audio.focus;

/** How long a focus request intends to hold focus. */
public enum FocusGain {
    /** Indefinitely; the previous holder loses focus for good. */
    GAIN,
    /** Briefly; the previous holder gets focus back afterwards. */
    GAIN_TRANSIENT,
    /** Briefly, and the previous holder may keep playing at a lower volume. */
    GAIN_TRANSIENT_MAY_DUCK;

    FocusChange lossForPreviousHolder() {
        return switch (this) {
            case GAIN -> FocusChange.LOSS;
            case GAIN_TRANSIENT -> FocusChange.LOSS_TRANSIENT;
            case GAIN_TRANSIENT_MAY_DUCK -> FocusChange.LOSS_TRANSIENT_CAN_DUCK;
        };
    }
}
