package dev.unitrain;

import java.util.Locale;

/**
 * Stage of a run. TRAIN and VAL alternate inside every epoch, TRAIN first;
 * TEST and INFER run on their own outside the epoch loop.
 */
public enum Phase {
    TRAIN,
    VAL,
    TEST,
    INFER;

    /** Lower-case name used as the prefix of logged metric keys ("val_loss"). */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
