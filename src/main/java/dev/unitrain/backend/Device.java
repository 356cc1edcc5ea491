package dev.unitrain.backend;

/**
 * Compute placement of a backend.
 *
 * <p>{@code ACCELERATOR} spreads per-sample work of a batch over a backend-owned worker
 * pool; only backends that report {@link ModelBackend#supportsAccelerator()} accept it.
 */
public enum Device {
    CPU,
    ACCELERATOR
}
