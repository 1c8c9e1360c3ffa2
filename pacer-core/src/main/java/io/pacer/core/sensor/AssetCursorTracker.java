package io.pacer.core.sensor;

/**
 * Per-asset progress of an asset-monitoring sensor, kept in the cursor of its context.
 */
public interface AssetCursorTracker
{
    /**
     * Returns true when the cursor was advanced since the current evaluation started.
     */
    boolean isCursorUpdated();

    void resetCursorUpdated();

    /**
     * Moves the cursor of every monitored asset to its latest materialization.
     */
    void advanceAllCursors();
}
