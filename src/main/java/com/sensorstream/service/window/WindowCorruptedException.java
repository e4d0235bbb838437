package com.sensorstream.service.window;

/**
 * A machine window failed its internal consistency check.
 *
 * Fatal to that machine's window only: the owning lane resets the window and
 * carries on with the next reading.
 */
public class WindowCorruptedException extends RuntimeException {

    private final String machineId;

    public WindowCorruptedException(String machineId, String message) {
        super("Window of machine " + machineId + " is corrupted: " + message);
        this.machineId = machineId;
    }

    public String getMachineId() {
        return machineId;
    }
}
