package org.lamportmachine.machine;

public enum MachineState {
    INITIALIZING,
    RUNNING,
    SHUTTING_DOWN,
    TERMINATED
}
