package org.lamportmachine.machine;

/**
 * Fatal startup failure: the machine could not bind its listening socket.
 */
public class MachineStartupException extends RuntimeException {

    public MachineStartupException(String message, Throwable cause) {
        super(message, cause);
    }
}
