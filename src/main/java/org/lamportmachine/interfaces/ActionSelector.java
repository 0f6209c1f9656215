package org.lamportmachine.interfaces;

import org.lamportmachine.machine.Action;

/**
 * Picks the local action for a tick in which no message was waiting.
 */
public interface ActionSelector {

    Action next();
}
