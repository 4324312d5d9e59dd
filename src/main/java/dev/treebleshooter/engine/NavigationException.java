package dev.treebleshooter.engine;

/**
 * Raised when a navigator is asked for a transition it cannot perform:
 * an illegal move for the current state, a dangling reference, or a walk
 * that exceeds the history ceiling. The navigator's state is left unchanged.
 */
public class NavigationException extends RuntimeException {

    public NavigationException(String message) {
        super(message);
    }
}
