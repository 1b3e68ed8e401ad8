package com.phillippitts.clipcast.service.hotkey;

/**
 * Matches one configured binding against the key event stream. Implementations keep only
 * their own timing or held-key state and are driven from a single hook thread.
 */
public interface HotkeyTrigger {

    /** Human-readable name for logs. */
    String name();

    /** @return true when this press completes the binding */
    boolean onKeyPressed(NormalizedKeyEvent e);

    /** Clears held-key state; never fires an action. */
    void onKeyReleased(NormalizedKeyEvent e);
}
