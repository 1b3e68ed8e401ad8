package com.phillippitts.clipcast.service.hotkey;

import java.util.function.Consumer;

/**
 * Abstraction over a global keyboard hook so tests can drive {@link HotkeyManager} without
 * OS-level hooks.
 */
public interface GlobalKeyHook {

    /**
     * Registers the hook. Idempotent.
     *
     * @throws SecurityException when the OS refuses the hook (e.g. missing Accessibility permission)
     */
    void register();

    /** Unregisters the hook. Idempotent. */
    void unregister();

    void addListener(Consumer<NormalizedKeyEvent> listener);
}
