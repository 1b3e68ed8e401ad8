package com.phillippitts.clipcast.service.hotkey.impl;

import com.github.kwhat.jnativehook.GlobalScreen;
import com.github.kwhat.jnativehook.NativeHookException;
import com.github.kwhat.jnativehook.NativeInputEvent;
import com.github.kwhat.jnativehook.keyboard.NativeKeyEvent;
import com.github.kwhat.jnativehook.keyboard.NativeKeyListener;
import com.phillippitts.clipcast.service.hotkey.GlobalKeyHook;
import com.phillippitts.clipcast.service.hotkey.NormalizedKeyEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Production {@link GlobalKeyHook} backed by JNativeHook.
 */
@Component
@ConditionalOnProperty(prefix = "hotkey", name = "enabled", havingValue = "true", matchIfMissing = true)
public class JNativeHookGlobalKeyHook implements GlobalKeyHook, NativeKeyListener {

    private static final Logger LOG = LogManager.getLogger(JNativeHookGlobalKeyHook.class);

    private volatile Consumer<NormalizedKeyEvent> listener;
    private final AtomicBoolean registered = new AtomicBoolean(false);

    @Override
    public void register() {
        if (!registered.compareAndSet(false, true)) {
            return;
        }
        try {
            GlobalScreen.registerNativeHook();
            GlobalScreen.addNativeKeyListener(this);
            LOG.info("Registered JNativeHook global key listener");
        } catch (NativeHookException | LinkageError e) {
            registered.set(false);
            throw new SecurityException("Failed to register global key hook: " + e.getMessage(), e);
        }
    }

    @Override
    public void unregister() {
        if (!registered.compareAndSet(true, false)) {
            return;
        }
        GlobalScreen.removeNativeKeyListener(this);
        try {
            GlobalScreen.unregisterNativeHook();
        } catch (NativeHookException e) {
            LOG.debug("Error unregistering native hook: {}", e.getMessage());
        }
    }

    @Override
    public void addListener(Consumer<NormalizedKeyEvent> listener) {
        this.listener = listener;
    }

    @Override
    public void nativeKeyPressed(NativeKeyEvent nativeEvent) {
        emit(nativeEvent, NormalizedKeyEvent.Type.PRESSED);
    }

    @Override
    public void nativeKeyReleased(NativeKeyEvent nativeEvent) {
        emit(nativeEvent, NormalizedKeyEvent.Type.RELEASED);
    }

    @Override
    public void nativeKeyTyped(NativeKeyEvent nativeEvent) {
        // Press and release carry everything the triggers need
    }

    private void emit(NativeKeyEvent ne, NormalizedKeyEvent.Type type) {
        Consumer<NormalizedKeyEvent> l = this.listener;
        if (l == null) {
            return;
        }
        String keyText = NativeKeyEvent.getKeyText(ne.getKeyCode());
        if (keyText == null || keyText.isBlank()) {
            return;
        }
        NormalizedKeyEvent e = new NormalizedKeyEvent(type, keyText, extractModifiers(ne), System.currentTimeMillis());
        try {
            l.accept(e);
        } catch (RuntimeException ex) {
            LOG.warn("Hotkey listener failed for {}: {}", e, ex.toString());
        }
    }

    private static Set<String> extractModifiers(NativeInputEvent e) {
        int m = e.getModifiers();
        Set<String> mods = new HashSet<>();
        if ((m & NativeInputEvent.SHIFT_MASK) != 0) {
            mods.add("SHIFT");
        }
        if ((m & NativeInputEvent.CTRL_MASK) != 0) {
            mods.add("CONTROL");
        }
        if ((m & NativeInputEvent.ALT_MASK) != 0) {
            mods.add("ALT");
        }
        if ((m & NativeInputEvent.META_MASK) != 0) {
            mods.add("META");
        }
        return mods;
    }
}
