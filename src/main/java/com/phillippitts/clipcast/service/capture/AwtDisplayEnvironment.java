package com.phillippitts.clipcast.service.capture;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.awt.GraphicsConfiguration;
import java.awt.GraphicsDevice;
import java.awt.GraphicsEnvironment;
import java.awt.HeadlessException;
import java.awt.MouseInfo;
import java.awt.Point;
import java.awt.PointerInfo;
import java.awt.geom.AffineTransform;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link DisplayEnvironment} backed by AWT. Returns nothing in headless mode.
 */
public final class AwtDisplayEnvironment implements DisplayEnvironment {

    private static final Logger LOG = LogManager.getLogger(AwtDisplayEnvironment.class);

    @Override
    public List<DisplayInfo> displays() {
        if (GraphicsEnvironment.isHeadless()) {
            return List.of();
        }
        try {
            GraphicsDevice[] devices = GraphicsEnvironment.getLocalGraphicsEnvironment().getScreenDevices();
            List<DisplayInfo> result = new ArrayList<>(devices.length);
            for (int i = 0; i < devices.length; i++) {
                GraphicsConfiguration cfg = devices[i].getDefaultConfiguration();
                AffineTransform tx = cfg.getDefaultTransform();
                result.add(new DisplayInfo(i, cfg.getBounds(), tx.getScaleX(), tx.getScaleY()));
            }
            return result;
        } catch (HeadlessException e) {
            LOG.debug("No displays: {}", e.toString());
            return List.of();
        }
    }

    @Override
    public Optional<Point> pointerLocation() {
        if (GraphicsEnvironment.isHeadless()) {
            return Optional.empty();
        }
        try {
            PointerInfo info = MouseInfo.getPointerInfo();
            return info == null ? Optional.empty() : Optional.ofNullable(info.getLocation());
        } catch (HeadlessException | SecurityException e) {
            LOG.debug("Pointer location unavailable: {}", e.toString());
            return Optional.empty();
        }
    }
}
