package com.phillippitts.clipcast.testutil;

import com.phillippitts.clipcast.service.capture.DisplayEnvironment;
import com.phillippitts.clipcast.service.capture.DisplayInfo;

import java.awt.Point;
import java.awt.Rectangle;
import java.util.List;
import java.util.Optional;

/**
 * Fixed displays and pointer, so capture code runs without a real screen.
 */
public class FakeDisplayEnvironment implements DisplayEnvironment {

    private final List<DisplayInfo> displays;
    private volatile Point pointer;

    public FakeDisplayEnvironment(List<DisplayInfo> displays, Point pointer) {
        this.displays = List.copyOf(displays);
        this.pointer = pointer;
    }

    /** One 1440x900 display at scale 2.0 with the pointer in the middle. */
    public static FakeDisplayEnvironment retina() {
        return new FakeDisplayEnvironment(List.of(new DisplayInfo(0, new Rectangle(0, 0, 1440, 900), 2.0, 2.0)),
                new Point(720, 450));
    }

    public static FakeDisplayEnvironment headless() {
        return new FakeDisplayEnvironment(List.of(), null);
    }

    public void movePointer(Point p) {
        this.pointer = p;
    }

    @Override
    public List<DisplayInfo> displays() {
        return displays;
    }

    @Override
    public Optional<Point> pointerLocation() {
        return Optional.ofNullable(pointer);
    }
}
