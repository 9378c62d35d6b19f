package com.gridcore.calc.fill;

public enum FillDirection {
    UP,
    DOWN,
    LEFT,
    RIGHT;

    /** True for UP and DOWN, which fill along rows. */
    public boolean isVertical() {
        return this == UP || this == DOWN;
    }

    /** True for DOWN and RIGHT, which extend past the end of the source. */
    public boolean isForward() {
        return this == DOWN || this == RIGHT;
    }
}
