package org.pointerviz.layout;

/**
 * Top-left corner of a node in diagram coordinates.
 *
 * @param x Horizontal coordinate, growing to the right.
 * @param y Vertical coordinate, growing downwards.
 */
public record Position(double x, double y) {

    public Position translate(double dx, double dy) {
        return new Position(x + dx, y + dy);
    }
}
