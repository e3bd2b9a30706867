package com.securezone.detector.model;

import lombok.Value;

@Value
public class RegionOfInterest {

    int x;
    int y;
    int width;
    int height;

    public static RegionOfInterest of(int[] xywh) {
        if (xywh == null || xywh.length != 4) {
            throw new IllegalArgumentException("roi must be [x, y, width, height]");
        }
        return new RegionOfInterest(xywh[0], xywh[1], xywh[2], xywh[3]);
    }

    /**
     * Overlap test with a rectangle; touching edges do not count.
     */
    public boolean intersects(int rx, int ry, int rw, int rh) {
        return rx < x + width && rx + rw > x
            && ry < y + height && ry + rh > y;
    }

    public boolean intersects(CandidateRegion region) {
        return intersects(region.getX(), region.getY(), region.getWidth(), region.getHeight());
    }

    public boolean fitsWithin(int frameWidth, int frameHeight) {
        return x >= 0 && y >= 0 && width > 0 && height > 0
            && width <= frameWidth - x && height <= frameHeight - y;
    }

    @Override
    public String toString() {
        return "[" + x + ", " + y + ", " + width + ", " + height + "]";
    }
}
