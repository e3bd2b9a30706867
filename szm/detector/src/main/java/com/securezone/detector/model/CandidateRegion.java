package com.securezone.detector.model;

import java.util.Comparator;

import lombok.Value;

@Value
public class CandidateRegion {

    public static final Comparator<CandidateRegion> READING_ORDER = Comparator
        .comparingInt(CandidateRegion::getY)
        .thenComparingInt(CandidateRegion::getX)
        .thenComparingInt(CandidateRegion::getWidth)
        .thenComparingInt(CandidateRegion::getHeight);

    int x;
    int y;
    int width;
    int height;
    double area;
}
