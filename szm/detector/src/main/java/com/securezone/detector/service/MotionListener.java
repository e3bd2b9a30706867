package com.securezone.detector.service;

import java.time.Instant;
import java.util.List;

import com.securezone.detector.model.CandidateRegion;

@FunctionalInterface
public interface MotionListener {

    void onMotion(Instant timestamp, List<CandidateRegion> regions);
}
