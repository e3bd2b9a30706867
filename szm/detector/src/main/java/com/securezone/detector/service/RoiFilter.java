package com.securezone.detector.service;

import java.util.ArrayList;
import java.util.List;

import com.securezone.detector.model.CandidateRegion;
import com.securezone.detector.model.RegionOfInterest;

/**
 * Keeps regions that overlap the ROI. Partial entries count; regions are not clipped.
 */
public class RoiFilter {

    public List<CandidateRegion> filter(List<CandidateRegion> regions, RegionOfInterest roi) {
        List<CandidateRegion> inside = new ArrayList<>();
        for (CandidateRegion region : regions) {
            if (roi.intersects(region)) {
                inside.add(region);
            }
        }
        return inside;
    }
}
