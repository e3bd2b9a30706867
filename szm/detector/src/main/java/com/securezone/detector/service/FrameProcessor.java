package com.securezone.detector.service;

import java.util.ArrayList;
import java.util.List;

import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.MatVector;
import org.bytedeco.opencv.opencv_core.Point;
import org.bytedeco.opencv.opencv_core.Rect;

import lombok.extern.slf4j.Slf4j;

import com.securezone.detector.exception.NotReadyException;
import com.securezone.detector.model.CandidateRegion;
import com.securezone.detector.model.DetectorConfig;

/**
 * Background subtraction for one frame: blurred gray frame vs. reference, hard threshold,
 * dilation, external contours. Only contours with {@code area >= minArea} are returned.
 */
@Slf4j
public class FrameProcessor {

    private final FramePreprocessor preprocessor;
    private final int threshold;
    private final int dilateIterations;
    private final double minArea;

    public FrameProcessor(FramePreprocessor preprocessor, int threshold, int dilateIterations, double minArea) {
        this.preprocessor = preprocessor;
        this.threshold = threshold;
        this.dilateIterations = dilateIterations;
        this.minArea = minArea;
    }

    public static FrameProcessor fromConfig(DetectorConfig config, FramePreprocessor preprocessor) {
        return new FrameProcessor(preprocessor, config.getThreshold(), config.getDilateIterations(),
            config.getMinArea());
    }

    /**
     * @return regions sorted top-to-bottom, left-to-right
     * @throws NotReadyException while the background model is still calibrating
     */
    public List<CandidateRegion> process(Mat frame, BackgroundModel background) throws NotReadyException {
        Mat reference = background.reference();

        Mat gray = preprocessor.toBlurredGray(frame);
        Mat mask = new Mat();
        try {
            if (gray.rows() != reference.rows() || gray.cols() != reference.cols()) {
                log.warn("Frame size {}x{} differs from background {}x{}, skipping frame",
                    gray.cols(), gray.rows(), reference.cols(), reference.rows());
                return List.of();
            }
            opencv_core.absdiff(reference, gray, mask);
            opencv_imgproc.threshold(mask, mask, threshold, 255, opencv_imgproc.THRESH_BINARY);
            if (dilateIterations > 0) {
                opencv_imgproc.dilate(mask, mask, new Mat(), new Point(-1, -1), dilateIterations,
                    opencv_core.BORDER_CONSTANT, opencv_imgproc.morphologyDefaultBorderValue());
            }
            return retainSignificant(detectContours(mask));
        } finally {
            mask.release();
            gray.release();
        }
    }

    public List<CandidateRegion> retainSignificant(List<CandidateRegion> regions) {
        List<CandidateRegion> result = new ArrayList<>();
        for (CandidateRegion region : regions) {
            if (region.getArea() >= minArea) {
                result.add(region);
            }
        }
        result.sort(CandidateRegion.READING_ORDER);
        return result;
    }

    private static List<CandidateRegion> detectContours(Mat binary) {
        MatVector contours = new MatVector();
        Mat hierarchy = new Mat();
        opencv_imgproc.findContours(binary, contours, hierarchy,
            opencv_imgproc.RETR_EXTERNAL, opencv_imgproc.CHAIN_APPROX_SIMPLE);

        List<CandidateRegion> result = new ArrayList<>();
        for (int i = 0; i < contours.size(); i++) {
            Mat contour = contours.get(i);
            double area = opencv_imgproc.contourArea(contour);
            Rect rect = opencv_imgproc.boundingRect(contour);
            result.add(new CandidateRegion(rect.x(), rect.y(), rect.width(), rect.height(), area));
            contour.release();
        }
        hierarchy.release();
        contours.close();

        log.trace("Found {} contours", result.size());
        return result;
    }
}
