package com.securezone.detector.service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.opencv_core.Mat;

import lombok.extern.slf4j.Slf4j;

import com.securezone.detector.exception.NotReadyException;
import com.securezone.detector.model.CalibrationStatus;

/**
 * Reference image of the empty scene: the per-pixel median of the first
 * {@code requiredSamples} frames after construction or {@link #reset()}. The median keeps
 * a single object passing through during calibration out of the reference.
 */
@Slf4j
public class BackgroundModel {

    private final int requiredSamples;
    private final FramePreprocessor preprocessor;
    private final List<byte[]> samples = new ArrayList<>();

    private int rows = -1;
    private int cols = -1;
    private Mat reference;

    public BackgroundModel(int requiredSamples, FramePreprocessor preprocessor) {
        if (requiredSamples < 1) {
            throw new IllegalArgumentException("bg_frames must be >= 1, got " + requiredSamples);
        }
        this.requiredSamples = requiredSamples;
        this.preprocessor = preprocessor;
    }

    public CalibrationStatus ingest(Mat frame) {
        if (reference != null) {
            return CalibrationStatus.READY;
        }

        Mat gray = preprocessor.toBlurredGray(frame);
        try {
            if (rows < 0) {
                rows = gray.rows();
                cols = gray.cols();
            } else if (gray.rows() != rows || gray.cols() != cols) {
                log.warn("Frame size changed during calibration ({}x{} -> {}x{}), restarting calibration",
                    cols, rows, gray.cols(), gray.rows());
                samples.clear();
                rows = gray.rows();
                cols = gray.cols();
            }
            samples.add(toBytes(gray));
        } finally {
            gray.release();
        }

        log.debug("Calibrating... {}/{}", samples.size(), requiredSamples);
        if (samples.size() < requiredSamples) {
            return CalibrationStatus.CALIBRATING;
        }

        reference = new Mat(rows, cols, opencv_core.CV_8UC1);
        reference.data().put(median(samples, rows * cols));
        samples.clear();
        log.info("Background model created from {} frames ({}x{})", requiredSamples, cols, rows);
        return CalibrationStatus.READY;
    }

    public boolean isReady() {
        return reference != null;
    }

    public Mat reference() throws NotReadyException {
        if (reference == null) {
            throw new NotReadyException(samples.size(), requiredSamples);
        }
        return reference;
    }

    /**
     * Drops the reference and all collected samples. A no-op while calibrating with no
     * samples collected.
     */
    public void reset() {
        if (reference == null && samples.isEmpty()) {
            return;
        }
        if (reference != null) {
            reference.release();
            reference = null;
        }
        samples.clear();
        rows = -1;
        cols = -1;
        log.info("Background model reset, collecting {} new calibration frames", requiredSamples);
    }

    public int samplesCollected() {
        return reference != null ? requiredSamples : samples.size();
    }

    public int requiredSamples() {
        return requiredSamples;
    }

    private static byte[] toBytes(Mat gray) {
        Mat continuous = gray.isContinuous() ? gray : gray.clone();
        byte[] data = new byte[rowsTimesCols(continuous)];
        continuous.data().get(data);
        if (continuous != gray) {
            continuous.release();
        }
        return data;
    }

    private static int rowsTimesCols(Mat mat) {
        return mat.rows() * mat.cols();
    }

    /**
     * Per-pixel median; for an even sample count the two middle values are averaged and
     * truncated.
     */
    static byte[] median(List<byte[]> stack, int length) {
        int n = stack.size();
        int[] column = new int[n];
        byte[] result = new byte[length];
        for (int i = 0; i < length; i++) {
            for (int s = 0; s < n; s++) {
                column[s] = stack.get(s)[i] & 0xFF;
            }
            Arrays.sort(column);
            int mid = n / 2;
            int value = (n % 2 == 1) ? column[mid] : (column[mid - 1] + column[mid]) / 2;
            result[i] = (byte) value;
        }
        return result;
    }
}
