package com.securezone.detector.service;

import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Size;

public class FramePreprocessor {

    private final int blurKernel;

    public FramePreprocessor(int blurKernel) {
        if (blurKernel <= 0 || blurKernel % 2 == 0) {
            throw new IllegalArgumentException("blur kernel must be a positive odd number: " + blurKernel);
        }
        this.blurKernel = blurKernel;
    }

    public Mat toBlurredGray(Mat image) {
        Mat gray = new Mat();
        switch (image.channels()) {
            case 1:
                image.copyTo(gray);
                break;
            case 4:
                opencv_imgproc.cvtColor(image, gray, opencv_imgproc.COLOR_BGRA2GRAY);
                break;
            default:
                opencv_imgproc.cvtColor(image, gray, opencv_imgproc.COLOR_BGR2GRAY);
        }
        if (blurKernel > 1) {
            opencv_imgproc.GaussianBlur(gray, gray, new Size(blurKernel, blurKernel), 0);
        }
        return gray;
    }
}
