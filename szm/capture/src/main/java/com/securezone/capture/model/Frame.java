package com.securezone.capture.model;

import java.time.Instant;

import org.bytedeco.opencv.opencv_core.Mat;

import lombok.Getter;
import lombok.ToString;

@Getter
@ToString(exclude = "image")
public class Frame implements AutoCloseable {

    private final long index;
    private final Instant timestamp;
    private final Mat image;

    public Frame(long index, Instant timestamp, Mat image) {
        this.index = index;
        this.timestamp = timestamp;
        this.image = image;
    }

    public int rows() {
        return image.rows();
    }

    public int cols() {
        return image.cols();
    }

    public int channels() {
        return image.channels();
    }

    @Override
    public void close() {
        image.release();
    }
}
