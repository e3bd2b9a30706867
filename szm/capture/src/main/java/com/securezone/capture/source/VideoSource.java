package com.securezone.capture.source;

import java.io.Closeable;

import com.securezone.capture.exception.SourceExhaustedException;
import com.securezone.capture.exception.SourceUnavailableException;
import com.securezone.capture.model.Frame;

public interface VideoSource extends Closeable {

    /**
     * Blocks until the next frame is available.
     *
     * @throws SourceExhaustedException   when a file source reached its end
     * @throws SourceUnavailableException when a live source stopped delivering frames
     */
    Frame next() throws SourceExhaustedException, SourceUnavailableException;

    boolean isLive();

    double fps();

    int width();

    int height();

    String describe();

    @Override
    void close();
}
