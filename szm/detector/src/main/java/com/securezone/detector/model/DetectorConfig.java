package com.securezone.detector.model;

import java.time.Duration;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import com.securezone.detector.exception.ConfigurationException;

@Slf4j
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class DetectorConfig {

    @JsonProperty("video_source")
    private String videoSource;

    @JsonProperty("bg_frames")
    private Integer bgFrames;

    @JsonProperty("min_area")
    private Double minArea;

    @JsonProperty("roi")
    private int[] roi;

    @JsonProperty("alert_after_hours")
    private int[] alertAfterHours;

    @JsonProperty("record_duration")
    private Double recordDuration;

    @JsonProperty("save_videos")
    private Boolean saveVideos;

    @JsonProperty("output_fps")
    private Double outputFps;

    @JsonProperty("threshold")
    private int threshold = 25;

    @JsonProperty("blur_kernel")
    private int blurKernel = 21;

    @JsonProperty("dilate_iterations")
    private int dilateIterations = 2;

    @JsonProperty("confirm_window")
    private int confirmWindow = 1;

    @JsonProperty("confirm_frames")
    private int confirmFrames = 1;

    @JsonProperty("max_empty_reads")
    private int maxEmptyReads = 5;

    @JsonProperty("empty_read_delay_ms")
    private long emptyReadDelayMs = 100;

    @JsonProperty("throttle_playback")
    private boolean throttlePlayback = true;

    @JsonProperty("camera_id")
    private String cameraId = "SECURECAM-ATM-01";

    @JsonProperty("recordings_dir")
    private String recordingsDir = "data/recordings";

    @JsonProperty("log_file")
    private String logFile = "data/logs/motion_log.jsonl";

    @JsonProperty("play_sound")
    private boolean playSound = false;

    public RegionOfInterest regionOfInterest() {
        return RegionOfInterest.of(roi);
    }

    public ScheduleWindow scheduleWindow() {
        return ScheduleWindow.of(alertAfterHours);
    }

    public Duration recordDurationAsDuration() {
        return Duration.ofMillis(Math.round(recordDuration * 1000));
    }

    public DetectorConfig validate() throws ConfigurationException {
        require(videoSource != null && !videoSource.isBlank(), "video_source is required");
        require(bgFrames != null, "bg_frames is required");
        require(bgFrames >= 1, "bg_frames must be >= 1, got " + bgFrames);
        require(minArea != null, "min_area is required");
        require(minArea > 0, "min_area must be positive, got " + minArea);

        require(roi != null, "roi is required");
        require(roi.length == 4, "roi must be [x, y, width, height]");
        require(roi[0] >= 0 && roi[1] >= 0, "roi origin must not be negative");
        require(roi[2] > 0 && roi[3] > 0, "roi width and height must be positive");

        require(alertAfterHours != null, "alert_after_hours is required");
        require(alertAfterHours.length == 2, "alert_after_hours must be [start_hour, end_hour]");
        require(alertAfterHours[0] >= 0 && alertAfterHours[0] < 24,
            "alert_after_hours start must be in [0, 24), got " + alertAfterHours[0]);
        require(alertAfterHours[1] >= 0 && alertAfterHours[1] <= 24,
            "alert_after_hours end must be in [0, 24], got " + alertAfterHours[1]);

        require(recordDuration != null, "record_duration is required");
        require(recordDuration > 0, "record_duration must be positive, got " + recordDuration);
        require(saveVideos != null, "save_videos is required");
        require(outputFps != null, "output_fps is required");
        require(outputFps > 0, "output_fps must be positive, got " + outputFps);

        require(threshold >= 0 && threshold < 255, "threshold must be in [0, 255), got " + threshold);
        require(blurKernel > 0 && blurKernel % 2 == 1, "blur_kernel must be a positive odd number, got " + blurKernel);
        require(dilateIterations >= 0, "dilate_iterations must not be negative");
        require(confirmWindow >= 1, "confirm_window must be >= 1");
        require(confirmFrames >= 1 && confirmFrames <= confirmWindow,
            "confirm_frames must be in [1, confirm_window], got " + confirmFrames);
        require(maxEmptyReads >= 0, "max_empty_reads must not be negative");
        require(emptyReadDelayMs >= 0, "empty_read_delay_ms must not be negative");

        if (scheduleWindow().isDegenerate()) {
            log.warn("alert_after_hours {} has equal bounds; treating the schedule as always active",
                scheduleWindow());
        }
        if (playSound) {
            log.info("play_sound is set but audible alerts are not supported; ignoring");
        }
        return this;
    }

    private static void require(boolean condition, String message) throws ConfigurationException {
        if (!condition) {
            throw new ConfigurationException(message);
        }
    }
}
