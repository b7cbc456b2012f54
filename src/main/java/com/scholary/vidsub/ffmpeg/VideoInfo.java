package com.scholary.vidsub.ffmpeg;

/** Basic properties of a video file as reported by ffprobe. */
public record VideoInfo(double durationSeconds, int width, int height) {}
