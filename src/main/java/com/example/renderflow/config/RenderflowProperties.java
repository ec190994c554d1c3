package com.example.renderflow.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings for the render worker, its local directories, the encoder and the asset downloader.
 */
@ConfigurationProperties(prefix = "renderflow")
public class RenderflowProperties {

    private Worker worker = new Worker();
    private Storage storage = new Storage();
    private Encoder encoder = new Encoder();
    private Downloader downloader = new Downloader();

    public Worker getWorker() {
        return worker;
    }

    public void setWorker(Worker worker) {
        this.worker = worker;
    }

    public Storage getStorage() {
        return storage;
    }

    public void setStorage(Storage storage) {
        this.storage = storage;
    }

    public Encoder getEncoder() {
        return encoder;
    }

    public void setEncoder(Encoder encoder) {
        this.encoder = encoder;
    }

    public Downloader getDownloader() {
        return downloader;
    }

    public void setDownloader(Downloader downloader) {
        this.downloader = downloader;
    }

    public static class Worker {
        private long pollIntervalMs = 1000;
        private Duration maxRuntime = Duration.ofMinutes(30);
        private Duration watchdogInterval = Duration.ofSeconds(5);
        /** Empty means "derive from host name and pid". */
        private String owner = "";

        public long getPollIntervalMs() {
            return pollIntervalMs;
        }

        public void setPollIntervalMs(long pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
        }

        public Duration getMaxRuntime() {
            return maxRuntime;
        }

        public void setMaxRuntime(Duration maxRuntime) {
            this.maxRuntime = maxRuntime;
        }

        public Duration getWatchdogInterval() {
            return watchdogInterval;
        }

        public void setWatchdogInterval(Duration watchdogInterval) {
            this.watchdogInterval = watchdogInterval;
        }

        public String getOwner() {
            return owner;
        }

        public void setOwner(String owner) {
            this.owner = owner;
        }
    }

    public static class Storage {
        private String tempDir = "./data/renderflow/temp";
        private String outputDir = "./data/renderflow/output";
        private String publicOutputPrefix = "/outputs";

        public String getTempDir() {
            return tempDir;
        }

        public void setTempDir(String tempDir) {
            this.tempDir = tempDir;
        }

        public String getOutputDir() {
            return outputDir;
        }

        public void setOutputDir(String outputDir) {
            this.outputDir = outputDir;
        }

        public String getPublicOutputPrefix() {
            return publicOutputPrefix;
        }

        public void setPublicOutputPrefix(String publicOutputPrefix) {
            this.publicOutputPrefix = publicOutputPrefix;
        }
    }

    public static class Encoder {
        private String binary = "ffmpeg";
        private String videoCodec = "libx264";
        private String preset = "fast";
        private String audioCodec = "aac";
        private String audioBitrate = "128k";
        private int logTailLines = 40;

        public String getBinary() {
            return binary;
        }

        public void setBinary(String binary) {
            this.binary = binary;
        }

        public String getVideoCodec() {
            return videoCodec;
        }

        public void setVideoCodec(String videoCodec) {
            this.videoCodec = videoCodec;
        }

        public String getPreset() {
            return preset;
        }

        public void setPreset(String preset) {
            this.preset = preset;
        }

        public String getAudioCodec() {
            return audioCodec;
        }

        public void setAudioCodec(String audioCodec) {
            this.audioCodec = audioCodec;
        }

        public String getAudioBitrate() {
            return audioBitrate;
        }

        public void setAudioBitrate(String audioBitrate) {
            this.audioBitrate = audioBitrate;
        }

        public int getLogTailLines() {
            return logTailLines;
        }

        public void setLogTailLines(int logTailLines) {
            this.logTailLines = logTailLines;
        }
    }

    public static class Downloader {
        private int timeoutSeconds = 120;
        private int maxRedirects = 5;
        private String userAgent = "renderflow/1.0";

        public int getTimeoutSeconds() {
            return timeoutSeconds;
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }

        public int getMaxRedirects() {
            return maxRedirects;
        }

        public void setMaxRedirects(int maxRedirects) {
            this.maxRedirects = maxRedirects;
        }

        public String getUserAgent() {
            return userAgent;
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = userAgent;
        }
    }
}
