package com.architectai.generation.service;

@FunctionalInterface
public interface ProgressListener {

    void onProgress(double percent, String message);

    static ProgressListener none() {
        return (percent, message) -> { };
    }
}
