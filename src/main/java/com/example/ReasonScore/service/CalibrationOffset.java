package com.example.ReasonScore.service;

/**
 * Correction added to the overall confidence before clamping.
 */
@FunctionalInterface
public interface CalibrationOffset {

    double current();

    static CalibrationOffset none() {
        return () -> 0.0;
    }
}
