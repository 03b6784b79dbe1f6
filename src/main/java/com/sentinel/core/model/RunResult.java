package com.sentinel.core.model;

/**
 * Final verdict of a Sentinel run as recorded in its manifest.
 */
public enum RunResult {
    PASS,
    FAIL,
    ERROR
}
