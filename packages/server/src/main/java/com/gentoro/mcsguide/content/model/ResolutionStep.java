package com.gentoro.mcsguide.content.model;

/** One numbered step of a troubleshooting guide. */
public record ResolutionStep(int step, String action, String details) {}
