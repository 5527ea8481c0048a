package com.spot.facet;

/** One point of a piecewise linear map from a raw value {@code x} to a rank {@code fx}. */
public record ControlPoint(double x, double fx) {}
