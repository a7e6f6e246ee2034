package com.tripdispatch.dispatch.dispatch.model;

public record SweepResult(int offersExpired, int tripsAdvanced, int failures) {
}
