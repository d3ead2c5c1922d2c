package com.dayplanner.service;

public enum NavigationDirection {
    BACKWARD,
    NEUTRAL,
    FORWARD
}
