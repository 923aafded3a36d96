package com.starwatch.model;

public enum PageDirection {
    FORWARD,
    BACKWARD
}
