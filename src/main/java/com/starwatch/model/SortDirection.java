package com.starwatch.model;

public enum SortDirection {
    ASC,
    DESC
}
