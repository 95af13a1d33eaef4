package com.jimin.river.filter;

public enum FilterDecision {
    KEEP,
    DISCARD
}
