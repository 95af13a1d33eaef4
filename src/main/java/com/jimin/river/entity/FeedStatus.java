package com.jimin.river.entity;

public enum FeedStatus {
    ACTIVE,
    ERROR,
    DISABLED
}
