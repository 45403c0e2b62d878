package com.leadscoring.model;

public enum Sentiment {
    POSITIVE,
    NEUTRAL,
    NEGATIVE
}
