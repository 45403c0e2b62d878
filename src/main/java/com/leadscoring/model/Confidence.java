package com.leadscoring.model;

public enum Confidence {
    MEDIUM,
    HIGH
}
