package com.leadscoring.model;

public enum AssignmentPriority {
    LOW,
    MEDIUM,
    HIGH
}
