package com.encarbot.model;

public enum ClassificationLabel {
    NEW,
    UPDATED,
    UNCHANGED
}
