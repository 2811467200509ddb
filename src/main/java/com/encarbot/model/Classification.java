package com.encarbot.model;

public record Classification(ClassificationLabel label, Listing listing) {
    public boolean isNew() {
        return label == ClassificationLabel.NEW;
    }
}
