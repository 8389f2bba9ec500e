package com.researchplatform.common.model;

public enum SearchTopic {
    GENERAL("general"),
    NEWS("news");

    private final String wireValue;

    SearchTopic(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }
}
