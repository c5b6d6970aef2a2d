package com.autohistorian.service.store;

public class TopicNotFoundException extends RuntimeException {
    private final String topicName;

    public TopicNotFoundException(String topicName) {
        super("Unknown topic: " + topicName);
        this.topicName = topicName;
    }

    public String getTopicName() {
        return topicName;
    }
}
