package com.autohistorian.dto;

public class ArticleDtos {

    /** Generated encyclopedia-style article for one topic, in markdown. */
    public static class Article {
        private String topic;
        private String markdown;
        private int events; // facts the article was written from
        private int statements;

        public Article() {}

        public Article(String topic, String markdown, int events, int statements) {
            this.topic = topic;
            this.markdown = markdown;
            this.events = events;
            this.statements = statements;
        }

        public String getTopic() { return topic; }
        public void setTopic(String topic) { this.topic = topic; }
        public String getMarkdown() { return markdown; }
        public void setMarkdown(String markdown) { this.markdown = markdown; }
        public int getEvents() { return events; }
        public void setEvents(int events) { this.events = events; }
        public int getStatements() { return statements; }
        public void setStatements(int statements) { this.statements = statements; }
    }
}
