package com.autohistorian.dto;

import com.autohistorian.model.Statement;
import com.autohistorian.model.TimelineItem;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class TimelineDtos {

    /** The same facts ordered by when they happened and by when they were reported. */
    public static class DualTimeline {
        private String topic;
        private List<TimelineItem> byValidTime = new ArrayList<>();
        private List<TimelineItem> byObservationTime = new ArrayList<>();

        public DualTimeline() {}

        public DualTimeline(String topic, List<TimelineItem> byValidTime, List<TimelineItem> byObservationTime) {
            this.topic = topic;
            this.byValidTime = byValidTime;
            this.byObservationTime = byObservationTime;
        }

        public String getTopic() { return topic; }
        public void setTopic(String topic) { this.topic = topic; }
        public List<TimelineItem> getByValidTime() { return byValidTime; }
        public void setByValidTime(List<TimelineItem> byValidTime) { this.byValidTime = byValidTime; }
        public List<TimelineItem> getByObservationTime() { return byObservationTime; }
        public void setByObservationTime(List<TimelineItem> byObservationTime) { this.byObservationTime = byObservationTime; }
    }

    /** TimelineJS document: a title slide plus one slide per dated item. */
    public static class TimelineJs {
        private Slide title;
        private List<Slide> events = new ArrayList<>();

        public Slide getTitle() { return title; }
        public void setTitle(Slide title) { this.title = title; }
        public List<Slide> getEvents() { return events; }
        public void setEvents(List<Slide> events) { this.events = events; }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Slide {
        @JsonProperty("start_date")
        private SlideDate startDate; // absent on the title slide
        private SlideText text;

        public SlideDate getStartDate() { return startDate; }
        public void setStartDate(SlideDate startDate) { this.startDate = startDate; }
        public SlideText getText() { return text; }
        public void setText(SlideText text) { this.text = text; }
    }

    public static class SlideDate {
        private String year;
        private String month;
        private String day;

        public SlideDate() {}

        public SlideDate(String year, String month, String day) {
            this.year = year;
            this.month = month;
            this.day = day;
        }

        public String getYear() { return year; }
        public void setYear(String year) { this.year = year; }
        public String getMonth() { return month; }
        public void setMonth(String month) { this.month = month; }
        public String getDay() { return day; }
        public void setDay(String day) { this.day = day; }
    }

    public static class SlideText {
        private String headline;
        private String text;

        public SlideText() {}

        public SlideText(String headline, String text) {
            this.headline = headline;
            this.text = text;
        }

        public String getHeadline() { return headline; }
        public void setHeadline(String headline) { this.headline = headline; }
        public String getText() { return text; }
        public void setText(String text) { this.text = text; }
    }

    /** Statements grouped by stance; each group holds a few examples, counts cover all of them. */
    public static class Perspectives {
        private String topic;
        private Map<String, Integer> counts = new LinkedHashMap<>(); // pro/con/neutral/unset -> count
        private List<Statement> pro = new ArrayList<>();
        private List<Statement> con = new ArrayList<>();
        private List<Statement> neutral = new ArrayList<>();

        public String getTopic() { return topic; }
        public void setTopic(String topic) { this.topic = topic; }
        public Map<String, Integer> getCounts() { return counts; }
        public void setCounts(Map<String, Integer> counts) { this.counts = counts; }
        public List<Statement> getPro() { return pro; }
        public void setPro(List<Statement> pro) { this.pro = pro; }
        public List<Statement> getCon() { return con; }
        public void setCon(List<Statement> con) { this.con = con; }
        public List<Statement> getNeutral() { return neutral; }
        public void setNeutral(List<Statement> neutral) { this.neutral = neutral; }
    }
}
