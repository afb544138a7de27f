package com.cronhooks.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.OffsetDateTime;

@JsonIgnoreProperties(ignoreUnknown = true)
public class Reminder {
    private String id;
    private String text;
    private OffsetDateTime datetime;

    public Reminder() {}

    public Reminder(String id, String text, OffsetDateTime datetime) {
        this.id = id;
        this.text = text;
        this.datetime = datetime;
    }

    public Reminder(Reminder other) {
        this(other.id, other.text, other.datetime);
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getText() { return text; }
    public void setText(String text) { this.text = text; }

    public OffsetDateTime getDatetime() { return datetime; }
    public void setDatetime(OffsetDateTime datetime) { this.datetime = datetime; }

    @Override
    public String toString() {
        return "Reminder{" +
                "id='" + id + '\'' +
                ", datetime=" + datetime +
                '}';
    }
}
