package com.hubrelay.webhooks.model.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/** The upstream webhook registration, as described in {@code ping} and {@code meta} payloads. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Hook {

    @JsonProperty("id")
    private long id;

    @JsonProperty("type")
    private String type;

    @JsonProperty("name")
    private String name;

    @JsonProperty("active")
    private boolean active;

    @JsonProperty("events")
    private List<String> events = new ArrayList<>();

    public long getId()              { return id; }
    public String getType()          { return type; }
    public String getName()          { return name; }
    public boolean isActive()        { return active; }
    public List<String> getEvents()  { return events; }

    public void setId(long id)                    { this.id = id; }
    public void setType(String type)              { this.type = type; }
    public void setName(String name)              { this.name = name; }
    public void setActive(boolean active)         { this.active = active; }
    public void setEvents(List<String> events)    { this.events = events; }
}
