package com.hubrelay.webhooks.model.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * An issue / pull request label.
 *
 * Two labels are equal when their GitHub ids are equal, so a label renamed
 * between two deliveries still matches itself.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Label {

    @JsonProperty("id")
    private long id;

    @JsonProperty("name")
    private String name;

    /** Hex colour without the leading '#'. */
    @JsonProperty("color")
    private String color;

    @JsonProperty("description")
    private String description;

    @JsonProperty("default")
    private boolean defaultLabel;

    public Label() {}

    public Label(long id, String name, String color) {
        this.id = id;
        this.name = name;
        this.color = color;
    }

    public long getId()              { return id; }
    public String getName()          { return name; }
    public String getColor()         { return color; }
    public String getDescription()   { return description; }
    public boolean isDefaultLabel()  { return defaultLabel; }

    public void setId(long id)                       { this.id = id; }
    public void setName(String name)                 { this.name = name; }
    public void setColor(String color)               { this.color = color; }
    public void setDescription(String description)   { this.description = description; }
    public void setDefaultLabel(boolean defaultLabel) { this.defaultLabel = defaultLabel; }

    @Override
    public boolean equals(Object o) {
        return o instanceof Label other && id == other.id;
    }

    @Override
    public int hashCode() { return Objects.hashCode(id); }

    @Override
    public String toString() {
        return "Label{id=" + id + ", name='" + name + "'}";
    }
}
