package com.hubrelay.webhooks.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** A branch or tag was deleted. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DeleteEvent extends GitHubEvent {

    @JsonProperty("ref")
    private String ref;

    @JsonProperty("ref_type")
    private String refType;

    @Override
    public EventKind getKind() { return EventKind.DELETE; }

    public String getRef()      { return ref; }
    public String getRefType()  { return refType; }

    public void setRef(String ref)          { this.ref = ref; }
    public void setRefType(String refType)  { this.refType = refType; }
}
