package com.hubrelay.webhooks.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** A branch or tag was created. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CreateEvent extends GitHubEvent {

    @JsonProperty("ref")
    private String ref;

    /** "branch" or "tag". */
    @JsonProperty("ref_type")
    private String refType;

    @JsonProperty("master_branch")
    private String masterBranch;

    @Override
    public EventKind getKind() { return EventKind.CREATE; }

    public String getRef()           { return ref; }
    public String getRefType()       { return refType; }
    public String getMasterBranch()  { return masterBranch; }

    public void setRef(String ref)                    { this.ref = ref; }
    public void setRefType(String refType)            { this.refType = refType; }
    public void setMasterBranch(String masterBranch)  { this.masterBranch = masterBranch; }
}
