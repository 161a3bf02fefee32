package com.hubrelay.webhooks.model.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Author or committer identity as recorded in a git commit. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class GitUser {

    @JsonProperty("name")
    private String name;

    @JsonProperty("email")
    private String email;

    /** GitHub login, present only when the email maps to an account. */
    @JsonProperty("username")
    private String username;

    public String getName()      { return name; }
    public String getEmail()     { return email; }
    public String getUsername()  { return username; }

    public void setName(String name)          { this.name = name; }
    public void setEmail(String email)        { this.email = email; }
    public void setUsername(String username)  { this.username = username; }
}
