package com.yammer.dropwizard.directoryauth;

import javax.validation.constraints.NotEmpty;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Settings shared by every kind of login provider: the registry tag used to pick the implementation plus the
 * optional id and display name the host uses to tell several providers of the same kind apart.
 */
public class AuthProviderConfiguration {

    @NotEmpty
    @JsonProperty
    private String type;

    @JsonProperty
    private String id;

    @JsonProperty
    private String name;

    protected AuthProviderConfiguration(String type) {
        this.type = type;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    /**
     * @return the provider id, or {@code null} when the host runs a single provider of this type
     */
    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }
}
