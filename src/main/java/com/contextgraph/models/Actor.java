package com.contextgraph.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Who produced evidence, approved, or acted.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Actor {

    private ActorType type;
    private String id;
    private String name;

    public Actor() {
    }

    public Actor(ActorType type, String id) {
        this(type, id, null);
    }

    public Actor(ActorType type, String id, String name) {
        this.type = type;
        this.id = id;
        this.name = name;
    }

    public static Actor agent(String id) {
        return new Actor(ActorType.AGENT, id);
    }

    public static Actor human(String id) {
        return new Actor(ActorType.HUMAN, id);
    }

    public ActorType getType() {
        return type;
    }

    public void setType(ActorType type) {
        this.type = type;
    }

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
