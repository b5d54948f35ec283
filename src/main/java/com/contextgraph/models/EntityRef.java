package com.contextgraph.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Weak reference to a business entity (account, ticket, opportunity).
 * Purely descriptive; aliases are alternate identifiers in no particular order.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class EntityRef {

    private String namespace;
    private String type;
    private String id;
    private List<String> aliases = new ArrayList<>();

    public EntityRef() {
    }

    public EntityRef(String namespace, String type, String id) {
        this.namespace = namespace;
        this.type = type;
        this.id = id;
    }

    public String getNamespace() {
        return namespace;
    }

    public void setNamespace(String namespace) {
        this.namespace = namespace;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public List<String> getAliases() {
        return aliases;
    }

    public void setAliases(List<String> aliases) {
        this.aliases = aliases != null ? new ArrayList<>(aliases) : new ArrayList<>();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EntityRef)) return false;
        EntityRef other = (EntityRef) o;
        return Objects.equals(namespace, other.namespace)
            && Objects.equals(type, other.type)
            && Objects.equals(id, other.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(namespace, type, id);
    }

    @Override
    public String toString() {
        return namespace + ":" + type + ":" + id;
    }
}
