package com.autohistorian.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** A named entity mentioned in a document. Not deduplicated across documents. */
public class Entity {
    private String id;
    private String name;
    private String category; // person, organization, location, law, ...
    private List<String> aliases = new ArrayList<>();
    private String description;

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getCategory() { return category; }
    public void setCategory(String category) { this.category = category; }

    public List<String> getAliases() { return aliases; }
    public void setAliases(List<String> aliases) { this.aliases = aliases != null ? aliases : new ArrayList<>(); }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Entity)) return false;
        Entity that = (Entity) o;
        return Objects.equals(id, that.id)
                && Objects.equals(name, that.name)
                && Objects.equals(category, that.category)
                && Objects.equals(aliases, that.aliases)
                && Objects.equals(description, that.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, category);
    }
}
