package spl.idstring.model;

import spl.idstring.template.AttributeSource;

/**
 * Entity whose synthetic name is assigned once, after its collection has been sorted.
 */
public abstract class CanonicalEntity implements AttributeSource {

    private String name;

    public String name() {
        if (name == null) {
            throw new IllegalStateException(getClass().getSimpleName() + " has not been named yet");
        }
        return name;
    }

    public boolean isNamed() {
        return name != null;
    }

    void assignName(String name) {
        if (this.name != null) {
            throw new IllegalStateException(getClass().getSimpleName() + " already named " + this.name);
        }
        this.name = name;
    }
}
