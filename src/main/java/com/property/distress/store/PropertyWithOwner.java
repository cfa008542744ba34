package com.property.distress.store;

import com.property.distress.core.model.Owner;
import com.property.distress.core.model.Property;

import java.util.Objects;

/**
 * A property together with its owner, as loaded from the master parcel roll.
 *
 * @param property the property, unsaved or saved
 * @param owner    the owner, or null when the roll carries none
 */
public record PropertyWithOwner(Property property, Owner owner) {
    public PropertyWithOwner {
        Objects.requireNonNull(property, "property is required");
    }
}
