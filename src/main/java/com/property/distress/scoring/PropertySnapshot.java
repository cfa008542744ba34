package com.property.distress.scoring;

import com.property.distress.core.model.Owner;
import com.property.distress.core.model.Property;
import com.property.distress.core.model.ViolationDetails;

import java.util.List;
import java.util.Objects;

/**
 * Everything the scoring model reads about one property.
 *
 * @param property   the property, which must carry an id
 * @param owner      its owner, or null
 * @param violations every violation on the property, open or closed
 */
public record PropertySnapshot(Property property, Owner owner, List<ViolationDetails> violations) {

    public PropertySnapshot {
        Objects.requireNonNull(property, "property is required");
        Objects.requireNonNull(property.getId(), "property must be saved before it is scored");
        violations = violations != null ? List.copyOf(violations) : List.of();
    }

    public List<ViolationDetails> openViolations() {
        return violations.stream().filter(ViolationDetails::isOpen).toList();
    }
}
