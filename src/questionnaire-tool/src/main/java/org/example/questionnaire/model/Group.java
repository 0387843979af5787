package org.example.questionnaire.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/** A swimlane grouping of nodes, typically one questionnaire page or section. */
public record Group(String id, String label, Set<String> containedIds, Geometry geometry) {

    public Group {
        label = label == null ? "" : label;
        containedIds = Collections.unmodifiableSet(new LinkedHashSet<>(containedIds));
    }

    public Group withMember(String nodeId) {
        Set<String> copy = new LinkedHashSet<>(containedIds);
        copy.add(nodeId);
        return new Group(id, label, copy, geometry);
    }

    public Group withoutMember(String nodeId) {
        Set<String> copy = new LinkedHashSet<>(containedIds);
        copy.remove(nodeId);
        return new Group(id, label, copy, geometry);
    }
}
