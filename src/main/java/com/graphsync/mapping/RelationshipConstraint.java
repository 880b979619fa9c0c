package com.graphsync.mapping;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * One end of a relationship class: which classes may appear there and how many of them.
 */
@Value
@Builder
@Jacksonized
public class RelationshipConstraint {
    boolean polymorphic;
    /**
     * Multiplicity in the {@code (lower..upper)} notation, e.g. {@code (0..*)}.
     */
    @Builder.Default
    String multiplicity = "(0..*)";
    String roleLabel;
    @Singular
    List<String> constraintClasses;
}
