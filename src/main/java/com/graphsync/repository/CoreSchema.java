package com.graphsync.repository;

import com.graphsync.mapping.ClassDefinition;
import com.graphsync.mapping.RelationshipClassDefinition;
import com.graphsync.mapping.RelationshipConstraint;
import com.graphsync.mapping.StrengthType;
import com.graphsync.schema.DynamicSchema;
import com.graphsync.schema.SchemaVersion;

/**
 * Built-in base schema every repository starts with. Containers, groups and loader records use its classes.
 */
public final class CoreSchema {

    public static final String NAME = "Core";
    public static final String ALIAS = "core";

    public static final String ELEMENT = "Core:Element";
    public static final String SUBJECT = "Core:Subject";
    public static final String PHYSICAL_PARTITION = "Core:PhysicalPartition";
    public static final String DEFINITION_PARTITION = "Core:DefinitionPartition";
    public static final String SPATIAL_LOCATION_PARTITION = "Core:SpatialLocationPartition";
    public static final String GROUP_INFORMATION_PARTITION = "Core:GroupInformationPartition";
    public static final String DOCUMENT_PARTITION = "Core:DocumentPartition";
    public static final String LINK_PARTITION = "Core:LinkPartition";
    public static final String REPOSITORY_MODEL = "Core:RepositoryModel";
    public static final String PHYSICAL_MODEL = "Core:PhysicalModel";
    public static final String DEFINITION_MODEL = "Core:DefinitionModel";
    public static final String SPATIAL_LOCATION_MODEL = "Core:SpatialLocationModel";
    public static final String GROUP_INFORMATION_MODEL = "Core:GroupInformationModel";
    public static final String DOCUMENT_LIST_MODEL = "Core:DocumentListModel";
    public static final String LINK_MODEL = "Core:LinkModel";
    public static final String REPOSITORY_LINK = "Core:RepositoryLink";
    public static final String ELEMENT_ASPECT = "Core:ElementAspect";
    public static final String UNIQUE_ASPECT = "Core:UniqueAspect";
    public static final String ELEMENT_REFERS_TO_ELEMENTS = "Core:ElementRefersToElements";
    public static final String ELEMENT_OWNS_CHILD_ELEMENTS = "Core:ElementOwnsChildElements";

    private static final String[] ENTITY_CLASSES = {
            "Element", "Subject", "InformationPartition", "PhysicalPartition", "DefinitionPartition",
            "SpatialLocationPartition", "GroupInformationPartition", "DocumentPartition", "LinkPartition",
            "Model", "RepositoryModel", "PhysicalModel", "DefinitionModel", "SpatialLocationModel",
            "GroupInformationModel", "DocumentListModel", "LinkModel", "PhysicalElement", "PhysicalType",
            "DefinitionElement", "Category", "SpatialLocationElement", "GroupInformationElement", "Document",
            "InformationRecordElement", "UrlLink", "RepositoryLink"
    };

    private CoreSchema() {
        // Utility class
    }

    public static DynamicSchema create() {
        DynamicSchema.DynamicSchemaBuilder builder = DynamicSchema.builder()
                .name(NAME)
                .alias(ALIAS)
                .version(SchemaVersion.INITIAL);
        for (String name : ENTITY_CLASSES) {
            builder.entityClass(ClassDefinition.builder()
                    .name(name)
                    .baseClass(name.equals("Element") ? "" : ELEMENT)
                    .build());
        }
        builder.entityClass(ClassDefinition.builder()
                .name("ElementAspect")
                .baseClass("")
                .build());
        builder.entityClass(ClassDefinition.builder()
                .name("UniqueAspect")
                .baseClass(ELEMENT_ASPECT)
                .build());
        RelationshipConstraint anyElement = RelationshipConstraint.builder()
                .polymorphic(true)
                .constraintClass(ELEMENT)
                .build();
        builder.relationshipClass(RelationshipClassDefinition.builder()
                .name("ElementRefersToElements")
                .baseClass("")
                .strength(StrengthType.REFERENCING)
                .source(anyElement)
                .target(anyElement)
                .build());
        builder.relationshipClass(RelationshipClassDefinition.builder()
                .name("ElementOwnsChildElements")
                .baseClass("")
                .strength(StrengthType.EMBEDDING)
                .source(anyElement)
                .target(anyElement)
                .build());
        return builder.build();
    }
}
