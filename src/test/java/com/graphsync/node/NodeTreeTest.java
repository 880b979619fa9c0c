package com.graphsync.node;

import com.graphsync.engine.ConnectorConfig;
import com.graphsync.engine.JobArgs;
import com.graphsync.engine.SyncConnector;
import com.graphsync.exception.ConstructionException;
import com.graphsync.fixtures.ComponentConnector;
import com.graphsync.fixtures.PlantConnector;
import com.graphsync.loader.FileConnection;
import com.graphsync.loader.JsonLoader;
import com.graphsync.loader.LoaderProps;
import com.graphsync.mapping.AspectMapping;
import com.graphsync.mapping.ClassRef;
import com.graphsync.mapping.ElementMapping;
import com.graphsync.mapping.RelationshipMapping;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for NodeTree and the construction rules of the nodes.
 */
class NodeTreeTest {

    @TempDir
    Path tempDir;

    private SyncConnector connector;
    private ContainerNode container;

    @BeforeEach
    void setUp() {
        connector = new SyncConnector() {
            @Override
            public ConnectorConfig config() {
                return ConnectorConfig.builder().appId("test").connectorName("empty").build();
            }

            @Override
            public void form() {
                // nodes are added by the tests
            }
        };
        container = new ContainerNode(connector, "Project");
    }

    private static JsonLoader loader() {
        return new JsonLoader(LoaderProps.builder().format("json").entity("Pump").build());
    }

    private static ElementMapping pumps() {
        return ElementMapping.builder()
                .irEntity("Pump")
                .targetClass(ClassRef.existing("Core:PhysicalElement"))
                .build();
    }

    @Test
    void testDuplicateKeyIsRejected() {
        assertThatThrownBy(() -> new GroupNode(connector, "Project", container, GroupKind.PHYSICAL))
                .isInstanceOf(ConstructionException.class)
                .hasMessageContaining("Node key already exists");
    }

    @Test
    void testLoaderMustLiveInLinkGroup() {
        GroupNode physical = new GroupNode(connector, "Physical", container, GroupKind.PHYSICAL);

        assertThatThrownBy(() -> new LoaderNode(connector, "Loader", physical, loader()))
                .isInstanceOf(ConstructionException.class)
                .hasMessageContaining("must be placed in a LINK group");
    }

    @Test
    void testOneLoaderPerContainer() {
        GroupNode links = new GroupNode(connector, "Links", container, GroupKind.LINK);
        new LoaderNode(connector, "Loader", links, loader());

        assertThatThrownBy(() -> new LoaderNode(connector, "Loader2", links, loader()))
                .isInstanceOf(ConstructionException.class)
                .hasMessageContaining("already has loader node Loader");
    }

    @Test
    void testChildRecordsNeedParentAttr() {
        GroupNode physical = new GroupNode(connector, "Physical", container, GroupKind.PHYSICAL);
        RecordNode parent = new RecordNode(connector, "PumpNode", pumps(), RecordPlacement.inGroup(physical));

        assertThatThrownBy(() -> new RecordNode(connector, "PortNode", ElementMapping.builder()
                .irEntity("Port")
                .targetClass(ClassRef.existing("Core:PhysicalElement"))
                .build(), RecordPlacement.underParent(parent)))
                .isInstanceOf(ConstructionException.class)
                .hasMessageContaining("has no parentAttr");
    }

    @Test
    void testCategoryNeedsBothNodeAndAttr() {
        GroupNode physical = new GroupNode(connector, "Physical", container, GroupKind.PHYSICAL);

        assertThatThrownBy(() -> new RecordNode(connector, "PumpNode", ElementMapping.builder()
                .irEntity("Pump")
                .targetClass(ClassRef.existing("Core:PhysicalElement"))
                .categoryAttr("category")
                .build(), RecordPlacement.inGroup(physical)))
                .isInstanceOf(ConstructionException.class)
                .hasMessageContaining("category");
    }

    @Test
    void testLinkFromIrEntityNeedsSourceNode() {
        RelationshipMapping mapping = RelationshipMapping.builder()
                .irEntity("Feeds")
                .targetClass(ClassRef.existing("Core:ElementRefersToElements"))
                .fromAttr("from")
                .toAttr("to")
                .build();

        assertThatThrownBy(() -> new LinkNode(connector, "FeedsNode", container, mapping, null, null))
                .isInstanceOf(ConstructionException.class)
                .hasMessageContaining("needs the source record node");
    }

    @Test
    void testExecutionOrder() {
        ComponentConnector components = new ComponentConnector();
        components.form();

        assertThat(components.getTree().getNodes(ComponentConnector.CONTAINER))
                .extracting(Node::getKey)
                .containsExactly("Links", ComponentConnector.LOADER,
                        "Definitions", "CategoryNode",
                        "Physical", "ComponentNode", "PortNode",
                        "ConnectionNode", "ExternalLinkNode",
                        "OwnershipNode");
    }

    @Test
    void testClassMapCollectsDefinitions() {
        ComponentConnector components = new ComponentConnector();
        components.form();

        assertThat(components.getTree().getClassMap().getEntityClasses())
                .extracting(d -> d.getName())
                .containsExactlyInAnyOrder("ComponentCategory", "Component");
        assertThat(components.getTree().getClassMap().getRelationshipClasses())
                .extracting(d -> d.getName())
                .containsExactly("ComponentConnectsToComponent");
    }

    @Test
    void testModeledRecordsAndAspectsJoinTheTree() {
        PlantConnector plant = new PlantConnector();
        plant.form();

        assertThat(plant.getTree().getNodes(PlantConnector.CONTAINER))
                .extracting(Node::getKey)
                .containsExactly("Sources", PlantConnector.LOADER,
                        "Physical", "AssemblyNode", "PartNode",
                        "RatingNode", "NoteNode");
        assertThat(plant.getTree().find("AssemblyNode", NodeKind.MODELED_RECORD)).isPresent();
        assertThat(plant.getTree().getClassMap().getEntityClasses())
                .extracting(d -> d.getName())
                .containsExactlyInAnyOrder("Assembly", "AssemblyRating");
    }

    @Test
    void testAspectNodeNeedsAWayToItsOwner() {
        AspectMapping notes = AspectMapping.builder()
                .irEntity("Note")
                .targetClass(ClassRef.existing("Core:UniqueAspect"))
                .build();

        assertThatThrownBy(() -> new AspectNode(connector, "NoteNode", container, notes, null))
                .isInstanceOf(ConstructionException.class);
        GroupNode physical = new GroupNode(connector, "Physical", container, GroupKind.PHYSICAL);
        RecordNode owner = new RecordNode(connector, "PumpNode", pumps(), RecordPlacement.inGroup(physical));
        assertThatThrownBy(() -> new AspectNode(connector, "NoteNode", container, notes, owner))
                .isInstanceOf(ConstructionException.class)
                .hasMessageContaining("ownerAttr");
    }

    @Test
    void testValidateJob() throws Exception {
        Path source = Files.writeString(tempDir.resolve("source.json"), "{}");

        assertThatThrownBy(() -> connector.getTree().validate(JobArgs.builder()
                .connection(new FileConnection("Loader", source))
                .containerKey("Project")
                .build()))
                .isInstanceOf(ConstructionException.class)
                .hasMessageContaining("has no loader node");

        GroupNode links = new GroupNode(connector, "Links", container, GroupKind.LINK);
        LoaderNode loaderNode = new LoaderNode(connector, "Loader", links, loader());

        assertThat(connector.getTree().validate(JobArgs.builder()
                .connection(new FileConnection("Loader", source))
                .containerKey("Project")
                .build())).isSameAs(loaderNode);
        assertThatThrownBy(() -> connector.getTree().validate(JobArgs.builder()
                .connection(new FileConnection("Other", source))
                .containerKey("Project")
                .build()))
                .isInstanceOf(ConstructionException.class)
                .hasMessageContaining("is loaded by Loader");
        assertThatThrownBy(() -> connector.getTree().validate(JobArgs.builder()
                .connection(new FileConnection("Loader", source))
                .containerKey("Elsewhere")
                .build()))
                .isInstanceOf(ConstructionException.class)
                .hasMessageContaining("No container node named Elsewhere");
    }

    @Test
    void testToJsonListsEveryNode() {
        GroupNode physical = new GroupNode(connector, "Physical", container, GroupKind.PHYSICAL);
        new RecordNode(connector, "PumpNode", pumps(), RecordPlacement.inGroup(physical));

        assertThat(connector.getTree().toJson())
                .extracting(json -> json.get("key"))
                .containsExactly("Project", "Physical", "PumpNode");
    }
}
