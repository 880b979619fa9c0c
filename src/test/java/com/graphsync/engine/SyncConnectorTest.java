package com.graphsync.engine;

import com.graphsync.exception.ChannelStateException;
import com.graphsync.exception.SchemaSyncException;
import com.graphsync.exception.SyncException;
import com.graphsync.exception.SourceDataException;
import com.graphsync.fixtures.ComponentConnector;
import com.graphsync.fixtures.FakeChannelControl;
import com.graphsync.fixtures.PlantConnector;
import com.graphsync.fixtures.SourceFiles;
import com.graphsync.loader.ApiConnection;
import com.graphsync.loader.FileConnection;
import com.graphsync.node.LoaderNode;
import com.graphsync.node.NodeKind;
import com.graphsync.repository.AspectProps;
import com.graphsync.repository.CoreSchema;
import com.graphsync.repository.InMemoryTargetRepository;
import com.graphsync.repository.ProvenanceRecord;
import com.graphsync.repository.RecordProps;
import com.graphsync.schema.SchemaVersion;
import com.graphsync.util.Checksums;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static com.graphsync.fixtures.ComponentConnector.*;
import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end tests of SyncConnector jobs against an in-memory repository.
 */
class SyncConnectorTest {

    private static final String HEADER = "graphsync - ";

    @TempDir
    Path tempDir;

    private Path source;
    private InMemoryTargetRepository repository;

    @BeforeEach
    void setUp() {
        source = tempDir.resolve("source.json");
        repository = new InMemoryTargetRepository();
    }

    private static ComponentConnector formed(ComponentConnector connector) {
        connector.form();
        return connector;
    }

    private SyncReport run(ComponentConnector connector, boolean enableDelete) {
        return connector.runJob(repository, JobArgs.builder()
                .connection(new FileConnection(LOADER, source))
                .containerKey(CONTAINER)
                .enableDelete(enableDelete)
                .build());
    }

    private SyncReport run(ComponentConnector connector) {
        return run(connector, true);
    }

    private RecordProps component(String pk) {
        return repository.getRecordsOfClass(COMPONENT_CLASS).stream()
                .filter(r -> r.getCode().getValue().equals("Component-" + pk))
                .findFirst()
                .orElseThrow();
    }

    private String containerId() {
        return repository.getRecordsOfClass(CoreSchema.SUBJECT).stream()
                .filter(r -> CONTAINER.equals(r.getUserLabel()))
                .map(RecordProps::getId)
                .findFirst()
                .orElseThrow();
    }

    @Test
    void testSingleComponentInsertedThenUpdated() throws Exception {
        SourceFiles.write(source, "{ \"Component\": [ { \"id\": \"1\", \"name\": \"A\" } ] }");

        SyncReport first = run(formed(new ComponentConnector()));

        assertThat(first.isSuccess()).isTrue();
        assertThat(repository.getRecordsOfClass(COMPONENT_CLASS)).hasSize(1);
        RecordProps record = component("1");
        assertThat(record.getProperties()).containsEntry("name", "A");
        ProvenanceRecord provenance = repository.listProvenance().stream()
                .filter(p -> p.getKind().equals("Component"))
                .findFirst()
                .orElseThrow();
        assertThat(provenance.getElementId()).isEqualTo(record.getId());
        assertThat(provenance.getIdentifier()).isEqualTo("Component-1");
        assertThat(provenance.getChecksum()).isEqualTo(Checksums.md5("{\"id\":\"1\",\"name\":\"A\"}"));

        SourceFiles.write(source, "{ \"Component\": [ { \"id\": \"1\", \"name\": \"B\" } ] }");
        SyncReport second = run(formed(new ComponentConnector()));

        assertThat(second.count(NodeKind.RECORD, ItemState.CHANGED)).isEqualTo(1);
        RecordProps updated = component("1");
        assertThat(updated.getId()).isEqualTo(record.getId());
        assertThat(updated.getCode()).isEqualTo(record.getCode());
        assertThat(updated.getProperties()).containsEntry("name", "B");
    }

    @Test
    void testFullSourceFirstRun() throws Exception {
        SourceFiles.write(source, SourceFiles.FULL_SOURCE);

        SyncReport report = run(formed(new ComponentConnector()));

        assertThat(report.getFinalState()).isEqualTo(RunState.DONE);
        assertThat(report.getSourceState()).isEqualTo(ItemState.NEW);
        assertThat(report.getSchemaState()).isEqualTo(ItemState.NEW);
        assertThat(report.count(NodeKind.LOADER, ItemState.NEW)).isEqualTo(1);
        assertThat(report.count(NodeKind.RECORD, ItemState.NEW)).isEqualTo(4);
        assertThat(report.count(NodeKind.LINK, ItemState.NEW)).isEqualTo(2);
        assertThat(report.skipped(NodeKind.LINK)).isEqualTo(1);
        assertThat(report.count(NodeKind.FOREIGN_KEY, ItemState.NEW)).isEqualTo(1);
        assertThat(report.getDeletedIds()).isEmpty();

        RecordProps category = repository.getRecordsOfClass(CATEGORY_CLASS).get(0);
        RecordProps one = component("1");
        RecordProps two = component("2");
        assertThat(category.getProperties()).containsEntry("label", "Pumps");
        assertThat(one.getCategory()).isEqualTo(category.getId());
        assertThat(two.getCategory()).isNull();
        assertThat(two.getReferences().get("owner").getId()).isEqualTo(one.getId());

        List<RecordProps> ports = repository.getRecordsOfClass("Core:PhysicalElement");
        assertThat(ports).singleElement().satisfies(port -> {
            assertThat(port.getParent()).isEqualTo(one.getId());
            assertThat(port.getUserLabel()).isEqualTo("Port p1");
        });

        assertThat(repository.getRelationships(CONNECTION_CLASS)).singleElement()
                .satisfies(r -> {
                    assertThat(r.getSourceId()).isEqualTo(one.getId());
                    assertThat(r.getTargetId()).isEqualTo(two.getId());
                });
        assertThat(repository.getRelationships(REFERS_TO)).singleElement()
                .satisfies(r -> {
                    assertThat(r.getSourceId()).isEqualTo(one.getId());
                    assertThat(r.getTargetId()).isEqualTo(containerId());
                });

        assertThat(repository.getRecordsOfClass(CoreSchema.REPOSITORY_LINK)).singleElement()
                .satisfies(link -> assertThat(link.getJsonProperties()).containsEntry("nodeKey", LOADER));
        assertThat(repository.getSchema("TestSchema").orElseThrow().getVersion()).isEqualTo(SchemaVersion.INITIAL);
        assertThat(repository.getChangesets()).containsExactly(
                HEADER + "Dynamic Schema Update",
                HEADER + "Container Update",
                HEADER + "Data Update");
    }

    @Test
    void testUnchangedSourceSkipsTheRun() throws Exception {
        SourceFiles.write(source, SourceFiles.FULL_SOURCE);
        run(formed(new ComponentConnector()));
        List<String> changesets = repository.getChangesets();

        SyncReport report = run(formed(new ComponentConnector()));

        assertThat(report.isSuccess()).isTrue();
        assertThat(report.getSourceState()).isEqualTo(ItemState.UNCHANGED);
        assertThat(report.getSchemaState()).isNull();
        assertThat(report.getWriteCount()).isZero();
        assertThat(repository.getChangesets()).isEqualTo(changesets);
    }

    @Test
    void testTouchedSourceLeavesRecordsUnchanged() throws Exception {
        SourceFiles.write(source, SourceFiles.FULL_SOURCE);
        run(formed(new ComponentConnector()));
        int changesets = repository.getChangesets().size();

        SourceFiles.touch(source);
        SyncReport report = run(formed(new ComponentConnector()));

        assertThat(report.getSourceState()).isEqualTo(ItemState.CHANGED);
        assertThat(report.getSchemaState()).isEqualTo(ItemState.UNCHANGED);
        assertThat(report.count(NodeKind.LOADER, ItemState.CHANGED)).isEqualTo(1);
        assertThat(report.count(NodeKind.RECORD, ItemState.UNCHANGED)).isEqualTo(4);
        assertThat(report.count(NodeKind.LINK, ItemState.UNCHANGED)).isEqualTo(2);
        assertThat(report.count(NodeKind.FOREIGN_KEY, ItemState.UNCHANGED)).isEqualTo(1);
        assertThat(report.getWriteCount()).isEqualTo(1);
        assertThat(repository.getChangesets()).hasSize(changesets + 1).last().isEqualTo(HEADER + "Data Update");
    }

    @Test
    void testContentChangeUpdatesOnlyThatRecord() throws Exception {
        SourceFiles.write(source, SourceFiles.FULL_SOURCE);
        run(formed(new ComponentConnector()));
        RecordProps before = component("2");

        SourceFiles.write(source, SourceFiles.FULL_SOURCE.replace("\"name\": \"B\"", "\"name\": \"Renamed\""));
        SyncReport report = run(formed(new ComponentConnector()));

        assertThat(report.count(NodeKind.RECORD, ItemState.CHANGED)).isEqualTo(1);
        assertThat(report.count(NodeKind.RECORD, ItemState.UNCHANGED)).isEqualTo(3);
        assertThat(report.count(NodeKind.FOREIGN_KEY, ItemState.UNCHANGED)).isEqualTo(1);
        RecordProps after = component("2");
        assertThat(after.getId()).isEqualTo(before.getId());
        assertThat(after.getProperties()).containsEntry("name", "Renamed");
        assertThat(after.getReferences()).containsKey("owner");
    }

    @Test
    void testRemovedRecordsAreDeleted() throws Exception {
        SourceFiles.write(source, SourceFiles.FULL_SOURCE);
        run(formed(new ComponentConnector()));
        String two = component("2").getId();

        SourceFiles.write(source, """
                {
                  "Category": [ { "id": "pump", "label": "Pumps" } ],
                  "Component": [ { "id": "1", "name": "A", "category": "pump" } ],
                  "Port": [ { "id": "p1", "componentId": "1" } ]
                }
                """);
        SyncReport report = run(formed(new ComponentConnector()));

        assertThat(report.getDeletedIds()).containsExactly(two);
        assertThat(repository.getRecordsOfClass(COMPONENT_CLASS)).extracting(RecordProps::getId)
                .containsExactly(component("1").getId());
        assertThat(repository.getRelationships(CONNECTION_CLASS)).isEmpty();
        assertThat(repository.listProvenance()).noneMatch(p -> p.getElementId().equals(two));
        assertThat(repository.getRecordsOfClass(CATEGORY_CLASS)).hasSize(1);
        assertThat(repository.getRecordsOfClass(CoreSchema.REPOSITORY_LINK)).hasSize(1);
    }

    @Test
    void testDeletionCanBeDisabled() throws Exception {
        SourceFiles.write(source, SourceFiles.FULL_SOURCE);
        run(formed(new ComponentConnector()));

        SourceFiles.write(source, "{ \"Component\": [ { \"id\": \"1\", \"name\": \"A\", \"category\": \"pump\" } ] }");
        SyncReport report = run(formed(new ComponentConnector()), false);

        assertThat(report.getDeletedIds()).isEmpty();
        assertThat(report.getKeptOrphans()).isEqualTo(3);
        assertThat(repository.getRecordsOfClass(COMPONENT_CLASS)).hasSize(2);
    }

    @Test
    void testDefinitionsAreDeletedAfterTheirUsers() throws Exception {
        SourceFiles.write(source, SourceFiles.FULL_SOURCE);
        run(formed(new ComponentConnector()));
        String one = component("1").getId();
        String category = repository.getRecordsOfClass(CATEGORY_CLASS).get(0).getId();

        SourceFiles.write(source, "{ \"Component\": [ { \"id\": \"2\", \"name\": \"B\" } ] }");
        SyncReport report = run(formed(new ComponentConnector()));

        assertThat(report.getDeletedIds()).containsExactly(one, category);
        assertThat(repository.getRecordsOfClass(CATEGORY_CLASS)).isEmpty();
        assertThat(repository.getRecordsOfClass("Core:PhysicalElement")).isEmpty();
        assertThat(component("2").getReferences()).isEmpty();
    }

    @Test
    void testReferencedDefinitionIsKept() throws Exception {
        SourceFiles.write(source, SourceFiles.FULL_SOURCE);
        run(formed(new ComponentConnector()));

        SourceFiles.write(source, "{ \"Component\": [ { \"id\": \"1\", \"name\": \"A\", \"category\": \"pump\" } ] }");
        run(formed(new ComponentConnector()));

        assertThat(repository.getRecordsOfClass(CATEGORY_CLASS)).hasSize(1);
        assertThat(component("1").getCategory()).isNotNull();
    }

    @Test
    void testDuplicateLinksAreInsertedOnce() throws Exception {
        SourceFiles.write(source, """
                {
                  "Component": [ { "id": "1", "name": "A" }, { "id": "2", "name": "B" } ],
                  "Connection": [
                    { "id": "c1", "from": "1", "to": "2" },
                    { "id": "c2", "from": "1", "to": "2" },
                    { "id": "c3", "from": "1", "to": "9" }
                  ]
                }
                """);

        SyncReport report = run(formed(new ComponentConnector()));

        assertThat(repository.getRelationships(CONNECTION_CLASS)).hasSize(1);
        assertThat(report.count(NodeKind.LINK, ItemState.NEW)).isEqualTo(1);
        assertThat(report.count(NodeKind.LINK, ItemState.UNCHANGED)).isEqualTo(1);
        assertThat(report.skipped(NodeKind.LINK)).isEqualTo(1);
    }

    @Test
    void testSchemaEvolvesWithDefinitions() throws Exception {
        SourceFiles.write(source, SourceFiles.FULL_SOURCE);
        run(formed(new ComponentConnector(false)));

        SourceFiles.touch(source);
        SyncReport evolved = run(formed(new ComponentConnector(true)));

        assertThat(evolved.getSchemaState()).isEqualTo(ItemState.CHANGED);
        assertThat(repository.querySchemaVersion("TestSchema")).contains(SchemaVersion.parse("01.00.01"));
        assertThat(repository.getSchema("TestSchema").orElseThrow().findEntityClass("Component").orElseThrow()
                .findProperty("material")).isPresent();
        assertThat(evolved.count(NodeKind.RECORD, ItemState.UNCHANGED)).isEqualTo(4);

        SourceFiles.touch(source);
        SyncReport stable = run(formed(new ComponentConnector(true)));

        assertThat(stable.getSchemaState()).isEqualTo(ItemState.UNCHANGED);
        assertThat(repository.querySchemaVersion("TestSchema")).contains(SchemaVersion.parse("01.00.01"));
    }

    @Test
    void testChannelProtocol() throws Exception {
        FakeChannelControl channel = new FakeChannelControl();
        repository = new InMemoryTargetRepository(channel);
        SourceFiles.write(source, SourceFiles.FULL_SOURCE);

        run(formed(new ComponentConnector()));

        assertThat(channel.calls).containsExactly(
                "startBulkMode",
                "lock 0x1", "pull", "push " + HEADER + "Domain Schema Update",
                "lock 0x1", "pull", "push " + HEADER + "Dynamic Schema Update",
                "lock 0x1", "pull", "push " + HEADER + "Container Update",
                "lock " + containerId(), "pull", "push " + HEADER + "Data Update");
        assertThat(channel.locks).isEmpty();
    }

    @Test
    void testPendingRequestsAbortTheJob() throws Exception {
        FakeChannelControl channel = new FakeChannelControl();
        channel.pendingRequests = true;
        repository = new InMemoryTargetRepository(channel);
        SourceFiles.write(source, SourceFiles.FULL_SOURCE);
        ComponentConnector connector = formed(new ComponentConnector());

        assertThatThrownBy(() -> run(connector))
                .isInstanceOf(ChannelStateException.class)
                .hasMessageContaining("requests are pending");
        assertThat(connector.getState()).isEqualTo(RunState.FAILED);
        assertThat(repository.getChangesets()).isEmpty();
    }

    @Test
    void testUnreleasedLockAbortsTheJob() throws Exception {
        FakeChannelControl channel = new FakeChannelControl();
        channel.keepLocksOnPush = true;
        repository = new InMemoryTargetRepository(channel);
        SourceFiles.write(source, SourceFiles.FULL_SOURCE);

        assertThatThrownBy(() -> run(formed(new ComponentConnector())))
                .isInstanceOf(ChannelStateException.class)
                .hasMessageContaining("previous channel 0x1 is still locked");
    }

    @Test
    void testRateLimitedLockIsRetried() throws Exception {
        FakeChannelControl channel = new FakeChannelControl();
        channel.rateLimitedLocks = 2;
        repository = new InMemoryTargetRepository(channel);
        SourceFiles.write(source, SourceFiles.FULL_SOURCE);
        List<Duration> sleeps = new ArrayList<>();

        SyncReport report = run(formed(new ComponentConnector(false, new RetryLoop(sleeps::add, new Random(7)))));

        assertThat(report.isSuccess()).isTrue();
        assertThat(sleeps).hasSize(2);
        assertThat(channel.calls).startsWith("startBulkMode", "rateLimited", "rateLimited", "lock 0x1");
    }

    @Test
    void testFailedJobAbandonsItsChanges() throws Exception {
        SourceFiles.write(source, SourceFiles.FULL_SOURCE);
        ComponentConnector misconfigured = formed(new ComponentConnector() {
            @Override
            public ConnectorConfig config() {
                return ConnectorConfig.builder().appId("graphsync-tests").connectorName("NoSchema").build();
            }
        });

        assertThatThrownBy(() -> run(misconfigured))
                .isInstanceOf(SchemaSyncException.class)
                .hasMessageContaining("no dynamic schema is configured");
        assertThat(misconfigured.getState()).isEqualTo(RunState.FAILED);
        assertThat(repository.hasPendingChanges()).isFalse();
        assertThat(repository.getChangesets()).isEmpty();

        SyncReport retry = run(formed(new ComponentConnector()));

        assertThat(retry.getSourceState()).isEqualTo(ItemState.NEW);
        assertThat(retry.isSuccess()).isTrue();
    }

    @Test
    void testMissingSourceFileFailsBeforeAnyWrite() {
        ComponentConnector connector = formed(new ComponentConnector());

        assertThatThrownBy(() -> run(connector))
                .isInstanceOf(SourceDataException.class);
        assertThat(repository.getChangesets()).isEmpty();
    }

    @Test
    void testApiSourcesAlwaysCountAsChanged() {
        ComponentConnector connector = formed(new ComponentConnector());
        LoaderNode loader = connector.getTree().findLoader(connector.getTree().findContainer(CONTAINER).orElseThrow())
                .orElseThrow();

        assertThat(loader.detectChange(new ApiConnection(LOADER, "https://example.org/api")))
                .isEqualTo(ItemState.CHANGED);
    }

    @Test
    void testSaveWritesTreeSnapshot() throws Exception {
        ComponentConnector connector = formed(new ComponentConnector());
        Path snapshot = tempDir.resolve("out/tree.json");

        connector.save(snapshot);

        assertThat(Files.readString(snapshot))
                .contains("\"ComponentNode\"")
                .contains("\"connectorName\" : \"ComponentConnector\"");
    }

    @Test
    void testAmbiguousLocatorSkipsTheLink() throws Exception {
        SourceFiles.write(source, """
                {
                  "Component": [ { "id": "1", "name": "A" }, { "id": "2", "name": "A" } ],
                  "ExternalLink": [ { "id": "e1", "component": "1", "locator": "ClassName=ts:Component; name=A" } ]
                }
                """);

        SyncReport report = run(formed(new ComponentConnector()));

        assertThat(report.getFinalState()).isEqualTo(RunState.DONE);
        assertThat(report.skipped(NodeKind.LINK)).isEqualTo(1);
        assertThat(report.count(NodeKind.LINK, ItemState.NEW)).isZero();
        assertThat(repository.getRelationships(REFERS_TO)).isEmpty();
    }

    private SyncReport runPlant() {
        PlantConnector connector = new PlantConnector();
        connector.form();
        return connector.runJob(repository, JobArgs.builder()
                .connection(new FileConnection(PlantConnector.LOADER, source))
                .containerKey(PlantConnector.CONTAINER)
                .enableDelete(true)
                .build());
    }

    private String assembly(String pk) {
        return repository.getRecordsOfClass(PlantConnector.ASSEMBLY_CLASS).stream()
                .filter(r -> r.getCode().getValue().equals("Assembly-" + pk))
                .map(RecordProps::getId)
                .findFirst()
                .orElseThrow();
    }

    private String plantId() {
        return repository.getRecordsOfClass(CoreSchema.SUBJECT).stream()
                .filter(r -> PlantConnector.CONTAINER.equals(r.getUserLabel()))
                .map(RecordProps::getId)
                .findFirst()
                .orElseThrow();
    }

    @Test
    void testModeledRecordsOwnASubCollection() throws Exception {
        SourceFiles.write(source, """
                {
                  "Assembly": [ { "id": "a1", "name": "Frame" }, { "id": "a2", "name": "Drive" } ],
                  "Part": [ { "id": "p1", "assemblyId": "a1" } ]
                }
                """);

        SyncReport first = runPlant();

        assertThat(first.isSuccess()).isTrue();
        assertThat(first.count(NodeKind.RECORD, ItemState.NEW)).isEqualTo(3);
        assertThat(first.count(NodeKind.MODELED_RECORD, ItemState.NEW)).isEqualTo(2);
        String a1 = assembly("a1");
        String a2 = assembly("a2");
        assertThat(repository.getCollection(a1)).hasValueSatisfying(collection -> {
            assertThat(collection.getClassFullName()).isEqualTo(CoreSchema.PHYSICAL_MODEL);
            assertThat(collection.isDefinition()).isFalse();
        });
        assertThat(repository.getCollection(a2)).isPresent();
        assertThat(repository.getRecordsOfClass("Core:PhysicalElement")).singleElement()
                .satisfies(part -> assertThat(part.getParent()).isEqualTo(a1));

        SourceFiles.write(source, """
                {
                  "Assembly": [ { "id": "a1", "name": "Frame v2" } ],
                  "Part": [ { "id": "p1", "assemblyId": "a1" } ]
                }
                """);
        SyncReport second = runPlant();

        assertThat(second.count(NodeKind.RECORD, ItemState.CHANGED)).isEqualTo(1);
        assertThat(second.count(NodeKind.MODELED_RECORD, ItemState.UNCHANGED)).isEqualTo(1);
        assertThat(second.count(NodeKind.MODELED_RECORD, ItemState.NEW)).isZero();
        assertThat(assembly("a1")).isEqualTo(a1);
        assertThat(second.getDeletedIds()).containsExactly(a2);
        assertThat(repository.getCollection(a2)).isEmpty();
        assertThat(repository.getCollection(a1)).isPresent();
    }

    @Test
    void testAspectsFollowTheirSourceRows() throws Exception {
        String assemblies = "\"Assembly\": [ { \"id\": \"a1\", \"name\": \"Frame\" }, "
                + "{ \"id\": \"a2\", \"name\": \"Drive\" } ]";
        String note = "\"Note\": [ { \"id\": \"n1\", \"target\": \"a2\", \"text\": \"check seals\" } ]";
        SourceFiles.write(source, "{ " + assemblies + ", " + note + ", "
                + "\"Rating\": [ { \"id\": \"r1\", \"assembly\": \"a1\", \"grade\": \"A\" } ] }");

        SyncReport first = runPlant();

        assertThat(first.isSuccess()).isTrue();
        assertThat(first.count(NodeKind.ASPECT, ItemState.NEW)).isEqualTo(2);
        String a1 = assembly("a1");
        String a2 = assembly("a2");
        AspectProps rating = repository.findAspect(a1, PlantConnector.RATING_CLASS).orElseThrow();
        assertThat(rating.getProperties()).containsEntry("grade", "A");
        assertThat(repository.getAspects(a2)).singleElement().satisfies(n -> {
            assertThat(n.getClassFullName()).isEqualTo(CoreSchema.UNIQUE_ASPECT);
            assertThat(n.getProperties()).containsEntry("text", "check seals");
        });
        ProvenanceRecord provenance = repository.listProvenance().stream()
                .filter(p -> p.getKind().equals("Rating"))
                .findFirst()
                .orElseThrow();
        assertThat(provenance.getElementId()).isEqualTo(a1);
        assertThat(provenance.getScope()).isEqualTo(plantId());
        assertThat(provenance.getIdentifier()).isEqualTo("Rating-r1");
        assertThat(repository.getSchema("TestSchema").orElseThrow().findEntityClass("AssemblyRating"))
                .hasValueSatisfying(c -> assertThat(c.getBaseClass()).isEqualTo(CoreSchema.UNIQUE_ASPECT));

        SourceFiles.touch(source);
        SyncReport unchanged = runPlant();

        assertThat(unchanged.count(NodeKind.ASPECT, ItemState.UNCHANGED)).isEqualTo(2);

        SourceFiles.write(source, "{ " + assemblies + ", " + note + ", "
                + "\"Rating\": [ { \"id\": \"r1\", \"assembly\": \"a1\", \"grade\": \"B\" } ] }");
        SyncReport regraded = runPlant();

        assertThat(regraded.count(NodeKind.ASPECT, ItemState.CHANGED)).isEqualTo(1);
        assertThat(repository.findAspect(a1, PlantConnector.RATING_CLASS)).hasValueSatisfying(r -> {
            assertThat(r.getId()).isEqualTo(rating.getId());
            assertThat(r.getProperties()).containsEntry("grade", "B");
        });

        SourceFiles.write(source, "{ " + assemblies + ", " + note + ", "
                + "\"Rating\": [ { \"id\": \"r1\", \"assembly\": \"a2\", \"grade\": \"B\" } ] }");
        SyncReport moved = runPlant();

        assertThat(moved.count(NodeKind.ASPECT, ItemState.NEW)).isEqualTo(1);
        assertThat(repository.getAspects(a1)).isEmpty();
        String movedId = repository.findAspect(a2, PlantConnector.RATING_CLASS).orElseThrow().getId();

        SourceFiles.write(source, "{ " + assemblies + ", " + note + " }");
        SyncReport removed = runPlant();

        assertThat(removed.getDeletedIds()).containsExactly(movedId);
        assertThat(repository.findAspect(a2, PlantConnector.RATING_CLASS)).isEmpty();
        assertThat(repository.getAspects(a2)).hasSize(1);
        assertThat(repository.listProvenance()).noneMatch(p -> p.getKind().equals("Rating"));
    }

    @Test
    void testAspectWithUnknownOwnerIsSkipped() throws Exception {
        SourceFiles.write(source, """
                {
                  "Assembly": [ { "id": "a1", "name": "Frame" } ],
                  "Rating": [ { "id": "r1", "assembly": "zz", "grade": "A" } ]
                }
                """);

        SyncReport report = runPlant();

        assertThat(report.getFinalState()).isEqualTo(RunState.DONE);
        assertThat(report.skipped(NodeKind.ASPECT)).isEqualTo(1);
        assertThat(repository.getAspects(assembly("a1"))).isEmpty();
    }

    @Test
    void testAspectWithoutElementFailsTheJob() throws Exception {
        SourceFiles.write(source, """
                {
                  "Assembly": [ { "id": "a1", "name": "Frame" } ],
                  "Note": [ { "id": "n1", "target": "zz", "text": "loose" } ]
                }
                """);

        assertThatThrownBy(this::runPlant).isInstanceOf(SyncException.class);
        assertThat(repository.getRecordsOfClass(PlantConnector.ASSEMBLY_CLASS)).isEmpty();
    }
}
