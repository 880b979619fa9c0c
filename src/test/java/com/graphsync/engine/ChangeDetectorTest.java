package com.graphsync.engine;

import com.graphsync.repository.Code;
import com.graphsync.repository.InMemoryTargetRepository;
import com.graphsync.repository.ProvenanceRecord;
import com.graphsync.repository.RecordProps;
import com.graphsync.repository.TargetRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ChangeDetector.
 */
class ChangeDetectorTest {

    private static final String SCOPE = TargetRepository.ROOT_ID;

    private InMemoryTargetRepository repository;
    private ChangeDetector detector;
    private String specId;

    @BeforeEach
    void setUp() {
        repository = new InMemoryTargetRepository();
        detector = new ChangeDetector(repository);
        specId = repository.insertCodeSpec(CodeSpecs.RECORD);
    }

    private SyncArg arg(String name, String version, String checksum) {
        RecordProps props = RecordProps.builder()
                .classFullName("Core:PhysicalElement")
                .model(SCOPE)
                .code(Code.of(specId, SCOPE, "Pump-1"))
                .userLabel("1")
                .properties(new LinkedHashMap<>(Map.of("name", name)))
                .build();
        return SyncArg.builder()
                .props(props)
                .version(version)
                .checksum(checksum)
                .scope(SCOPE)
                .kind("Pump")
                .identifier("Pump-1")
                .build();
    }

    @Test
    void testFirstSyncInsertsWithProvenance() {
        SyncResult result = detector.syncRecord(arg("A", "1", "aaa"));

        assertThat(result.state()).isEqualTo(ItemState.NEW);
        assertThat(repository.getRecord(result.entityId())).isPresent();
        ProvenanceRecord provenance = repository.findProvenance(SCOPE, "Pump", "Pump-1").orElseThrow();
        assertThat(provenance.getElementId()).isEqualTo(result.entityId());
        assertThat(provenance.fingerprint()).isEqualTo("1aaa");
    }

    @Test
    void testSameFingerprintIsUnchanged() {
        String id = detector.syncRecord(arg("A", "1", "aaa")).entityId();

        SyncResult result = detector.syncRecord(arg("ignored", "1", "aaa"));

        assertThat(result).isEqualTo(new SyncResult(id, ItemState.UNCHANGED));
        assertThat(repository.getRecord(id).orElseThrow().getProperties()).containsEntry("name", "A");
    }

    @Test
    void testChecksumChangeUpdatesInPlace() {
        String id = detector.syncRecord(arg("A", "1", "aaa")).entityId();

        SyncResult result = detector.syncRecord(arg("B", "1", "bbb"));

        assertThat(result).isEqualTo(new SyncResult(id, ItemState.CHANGED));
        assertThat(repository.getRecord(id).orElseThrow().getProperties()).containsEntry("name", "B");
        assertThat(repository.findProvenance(SCOPE, "Pump", "Pump-1").orElseThrow().getChecksum()).isEqualTo("bbb");
    }

    @Test
    void testVersionChangeAloneIsChanged() {
        detector.syncRecord(arg("A", "1", "aaa"));

        assertThat(detector.syncRecord(arg("A", "2", "aaa")).state()).isEqualTo(ItemState.CHANGED);
    }

    @Test
    void testRecordWithoutProvenanceIsAdopted() {
        String id = repository.insertRecord(arg("A", "1", "aaa").getProps());

        SyncResult result = detector.syncRecord(arg("A", "1", "aaa"));

        assertThat(result).isEqualTo(new SyncResult(id, ItemState.NEW));
        assertThat(repository.listProvenance()).hasSize(1);
    }

    @Test
    void testStaleProvenanceIsDropped() {
        String id = repository.insertRecord(RecordProps.builder()
                .classFullName("Core:PhysicalElement")
                .model(SCOPE)
                .userLabel("other")
                .build());
        repository.insertProvenance(ProvenanceRecord.builder()
                .elementId(id)
                .scope(SCOPE)
                .kind("Pump")
                .identifier("Pump-1")
                .version("1")
                .checksum("aaa")
                .build());

        SyncResult result = detector.syncRecord(arg("A", "1", "aaa"));

        assertThat(result.state()).isEqualTo(ItemState.NEW);
        assertThat(result.entityId()).isNotEqualTo(id);
        assertThat(repository.listProvenance())
                .extracting(ProvenanceRecord::getElementId)
                .containsExactly(result.entityId());
    }

    @Test
    void testClassifyDoesNotWrite() {
        assertThat(detector.classify(SCOPE, "Pump", "Pump-1", "1", "aaa")).isEqualTo(ItemState.NEW);

        String id = detector.syncRecord(arg("A", "1", "aaa")).entityId();
        repository.commit("insert");

        assertThat(detector.classify(SCOPE, "Pump", "pump-1", "1", "aaa")).isEqualTo(ItemState.UNCHANGED);
        assertThat(detector.classify(SCOPE, "Pump", "Pump-1", "2", "aaa")).isEqualTo(ItemState.CHANGED);
        assertThat(repository.hasPendingChanges()).isFalse();

        repository.deleteRecord(id);
        assertThat(detector.classify(SCOPE, "Pump", "Pump-1", "1", "aaa")).isEqualTo(ItemState.NEW);
    }
}
