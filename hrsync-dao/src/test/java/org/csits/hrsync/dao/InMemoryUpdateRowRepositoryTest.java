package org.csits.hrsync.dao;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryUpdateRowRepositoryTest {

    private InMemoryUpdateRowRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryUpdateRowRepository();
    }

    @Test
    void appendAll_assignsContiguousIndexesAcrossCalls() {
        repository.appendAll(Arrays.asList(
            UpdateRowEntity.staged("E001", "A"),
            UpdateRowEntity.staged("E002", "B")));
        repository.appendAll(Arrays.asList(UpdateRowEntity.staged("E003", "C")));

        List<UpdateRowEntity> all = repository.findAll();
        assertThat(all).extracting(UpdateRowEntity::getRowIndex).containsExactly(0, 1, 2);
        assertThat(all).extracting(UpdateRowEntity::getBusinessId).containsExactly("E001", "E002", "E003");
        assertThat(all).allMatch(r -> "PENDING".equals(r.getStatus()));
        assertThat(repository.count()).isEqualTo(3);
    }

    @Test
    void findRange_isHalfOpenAndOrdered() {
        for (int i = 0; i < 5; i++) {
            repository.appendAll(Arrays.asList(UpdateRowEntity.staged("E" + i, "v" + i)));
        }

        assertThat(repository.findRange(1, 4)).extracting(UpdateRowEntity::getRowIndex).containsExactly(1, 2, 3);
        assertThat(repository.findRange(4, 10)).extracting(UpdateRowEntity::getRowIndex).containsExactly(4);
        assertThat(repository.findRange(3, 3)).isEmpty();
    }

    @Test
    void update_writesResultColumnsAndReturnsFalseForUnknownRow() {
        repository.appendAll(Arrays.asList(UpdateRowEntity.staged("E001", "A")));
        UpdateRowEntity row = repository.findByRowIndex(0).orElseThrow(IllegalStateException::new);
        row.setStatus(UpdateRowStatus.FAILED.name());
        row.setHttpCode(404);
        row.setErrorMessage("record or field not found");

        assertThat(repository.update(row)).isTrue();

        UpdateRowEntity stored = repository.findByRowIndex(0).orElseThrow(IllegalStateException::new);
        assertThat(stored.getStatus()).isEqualTo("FAILED");
        assertThat(stored.getHttpCode()).isEqualTo(404);
        assertThat(stored.getUpdatedAt()).isNotNull();

        UpdateRowEntity ghost = UpdateRowEntity.staged("X", "Y");
        ghost.setRowIndex(99);
        assertThat(repository.update(ghost)).isFalse();
    }

    @Test
    void readsReturnCopies() {
        repository.appendAll(Arrays.asList(UpdateRowEntity.staged("E001", "A")));
        UpdateRowEntity row = repository.findByRowIndex(0).orElseThrow(IllegalStateException::new);
        row.setStatus(UpdateRowStatus.COMPLETED.name());

        assertThat(repository.findByRowIndex(0).get().getStatus()).isEqualTo("PENDING");
    }

    @Test
    void countByStatus_andFindByStatus() {
        repository.appendAll(Arrays.asList(
            UpdateRowEntity.staged("E001", "A"),
            UpdateRowEntity.staged("E002", "B"),
            UpdateRowEntity.staged("E003", "C")));
        UpdateRowEntity failed = repository.findByRowIndex(1).get();
        failed.setStatus(UpdateRowStatus.FAILED.name());
        repository.update(failed);

        Map<String, Long> counts = repository.countByStatus();
        assertThat(counts).containsEntry("PENDING", 2L).containsEntry("FAILED", 1L);
        assertThat(repository.findByStatus("FAILED")).extracting(UpdateRowEntity::getBusinessId).containsExactly("E002");
    }

    @Test
    void resetSettledNotFor_resetsOnlySettledRowsOfOtherFields() {
        repository.appendAll(Arrays.asList(
            UpdateRowEntity.staged("E001", "A"),
            UpdateRowEntity.staged("E002", "B"),
            UpdateRowEntity.staged("E003", "C"),
            UpdateRowEntity.staged("E004", "D")));
        settle(0, UpdateRowStatus.COMPLETED, "work.department");
        settle(1, UpdateRowStatus.SKIPPED, "work.title");
        settle(2, UpdateRowStatus.FAILED, "work.department");

        assertThat(repository.resetSettledNotFor("work.title")).isEqualTo(1);

        UpdateRowEntity reset = repository.findByRowIndex(0).get();
        assertThat(reset.getStatus()).isEqualTo("PENDING");
        assertThat(reset.getHttpCode()).isNull();
        assertThat(reset.getVerifiedValue()).isNull();
        assertThat(reset.getFieldPath()).isNull();
        assertThat(repository.findAll()).extracting(UpdateRowEntity::getStatus)
            .containsExactly("PENDING", "SKIPPED", "FAILED", "PENDING");
        assertThat(repository.resetSettledNotFor("work.title")).isZero();
    }

    private void settle(int rowIndex, UpdateRowStatus status, String fieldPath) {
        UpdateRowEntity row = repository.findByRowIndex(rowIndex).orElseThrow(IllegalStateException::new);
        row.setStatus(status.name());
        row.setHttpCode(200);
        row.setVerifiedValue("v");
        row.setFieldPath(fieldPath);
        repository.update(row);
    }

    @Test
    void deleteAll_resetsIndexes() {
        repository.appendAll(Arrays.asList(UpdateRowEntity.staged("E001", "A")));
        repository.deleteAll();
        repository.appendAll(Arrays.asList(UpdateRowEntity.staged("E009", "Z")));

        assertThat(repository.findAll()).extracting(UpdateRowEntity::getRowIndex).containsExactly(0);
    }
}
