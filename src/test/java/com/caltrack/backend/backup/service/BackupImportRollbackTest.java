package com.caltrack.backend.backup.service;

import com.caltrack.backend.common.tx.StorageFailureException;
import com.caltrack.backend.testsupport.BaseSpringTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.context.bean.override.mockito.MockitoSpyBean;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;

@SpringBootTest
class BackupImportRollbackTest extends BaseSpringTest {

    @Autowired BackupService backupService;

    // ✅ replaces @SpyBean (Spring Boot 3.4+)
    @MockitoSpyBean
    BackupImportWriter writer;

    private static final String DOC = """
        {
          "version": 1,
          "products": [
            {"id":"00000000-0000-0000-0000-000000000001","name":"Oats","calories":389,"isCustom":false},
            {"id":"00000000-0000-0000-0000-000000000002","name":"Milk","calories":64,"isCustom":false}
          ],
          "dailyLogs": [
            {"id":"00000000-0000-0000-0000-000000000003","date":"2026-01-15T00:00:00Z",
             "calorieTarget":2000,"proteinTarget":50,"carbTarget":250,"fatTarget":65}
          ]
        }
        """;

    @Test
    void storage_failure_after_partial_writes_rolls_everything_back() {
        doAnswer(inv -> {
            inv.callRealMethod();
            throw new DataIntegrityViolationException("disk full");
        }).when(writer).apply(any());

        assertThatThrownBy(() -> backupService.importBackup(DOC.getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(StorageFailureException.class)
                .hasMessage("STORAGE_WRITE_FAILED")
                .hasCauseInstanceOf(DataIntegrityViolationException.class);

        assertThat(productRepo.count()).isZero();
        assertThat(dayRepo.count()).isZero();
    }
}
