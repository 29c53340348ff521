package com.architectai.generation.config;

import com.architectai.generation.dto.MigrationReport;
import com.architectai.generation.service.MigrationReconciler;
import com.architectai.generation.service.VersionStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class VersionStoreInitializerTest {

    @Mock
    private VersionStore versionStore;

    @Mock
    private MigrationReconciler migrationReconciler;

    @Test
    void loadsStableHistoriesBeforeMigrating() {
        when(migrationReconciler.reconcile()).thenReturn(MigrationReport.builder().legacyGroups(0).build());
        VersionStoreInitializer initializer = new VersionStoreInitializer(versionStore, migrationReconciler, true);
        assertThat(initializer.isReady()).isFalse();

        initializer.run(new DefaultApplicationArguments());

        InOrder order = inOrder(versionStore, migrationReconciler);
        order.verify(versionStore).reload();
        order.verify(migrationReconciler).reconcile();
        assertThat(initializer.isReady()).isTrue();
    }

    @Test
    void failedGroupsDoNotKeepTheServiceDown() {
        when(migrationReconciler.reconcile()).thenReturn(MigrationReport.builder()
                .legacyGroups(1)
                .failedGroup("mermaid_erd")
                .build());
        VersionStoreInitializer initializer = new VersionStoreInitializer(versionStore, migrationReconciler, true);

        initializer.run(new DefaultApplicationArguments());

        assertThat(initializer.isReady()).isTrue();
    }

    @Test
    void migrationCanBeDisabled() {
        VersionStoreInitializer initializer = new VersionStoreInitializer(versionStore, migrationReconciler, false);

        initializer.run(new DefaultApplicationArguments());

        verify(versionStore).reload();
        verifyNoInteractions(migrationReconciler);
        assertThat(initializer.isReady()).isTrue();
    }
}
