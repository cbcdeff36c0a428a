package com.example.devopsgateway.gateway;

import com.example.devopsgateway.config.GatewayProperties;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PendingResultStoreTest {

    private final PendingResultStore store = new PendingResultStore(new GatewayProperties());

    @Test
    void lifecycleFromPendingToCompleted() {
        store.begin("r-1", "get_logs", "dev-1");
        assertThat(store.pendingCount()).isEqualTo(1);

        store.complete("r-1", List.of("entry"));

        PendingResult result = store.find("r-1").orElseThrow();
        assertThat(result.getStatus()).isEqualTo(PendingResult.Status.COMPLETED);
        assertThat(result.getData()).isEqualTo(List.of("entry"));
        assertThat(result.getOwner()).isEqualTo("dev-1");
        assertThat(result.getCompletedAt()).isNotNull();
        assertThat(store.pendingCount()).isZero();
    }

    @Test
    void failureKeepsError() {
        store.begin("r-2", "get_metrics", "dev-1");
        store.fail("r-2", "Gateway call timed out after 30s");

        PendingResult result = store.find("r-2").orElseThrow();
        assertThat(result.getStatus()).isEqualTo(PendingResult.Status.FAILED);
        assertThat(result.getError()).contains("timed out");
        assertThat(result.getData()).isNull();
    }

    @Test
    void completingAnUnknownRequestDoesNotCreateIt() {
        store.complete("missing", "data");

        assertThat(store.find("missing")).isEmpty();
        assertThat(store.find(null)).isEmpty();
    }

    @Test
    void reusedIdDoesNotReplaceTheOwner() {
        store.begin("r-3", "get_logs", "alice");

        assertThatThrownBy(() -> store.begin("r-3", "get_metrics", "mallory"))
                .isInstanceOf(IllegalStateException.class);

        PendingResult result = store.find("r-3").orElseThrow();
        assertThat(result.getOwner()).isEqualTo("alice");
        assertThat(result.getOperation()).isEqualTo("get_logs");
    }
}
