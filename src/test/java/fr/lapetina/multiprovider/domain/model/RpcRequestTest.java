package fr.lapetina.multiprovider.domain.model;

import fr.lapetina.multiprovider.domain.exception.InvalidRequestException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RpcRequestTest {

    @Test
    @DisplayName("should expose batch methods in order")
    void shouldExposeBatchMethods() {
        RpcRequest request = RpcRequest.batch(List.of(
                RpcCall.of("eth_blockNumber", null),
                RpcCall.of("eth_chainId", null)
        ));

        assertThat(request.isBatch()).isTrue();
        assertThat(request.target()).isEqualTo("batch");
        assertThat(request.methods()).containsExactly("eth_blockNumber", "eth_chainId");
    }

    @Test
    @DisplayName("should reject blank JSON-RPC method")
    void shouldRejectBlankMethod() {
        assertThatThrownBy(() -> RpcRequest.jsonRpc(" ", null))
                .isInstanceOf(InvalidRequestException.class);
    }

    @Test
    @DisplayName("should reject empty batch")
    void shouldRejectEmptyBatch() {
        assertThatThrownBy(() -> RpcRequest.batch(List.of()))
                .isInstanceOf(InvalidRequestException.class);
    }

    @Test
    @DisplayName("should reject relative REST path")
    void shouldRejectRelativePath() {
        assertThatThrownBy(() -> RpcRequest.get("eth/v1/node/health"))
                .isInstanceOf(InvalidRequestException.class);
    }

    @Test
    @DisplayName("should have no JSON-RPC methods for REST requests")
    void shouldHaveNoMethodsForRest() {
        assertThat(RpcRequest.get("/eth/v1/node/health").methods()).isEmpty();
    }
}
