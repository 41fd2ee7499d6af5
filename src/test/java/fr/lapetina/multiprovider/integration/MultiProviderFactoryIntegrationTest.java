package fr.lapetina.multiprovider.integration;

import fr.lapetina.multiprovider.domain.exception.NoActiveProviderException;
import fr.lapetina.multiprovider.domain.model.Layer;
import fr.lapetina.multiprovider.domain.model.RpcResponse;
import fr.lapetina.multiprovider.domain.policy.FallbackPolicy;
import fr.lapetina.multiprovider.domain.policy.RotatingPolicy;
import fr.lapetina.multiprovider.failover.FailoverProvider;
import fr.lapetina.multiprovider.infrastructure.http.StubEndpointClient;
import fr.lapetina.multiprovider.infrastructure.metrics.MicrometerMetricsSink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Integration tests for configuration-built provider pools.
 * Configuration is externalized to test-config.yaml.
 */
class MultiProviderFactoryIntegrationTest {

    private TestMultiProviderFactory factory;

    @BeforeEach
    void setUp() {
        factory = TestMultiProviderFactory.create();
    }

    @AfterEach
    void tearDown() {
        if (factory != null) {
            factory.close();
        }
    }

    private static void refuse(StubEndpointClient stub) {
        stub.setResponder(request -> {
            throw new ConnectException("Connection refused");
        });
    }

    @Test
    @DisplayName("should build pools with the configured policy and layer")
    void shouldBuildConfiguredPools() {
        FailoverProvider execution = factory.getProvider("execution");
        FailoverProvider beacon = factory.getProvider("beacon");

        assertThat(execution.getLayer()).isEqualTo(Layer.EXECUTION);
        assertThat(execution.getPolicy()).isInstanceOf(RotatingPolicy.class);
        assertThat(execution.getPool()).hasSize(2);
        assertThat(beacon.getLayer()).isEqualTo(Layer.CONSENSUS);
        assertThat(beacon.getPolicy()).isInstanceOf(FallbackPolicy.class);
        assertThat(factory.getProviders()).hasSize(2);
    }

    @Test
    @DisplayName("should label endpoints with the configured chain")
    void shouldUseConfiguredIdentity() {
        assertThat(factory.getProvider("execution").getPool())
                .allSatisfy(client -> {
                    assertThat(client.getIdentity().chainId()).isEqualTo("17000");
                    assertThat(client.getIdentity().network()).isEqualTo("holesky");
                });
        assertThat(factory.getChainRegistry().networkOf("1337")).isEqualTo("devnet");
    }

    @Test
    @DisplayName("should fail over and publish metrics with configured prefix")
    void shouldFailOverAndPublishMetrics() {
        FailoverProvider execution = factory.getProvider("execution");
        refuse(factory.stub("http://127.0.0.1:9001"));

        RpcResponse response = execution.call("eth_blockNumber", null);

        assertThat(response.provider()).isEqualTo("127.0.0.1:9002");
        String scrape = ((MicrometerMetricsSink) factory.getMetricsSink()).scrape();
        assertThat(scrape)
                .contains("test_rpc_request_total")
                .contains("network=\"holesky\"")
                .contains("result=\"fail\"")
                .contains("result=\"success\"");
    }

    @Test
    @DisplayName("should route consensus requests through the fallback pool")
    void shouldRouteConsensusRequests() {
        factory.stub("http://127.0.0.1:5052").setResponder(request ->
                StubEndpointClient.ok("{\"data\":{\"is_syncing\":false}}"));

        RpcResponse response = factory.getProvider("beacon").get("/eth/v1/node/syncing");

        assertThat(response.result().path("data").path("is_syncing").asBoolean()).isFalse();
        assertThat(factory.stub("http://127.0.0.1:5053").getRequestCount()).isZero();
    }

    @Test
    @DisplayName("should report exhaustion when every endpoint fails")
    void shouldReportExhaustion() {
        refuse(factory.stub("http://127.0.0.1:9001"));
        refuse(factory.stub("http://127.0.0.1:9002"));

        assertThatThrownBy(() -> factory.getProvider("execution").call("eth_blockNumber", null))
                .isInstanceOf(NoActiveProviderException.class);
    }

    @Test
    @DisplayName("should reject unknown provider names")
    void shouldRejectUnknownProvider() {
        assertThatThrownBy(() -> factory.getProvider("missing"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(factory.findProvider("missing")).isEmpty();
    }

    @Test
    @DisplayName("should close endpoint clients on shutdown")
    void shouldCloseClients() {
        StubEndpointClient stub = factory.stub("http://127.0.0.1:9001");

        factory.close();
        factory = null;

        assertThat(stub.isClosed()).isTrue();
    }
}
