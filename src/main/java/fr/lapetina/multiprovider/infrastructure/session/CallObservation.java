package fr.lapetina.multiprovider.infrastructure.session;

import fr.lapetina.multiprovider.domain.model.CallStatus;
import fr.lapetina.multiprovider.domain.model.EndpointIdentity;
import fr.lapetina.multiprovider.infrastructure.metrics.MetricsSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Observations of one request/response cycle against one endpoint.
 *
 * Confined to the invocation that created it. Starts out as a failure for every
 * method label; {@link #emit} publishes everything to the sink and can only run once.
 */
final class CallObservation {

    private static final Logger log = LoggerFactory.getLogger(CallObservation.class);

    private final EndpointIdentity identity;
    private final List<String> methods;
    private final boolean batched;
    private final long requestBytes;
    private final List<CallStatus> statuses;
    private final List<String> errorCodes;

    private long startNanos;
    private long elapsedNanos = -1;
    private long responseBytes = -1;
    private int statusCode;
    private CallStatus httpStatus = CallStatus.FAIL;
    private boolean emitted;

    CallObservation(EndpointIdentity identity, List<String> methods, boolean batched, long requestBytes) {
        this.identity = identity;
        this.methods = methods.isEmpty() ? List.of("") : methods;
        this.batched = batched;
        this.requestBytes = requestBytes;
        this.statuses = new ArrayList<>(this.methods.size());
        this.errorCodes = new ArrayList<>(this.methods.size());
        for (int i = 0; i < this.methods.size(); i++) {
            statuses.add(CallStatus.FAIL);
            errorCodes.add("");
        }
    }

    void start() {
        startNanos = System.nanoTime();
    }

    /**
     * Stops the latency clock; a second call has no effect.
     */
    void stop() {
        if (elapsedNanos < 0) {
            elapsedNanos = System.nanoTime() - startNanos;
        }
    }

    void responseReceived(int statusCode, long payloadSize) {
        stop();
        this.statusCode = statusCode;
        this.responseBytes = payloadSize;
    }

    void httpSucceeded() {
        httpStatus = CallStatus.SUCCESS;
    }

    /**
     * Records the outcome of the call at {@code position} in payload order.
     */
    void outcome(int position, CallStatus status, String errorCode) {
        if (position < 0 || position >= methods.size()) {
            return;
        }
        statuses.set(position, status);
        errorCodes.set(position, errorCode != null ? errorCode : "");
    }

    int size() {
        return methods.size();
    }

    void emit(MetricsSink sink) {
        if (emitted) {
            return;
        }
        emitted = true;
        stop();
        try {
            sink.observeLatency(identity, Duration.ofNanos(elapsedNanos));
            sink.observeRequestPayload(identity, requestBytes);
            if (responseBytes >= 0) {
                sink.observeResponsePayload(identity, responseBytes);
            }
            if (batched) {
                sink.observeBatchSize(identity, methods.size());
            }
            sink.incrementHttpRequest(identity, batched, statusCode > 0 ? String.valueOf(statusCode) : "", httpStatus);
            for (int i = 0; i < methods.size(); i++) {
                sink.incrementRequest(identity.labels(methods.get(i), statuses.get(i), errorCodes.get(i)));
            }
        } catch (RuntimeException e) {
            log.debug("Dropped call observation: provider={}, error={}", identity.provider(), e.toString());
        }
    }
}
