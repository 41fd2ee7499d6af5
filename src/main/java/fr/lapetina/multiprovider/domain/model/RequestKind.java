package fr.lapetina.multiprovider.domain.model;

/**
 * Shape of a logical request.
 */
public enum RequestKind {
    /** Single JSON-RPC call */
    JSON_RPC,

    /** JSON-RPC batch sent as one HTTP request */
    JSON_RPC_BATCH,

    /** REST GET against a path-parameterized API */
    REST_GET,

    /** REST POST with a JSON body */
    REST_POST;

    public boolean isJsonRpc() {
        return this == JSON_RPC || this == JSON_RPC_BATCH;
    }

    public boolean isRest() {
        return this == REST_GET || this == REST_POST;
    }
}
