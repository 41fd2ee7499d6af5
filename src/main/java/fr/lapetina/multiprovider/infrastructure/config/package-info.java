/**
 * YAML configuration of provider pools.
 *
 * <pre>
 * providers:
 *   - name: execution
 *     layer: execution        # execution | consensus
 *     policy: rotating        # rotating | fallback
 *     endpoints:
 *       - https://eth-mainnet.alchemy.com/v2/KEY
 *       - https://mainnet.infura.io/v3/KEY
 * http:
 *   connectTimeoutMs: 10000
 *   requestTimeoutMs: 30000
 * identity:
 *   probe: true
 * metrics:
 *   enabled: true
 *   prefix: web3
 *   networks:
 *     - chainId: "8453"
 *       name: base
 * </pre>
 */
package fr.lapetina.multiprovider.infrastructure.config;
