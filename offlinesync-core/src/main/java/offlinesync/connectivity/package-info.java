/**
 * Connectivity tracking: the edge-triggered {@link offlinesync.connectivity.ConnectivityMonitor}
 * and the bundled probes.
 */
package offlinesync.connectivity;
