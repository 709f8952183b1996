/**
 * Orchestrator side of the OMOTES job protocol: {@link com.omotes.orchestrator.OrchestratorInterface}
 * listens for submissions and cancellations per workflow type and relays worker events to the SDK.
 */
package com.omotes.orchestrator;
