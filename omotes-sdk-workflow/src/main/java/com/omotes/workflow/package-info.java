/**
 * Workflow types and jobs.
 *
 * <ul>
 *   <li>{@link com.omotes.workflow.WorkflowTypeManager} – registry loaded from the workflow configuration file or the wire catalog</li>
 *   <li>{@link com.omotes.workflow.WorkflowConfigParameters} – runtime/wire conversion of parameter values</li>
 *   <li>{@link com.omotes.workflow.OmotesQueueNames} – queue names per workflow type and per job</li>
 *   <li>{@link com.omotes.workflow.parameter} – the typed parameter model</li>
 * </ul>
 */
package com.omotes.workflow;
