package com.omotes.worker;

import java.util.Map;

/**
 * The computation a worker performs for one task type.
 */
@FunctionalInterface
public interface WorkerTaskFunction {

    /**
     * @param inputEsdl      input ESDL document
     * @param workflowConfig workflow parameter values as wire scalars (String, Boolean or Double);
     *                       read them with {@link com.omotes.workflow.WorkflowConfigParameters#parse}
     * @param progress       reporter for intermediate progress
     * @return the output ESDL document
     * @throws Exception any failure; the job is then reported as failed
     */
    String execute(String inputEsdl, Map<String, Object> workflowConfig, ProgressReporter progress) throws Exception;
}
