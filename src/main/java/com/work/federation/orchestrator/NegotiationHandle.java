package com.work.federation.orchestrator;

import java.util.concurrent.Future;

/**
 * 异步启动一次协商后的句柄。
 */
public class NegotiationHandle {

    private final String runId;
    private final Future<NegotiationResult> result;

    NegotiationHandle(String runId, Future<NegotiationResult> result) {
        this.runId = runId;
        this.result = result;
    }

    public String getRunId() {
        return runId;
    }

    /**
     * 失败类结局也以正常结果返回，不会抛出执行异常。
     */
    public Future<NegotiationResult> getResult() {
        return result;
    }
}
