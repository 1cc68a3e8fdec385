package io.github.hotbrkm.campaignengine.agent.email.send.engine;

import io.github.hotbrkm.campaignengine.agent.email.send.server.NoServerAvailableException;

import java.util.List;

/**
 * The server pool ran dry partway through a batch. {@link #getResults()} holds one outcome per recipient of the
 * batch: those already handled, FAILED for the recipient that found no server, SKIPPED for the rest.
 */
public class DispatchAbortedException extends NoServerAvailableException {

    private final transient List<DispatchResult> results;

    public DispatchAbortedException(String message, List<DispatchResult> results, Throwable cause) {
        super(message);
        initCause(cause);
        this.results = List.copyOf(results);
    }

    public List<DispatchResult> getResults() {
        return results;
    }
}
