package io.github.drompincen.mockjira.runtime.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Service-desk view over a work item. Approvals are append-only.
 */
public record ServiceRequest(
        String id,
        String issueKey,
        String serviceDeskId,
        String requestTypeId,
        List<Approval> approvals,
        Instant created
) {

    public ServiceRequest {
        approvals = approvals != null ? List.copyOf(approvals) : List.of();
    }

    public boolean hasApproval(String approvalId) {
        return approvals.stream().anyMatch(a -> a.id().equals(approvalId));
    }

    public ServiceRequest withApproval(Approval approval) {
        List<Approval> next = new ArrayList<>(approvals);
        next.add(approval);
        return new ServiceRequest(id, issueKey, serviceDeskId, requestTypeId, next, created);
    }
}
