package cull.email.app.entity;

import lombok.Value;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-message result of a batch disposal call.
 */
@Value
public class DisposalResult {
    List<String> succeeded;
    /** Message id to failure reason. */
    Map<String, String> failed;

    public DisposalResult(Collection<String> succeeded, Map<String, String> failed) {
        this.succeeded = succeeded == null ? List.of() : List.copyOf(succeeded);
        this.failed = failed == null ? Map.of() : new LinkedHashMap<>(failed);
    }

    public static DisposalResult allSucceeded(Collection<String> ids) {
        return new DisposalResult(ids, Map.of());
    }

    public static DisposalResult allFailed(Collection<String> ids, String reason) {
        Map<String, String> failed = new LinkedHashMap<>();
        for (String id : ids) {
            failed.put(id, reason);
        }
        return new DisposalResult(List.of(), failed);
    }
}
