package cull.email.app.entity;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Result of trashing or deleting the messages of an ad-hoc query.
 */
@Value
@Builder
public class MessageDisposalReport {
    String query;
    DisposalAction action;
    RunMode mode;
    int enumerated;
    @Singular("attemptedId")
    List<String> attempted;
    @Singular("succeededId")
    List<String> succeeded;
    @Singular("failure")
    Map<String, String> failed;
}
