package cull.email.app.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Body returned by the REST API when a request fails.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    /** Simple name of the exception type, e.g. {@code RuleNotFoundException}. */
    private String errorType;

    private String message;

    private int status;

    @Builder.Default
    private LocalDateTime timestamp = LocalDateTime.now();

    private String path;
}
