package com.thetaguard.api.dto.response;

import java.time.Instant;
import lombok.Getter;

/** Success envelope. {@code policyVersion} names the risk parameters the decision was made under. */
@Getter
public class ApiResponse<T> {

    private final boolean success = true;
    private final T data;
    private final String policyVersion;
    private final Instant timestamp;

    private ApiResponse(T data, String policyVersion) {
        this.data = data;
        this.policyVersion = policyVersion;
        this.timestamp = Instant.now();
    }

    public static <T> ApiResponse<T> of(T data, String policyVersion) {
        return new ApiResponse<>(data, policyVersion);
    }
}
