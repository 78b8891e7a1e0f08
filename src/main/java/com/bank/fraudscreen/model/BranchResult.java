package com.bank.fraudscreen.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Output of one parallel branch: either its value or the error that stopped it.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Schema(description = "Outcome of one workflow branch")
public class BranchResult<T> {

    @Schema(example = "compliance-audit")
    String stage;

    BranchStatus status;

    T value;

    String error;

    public static <T> BranchResult<T> success(String stage, T value) {
        return new BranchResult<>(stage, BranchStatus.SUCCEEDED, value, null);
    }

    public static <T> BranchResult<T> failure(String stage, String error) {
        return new BranchResult<>(stage, BranchStatus.FAILED, null, error);
    }

    public boolean isSucceeded() {
        return status == BranchStatus.SUCCEEDED;
    }
}
