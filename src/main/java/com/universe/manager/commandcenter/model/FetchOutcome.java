package com.universe.manager.commandcenter.model;

import java.util.Objects;

/**
 * Result of one logical fetch, produced once retries are exhausted or an attempt succeeds.
 */
public sealed interface FetchOutcome permits FetchOutcome.Success, FetchOutcome.Failure {

    static FetchOutcome success(HealthSnapshot snapshot) {
        return new Success(snapshot);
    }

    static FetchOutcome failure(ErrorDetail error) {
        return new Failure(error);
    }

    boolean isSuccess();

    record Success(HealthSnapshot snapshot) implements FetchOutcome {

        public Success {
            Objects.requireNonNull(snapshot, "snapshot");
        }

        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    record Failure(ErrorDetail error) implements FetchOutcome {

        public Failure {
            Objects.requireNonNull(error, "error");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }
    }
}
