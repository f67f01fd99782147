package fr.lapetina.chat.recovery.domain.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Call-site context attached to a handled error.
 *
 * @param operation      name of the failing operation, logged with the error
 * @param parameters     optional diagnostic parameters, logged after sanitization
 * @param retryOperation operation to re-run on retry, may be null when the error cannot be retried
 */
public record ErrorContext(String operation, Map<String, String> parameters, RetryOperation retryOperation) {

    public ErrorContext {
        Objects.requireNonNull(operation, "Operation is required");
        parameters = parameters != null ? Map.copyOf(parameters) : Map.of();
    }

    public static ErrorContext of(String operation) {
        return new ErrorContext(operation, null, null);
    }

    public static ErrorContext of(String operation, RetryOperation retryOperation) {
        return new ErrorContext(operation, null, retryOperation);
    }

    public boolean hasRetryOperation() {
        return retryOperation != null;
    }

    /**
     * Parameters sorted by key, so log lines are stable.
     */
    public Map<String, String> sortedParameters() {
        Map<String, String> sorted = new LinkedHashMap<>();
        parameters.keySet().stream().sorted().forEach(key -> sorted.put(key, parameters.get(key)));
        return sorted;
    }

    public static Builder builder(String operation) {
        return new Builder(operation);
    }

    public static final class Builder {
        private final String operation;
        private final Map<String, String> parameters = new LinkedHashMap<>();
        private RetryOperation retryOperation;

        private Builder(String operation) {
            this.operation = operation;
        }

        public Builder parameter(String key, Object value) {
            parameters.put(key, String.valueOf(value));
            return this;
        }

        public Builder retryOperation(RetryOperation retryOperation) {
            this.retryOperation = retryOperation;
            return this;
        }

        public ErrorContext build() {
            return new ErrorContext(operation, parameters, retryOperation);
        }
    }
}
