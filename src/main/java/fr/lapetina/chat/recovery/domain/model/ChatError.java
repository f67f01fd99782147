package fr.lapetina.chat.recovery.domain.model;

import fr.lapetina.chat.recovery.domain.taxonomy.ErrorTaxonomy;

import java.util.List;
import java.util.Objects;

/**
 * Classified domain error raised by the chat application.
 *
 * <p>One instance wraps exactly one {@link ErrorKind} plus the payload that kind needs
 * (item name, byte counts, status code, wrapped cause). Severity, category, retryability and
 * recovery actions are derived from the kind through {@link ErrorTaxonomy}, never stored.
 *
 * <p>Instances are created through the static factories, one per kind:
 * <pre>{@code
 * throw ChatError.insufficientStorage(4_000_000_000L, 1_200_000_000L);
 * throw ChatError.modelLoadFailed("llama-3.2-1b", ioException);
 * }</pre>
 */
public final class ChatError extends RuntimeException implements ClassifiedError {

    private final ErrorKind kind;
    private final String subject;
    private final String detail;
    private final long requiredBytes;
    private final long availableBytes;
    private final int statusCode;

    private ChatError(
            ErrorKind kind,
            String subject,
            String detail,
            long requiredBytes,
            long availableBytes,
            int statusCode,
            Throwable cause
    ) {
        super(ErrorTaxonomy.message(kind, subject, detail, requiredBytes, availableBytes, statusCode), cause);
        this.kind = Objects.requireNonNull(kind, "Error kind is required");
        this.subject = subject;
        this.detail = detail;
        this.requiredBytes = requiredBytes;
        this.availableBytes = availableBytes;
        this.statusCode = statusCode;
    }

    private static ChatError of(ErrorKind kind) {
        return new ChatError(kind, null, null, 0, 0, 0, null);
    }

    private static ChatError of(ErrorKind kind, String subject) {
        return new ChatError(kind, subject, null, 0, 0, 0, null);
    }

    private static ChatError of(ErrorKind kind, String subject, Throwable cause) {
        return new ChatError(kind, subject, null, 0, 0, 0, cause);
    }

    // Network

    public static ChatError networkUnavailable() {
        return of(ErrorKind.NETWORK_UNAVAILABLE);
    }

    public static ChatError networkTimeout() {
        return of(ErrorKind.NETWORK_TIMEOUT);
    }

    public static ChatError downloadFailed(String item, Throwable cause) {
        return of(ErrorKind.DOWNLOAD_FAILED, item, cause);
    }

    public static ChatError uploadFailed(String item, Throwable cause) {
        return of(ErrorKind.UPLOAD_FAILED, item, cause);
    }

    public static ChatError serverError(int statusCode, String serverMessage) {
        return new ChatError(ErrorKind.SERVER_ERROR, null, serverMessage, 0, 0, statusCode, null);
    }

    // Model

    public static ChatError modelNotFound(String model) {
        return of(ErrorKind.MODEL_NOT_FOUND, model);
    }

    public static ChatError modelLoadFailed(String model, Throwable cause) {
        return of(ErrorKind.MODEL_LOAD_FAILED, model, cause);
    }

    public static ChatError modelCorrupted(String model) {
        return of(ErrorKind.MODEL_CORRUPTED, model);
    }

    public static ChatError modelIncompatible(String model, String reason) {
        return new ChatError(ErrorKind.MODEL_INCOMPATIBLE, model, reason, 0, 0, 0, null);
    }

    public static ChatError modelDownloadFailed(String model, Throwable cause) {
        return of(ErrorKind.MODEL_DOWNLOAD_FAILED, model, cause);
    }

    public static ChatError modelVerificationFailed(String model) {
        return of(ErrorKind.MODEL_VERIFICATION_FAILED, model);
    }

    public static ChatError modelAlreadyExists(String model) {
        return of(ErrorKind.MODEL_ALREADY_EXISTS, model);
    }

    // Storage

    public static ChatError insufficientStorage(long requiredBytes, long availableBytes) {
        return new ChatError(ErrorKind.INSUFFICIENT_STORAGE, null, null, requiredBytes, availableBytes, 0, null);
    }

    public static ChatError storageAccessDenied() {
        return of(ErrorKind.STORAGE_ACCESS_DENIED);
    }

    public static ChatError fileNotFound(String file) {
        return of(ErrorKind.FILE_NOT_FOUND, file);
    }

    public static ChatError fileCorrupted(String file) {
        return of(ErrorKind.FILE_CORRUPTED, file);
    }

    public static ChatError diskFull() {
        return of(ErrorKind.DISK_FULL);
    }

    // Memory

    public static ChatError outOfMemory(long requiredBytes, long availableBytes) {
        return new ChatError(ErrorKind.OUT_OF_MEMORY, null, null, requiredBytes, availableBytes, 0, null);
    }

    public static ChatError memoryAllocationFailed() {
        return of(ErrorKind.MEMORY_ALLOCATION_FAILED);
    }

    public static ChatError memoryFragmentation() {
        return of(ErrorKind.MEMORY_FRAGMENTATION);
    }

    // GPU

    public static ChatError gpuNotAvailable() {
        return of(ErrorKind.GPU_NOT_AVAILABLE);
    }

    public static ChatError gpuInitializationFailed(Throwable cause) {
        return of(ErrorKind.GPU_INITIALIZATION_FAILED, null, cause);
    }

    public static ChatError gpuOperationFailed(String operation, Throwable cause) {
        return of(ErrorKind.GPU_OPERATION_FAILED, operation, cause);
    }

    public static ChatError gpuMemoryExhausted() {
        return of(ErrorKind.GPU_MEMORY_EXHAUSTED);
    }

    // Chat

    public static ChatError chatSessionExpired() {
        return of(ErrorKind.CHAT_SESSION_EXPIRED);
    }

    public static ChatError messageValidationFailed(String reason) {
        return of(ErrorKind.MESSAGE_VALIDATION_FAILED, reason);
    }

    public static ChatError conversationLoadFailed(Throwable cause) {
        return of(ErrorKind.CONVERSATION_LOAD_FAILED, null, cause);
    }

    public static ChatError conversationSaveFailed(Throwable cause) {
        return of(ErrorKind.CONVERSATION_SAVE_FAILED, null, cause);
    }

    public static ChatError inferenceTimeout() {
        return of(ErrorKind.INFERENCE_TIMEOUT);
    }

    public static ChatError inferenceFailed(Throwable cause) {
        return of(ErrorKind.INFERENCE_FAILED, null, cause);
    }

    // Export

    public static ChatError exportFailed(String format, Throwable cause) {
        return of(ErrorKind.EXPORT_FAILED, format, cause);
    }

    public static ChatError exportFormatUnsupported(String format) {
        return of(ErrorKind.EXPORT_FORMAT_UNSUPPORTED, format);
    }

    public static ChatError exportPermissionDenied() {
        return of(ErrorKind.EXPORT_PERMISSION_DENIED);
    }

    // System

    public static ChatError systemResourcesUnavailable() {
        return of(ErrorKind.SYSTEM_RESOURCES_UNAVAILABLE);
    }

    public static ChatError permissionDenied(String permission) {
        return of(ErrorKind.PERMISSION_DENIED, permission);
    }

    public static ChatError configurationError(String details) {
        return of(ErrorKind.CONFIGURATION_ERROR, details);
    }

    public static ChatError unexpected(Throwable cause) {
        return of(ErrorKind.UNEXPECTED_ERROR, null, Objects.requireNonNull(cause, "Cause is required"));
    }

    // User

    public static ChatError invalidInput(String details) {
        return of(ErrorKind.INVALID_INPUT, details);
    }

    public static ChatError operationCancelled() {
        return of(ErrorKind.OPERATION_CANCELLED);
    }

    public static ChatError featureNotAvailable(String feature) {
        return of(ErrorKind.FEATURE_NOT_AVAILABLE, feature);
    }

    /**
     * Classifies any throwable: well-formed classified errors pass through, anything else
     * (including a classified error missing its code, severity or category) is wrapped
     * as {@link ErrorKind#UNEXPECTED_ERROR}.
     */
    public static ClassifiedError classify(Throwable throwable) {
        if (throwable instanceof ClassifiedError classified && isRoutable(classified)) {
            return classified;
        }
        return unexpected(throwable);
    }

    private static boolean isRoutable(ClassifiedError error) {
        try {
            return error.code() != null && error.severity() != null && error.category() != null;
        } catch (RuntimeException e) {
            return false;
        }
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getSubject() {
        return subject;
    }

    public String getDetail() {
        return detail;
    }

    public long getRequiredBytes() {
        return requiredBytes;
    }

    public long getAvailableBytes() {
        return availableBytes;
    }

    public int getStatusCode() {
        return statusCode;
    }

    @Override
    public String code() {
        return kind.getCode();
    }

    @Override
    public String message() {
        return getMessage();
    }

    @Override
    public ErrorSeverity severity() {
        return ErrorTaxonomy.severity(kind);
    }

    @Override
    public ErrorCategory category() {
        return ErrorTaxonomy.category(kind);
    }

    @Override
    public boolean isRetryable() {
        return ErrorTaxonomy.isRetryable(kind);
    }

    @Override
    public List<RecoveryAction> recoveryActions() {
        return ErrorTaxonomy.recoveryActions(kind, subject);
    }

    @Override
    public Throwable cause() {
        return getCause();
    }

    @Override
    public String toString() {
        return "ChatError{" +
                "code=" + code() +
                ", kind=" + kind +
                ", severity=" + severity() +
                ", message='" + getMessage() + '\'' +
                '}';
    }
}
