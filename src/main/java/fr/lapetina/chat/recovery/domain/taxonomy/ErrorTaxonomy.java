package fr.lapetina.chat.recovery.domain.taxonomy;

import fr.lapetina.chat.recovery.domain.model.ChatError;
import fr.lapetina.chat.recovery.domain.model.ClassifiedError;
import fr.lapetina.chat.recovery.domain.model.ErrorCategory;
import fr.lapetina.chat.recovery.domain.model.ErrorKind;
import fr.lapetina.chat.recovery.domain.model.ErrorSeverity;
import fr.lapetina.chat.recovery.domain.model.RecoveryAction;

import java.util.List;
import java.util.Locale;

/**
 * Per-kind policy table for {@link ErrorKind}.
 *
 * <p>Every mapping is an exhaustive {@code switch} expression without a default branch, so
 * adding a kind without deciding its policy does not compile. The mapping for an existing
 * code must stay stable: codes and severities are read back from persisted logs.
 */
public final class ErrorTaxonomy {

    private static final double GIB = 1_073_741_824d;
    private static final double MIB = 1_048_576d;
    private static final String DEFAULT_MODEL_NAME = "model";

    private ErrorTaxonomy() {
    }

    /**
     * Classifies any error into its full descriptor.
     */
    public static ErrorDescriptor classify(ClassifiedError error) {
        List<RecoveryAction> actions = error.recoveryActions();
        if (actions == null || actions.isEmpty()) {
            actions = List.of(RecoveryAction.DISMISS);
        }
        return new ErrorDescriptor(
                error.code(),
                error.message(),
                error.severity(),
                error.category(),
                error.isRetryable(),
                actions
        );
    }

    public static ErrorSeverity severity(ErrorKind kind) {
        return switch (kind) {
            case NETWORK_UNAVAILABLE, NETWORK_TIMEOUT, DOWNLOAD_FAILED, UPLOAD_FAILED -> ErrorSeverity.MEDIUM;
            case SERVER_ERROR -> ErrorSeverity.HIGH;
            case MODEL_NOT_FOUND, MODEL_LOAD_FAILED, MODEL_CORRUPTED, MODEL_DOWNLOAD_FAILED,
                 MODEL_VERIFICATION_FAILED -> ErrorSeverity.HIGH;
            case MODEL_INCOMPATIBLE, MODEL_ALREADY_EXISTS -> ErrorSeverity.LOW;
            case INSUFFICIENT_STORAGE, DISK_FULL -> ErrorSeverity.HIGH;
            case STORAGE_ACCESS_DENIED, FILE_NOT_FOUND, FILE_CORRUPTED -> ErrorSeverity.MEDIUM;
            case OUT_OF_MEMORY, MEMORY_ALLOCATION_FAILED, MEMORY_FRAGMENTATION -> ErrorSeverity.HIGH;
            case GPU_NOT_AVAILABLE -> ErrorSeverity.LOW;
            case GPU_INITIALIZATION_FAILED, GPU_OPERATION_FAILED, GPU_MEMORY_EXHAUSTED -> ErrorSeverity.MEDIUM;
            case CHAT_SESSION_EXPIRED, MESSAGE_VALIDATION_FAILED -> ErrorSeverity.LOW;
            case CONVERSATION_LOAD_FAILED, CONVERSATION_SAVE_FAILED,
                 INFERENCE_TIMEOUT, INFERENCE_FAILED -> ErrorSeverity.MEDIUM;
            case EXPORT_FAILED, EXPORT_FORMAT_UNSUPPORTED, EXPORT_PERMISSION_DENIED -> ErrorSeverity.LOW;
            case SYSTEM_RESOURCES_UNAVAILABLE, PERMISSION_DENIED, CONFIGURATION_ERROR -> ErrorSeverity.HIGH;
            case UNEXPECTED_ERROR -> ErrorSeverity.CRITICAL;
            case INVALID_INPUT, OPERATION_CANCELLED, FEATURE_NOT_AVAILABLE -> ErrorSeverity.LOW;
        };
    }

    public static ErrorCategory category(ErrorKind kind) {
        return switch (kind) {
            case NETWORK_UNAVAILABLE, NETWORK_TIMEOUT, DOWNLOAD_FAILED, UPLOAD_FAILED,
                 SERVER_ERROR -> ErrorCategory.NETWORK;
            case MODEL_NOT_FOUND, MODEL_LOAD_FAILED, MODEL_CORRUPTED, MODEL_INCOMPATIBLE,
                 MODEL_DOWNLOAD_FAILED, MODEL_VERIFICATION_FAILED, MODEL_ALREADY_EXISTS -> ErrorCategory.MODEL;
            case INSUFFICIENT_STORAGE, STORAGE_ACCESS_DENIED, FILE_NOT_FOUND, FILE_CORRUPTED,
                 DISK_FULL -> ErrorCategory.STORAGE;
            case OUT_OF_MEMORY, MEMORY_ALLOCATION_FAILED, MEMORY_FRAGMENTATION -> ErrorCategory.MEMORY;
            case GPU_NOT_AVAILABLE, GPU_INITIALIZATION_FAILED, GPU_OPERATION_FAILED,
                 GPU_MEMORY_EXHAUSTED -> ErrorCategory.GPU;
            case CHAT_SESSION_EXPIRED, MESSAGE_VALIDATION_FAILED, CONVERSATION_LOAD_FAILED,
                 CONVERSATION_SAVE_FAILED, INFERENCE_TIMEOUT, INFERENCE_FAILED -> ErrorCategory.CHAT;
            case EXPORT_FAILED, EXPORT_FORMAT_UNSUPPORTED, EXPORT_PERMISSION_DENIED -> ErrorCategory.EXPORT;
            case SYSTEM_RESOURCES_UNAVAILABLE, PERMISSION_DENIED, CONFIGURATION_ERROR,
                 UNEXPECTED_ERROR -> ErrorCategory.SYSTEM;
            case INVALID_INPUT, OPERATION_CANCELLED, FEATURE_NOT_AVAILABLE -> ErrorCategory.USER;
        };
    }

    public static boolean isRetryable(ErrorKind kind) {
        return switch (kind) {
            case NETWORK_UNAVAILABLE, NETWORK_TIMEOUT, DOWNLOAD_FAILED, UPLOAD_FAILED, SERVER_ERROR -> true;
            case MODEL_LOAD_FAILED, MODEL_DOWNLOAD_FAILED, MODEL_VERIFICATION_FAILED -> true;
            case OUT_OF_MEMORY, MEMORY_ALLOCATION_FAILED -> true;
            case GPU_OPERATION_FAILED, GPU_MEMORY_EXHAUSTED -> true;
            case CONVERSATION_LOAD_FAILED, CONVERSATION_SAVE_FAILED, INFERENCE_TIMEOUT, INFERENCE_FAILED -> true;
            case EXPORT_FAILED, SYSTEM_RESOURCES_UNAVAILABLE -> true;
            case MODEL_NOT_FOUND, MODEL_CORRUPTED, MODEL_INCOMPATIBLE, MODEL_ALREADY_EXISTS,
                 INSUFFICIENT_STORAGE, STORAGE_ACCESS_DENIED, FILE_NOT_FOUND, FILE_CORRUPTED, DISK_FULL,
                 MEMORY_FRAGMENTATION, GPU_NOT_AVAILABLE, GPU_INITIALIZATION_FAILED,
                 CHAT_SESSION_EXPIRED, MESSAGE_VALIDATION_FAILED,
                 EXPORT_FORMAT_UNSUPPORTED, EXPORT_PERMISSION_DENIED,
                 PERMISSION_DENIED, CONFIGURATION_ERROR, UNEXPECTED_ERROR,
                 INVALID_INPUT, OPERATION_CANCELLED, FEATURE_NOT_AVAILABLE -> false;
        };
    }

    public static List<RecoveryAction> recoveryActions(ErrorKind kind) {
        return recoveryActions(kind, null);
    }

    /**
     * Recovery actions in display order. {@code modelName} fills the redownload action when known.
     */
    public static List<RecoveryAction> recoveryActions(ErrorKind kind, String modelName) {
        RecoveryAction redownload = RecoveryAction.redownloadModel(
                modelName != null && !modelName.isBlank() ? modelName : DEFAULT_MODEL_NAME);

        return switch (kind) {
            case NETWORK_UNAVAILABLE, NETWORK_TIMEOUT -> List.of(
                    RecoveryAction.CHECK_NETWORK, RecoveryAction.retryWithDelaySeconds(5), RecoveryAction.DISMISS);
            case DOWNLOAD_FAILED, UPLOAD_FAILED -> List.of(
                    RecoveryAction.RETRY, RecoveryAction.CHECK_NETWORK, RecoveryAction.DISMISS);
            case SERVER_ERROR -> List.of(
                    RecoveryAction.retryWithDelaySeconds(10), RecoveryAction.CONTACT_SUPPORT, RecoveryAction.DISMISS);
            case MODEL_NOT_FOUND, MODEL_CORRUPTED, MODEL_VERIFICATION_FAILED -> List.of(
                    redownload, RecoveryAction.DISMISS);
            case MODEL_LOAD_FAILED -> List.of(
                    redownload, RecoveryAction.RESTART_APP, RecoveryAction.DISMISS);
            case MODEL_INCOMPATIBLE -> List.of(
                    RecoveryAction.SWITCH_FALLBACK_MODEL, RecoveryAction.DISMISS);
            case MODEL_DOWNLOAD_FAILED -> List.of(
                    RecoveryAction.RETRY, RecoveryAction.CHECK_NETWORK, RecoveryAction.CHECK_STORAGE,
                    RecoveryAction.DISMISS);
            case INSUFFICIENT_STORAGE, DISK_FULL -> List.of(
                    RecoveryAction.CHECK_STORAGE, RecoveryAction.CLEAR_CACHE, RecoveryAction.DISMISS);
            case STORAGE_ACCESS_DENIED, EXPORT_PERMISSION_DENIED, PERMISSION_DENIED -> List.of(
                    RecoveryAction.OPEN_SETTINGS, RecoveryAction.DISMISS);
            case FILE_NOT_FOUND, FILE_CORRUPTED, CONVERSATION_LOAD_FAILED, CONVERSATION_SAVE_FAILED -> List.of(
                    RecoveryAction.RETRY, RecoveryAction.CLEAR_CACHE, RecoveryAction.DISMISS);
            case OUT_OF_MEMORY, MEMORY_ALLOCATION_FAILED, MEMORY_FRAGMENTATION -> List.of(
                    RecoveryAction.FREE_MEMORY, RecoveryAction.RESTART_APP, RecoveryAction.DISMISS);
            case GPU_INITIALIZATION_FAILED, GPU_OPERATION_FAILED, GPU_MEMORY_EXHAUSTED -> List.of(
                    RecoveryAction.RETRY, RecoveryAction.RESTART_APP, RecoveryAction.DISMISS);
            case INFERENCE_TIMEOUT, INFERENCE_FAILED -> List.of(
                    RecoveryAction.RETRY, RecoveryAction.SWITCH_FALLBACK_MODEL, RecoveryAction.DISMISS);
            case EXPORT_FAILED -> List.of(
                    RecoveryAction.RETRY, RecoveryAction.CHECK_STORAGE, RecoveryAction.DISMISS);
            case SYSTEM_RESOURCES_UNAVAILABLE, CONFIGURATION_ERROR, UNEXPECTED_ERROR -> List.of(
                    RecoveryAction.RESTART_APP, RecoveryAction.CONTACT_SUPPORT, RecoveryAction.DISMISS);
            case MODEL_ALREADY_EXISTS, GPU_NOT_AVAILABLE, CHAT_SESSION_EXPIRED, MESSAGE_VALIDATION_FAILED,
                 EXPORT_FORMAT_UNSUPPORTED, INVALID_INPUT, OPERATION_CANCELLED,
                 FEATURE_NOT_AVAILABLE -> List.of(RecoveryAction.DISMISS);
        };
    }

    public static String message(ChatError error) {
        return message(error.getKind(), error.getSubject(), error.getDetail(),
                error.getRequiredBytes(), error.getAvailableBytes(), error.getStatusCode());
    }

    /**
     * Renders the user-facing message for a kind and its payload.
     */
    public static String message(
            ErrorKind kind,
            String subject,
            String detail,
            long requiredBytes,
            long availableBytes,
            int statusCode
    ) {
        String s = subject != null ? subject : "unknown";
        return switch (kind) {
            case NETWORK_UNAVAILABLE -> "No internet connection available. Please check your network settings.";
            case NETWORK_TIMEOUT -> "The request took too long to complete. Please try again.";
            case DOWNLOAD_FAILED -> "Failed to download " + s + ". Please check your connection and try again.";
            case UPLOAD_FAILED -> "Failed to upload " + s + ". Please check your connection and try again.";
            case SERVER_ERROR -> "Server error (" + statusCode + "). Please try again later.";
            case MODEL_NOT_FOUND -> "The model '" + s + "' could not be found. Please try downloading it again.";
            case MODEL_LOAD_FAILED -> "Failed to load the '" + s + "' model. The file may be corrupted.";
            case MODEL_CORRUPTED -> "The '" + s + "' model file is corrupted. Please redownload it.";
            case MODEL_INCOMPATIBLE -> "The '" + s + "' model is not compatible: "
                    + (detail != null ? detail : "unknown reason");
            case MODEL_DOWNLOAD_FAILED -> "Failed to download the '" + s + "' model. Please try again.";
            case MODEL_VERIFICATION_FAILED -> "The '" + s + "' model failed verification. Please redownload it.";
            case MODEL_ALREADY_EXISTS -> "The '" + s + "' model is already downloaded.";
            case INSUFFICIENT_STORAGE -> String.format(Locale.ROOT,
                    "Not enough storage space. Need %.1fGB, but only %.1fGB available.",
                    requiredBytes / GIB, availableBytes / GIB);
            case STORAGE_ACCESS_DENIED -> "Cannot access device storage. Please check app permissions.";
            case FILE_NOT_FOUND -> "The file '" + s + "' could not be found.";
            case FILE_CORRUPTED -> "The file '" + s + "' is corrupted or unreadable.";
            case DISK_FULL -> "Device storage is full. Please free up space and try again.";
            case OUT_OF_MEMORY -> String.format(Locale.ROOT,
                    "Not enough memory. Need %.0fMB, but only %.0fMB available.",
                    requiredBytes / MIB, availableBytes / MIB);
            case MEMORY_ALLOCATION_FAILED -> "Failed to allocate memory. Please close other apps and try again.";
            case MEMORY_FRAGMENTATION -> "Memory is fragmented. Please restart the app.";
            case GPU_NOT_AVAILABLE -> "GPU acceleration is not available on this device.";
            case GPU_INITIALIZATION_FAILED -> "Failed to initialize GPU acceleration.";
            case GPU_OPERATION_FAILED -> "GPU operation '" + s + "' failed. Falling back to CPU processing.";
            case GPU_MEMORY_EXHAUSTED -> "GPU memory is exhausted. Please try with a smaller model.";
            case CHAT_SESSION_EXPIRED -> "Your chat session has expired. Please start a new conversation.";
            case MESSAGE_VALIDATION_FAILED -> "Message validation failed: " + s;
            case CONVERSATION_LOAD_FAILED -> "Failed to load conversation. The data may be corrupted.";
            case CONVERSATION_SAVE_FAILED -> "Failed to save conversation. Please check storage space.";
            case INFERENCE_TIMEOUT -> "The AI response took too long to generate. Please try again.";
            case INFERENCE_FAILED -> "Failed to generate AI response. Please try again.";
            case EXPORT_FAILED -> "Failed to export conversation as " + s + ". Please try again.";
            case EXPORT_FORMAT_UNSUPPORTED -> "Export format '" + s + "' is not supported.";
            case EXPORT_PERMISSION_DENIED -> "Permission denied for exporting files. Please check app permissions.";
            case SYSTEM_RESOURCES_UNAVAILABLE -> "System resources are unavailable. Please restart the app.";
            case PERMISSION_DENIED -> "Permission denied for " + s + ". Please check app settings.";
            case CONFIGURATION_ERROR -> "Configuration error: " + s;
            case UNEXPECTED_ERROR -> "An unexpected error occurred. Please try again.";
            case INVALID_INPUT -> "Invalid input: " + s;
            case OPERATION_CANCELLED -> "Operation was cancelled.";
            case FEATURE_NOT_AVAILABLE -> "The feature '" + s + "' is not available on this device.";
        };
    }
}
