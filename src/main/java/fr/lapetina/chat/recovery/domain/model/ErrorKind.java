package fr.lapetina.chat.recovery.domain.model;

/**
 * Closed set of error kinds raised by the chat application.
 *
 * <p>Each kind only carries its stable code. Codes are persisted in log files and used as
 * retry buckets and statistics keys, so a code must never be reassigned. Every other
 * attribute is derived by {@link fr.lapetina.chat.recovery.domain.taxonomy.ErrorTaxonomy}.
 */
public enum ErrorKind {

    // Network
    NETWORK_UNAVAILABLE("NET_001"),
    NETWORK_TIMEOUT("NET_002"),
    DOWNLOAD_FAILED("NET_003"),
    UPLOAD_FAILED("NET_004"),
    SERVER_ERROR("NET_005"),

    // Model
    MODEL_NOT_FOUND("MDL_001"),
    MODEL_LOAD_FAILED("MDL_002"),
    MODEL_CORRUPTED("MDL_003"),
    MODEL_INCOMPATIBLE("MDL_004"),
    MODEL_DOWNLOAD_FAILED("MDL_005"),
    MODEL_VERIFICATION_FAILED("MDL_006"),
    MODEL_ALREADY_EXISTS("MDL_007"),

    // Storage
    INSUFFICIENT_STORAGE("STG_001"),
    STORAGE_ACCESS_DENIED("STG_002"),
    FILE_NOT_FOUND("STG_003"),
    FILE_CORRUPTED("STG_004"),
    DISK_FULL("STG_005"),

    // Memory
    OUT_OF_MEMORY("MEM_001"),
    MEMORY_ALLOCATION_FAILED("MEM_002"),
    MEMORY_FRAGMENTATION("MEM_003"),

    // GPU
    GPU_NOT_AVAILABLE("GPU_001"),
    GPU_INITIALIZATION_FAILED("GPU_002"),
    GPU_OPERATION_FAILED("GPU_003"),
    GPU_MEMORY_EXHAUSTED("GPU_004"),

    // Chat
    CHAT_SESSION_EXPIRED("CHT_001"),
    MESSAGE_VALIDATION_FAILED("CHT_002"),
    CONVERSATION_LOAD_FAILED("CHT_003"),
    CONVERSATION_SAVE_FAILED("CHT_004"),
    INFERENCE_TIMEOUT("CHT_005"),
    INFERENCE_FAILED("CHT_006"),

    // Export
    EXPORT_FAILED("EXP_001"),
    EXPORT_FORMAT_UNSUPPORTED("EXP_002"),
    EXPORT_PERMISSION_DENIED("EXP_003"),

    // System
    SYSTEM_RESOURCES_UNAVAILABLE("SYS_001"),
    PERMISSION_DENIED("SYS_002"),
    CONFIGURATION_ERROR("SYS_003"),
    UNEXPECTED_ERROR("SYS_004"),

    // User
    INVALID_INPUT("USR_001"),
    OPERATION_CANCELLED("USR_002"),
    FEATURE_NOT_AVAILABLE("USR_003");

    private final String code;

    ErrorKind(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
