package com.gdin.inspection.lodbook.models;

public enum AdvisoryKind {
    UNRESOLVED_REFERENCE,
    UNCONFIGURED_TYPE,
    MISSING_IMAGE_RECORD,
    UNSUPPORTED_IMAGE_FORMAT,
    MALFORMED_MARKER,
    ITEM_FAILED
}
