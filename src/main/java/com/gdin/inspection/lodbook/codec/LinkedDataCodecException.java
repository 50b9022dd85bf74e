package com.gdin.inspection.lodbook.codec;

public class LinkedDataCodecException extends RuntimeException {

    public LinkedDataCodecException(String message) {
        super(message);
    }

    public LinkedDataCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
