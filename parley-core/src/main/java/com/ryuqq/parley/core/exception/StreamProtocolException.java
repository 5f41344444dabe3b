package com.ryuqq.parley.core.exception;

/**
 * 스트림 단계 순서 위반 (start 없이 chunk/complete, complete 이후 chunk 등).
 *
 * @author Parley Team
 * @since 1.0.0
 */
public class StreamProtocolException extends ParleyException {

    public static final String ERROR_CODE = "STREAM-409";

    private final String streamId;

    public StreamProtocolException(String streamId, String message) {
        super(ERROR_CODE, "Stream " + streamId + ": " + message);
        this.streamId = streamId;
    }

    public String streamId() {
        return streamId;
    }
}
