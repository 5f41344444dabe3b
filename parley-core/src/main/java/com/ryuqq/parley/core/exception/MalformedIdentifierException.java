package com.ryuqq.parley.core.exception;

/**
 * 식별자 텍스트를 파싱할 수 없는 경우.
 *
 * @author Parley Team
 * @since 1.0.0
 */
public class MalformedIdentifierException extends ParleyException {

    public static final String ERROR_CODE = "ID-400";

    private final String text;

    public MalformedIdentifierException(String text, String reason) {
        super(ERROR_CODE, "Malformed identifier '" + text + "': " + reason);
        this.text = text;
    }

    /**
     * 파싱에 실패한 원본 텍스트.
     *
     * @return 원본 텍스트 (null 가능)
     */
    public String text() {
        return text;
    }
}
