package com.ryuqq.parley.core.exception;

/**
 * Parley 코어의 모든 타입 오류의 상위 클래스.
 *
 * <p>각 하위 클래스는 고정된 오류 코드를 가지며, 호출 측은 타입 또는 오류 코드로 분기합니다.
 * 코어는 이 오류들을 내부에서 재시도하거나 다른 결과로 바꾸지 않습니다.</p>
 *
 * <p><strong>오류 분류:</strong></p>
 * <ul>
 *   <li>{@link MalformedIdentifierException} - 식별자 파싱 실패 (ID-400)</li>
 *   <li>{@link NotMeetingParticipantException} - 회의 참가자가 아닌 요청 (MEETING-403)</li>
 *   <li>{@link UnknownRecipientException} - 라우팅 대상 없음 (ROUTE-404)</li>
 *   <li>{@link MeetingTimeoutException} - 정족수 대기 시간 초과 (MEETING-408)</li>
 *   <li>{@link StreamProtocolException} - 스트림 단계 위반 (STREAM-409)</li>
 *   <li>{@link MeetingEndedException} - 종료된 회의에 대한 요청 (MEETING-410)</li>
 *   <li>{@link DeliveryFailureException} - 단일 수신자 전달 실패 (DELIVERY-500)</li>
 * </ul>
 *
 * @author Parley Team
 * @since 1.0.0
 */
public abstract class ParleyException extends RuntimeException {

    private final String errorCode;

    protected ParleyException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected ParleyException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * 오류 코드 조회.
     *
     * @return 오류 코드 (예: ROUTE-404)
     */
    public String errorCode() {
        return errorCode;
    }
}
