package com.ryuqq.parley.application.router;

import com.ryuqq.parley.application.meeting.MeetingCoordinator;
import com.ryuqq.parley.core.message.Message;
import com.ryuqq.parley.core.message.MessageType;
import com.ryuqq.parley.core.model.ParticipantId;
import com.ryuqq.parley.core.model.RecipientSpec;
import com.ryuqq.parley.core.model.SourceSpec;
import com.ryuqq.parley.core.outcome.DeliveryReport;
import com.ryuqq.parley.core.outcome.StreamStartResult;
import com.ryuqq.parley.core.spi.Participant;

import java.time.Duration;
import java.util.List;

/**
 * 참가자와 채널을 잇는 최상위 라우터.
 *
 * <p>컴파일러/인터프리터 계층이 호출하는 진입점입니다. 텍스트로 된 수신자/출처 지정은
 * 여기서 한 번 파싱되고, 이후 코어 내부는 타입이 있는 식별자만 사용합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * router.register(planner);
 * router.register(human);
 *
 * DeliveryReport report = router.routeMessage(
 *     HumanRef.defaultHuman(), "agent planner", "plan the release", MessageType.DIRECT);
 *
 * List&lt;Message&gt; batch = router.waitForMessages(planner.id(), "*", Duration.ofSeconds(5));
 * </pre>
 *
 * @author Parley Team
 * @since 1.0.0
 */
public interface MessageRouter {

    /**
     * 참가자 등록.
     *
     * @param participant 등록할 참가자
     * @throws IllegalArgumentException participant가 null인 경우
     * @throws IllegalStateException 같은 ID로 다른 참가자가 이미 등록된 경우
     */
    void register(Participant participant);

    /**
     * 참가자 등록 해제. 등록되지 않은 ID는 무시합니다.
     *
     * @param participantId 해제할 참가자 ID
     */
    void unregister(ParticipantId participantId);

    boolean isRegistered(ParticipantId participantId);

    /**
     * 텍스트 수신자 지정으로 메시지 라우팅.
     *
     * @param sender 발신자
     * @param recipientSpec 수신자 지정 (예: "agent 7", "meeting 101, agent 7")
     * @param content 본문
     * @param type DIRECT 또는 MEETING_BROADCAST
     * @return 전달 결과 (부분 실패 포함)
     * @throws com.ryuqq.parley.core.exception.MalformedIdentifierException 수신자 지정 형식이 잘못된 경우
     * @throws com.ryuqq.parley.core.exception.UnknownRecipientException 수신자가 등록되지 않은 경우
     * @throws com.ryuqq.parley.core.exception.MeetingEndedException 종료된 회의로 보낸 경우
     */
    DeliveryReport routeMessage(ParticipantId sender, String recipientSpec, String content, MessageType type);

    /**
     * 파싱된 수신자 지정으로 메시지 라우팅.
     *
     * @see #routeMessage(ParticipantId, String, String, MessageType)
     */
    DeliveryReport routeMessage(ParticipantId sender, RecipientSpec recipient, String content, MessageType type);

    /**
     * 참가자의 받은편지함에서 메시지 배치를 기다림.
     *
     * <p>회의 출처는 차등 대기 정책을 따릅니다. 명시적으로 지목된 메시지가 있으면 짧게,
     * 없으면 길게 모아서 돌려줍니다. 사람이 보낸 메시지는 즉시 돌려줍니다.</p>
     *
     * @param participant 대기하는 참가자
     * @param sourceSpec 출처 지정 ("*", "agent 7", "meeting 101")
     * @param timeout 최대 대기 시간
     * @return 도착 순서의 메시지 배치 (시간 초과 시 빈 목록 가능)
     * @throws com.ryuqq.parley.core.exception.UnknownRecipientException 참가자가 등록되지 않은 경우
     */
    List<Message> waitForMessages(ParticipantId participant, String sourceSpec, Duration timeout);

    List<Message> waitForMessages(ParticipantId participant, SourceSpec source, Duration timeout);

    /**
     * 설정된 기본 대기 시간으로 메시지 배치를 기다림.
     */
    List<Message> waitForMessages(ParticipantId participant, SourceSpec source);

    /**
     * 스트림 시작.
     *
     * @param sender 발신자
     * @param recipientSpec 수신자 지정
     * @return 시작 또는 건너뜀 결과
     */
    StreamStartResult startStream(ParticipantId sender, String recipientSpec);

    /**
     * 스트림 조각 추가.
     *
     * @throws com.ryuqq.parley.core.exception.StreamProtocolException 알 수 없거나 완료된 스트림인 경우
     */
    void streamChunk(String streamId, String chunk);

    /**
     * 스트림 완료. 누적된 전체 본문을 한 번 전달합니다.
     *
     * @return 최종 메시지의 전달 결과
     * @throws com.ryuqq.parley.core.exception.StreamProtocolException 알 수 없거나 이미 완료된 스트림인 경우
     */
    DeliveryReport completeStream(String streamId);

    /**
     * 회의 조정자.
     *
     * @return 같은 채널/참가자 레지스트리를 공유하는 MeetingCoordinator
     */
    MeetingCoordinator meetings();
}
