package com.ryuqq.parley.core.model;

import com.ryuqq.parley.core.exception.MalformedIdentifierException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 경계 텍스트를 타입이 있는 식별자로 변환하는 파서.
 *
 * <p>인터프리터 계층에서 들어오는 텍스트는 이 클래스에서 정확히 한 번 파싱됩니다.
 * 이후 코어 내부에서는 식별자를 문자열로 비교하지 않습니다.</p>
 *
 * <p><strong>인식하는 형식:</strong></p>
 * <ul>
 *   <li>{@code "agent 1234"} - {@link AgentId}</li>
 *   <li>{@code "meeting 42"} - {@link MeetingId}</li>
 *   <li>{@code "human"}, {@code "user"} (대소문자 무관) - 기본 {@link HumanRef}</li>
 *   <li>{@code "human alice"} - 이름 있는 {@link HumanRef}</li>
 *   <li>{@code "42"} - 접두어 없는 ID (문맥 {@link IdKind}가 주어진 경우에만 허용)</li>
 * </ul>
 *
 * @author Parley Team
 * @since 1.0.0
 */
public final class IdentifierParser {

    private static final String USER_ALIAS = "user";
    private static final String WILDCARD = "*";

    private IdentifierParser() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 접두어가 있는 식별자 파싱.
     *
     * @param text 식별자 텍스트
     * @return AgentId, MeetingId 또는 HumanRef
     * @throws MalformedIdentifierException 형식이 잘못되었거나 접두어 없는 ID인 경우
     */
    public static EntityId parse(String text) {
        return parse(text, null);
    }

    /**
     * 문맥을 사용하여 식별자 파싱.
     *
     * <p>접두어 없는 ID는 {@code context} 종류로 해석합니다. 접두어가 있으면 문맥은 무시됩니다.</p>
     *
     * @param text 식별자 텍스트
     * @param context 접두어 없는 ID의 종류 (null이면 접두어 없는 ID를 거부)
     * @return 파싱된 식별자
     * @throws MalformedIdentifierException 형식이 잘못된 경우
     */
    public static EntityId parse(String text, IdKind context) {
        if (text == null || text.isBlank()) {
            throw new MalformedIdentifierException(text, "identifier cannot be empty");
        }
        String[] tokens = text.trim().split("\\s+");
        if (tokens.length > 2) {
            throw new MalformedIdentifierException(text, "unexpected trailing tokens");
        }
        String head = tokens[0].toLowerCase(Locale.ROOT);

        if (tokens.length == 1) {
            if (isHumanAlias(head)) {
                return HumanRef.defaultHuman();
            }
            if (isPrefix(head)) {
                throw new MalformedIdentifierException(text, "missing value after '" + head + "'");
            }
            if (context == null) {
                throw new MalformedIdentifierException(text, "ambiguous bare identifier");
            }
            return create(context, tokens[0], text);
        }

        IdKind kind = prefixKind(head);
        if (kind == null) {
            throw new MalformedIdentifierException(text, "unknown identifier prefix '" + tokens[0] + "'");
        }
        return create(kind, tokens[1], text);
    }

    /**
     * 에이전트 식별자 파싱 (접두어 없는 ID는 에이전트로 해석).
     *
     * @throws MalformedIdentifierException 에이전트 식별자가 아닌 경우
     */
    public static AgentId parseAgent(String text) {
        EntityId id = parse(text, IdKind.AGENT);
        if (!(id instanceof AgentId)) {
            throw new MalformedIdentifierException(text, "expected an agent identifier but got " + id.kind());
        }
        return (AgentId) id;
    }

    /**
     * 회의 식별자 파싱 (접두어 없는 ID는 회의로 해석).
     *
     * @throws MalformedIdentifierException 회의 식별자가 아닌 경우
     */
    public static MeetingId parseMeeting(String text) {
        EntityId id = parse(text, IdKind.MEETING);
        if (!(id instanceof MeetingId)) {
            throw new MalformedIdentifierException(text, "expected a meeting identifier but got " + id.kind());
        }
        return (MeetingId) id;
    }

    /**
     * 참가자(에이전트 또는 사람) 식별자 파싱.
     *
     * @throws MalformedIdentifierException 참가자 식별자가 아닌 경우
     */
    public static ParticipantId parseParticipant(String text) {
        EntityId id = parse(text, IdKind.AGENT);
        if (!(id instanceof ParticipantId)) {
            throw new MalformedIdentifierException(text, "expected a participant identifier but got " + id.kind());
        }
        return (ParticipantId) id;
    }

    /**
     * 수신자 지정 파싱.
     *
     * <p>쉼표로 구분된 목록을 받습니다. 회의가 포함되면 회의가 목적지가 되고 나머지 참가자는
     * 명시 대상이 됩니다 ({@code "meeting 42, agent 7, human alice"}). 회의가 없으면 참가자는
     * 정확히 하나여야 합니다.</p>
     *
     * @param text 수신자 지정 텍스트
     * @return RecipientSpec
     * @throws MalformedIdentifierException 형식이 잘못되었거나 목적지가 모호한 경우
     */
    public static RecipientSpec parseRecipient(String text) {
        if (text == null || text.isBlank()) {
            throw new MalformedIdentifierException(text, "recipient cannot be empty");
        }
        MeetingId meeting = null;
        List<ParticipantId> participants = new ArrayList<>();
        for (String part : text.split(",")) {
            EntityId id = parse(part, IdKind.AGENT);
            if (id instanceof MeetingId) {
                if (meeting != null) {
                    throw new MalformedIdentifierException(text, "more than one meeting in recipient");
                }
                meeting = (MeetingId) id;
            } else if (!participants.contains(id)) {
                participants.add((ParticipantId) id);
            }
        }
        if (meeting != null) {
            return RecipientSpec.meeting(meeting, participants);
        }
        if (participants.size() != 1) {
            throw new MalformedIdentifierException(text, "multiple participants require a meeting destination");
        }
        return RecipientSpec.participant(participants.get(0));
    }

    /**
     * 대기 출처 지정 파싱. {@code "*"}는 모든 출처입니다.
     *
     * @param text 출처 텍스트
     * @return SourceSpec
     * @throws MalformedIdentifierException 형식이 잘못된 경우
     */
    public static SourceSpec parseSource(String text) {
        if (text != null && WILDCARD.equals(text.trim())) {
            return SourceSpec.any();
        }
        return SourceSpec.of(parse(text, IdKind.AGENT));
    }

    private static EntityId create(IdKind kind, String value, String text) {
        if (!IdentifierRules.isValidValue(value)) {
            throw new MalformedIdentifierException(text, "invalid " + kind.prefix() + " value '" + value + "'");
        }
        return switch (kind) {
            case AGENT -> AgentId.of(value);
            case MEETING -> MeetingId.of(value);
            case HUMAN -> HumanRef.of(value);
        };
    }

    private static IdKind prefixKind(String head) {
        if (USER_ALIAS.equals(head)) {
            return IdKind.HUMAN;
        }
        for (IdKind kind : IdKind.values()) {
            if (kind.prefix().equals(head)) {
                return kind;
            }
        }
        return null;
    }

    private static boolean isPrefix(String head) {
        return prefixKind(head) != null;
    }

    private static boolean isHumanAlias(String head) {
        return IdKind.HUMAN.prefix().equals(head) || USER_ALIAS.equals(head);
    }
}
