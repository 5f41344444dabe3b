package com.ryuqq.parley.adapter.router.participant;

import com.ryuqq.parley.core.message.Message;
import com.ryuqq.parley.core.spi.Participant;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 메시지가 특정 참가자를 지목하는지 판단.
 *
 * <p>명시 대상 목록이 있으면 그것만 기준으로 삼습니다. 목록이 없을 때에만 본문에서
 * 참가자의 표시 이름이나 ID 값을 단어 경계 기준으로 찾습니다. 본문 검사는 최선 노력이며
 * 오탐이 있을 수 있습니다.</p>
 *
 * @author Parley Team
 * @since 1.0.0
 */
public final class AddressingRules {

    private AddressingRules() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 메시지가 참가자를 지목하는지 확인.
     *
     * @param message 확인할 메시지
     * @param participant 대상 참가자
     * @return 지목하면 true (자기 자신이 보낸 메시지는 false)
     */
    public static boolean isAddressedTo(Message message, Participant participant) {
        if (message.sender().equals(participant.id())) {
            return false;
        }
        if (message.hasExplicitTargets()) {
            return message.targets(participant.id());
        }
        return mentions(message.content(), participant.displayName())
            || mentions(message.content(), participant.id().getValue());
    }

    /**
     * 본문에 이름이 단어 단위로 등장하는지 확인 (대소문자 무시).
     */
    static boolean mentions(String content, String name) {
        if (content == null || content.isEmpty() || name == null || name.isBlank()) {
            return false;
        }
        Pattern pattern = Pattern.compile(
            "(?<![\\p{Alnum}_])" + Pattern.quote(name.toLowerCase(Locale.ROOT)) + "(?![\\p{Alnum}_])");
        return pattern.matcher(content.toLowerCase(Locale.ROOT)).find();
    }
}
