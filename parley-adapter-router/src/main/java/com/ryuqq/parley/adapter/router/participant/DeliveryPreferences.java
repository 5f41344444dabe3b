package com.ryuqq.parley.adapter.router.participant;

/**
 * 사람 참가자의 전달 선호.
 *
 * @param streamingEnabled 점진 표시 사용 여부
 * @param meetingNotifications 회의 발언 점진 표시 수준
 *
 * @author Parley Team
 * @since 1.0.0
 */
public record DeliveryPreferences(boolean streamingEnabled, MeetingNotifications meetingNotifications) {

    public DeliveryPreferences {
        if (meetingNotifications == null) {
            throw new IllegalArgumentException("meetingNotifications cannot be null");
        }
    }

    /**
     * 기본 선호: 점진 표시 사용, 모든 회의 발언 표시.
     */
    public static DeliveryPreferences defaults() {
        return new DeliveryPreferences(true, MeetingNotifications.ALL);
    }

    public DeliveryPreferences withStreamingEnabled(boolean streamingEnabled) {
        return new DeliveryPreferences(streamingEnabled, meetingNotifications);
    }

    public DeliveryPreferences withMeetingNotifications(MeetingNotifications meetingNotifications) {
        return new DeliveryPreferences(streamingEnabled, meetingNotifications);
    }
}
