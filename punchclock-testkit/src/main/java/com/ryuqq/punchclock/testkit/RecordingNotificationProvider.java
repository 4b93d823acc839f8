package com.ryuqq.punchclock.testkit;

import com.ryuqq.punchclock.application.notification.NotificationLevel;
import com.ryuqq.punchclock.application.notification.NotificationMessage;
import com.ryuqq.punchclock.application.notification.NotificationProvider;
import com.ryuqq.punchclock.application.notification.ProviderResult;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 받은 메시지를 기록만 하는 {@link NotificationProvider}.
 *
 * @author PunchClock Team
 * @since 1.0.0
 */
public class RecordingNotificationProvider implements NotificationProvider {

    private final String name;
    private final Set<NotificationLevel> levels;
    private final List<NotificationMessage> received = new CopyOnWriteArrayList<>();

    public RecordingNotificationProvider(String name) {
        this(name, EnumSet.allOf(NotificationLevel.class));
    }

    /**
     * 생성자.
     *
     * @param name 채널 이름
     * @param levels 전송 대상 등급
     */
    public RecordingNotificationProvider(String name, Set<NotificationLevel> levels) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (levels == null) {
            throw new IllegalArgumentException("levels cannot be null");
        }
        this.name = name;
        this.levels = levels.isEmpty() ? EnumSet.noneOf(NotificationLevel.class) : EnumSet.copyOf(levels);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean shouldNotify(NotificationMessage message) {
        return levels.contains(message.level());
    }

    @Override
    public ProviderResult deliver(NotificationMessage message) {
        received.add(message);
        return ProviderResult.delivered(name, 204);
    }

    public List<NotificationMessage> received() {
        return List.copyOf(received);
    }

    public NotificationMessage lastReceived() {
        if (received.isEmpty()) {
            throw new IllegalStateException(name + " has not received any message");
        }
        return received.get(received.size() - 1);
    }
}
