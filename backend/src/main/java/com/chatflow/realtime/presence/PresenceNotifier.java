package com.chatflow.realtime.presence;

import com.chatflow.realtime.hub.FanoutHub;
import com.chatflow.realtime.model.Chat;
import com.chatflow.realtime.protocol.EventKind;
import com.chatflow.realtime.protocol.event.PresencePayload;
import com.chatflow.realtime.repository.ChatRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Pushes presence transitions to everyone sharing a chat with the user, on the
 * single-threaded {@code presenceExecutor} so announcements leave in the order the
 * tracker produced them. Each co-member receives one event even if they share several
 * chats with the user.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PresenceNotifier {

    private final ChatRepository chatRepository;
    private final FanoutHub hub;

    @Async("presenceExecutor")
    public void announce(EventKind kind, PresencePayload payload) {
        String userId = payload.getUserId();
        Set<String> audience = new LinkedHashSet<>();
        for (Chat chat : chatRepository.findByMember(userId)) {
            audience.addAll(chat.memberIds());
        }
        audience.remove(userId);

        for (String memberId : audience) {
            hub.sendToUser(memberId, kind, null, payload);
        }
        log.debug("Presence {} for userId={} sent to {} co-members", kind, userId, audience.size());
    }
}
