package com.careerhub.matchservice.games.careermatch.service.impl;

import com.careerhub.matchservice.games.careermatch.config.CareerMatchProperties;
import com.careerhub.matchservice.games.careermatch.domain.constants.GameMessages;
import com.careerhub.matchservice.games.careermatch.domain.dto.FlipResult;
import com.careerhub.matchservice.games.careermatch.domain.dto.GameStateView;
import com.careerhub.matchservice.games.careermatch.domain.dto.JoinResult;
import com.careerhub.matchservice.games.careermatch.domain.enums.ConnectionStatus;
import com.careerhub.matchservice.games.careermatch.domain.enums.Difficulty;
import com.careerhub.matchservice.games.careermatch.domain.event.SessionOpenedEvent;
import com.careerhub.matchservice.games.careermatch.domain.exception.CareerMatchException;
import com.careerhub.matchservice.games.careermatch.domain.exception.ErrorCode;
import com.careerhub.matchservice.games.careermatch.domain.model.GameSession;
import com.careerhub.matchservice.games.careermatch.domain.model.Participant;
import com.careerhub.matchservice.games.careermatch.domain.model.PerpetualRoom;
import com.careerhub.matchservice.games.careermatch.domain.port.GameEventPublisher;
import com.careerhub.matchservice.games.careermatch.domain.port.GameEventPublisher.MatchEventType;
import com.careerhub.matchservice.games.careermatch.domain.repository.CardStore;
import com.careerhub.matchservice.games.careermatch.service.CardMatchStateMachine;
import com.careerhub.matchservice.games.careermatch.service.CareerMatchService;
import com.careerhub.matchservice.games.careermatch.service.MatchLocks;
import com.careerhub.matchservice.games.careermatch.service.ParticipantRegistry;
import com.careerhub.matchservice.games.careermatch.service.RoomAllocator;
import com.careerhub.matchservice.games.careermatch.service.SessionManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

@Slf4j
@Service
@RequiredArgsConstructor
public class CareerMatchServiceImpl implements CareerMatchService {

    private final RoomAllocator allocator;
    private final SessionManager sessionManager;
    private final ParticipantRegistry registry;
    private final CardMatchStateMachine stateMachine;
    private final CardStore cards;
    private final MatchLocks locks;
    private final GameEventPublisher publisher;
    private final ApplicationEventPublisher domainEvents;
    private final CareerMatchProperties props;
    private final Clock clock;

    @Override
    public JoinResult joinGame(String userId, String displayName, Difficulty difficulty) {
        if (StringUtils.isBlank(userId)) {
            throw new IllegalArgumentException("userId 不能为空");
        }
        PerpetualRoom allocated = allocator.findAvailableRoom(difficulty);
        String roomId = allocated.getId();
        String token = locks.lockRoom(roomId);
        try {
            GameSession session = sessionManager.getOrCreateActiveSession(roomId);
            PerpetualRoom room = sessionManager.requireRoom(roomId);

            Optional<Participant> existing = registry.findUser(session.getId(), userId);
            if (existing.isEmpty()
                    && registry.listParticipants(session.getId()).size() >= room.getMaxPlayersPerGame()) {
                throw CareerMatchException.of(ErrorCode.SESSION_FULL, GameMessages.SESSION_FULL);
            }
            Participant me = existing.orElseGet(() -> registry.addUserParticipant(session, room, userId, displayName));
            List<Participant> all = registry.listParticipants(session.getId());
            if (existing.isEmpty()) {
                publisher.publishToSession(roomId, session.getId(), MatchEventType.PARTICIPANT_JOINED, me);
            }

            GameSession current = session;
            if (!session.started()) {
                if (all.size() >= room.getMaxPlayersPerGame()) {
                    current = sessionManager.startGameSession(session.getId());
                    all = registry.listParticipants(session.getId());
                } else if (existing.isEmpty() && all.size() == 1) {
                    long fillAt = clock.millis() + props.getAiFill().getWaitSeconds() * 1000L;
                    if (room.getNextGameStartsAt() != null) {
                        fillAt = Math.max(fillAt, room.getNextGameStartsAt());
                    }
                    domainEvents.publishEvent(new SessionOpenedEvent(roomId, session.getId(), fillAt));
                }
            }
            boolean host = registry.findHost(session.getId())
                    .map(h -> h.getId().equals(me.getId()))
                    .orElse(false);
            return new JoinResult(sessionManager.requireRoom(roomId), current, me, all, host);
        } finally {
            locks.unlockRoom(roomId, token);
        }
    }

    @Override
    public CompletableFuture<FlipResult> flipCard(String sessionId, int position, String actorId) {
        if (StringUtils.isBlank(actorId)) {
            throw new IllegalArgumentException("actorId 不能为空");
        }
        return stateMachine.flip(sessionId, position, actorId);
    }

    @Override
    public GameStateView getGameState(String sessionId) {
        GameSession session = sessionManager.requireSession(sessionId);
        return new GameStateView(
                session,
                registry.listParticipants(sessionId),
                cards.findBySession(sessionId),
                sessionManager.requireRoom(session.getRoomId()));
    }

    @Override
    public GameSession startGameSession(String sessionId) {
        GameSession session = sessionManager.requireSession(sessionId);
        String token = locks.lockRoom(session.getRoomId());
        try {
            return sessionManager.startGameSession(sessionId);
        } finally {
            locks.unlockRoom(session.getRoomId(), token);
        }
    }

    @Override
    public Participant reportConnection(String sessionId, String userId, ConnectionStatus status) {
        sessionManager.requireSession(sessionId);
        return registry.updateConnectionStatus(sessionId, userId, status)
                .orElseThrow(() -> new IllegalArgumentException("参与者不存在: " + userId));
    }

    @Override
    public List<PerpetualRoom> listRooms() {
        return allocator.listRooms();
    }
}
