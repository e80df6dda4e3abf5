package com.careerhub.matchservice.games.careermatch.service;

import com.careerhub.matchservice.games.careermatch.domain.enums.Difficulty;
import com.careerhub.matchservice.games.careermatch.domain.enums.ParticipantType;
import com.careerhub.matchservice.games.careermatch.domain.enums.RoomStatus;
import com.careerhub.matchservice.games.careermatch.domain.enums.SessionStatus;
import com.careerhub.matchservice.games.careermatch.domain.event.TurnStartedEvent;
import com.careerhub.matchservice.games.careermatch.domain.exception.CareerMatchException;
import com.careerhub.matchservice.games.careermatch.domain.exception.ErrorCode;
import com.careerhub.matchservice.games.careermatch.domain.model.Card;
import com.careerhub.matchservice.games.careermatch.domain.model.GameSession;
import com.careerhub.matchservice.games.careermatch.domain.model.Participant;
import com.careerhub.matchservice.games.careermatch.domain.model.PerpetualRoom;
import com.careerhub.matchservice.games.careermatch.domain.port.GameEventPublisher.MatchEventType;
import com.careerhub.matchservice.games.careermatch.support.CareerMatchFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionManagerTest {

    private CareerMatchFixture fx;
    private PerpetualRoom room;

    @BeforeEach
    void setUp() {
        fx = new CareerMatchFixture();
        room = fx.room("MATCH01", Difficulty.MEDIUM, 4, 8);
    }

    @AfterEach
    void tearDown() throws Exception {
        fx.close();
    }

    @Test
    @DisplayName("房间已有进行中的对局时直接复用")
    void getOrCreateActiveSession_reusesActive() {
        GameSession first = fx.sessionManager.getOrCreateActiveSession(room.getId());
        GameSession again = fx.sessionManager.getOrCreateActiveSession(room.getId());

        assertThat(again.getId()).isEqualTo(first.getId());
        assertThat(first.getGameNumber()).isEqualTo(1);
        assertThat(first.getPairsRemaining()).isEqualTo(8);
        assertThat(fx.cards.findBySession(first.getId())).hasSize(16);
        assertThat(fx.sessionManager.requireRoom(room.getId()).getCurrentGameId()).isEqualTo(first.getId());
    }

    @Test
    @DisplayName("上一局结束后新建下一局，局号递增")
    void getOrCreateActiveSession_afterCompletion() {
        GameSession first = fx.sessionManager.getOrCreateActiveSession(room.getId());
        first.setStatus(SessionStatus.COMPLETED);
        fx.sessionManager.persist(first);

        GameSession next = fx.sessionManager.getOrCreateActiveSession(room.getId());

        assertThat(next.getId()).isNotEqualTo(first.getId());
        assertThat(next.getGameNumber()).isEqualTo(2);
        assertThat(next.started()).isFalse();
    }

    @Test
    @DisplayName("一名真人开局：AI 补齐三席，16 张牌全部背面朝上，恰好一人持有回合")
    void startGameSession_fillsWithAi() {
        GameSession session = fx.sessionManager.getOrCreateActiveSession(room.getId());
        fx.registry.addUserParticipant(session, fx.sessionManager.requireRoom(room.getId()), "u1", "Ada");

        GameSession started = fx.sessionManager.startGameSession(session.getId());

        List<Participant> roster = fx.registry.listParticipants(session.getId());
        assertThat(roster).hasSize(4);
        assertThat(roster).filteredOn(p -> p.getParticipantType() == ParticipantType.AI_AGENT).hasSize(3);
        assertThat(roster).filteredOn(Participant::isActiveTurn).hasSize(1);
        assertThat(roster).extracting(Participant::getId).contains(started.getCurrentTurnPlayerId());

        List<Card> cards = fx.cards.findBySession(session.getId());
        assertThat(cards).hasSize(16);
        assertThat(cards).allMatch(Card::faceDown);

        assertThat(started.started()).isTrue();
        assertThat(started.getCurrentTurnNumber()).isEqualTo(1);
        assertThat(started.getTotalParticipants()).isEqualTo(4);
        assertThat(started.getHumanParticipants()).isEqualTo(1);
        assertThat(started.getAiParticipants()).isEqualTo(3);

        PerpetualRoom after = fx.sessionManager.requireRoom(room.getId());
        assertThat(after.getStatus()).isEqualTo(RoomStatus.ACTIVE);
        assertThat(after.getCurrentPlayerCount()).isEqualTo(4);
        assertThat(after.getLastGameStartedAt()).isEqualTo(fx.clock.millis());

        assertThat(fx.publisher.ofType(MatchEventType.GAME_STARTED)).hasSize(1);
        assertThat(fx.domainEvents).filteredOn(e -> e instanceof TurnStartedEvent).hasSize(1);
    }

    @Test
    @DisplayName("关闭 AI 补位时按实际人数开局")
    void startGameSession_withoutAiFill() {
        PerpetualRoom r = fx.sessionManager.requireRoom(room.getId());
        r.setAiFillEnabled(false);
        fx.rooms.save(r);
        GameSession session = fx.sessionManager.getOrCreateActiveSession(room.getId());
        fx.registry.addUserParticipant(session, fx.sessionManager.requireRoom(room.getId()), "u1", "Ada");

        fx.sessionManager.startGameSession(session.getId());

        assertThat(fx.registry.listParticipants(session.getId())).hasSize(1);
    }

    @Test
    @DisplayName("已开局时再次开局不改变任何状态")
    void startGameSession_idempotent() {
        GameSession session = fx.startedSession(room, "u1");
        String holder = session.getCurrentTurnPlayerId();

        GameSession again = fx.sessionManager.startGameSession(session.getId());

        assertThat(again.getCurrentTurnPlayerId()).isEqualTo(holder);
        assertThat(fx.registry.listParticipants(session.getId())).hasSize(4);
        assertThat(fx.publisher.ofType(MatchEventType.GAME_STARTED)).hasSize(1);
    }

    @Test
    @DisplayName("没有参与者时开局返回 EMPTY_ROOM")
    void startGameSession_emptyRoom() {
        GameSession session = fx.sessionManager.getOrCreateActiveSession(room.getId());

        assertThatThrownBy(() -> fx.sessionManager.startGameSession(session.getId()))
                .isInstanceOf(CareerMatchException.class)
                .extracting(e -> ((CareerMatchException) e).getCode())
                .isEqualTo(ErrorCode.EMPTY_ROOM);
    }

    @Test
    @DisplayName("版本落后的保存返回 TURN_CONFLICT")
    void persist_staleVersion_conflicts() {
        GameSession session = fx.sessionManager.getOrCreateActiveSession(room.getId());
        GameSession copyA = fx.session(session.getId());
        GameSession copyB = fx.session(session.getId());

        fx.sessionManager.persist(copyA);

        assertThatThrownBy(() -> fx.sessionManager.persist(copyB))
                .isInstanceOf(CareerMatchException.class)
                .extracting(e -> ((CareerMatchException) e).getCode())
                .isEqualTo(ErrorCode.TURN_CONFLICT);
    }

    @Test
    @DisplayName("不存在的房间 / 对局返回 NOT_FOUND 类错误")
    void require_missing() {
        assertThatThrownBy(() -> fx.sessionManager.requireRoom("nope"))
                .extracting(e -> ((CareerMatchException) e).getCode())
                .isEqualTo(ErrorCode.ROOM_NOT_FOUND);
        assertThatThrownBy(() -> fx.sessionManager.requireSession("nope"))
                .extracting(e -> ((CareerMatchException) e).getCode())
                .isEqualTo(ErrorCode.SESSION_NOT_FOUND);
    }
}
