package com.careerhub.matchservice.games.careermatch.service;

import com.careerhub.matchservice.games.careermatch.domain.enums.Difficulty;
import com.careerhub.matchservice.games.careermatch.domain.exception.CareerMatchException;
import com.careerhub.matchservice.games.careermatch.domain.exception.ErrorCode;
import com.careerhub.matchservice.games.careermatch.domain.model.GameSession;
import com.careerhub.matchservice.games.careermatch.domain.model.Participant;
import com.careerhub.matchservice.games.careermatch.domain.model.PerpetualRoom;
import com.careerhub.matchservice.games.careermatch.support.CareerMatchFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TurnEngineTest {

    private CareerMatchFixture fx;
    private GameSession session;
    private List<Participant> roster;

    @BeforeEach
    void setUp() {
        fx = new CareerMatchFixture();
        PerpetualRoom room = fx.room("MATCH01", Difficulty.EASY, 3, 6);
        session = fx.startedSession(room, "u1", "u2", "u3");
        roster = fx.registry.listParticipants(session.getId());
        fx.giveTurnTo(session.getId(), roster.get(2).getId());
        session = fx.session(session.getId());
    }

    @AfterEach
    void tearDown() throws Exception {
        fx.close();
    }

    @Test
    @DisplayName("按入座顺序轮转，最后一位之后回到第一位")
    void advanceTurn_roundRobinWraps() {
        int turn = session.getCurrentTurnNumber();

        Participant next = fx.turnEngine.advanceTurn(session);
        assertThat(next.getId()).isEqualTo(roster.get(0).getId());
        next = fx.turnEngine.advanceTurn(session);
        assertThat(next.getId()).isEqualTo(roster.get(1).getId());

        assertThat(session.getCurrentTurnNumber()).isEqualTo(turn + 2);
        assertThat(session.getCurrentTurnPlayerId()).isEqualTo(roster.get(1).getId());
        assertThat(fx.registry.listParticipants(session.getId()))
                .filteredOn(Participant::isActiveTurn)
                .extracting(Participant::getId)
                .containsExactly(roster.get(1).getId());
    }

    @Test
    @DisplayName("换人时新持有者的回合数加一并清空翻牌标记")
    void advanceTurn_updatesHolder() {
        session.setFirstCardFlipped(4);
        int before = fx.participant(session.getId(), roster.get(0).getId()).getTurnsTaken();

        Participant next = fx.turnEngine.advanceTurn(session);

        assertThat(next.getTurnsTaken()).isEqualTo(before + 1);
        assertThat(next.getTurnStartedAt()).isEqualTo(fx.clock.millis());
        assertThat(session.getFirstCardFlipped()).isNull();
    }

    @Test
    @DisplayName("跳过已离开（inactive）的参与者")
    void advanceTurn_skipsInactive() {
        Participant gone = fx.participant(session.getId(), roster.get(0).getId());
        gone.setActive(false);
        fx.participants.save(gone);

        assertThat(fx.turnEngine.advanceTurn(session).getId()).isEqualTo(roster.get(1).getId());
    }

    @Test
    @DisplayName("非持有者校验失败返回 NOT_YOUR_TURN")
    void requireTurnHolder_rejectsOthers() {
        assertThat(fx.turnEngine.requireTurnHolder(session, "u3").getId()).isEqualTo(roster.get(2).getId());

        assertThatThrownBy(() -> fx.turnEngine.requireTurnHolder(session, "u1"))
                .isInstanceOf(CareerMatchException.class)
                .extracting(e -> ((CareerMatchException) e).getCode())
                .isEqualTo(ErrorCode.NOT_YOUR_TURN);
        assertThatThrownBy(() -> fx.turnEngine.requireTurnHolder(session, null))
                .isInstanceOf(CareerMatchException.class);
    }

    @Test
    @DisplayName("结算后收回回合，任何人都不能再行动")
    void releaseTurn_clearsHolder() {
        fx.turnEngine.releaseTurn(session);

        assertThat(session.getCurrentTurnPlayerId()).isNull();
        assertThat(fx.registry.listParticipants(session.getId())).noneMatch(Participant::isActiveTurn);
        assertThatThrownBy(() -> fx.turnEngine.requireTurnHolder(session, "u3"))
                .isInstanceOf(CareerMatchException.class);
    }
}
