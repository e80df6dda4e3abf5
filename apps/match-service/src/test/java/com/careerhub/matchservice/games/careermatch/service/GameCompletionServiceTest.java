package com.careerhub.matchservice.games.careermatch.service;

import com.careerhub.matchservice.games.careermatch.domain.dto.CareerMatchResult;
import com.careerhub.matchservice.games.careermatch.domain.dto.FlipResult;
import com.careerhub.matchservice.games.careermatch.domain.dto.JoinResult;
import com.careerhub.matchservice.games.careermatch.domain.enums.Difficulty;
import com.careerhub.matchservice.games.careermatch.domain.enums.RoomStatus;
import com.careerhub.matchservice.games.careermatch.domain.enums.SessionStatus;
import com.careerhub.matchservice.games.careermatch.domain.event.SessionClosedEvent;
import com.careerhub.matchservice.games.careermatch.domain.model.GameSession;
import com.careerhub.matchservice.games.careermatch.domain.model.Participant;
import com.careerhub.matchservice.games.careermatch.domain.model.PerpetualRoom;
import com.careerhub.matchservice.games.careermatch.domain.model.WinnerEntry;
import com.careerhub.matchservice.games.careermatch.domain.port.GameEventPublisher.MatchEventType;
import com.careerhub.matchservice.games.careermatch.domain.port.XpLedger;
import com.careerhub.matchservice.games.careermatch.support.CareerMatchFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class GameCompletionServiceTest {

    private CareerMatchFixture fx;

    @AfterEach
    void tearDown() throws Exception {
        fx.close();
    }

    private void flip(String sessionId, int position, String actor) throws Exception {
        fx.stateMachine.flip(sessionId, position, actor).get(5, TimeUnit.SECONDS);
    }

    @Test
    @DisplayName("完整对局：按配对数排名，房间进入 10 秒局间休息")
    void completeGame_ranksAndStartsIntermission() throws Exception {
        fx = new CareerMatchFixture();
        PerpetualRoom room = fx.room("MATCH01", Difficulty.EASY, 3, 3);
        GameSession session = fx.startedSession(room, "u1", "u2", "u3");
        String sid = session.getId();
        fx.layDeck(sid, "x", "x", "y", "y", "z", "z");
        Participant u1 = fx.registry.findUser(sid, "u1").orElseThrow();
        Participant u2 = fx.registry.findUser(sid, "u2").orElseThrow();
        Participant u3 = fx.registry.findUser(sid, "u3").orElseThrow();
        fx.giveTurnTo(sid, u1.getId());
        fx.clock.advance(Duration.ofSeconds(95));

        flip(sid, 0, "u1");
        flip(sid, 2, "u1");
        flip(sid, 0, "u2");
        flip(sid, 1, "u2");
        flip(sid, 2, "u2");
        flip(sid, 4, "u2");
        flip(sid, 2, "u3");
        flip(sid, 3, "u3");
        flip(sid, 4, "u3");
        flip(sid, 5, "u3");

        GameSession done = fx.session(sid);
        assertThat(done.getStatus()).isEqualTo(SessionStatus.COMPLETED);
        assertThat(done.getCompletedAt()).isEqualTo(fx.clock.millis());
        assertThat(done.getDurationSeconds()).isEqualTo(95);
        assertThat(done.getWinners())
                .extracting(WinnerEntry::getParticipantId, WinnerEntry::getPairsMatched, WinnerEntry::getRank)
                .containsExactly(
                        org.assertj.core.groups.Tuple.tuple(u3.getId(), 2, 1),
                        org.assertj.core.groups.Tuple.tuple(u2.getId(), 1, 2),
                        org.assertj.core.groups.Tuple.tuple(u1.getId(), 0, 3));

        PerpetualRoom after = fx.sessionManager.requireRoom(room.getId());
        assertThat(after.getStatus()).isEqualTo(RoomStatus.INTERMISSION);
        assertThat(after.getNextGameStartsAt()).isEqualTo(fx.clock.millis() + 10_000);
        assertThat(after.getTotalGamesPlayed()).isEqualTo(1);
        assertThat(after.getTotalMatchesMade()).isEqualTo(3);
        assertThat(after.getAvgGameDurationSeconds()).isEqualTo(95);

        assertThat(fx.publisher.ofType(MatchEventType.GAME_COMPLETED)).hasSize(1);
        assertThat(fx.publisher.ofType(MatchEventType.ROOM_INTERMISSION)).hasSize(1);
        assertThat(fx.domainEvents).filteredOn(e -> e instanceof SessionClosedEvent).hasSize(1);

        assertThat(fx.postedResults).hasSize(1);
        CareerMatchResult posted = fx.postedResults.get(0);
        assertThat(posted.sessionId()).isEqualTo(sid);
        assertThat(posted.standings()).hasSize(3);
    }

    @Test
    @DisplayName("配对数相同时按平台 XP，再按入座顺序排名")
    void rank_tieBreaks() {
        fx = new CareerMatchFixture();
        Participant a = participant("a", 1, 2, 10);
        Participant b = participant("b", 2, 2, 25);
        Participant c = participant("c", 3, 2, 25);
        Participant d = participant("d", 4, 3, 30);

        List<WinnerEntry> ranked = fx.completion.rank(List.of(a, b, c, d));

        assertThat(ranked).extracting(WinnerEntry::getParticipantId).containsExactly("d", "b", "c", "a");
        assertThat(ranked).extracting(WinnerEntry::getRank).containsExactly(1, 2, 3, 4);
    }

    @Test
    @DisplayName("XP 账本推送失败不影响结算")
    void completeGame_ledgerFailureIsNotFatal() throws Exception {
        XpLedger ledger = mock(XpLedger.class);
        doThrow(new IllegalStateException("ledger down")).when(ledger).postResults(any());
        fx = new CareerMatchFixture(42L, ledger);
        PerpetualRoom room = fx.room("SOLO", Difficulty.EASY, 1, 1);
        GameSession session = fx.startedSession(room, "u1");

        flip(session.getId(), 0, "u1");
        flip(session.getId(), 1, "u1");

        assertThat(fx.session(session.getId()).getStatus()).isEqualTo(SessionStatus.COMPLETED);
        assertThat(fx.sessionManager.requireRoom(room.getId()).getStatus()).isEqualTo(RoomStatus.INTERMISSION);
        ArgumentCaptor<CareerMatchResult> captor = ArgumentCaptor.forClass(CareerMatchResult.class);
        verify(ledger).postResults(captor.capture());
        assertThat(captor.getValue().standings()).hasSize(1);
    }

    @Test
    @DisplayName("局间休息结束后房间恢复开放，重复调用无效果")
    void reopenRoom_onlyFromIntermission() throws Exception {
        fx = new CareerMatchFixture();
        PerpetualRoom room = fx.room("SOLO", Difficulty.EASY, 1, 1);
        GameSession session = fx.startedSession(room, "u1");
        flip(session.getId(), 0, "u1");
        flip(session.getId(), 1, "u1");

        assertThat(fx.completion.reopenRoom(room.getId())).isTrue();
        PerpetualRoom after = fx.sessionManager.requireRoom(room.getId());
        assertThat(after.getStatus()).isEqualTo(RoomStatus.ACTIVE);
        assertThat(after.getNextGameStartsAt()).isNull();
        assertThat(after.getCurrentPlayerCount()).isZero();
        assertThat(fx.publisher.ofType(MatchEventType.ROOM_REOPENED)).hasSize(1);

        assertThat(fx.completion.reopenRoom(room.getId())).isFalse();
        assertThat(fx.sessionManager.getOrCreateActiveSession(room.getId()).getGameNumber()).isEqualTo(2);
    }

    @Test
    @DisplayName("XP 账本很慢时终局翻牌立即返回，其它对局的揭示不受影响")
    void completeGame_slowLedgerDoesNotStallOtherSessions() throws Exception {
        CountDownLatch ledgerRelease = new CountDownLatch(1);
        List<CareerMatchResult> posted = new CopyOnWriteArrayList<>();
        XpLedger slowLedger = result -> {
            try {
                ledgerRelease.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            posted.add(result);
        };
        ExecutorService ledgerPool = Executors.newSingleThreadExecutor();
        try {
            fx = new CareerMatchFixture(42L, slowLedger, ledgerPool);
            GameSession a = fx.startedSession(fx.room("SOLO-A", Difficulty.EASY, 1, 1), "u1");
            GameSession b = fx.startedSession(fx.room("SOLO-B", Difficulty.EASY, 1, 2), "u2");
            fx.layDeck(b.getId(), "x", "y", "x", "y");

            flip(a.getId(), 0, "u1");
            FlipResult last = fx.stateMachine.flip(a.getId(), 1, "u1").get(2, TimeUnit.SECONDS);
            assertThat(last.isGameCompleted()).isTrue();
            assertThat(fx.gameLock.isLocked("session:" + a.getId())).isFalse();
            assertThat(fx.gameLock.isLocked("room:" + a.getRoomId())).isFalse();

            flip(b.getId(), 0, "u2");
            FlipResult miss = fx.stateMachine.flip(b.getId(), 1, "u2").get(2, TimeUnit.SECONDS);
            assertThat(miss.getIsMatch()).isFalse();
            assertThat(posted).isEmpty();
        } finally {
            ledgerRelease.countDown();
            ledgerPool.shutdown();
            assertThat(ledgerPool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        }
        assertThat(posted).hasSize(1);
    }

    @Test
    @DisplayName("入座持有房间锁时终局结算等待，入座写回的旧房间记录不会冲掉局间休息")
    void completeGame_waitsForInFlightJoin() throws Exception {
        fx = new CareerMatchFixture();
        PerpetualRoom room = fx.room("TRIO", Difficulty.EASY, 3, 1);
        room.setAiFillEnabled(false);
        fx.rooms.save(room);
        GameSession session = fx.startedSession(room, "u1", "u2");
        String sid = session.getId();
        fx.giveTurnTo(sid, fx.registry.findUser(sid, "u1").orElseThrow().getId());

        // 入座进行中：已持有房间锁并读到了结算前的房间记录
        String joinToken = fx.locks.lockRoom(room.getId());
        PerpetualRoom staleRoom = fx.sessionManager.requireRoom(room.getId());

        flip(sid, 0, "u1");
        CompletableFuture<FlipResult> last = fx.stateMachine.flip(sid, 1, "u1");
        Thread.sleep(200);
        assertThat(last).isNotDone();
        assertThat(fx.session(sid).getStatus()).isEqualTo(SessionStatus.ACTIVE);

        fx.registry.addUserParticipant(fx.session(sid), staleRoom, "u3", "Cy");
        fx.locks.unlockRoom(room.getId(), joinToken);

        assertThat(last.get(5, TimeUnit.SECONDS).isGameCompleted()).isTrue();
        PerpetualRoom after = fx.sessionManager.requireRoom(room.getId());
        assertThat(after.getStatus()).isEqualTo(RoomStatus.INTERMISSION);
        assertThat(after.getNextGameStartsAt()).isNotNull();
        assertThat(after.getTotalGamesPlayed()).isEqualTo(1);
        assertThat(after.getCurrentPlayerCount()).isEqualTo(3);
        assertThat(fx.session(sid).getWinners()).hasSize(3);
    }

    @Test
    @DisplayName("结算后的入座进入下一局，房间仍处于局间休息且统计保留")
    void joinAfterCompletion_opensNextSession() throws Exception {
        fx = new CareerMatchFixture();
        PerpetualRoom room = fx.room("DUO", Difficulty.EASY, 2, 1);
        GameSession session = fx.startedSession(room, "u1", "u2");
        String sid = session.getId();
        fx.giveTurnTo(sid, fx.registry.findUser(sid, "u1").orElseThrow().getId());
        flip(sid, 0, "u1");
        flip(sid, 1, "u1");

        JoinResult joined = fx.service.joinGame("u9", "Nia", Difficulty.EASY);

        assertThat(joined.getSession().getId()).isNotEqualTo(sid);
        assertThat(joined.getSession().getGameNumber()).isEqualTo(2);
        assertThat(fx.registry.listParticipants(sid)).hasSize(2);
        PerpetualRoom after = fx.sessionManager.requireRoom(room.getId());
        assertThat(after.getStatus()).isEqualTo(RoomStatus.INTERMISSION);
        assertThat(after.getNextGameStartsAt()).isNotNull();
        assertThat(after.getTotalGamesPlayed()).isEqualTo(1);
        assertThat(after.getCurrentPlayerCount()).isEqualTo(1);
    }

    private Participant participant(String id, int seq, int pairs, int totalXp) {
        Participant p = new Participant();
        p.setId(id);
        p.setDisplayName(id);
        p.setJoinSequence(seq);
        p.setPairsMatched(pairs);
        p.setTotalXp(totalXp);
        return p;
    }
}
