package com.careerhub.matchservice.games.careermatch.service;

import com.careerhub.matchservice.games.careermatch.config.CareerMatchProperties;
import com.careerhub.matchservice.games.careermatch.domain.constants.GameMessages;
import com.careerhub.matchservice.games.careermatch.domain.exception.CareerMatchException;
import com.careerhub.matchservice.games.careermatch.domain.exception.ErrorCode;
import com.careerhub.matchservice.games.careermatch.domain.repository.GameLock;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * 对局锁与房间锁。
 * - 对局锁：翻牌的“校验 + 应用”在同一对局内单写；抢锁失败即 TURN_CONFLICT，不排队。
 * - 房间锁：串行化同一房间的入座、开局、结算与恢复开放。
 */
@Component
@RequiredArgsConstructor
public class MatchLocks {

    private static final long ROOM_RETRY_MS = 10;

    private final GameLock lock;
    private final CareerMatchProperties props;

    /**
     * @return 持有者令牌，释放时原样传回
     */
    public String lockSession(String sessionId) {
        String token = UUID.randomUUID().toString();
        if (!lock.tryLock(sessionKey(sessionId), token, ttl())) {
            throw CareerMatchException.of(ErrorCode.TURN_CONFLICT, GameMessages.TURN_CONFLICT);
        }
        return token;
    }

    public void unlockSession(String sessionId, String token) {
        lock.unlock(sessionKey(sessionId), token);
    }

    public String lockRoom(String roomId) {
        String token = UUID.randomUUID().toString();
        if (!lock.tryLock(roomKey(roomId), token, ttl())) {
            throw CareerMatchException.of(ErrorCode.ROOM_BUSY, GameMessages.ROOM_BUSY);
        }
        return token;
    }

    /**
     * 等待房间锁，用于对局结算：此时牌局已定，不能以 ROOM_BUSY 放弃。
     * 房间锁的持有时间只有一次入座或开局的长度，等待上限为 lock.roomWaitMs。
     */
    public String awaitRoom(String roomId) {
        String token = UUID.randomUUID().toString();
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(props.getLock().getRoomWaitMs());
        while (!lock.tryLock(roomKey(roomId), token, ttl())) {
            if (System.nanoTime() > deadline) {
                throw CareerMatchException.of(ErrorCode.ROOM_BUSY, GameMessages.ROOM_BUSY);
            }
            try {
                Thread.sleep(ROOM_RETRY_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw CareerMatchException.of(ErrorCode.ROOM_BUSY, GameMessages.ROOM_BUSY);
            }
        }
        return token;
    }

    public void unlockRoom(String roomId, String token) {
        lock.unlock(roomKey(roomId), token);
    }

    private Duration ttl() {
        return Duration.ofSeconds(props.getLock().getTtlSeconds());
    }

    private static String sessionKey(String sessionId) {
        return "session:" + sessionId;
    }

    private static String roomKey(String roomId) {
        return "room:" + roomId;
    }
}
