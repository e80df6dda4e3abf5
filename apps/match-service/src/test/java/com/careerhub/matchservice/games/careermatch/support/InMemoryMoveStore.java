package com.careerhub.matchservice.games.careermatch.support;

import com.careerhub.matchservice.games.careermatch.domain.model.Move;
import com.careerhub.matchservice.games.careermatch.domain.repository.MoveStore;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

public class InMemoryMoveStore implements MoveStore {

    private final Map<String, List<Move>> bySession = new ConcurrentHashMap<>();

    @Override
    public void append(Move move) {
        bySession.computeIfAbsent(move.getSessionId(), k -> new CopyOnWriteArrayList<>()).add(Copies.of(move));
    }

    @Override
    public List<Move> findBySession(String sessionId) {
        return bySession.getOrDefault(sessionId, List.of()).stream().map(Copies::of).toList();
    }
}
