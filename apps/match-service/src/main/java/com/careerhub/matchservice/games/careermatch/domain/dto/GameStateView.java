package com.careerhub.matchservice.games.careermatch.domain.dto;

import com.careerhub.matchservice.games.careermatch.domain.model.Card;
import com.careerhub.matchservice.games.careermatch.domain.model.GameSession;
import com.careerhub.matchservice.games.careermatch.domain.model.Participant;
import com.careerhub.matchservice.games.careermatch.domain.model.PerpetualRoom;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 对局全量快照：参与者按入座顺序，卡牌按位置排序。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class GameStateView {
    private GameSession session;
    private List<Participant> participants;
    private List<Card> cards;
    private PerpetualRoom room;
}
