package com.careerhub.matchservice.games.careermatch.domain.dto;

import com.careerhub.matchservice.games.careermatch.domain.model.GameSession;
import com.careerhub.matchservice.games.careermatch.domain.model.Participant;
import com.careerhub.matchservice.games.careermatch.domain.model.PerpetualRoom;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class JoinResult {
    private PerpetualRoom room;
    private GameSession session;
    private Participant participant;
    private List<Participant> allParticipants;
    private boolean host;
}
