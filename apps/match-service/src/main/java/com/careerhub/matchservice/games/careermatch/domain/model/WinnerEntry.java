package com.careerhub.matchservice.games.careermatch.domain.model;

import com.careerhub.matchservice.games.careermatch.domain.enums.ParticipantType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 结算排名项
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class WinnerEntry {
    private String participantId;
    private String displayName;
    private ParticipantType participantType;
    private String userId;
    private int pairsMatched;
    private int totalXp;
    private int arcadeXp;
    private int rank;
}
