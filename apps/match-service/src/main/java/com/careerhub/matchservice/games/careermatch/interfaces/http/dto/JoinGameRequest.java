package com.careerhub.matchservice.games.careermatch.interfaces.http.dto;

import com.careerhub.matchservice.games.careermatch.domain.enums.Difficulty;
import lombok.Data;

@Data
public class JoinGameRequest {
    private String userId;
    /** 可空，默认 "Player" */
    private String displayName;
    /** 可空，表示不限难度 */
    private Difficulty difficulty;
}
