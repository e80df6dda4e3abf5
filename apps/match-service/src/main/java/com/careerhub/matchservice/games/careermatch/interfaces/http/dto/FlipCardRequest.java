package com.careerhub.matchservice.games.careermatch.interfaces.http.dto;

import lombok.Data;

@Data
public class FlipCardRequest {
    private Integer position;
    /** 参与者ID 或用户ID */
    private String actorId;
}
