package com.careerhub.matchservice.games.careermatch.interfaces.http.dto;

import com.careerhub.matchservice.games.careermatch.domain.enums.ConnectionStatus;
import lombok.Data;

@Data
public class ConnectionReport {
    private String userId;
    private ConnectionStatus status;
}
