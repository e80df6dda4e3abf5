package com.careerhub.matchservice.games.careermatch.domain.enums;

public enum ParticipantType {
    USER,
    AI_AGENT
}
