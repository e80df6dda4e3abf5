package com.careerhub.matchservice.games.careermatch.domain.enums;

/** 常驻房间状态：对局中 / 局间休息 / 人工暂停 */
public enum RoomStatus {
    ACTIVE,
    INTERMISSION,
    PAUSED
}
