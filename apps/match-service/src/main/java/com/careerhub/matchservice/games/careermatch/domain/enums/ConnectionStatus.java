package com.careerhub.matchservice.games.careermatch.domain.enums;

/**
 * 连接状态：只做记录，不驱动回合跳过。
 */
public enum ConnectionStatus {
    CONNECTED,
    RECONNECTING,
    DISCONNECTED
}
