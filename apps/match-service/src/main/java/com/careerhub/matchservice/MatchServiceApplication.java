package com.careerhub.matchservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cloud.openfeign.EnableFeignClients;

/**
 * match-service 启动入口。
 * 通过 @EnableFeignClients 启用基础设施层的 Feign Client（XP 账本）。
 */
@SpringBootApplication
@EnableFeignClients
public class MatchServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(MatchServiceApplication.class, args);
    }
}
