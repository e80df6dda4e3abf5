package com.careerhub.matchservice.common.random;

import org.springframework.stereotype.Component;

import java.util.concurrent.ThreadLocalRandom;

/**
 * 默认随机源：基于 ThreadLocalRandom，多线程下无竞争。
 */
@Component
public class ThreadLocalRandomSource implements RandomSource {

    @Override
    public int nextInt(int bound) {
        return ThreadLocalRandom.current().nextInt(bound);
    }
}
