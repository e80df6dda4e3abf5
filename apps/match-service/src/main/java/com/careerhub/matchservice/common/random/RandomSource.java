package com.careerhub.matchservice.common.random;

import java.util.List;

/**
 * 随机源端口：先手选择、AI 抽取、洗牌都从这里取随机数。
 * 测试中注入固定种子的实现，保证结果可断言。
 */
public interface RandomSource {

    /**
     * @param bound 上界（不含），必须 > 0
     * @return [0, bound) 内均匀分布的整数
     */
    int nextInt(int bound);

    /**
     * 原地洗牌（Fisher-Yates）。
     */
    default <T> void shuffle(List<T> items) {
        for (int i = items.size() - 1; i > 0; i--) {
            int j = nextInt(i + 1);
            T tmp = items.get(i);
            items.set(i, items.get(j));
            items.set(j, tmp);
        }
    }
}
