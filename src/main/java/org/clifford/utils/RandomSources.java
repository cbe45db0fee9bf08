package org.clifford.utils;

import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;

/**
 * 随机比特源的工厂。
 * 所有随机性都通过显式传入的 {@link UniformRandomProvider} 获得，不使用进程级共享状态。
 * 默认算法为 XO_SHI_RO_256_PP。
 */
public final class RandomSources {

    public static final RandomSource DEFAULT_ALGORITHM = RandomSource.XO_SHI_RO_256_PP;

    private RandomSources() {
    }

    /**
     * 可复现的随机源：相同种子产生相同的比特序列。
     */
    public static UniformRandomProvider create(long seed) {
        return DEFAULT_ALGORITHM.create(seed);
    }
}
