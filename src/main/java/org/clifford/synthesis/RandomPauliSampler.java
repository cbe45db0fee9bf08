package org.clifford.synthesis;

import org.apache.commons.rng.UniformRandomProvider;
import org.clifford.tableau.Tableau;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 均匀采样单行 Pauli 串（模符号）。
 * 每个比特的 x、z 各取一个独立的公平比特，因此 I/X/Y/Z 各以 1/4 概率出现。
 */
public final class RandomPauliSampler {

    private static final Logger logger = LoggerFactory.getLogger(RandomPauliSampler.class);

    private final UniformRandomProvider rng;

    public RandomPauliSampler(UniformRandomProvider rng) {
        this.rng = Objects.requireNonNull(rng, "RandomPauliSampler: rng 不能为 null");
    }

    /**
     * @param nQubits 比特数，至少为 1。
     * @return 1 行 nQubits 列的 Tableau。
     */
    public Tableau sample(int nQubits) {
        if (nQubits < 1) {
            logger.error("RandomPauliSampler: 比特数必须为正: {}", nQubits);
            throw new IllegalArgumentException("比特数必须为正: " + nQubits);
        }
        boolean[][] xs = new boolean[1][nQubits];
        boolean[][] zs = new boolean[1][nQubits];
        for (int q = 0; q < nQubits; q++) {
            xs[0][q] = rng.nextBoolean();
        }
        for (int q = 0; q < nQubits; q++) {
            zs[0][q] = rng.nextBoolean();
        }
        return Tableau.of(xs, zs);
    }

    public static Tableau generateRandomPauli(int nQubits, UniformRandomProvider rng) {
        return new RandomPauliSampler(rng).sample(nQubits);
    }
}
