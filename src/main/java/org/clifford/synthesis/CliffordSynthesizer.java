package org.clifford.synthesis;

import org.apache.commons.rng.UniformRandomProvider;
import org.clifford.circuit.CircuitProgram;
import org.clifford.exceptions.SynthesisNonTerminationException;
import org.clifford.tableau.Tableau;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 均匀随机 n 比特 Clifford 线路的合成器，O(n^2) 个门。
 * 逐轮剥离：每轮在尚未剥离的 n 个比特上采样一对反对易的 Pauli 串，
 * 用门作用把它们化为 (X_0, Z_0)，把这一轮记录的线路平移到对应的比特窗口后追加到结果中。
 * 参见 Bravyi &amp; Maslov, arXiv:2008.06011。
 * <p>
 * 每个实例持有自己的随机源，不同实例可以并行使用；单个实例不是线程安全的。
 * @author Ayalyt
 */
public final class CliffordSynthesizer {

    private static final Logger logger = LoggerFactory.getLogger(CliffordSynthesizer.class);

    private final UniformRandomProvider rng;
    private final RandomPauliSampler sampler;
    private final SynthesisOptions options;

    public CliffordSynthesizer(UniformRandomProvider rng) {
        this(rng, SynthesisOptions.defaults());
    }

    public CliffordSynthesizer(UniformRandomProvider rng, SynthesisOptions options) {
        this.rng = Objects.requireNonNull(rng, "CliffordSynthesizer: rng 不能为 null");
        this.options = Objects.requireNonNull(options, "CliffordSynthesizer: options 不能为 null");
        this.sampler = new RandomPauliSampler(rng);
    }

    public static CircuitProgram generateRandomClifford(int nQubits, UniformRandomProvider rng) {
        return new CliffordSynthesizer(rng).synthesize(nQubits);
    }

    /**
     * 合成一个均匀随机的 nQubits 比特 Clifford 线路。
     * 默认不记录 SWAP(0, 0)，与参考输出不同；需要完全一致的输出时打开 recordTrivialSwap。
     *
     * @param nQubits 比特数，至少为 1。
     * @return 门均取自 {H, S, SWAP, CNOT, X, Y, Z}、索引均在 [0, nQubits) 内的线路。
     * @throws SynthesisNonTerminationException 某一轮反对易对的采样次数超过上限。
     */
    public CircuitProgram synthesize(int nQubits) {
        if (nQubits < 1) {
            logger.error("CliffordSynthesizer: 比特数必须为正: {}", nQubits);
            throw new IllegalArgumentException("比特数必须为正: " + nQubits);
        }
        CircuitProgram compiled = new CircuitProgram();
        for (int n = nQubits; n >= 1; n--) {
            Tableau tableau = sampleAntiCommutingPair(n);
            canonicalizeRow(tableau, 0);
            fixSecondRow(tableau);
            applyRandomPauli(tableau);
            CircuitProgram round = tableau.getCircuit();
            compiled.addAll(round.shiftQubits(nQubits - n));
            logger.debug("第 {} 轮（剩余 {} 个比特）产生 {} 个门", nQubits - n + 1, n, round.size());
        }
        logger.info("合成了 {} 比特随机 Clifford 线路，共 {} 个门", nQubits, compiled.size());
        return compiled;
    }

    /**
     * 反复采样两个 Pauli 串直到二者反对易，返回二者堆叠成的两行表。
     */
    private Tableau sampleAntiCommutingPair(int n) {
        for (int attempt = 1; attempt <= options.getMaxPairAttempts(); attempt++) {
            Tableau first = sampler.sample(n);
            Tableau second = sampler.sample(n);
            if (!first.commutes(second)) {
                logger.debug("第 {} 次采样得到反对易对 {} / {}", attempt, first, second);
                return first.plus(second);
            }
        }
        logger.error("在 {} 个比特上连续 {} 次未采到反对易对", n, options.getMaxPairAttempts());
        throw new SynthesisNonTerminationException(n, options.getMaxPairAttempts());
    }

    /**
     * 把第 row 行化为 0 号比特上的单个 X。
     */
    private void canonicalizeRow(Tableau tableau, int row) {
        clearZ(tableau, row);
        collapseX(tableau, row);
    }

    /**
     * 消去该行所有 Z 分量：Y 位置作用 S，Z 位置作用 H。
     */
    private void clearZ(Tableau tableau, int row) {
        boolean[] x = tableau.getXs().row(row);
        boolean[] z = tableau.getZs().row(row);
        for (int q = 0; q < tableau.getNQubits(); q++) {
            if (z[q]) {
                if (x[q]) {
                    tableau.applyS(q);
                } else {
                    tableau.applyH(q);
                }
            }
        }
    }

    /**
     * 用 CNOT 把该行的 X 支撑压缩到一个比特上，再用 SWAP 移到 0 号比特。
     */
    private void collapseX(Tableau tableau, int row) {
        boolean[] x = tableau.getXs().row(row);
        List<Integer> support = new ArrayList<>();
        for (int q = 0; q < x.length; q++) {
            if (x[q]) {
                support.add(q);
            }
        }
        if (support.isEmpty()) {
            // 反对易对中不可能出现恒等行
            logger.error("第 {} 行在消去 Z 后没有 X 支撑: {}", row, tableau);
            throw new IllegalStateException("第 " + row + " 行没有 X 支撑，无法规范化: " + tableau);
        }
        while (support.size() > 1) {
            tableau.applyCNOT(support.get(0), support.get(1));
            support.remove(1);
        }
        int survivor = support.get(0);
        if (survivor != 0 || options.isRecordTrivialSwap()) {
            tableau.applySWAP(0, survivor);
        }
    }

    /**
     * 若第 1 行不是 Z_0，在 H(0) 的框架下对其重复规范化，再用 H(0) 还原。
     */
    private void fixSecondRow(Tableau tableau) {
        if (isCanonicalZ(tableau, 1)) {
            return;
        }
        tableau.applyH(0);
        canonicalizeRow(tableau, 1);
        tableau.applyH(0);
    }

    private static boolean isCanonicalZ(Tableau tableau, int row) {
        boolean[] x = tableau.getXs().row(row);
        boolean[] z = tableau.getZs().row(row);
        for (int q = 0; q < x.length; q++) {
            if (x[q] || z[q] != (q == 0)) {
                return false;
            }
        }
        return true;
    }

    /**
     * 两个公平比特选出 0 号比特上的 I/X/Y/Z 之一。
     */
    private void applyRandomPauli(Tableau tableau) {
        boolean first = rng.nextBoolean();
        boolean second = rng.nextBoolean();
        if (!first) {
            if (second) {
                tableau.applyX(0);
            } else {
                tableau.applyI(0);
            }
        } else {
            if (second) {
                tableau.applyY(0);
            } else {
                tableau.applyZ(0);
            }
        }
    }
}
