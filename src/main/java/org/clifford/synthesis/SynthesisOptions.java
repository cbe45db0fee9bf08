package org.clifford.synthesis;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 随机 Clifford 合成的配置。
 * 此类是不可变的。
 * @author Ayalyt
 */
@Getter
public final class SynthesisOptions {

    private static final Logger logger = LoggerFactory.getLogger(SynthesisOptions.class);

    public static final int DEFAULT_MAX_PAIR_ATTEMPTS = 1000;

    private static final SynthesisOptions DEFAULTS = new SynthesisOptions(DEFAULT_MAX_PAIR_ATTEMPTS, false);

    /** 每一轮采样反对易 Pauli 对的最大次数，超过即视为内部致命错误 */
    private final int maxPairAttempts;

    /** 存活支撑已在 0 号比特时，是否仍记录 SWAP(0, 0) */
    private final boolean recordTrivialSwap;

    private SynthesisOptions(int maxPairAttempts, boolean recordTrivialSwap) {
        if (maxPairAttempts < 1) {
            logger.error("maxPairAttempts 必须为正: {}", maxPairAttempts);
            throw new IllegalArgumentException("maxPairAttempts 必须为正: " + maxPairAttempts);
        }
        this.maxPairAttempts = maxPairAttempts;
        this.recordTrivialSwap = recordTrivialSwap;
    }

    public static SynthesisOptions defaults() {
        return DEFAULTS;
    }

    public static SynthesisOptions of(int maxPairAttempts, boolean recordTrivialSwap) {
        return new SynthesisOptions(maxPairAttempts, recordTrivialSwap);
    }

    public SynthesisOptions withMaxPairAttempts(int maxPairAttempts) {
        return new SynthesisOptions(maxPairAttempts, recordTrivialSwap);
    }

    public SynthesisOptions withRecordTrivialSwap(boolean recordTrivialSwap) {
        return new SynthesisOptions(maxPairAttempts, recordTrivialSwap);
    }

    @Override
    public String toString() {
        return "SynthesisOptions{maxPairAttempts=" + maxPairAttempts + ", recordTrivialSwap=" + recordTrivialSwap + "}";
    }
}
