package org.clifford.tableau;

import org.clifford.circuit.GateOperation;
import org.clifford.utils.BitMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * 在无符号稳定子表上可作用的 Clifford 门。
 * 每个门在辛表示下对 (xs, zs) 的共轭作用，不跟踪相位。
 */
public enum CliffordGate {

    /**
     * 门枚举
     */
    H(1),       // 交换 x_q 与 z_q
    S(1),       // z_q ^= x_q
    SWAP(2),    // 交换两列
    CNOT(2),    // x_t ^= x_c; z_c ^= z_t
    X(1),
    Y(1),
    Z(1),
    I(1);       // 不记录

    private static final Logger logger = LoggerFactory.getLogger(CliffordGate.class);

    private final int arity;

    CliffordGate(int arity) {
        this.arity = arity;
    }

    /**
     * 该门是否被记录到线路中。
     */
    public boolean isRecorded() {
        return this != I;
    }

    /**
     * 按门名查找，区分大小写。
     * @throws IllegalArgumentException 未知门名。
     */
    public static CliffordGate fromName(String name) {
        for (CliffordGate gate : values()) {
            if (gate.name().equals(name)) {
                return gate;
            }
        }
        logger.error("未知的 Clifford 门: {}", name);
        throw new IllegalArgumentException("未知的 Clifford 门: " + name);
    }

    /**
     * 计算门作用后的 (xs, zs)，不修改输入。
     *
     * @param xs X 部分。
     * @param zs Z 部分，与 xs 同形。
     * @param qubits 作用的比特，个数须等于 arity。
     * @return 新状态与待记录的门操作。
     * @throws IllegalArgumentException 比特个数不符，或 CNOT 的控制位与目标位相同。
     * @throws IndexOutOfBoundsException 比特索引越界。
     */
    public GateApplication apply(BitMatrix xs, BitMatrix zs, int... qubits) {
        if (qubits.length != arity) {
            logger.error("{} 需要 {} 个比特，实际为 {}", this, arity, Arrays.toString(qubits));
            throw new IllegalArgumentException(this + " 需要 " + arity + " 个比特，实际为 " + Arrays.toString(qubits));
        }
        for (int qubit : qubits) {
            if (qubit < 0 || qubit >= xs.getCols()) {
                throw new IndexOutOfBoundsException("比特索引 " + qubit + " 越界：" + xs.getCols());
            }
        }
        if (this == CNOT && qubits[0] == qubits[1]) {
            logger.error("CNOT 的控制位与目标位相同: {}", qubits[0]);
            throw new IllegalArgumentException("CNOT 的控制位与目标位不能相同: " + qubits[0]);
        }
        GateOperation emitted = isRecorded() ? GateOperation.of(name(), qubits) : null;
        return switch (this) {
            case H -> new GateApplication(xs.withColumnFrom(qubits[0], zs), zs.withColumnFrom(qubits[0], xs), emitted);
            case S -> new GateApplication(xs, zs.xorColumn(qubits[0], xs, qubits[0]), emitted);
            case SWAP -> new GateApplication(xs.swapColumns(qubits[0], qubits[1]), zs.swapColumns(qubits[0], qubits[1]), emitted);
            case CNOT -> new GateApplication(xs.xorColumn(qubits[1], qubits[0]), zs.xorColumn(qubits[0], qubits[1]), emitted);
            // Pauli 门只改变全局相位
            case X, Y, Z, I -> new GateApplication(xs, zs, emitted);
        };
    }
}
