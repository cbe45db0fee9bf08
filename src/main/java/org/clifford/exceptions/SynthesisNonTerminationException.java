package org.clifford.exceptions;

import lombok.Getter;

/**
 * 随机 Clifford 合成中，反对易 Pauli 对的重采样次数超过上限。
 * 属于内部致命错误，不在本地恢复。
 * @author Ayalyt
 */
@Getter
public class SynthesisNonTerminationException extends IllegalStateException {

    private final int qubits;
    private final int attempts;

    public SynthesisNonTerminationException(int qubits, int attempts) {
        super("在 " + qubits + " 个量子比特上连续 " + attempts + " 次未采到反对易的 Pauli 对");
        this.qubits = qubits;
        this.attempts = attempts;
    }
}
