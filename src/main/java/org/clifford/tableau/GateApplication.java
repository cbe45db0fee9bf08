package org.clifford.tableau;

import lombok.Getter;
import org.clifford.circuit.GateOperation;
import org.clifford.utils.BitMatrix;

import java.util.Optional;

/**
 * 一次门作用的结果：新的 (xs, zs) 以及应记录到线路中的门操作。
 * 恒等门不产生门操作。
 * 此类是不可变的。
 */
@Getter
public final class GateApplication {

    private final BitMatrix xs;
    private final BitMatrix zs;

    @Getter(lombok.AccessLevel.NONE)
    private final GateOperation emitted;

    GateApplication(BitMatrix xs, BitMatrix zs, GateOperation emitted) {
        this.xs = xs;
        this.zs = zs;
        this.emitted = emitted;
    }

    public Optional<GateOperation> getEmitted() {
        return Optional.ofNullable(emitted);
    }

    @Override
    public String toString() {
        return "GateApplication{xs=" + xs + ", zs=" + zs + ", emitted=" + emitted + "}";
    }
}
