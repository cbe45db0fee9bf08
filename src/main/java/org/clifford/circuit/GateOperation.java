package org.clifford.circuit;

import lombok.Getter;
import org.apache.commons.lang3.StringUtils;
import org.clifford.exceptions.OperationFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 线路中的一个门操作：门名 + 有序的量子比特索引列表。
 * 此类是不可变的。
 * @author Ayalyt
 */
@Getter
public final class GateOperation {

    private static final Logger logger = LoggerFactory.getLogger(GateOperation.class);

    private final String name;
    private final List<Integer> qubits;

    private final int hashCode;

    private GateOperation(String name, List<Integer> qubits) {
        this.name = name;
        this.qubits = Collections.unmodifiableList(new ArrayList<>(qubits));
        this.hashCode = Objects.hash(name, this.qubits);
    }

    /**
     * 工厂方法：校验后创建门操作。
     * @param name 门名，非空且不含空白字符（文本格式以空格分隔）。
     * @param qubits 量子比特索引，非空且均为非负整数。
     * @return 新的 GateOperation。
     * @throws OperationFormatException 门名或比特列表不合法。
     */
    public static GateOperation of(String name, List<Integer> qubits) {
        if (StringUtils.isBlank(name) || StringUtils.containsWhitespace(name)) {
            logger.error("门名非法: '{}'", name);
            throw new OperationFormatException("门名必须是非空且不含空白的字符串: '" + name + "'");
        }
        if (qubits == null || qubits.isEmpty()) {
            logger.error("门 {} 的比特列表为空", name);
            throw new OperationFormatException("门 " + name + " 至少需要一个量子比特索引");
        }
        for (Integer qubit : qubits) {
            if (qubit == null || qubit < 0) {
                logger.error("门 {} 含非法比特索引: {}", name, qubits);
                throw new OperationFormatException("门 " + name + " 的比特索引必须是非负整数: " + qubits);
            }
        }
        return new GateOperation(name, qubits);
    }

    public static GateOperation of(String name, int... qubits) {
        List<Integer> list = new ArrayList<>(qubits.length);
        for (int qubit : qubits) {
            list.add(qubit);
        }
        return of(name, list);
    }

    /**
     * 将所有比特索引平移 shift。
     * @return 新的 GateOperation。
     */
    public GateOperation shift(int shift) {
        if (shift == 0) {
            return this;
        }
        return of(name, qubits.stream().map(q -> q + shift).toList());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        GateOperation that = (GateOperation) o;
        return name.equals(that.name) && qubits.equals(that.qubits);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    /**
     * 文本形式 "NAME IDX1 IDX2 ..."（不含换行）。
     */
    @Override
    public String toString() {
        return name + " " + qubits.stream().map(String::valueOf).collect(Collectors.joining(" "));
    }
}
