package org.clifford.circuit;

import org.apache.commons.lang3.StringUtils;
import org.clifford.exceptions.IndexTypeException;
import org.clifford.exceptions.OperationFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 有序、只追加的门操作序列。
 * 由 Tableau 的门作用记录生成，供外部的密度矩阵模拟后端按顺序执行。
 * <p>
 * 文本格式：每个门一行 "NAME IDX1 IDX2 ...\n"，无表头表尾。
 * @author Ayalyt
 */
public final class CircuitProgram {

    private static final Logger logger = LoggerFactory.getLogger(CircuitProgram.class);

    private final List<GateOperation> operations;

    public CircuitProgram() {
        this.operations = new ArrayList<>();
    }

    private CircuitProgram(List<GateOperation> operations) {
        this.operations = new ArrayList<>(operations);
    }

    // --- 追加 ---

    public void addGate(GateOperation operation) {
        Objects.requireNonNull(operation, "CircuitProgram.addGate: operation 不能为 null");
        operations.add(operation);
        logger.debug("追加门操作: {}", operation);
    }

    public void addGate(String name, int... qubits) {
        addGate(GateOperation.of(name, qubits));
    }

    /**
     * 以松散类型的二元组 [门名, 索引] 追加门操作，索引可为单个整数、整数数组或整数的可迭代对象。
     * @param op 二元组。
     * @throws OperationFormatException 不是二元组，或门名不是字符串。
     * @throws IndexTypeException 索引不是整数或整数的可迭代对象。
     */
    public void addGate(List<?> op) {
        if (op == null || op.size() != 2) {
            logger.error("门操作条目格式错误: {}", op);
            throw new OperationFormatException("门操作必须是 (门名, 索引) 二元组: " + op);
        }
        if (!(op.get(0) instanceof String name)) {
            logger.error("门名不是字符串: {}", op.get(0));
            throw new OperationFormatException("门名必须是字符串: " + op.get(0));
        }
        addGate(GateOperation.of(name, toQubitList(op.get(1))));
    }

    private static List<Integer> toQubitList(Object indices) {
        if (indices instanceof Integer single) {
            return List.of(single);
        }
        if (indices instanceof int[] array) {
            List<Integer> list = new ArrayList<>(array.length);
            for (int qubit : array) {
                list.add(qubit);
            }
            return list;
        }
        if (indices instanceof Iterable<?> iterable) {
            List<Integer> list = new ArrayList<>();
            for (Object element : iterable) {
                if (!(element instanceof Integer qubit)) {
                    logger.error("比特索引不是整数: {}", element);
                    throw new IndexTypeException("门的索引必须是整数或整数的可迭代对象: " + indices);
                }
                list.add(qubit);
            }
            return list;
        }
        logger.error("比特索引类型非法: {}", indices);
        throw new IndexTypeException("门的索引必须是整数或整数的可迭代对象: " + indices);
    }

    /**
     * 线路的独立副本。
     */
    public CircuitProgram copy() {
        return new CircuitProgram(operations);
    }

    /**
     * 原地拼接：把 other 的所有门追加到本线路末尾。
     */
    public void addAll(CircuitProgram other) {
        operations.addAll(other.operations);
    }

    // --- 变换 ---

    /**
     * 将每个门的每个比特索引平移 shift，用于把子线路搬到另一段比特窗口上。
     * @return 新的 CircuitProgram，本线路不变。
     */
    public CircuitProgram shiftQubits(int shift) {
        List<GateOperation> shifted = operations.stream().map(op -> op.shift(shift)).toList();
        return new CircuitProgram(shifted);
    }

    /**
     * 拼接两个线路，本线路的门在前。
     * @return 新的 CircuitProgram。
     */
    public CircuitProgram concat(CircuitProgram other) {
        CircuitProgram result = new CircuitProgram(this.operations);
        result.addAll(other);
        return result;
    }

    public List<GateOperation> getOperations() {
        return Collections.unmodifiableList(operations);
    }

    public int size() {
        return operations.size();
    }

    public boolean isEmpty() {
        return operations.isEmpty();
    }

    /**
     * 解析文本格式的线路。空行被忽略。
     * @param text 每行 "NAME IDX1 IDX2 ..."。
     * @return 解析得到的 CircuitProgram。
     * @throws OperationFormatException 某行缺少比特索引。
     * @throws IndexTypeException 某个索引不是十进制整数。
     */
    public static CircuitProgram parse(String text) {
        CircuitProgram program = new CircuitProgram();
        String[] lines = text.split("\n", -1);
        for (int lineNo = 0; lineNo < lines.length; lineNo++) {
            String line = lines[lineNo];
            if (StringUtils.isBlank(line)) {
                continue;
            }
            String[] tokens = StringUtils.split(line, ' ');
            if (tokens.length < 2) {
                logger.error("第 {} 行缺少比特索引: '{}'", lineNo + 1, line);
                throw new OperationFormatException("第 " + (lineNo + 1) + " 行缺少比特索引: '" + line + "'");
            }
            List<Integer> qubits = new ArrayList<>(tokens.length - 1);
            for (int i = 1; i < tokens.length; i++) {
                try {
                    qubits.add(Integer.parseInt(tokens[i]));
                } catch (NumberFormatException e) {
                    logger.error("第 {} 行的索引 '{}' 不是整数", lineNo + 1, tokens[i]);
                    throw new IndexTypeException("第 " + (lineNo + 1) + " 行的索引不是整数: '" + tokens[i] + "'", e);
                }
            }
            program.addGate(GateOperation.of(tokens[0], qubits));
        }
        return program;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return operations.equals(((CircuitProgram) o).operations);
    }

    @Override
    public int hashCode() {
        return operations.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (GateOperation op : operations) {
            sb.append(op).append('\n');
        }
        return sb.toString();
    }
}
