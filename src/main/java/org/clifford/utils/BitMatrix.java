package org.clifford.utils;

import lombok.Getter;
import org.clifford.exceptions.ShapeMismatchException;
import org.clifford.exceptions.ValueDomainException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * GF(2) 上的二元矩阵，行数与列数均至少为 1。
 * 此类是不可变的：所有列运算都返回新矩阵。
 * @author Ayalyt
 */
@Getter
public final class BitMatrix {

    private static final Logger logger = LoggerFactory.getLogger(BitMatrix.class);

    private final int rows;
    private final int cols;

    // 私有存储，不暴露
    @Getter(lombok.AccessLevel.NONE)
    private final boolean[][] bits;

    private final int hashCode;

    /**
     * 私有构造函数，调用方保证 bits 为规则矩阵且不再被外部持有。
     */
    private BitMatrix(boolean[][] bits) {
        this.rows = bits.length;
        this.cols = bits[0].length;
        this.bits = bits;
        this.hashCode = Arrays.deepHashCode(bits);
    }

    // --- 工厂方法 ---

    /**
     * 由布尔二维数组创建（深拷贝）。
     * @throws ShapeMismatchException 如果数组为空、行为空或不规则。
     */
    public static BitMatrix of(boolean[][] values) {
        checkRectangular(values == null ? null : values.length, values == null ? -1 : commonRowLength(values));
        boolean[][] copy = new boolean[values.length][];
        for (int i = 0; i < values.length; i++) {
            copy[i] = values[i].clone();
        }
        return new BitMatrix(copy);
    }

    /**
     * 由 0/1 整数二维数组创建，整数被规范化为布尔值。
     * @throws ShapeMismatchException 如果数组为空、行为空或不规则。
     * @throws ValueDomainException 如果存在 0/1 以外的元素。
     */
    public static BitMatrix ofBits(int[][] values) {
        checkRectangular(values == null ? null : values.length, values == null ? -1 : commonRowLength(values));
        boolean[][] converted = new boolean[values.length][values[0].length];
        for (int i = 0; i < values.length; i++) {
            for (int j = 0; j < values[i].length; j++) {
                int v = values[i][j];
                if (v != 0 && v != 1) {
                    logger.error("BitMatrix.ofBits: 位置 ({}, {}) 的元素 {} 不是 0 或 1", i, j, v);
                    throw new ValueDomainException("矩阵元素必须是 0 或 1，位置 (" + i + ", " + j + ") 为 " + v);
                }
                converted[i][j] = v == 1;
            }
        }
        return new BitMatrix(converted);
    }

    public static BitMatrix zeros(int rows, int cols) {
        if (rows < 1 || cols < 1) {
            throw new ShapeMismatchException("矩阵形状必须至少为 1x1: " + rows + "x" + cols);
        }
        return new BitMatrix(new boolean[rows][cols]);
    }

    private static int commonRowLength(boolean[][] values) {
        int len = values.length == 0 || values[0] == null ? -1 : values[0].length;
        for (boolean[] row : values) {
            if (row == null || row.length != len) {
                return -1;
            }
        }
        return len;
    }

    private static int commonRowLength(int[][] values) {
        int len = values.length == 0 || values[0] == null ? -1 : values[0].length;
        for (int[] row : values) {
            if (row == null || row.length != len) {
                return -1;
            }
        }
        return len;
    }

    private static void checkRectangular(Integer rowCount, int colCount) {
        if (rowCount == null || rowCount == 0) {
            logger.error("BitMatrix: 矩阵必须是非空的二维数组");
            throw new ShapeMismatchException("维度不兼容：矩阵必须是非空的二维数组");
        }
        if (colCount < 1) {
            logger.error("BitMatrix: 矩阵的行为空或长度不一致");
            throw new ShapeMismatchException("维度不兼容：矩阵的每一行必须非空且长度一致");
        }
    }

    // --- 访问 ---

    public boolean get(int row, int col) {
        checkRow(row);
        checkCol(col);
        return bits[row][col];
    }

    public boolean[] row(int row) {
        checkRow(row);
        return bits[row].clone();
    }

    public boolean sameShape(BitMatrix other) {
        return rows == other.rows && cols == other.cols;
    }

    private void checkRow(int row) {
        if (row < 0 || row >= rows) {
            throw new IndexOutOfBoundsException("行索引 " + row + " 越界：" + rows);
        }
    }

    private void checkCol(int col) {
        if (col < 0 || col >= cols) {
            throw new IndexOutOfBoundsException("列索引 " + col + " 越界：" + cols);
        }
    }

    private boolean[][] copyBits() {
        boolean[][] copy = new boolean[rows][];
        for (int i = 0; i < rows; i++) {
            copy[i] = bits[i].clone();
        }
        return copy;
    }

    // --- 列运算 ---

    /**
     * 交换两列。
     */
    public BitMatrix swapColumns(int a, int b) {
        checkCol(a);
        checkCol(b);
        boolean[][] copy = copyBits();
        for (boolean[] row : copy) {
            boolean tmp = row[a];
            row[a] = row[b];
            row[b] = tmp;
        }
        return new BitMatrix(copy);
    }

    /**
     * 第 target 列异或上 source 列的对应位置（source 取自 sourceMatrix，形状须一致）。
     */
    public BitMatrix xorColumn(int target, BitMatrix sourceMatrix, int source) {
        requireSameShape(sourceMatrix);
        checkCol(target);
        sourceMatrix.checkCol(source);
        boolean[][] copy = copyBits();
        for (int i = 0; i < rows; i++) {
            copy[i][target] ^= sourceMatrix.bits[i][source];
        }
        return new BitMatrix(copy);
    }

    public BitMatrix xorColumn(int target, int source) {
        return xorColumn(target, this, source);
    }

    /**
     * 将第 col 列替换为 sourceMatrix 的第 col 列。
     */
    public BitMatrix withColumnFrom(int col, BitMatrix sourceMatrix) {
        requireSameShape(sourceMatrix);
        checkCol(col);
        boolean[][] copy = copyBits();
        for (int i = 0; i < rows; i++) {
            copy[i][col] = sourceMatrix.bits[i][col];
        }
        return new BitMatrix(copy);
    }

    // --- 矩阵运算 ---

    /**
     * 逐元素异或。
     * @throws ShapeMismatchException 如果形状不同。
     */
    public BitMatrix xor(BitMatrix other) {
        requireSameShape(other);
        boolean[][] result = new boolean[rows][cols];
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                result[i][j] = bits[i][j] ^ other.bits[i][j];
            }
        }
        return new BitMatrix(result);
    }

    /**
     * 垂直堆叠，本矩阵的行在前。
     * @throws ShapeMismatchException 如果列数不同。
     */
    public BitMatrix vstack(BitMatrix other) {
        if (cols != other.cols) {
            logger.error("BitMatrix.vstack: 列数不一致 {} vs {}", cols, other.cols);
            throw new ShapeMismatchException("无法堆叠列数不同的矩阵: " + cols + " vs " + other.cols);
        }
        boolean[][] result = new boolean[rows + other.rows][];
        for (int i = 0; i < rows; i++) {
            result[i] = bits[i].clone();
        }
        for (int i = 0; i < other.rows; i++) {
            result[rows + i] = other.bits[i].clone();
        }
        return new BitMatrix(result);
    }

    /**
     * 按给定顺序选取行（允许重复）。
     */
    public BitMatrix selectRows(int... rowIndices) {
        if (rowIndices.length == 0) {
            throw new ShapeMismatchException("至少需要选取一行");
        }
        boolean[][] result = new boolean[rowIndices.length][];
        for (int i = 0; i < rowIndices.length; i++) {
            checkRow(rowIndices[i]);
            result[i] = bits[rowIndices[i]].clone();
        }
        return new BitMatrix(result);
    }

    /**
     * 一行上 x·z' XOR x'·z 的奇偶性，即两个 Pauli 行的辛内积。
     * (xs, zs) 的第 rowA 行与 (otherXs, otherZs) 的第 rowB 行，列数须一致。
     */
    public static boolean symplecticParity(BitMatrix xs, int rowA, BitMatrix zs, BitMatrix otherXs, int rowB, BitMatrix otherZs) {
        boolean parity = false;
        boolean[] xa = xs.bits[rowA];
        boolean[] za = zs.bits[rowA];
        boolean[] xb = otherXs.bits[rowB];
        boolean[] zb = otherZs.bits[rowB];
        for (int q = 0; q < xa.length; q++) {
            parity ^= (xa[q] & zb[q]) ^ (xb[q] & za[q]);
        }
        return parity;
    }

    private void requireSameShape(BitMatrix other) {
        if (!sameShape(other)) {
            logger.error("BitMatrix: 形状不一致 {}x{} vs {}x{}", rows, cols, other.rows, other.cols);
            throw new ShapeMismatchException("形状不兼容: " + rows + "x" + cols + " vs " + other.rows + "x" + other.cols);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return Arrays.deepEquals(bits, ((BitMatrix) o).bits);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < rows; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append('[');
            for (int j = 0; j < cols; j++) {
                sb.append(bits[i][j] ? '1' : '0');
            }
            sb.append(']');
        }
        return sb.append(']').toString();
    }
}
