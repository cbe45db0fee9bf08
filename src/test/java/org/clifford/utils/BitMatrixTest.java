package org.clifford.utils;

import org.clifford.exceptions.ShapeMismatchException;
import org.clifford.exceptions.ValueDomainException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BitMatrixTest {

    @Test
    @DisplayName("0/1 整数被规范化为布尔值")
    void testOfBits_NormalizesToBoolean() {
        BitMatrix fromInts = BitMatrix.ofBits(new int[][]{{1, 0}, {0, 1}});
        BitMatrix fromBools = BitMatrix.of(new boolean[][]{{true, false}, {false, true}});
        assertEquals(fromBools, fromInts);
        assertEquals(fromBools.hashCode(), fromInts.hashCode());
        assertEquals(2, fromInts.getRows());
        assertEquals(2, fromInts.getCols());
    }

    @Test
    void testOfBits_OutOfDomain_ShouldThrow() {
        assertThrows(ValueDomainException.class, () -> BitMatrix.ofBits(new int[][]{{0, 2}}));
        assertThrows(ValueDomainException.class, () -> BitMatrix.ofBits(new int[][]{{-1}}));
    }

    @Test
    @DisplayName("空矩阵和不规则矩阵抛出 ShapeMismatchException")
    void testIrregularShapes_ShouldThrow() {
        assertAll(
                () -> assertThrows(ShapeMismatchException.class, () -> BitMatrix.ofBits(new int[0][])),
                () -> assertThrows(ShapeMismatchException.class, () -> BitMatrix.ofBits(new int[][]{{}})),
                () -> assertThrows(ShapeMismatchException.class, () -> BitMatrix.ofBits(new int[][]{{1, 0}, {1}})),
                () -> assertThrows(ShapeMismatchException.class, () -> BitMatrix.of(null))
        );
    }

    @Test
    @DisplayName("输入数组被深拷贝")
    void testOf_CopiesInput() {
        boolean[][] raw = {{true, false}};
        BitMatrix matrix = BitMatrix.of(raw);
        raw[0][0] = false;
        assertTrue(matrix.get(0, 0));
        matrix.row(0)[1] = true;
        assertFalse(matrix.get(0, 1));
    }

    @Test
    void testColumnOperations() {
        BitMatrix m = BitMatrix.ofBits(new int[][]{{1, 0, 1}, {0, 1, 1}});
        assertEquals(BitMatrix.ofBits(new int[][]{{1, 0, 1}, {1, 1, 0}}), m.swapColumns(0, 2));
        assertEquals(BitMatrix.ofBits(new int[][]{{1, 1, 1}, {0, 0, 1}}), m.xorColumn(1, 2));
        BitMatrix zeros = BitMatrix.zeros(2, 3);
        assertEquals(BitMatrix.ofBits(new int[][]{{1, 0, 0}, {0, 0, 0}}), zeros.withColumnFrom(0, m));
        assertThrows(IndexOutOfBoundsException.class, () -> m.swapColumns(0, 3));
    }

    @Test
    void testStackSelectAndXor() {
        BitMatrix a = BitMatrix.ofBits(new int[][]{{1, 0}});
        BitMatrix b = BitMatrix.ofBits(new int[][]{{1, 1}});
        BitMatrix stacked = a.vstack(b);
        assertEquals(BitMatrix.ofBits(new int[][]{{1, 0}, {1, 1}}), stacked);
        assertEquals(b, stacked.selectRows(1));
        assertEquals(BitMatrix.ofBits(new int[][]{{0, 1}}), a.xor(b));
        assertThrows(ShapeMismatchException.class, () -> a.xor(stacked));
        assertThrows(ShapeMismatchException.class, () -> a.vstack(BitMatrix.zeros(1, 3)));
    }

    @Test
    @DisplayName("辛内积：XX 与 ZZ 对易，XI 与 ZI 反对易")
    void testSymplecticParity() {
        BitMatrix xs = BitMatrix.ofBits(new int[][]{{1, 1}, {0, 0}, {1, 0}, {0, 0}});
        BitMatrix zs = BitMatrix.ofBits(new int[][]{{0, 0}, {1, 1}, {0, 0}, {1, 0}});
        assertFalse(BitMatrix.symplecticParity(xs, 0, zs, xs, 1, zs));
        assertTrue(BitMatrix.symplecticParity(xs, 2, zs, xs, 3, zs));
    }
}
