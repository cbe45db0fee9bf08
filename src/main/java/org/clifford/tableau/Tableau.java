package org.clifford.tableau;

import lombok.Getter;
import org.clifford.circuit.CircuitProgram;
import org.clifford.circuit.GateOperation;
import org.clifford.exceptions.ShapeMismatchException;
import org.clifford.exceptions.ValueDomainException;
import org.clifford.utils.BitMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

/**
 * 无符号稳定子表 (unsigned stabilizer tableau)。
 * 每一行 (x_i, z_i) 按 (x,z) → {00:I, 10:X, 01:Z, 11:Y} 编码一个 n 比特 Pauli 串，不跟踪符号。
 * <p>
 * xs/zs 只被 apply* 系列方法原地替换，每次门作用同时追加到所持有的 {@link CircuitProgram}。
 * 行选取、堆叠、异或都返回新的独立 Tableau（线路为空）。
 * 相等性只比较 xs 与 zs。
 * @author Ayalyt
 */
@Getter
public final class Tableau {

    private static final Logger logger = LoggerFactory.getLogger(Tableau.class);

    private BitMatrix xs;
    private BitMatrix zs;

    /** 记录作用在本表上的所有门，按作用顺序 */
    @Getter(lombok.AccessLevel.NONE)
    private final CircuitProgram circuit;

    /**
     * 私有构造函数。先校验，后赋值。
     */
    private Tableau(BitMatrix xs, BitMatrix zs) {
        checkXZ(xs, zs);
        this.xs = xs;
        this.zs = zs;
        this.circuit = new CircuitProgram();
        logger.debug("创建 Tableau: {}", this);
    }

    private static void checkXZ(BitMatrix xs, BitMatrix zs) {
        if (xs == null || zs == null) {
            logger.error("Tableau: xs 或 zs 为 null");
            throw new ShapeMismatchException("xs 与 zs 不能为 null");
        }
        if (!xs.sameShape(zs)) {
            logger.error("Tableau: xs 形状 {}x{} 与 zs 形状 {}x{} 不一致", xs.getRows(), xs.getCols(), zs.getRows(), zs.getCols());
            throw new ShapeMismatchException("xs 与 zs 形状不兼容: " + xs.getRows() + "x" + xs.getCols()
                    + " vs " + zs.getRows() + "x" + zs.getCols());
        }
    }

    // --- 工厂方法 ---

    public static Tableau of(BitMatrix xs, BitMatrix zs) {
        return new Tableau(xs, zs);
    }

    /**
     * 由 0/1 整数矩阵创建。
     * @throws ShapeMismatchException 矩阵不规则、为空或形状不一致。
     * @throws ValueDomainException 存在 0/1 以外的元素。
     */
    public static Tableau of(int[][] xs, int[][] zs) {
        return new Tableau(BitMatrix.ofBits(xs), BitMatrix.ofBits(zs));
    }

    public static Tableau of(boolean[][] xs, boolean[][] zs) {
        return new Tableau(BitMatrix.of(xs), BitMatrix.of(zs));
    }

    /**
     * 由 Pauli 串创建，每个串一行，字符取自 {I, X, Y, Z}。
     * @throws ShapeMismatchException 没有串，或串长度不一致。
     * @throws ValueDomainException 含非法字符。
     */
    public static Tableau fromPauliStrings(String... paulis) {
        if (paulis.length == 0) {
            throw new ShapeMismatchException("至少需要一个 Pauli 串");
        }
        boolean[][] xs = new boolean[paulis.length][];
        boolean[][] zs = new boolean[paulis.length][];
        for (int i = 0; i < paulis.length; i++) {
            String pauli = paulis[i];
            xs[i] = new boolean[pauli.length()];
            zs[i] = new boolean[pauli.length()];
            for (int q = 0; q < pauli.length(); q++) {
                char label = pauli.charAt(q);
                switch (label) {
                    case 'I' -> { }
                    case 'X' -> xs[i][q] = true;
                    case 'Z' -> zs[i][q] = true;
                    case 'Y' -> {
                        xs[i][q] = true;
                        zs[i][q] = true;
                    }
                    default -> {
                        logger.error("Pauli 串 '{}' 含非法字符 '{}'", pauli, label);
                        throw new ValueDomainException("Pauli 串只能包含 I/X/Y/Z: '" + pauli + "'");
                    }
                }
            }
        }
        return of(xs, zs);
    }

    /**
     * n 比特恒等 Clifford 的表：前 n 行为 X_0..X_{n-1}（destabilizer），后 n 行为 Z_0..Z_{n-1}（stabilizer）。
     */
    public static Tableau identity(int nQubits) {
        if (nQubits < 1) {
            throw new IllegalArgumentException("量子比特数必须为正: " + nQubits);
        }
        boolean[][] xs = new boolean[2 * nQubits][nQubits];
        boolean[][] zs = new boolean[2 * nQubits][nQubits];
        for (int q = 0; q < nQubits; q++) {
            xs[q][q] = true;
            zs[nQubits + q][q] = true;
        }
        return of(xs, zs);
    }

    // --- 基本属性 ---

    public int getNQubits() {
        return xs.getCols();
    }

    public int getNRows() {
        return xs.getRows();
    }

    /**
     * 已作用门的记录。返回副本，对它的修改不影响本表。
     */
    public CircuitProgram getCircuit() {
        return circuit.copy();
    }

    // --- 对易关系 ---

    /**
     * 检查两个单行 Pauli 串是否对易：各比特上 x_a·z_b XOR x_b·z_a 的奇偶性为 0。
     * @throws ShapeMismatchException 任一方不是单行，或比特数不同。
     */
    public static boolean checkCommutation(Tableau first, Tableau second) {
        if (first.getNRows() != 1 || second.getNRows() != 1) {
            logger.error("checkCommutation: 只能比较单行 Pauli 串，实际行数 {} 与 {}", first.getNRows(), second.getNRows());
            throw new ShapeMismatchException("只能比较单行 Pauli 串: " + first.getNRows() + " 行 vs " + second.getNRows() + " 行");
        }
        if (first.getNQubits() != second.getNQubits()) {
            logger.error("checkCommutation: 比特数不一致 {} vs {}", first.getNQubits(), second.getNQubits());
            throw new ShapeMismatchException("比特数不一致: " + first.getNQubits() + " vs " + second.getNQubits());
        }
        return !BitMatrix.symplecticParity(first.xs, 0, first.zs, second.xs, 0, second.zs);
    }

    public boolean commutes(Tableau other) {
        return checkCommutation(this, other);
    }

    /**
     * 本表第 i 行与第 j 行是否对易。
     */
    public boolean rowsCommute(int i, int j) {
        checkRow(i);
        checkRow(j);
        return !BitMatrix.symplecticParity(xs, i, zs, xs, j, zs);
    }

    // --- 门作用 ---

    /**
     * 作用一个 Clifford 门：计算新状态，提交，并记录门操作。
     */
    public void apply(CliffordGate gate, int... qubits) {
        GateApplication application = gate.apply(xs, zs, qubits);
        this.xs = application.getXs();
        this.zs = application.getZs();
        application.getEmitted().ifPresent(circuit::addGate);
    }

    public void applyH(int qubit) {
        apply(CliffordGate.H, qubit);
    }

    public void applyS(int qubit) {
        apply(CliffordGate.S, qubit);
    }

    public void applySWAP(int qubit1, int qubit2) {
        apply(CliffordGate.SWAP, qubit1, qubit2);
    }

    public void applyCNOT(int control, int target) {
        apply(CliffordGate.CNOT, control, target);
    }

    public void applyX(int qubit) {
        apply(CliffordGate.X, qubit);
    }

    public void applyY(int qubit) {
        apply(CliffordGate.Y, qubit);
    }

    public void applyZ(int qubit) {
        apply(CliffordGate.Z, qubit);
    }

    public void applyI(int qubit) {
        apply(CliffordGate.I, qubit);
    }

    /**
     * 按顺序把线路中的每个门作用到本表上（同时记录到本表的线路中）。
     * @throws IllegalArgumentException 线路中含有非 Clifford 门。
     */
    public void replay(CircuitProgram program) {
        for (GateOperation op : program.getOperations()) {
            int[] qubits = op.getQubits().stream().mapToInt(Integer::intValue).toArray();
            apply(CliffordGate.fromName(op.getName()), qubits);
        }
        logger.debug("重放了 {} 个门，当前 Tableau: {}", program.size(), this);
    }

    // --- 行选取与组合 ---

    /**
     * 取出第 row 行，作为新的单行 Tableau。
     */
    public Tableau get(int row) {
        checkRow(row);
        return select(row);
    }

    /**
     * 取出 [from, to) 行。
     */
    public Tableau get(int from, int to) {
        if (from < 0 || to > getNRows() || from >= to) {
            throw new IndexOutOfBoundsException("行区间 [" + from + ", " + to + ") 越界：" + getNRows());
        }
        return select(IntStream.range(from, to).toArray());
    }

    /**
     * 按给定顺序选取行。
     */
    public Tableau select(int... rows) {
        return new Tableau(xs.selectRows(rows), zs.selectRows(rows));
    }

    /**
     * 垂直堆叠（生成元的并），本表的行在前。
     */
    public Tableau plus(Tableau other) {
        return new Tableau(xs.vstack(other.xs), zs.vstack(other.zs));
    }

    /**
     * 逐行异或，即忽略相位的 Pauli 串乘法。
     * @throws ShapeMismatchException 形状不同。
     */
    public Tableau times(Tableau other) {
        return new Tableau(xs.xor(other.xs), zs.xor(other.zs));
    }

    private void checkRow(int row) {
        if (row < 0 || row >= getNRows()) {
            throw new IndexOutOfBoundsException("行索引 " + row + " 越界：" + getNRows());
        }
    }

    // --- 输出 ---

    /**
     * 每行转为 Pauli 串。
     */
    public List<String> toStrings() {
        List<String> result = new ArrayList<>(getNRows());
        for (int i = 0; i < getNRows(); i++) {
            result.add(rowToString(i));
        }
        return result;
    }

    private String rowToString(int row) {
        StringBuilder sb = new StringBuilder(getNQubits());
        for (int q = 0; q < getNQubits(); q++) {
            boolean x = xs.get(row, q);
            boolean z = zs.get(row, q);
            sb.append(x ? (z ? 'Y' : 'X') : (z ? 'Z' : 'I'));
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Tableau that = (Tableau) o;
        return xs.equals(that.xs) && zs.equals(that.zs);
    }

    // 可变对象，按当前状态计算
    @Override
    public int hashCode() {
        return 31 * xs.hashCode() + zs.hashCode();
    }

    @Override
    public String toString() {
        return toStrings().toString();
    }
}
