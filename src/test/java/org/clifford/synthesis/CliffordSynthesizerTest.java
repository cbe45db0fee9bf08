package org.clifford.synthesis;

import org.apache.commons.rng.UniformRandomProvider;
import org.clifford.circuit.CircuitProgram;
import org.clifford.circuit.GateOperation;
import org.clifford.exceptions.SynthesisNonTerminationException;
import org.clifford.tableau.Tableau;
import org.clifford.utils.RandomSources;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CliffordSynthesizerTest {

    private static final Set<String> ALLOWED_GATES = Set.of("H", "S", "SWAP", "CNOT", "X", "Y", "Z");

    @Nested
    @DisplayName("合成结果的基本性质")
    class ShapeTests {

        @Test
        @DisplayName("n = 1..9 均终止，线路非空，门数不超过 c·n^2")
        void testSynthesize_TerminatesWithQuadraticGateCount() {
            CliffordSynthesizer synthesizer = new CliffordSynthesizer(RandomSources.create(2008L));
            for (int n = 1; n < 10; n++) {
                CircuitProgram circuit = synthesizer.synthesize(n);
                assertFalse(circuit.isEmpty(), "n = " + n);
                assertTrue(circuit.size() <= 2 * n * n + 5 * n, "n = " + n + " 时门数为 " + circuit.size());
            }
        }

        @Test
        @DisplayName("只使用 H/S/SWAP/CNOT/X/Y/Z，索引在 [0, n) 内")
        void testSynthesize_GatesAndIndicesInRange() {
            UniformRandomProvider rng = RandomSources.create(31L);
            for (int n = 1; n < 10; n++) {
                CircuitProgram circuit = CliffordSynthesizer.generateRandomClifford(n, rng);
                for (GateOperation op : circuit.getOperations()) {
                    assertTrue(ALLOWED_GATES.contains(op.getName()), op.toString());
                    for (int qubit : op.getQubits()) {
                        assertTrue(qubit >= 0 && qubit < n, "n = " + n + ": " + op);
                    }
                    if (op.getName().equals("SWAP") || op.getName().equals("CNOT")) {
                        assertNotEquals(op.getQubits().get(0), op.getQubits().get(1), op.toString());
                    }
                }
            }
        }

        @Test
        @DisplayName("相同种子产生相同线路")
        void testSynthesize_Reproducible() {
            CircuitProgram first = new CliffordSynthesizer(RandomSources.create(42L)).synthesize(6);
            CircuitProgram second = new CliffordSynthesizer(RandomSources.create(42L)).synthesize(6);
            assertEquals(first.toString(), second.toString());
        }

        @Test
        @DisplayName("合成线路可被解析回同一线路")
        void testSynthesize_TextRoundTrip() {
            CircuitProgram circuit = new CliffordSynthesizer(RandomSources.create(5L)).synthesize(5);
            assertEquals(circuit, CircuitProgram.parse(circuit.toString()));
        }

        @Test
        void testSynthesize_NonPositiveWidth_ShouldThrow() {
            CliffordSynthesizer synthesizer = new CliffordSynthesizer(RandomSources.create(1L));
            assertThrows(IllegalArgumentException.class, () -> synthesizer.synthesize(0));
        }
    }

    @Nested
    @DisplayName("作为 Clifford 变换的正确性")
    class CliffordTests {

        @Test
        @DisplayName("在恒等表上重放后仍保持辛结构：仅 (X_i, Z_i) 对应行反对易")
        void testReplayOnIdentity_PreservesSymplecticStructure() {
            UniformRandomProvider rng = RandomSources.create(777L);
            for (int n = 1; n < 8; n++) {
                CircuitProgram circuit = CliffordSynthesizer.generateRandomClifford(n, rng);
                Tableau tableau = Tableau.identity(n);
                tableau.replay(circuit);
                for (int i = 0; i < 2 * n; i++) {
                    for (int j = 0; j < 2 * n; j++) {
                        boolean expectedAntiCommute = Math.abs(i - j) == n;
                        assertEquals(!expectedAntiCommute, tableau.rowsCommute(i, j),
                                "n = " + n + " 行 " + i + "/" + j + ": " + tableau);
                    }
                }
            }
        }

        @Test
        @DisplayName("单比特：不同种子覆盖多种 Clifford 作用")
        void testSingleQubit_ReachesManyImages() {
            UniformRandomProvider rng = RandomSources.create(2020L);
            Set<String> images = new HashSet<>();
            for (int i = 0; i < 300; i++) {
                Tableau tableau = Tableau.identity(1);
                tableau.replay(CliffordSynthesizer.generateRandomClifford(1, rng));
                images.add(tableau.toStrings().toString());
            }
            // 无符号单比特 Clifford 作用共 6 种
            assertEquals(6, images.size(), images.toString());
        }
    }

    @Nested
    @DisplayName("配置")
    class OptionsTests {

        @Test
        @DisplayName("采样次数耗尽时抛出 SynthesisNonTerminationException")
        void testPairAttemptsExhausted_ShouldThrow() {
            // 恒为 0 的比特源只产生恒等 Pauli 串，永远对易
            UniformRandomProvider zeros = new ZeroRandomProvider();
            CliffordSynthesizer synthesizer = new CliffordSynthesizer(zeros, SynthesisOptions.defaults().withMaxPairAttempts(25));
            SynthesisNonTerminationException e = assertThrows(SynthesisNonTerminationException.class,
                    () -> synthesizer.synthesize(3));
            assertEquals(25, e.getAttempts());
            assertEquals(3, e.getQubits());
        }

        @Test
        @DisplayName("recordTrivialSwap 控制是否记录 SWAP(0, 0)")
        void testRecordTrivialSwap() {
            CircuitProgram skipped = new CliffordSynthesizer(RandomSources.create(3L)).synthesize(1);
            CircuitProgram recorded = new CliffordSynthesizer(RandomSources.create(3L),
                    SynthesisOptions.defaults().withRecordTrivialSwap(true)).synthesize(1);
            GateOperation trivialSwap = GateOperation.of("SWAP", 0, 0);
            assertFalse(skipped.toString().contains("SWAP"));
            assertTrue(recorded.getOperations().contains(trivialSwap));
            // 记录与否不消耗随机比特，去掉 SWAP(0, 0) 后两条线路一致
            assertEquals(skipped.getOperations(), recorded.getOperations().stream()
                    .filter(op -> !op.equals(trivialSwap)).toList());
        }

        @Test
        void testOptionsValidation() {
            assertThrows(IllegalArgumentException.class, () -> SynthesisOptions.of(0, false));
            assertEquals(SynthesisOptions.DEFAULT_MAX_PAIR_ATTEMPTS, SynthesisOptions.defaults().getMaxPairAttempts());
            assertFalse(SynthesisOptions.defaults().isRecordTrivialSwap());
        }
    }

    /**
     * 所有比特恒为 0 的随机源。
     */
    private static final class ZeroRandomProvider implements UniformRandomProvider {

        @Override
        public void nextBytes(byte[] bytes) {
            Arrays.fill(bytes, (byte) 0);
        }

        @Override
        public void nextBytes(byte[] bytes, int start, int len) {
            Arrays.fill(bytes, start, start + len, (byte) 0);
        }

        @Override
        public int nextInt() {
            return 0;
        }

        @Override
        public int nextInt(int n) {
            return 0;
        }

        @Override
        public long nextLong() {
            return 0L;
        }

        @Override
        public long nextLong(long n) {
            return 0L;
        }

        @Override
        public boolean nextBoolean() {
            return false;
        }

        @Override
        public float nextFloat() {
            return 0f;
        }

        @Override
        public double nextDouble() {
            return 0d;
        }
    }
}
