package io.github.yok.secondq.core.operator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.math3.complex.Complex;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class VibrationalOpTest {

    /**
     * モード 0 に 2 モーダル、モード 1 に 3 モーダルです。
     */
    private static final List<Integer> MODALS = List.of(2, 3);

    private static VibrationalOp op(List<Integer> numModals, Object... kv) {
        Map<String, Complex> m = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2) {
            Object v = kv[i + 1];
            m.put((String) kv[i],
                    v instanceof Complex ? (Complex) v : new Complex(((Number) v).doubleValue()));
        }
        return new VibrationalOp(m, numModals);
    }

    @Nested
    @DisplayName("ラベルの検証")
    class Validation {

        @ParameterizedTest
        @ValueSource(strings = {"+_0", "+_0_0_0", "*_0_0", "+_0_0  -_1_0", "+_2_0", "+_0_2",
                "-_1_3"})
        void rejectsMalformedLabels(String label) {
            assertThrows(InvalidLabelException.class, () -> op(MODALS, label, 1.0));
        }

        @Test
        void acceptsLabelsInsideEachMode() {
            VibrationalOp op = op(MODALS, "+_0_1 -_1_2", 1.0, "", 0.5);
            assertEquals(5, op.registerLength());
            assertEquals(MODALS, op.getNumModals());
            assertEquals(2, op.size());
        }

        @Test
        void rejectsEmptyMode() {
            assertThrows(IllegalArgumentException.class, () -> VibrationalOp.zero(List.of(2, 0)));
        }

        @Test
        void rejectsRegisterLengthOtherThanModalSum() {
            assertThrows(IllegalArgumentException.class,
                    () -> new VibrationalOp(SparseTerms.zero(4), MODALS));
        }
    }

    @Nested
    @DisplayName("演算")
    class Operations {

        @Test
        void composeConcatenatesLabels() {
            VibrationalOp a = op(MODALS, "+_0_1", 2.0);
            VibrationalOp b = op(MODALS, "-_1_0", Complex.I);
            assertEquals(op(MODALS, "+_0_1 -_1_0", new Complex(0.0, 2.0)), a.compose(b));
            assertEquals(op(MODALS, "-_1_0 +_0_1", new Complex(0.0, 2.0)), a.compose(b, true));
        }

        @Test
        void tensorShiftsModes() {
            VibrationalOp a = op(List.of(2), "+_0_1 -_0_0", 1.0);
            VibrationalOp b = op(List.of(3), "+_0_2", 2.0);

            VibrationalOp t = a.tensor(b);
            assertEquals(List.of(2, 3), t.getNumModals());
            assertEquals(op(List.of(2, 3), "+_0_1 -_0_0 +_1_2", 2.0), t);
            assertEquals(op(List.of(3, 2), "+_0_2 +_1_1 -_1_0", 2.0), a.expand(b));
        }

        @Test
        void adjointReversesSwapsAndConjugates() {
            VibrationalOp a = op(MODALS, "+_0_1 -_1_2", new Complex(1.0, 2.0));
            assertEquals(op(MODALS, "+_1_2 -_0_1", new Complex(1.0, -2.0)), a.adjoint());
            assertEquals(a, a.adjoint().adjoint());
        }

        @Test
        void transposeOnlyReversesTokens() {
            VibrationalOp a = op(MODALS, "+_0_1 -_1_2", new Complex(1.0, 2.0));
            assertEquals(op(MODALS, "-_1_2 +_0_1", new Complex(1.0, 2.0)), a.transpose());
        }
    }

    @Nested
    @DisplayName("簡約")
    class Simplification {

        @Test
        void repeatedOperatorOnSameModalVanishes() {
            assertEquals(0, op(MODALS, "+_0_1 -_1_0 +_0_1", 1.0).simplify().size());
        }

        @Test
        void differentModalsOfSameModeAreIndependent() {
            VibrationalOp a = op(MODALS, "+_0_0 +_0_1", 1.0);
            assertEquals(a, a.simplify());
        }

        @Test
        void alternatingRunCollapsesWithoutSign() {
            // フェルミオンでは -1 になる並びでも、振動モードの演算子は交換するため符号は変わりません
            VibrationalOp a = op(MODALS, "+_0_0 -_1_0 -_0_0 +_1_1 +_0_0", 1.0);
            assertEquals(op(MODALS, "+_0_0 -_1_0 +_1_1", 1.0), a.simplify());
        }

        @Test
        void sumsAndPrunes() {
            VibrationalOp a = op(MODALS, "+_0_0 -_0_0 +_0_0", 1.0, "+_0_0", -1.0, "-_1_1", 1e-12);
            assertEquals(0, a.simplify().size());
        }
    }

    @Nested
    @DisplayName("他の演算子との関係")
    class AcrossFlavors {

        @Test
        @SuppressWarnings({"rawtypes", "unchecked"})
        void addingDifferentFlavorIsRejected() {
            SparseLabelOp vibrational = op(List.of(2), "+_0_1", 1.0);
            FermionicOp fermionic = new FermionicOp(Collections.singletonMap("+_1", Complex.ONE), 2);
            assertThrows(UnsupportedOperandTypeException.class, () -> vibrational.add(fermionic));
            assertThrows(UnsupportedOperandTypeException.class,
                    () -> ((SparseLabelOp) fermionic).subtract(vibrational));
        }

        @Test
        @SuppressWarnings({"rawtypes", "unchecked"})
        void differentFlavorIsNeverEquivalent() {
            SparseLabelOp vibrational = VibrationalOp.one(List.of(2));
            FermionicOp fermionic = FermionicOp.one(2);
            assertFalse(vibrational.equiv(fermionic));
            assertNotEquals(vibrational, fermionic);
        }

        @Test
        void modalLayoutMustMatch() {
            VibrationalOp a = VibrationalOp.one(List.of(2, 3));
            VibrationalOp b = VibrationalOp.one(List.of(3, 2));
            assertThrows(MismatchedRegisterLengthException.class, () -> a.add(b));
            assertThrows(MismatchedRegisterLengthException.class, () -> a.compose(b));
            assertFalse(a.equiv(b));
            assertNotEquals(a, b);
        }

        @Test
        void sharesVectorSpaceOperations() {
            VibrationalOp a = op(MODALS, "+_0_1 -_0_0", 1.0);
            VibrationalOp sum = a.add(a.adjoint()).scale(0.5);
            assertEquals(op(MODALS, "+_0_1 -_0_0", 0.5, "+_0_0 -_0_1", 0.5), sum);
            assertTrue(a.subtract(a).simplify().equiv(VibrationalOp.zero(MODALS)));
        }
    }
}
