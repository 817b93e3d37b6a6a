package io.github.yok.secondq.core.tensor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.yok.secondq.core.operator.SparseTerms;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.math3.complex.Complex;
import org.ejml.data.DMatrixRMaj;
import org.junit.jupiter.api.Test;

class PolynomialTensorTest {

    @Test
    void denseTensorIsRowMajor() {
        DenseTensor t = DenseTensor.builder(2, 2).set(1.0, 0, 1).set(new Complex(0.0, 2.0), 1, 0)
                .build();

        List<String> visited = new ArrayList<>();
        t.forEachEntry(true, (idx, v) -> visited.add(Arrays.toString(idx)));
        assertEquals(List.of("[0, 0]", "[0, 1]", "[1, 0]", "[1, 1]"), visited);

        assertEquals(4, t.size());
        assertEquals(new Complex(0.0, 2.0), t.get(1, 0));
    }

    @Test
    void denseTensorSkipsZerosUnlessAsked() {
        DenseTensor t = DenseTensor.builder(1, 3).set(5.0, 2).build();
        List<Complex> values = new ArrayList<>();
        t.forEachEntry(false, (idx, v) -> values.add(v));
        assertEquals(List.of(new Complex(5.0)), values);
    }

    @Test
    void denseTensorRejectsBadIndices() {
        DenseTensor t = DenseTensor.builder(2, 2).build();
        assertThrows(IllegalArgumentException.class, () -> t.get(0));
        assertThrows(IndexOutOfBoundsException.class, () -> t.get(0, 2));
    }

    @Test
    void denseTensorFromNonSquareMatrixIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> DenseTensor.fromMatrix(new DMatrixRMaj(2, 3)));
    }

    @Test
    void keyOfBodyOrder() {
        assertEquals("", PolynomialTensor.keyOfBodyOrder(0));
        assertEquals("+-", PolynomialTensor.keyOfBodyOrder(1));
        assertEquals("++--", PolynomialTensor.keyOfBodyOrder(2));
    }

    @Test
    void termsFollowKeySymbols() {
        DenseTensor two = DenseTensor.builder(4, 4).set(0.25, 0, 1, 2, 3).build();
        PolynomialTensor p = PolynomialTensor.ofBodyOrders(Collections.singletonMap(2, two), 4);

        SparseTerms terms = p.termsOf("++--", false);
        assertEquals(1, terms.size());
        assertEquals(new Complex(0.25), terms.get("+_0 +_1 -_2 -_3"));
        assertEquals(4, terms.registerLength());
    }

    @Test
    void bodyOrdersAreSorted() {
        Map<Integer, DenseTensor> byOrder = new LinkedHashMap<>();
        byOrder.put(2, DenseTensor.builder(4, 2).build());
        byOrder.put(1, DenseTensor.builder(2, 2).build());
        PolynomialTensor p = PolynomialTensor.ofBodyOrders(byOrder, 2);
        assertEquals(List.of("+-", "++--"), new ArrayList<>(p.keys()));
    }

    @Test
    void rejectsInconsistentTensors() {
        DenseTensor rank2 = DenseTensor.builder(2, 3).build();
        assertThrows(IllegalArgumentException.class,
                () -> new PolynomialTensor(Collections.singletonMap("++--", rank2), 3));
        assertThrows(IllegalArgumentException.class,
                () -> new PolynomialTensor(Collections.singletonMap("+-", rank2), 4));
        assertThrows(IllegalArgumentException.class,
                () -> new PolynomialTensor(Collections.singletonMap("+x", rank2), 3));
    }

    @Test
    void unknownKeyIsRejected() {
        PolynomialTensor p = new PolynomialTensor(Collections.emptyMap(), 2);
        assertThrows(IllegalArgumentException.class, () -> p.get("+-"));
    }
}
