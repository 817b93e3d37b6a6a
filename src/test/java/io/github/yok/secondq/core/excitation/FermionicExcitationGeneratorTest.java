package io.github.yok.secondq.core.excitation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class FermionicExcitationGeneratorTest {

    private final FermionicExcitationGenerator generator = new FermionicExcitationGenerator();

    private static Excitation exc(List<Integer> sources, List<Integer> targets) {
        return new Excitation(sources, targets);
    }

    private static long countOfOrder(List<Excitation> excitations, int order) {
        return excitations.stream().filter(e -> e.order() == order).count();
    }

    @Nested
    @DisplayName("占有軌道からの励起")
    class Occupied {

        @Test
        void smallestSystem() {
            List<Excitation> result =
                    generator.generate(4, new ParticleCounts(1, 1), ExcitationSettings.upTo(2));
            assertEquals(List.of(exc(List.of(0), List.of(1)), exc(List.of(2), List.of(3)),
                    exc(List.of(0, 2), List.of(1, 3))), result);
        }

        @ParameterizedTest(name = "n={0}, particles=({1}, {2}) -> singles={3}, doubles={4}")
        @CsvSource({"4, 1, 1, 2, 1", "8, 2, 2, 8, 18", "8, 2, 1, 7, 13", "6, 1, 1, 4, 4",
                "6, 2, 0, 2, 0"})
        void countsPerOrder(int n, int alpha, int beta, long singles, long doubles) {
            List<Excitation> result = generator.generate(n, new ParticleCounts(alpha, beta),
                    ExcitationSettings.upTo(2));
            assertEquals(singles, countOfOrder(result, 1));
            assertEquals(doubles, countOfOrder(result, 2));
        }

        @Test
        void ordersByDegreeThenSourcesThenTargets() {
            List<Excitation> result =
                    generator.generate(8, new ParticleCounts(2, 2), ExcitationSettings.upTo(2));
            for (int i = 1; i < result.size(); i++) {
                Excitation prev = result.get(i - 1);
                Excitation cur = result.get(i);
                assertTrue(prev.order() <= cur.order(), "order: " + prev + " / " + cur);
                if (prev.order() == cur.order()) {
                    String a = key(prev);
                    String b = key(cur);
                    assertTrue(a.compareTo(b) < 0, prev + " / " + cur);
                }
            }
        }

        private String key(Excitation e) {
            // 8 軌道以下なので 1 桁の連結で辞書式順序と一致します
            return e.getSources().stream().map(String::valueOf).collect(Collectors.joining())
                    + "|"
                    + e.getTargets().stream().map(String::valueOf).collect(Collectors.joining());
        }

        @Test
        void isDeterministic() {
            ExcitationSettings s = ExcitationSettings.upTo(3);
            assertEquals(generator.generate(8, new ParticleCounts(2, 2), s),
                    generator.generate(8, new ParticleCounts(2, 2), s));
        }

        @Test
        void onlyRequestedOrders() {
            List<Excitation> result = generator.generate(8, new ParticleCounts(2, 2),
                    ExcitationSettings.ofOrders(2));
            assertEquals(18, result.size());
            assertTrue(result.stream().allMatch(e -> e.order() == 2));
        }
    }

    @Nested
    @DisplayName("スピンの条件")
    class Spin {

        @Test
        void withoutSpinPreservation() {
            ExcitationSettings s = ExcitationSettings.upTo(2).toBuilder().preserveSpin(false)
                    .build();
            List<Excitation> result = generator.generate(4, new ParticleCounts(1, 1), s);
            assertEquals(List.of(exc(List.of(0), List.of(1)), exc(List.of(0), List.of(3)),
                    exc(List.of(2), List.of(1)), exc(List.of(2), List.of(3)),
                    exc(List.of(0, 2), List.of(1, 3))), result);
        }

        @Test
        void betaOnly() {
            ExcitationSettings s = ExcitationSettings.upTo(2).toBuilder().alphaSpin(false).build();
            assertEquals(List.of(exc(List.of(2), List.of(3))),
                    generator.generate(4, new ParticleCounts(1, 1), s));
        }

        @Test
        void alphaOnly() {
            ExcitationSettings s = ExcitationSettings.upTo(2).toBuilder().betaSpin(false).build();
            assertEquals(List.of(exc(List.of(0), List.of(1))),
                    generator.generate(4, new ParticleCounts(1, 1), s));
        }

        @Test
        void maxSpinExcitationDropsSameSpinDoubles() {
            ExcitationSettings s =
                    ExcitationSettings.upTo(2).toBuilder().maxSpinExcitation(1).build();
            List<Excitation> result = generator.generate(8, new ParticleCounts(2, 2), s);
            assertEquals(8, countOfOrder(result, 1));
            assertEquals(16, countOfOrder(result, 2));
        }
    }

    @Nested
    @DisplayName("一般化励起")
    class Generalized {

        private final ExcitationSettings settings =
                ExcitationSettings.upTo(2).toBuilder().generalized(true).build();

        @Test
        void keepsOneOfEachMirrorPair() {
            List<Excitation> result = generator.generate(6, new ParticleCounts(1, 1), settings);
            assertEquals(6, countOfOrder(result, 1));
            assertEquals(9, countOfOrder(result, 2));
            for (Excitation e : result) {
                assertTrue(result.stream().noneMatch(o -> o.getSources().equals(e.getTargets())
                        && o.getTargets().equals(e.getSources())), "mirror of " + e);
            }
        }

        @Test
        void movesUpwardWithinEachSpinBlock() {
            List<Excitation> result = generator.generate(6, new ParticleCounts(1, 1), settings);
            assertEquals(List.of(exc(List.of(0), List.of(1)), exc(List.of(0), List.of(2)),
                    exc(List.of(1), List.of(2)), exc(List.of(3), List.of(4)),
                    exc(List.of(3), List.of(5)), exc(List.of(4), List.of(5)),
                    exc(List.of(0, 3), List.of(1, 4)), exc(List.of(0, 3), List.of(1, 5)),
                    exc(List.of(0, 3), List.of(2, 4)), exc(List.of(0, 3), List.of(2, 5)),
                    exc(List.of(0, 4), List.of(1, 5)), exc(List.of(0, 4), List.of(2, 5)),
                    exc(List.of(1, 3), List.of(2, 4)), exc(List.of(1, 3), List.of(2, 5)),
                    exc(List.of(1, 4), List.of(2, 5))), result);
        }

        @Test
        void rejectsDoublesMovingDownInOneBlock() {
            List<Excitation> result = generator.generate(6, new ParticleCounts(1, 1), settings);
            assertFalse(result.contains(exc(List.of(0, 4), List.of(1, 3))));
            assertFalse(result.contains(exc(List.of(0, 5), List.of(1, 3))));
            assertFalse(result.contains(exc(List.of(1, 5), List.of(2, 3))));
        }

        @Test
        void sameSpinDoublesInLargerBlocks() {
            // α ブロック {0,1,2,3} を 2 つに分ける 3 通りは、いずれも 0 を含む側が移動元になります
            ExcitationSettings alphaOnly = ExcitationSettings.ofOrders(2).toBuilder()
                    .generalized(true).betaSpin(false).build();
            List<Excitation> result = generator.generate(8, new ParticleCounts(2, 2), alphaOnly);
            assertEquals(List.of(exc(List.of(0, 1), List.of(2, 3)),
                    exc(List.of(0, 2), List.of(1, 3)), exc(List.of(0, 3), List.of(1, 2))), result);
        }

        @Test
        void ignoresOccupation() {
            assertEquals(generator.generate(6, new ParticleCounts(0, 0), settings),
                    generator.generate(6, new ParticleCounts(3, 3), settings));
        }

        @Test
        void sourcesAndTargetsAreDisjoint() {
            List<Excitation> result = generator.generate(6, new ParticleCounts(1, 1), settings);
            for (Excitation e : result) {
                assertTrue(e.getSources().stream().noneMatch(e.getTargets()::contains), e.toString());
            }
        }
    }

    @Nested
    @DisplayName("入力の検証")
    class Validation {

        @Test
        void rejectsOddSpinOrbitals() {
            assertThrows(IllegalArgumentException.class,
                    () -> generator.generate(5, new ParticleCounts(1, 1), ExcitationSettings.upTo(2)));
            assertThrows(IllegalArgumentException.class,
                    () -> generator.generate(0, new ParticleCounts(0, 0), ExcitationSettings.upTo(2)));
        }

        @Test
        void rejectsTooManyParticles() {
            assertThrows(InvalidParticleCountException.class,
                    () -> generator.generate(4, new ParticleCounts(3, 0), ExcitationSettings.upTo(2)));
        }

        @Test
        void rejectsNegativeParticles() {
            assertThrows(InvalidParticleCountException.class, () -> generator.generate(4,
                    new ParticleCounts(-1, 1), ExcitationSettings.upTo(2)));
        }

        @Test
        void fullyOccupiedGivesEmptyPool() {
            assertTrue(generator.generate(4, new ParticleCounts(2, 2), ExcitationSettings.upTo(2))
                    .isEmpty());
            assertTrue(generator.generate(4, new ParticleCounts(0, 0), ExcitationSettings.upTo(2))
                    .isEmpty());
        }

        @Test
        void orderBeyondSystemGivesEmptyPool() {
            assertTrue(generator
                    .generate(4, new ParticleCounts(1, 1), ExcitationSettings.ofOrders(3)).isEmpty());
        }
    }

    @Test
    void combinationsAreLexicographic() {
        assertEquals(List.of(List.of(1, 3), List.of(1, 5), List.of(3, 5)),
                FermionicExcitationGenerator.combinations(List.of(1, 3, 5), 2));
        assertTrue(FermionicExcitationGenerator.combinations(List.of(1), 2).isEmpty());
    }
}
