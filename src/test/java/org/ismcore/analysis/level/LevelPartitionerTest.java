package org.ismcore.analysis.level;

import org.ismcore.analysis.closure.ClosureComputer;
import org.ismcore.analysis.matrix.BinaryMatrix;
import org.ismcore.analysis.relation.RelationEncoder;
import org.ismcore.analysis.testutil.SsimFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Level Partitioner Tests")
class LevelPartitionerTest {

    @Nested
    @DisplayName("1. Reference Scenarios")
    class ScenarioTests {

        @Test
        @DisplayName("Chain 0 -> 1 -> 2 yields top element 2 first and driver 0 last")
        void testChain() {
            List<LevelPartition> levels = LevelPartitioner.partition(SsimFixtures.matrix(
                    "111",
                    "011",
                    "001"
            ));

            assertLevels(levels, new int[]{2}, new int[]{1}, new int[]{0});
        }

        @Test
        @DisplayName("Mutual pair is emitted as one level")
        void testMutualPair() {
            List<LevelPartition> levels = LevelPartitioner.partition(SsimFixtures.matrix(
                    "11",
                    "11"
            ));

            assertLevels(levels, new int[]{0, 1});
        }

        @Test
        @DisplayName("Unrelated elements both qualify on the first pass, in ascending order")
        void testUnrelatedPair() {
            List<LevelPartition> levels = LevelPartitioner.partition(SsimFixtures.matrix(
                    "10",
                    "01"
            ));

            assertLevels(levels, new int[]{0, 1});
        }

        @Test
        @DisplayName("Driver above a mutual pair sits one level below the pair")
        void testDriverAboveCycle() {
            List<LevelPartition> levels = LevelPartitioner.partition(SsimFixtures.matrix(
                    "111",
                    "011",
                    "011"
            ));

            assertLevels(levels, new int[]{1, 2}, new int[]{0});
        }

        @Test
        @DisplayName("Zero elements yield no levels")
        void testEmpty() {
            assertTrue(LevelPartitioner.partition(BinaryMatrix.empty(0)).isEmpty());
        }
    }

    @Nested
    @DisplayName("2. Fallbacks and Guards")
    class FallbackTests {

        @Test
        @DisplayName("Non-transitive cycle with no qualifying element is flushed as one level")
        void testCyclicRemainderFlushed() {
            List<LevelPartition> levels = LevelPartitioner.partition(SsimFixtures.matrix(
                    "110",
                    "011",
                    "101"
            ));

            assertLevels(levels, new int[]{0, 1, 2});
        }

        @Test
        @DisplayName("Remainder is flushed after regular levels are peeled off")
        void testRemainderAfterLevels() {
            // 3 is a sink; 0 -> 1 -> 2 -> 0 is left unclosed
            List<LevelPartition> levels = LevelPartitioner.partition(SsimFixtures.matrix(
                    "1100",
                    "0110",
                    "1011",
                    "0001"
            ));

            assertLevels(levels, new int[]{3}, new int[]{0, 1, 2});
        }

        @Test
        @DisplayName("Zero cap slack never cuts a chain short: one level per element")
        void testZeroSlackChain() {
            int n = 5;
            BinaryMatrix frm = ClosureComputer.close(RelationEncoder.encode(
                    n, SsimFixtures.chain(n).identifiers(), SsimFixtures.chain(n).table()
            ));

            List<LevelPartition> levels = LevelPartitioner.partition(frm, 0);

            assertEquals(n, levels.size());
            for (int i = 0; i < n; i++) {
                assertArrayEquals(new int[]{n - 1 - i}, levels.get(i).elementsCopy());
            }
        }

        @Test
        @DisplayName("Invalid arguments are rejected")
        void testInvalidArguments() {
            assertThrows(NullPointerException.class, () -> LevelPartitioner.partition(null));
            assertThrows(IllegalArgumentException.class,
                    () -> LevelPartitioner.partition(BinaryMatrix.empty(1), -1));
        }

        @Test
        @DisplayName("Result list is read-only")
        void testResultReadOnly() {
            List<LevelPartition> levels = LevelPartitioner.partition(SsimFixtures.matrix("1"));
            assertThrows(UnsupportedOperationException.class, levels::clear);
        }
    }

    @Nested
    @DisplayName("3. Properties on Random Tables")
    class PropertyTests {

        @Test
        @DisplayName("Every element lands on exactly one level and levels are numbered contiguously")
        void testCoverage() {
            for (long seed = 1; seed <= 40; seed++) {
                BinaryMatrix frm = closureOf(SsimFixtures.random(12, seed));
                List<LevelPartition> levels = LevelPartitioner.partition(frm);

                int[] seen = new int[frm.size()];
                for (int i = 0; i < levels.size(); i++) {
                    LevelPartition level = levels.get(i);
                    assertEquals(i + 1, level.getLevel());
                    int previous = -1;
                    for (int element : level.elementsCopy()) {
                        assertTrue(element > previous, "elements listed in ascending order");
                        previous = element;
                        seen[element]++;
                    }
                }
                for (int element = 0; element < seen.length; element++) {
                    assertEquals(1, seen[element], "seed " + seed + " element " + element);
                }
            }
        }

        @Test
        @DisplayName("One-way reachability always points to an earlier level; mutual pairs share a level")
        void testLevelOrdering() {
            for (long seed = 100; seed < 140; seed++) {
                BinaryMatrix frm = closureOf(SsimFixtures.random(10, seed));
                int[] levelOf = levelIndex(frm.size(), LevelPartitioner.partition(frm));

                for (int i = 0; i < frm.size(); i++) {
                    for (int j = 0; j < frm.size(); j++) {
                        if (i == j || !frm.get(i, j)) {
                            continue;
                        }
                        if (frm.get(j, i)) {
                            assertEquals(levelOf[i], levelOf[j], "mutual " + i + "<->" + j);
                        } else {
                            assertTrue(levelOf[j] < levelOf[i], "seed " + seed + ": " + i + "->" + j);
                        }
                    }
                }
            }
        }

        @Test
        @DisplayName("Repeated runs yield identical levels")
        void testDeterminism() {
            BinaryMatrix frm = closureOf(SsimFixtures.random(15, 7L));
            assertEquals(LevelPartitioner.partition(frm), LevelPartitioner.partition(frm));
        }
    }

    private static BinaryMatrix closureOf(SsimFixtures.Fixture fixture) {
        return ClosureComputer.close(RelationEncoder.encode(fixture.size(), fixture.identifiers(), fixture.table()));
    }

    private static int[] levelIndex(int size, List<LevelPartition> levels) {
        int[] levelOf = new int[size];
        for (LevelPartition level : levels) {
            for (int element : level.elementsCopy()) {
                levelOf[element] = level.getLevel();
            }
        }
        return levelOf;
    }

    private static void assertLevels(List<LevelPartition> levels, int[]... expected) {
        assertEquals(expected.length, levels.size(), "level count");
        for (int i = 0; i < expected.length; i++) {
            assertEquals(i + 1, levels.get(i).getLevel());
            assertArrayEquals(expected[i], levels.get(i).elementsCopy(), "level " + (i + 1));
        }
    }
}
