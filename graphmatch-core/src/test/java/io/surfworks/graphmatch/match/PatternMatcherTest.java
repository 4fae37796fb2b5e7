package io.surfworks.graphmatch.match;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import io.surfworks.graphmatch.constraint.ArgConstraint;
import io.surfworks.graphmatch.constraint.ConstraintResolver;
import io.surfworks.graphmatch.constraint.DefaultArgConstraint;
import io.surfworks.graphmatch.constraint.DefaultNodeConstraint;
import io.surfworks.graphmatch.constraint.NodeConstraint;
import io.surfworks.graphmatch.graph.Node;
import io.surfworks.graphmatch.graph.OperationGraph;
import io.surfworks.graphmatch.pattern.PatternGraph;
import io.surfworks.graphmatch.pattern.PatternGraphException;
import io.surfworks.graphmatch.pattern.PatternInputArg;
import io.surfworks.graphmatch.pattern.PatternNode;

/**
 * Tests for the matching engine.
 */
@DisplayName("PatternMatcher")
class PatternMatcherTest {

    // N1(Add) -> N2(Relu) -> N3(Sigmoid)
    private static final OperationGraph CHAIN = OperationGraph.builder("chain")
            .addNode("N1", "Add", List.of("x", "y"), List.of("n1"))
            .addNode("N2", "Relu", List.of("n1"), List.of("n2"))
            .addNode("N3", "Sigmoid", List.of("n2"), List.of("n3"))
            .build();

    private static final PatternGraph ADD_RELU = PatternGraph.builder("add_relu")
            .node(PatternNode.of("P1", "Add", List.of("a", "b"), List.of("t")))
            .node(PatternNode.of("P2", "Relu", List.of("t"), List.of("out")))
            .build();

    private static Node node(OperationGraph graph, String name) {
        return graph.nodeByName(name).orElseThrow();
    }

    private static void assertSound(PatternGraph pattern, OperationGraph target, PatternMatchResult result) {
        NodeConstraint defaults = DefaultNodeConstraint.create();
        for (PatternNode p : pattern.nodes()) {
            Node bound = result.getNodeByName(p.name());
            assertTrue(defaults.test(target, bound, pattern, p), "constraint violated for " + p.name());
            for (Node next : pattern.graph().outputNodes(pattern.graphNode(p))) {
                Node boundNext = result.getNodeByName(next.name());
                assertTrue(target.outputNodes(bound).contains(boundNext),
                        "missing target edge for pattern edge " + p.name() + " -> " + next.name());
            }
        }
    }

    private static void assertInjective(PatternMatchResult result) {
        Set<Node> targets = new HashSet<>();
        for (MatchedNodeGroup group : result.getMatchedNodeGroups().values()) {
            assertTrue(targets.add(group.matchedNode()), "target node bound twice: " + group.matchedNode());
        }
    }

    // ==================== Basic matching ====================

    @Nested
    @DisplayName("basic matching")
    class BasicTests {

        @Test
        @DisplayName("matches Add -> Relu from an explicit root")
        void matchesFromExplicitRoot() {
            PatternMatchResult result = new PatternMatcher(ADD_RELU).tryMatch(CHAIN, "P2").orElseThrow();

            assertEquals(node(CHAIN, "N1"), result.getNodeByName("P1"));
            assertEquals(node(CHAIN, "N2"), result.getNodeByName("P2"));
            assertEquals(2, result.size());
        }

        @Test
        @DisplayName("matches Add -> Relu from the default root")
        void matchesFromDefaultRoot() {
            PatternMatchResult result = new PatternMatcher(ADD_RELU).tryMatch(CHAIN).orElseThrow();

            assertEquals(node(CHAIN, "N1"), result.getNodeByName("P1"));
            assertEquals(node(CHAIN, "N2"), result.getNodeByName("P2"));
        }

        @Test
        @DisplayName("an empty root name selects the default root")
        void emptyRootNameIsDefault() {
            assertTrue(new PatternMatcher(ADD_RELU).tryMatch(CHAIN, "").isPresent());
        }

        @Test
        @DisplayName("returns no match when an operator type is absent")
        void noMatchForAbsentOpType() {
            PatternGraph conv = PatternGraph.builder("conv")
                    .node(PatternNode.of("C", "Conv", List.of("x", "w"), List.of("y")))
                    .build();

            assertTrue(new PatternMatcher(conv).tryMatch(CHAIN).isEmpty());
        }

        @Test
        @DisplayName("returns no match when the shape is absent")
        void noMatchForAbsentShape() {
            PatternGraph reluAdd = PatternGraph.builder("relu_add")
                    .node(PatternNode.of("R", "Relu", List.of("a"), List.of("t")))
                    .node(PatternNode.of("A", "Add", List.of("t", "b"), List.of("out")))
                    .build();

            assertTrue(new PatternMatcher(reluAdd).tryMatch(CHAIN).isEmpty());
        }

        @Test
        @DisplayName("a single wildcard node matches the first node in topological order")
        void trivialPattern() {
            PatternGraph any = PatternGraph.builder("any")
                    .node(PatternNode.wildcard("any", List.of(), List.of()))
                    .build();
            OperationGraph shuffled = OperationGraph.builder("shuffled")
                    .addNode("late", "Relu", List.of("early_out"), List.of("late_out"))
                    .addNode("early", "Exp", List.of("x"), List.of("early_out"))
                    .build();

            assertEquals(node(CHAIN, "N1"), new PatternMatcher(any).tryMatch(CHAIN).orElseThrow().getNodeByName("any"));
            assertEquals(node(shuffled, "early"),
                    new PatternMatcher(any).tryMatch(shuffled).orElseThrow().getNodeByName("any"));
        }

        @Test
        @DisplayName("an empty target graph never matches")
        void emptyTarget() {
            OperationGraph empty = OperationGraph.builder("empty").build();

            assertTrue(new PatternMatcher(ADD_RELU).tryMatch(empty).isEmpty());
        }

        @Test
        @DisplayName("the first candidate in topological order wins")
        void firstCandidateWins() {
            OperationGraph twoPairs = OperationGraph.builder("two_pairs")
                    .addNode("add_b", "Add", List.of("x", "y"), List.of("b1"))
                    .addNode("relu_b", "Relu", List.of("b1"), List.of("b2"))
                    .addNode("add_a", "Add", List.of("u", "v"), List.of("a1"))
                    .addNode("relu_a", "Relu", List.of("a1"), List.of("a2"))
                    .build();

            PatternMatchResult result = new PatternMatcher(ADD_RELU).tryMatch(twoPairs).orElseThrow();

            assertEquals(node(twoPairs, "add_b"), result.getNodeByName("P1"));
            assertEquals(node(twoPairs, "relu_b"), result.getNodeByName("P2"));
        }

        @Test
        @DisplayName("repeated calls produce identical bindings")
        void deterministic() {
            PatternMatcher matcher = new PatternMatcher(ADD_RELU);

            PatternMatchResult first = matcher.tryMatch(CHAIN, "P2").orElseThrow();
            PatternMatchResult second = matcher.tryMatch(CHAIN, "P2").orElseThrow();

            assertEquals(first.getMatchedNodeGroups(), second.getMatchedNodeGroups());
            assertEquals(first.getMatchedInputGroups(), second.getMatchedInputGroups());
        }
    }

    // ==================== Shared ancestors ====================

    @Nested
    @DisplayName("shared ancestors")
    class SharedAncestorTests {

        private static PatternGraph diamondPattern() {
            return PatternGraph.builder("diamond")
                    .node(PatternNode.of("A", "Split", List.of("in"), List.of("a")))
                    .node(PatternNode.of("B", "Relu", List.of("a"), List.of("b")))
                    .node(PatternNode.of("C", "Relu", List.of("a"), List.of("c")))
                    .node(PatternNode.of("D", "Add", List.of("b", "c"), List.of("d")))
                    .build();
        }

        private static OperationGraph diamondTarget() {
            return OperationGraph.builder("diamond")
                    .addNode("a", "Split", List.of("x"), List.of("a_out"))
                    .addNode("b", "Relu", List.of("a_out"), List.of("b_out"))
                    .addNode("c", "Relu", List.of("a_out"), List.of("c_out"))
                    .addNode("d", "Add", List.of("b_out", "c_out"), List.of("d_out"))
                    .build();
        }

        @Test
        @DisplayName("binds both sides of a diamond to distinct nodes")
        void diamond() {
            PatternGraph pattern = diamondPattern();
            OperationGraph target = diamondTarget();

            PatternMatchResult result = new PatternMatcher(pattern).tryMatch(target).orElseThrow();

            assertEquals(4, result.size());
            assertEquals(node(target, "a"), result.getNodeByName("A"));
            assertEquals(node(target, "d"), result.getNodeByName("D"));
            assertNotEquals(result.getNodeByName("B"), result.getNodeByName("C"));
            assertInjective(result);
            assertSound(pattern, target, result);
        }

        @Test
        @DisplayName("matches a diamond from its merge point")
        void diamondFromMergePoint() {
            PatternGraph pattern = diamondPattern();
            OperationGraph target = diamondTarget();

            PatternMatchResult result = new PatternMatcher(pattern).tryMatch(target, "D").orElseThrow();

            assertEquals(node(target, "a"), result.getNodeByName("A"));
            assertInjective(result);
            assertSound(pattern, target, result);
        }

        @Test
        @DisplayName("look-ahead keeps look-alike nodes in their positions")
        void lookAheadSeparatesLookAlikes() {
            // C <- B <- A -> E1 <- D <- C, D -> E2 -> F; E1 and E2 differ only by the edge from A
            PatternGraph pattern = PatternGraph.builder("look_ahead")
                    .node(PatternNode.of("A", "MatMul", List.of("x", "w"), List.of("a")))
                    .node(PatternNode.of("B", "Relu", List.of("a"), List.of("b")))
                    .node(PatternNode.of("C", "Tanh", List.of("b"), List.of("c")))
                    .node(PatternNode.of("D", "Exp", List.of("c"), List.of("d")))
                    .node(PatternNode.of("E1", "Concat", List.of("d", "a"), List.of("e1")))
                    .node(PatternNode.of("E2", "Concat", List.of("d"), List.of("e2")))
                    .node(PatternNode.of("F", "Sigmoid", List.of("e2"), List.of("f")))
                    .build();
            // e2 is declared before e1 so it is offered to E1 first
            OperationGraph target = OperationGraph.builder("look_ahead")
                    .addNode("a", "MatMul", List.of("x", "w"), List.of("a_out"))
                    .addNode("b", "Relu", List.of("a_out"), List.of("b_out"))
                    .addNode("c", "Tanh", List.of("b_out"), List.of("c_out"))
                    .addNode("d", "Exp", List.of("c_out"), List.of("d_out"))
                    .addNode("e2", "Concat", List.of("d_out"), List.of("e2_out"))
                    .addNode("e1", "Concat", List.of("d_out", "a_out"), List.of("e1_out"))
                    .addNode("f", "Sigmoid", List.of("e2_out"), List.of("f_out"))
                    .build();

            PatternMatchResult result = new PatternMatcher(pattern).tryMatch(target).orElseThrow();

            assertEquals(node(target, "e1"), result.getNodeByName("E1"));
            assertEquals(node(target, "e2"), result.getNodeByName("E2"));
            assertEquals(node(target, "f"), result.getNodeByName("F"));
            assertInjective(result);
            assertSound(pattern, target, result);
        }

        @Test
        @DisplayName("a failed look-ahead fails the match")
        void failedLookAhead() {
            // pattern: A feeds both B and C, B feeds C
            PatternGraph pattern = PatternGraph.builder("triangle")
                    .node(PatternNode.of("A", "MatMul", List.of("x", "w"), List.of("a")))
                    .node(PatternNode.of("B", "Relu", List.of("a"), List.of("b")))
                    .node(PatternNode.of("C", "Add", List.of("a", "b"), List.of("c")))
                    .build();
            // target: c only reads b, a's second consumer is unrelated
            OperationGraph target = OperationGraph.builder("open_triangle")
                    .addNode("a", "MatMul", List.of("x", "w"), List.of("a_out"))
                    .addNode("b", "Relu", List.of("a_out"), List.of("b_out"))
                    .addNode("side", "Sigmoid", List.of("a_out"), List.of("s_out"))
                    .addNode("c", "Add", List.of("b_out", "s_out"), List.of("c_out"))
                    .build();

            assertTrue(new PatternMatcher(pattern).tryMatch(target).isEmpty());
            assertTrue(new PatternMatcher(pattern).tryMatch(target, "C").isEmpty());
        }
    }

    // ==================== Backtracking ====================

    @Nested
    @DisplayName("backtracking")
    class BacktrackingTests {

        @Test
        @DisplayName("an abandoned branch releases the nodes bound beneath it")
        void abandonedBranchReleasesDescendants() {
            PatternGraph pattern = PatternGraph.builder("mul_of_add")
                    .node(PatternNode.of("U", "Relu", List.of("x"), List.of("u")))
                    .node(PatternNode.of("V", "Tanh", List.of("z"), List.of("v")))
                    .node(PatternNode.of("R", "Add", List.of("u", "v"), List.of("r")))
                    .node(PatternNode.of("Q", "Mul", List.of("r", "other"), List.of("q")))
                    .build();
            // add1 shares relu1 with add2 but has no Tanh input, so it is tried and abandoned first
            OperationGraph target = OperationGraph.builder("shared_relu")
                    .addNode("relu1", "Relu", List.of("x"), List.of("r1"))
                    .addNode("sig", "Sigmoid", List.of("y"), List.of("s"))
                    .addNode("tanh", "Tanh", List.of("z"), List.of("t"))
                    .addNode("add1", "Add", List.of("r1", "s"), List.of("a1"))
                    .addNode("add2", "Add", List.of("r1", "t"), List.of("a2"))
                    .addNode("q", "Mul", List.of("a1", "a2"), List.of("out"))
                    .build();

            PatternMatchResult result = new PatternMatcher(pattern).tryMatch(target, "Q").orElseThrow();

            assertEquals(node(target, "q"), result.getNodeByName("Q"));
            assertEquals(node(target, "add2"), result.getNodeByName("R"));
            assertEquals(node(target, "relu1"), result.getNodeByName("U"));
            assertEquals(node(target, "tanh"), result.getNodeByName("V"));
            assertEquals(4, result.size());
        }

        @Test
        @DisplayName("a failed candidate leaves nothing in the result")
        void failedCandidateLeavesNothing() {
            OperationGraph target = OperationGraph.builder("two_adds")
                    .addNode("add1", "Add", List.of("x", "y"), List.of("a1"))
                    .addNode("sig", "Sigmoid", List.of("a1"), List.of("s"))
                    .addNode("add2", "Add", List.of("u", "v"), List.of("a2"))
                    .addNode("relu", "Relu", List.of("a2"), List.of("r"))
                    .build();

            PatternMatchResult result = new PatternMatcher(ADD_RELU).tryMatch(target).orElseThrow();

            assertEquals(Map.of(
                    "P1", new MatchedNodeGroup(node(target, "add2"), ADD_RELU.patternNode("P1")),
                    "P2", new MatchedNodeGroup(node(target, "relu"), ADD_RELU.patternNode("P2"))),
                    result.getMatchedNodeGroups());
        }

        @Test
        @DisplayName("a caller-owned result is cleared when nothing matches")
        void callerOwnedResultCleared() {
            PatternMatchResult result = new PatternMatchResult();
            PatternMatcher matcher = new PatternMatcher(ADD_RELU);
            assertTrue(matcher.tryMatch(CHAIN, result, "P1"));
            assertFalse(result.isEmpty());

            OperationGraph noRelu = OperationGraph.builder("no_relu")
                    .addNode("add", "Add", List.of("x", "y"), List.of("a"))
                    .addNode("exp", "Exp", List.of("a"), List.of("e"))
                    .build();

            assertFalse(matcher.tryMatch(noRelu, result, "P1"));
            assertTrue(result.isEmpty());
        }
    }

    // ==================== Fan-out ====================

    @Nested
    @DisplayName("fan-out")
    class FanOutTests {

        private final PatternGraph twoConsumers = PatternGraph.builder("fan_out_two")
                .node(PatternNode.of("R", "Relu", List.of("x"), List.of("r")).withOutputEdgeCount(2))
                .build();

        @Test
        @DisplayName("an explicit fan-out of 2 picks the node with two consumers")
        void explicitFanOutSelects() {
            OperationGraph target = OperationGraph.builder("relus")
                    .addNode("r1", "Relu", List.of("x"), List.of("o1"))
                    .addNode("use1", "Exp", List.of("o1"), List.of("e1"))
                    .addNode("r2", "Relu", List.of("y"), List.of("o2"))
                    .addNode("use2", "Exp", List.of("o2"), List.of("e2"))
                    .addNode("use3", "Log", List.of("o2"), List.of("e3"))
                    .build();

            PatternMatchResult result = new PatternMatcher(twoConsumers).tryMatch(target).orElseThrow();

            assertEquals(node(target, "r2"), result.getNodeByName("R"));
        }

        @Test
        @DisplayName("an explicit fan-out of 2 rejects every other fan-out")
        void explicitFanOutRejects() {
            OperationGraph target = OperationGraph.builder("relus")
                    .addNode("r0", "Relu", List.of("w"), List.of("o0"))
                    .addNode("r1", "Relu", List.of("x"), List.of("o1"))
                    .addNode("use1", "Exp", List.of("o1"), List.of("e1"))
                    .addNode("r3", "Relu", List.of("y"), List.of("o3"))
                    .addNode("use2", "Exp", List.of("o3"), List.of("e2"))
                    .addNode("use3", "Log", List.of("o3"), List.of("e3"))
                    .addNode("use4", "Neg", List.of("o3"), List.of("e4"))
                    .build();

            assertTrue(new PatternMatcher(twoConsumers).tryMatch(target).isEmpty());
        }

        @Test
        @DisplayName("strict derived fan-out rejects a pattern tail with extra consumers")
        void strictDerivedFanOut() {
            PatternMatcher strict = new PatternMatcher(ADD_RELU, MatcherConfig.defaults().withStrictDerivedFanOut(true));
            OperationGraph terminal = OperationGraph.builder("terminal")
                    .addNode("N1", "Add", List.of("x", "y"), List.of("n1"))
                    .addNode("N2", "Relu", List.of("n1"), List.of("n2"))
                    .build();

            assertTrue(strict.tryMatch(CHAIN, "P2").isEmpty());
            assertTrue(strict.tryMatch(terminal, "P2").isPresent());
        }
    }

    // ==================== Arguments ====================

    @Nested
    @DisplayName("arguments")
    class ArgumentTests {

        @Test
        @DisplayName("binds declared inputs using their type constraints")
        void bindsDeclaredInputs() {
            PatternGraph pattern = PatternGraph.builder("matmul_f32")
                    .input(PatternInputArg.of("x").withTypes("f32"))
                    .input(PatternInputArg.of("w"))
                    .node(PatternNode.of("mm", "MatMul", List.of("x", "w"), List.of("y")))
                    .build();
            OperationGraph target = OperationGraph.builder("two_matmuls")
                    .declareArg("a", "f16", 2)
                    .declareArg("c", "f32", 2)
                    .addNode("mm1", "MatMul", List.of("a", "b"), List.of("o1"))
                    .addNode("mm2", "MatMul", List.of("c", "d"), List.of("o2"))
                    .build();

            PatternMatchResult result = new PatternMatcher(pattern).tryMatch(target).orElseThrow();

            assertEquals(node(target, "mm2"), result.getNodeByName("mm"));
            assertEquals("c", result.getInputByName("x").name());
            assertEquals("d", result.getInputByName("w").name());
        }

        @Test
        @DisplayName("assigns inputs regardless of slot order")
        void slotOrderIndependent() {
            PatternGraph pattern = PatternGraph.builder("matmul_ranked")
                    .input(PatternInputArg.of("x").withRanks(3))
                    .input(PatternInputArg.of("w").withRanks(2))
                    .node(PatternNode.of("mm", "MatMul", List.of("x", "w"), List.of("y")))
                    .build();
            OperationGraph target = OperationGraph.builder("swapped")
                    .declareArg("weight", "f32", 2)
                    .declareArg("act", "f32", 3)
                    .addNode("mm", "MatMul", List.of("weight", "act"), List.of("out"))
                    .build();

            PatternMatchResult result = new PatternMatcher(pattern).tryMatch(target).orElseThrow();

            assertEquals("act", result.getInputByName("x").name());
            assertEquals("weight", result.getInputByName("w").name());
        }

        @Test
        @DisplayName("a shared pattern input binds one target argument everywhere")
        void sharedInputIsConsistent() {
            PatternGraph pattern = PatternGraph.builder("gated")
                    .input(PatternInputArg.of("x"))
                    .node(PatternNode.of("A", "Relu", List.of("x"), List.of("a")))
                    .node(PatternNode.of("B", "Tanh", List.of("x"), List.of("b")))
                    .node(PatternNode.of("C", "Add", List.of("a", "b"), List.of("c")))
                    .build();
            OperationGraph shared = OperationGraph.builder("shared")
                    .addNode("relu", "Relu", List.of("in1"), List.of("r"))
                    .addNode("tanh", "Tanh", List.of("in1"), List.of("t"))
                    .addNode("add", "Add", List.of("r", "t"), List.of("o"))
                    .build();
            OperationGraph split = OperationGraph.builder("split")
                    .addNode("relu", "Relu", List.of("in1"), List.of("r"))
                    .addNode("tanh", "Tanh", List.of("in2"), List.of("t"))
                    .addNode("add", "Add", List.of("r", "t"), List.of("o"))
                    .build();

            PatternMatchResult result = new PatternMatcher(pattern).tryMatch(shared).orElseThrow();

            assertEquals("in1", result.getInputByName("x").name());
            assertTrue(new PatternMatcher(pattern).tryMatch(split).isEmpty());
        }

        @Test
        @DisplayName("two pattern inputs never bind the same target argument")
        void argumentBindingIsInjective() {
            PatternGraph pattern = PatternGraph.builder("add_xy")
                    .input(PatternInputArg.of("x"))
                    .input(PatternInputArg.of("y"))
                    .node(PatternNode.of("add", "Add", List.of("x", "y"), List.of("z")))
                    .build();
            OperationGraph doubled = OperationGraph.builder("doubled")
                    .addNode("add", "Add", List.of("in", "in"), List.of("out"))
                    .build();

            assertTrue(new PatternMatcher(pattern).tryMatch(doubled).isEmpty());
        }

        @Test
        @DisplayName("a pattern input read twice by one node matches a target argument read twice")
        void repeatedInputInOneNode() {
            PatternGraph pattern = PatternGraph.builder("square")
                    .input(PatternInputArg.of("x"))
                    .node(PatternNode.of("sq", "Mul", List.of("x", "x"), List.of("y")))
                    .build();
            OperationGraph target = OperationGraph.builder("squares")
                    .addNode("mul", "Mul", List.of("a", "b"), List.of("ab"))
                    .addNode("sq", "Mul", List.of("c", "c"), List.of("cc"))
                    .build();

            PatternMatchResult result = new PatternMatcher(pattern).tryMatch(target).orElseThrow();

            assertEquals(node(target, "sq"), result.getNodeByName("sq"));
            assertEquals("c", result.getInputByName("x").name());
        }

        @Test
        @DisplayName("fails when a node has too few inputs for the declared arguments")
        void tooFewTargetInputs() {
            PatternGraph pattern = PatternGraph.builder("add_xy")
                    .input(PatternInputArg.of("x"))
                    .input(PatternInputArg.of("y"))
                    .node(PatternNode.wildcard("n", List.of("x", "y"), List.of("z")))
                    .build();
            OperationGraph target = OperationGraph.builder("unary")
                    .addNode("neg", "Neg", List.of("a"), List.of("b"))
                    .build();

            assertTrue(new PatternMatcher(pattern).tryMatch(target).isEmpty());
        }
    }

    // ==================== Custom constraints and configuration ====================

    @Nested
    @DisplayName("custom constraints")
    class CustomConstraintTests {

        @Test
        @DisplayName("a node override replaces the default comparison for that node")
        void nodeOverride() {
            PatternGraph pattern = PatternGraph.builder("named_relu")
                    .node(PatternNode.of("act", "Relu", List.of("x"), List.of("y")))
                    .nodeConstraint("act", (target, node, p, pn) ->
                            node.opType().equals("Relu") && node.name().endsWith("_b"))
                    .build();
            OperationGraph target = OperationGraph.builder("relus")
                    .addNode("relu_a", "Relu", List.of("x"), List.of("a"))
                    .addNode("relu_b", "Relu", List.of("y"), List.of("b"))
                    .build();

            assertEquals(node(target, "relu_b"),
                    new PatternMatcher(pattern).tryMatch(target).orElseThrow().getNodeByName("act"));
        }

        @Test
        @DisplayName("an argument override replaces the default comparison for that input")
        void argOverride() {
            PatternGraph pattern = PatternGraph.builder("add_bias")
                    .input(PatternInputArg.of("bias"))
                    .node(PatternNode.of("add", "Add", List.of("x", "bias"), List.of("y")))
                    .argConstraint("bias", (target, arg, p, pa) -> arg.name().startsWith("const_"))
                    .build();
            OperationGraph target = OperationGraph.builder("adds")
                    .addNode("add1", "Add", List.of("u", "v"), List.of("a"))
                    .addNode("add2", "Add", List.of("const_b", "w"), List.of("b"))
                    .build();

            PatternMatchResult result = new PatternMatcher(pattern).tryMatch(target).orElseThrow();

            assertEquals(node(target, "add2"), result.getNodeByName("add"));
            assertEquals("const_b", result.getInputByName("bias").name());
        }

        @Test
        @DisplayName("a custom resolver changes the default for every entity")
        void customResolverDefault() {
            PatternGraph pattern = PatternGraph.builder("relu_x")
                    .input(PatternInputArg.of("x"))
                    .node(PatternNode.of("act", "Relu", List.of("x"), List.of("y")))
                    .build();
            ArgConstraint noTemporaries = DefaultArgConstraint.INSTANCE
                    .and((target, arg, p, pa) -> !arg.name().startsWith("tmp"));
            PatternMatcher matcher = new PatternMatcher(pattern,
                    new ConstraintResolver(DefaultNodeConstraint.create(), noTemporaries));
            OperationGraph target = OperationGraph.builder("relus")
                    .addNode("relu1", "Relu", List.of("tmp0"), List.of("a"))
                    .addNode("relu2", "Relu", List.of("in"), List.of("b"))
                    .build();

            PatternMatchResult result = matcher.tryMatch(target).orElseThrow();

            assertSame(pattern, matcher.pattern());
            assertEquals(node(target, "relu2"), result.getNodeByName("act"));
            assertEquals("in", result.getInputByName("x").name());
        }

        @Test
        @DisplayName("an exception from a predicate propagates to the caller")
        void predicateExceptionPropagates() {
            PatternGraph pattern = PatternGraph.builder("faulty")
                    .node(PatternNode.of("act", "Relu", List.of("x"), List.of("y")))
                    .nodeConstraint("act", (target, node, p, pn) -> {
                        throw new IllegalStateException("broken predicate");
                    })
                    .build();

            assertThrows(IllegalStateException.class, () -> new PatternMatcher(pattern).tryMatch(CHAIN));
        }

        @Test
        @DisplayName("skipping op types lets any operator match")
        void skipOpType() {
            PatternGraph conv = PatternGraph.builder("conv")
                    .node(PatternNode.of("C", "Conv", List.of("x"), List.of("y")))
                    .build();
            PatternMatcher matcher = new PatternMatcher(conv, MatcherConfig.defaults().withSkipOpType(true));

            Optional<PatternMatchResult> result = matcher.tryMatch(CHAIN);

            assertEquals(node(CHAIN, "N1"), result.orElseThrow().getNodeByName("C"));
        }

        @Test
        @DisplayName("domain and version are checked unless skipped")
        void domainAndVersion() {
            PatternGraph gelu = PatternGraph.builder("gelu")
                    .node(PatternNode.of("G", "Gelu", List.of("x"), List.of("y")).withDomain("com.microsoft", 1))
                    .build();
            OperationGraph onnx = OperationGraph.builder("onnx")
                    .addNode("g", "Gelu", "", 20, List.of("x"), List.of("y"))
                    .build();
            OperationGraph contrib = OperationGraph.builder("contrib")
                    .addNode("g", "Gelu", "com.microsoft", 1, List.of("x"), List.of("y"))
                    .build();

            assertTrue(new PatternMatcher(gelu).tryMatch(onnx).isEmpty());
            assertTrue(new PatternMatcher(gelu).tryMatch(contrib).isPresent());
            assertTrue(new PatternMatcher(gelu, MatcherConfig.defaults().withSkipDomainAndVersion(true))
                    .tryMatch(onnx).isPresent());
        }
    }

    // ==================== Configuration errors ====================

    @Nested
    @DisplayName("configuration errors")
    class ConfigurationErrorTests {

        @Test
        @DisplayName("rejects an unknown root name")
        void unknownRoot() {
            PatternMatcher matcher = new PatternMatcher(ADD_RELU);

            assertThrows(PatternGraphException.class, () -> matcher.tryMatch(CHAIN, "P3"));
        }

        @Test
        @DisplayName("rejects an empty pattern")
        void emptyPattern() {
            PatternMatcher matcher = new PatternMatcher(PatternGraph.builder("empty").build());

            assertThrows(PatternGraphException.class, () -> matcher.tryMatch(CHAIN));
        }
    }
}
