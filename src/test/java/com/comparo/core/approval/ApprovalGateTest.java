package com.comparo.core.approval;

import com.comparo.core.model.ApprovalDecision;
import com.comparo.core.model.Decision;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class ApprovalGateTest {

    private final ApprovalGate gate = new ApprovalGate(false, Set.of(), Clock.systemUTC());

    private CompletableFuture<ApprovalOutcome> propose(ApprovalGate g, String target, String callId) {
        return g.propose("r1", target, callId, "read_file", Map.of("filePath", "a.txt"));
    }

    @Nested
    @DisplayName("propose")
    class Propose {

        @Test
        @DisplayName("new proposal waits for a decision")
        void waits() {
            var future = propose(gate, "m1", "m1:read_file:1");

            assertFalse(future.isDone());
            assertEquals(ApprovalState.PROPOSED, gate.stateOf("r1", "m1:read_file:1").orElseThrow());
            assertEquals(1, gate.pendingCount("r1"));
        }

        @Test
        @DisplayName("proposing the same call twice returns the same future")
        void idempotent() {
            var first = propose(gate, "m1", "c1");
            var second = propose(gate, "m1", "c1");

            assertSame(first, second);
            assertEquals(1, gate.pendingCount("r1"));
        }

        @Test
        @DisplayName("auto-approved tools resolve immediately")
        void autoApproved() {
            var autoGate = new ApprovalGate(false, Set.of("read_file"), Clock.systemUTC());

            assertEquals(ApprovalOutcome.APPROVED, propose(autoGate, "m1", "c1").join());
            assertEquals(0, autoGate.pendingCount("r1"));
        }
    }

    @Nested
    @DisplayName("decide")
    class Decide {

        @Test
        @DisplayName("decision for one call leaves the others pending")
        void singleCall() {
            var c1 = propose(gate, "m1", "c1");
            var c2 = propose(gate, "m1", "c2");

            int resolved = gate.decide(new ApprovalDecision("r1", "m1", "c1", Decision.APPROVE));

            assertEquals(1, resolved);
            assertEquals(ApprovalOutcome.APPROVED, c1.join());
            assertFalse(c2.isDone());
        }

        @Test
        @DisplayName("target-scoped decision does not touch other targets")
        void targetScoped() {
            var m1 = propose(gate, "m1", "m1:c1");
            var m2 = propose(gate, "m2", "m2:c1");

            gate.decide(ApprovalDecision.forTarget("r1", "m1", Decision.DENY));

            assertEquals(ApprovalOutcome.DENIED, m1.join());
            assertFalse(m2.isDone());
        }

        @Test
        @DisplayName("approve-all resolves every pending call across targets")
        void approveAll() {
            var m1 = propose(gate, "m1", "m1:c1");
            var m2 = propose(gate, "m2", "m2:c1");

            assertEquals(2, gate.decide(ApprovalDecision.approveAll("r1")));

            assertEquals(ApprovalOutcome.APPROVED, m1.join());
            assertEquals(ApprovalOutcome.APPROVED, m2.join());
        }

        @Test
        @DisplayName("decisions do not cross requests")
        void requestScoped() {
            var other = gate.propose("r2", "m1", "c1", "read_file", Map.of());
            propose(gate, "m1", "c1");

            gate.decide(ApprovalDecision.approveAll("r1"));

            assertFalse(other.isDone());
        }

        @Test
        @DisplayName("resolved calls are not resolved again")
        void resolveOnce() {
            var c1 = propose(gate, "m1", "c1");
            gate.decide(ApprovalDecision.denyAll("r1"));

            assertEquals(0, gate.decide(ApprovalDecision.approveAll("r1")));
            assertEquals(ApprovalOutcome.DENIED, c1.join());
            assertEquals(ApprovalState.DENIED, gate.stateOf("r1", "c1").orElseThrow());
        }

        @Test
        @DisplayName("unknown request resolves nothing")
        void unknownRequest() {
            assertEquals(0, gate.decide(ApprovalDecision.approveAll("nope")));
        }

        @Test
        @DisplayName("without sticky approve-all later proposals wait again")
        void notSticky() {
            propose(gate, "m1", "c1");
            gate.decide(ApprovalDecision.approveAll("r1"));

            assertFalse(propose(gate, "m1", "c2").isDone());
        }

        @Test
        @DisplayName("with sticky approve-all later proposals are approved on arrival")
        void sticky() {
            var stickyGate = new ApprovalGate(true, Set.of(), Clock.systemUTC());
            propose(stickyGate, "m1", "c1");
            stickyGate.decide(ApprovalDecision.approveAll("r1"));

            assertEquals(ApprovalOutcome.APPROVED, propose(stickyGate, "m2", "c2").join());
        }
    }

    @Nested
    @DisplayName("lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("approved call moves to executed, denied call to skipped")
        void executedAndSkipped() {
            propose(gate, "m1", "c1");
            propose(gate, "m1", "c2");
            gate.decide(new ApprovalDecision("r1", "m1", "c1", Decision.APPROVE));
            gate.decide(new ApprovalDecision("r1", "m1", "c2", Decision.DENY));

            gate.markExecuted("r1", "c1");
            gate.markSkipped("r1", "c2");

            assertEquals(ApprovalState.EXECUTED, gate.stateOf("r1", "c1").orElseThrow());
            assertEquals(ApprovalState.SKIPPED, gate.stateOf("r1", "c2").orElseThrow());
        }

        @Test
        @DisplayName("a denied call cannot be marked executed")
        void illegalTransition() {
            propose(gate, "m1", "c1");
            gate.decide(ApprovalDecision.denyAll("r1"));

            gate.markExecuted("r1", "c1");

            assertEquals(ApprovalState.DENIED, gate.stateOf("r1", "c1").orElseThrow());
        }

        @Test
        @DisplayName("cancelling a request denies pending and future proposals")
        void cancelRequest() {
            var pending = propose(gate, "m1", "c1");

            assertEquals(1, gate.cancelRequest("r1"));

            assertEquals(ApprovalOutcome.DENIED, pending.join());
            assertEquals(ApprovalOutcome.DENIED, propose(gate, "m2", "c2").join());
        }

        @Test
        @DisplayName("cancelling a target only affects that target")
        void cancelTarget() {
            var m1 = propose(gate, "m1", "m1:c1");
            var m2 = propose(gate, "m2", "m2:c1");

            assertEquals(1, gate.cancelTarget("r1", "m1"));

            assertEquals(ApprovalOutcome.DENIED, m1.join());
            assertFalse(m2.isDone());
            assertEquals(ApprovalOutcome.DENIED, propose(gate, "m1", "m1:c2").join());
        }

        @Test
        @DisplayName("release denies outstanding calls and forgets the request")
        void release() {
            var pending = propose(gate, "m1", "c1");

            gate.release("r1");

            assertEquals(ApprovalOutcome.DENIED, pending.join());
            assertTrue(gate.stateOf("r1", "c1").isEmpty());
            assertTrue(gate.pendingToolState("r1").isEmpty());
        }

        @Test
        @DisplayName("proposals after release are denied without recreating the request")
        void proposeAfterRelease() {
            propose(gate, "m1", "c1");
            gate.release("r1");

            var late = propose(gate, "m1", "c2");

            assertTrue(late.isDone());
            assertEquals(ApprovalOutcome.DENIED, late.join());
            assertTrue(gate.stateOf("r1", "c2").isEmpty());
            assertEquals(0, gate.pendingCount("r1"));
            assertEquals(0, gate.cancelRequest("r1"));
            assertEquals(0, gate.cancelTarget("r1", "m1"));
            assertTrue(gate.pendingToolState("r1").isEmpty());
        }

        @Test
        @DisplayName("releasing an unseen request still denies its later proposals")
        void releaseBeforeAnyProposal() {
            gate.release("r1");

            assertEquals(ApprovalOutcome.DENIED, propose(gate, "m1", "c1").join());
            assertEquals(0, gate.pendingCount("r1"));
        }
    }

    @Test
    @DisplayName("pending tool state groups calls by target in proposal order")
    void pendingToolState() {
        propose(gate, "m1", "m1:c1");
        propose(gate, "m2", "m2:c1");
        propose(gate, "m1", "m1:c2");
        gate.decide(new ApprovalDecision("r1", "m1", "m1:c1", Decision.APPROVE));

        Map<String, List<ProposedToolCall>> state = gate.pendingToolState("r1");

        assertEquals(List.of("m1", "m2"), List.copyOf(state.keySet()));
        assertEquals(2, state.get("m1").size());
        assertEquals(ApprovalState.APPROVED, state.get("m1").get(0).state());
        assertEquals(ApprovalState.PROPOSED, state.get("m1").get(1).state());
        assertEquals("a.txt", state.get("m2").get(0).arguments().get("filePath"));
    }
}
