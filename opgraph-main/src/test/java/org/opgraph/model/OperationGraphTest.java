package org.opgraph.model;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OperationGraphTest {

    private final Operation first = new Operation("a", OperationType.ADDITION,
            OperandToken.literal("1"), OperandToken.literal("2"));
    private final Operation second = new Operation("b", OperationType.MULTIPLICATION,
            first.asReference(), OperandToken.literal("3"));
    private final Operation third = new Operation("c", OperationType.SUBTRACTION,
            second.asReference(), first.asReference());

    @Test
    void dependenciesFollowOperandOrder() {
        assertThat(OperationGraph.dependenciesOf(first)).isEmpty();
        assertThat(OperationGraph.dependenciesOf(third)).containsExactly("b", "a");
    }

    @Test
    void forwardOrderIsAccepted() {
        OperationGraph.verifyOrder(List.of(first, second, third));
        OperationGraph.verifyOrder(List.of());
    }

    @Test
    void referenceToLaterOperationIsRejected() {
        assertThatThrownBy(() -> OperationGraph.verifyOrder(List.of(second, first)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("index 0")
                .hasMessageContaining("references a");
    }

    @Test
    void danglingReferenceIsRejected() {
        assertThatThrownBy(() -> OperationGraph.verifyOrder(List.of(third)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void duplicateIdIsRejected() {
        assertThatThrownBy(() -> OperationGraph.verifyOrder(List.of(first, first)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Duplicate");
    }
}
