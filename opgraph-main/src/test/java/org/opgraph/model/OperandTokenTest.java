package org.opgraph.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OperandTokenTest {

    @Test
    void referenceIsEncodedWithPrefix() {
        assertThat(OperandToken.reference("0ABCDEF123456").encode()).isEqualTo("ref:0ABCDEF123456");
    }

    @Test
    void literalIsEncodedVerbatim() {
        assertThat(OperandToken.literal("-12.50").encode()).isEqualTo("-12.50");
    }

    @Test
    void decodeUsesPrefixOnly() {
        assertThat(OperandToken.decode("ref:op-7")).isEqualTo(OperandToken.reference("op-7"));
        assertThat(OperandToken.decode("3.14")).isEqualTo(OperandToken.literal("3.14"));
    }

    @Test
    void identifierShapedTextWithoutPrefixStaysLiteral() {
        String uuidShaped = "123e4567-e89b-12d3-a456-426614174000";

        assertThat(OperandToken.decode(uuidShaped)).isInstanceOf(OperandToken.Literal.class);
    }

    @Test
    void literalMayNotCarryReferencePrefix() {
        assertThatThrownBy(() -> OperandToken.literal("ref:1"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> OperandToken.literal(""))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> OperandToken.reference(""))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void negationTogglesSign() {
        assertThat(OperandToken.literal("5").negate().text()).isEqualTo("-5");
        assertThat(OperandToken.literal("-5").negate().text()).isEqualTo("5");
        assertThat(OperandToken.literal("0.25").negate().text()).isEqualTo("-0.25");
    }

    @Test
    void zeroStaysZeroUnderNegation() {
        OperandToken.Literal zero = OperandToken.literal("0");

        assertThat(zero.isZero()).isTrue();
        assertThat(zero.negate()).isEqualTo(zero);
        assertThat(OperandToken.literal("0.0").isZero()).isFalse();
    }
}
