package org.opgraph.model;

import java.util.Objects;

/**
 * String-encoded operand of an {@link Operation}: either a numeric literal
 * or a reference to the result of an earlier operation.
 * <p>
 * The {@value #REFERENCE_PREFIX} prefix is the only discriminator between the
 * two variants. Literal text never starts with it, so decoding needs no
 * inspection of the remainder.
 */
public sealed interface OperandToken permits OperandToken.Literal, OperandToken.Reference {

    String REFERENCE_PREFIX = "ref:";

    /**
     * The wire form stored in {@link Operation#getOperand1()} and
     * {@link Operation#getOperand2()}.
     */
    String encode();

    static Literal literal(String text) {
        return new Literal(text);
    }

    static Reference reference(String operationId) {
        return new Reference(operationId);
    }

    /**
     * Decodes a stored operand. Anything carrying the reference prefix is a
     * reference, everything else is a literal.
     */
    static OperandToken decode(String encoded) {
        Objects.requireNonNull(encoded, "encoded operand must not be null");
        if (encoded.startsWith(REFERENCE_PREFIX)) {
            return new Reference(encoded.substring(REFERENCE_PREFIX.length()));
        }
        return new Literal(encoded);
    }

    record Literal(String text) implements OperandToken {

        public Literal {
            Objects.requireNonNull(text, "text must not be null");
            if (text.isEmpty()) {
                throw new IllegalArgumentException("literal text must not be empty");
            }
            if (text.startsWith(REFERENCE_PREFIX)) {
                throw new IllegalArgumentException("literal text must not start with " + REFERENCE_PREFIX);
            }
        }

        @Override
        public String encode() {
            return text;
        }

        /**
         * True when the literal is exactly {@code "0"}, the only divisor
         * rejected at decomposition time.
         */
        public boolean isZero() {
            return "0".equals(text);
        }

        public Literal negate() {
            if (isZero()) {
                return this;
            }
            return text.startsWith("-") ? new Literal(text.substring(1)) : new Literal("-" + text);
        }
    }

    record Reference(String operationId) implements OperandToken {

        public Reference {
            Objects.requireNonNull(operationId, "operationId must not be null");
            if (operationId.isEmpty()) {
                throw new IllegalArgumentException("operationId must not be empty");
            }
        }

        @Override
        public String encode() {
            return REFERENCE_PREFIX + operationId;
        }
    }
}
