package com.tracecontract.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ParameterClassifier")
class ParameterClassifierTest {

    @Nested
    @DisplayName("Exception slot")
    class ExceptionSlot {

        @Test
        @DisplayName("should assign the exception index to the Throwable parameter")
        void shouldFindExceptionParameter() {
            OperationSpec op = OperationSpec.builder("fail").error("failure {code}")
                    .parameter("ex", Exception.class)
                    .parameter("code", int.class)
                    .build();

            Classification classification = ParameterClassifier.classify("Trace", op);

            assertThat(classification.hasException()).isTrue();
            assertThat(classification.exceptionIndex()).isZero();
            assertThat(classification.exception()).hasValue(0);
            assertThat(classification.contextIndices()).containsExactly(1);
            assertThat(classification.allIndices()).containsExactly(0, 1);
        }

        @Test
        @DisplayName("should accept subclasses of Throwable")
        void shouldAcceptSubclasses() {
            OperationSpec op = OperationSpec.builder("io").error("io {path}")
                    .parameter("path", String.class)
                    .parameter("cause", IOException.class)
                    .build();

            assertThat(ParameterClassifier.classify("Trace", op).exceptionIndex()).isEqualTo(1);
        }

        @Test
        @DisplayName("should report no exception when none is declared")
        void shouldReportNoException() {
            OperationSpec op = OperationSpec.builder("greet").info("Hello {name}")
                    .parameter("name", String.class)
                    .build();

            Classification classification = ParameterClassifier.classify("Trace", op);

            assertThat(classification.hasException()).isFalse();
            assertThat(classification.exceptionIndex()).isEqualTo(Classification.NO_EXCEPTION);
            assertThat(classification.exception()).isEmpty();
        }

        @Test
        @DisplayName("should reject a second exception parameter")
        void shouldRejectSecondException() {
            OperationSpec op = OperationSpec.builder("fail").error("failed")
                    .parameter("first", Exception.class)
                    .parameter("second", Error.class)
                    .build();

            assertThatThrownBy(() -> ParameterClassifier.classify("Trace", op))
                    .isInstanceOf(ClassificationException.class)
                    .hasMessageContaining("second")
                    .hasMessageContaining("Trace.fail")
                    .extracting(e -> ((ClassificationException) e).parameterName())
                    .isEqualTo("second");
        }

        @Test
        @DisplayName("should reject an exception parameter on an activity operation")
        void shouldRejectExceptionOnActivity() {
            OperationSpec op = OperationSpec.builder("work").info("working")
                    .parameter("cause", RuntimeException.class)
                    .returnsActivity()
                    .build();

            assertThatThrownBy(() -> ParameterClassifier.classify("Trace", op))
                    .isInstanceOf(ClassificationException.class)
                    .hasMessageContaining("Activity");
        }
    }

    @Nested
    @DisplayName("Context eligibility")
    class ContextEligibility {

        @Test
        @DisplayName("should keep strings, primitives and wrappers in declared order")
        void shouldKeepEligibleTypes() {
            OperationSpec op = OperationSpec.builder("mixed").info("mixed")
                    .parameter("name", String.class)
                    .parameter("when", Instant.class)
                    .parameter("count", long.class)
                    .parameter("ratio", Double.class)
                    .parameter("payload", Object.class)
                    .parameter("flag", boolean.class)
                    .build();

            Classification classification = ParameterClassifier.classify("Trace", op);

            assertThat(classification.contextIndices()).containsExactly(0, 2, 3, 5);
            assertThat(classification.allIndices()).containsExactly(0, 1, 2, 3, 4, 5);
        }

        @Test
        @DisplayName("should classify individual types")
        void shouldClassifyTypes() {
            assertThat(ParameterClassifier.isContextEligible(String.class)).isTrue();
            assertThat(ParameterClassifier.isContextEligible(char.class)).isTrue();
            assertThat(ParameterClassifier.isContextEligible(Integer.class)).isTrue();
            assertThat(ParameterClassifier.isContextEligible(StringBuilder.class)).isFalse();
            assertThat(ParameterClassifier.isException(IllegalStateException.class)).isTrue();
            assertThat(ParameterClassifier.isException(String.class)).isFalse();
        }
    }
}
