package org.scout.core.annotation;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.scout.core.model.MethodKey;
import org.scout.core.model.ParameterBinding;

import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnnotationReaderTest {

    private final AnnotationReader reader = new AnnotationReader(new ObjectMapper());

    @Test
    void readsSuitesAndBindings() throws NoSuchMethodException {
        AnnotationSet set = reader.read(Sample.class.getDeclaredMethod("testTagged", int.class, int.class));

        assertThat(set.suites()).containsExactlyInAnyOrder("fast", "db");
        assertThat(set.inSuite("fast")).isTrue();
        assertThat(set.params()).containsExactly(
                ParameterBinding.named(Map.of("a", 1, "b", 2)),
                ParameterBinding.positional(List.of(3, 4)));
        assertThat(set.invocations()).hasSize(2);
    }

    @Test
    void plainMethodRunsOnceWithoutArguments() throws NoSuchMethodException {
        AnnotationSet set = reader.read(Sample.class.getDeclaredMethod("testPlain"));

        assertThat(set.suites()).isEmpty();
        assertThat(set.invocations()).containsExactly((ParameterBinding) null);
    }

    @Test
    void emptyParametersStillMeanOneInvocation() throws NoSuchMethodException {
        AnnotationSet set = reader.read(Sample.class.getDeclaredMethod("testNoBindings"));

        assertThat(set.invocations()).hasSize(1);
    }

    @Test
    void invalidJsonIsReported() throws NoSuchMethodException {
        Method method = Sample.class.getDeclaredMethod("testBadJson");

        assertThatThrownBy(() -> reader.read(method))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("testBadJson");
    }

    @Test
    void scalarBindingIsRejected() throws NoSuchMethodException {
        Method method = Sample.class.getDeclaredMethod("testScalar");

        assertThatThrownBy(() -> reader.read(method)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void indexEntryOverridesDeclaredAnnotations() throws NoSuchMethodException {
        Method method = Sample.class.getDeclaredMethod("testTagged", int.class, int.class);
        MethodKey key = new MethodKey("unit", "Sample", "testTagged");
        AnnotationIndex index = AnnotationIndex.builder()
                .suites(key, "slow")
                .params(key, ParameterBinding.positional(Arrays.asList(5, 6)))
                .build();

        AnnotationSet set = index.resolve(key, method, reader);

        assertThat(set.suites()).containsExactly("slow");
        assertThat(set.params()).containsExactly(ParameterBinding.positional(List.of(5, 6)));
    }

    @Test
    void methodsWithoutEntryFallBackToTheReader() throws NoSuchMethodException {
        Method method = Sample.class.getDeclaredMethod("testPlain");
        AnnotationIndex index = AnnotationIndex.builder()
                .suites(new MethodKey("unit", "Sample", "other"), "x")
                .build();

        AnnotationSet set = index.resolve(new MethodKey("unit", "Sample", "testPlain"), method, reader);

        assertThat(set).isEqualTo(AnnotationSet.EMPTY);
    }

    @SuppressWarnings("unused")
    static class Sample {
        @Suites({"fast", "db"})
        @Parameters({"{\"a\": 1, \"b\": 2}", "[3, 4]"})
        void testTagged(int a, int b) {
        }

        void testPlain() {
        }

        @Parameters({})
        void testNoBindings() {
        }

        @Parameters({"{not json"})
        void testBadJson() {
        }

        @Parameters({"42"})
        void testScalar() {
        }
    }
}
