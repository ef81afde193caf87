package org.scout.core.filter;

import org.junit.jupiter.api.Test;
import org.scout.core.model.DiscoveredUnit;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TestFilterTest {

    @Test
    void nullExpressionSelectsEverything() {
        TestFilter filter = TestFilter.parse(null);

        assertThat(filter).isEqualTo(TestFilter.all());
        assertThat(filter.matches("any", "TestAny", "testAny")).isTrue();
    }

    @Test
    void parsesOneToThreeSegments() {
        assertThat(TestFilter.parse("unit_a")).isEqualTo(new TestFilter("unit_a", null, null));
        assertThat(TestFilter.parse("unit_a.ClassB")).isEqualTo(new TestFilter("unit_a", "ClassB", null));
        assertThat(TestFilter.parse("unit_a.ClassB.testC")).isEqualTo(new TestFilter("unit_a", "ClassB", "testC"));
    }

    @Test
    void rejectsMoreThanThreeSegments() {
        assertThatThrownBy(() -> TestFilter.parse("a.b.c.d"))
                .isInstanceOf(InvalidFilterFormatException.class)
                .hasMessageContaining("file.class.method");
    }

    @Test
    void emptyAndWildcardPartsMatchEverything() {
        TestFilter filter = TestFilter.parse("*..testRun");

        assertThat(filter.matches("unit_x", "TestAnything", "testRun")).isTrue();
        assertThat(filter.matches("unit_x", "TestAnything", "testOther")).isFalse();
    }

    @Test
    void partsMatchByExactEquality() {
        TestFilter filter = TestFilter.parse("unit_a.ClassB");

        assertThat(filter.matchesFile("unit_a")).isTrue();
        assertThat(filter.matchesFile("unit_ab")).isFalse();
        assertThat(filter.matchesClass("ClassB")).isTrue();
        assertThat(filter.matchesClass("ClassBB")).isFalse();
        assertThat(filter.matchesMethod("whatever")).isTrue();
    }

    @Test
    void narrowDropsClassesWithoutSurvivingMethods() {
        Map<String, List<String>> classes = new LinkedHashMap<>();
        classes.put("TestOne", List.of("testA", "testB"));
        classes.put("TestTwo", List.of("testC"));
        DiscoveredUnit unit = new DiscoveredUnit("unit", "", "", classes);

        assertThat(TestFilter.parse("unit..testB").narrow(unit)).containsExactly(Map.entry("TestOne", List.of("testB")));
        assertThat(TestFilter.parse("unit.TestTwo").narrow(unit)).containsExactly(Map.entry("TestTwo", List.of("testC")));
        assertThat(TestFilter.all().narrow(unit)).isEqualTo(classes);
    }
}
