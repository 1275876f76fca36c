package org.monkey.interpreter.runtime.model;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class EvalObjectTest {

    @Test
    void testTypesAndRendering() {
        assertThat(new IntegerObject(-42)).extracting(EvalObject::type, EvalObject::inspect)
                .containsExactly(ObjectType.INTEGER, "-42");
        assertThat(BooleanObject.TRUE).extracting(EvalObject::type, EvalObject::inspect)
                .containsExactly(ObjectType.BOOLEAN, "true");
        assertThat(BooleanObject.FALSE.inspect()).isEqualTo("false");
        assertThat(NullObject.NULL).extracting(EvalObject::type, EvalObject::inspect)
                .containsExactly(ObjectType.NULL, "null");
    }

    @Test
    void testBooleanFactoryReturnsSingletons() {
        assertThat(BooleanObject.of(true)).isSameAs(BooleanObject.TRUE);
        assertThat(BooleanObject.of(false)).isSameAs(BooleanObject.FALSE);
        assertThat(BooleanObject.TRUE.value()).isTrue();
        assertThat(BooleanObject.FALSE.value()).isFalse();
    }

    @Test
    void testIntegersCompareByValue() {
        assertThat(new IntegerObject(7)).isEqualTo(new IntegerObject(7)).isNotEqualTo(new IntegerObject(8));
    }
}
