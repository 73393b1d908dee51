package com.profilebundler.models;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class UpdateExpressionTest {

    @Test
    void parsesRelativeIncrementWithoutUnit() throws ProfileValueException {
        UpdateExpression expression = UpdateExpression.parse("perimeters==+1");

        assertEquals(UpdateExpression.Kind.RELATIVE, expression.getKind());
        assertEquals("perimeters", expression.getProperty());
        assertEquals(0, BigDecimal.ONE.compareTo(expression.getDelta()));
        assertNull(expression.getUnit());
    }

    @Test
    void parsesRelativeDecrementWithUnit() throws ProfileValueException {
        UpdateExpression expression = UpdateExpression.parse("fill_density==-5%");

        assertEquals(0, new BigDecimal("-5").compareTo(expression.getDelta()));
        assertEquals(ProfileValue.Unit.PERCENT, expression.getUnit());
        assertEquals("fill_density==-5%", expression.toString());
    }

    @Test
    void parsesAbsoluteAssignment() throws ProfileValueException {
        UpdateExpression expression = UpdateExpression.parse("fill_overlap=40%");

        assertEquals(UpdateExpression.Kind.ABSOLUTE, expression.getKind());
        assertEquals("fill_overlap", expression.getProperty());
        assertEquals("40%", expression.getValue());
    }

    @Test
    void absoluteValueMayContainEqualsSign() throws ProfileValueException {
        UpdateExpression expression = UpdateExpression.parse("compatible_printers_condition=nozzle_diameter[0]!=0.6");
        assertEquals("nozzle_diameter[0]!=0.6", expression.getValue());
    }

    @Test
    void rejectsMalformedExpressions() {
        assertThrows(ProfileValueException.class, () -> UpdateExpression.parse("perimeters==5"));
        assertThrows(ProfileValueException.class, () -> UpdateExpression.parse("perimeters==+x"));
        assertThrows(ProfileValueException.class, () -> UpdateExpression.parse("nonsense"));
        assertThrows(ProfileValueException.class, () -> UpdateExpression.parse(" "));
    }
}
