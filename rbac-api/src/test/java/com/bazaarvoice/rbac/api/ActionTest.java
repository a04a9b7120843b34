package com.bazaarvoice.rbac.api;

import org.testng.annotations.Test;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertTrue;

public class ActionTest {

    @Test
    public void testFromString() {
        assertEquals(Action.fromString("ViewAny"), Action.VIEW_ANY);
        assertEquals(Action.fromString("view_any"), Action.VIEW_ANY);
        assertEquals(Action.fromString(" MANAGE "), Action.MANAGE);
        assertEquals(Action.fromString("create"), Action.CREATE);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testFromStringUnknown() {
        Action.fromString("Publish");
    }

    @Test
    public void testAnyVariants() {
        assertEquals(Action.VIEW.anyVariant(), Action.VIEW_ANY);
        assertEquals(Action.UPDATE.anyVariant(), Action.UPDATE_ANY);
        assertEquals(Action.DELETE.anyVariant(), Action.DELETE_ANY);
        assertEquals(Action.CREATE.anyVariant(), Action.CREATE);
        assertEquals(Action.MANAGE.anyVariant(), Action.MANAGE);
        assertEquals(Action.VIEW_ANY.anyVariant(), Action.VIEW_ANY);
    }

    @Test
    public void testScopes() {
        assertTrue(Action.UPDATE.isInstanceScoped());
        assertFalse(Action.UPDATE_ANY.isInstanceScoped());
        assertFalse(Action.CREATE.isInstanceScoped());
        assertFalse(Action.MANAGE.isInstanceScoped());
    }
}
