package com.bazaarvoice.rbac.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.testng.annotations.Test;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertNotEquals;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.assertTrue;

public class CheckRequestTest {

    private CheckRequest.Builder valid() {
        return CheckRequest.builder()
                .user("alice")
                .tenant("acme")
                .action(Action.VIEW)
                .resourceType("projects");
    }

    @Test
    public void testBuild() {
        CheckRequest request = valid().resourceId(" p1 ").entity("east").build();
        assertEquals(request.getUserId(), "alice");
        assertEquals(request.getTenantId(), "acme");
        assertEquals(request.getAction(), Action.VIEW);
        assertEquals(request.getResourceType(), "projects");
        assertEquals(request.getResourceId(), "p1");
        assertEquals(request.getEntityId(), "east");
        assertTrue(request.hasResourceId());
        assertFalse(request.isBypassCache());
    }

    @Test
    public void testEmptyOptionalFieldsBecomeNull() {
        CheckRequest request = valid().resourceId("").entity("  ").build();
        assertNull(request.getResourceId());
        assertNull(request.getEntityId());
        assertFalse(request.hasResourceId());
    }

    @Test(expectedExceptions = InvalidCheckRequestException.class)
    public void testMissingUser() {
        valid().user(null).build();
    }

    @Test(expectedExceptions = InvalidCheckRequestException.class)
    public void testBlankTenant() {
        valid().tenant("   ").build();
    }

    @Test(expectedExceptions = InvalidCheckRequestException.class)
    public void testMissingAction() {
        valid().action(null).build();
    }

    @Test(expectedExceptions = InvalidCheckRequestException.class)
    public void testEmptyResourceType() {
        valid().resourceType("").build();
    }

    @Test
    public void testWithBypassCache() {
        CheckRequest request = valid().build();
        CheckRequest bypass = request.withBypassCache(true);
        assertTrue(bypass.isBypassCache());
        assertNotEquals(bypass, request);
        assertEquals(bypass.withBypassCache(false), request);
    }

    @Test
    public void testJson() throws Exception {
        CheckRequest request = new ObjectMapper().readValue(
                "{\"userId\":\"alice\",\"tenantId\":\"acme\",\"action\":\"DeleteAny\",\"resourceType\":\"projects\"}",
                CheckRequest.class);
        assertEquals(request, valid().action(Action.DELETE_ANY).build());
    }
}
