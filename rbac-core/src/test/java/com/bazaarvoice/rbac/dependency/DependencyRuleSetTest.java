package com.bazaarvoice.rbac.dependency;

import com.bazaarvoice.rbac.permissions.ResourcePermission;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.fail;

public class DependencyRuleSetTest {

    private final DependencyRuleSet _standard = DependencyRuleSet.compile(StandardDependencyRules.rules());

    @Test
    public void testManageImpliesEverythingOnItsType() {
        PermissionClosure closure = _standard.expand(perms("projects|Manage"));
        assertEquals(all(closure), perms("projects|Manage", "projects|Create", "projects|View", "projects|Update",
                "projects|Delete", "projects|ViewAny", "projects|UpdateAny", "projects|DeleteAny"));
        assertEquals(closure.getHeld(), perms("projects|Manage"));
        assertFalse(closure.implies(perm("tasks|View")));
    }

    @Test
    public void testTransitiveChain() {
        PermissionClosure closure = _standard.expand(perms("projects|Delete"));
        assertEquals(closure.getDerived(), perms("projects|Update", "projects|View"));
        assertEquals(closure.getDerivingRule(perm("projects|Update")), "delete-implies-update");
        assertEquals(closure.getDerivingRule(perm("projects|View")), "update-implies-view");
        assertNull(closure.getDerivingRule(perm("projects|Delete")));
    }

    @Test
    public void testNoUpwardImplication() {
        PermissionClosure closure = _standard.expand(perms("projects|View"));
        assertTrue(closure.getDerived().isEmpty());
        assertFalse(closure.implies(perm("projects|Update")));
        assertFalse(closure.implies(perm("projects|ViewAny")));
    }

    @Test
    public void testAnyActionImpliesInstanceAction() {
        PermissionClosure closure = _standard.expand(perms("tasks|UpdateAny"));
        assertTrue(closure.implies(perm("tasks|Update")));
        assertTrue(closure.implies(perm("tasks|ViewAny")));
        assertTrue(closure.implies(perm("tasks|View")));
        assertFalse(closure.implies(perm("tasks|DeleteAny")));
    }

    @Test
    public void testWildcardHeldPermission() {
        PermissionClosure closure = _standard.expand(perms("*|Update"));
        assertTrue(closure.implies(perm("projects|View")));
        assertTrue(closure.implies(perm("reports|Update")));
        assertFalse(closure.implies(perm("reports|Delete")));
    }

    @Test
    public void testAllConditionNeedsEveryLeg() {
        DependencyRuleSet ruleSet = DependencyRuleSet.compile(ImmutableList.of(
                PermissionDependencyRule.all("publish", 10,
                        ImmutableList.of(perm("reports|Update"), perm("reports|ViewAny")), perm("reports|Create"))));

        assertFalse(ruleSet.expand(perms("reports|Update")).implies(perm("reports|Create")));
        assertFalse(ruleSet.expand(perms("reports|ViewAny")).implies(perm("reports|Create")));
        assertTrue(ruleSet.expand(perms("reports|Update", "reports|ViewAny")).implies(perm("reports|Create")));
    }

    @Test
    public void testAllConditionSatisfiedThroughDerivedLeg() {
        List<PermissionDependencyRule> rules = withRule(StandardDependencyRules.rules(),
                PermissionDependencyRule.all("publish", 10,
                        ImmutableList.of(perm("reports|Update"), perm("reports|ViewAny")), perm("reports|Create")));
        DependencyRuleSet ruleSet = DependencyRuleSet.compile(rules);

        // UpdateAny derives both Update and ViewAny
        PermissionClosure closure = ruleSet.expand(perms("reports|UpdateAny"));
        assertTrue(closure.implies(perm("reports|Create")));
        assertEquals(closure.getDerivingRule(perm("reports|Create")), "publish");
    }

    @Test
    public void testAllTemplateBindsPerResourceType() {
        DependencyRuleSet ruleSet = DependencyRuleSet.compile(ImmutableList.of(
                PermissionDependencyRule.all("update-and-create-implies-manage", 10,
                        ImmutableList.of(perm("*|Update"), perm("*|Create")), perm("*|Manage"))));

        // Legs on different resource types never combine
        assertFalse(ruleSet.expand(perms("projects|Update", "tasks|Create")).implies(perm("projects|Manage")));
        assertTrue(ruleSet.expand(perms("projects|Update", "projects|Create")).implies(perm("projects|Manage")));
    }

    @Test
    public void testConcreteRuleOnlyAppliesToItsType() {
        DependencyRuleSet ruleSet = DependencyRuleSet.compile(ImmutableList.of(
                PermissionDependencyRule.any("project-view-implies-task-view", 10, perm("projects|View"), perm("tasks|View"))));

        assertTrue(ruleSet.expand(perms("projects|View")).implies(perm("tasks|View")));
        assertFalse(ruleSet.expand(perms("reports|View")).implies(perm("tasks|View")));
    }

    @Test
    public void testMonotonic() {
        Set<ResourcePermission> smaller = perms("projects|Update");
        Set<ResourcePermission> larger = perms("projects|Update", "tasks|DeleteAny");
        assertTrue(all(_standard.expand(larger)).containsAll(all(_standard.expand(smaller))));
    }

    @Test
    public void testEmptyRuleSet() {
        PermissionClosure closure = DependencyRuleSet.empty().expand(perms("projects|Manage"));
        assertEquals(all(closure), perms("projects|Manage"));
        assertFalse(closure.implies(perm("projects|View")));
        assertTrue(DependencyRuleSet.compile(ImmutableList.of()).isEmpty());
    }

    @Test
    public void testRulesSortedByPriority() {
        List<PermissionDependencyRule> rules = _standard.getRules();
        for (int i = 1; i < rules.size(); i++) {
            assertTrue(rules.get(i - 1).getPriority() >= rules.get(i).getPriority());
        }
    }

    @Test
    public void testRejectsDirectCycle() {
        assertRejected(ImmutableList.of(
                PermissionDependencyRule.any("a", 0, perm("projects|View"), perm("projects|Update")),
                PermissionDependencyRule.any("b", 0, perm("projects|Update"), perm("projects|View"))), "cycle");
    }

    @Test
    public void testRejectsCycleThroughTemplate() {
        List<PermissionDependencyRule> rules = withRule(StandardDependencyRules.rules(),
                PermissionDependencyRule.any("view-implies-delete", 0, perm("tasks|View"), perm("tasks|Delete")));
        assertRejected(rules, "cycle");
    }

    @Test
    public void testRejectsSelfImplication() {
        assertRejected(ImmutableList.of(
                PermissionDependencyRule.any("self", 0, perm("projects|View"), perm("projects|View"))), "own trigger");
    }

    @Test
    public void testRejectsDuplicateIds() {
        assertRejected(ImmutableList.of(
                PermissionDependencyRule.any("dup", 0, perm("projects|Update"), perm("projects|View")),
                PermissionDependencyRule.any("dup", 0, perm("tasks|Update"), perm("tasks|View"))), "Duplicate");
    }

    @Test
    public void testRejectsMixedRule() {
        assertRejected(ImmutableList.of(
                PermissionDependencyRule.any("mixed", 0, perm("*|Manage"), perm("projects|View"))), "mix");
    }

    @Test
    public void testRejectsEmptyImplies() {
        assertRejected(ImmutableList.of(
                PermissionDependencyRule.any("empty", 0, perm("projects|Manage"))), "at least one");
    }

    @Test
    public void testRejectsNullRule() {
        assertRejected(Arrays.asList(PermissionDependencyRule.any("a", 0, perm("projects|Update"), perm("projects|View")), null),
                "null rule");
    }

    private static void assertRejected(List<PermissionDependencyRule> rules, String messageFragment) {
        try {
            DependencyRuleSet.compile(rules);
            fail("Expected the rule table to be rejected");
        } catch (DependencyConfigurationException e) {
            assertTrue(e.getMessage().contains(messageFragment), e.getMessage());
        }
    }

    private static List<PermissionDependencyRule> withRule(List<PermissionDependencyRule> base, PermissionDependencyRule extra) {
        return ImmutableList.<PermissionDependencyRule>builder().addAll(base).add(extra).build();
    }

    private static Set<ResourcePermission> all(PermissionClosure closure) {
        return Sets.union(closure.getHeld(), closure.getDerived());
    }

    private static ResourcePermission perm(String permission) {
        return ResourcePermission.parse(permission);
    }

    private static Set<ResourcePermission> perms(String... permissions) {
        Set<ResourcePermission> set = Sets.newHashSet();
        for (String permission : permissions) {
            set.add(perm(permission));
        }
        return ImmutableSet.copyOf(set);
    }
}
