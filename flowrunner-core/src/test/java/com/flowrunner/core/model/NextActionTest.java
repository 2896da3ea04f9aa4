package com.flowrunner.core.model;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

class NextActionTest {

    @Test
    void firesFor_unconditionalEdge_shouldAlwaysFire() {
        NextAction edge = NextAction.to("action-2");
        
        assertTrue(edge.firesFor(null));
        assertTrue(edge.firesFor("anything"));
    }

    @Test
    void firesFor_conditionalEdge_shouldCompareStringForm() {
        NextAction edge = NextAction.when("action-2", "true");
        
        assertTrue(edge.firesFor(Boolean.TRUE));
        assertTrue(edge.firesFor("true"));
        assertFalse(edge.firesFor(Boolean.FALSE));
        assertFalse(edge.firesFor(null));
    }

    @Test
    void firesFor_numericCondition_shouldMatchStringForm() {
        NextAction edge = NextAction.when("action-2", "2");
        
        assertTrue(edge.firesFor(2));
        assertFalse(edge.firesFor(3));
    }
}
