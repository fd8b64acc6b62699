package com.dockyard.core.production;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ProductionStatusTest {

    @Test
    @DisplayName("legal transitions follow the deployment lifecycle")
    void transitions() {
        assertTrue(ProductionStatus.STOPPED.canTransitionTo(ProductionStatus.QUEUED));
        assertTrue(ProductionStatus.QUEUED.canTransitionTo(ProductionStatus.BUILDING));
        assertTrue(ProductionStatus.BUILDING.canTransitionTo(ProductionStatus.RUNNING));
        assertTrue(ProductionStatus.BUILDING.canTransitionTo(ProductionStatus.FAILED));
        assertTrue(ProductionStatus.RUNNING.canTransitionTo(ProductionStatus.STOPPED));
        assertTrue(ProductionStatus.FAILED.canTransitionTo(ProductionStatus.QUEUED));
    }

    @Test
    @DisplayName("illegal transitions are refused")
    void illegalTransitions() {
        assertFalse(ProductionStatus.STOPPED.canTransitionTo(ProductionStatus.RUNNING));
        assertFalse(ProductionStatus.QUEUED.canTransitionTo(ProductionStatus.QUEUED));
        assertFalse(ProductionStatus.BUILDING.canTransitionTo(ProductionStatus.QUEUED));
        assertFalse(ProductionStatus.FAILED.canTransitionTo(ProductionStatus.RUNNING));
    }

    @Test
    @DisplayName("only queued and building are active")
    void active() {
        assertTrue(ProductionStatus.QUEUED.isActive());
        assertTrue(ProductionStatus.BUILDING.isActive());
        assertFalse(ProductionStatus.RUNNING.isActive());
        assertFalse(ProductionStatus.FAILED.isActive());
        assertFalse(ProductionStatus.STOPPED.isActive());
    }

    @Test
    @DisplayName("errors are truncated to 500 characters")
    void errorTruncation() {
        ProductionState state = ProductionState.initial().withError("x".repeat(800));
        assertEquals(ProductionState.MAX_ERROR_LENGTH, state.error().length());
    }
}
