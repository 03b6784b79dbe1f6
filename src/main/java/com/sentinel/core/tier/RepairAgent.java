package com.sentinel.core.tier;

/**
 * One model tier's fix capability: given a failing validation, change the working
 * tree and report what it cost.
 */
@FunctionalInterface
public interface RepairAgent {

    RepairOutcome repair(RepairRequest request) throws RepairException;
}
