/**
 * Abstract contract tests for the persistence SPIs.
 *
 * <p>Adapters extend each class and supply a fresh instance from the factory method.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.autoapply.testkit.contract;
